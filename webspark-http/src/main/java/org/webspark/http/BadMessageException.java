//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.webspark.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>Exception thrown to indicate a Bad HTTP Message has been received.
 * Typically these are handled with either 400 or 413 responses.</p>
 * <p>In addition to the status code and reason, a map of details keyed by
 * request field may be carried, so that an error response can point at the
 * offending part of the message.</p>
 */
@SuppressWarnings("serial")
public class BadMessageException extends RuntimeException
{
    final int _code;
    final String _reason;
    final Map<String, String> _details;

    public BadMessageException(String reason)
    {
        this(HttpStatus.BAD_REQUEST_400, reason);
    }

    public BadMessageException(int code, String reason)
    {
        this(code, reason, Collections.emptyMap(), null);
    }

    public BadMessageException(int code, String reason, Throwable cause)
    {
        this(code, reason, Collections.emptyMap(), cause);
    }

    public BadMessageException(int code, String reason, Map<String, String> details, Throwable cause)
    {
        super(code + ": " + (reason == null ? HttpStatus.getMessage(code) : reason), cause);
        _code = code;
        _reason = reason == null ? HttpStatus.getMessage(code) : reason;
        _details = details == null || details.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public int getCode()
    {
        return _code;
    }

    public String getReason()
    {
        return _reason;
    }

    /**
     * @return an unmodifiable map of field name to problem description, possibly empty
     */
    public Map<String, String> getDetails()
    {
        return _details;
    }
}
