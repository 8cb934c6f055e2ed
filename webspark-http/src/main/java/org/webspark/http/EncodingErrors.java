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

import java.nio.charset.CodingErrorAction;
import java.util.Locale;

/**
 * The policy applied to bytes that cannot be decoded as text in the request charset.
 */
public enum EncodingErrors
{
    /**
     * Reject the request.
     */
    STRICT(CodingErrorAction.REPORT),
    /**
     * Drop the undecodable bytes.
     */
    IGNORE(CodingErrorAction.IGNORE),
    /**
     * Substitute the replacement character for the undecodable bytes.
     */
    REPLACE(CodingErrorAction.REPLACE);

    private final CodingErrorAction _action;

    EncodingErrors(CodingErrorAction action)
    {
        _action = action;
    }

    public CodingErrorAction getCodingErrorAction()
    {
        return _action;
    }

    /**
     * @param value a policy name, in any case
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static EncodingErrors from(String value)
    {
        return valueOf(value.trim().toUpperCase(Locale.ENGLISH));
    }
}
