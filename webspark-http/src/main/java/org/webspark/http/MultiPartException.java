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
import java.util.Map;

/**
 * <p>A {@link BadMessageException} raised while parsing a {@code multipart/form-data} body.</p>
 * <p>Each instance names the {@link Violation} that caused it, and through it a
 * {@link Category}, so that callers can tell a misconfigured request from an
 * oversized one or a malformed one without inspecting messages.</p>
 */
@SuppressWarnings("serial")
public class MultiPartException extends BadMessageException
{
    private static final String INVALID = "Invalid multipart/form-data: ";

    public enum Category
    {
        /**
         * The request headers do not allow the body to be parsed.
         */
        CONFIGURATION,
        /**
         * The body is, or would become, larger than allowed.
         */
        SIZE_LIMIT,
        /**
         * The body does not follow the multipart framing.
         */
        PROTOCOL
    }

    public enum Violation
    {
        MISSING_BOUNDARY(Category.CONFIGURATION, HttpStatus.BAD_REQUEST_400, "Missing boundary in Content-Type header"),
        UNSUPPORTED_CHARSET(Category.CONFIGURATION, HttpStatus.BAD_REQUEST_400, "Unsupported charset in Content-Type header"),
        CONTENT_LENGTH_TOO_LARGE(Category.SIZE_LIMIT, HttpStatus.PAYLOAD_TOO_LARGE_413, "Content-Length exceeds max body size"),
        BODY_TOO_LARGE(Category.SIZE_LIMIT, HttpStatus.PAYLOAD_TOO_LARGE_413, "Request entity too large"),
        UNDETECTABLE_DELIMITER(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, INVALID + "Unable to determine line delimiter."),
        MALFORMED_PART_HEADERS(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, INVALID + "malformed part headers"),
        HEADER_TERMINATOR_NOT_FOUND(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, INVALID + "part header terminator not found"),
        PART_HEADERS_TOO_LARGE(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, INVALID + "part headers too large"),
        MISSING_CONTENT_DISPOSITION(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, "Missing Content-Disposition header."),
        MISSING_PART_NAME(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, "Missing name in Content-Disposition header."),
        CLOSING_BOUNDARY_NOT_FOUND(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, INVALID + "closing boundary not found."),
        BODY_TERMINATOR_NOT_FOUND(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, INVALID + "part body terminator not found."),
        UNDECODABLE_FIELD(Category.PROTOCOL, HttpStatus.BAD_REQUEST_400, "Unable to decode field");

        private final Category _category;
        private final int _code;
        private final String _reason;

        Violation(Category category, int code, String reason)
        {
            _category = category;
            _code = code;
            _reason = reason;
        }

        public Category getCategory()
        {
            return _category;
        }

        public int getCode()
        {
            return _code;
        }

        public String getReason()
        {
            return _reason;
        }
    }

    private final Violation _violation;

    public MultiPartException(Violation violation)
    {
        this(violation, violation.getReason(), Collections.emptyMap(), null);
    }

    public MultiPartException(Violation violation, String reason)
    {
        this(violation, reason, Collections.emptyMap(), null);
    }

    public MultiPartException(Violation violation, String reason, Map<String, String> details, Throwable cause)
    {
        super(violation.getCode(), reason, details, cause);
        _violation = violation;
    }

    public Violation getViolation()
    {
        return _violation;
    }

    public Category getCategory()
    {
        return _violation.getCategory();
    }
}
