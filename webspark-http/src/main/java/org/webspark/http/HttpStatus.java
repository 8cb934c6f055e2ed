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

/**
 * <p>
 * Http Status Codes
 * </p>
 *
 * @see <a href="http://www.iana.org/assignments/http-status-codes/">IANA HTTP Status Code Registry</a>
 */
public class HttpStatus
{
    public static final int BAD_REQUEST_400 = 400;
    public static final int PAYLOAD_TOO_LARGE_413 = 413;

    private HttpStatus()
    {
    }

    /**
     * Get the status message for a specific code.
     *
     * @param code the code to look up
     * @return the specific message, or the code number itself if code
     * does not match known list.
     */
    public static String getMessage(int code)
    {
        switch (code)
        {
            case BAD_REQUEST_400:
                return "Bad Request";
            case PAYLOAD_TOO_LARGE_413:
                return "Payload Too Large";
            default:
                return Integer.toString(code);
        }
    }

    /**
     * Simple test against an code to determine if it falls into the
     * <code>Client Error</code> message category as defined in the
     * <a href="http://tools.ietf.org/html/rfc1945">RFC 1945 - HTTP/1.0</a>.
     *
     * @param code the code to test.
     * @return true if within range of codes that belongs to
     * <code>Client Error</code> messages.
     */
    public static boolean isClientError(int code)
    {
        return ((400 <= code) && (code <= 499));
    }
}
