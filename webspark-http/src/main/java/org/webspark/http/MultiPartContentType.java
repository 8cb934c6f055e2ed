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

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.Locale;

import org.webspark.util.QuotedStringTokenizer;

/**
 * The parameters of a {@code multipart/form-data} {@code Content-Type} header
 * that drive parsing: the boundary and an optional charset.
 */
public class MultiPartContentType
{
    private final String _mimeType;
    private final String _boundary;
    private final Charset _charset;

    private MultiPartContentType(String mimeType, String boundary, Charset charset)
    {
        _mimeType = mimeType;
        _boundary = boundary;
        _charset = charset;
    }

    /**
     * @param contentType the raw {@code Content-Type} header value
     * @return the parsed content type
     * @throws MultiPartException if there is no boundary, or the charset is not supported
     */
    public static MultiPartContentType parse(String contentType)
    {
        if (contentType == null)
            throw new MultiPartException(MultiPartException.Violation.MISSING_BOUNDARY);

        String mimeType = null;
        String boundary = null;
        String charset = null;
        QuotedStringTokenizer tok = new QuotedStringTokenizer(contentType, ";");
        while (tok.hasMoreTokens())
        {
            String t = tok.nextToken().trim();
            if (mimeType == null)
            {
                mimeType = t.toLowerCase(Locale.ENGLISH);
                continue;
            }
            int eq = t.indexOf('=');
            if (eq < 0)
                continue;
            String name = t.substring(0, eq).trim().toLowerCase(Locale.ENGLISH);
            String value = QuotedStringTokenizer.unquote(t.substring(eq + 1));
            if ("boundary".equals(name) && boundary == null)
                boundary = value;
            else if ("charset".equals(name) && charset == null)
                charset = value;
        }

        if (boundary == null || boundary.isEmpty())
            throw new MultiPartException(MultiPartException.Violation.MISSING_BOUNDARY);

        return new MultiPartContentType(mimeType, boundary, charset == null || charset.isEmpty() ? null : toCharset(charset));
    }

    private static Charset toCharset(String name)
    {
        try
        {
            return Charset.forName(name);
        }
        catch (IllegalCharsetNameException | UnsupportedCharsetException x)
        {
            throw new MultiPartException(MultiPartException.Violation.UNSUPPORTED_CHARSET,
                MultiPartException.Violation.UNSUPPORTED_CHARSET.getReason() + ": " + name,
                Collections.singletonMap("charset", name), x);
        }
    }

    /**
     * @return the lower cased media type, such as {@code multipart/form-data}
     */
    public String getMimeType()
    {
        return _mimeType;
    }

    public String getBoundary()
    {
        return _boundary;
    }

    /**
     * @return the boundary as it appears on the wire, prefixed with {@code --}
     */
    public byte[] getDelimiterBytes()
    {
        return ("--" + _boundary).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the charset named by the header, or null
     */
    public Charset getCharset()
    {
        return _charset;
    }

    /**
     * @param defaultCharset the charset to use when the header names none
     * @return the charset to decode text with
     */
    public Charset getCharset(Charset defaultCharset)
    {
        return _charset == null ? defaultCharset : _charset;
    }

    @Override
    public String toString()
    {
        return String.format("%s{%s,boundary=%s,charset=%s}", getClass().getSimpleName(), _mimeType, _boundary, _charset);
    }
}
