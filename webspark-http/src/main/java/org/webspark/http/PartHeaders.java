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

import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.webspark.util.ByteArrayOutputStream2;
import org.webspark.util.QuotedStringTokenizer;

/**
 * <p>The headers of a single part, with the {@code Content-Disposition} parameters
 * that identify it.</p>
 * <p>Header names are case insensitive and kept lower cased; repeated headers keep
 * their values in order.</p>
 */
public class PartHeaders
{
    public static final String CONTENT_DISPOSITION = "content-disposition";
    public static final String CONTENT_TYPE = "content-type";
    public static final String CONTENT_TRANSFER_ENCODING = "content-transfer-encoding";
    public static final String DEFAULT_CONTENT_TYPE = "text/plain";

    private final Map<String, List<String>> _headers;
    private final String _name;
    private final String _filename;
    private final String _contentType;

    private PartHeaders(Map<String, List<String>> headers, String name, String filename, String contentType)
    {
        _headers = headers;
        _name = name;
        _filename = filename;
        _contentType = contentType;
    }

    /**
     * Parse a header block.
     *
     * @param block the header bytes, without the terminating empty line
     * @param delimiter the line delimiter of the body
     * @param charset the charset to decode the headers with
     * @param errors the policy for undecodable bytes
     * @return the parsed headers
     * @throws MultiPartException if the block cannot be decoded, or does not identify a named part
     */
    public static PartHeaders parse(ByteArrayOutputStream2 block, LineDelimiter delimiter, Charset charset, EncodingErrors errors)
    {
        String text;
        try
        {
            text = block.decode(charset, errors.getCodingErrorAction());
        }
        catch (CharacterCodingException x)
        {
            throw new MultiPartException(MultiPartException.Violation.UNDECODABLE_FIELD,
                "Unable to decode part headers as " + charset.name(), Collections.emptyMap(), x);
        }
        return parse(text, delimiter);
    }

    static PartHeaders parse(String text, LineDelimiter delimiter)
    {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        String eol = delimiter == LineDelimiter.CRLF ? "\r\n" : "\n";
        int from = 0;
        while (from <= text.length())
        {
            int to = text.indexOf(eol, from);
            if (to < 0)
                to = text.length();
            String line = text.substring(from, to).trim();
            from = to + eol.length();

            int colon = line.indexOf(':');
            if (colon < 0)
                continue;
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ENGLISH);
            String value = line.substring(colon + 1).trim();
            headers.computeIfAbsent(key, k -> new ArrayList<>(1)).add(value);
        }

        List<String> dispositions = headers.get(CONTENT_DISPOSITION);
        if (dispositions == null)
            throw new MultiPartException(MultiPartException.Violation.MISSING_CONTENT_DISPOSITION);

        String name = null;
        String filename = null;
        QuotedStringTokenizer tok = new QuotedStringTokenizer(dispositions.get(0), ";");
        while (tok.hasMoreTokens())
        {
            String t = tok.nextToken().trim();
            String tl = t.toLowerCase(Locale.ENGLISH);
            if (tl.startsWith("name=") && name == null)
                name = QuotedStringTokenizer.unquote(t.substring(5));
            else if (tl.startsWith("filename=") && filename == null)
                filename = QuotedStringTokenizer.unquote(t.substring(9));
        }

        // An empty name is valid, the browser sends it for unnamed reset and submit buttons.
        if (name == null)
            throw new MultiPartException(MultiPartException.Violation.MISSING_PART_NAME);

        return new PartHeaders(headers, name, filename == null || filename.isEmpty() ? null : filename,
            contentType(headers.get(CONTENT_TYPE)));
    }

    private static String contentType(List<String> values)
    {
        if (values == null)
            return DEFAULT_CONTENT_TYPE;
        String value = values.get(0);
        int semi = value.indexOf(';');
        String type = (semi < 0 ? value : value.substring(0, semi)).trim().toLowerCase(Locale.ENGLISH);
        int slash = type.indexOf('/');
        if (slash <= 0 || slash == type.length() - 1 || type.indexOf('/', slash + 1) >= 0)
            return DEFAULT_CONTENT_TYPE;
        return type;
    }

    /**
     * @return the {@code name} parameter of the {@code Content-Disposition} header, possibly empty
     */
    public String getName()
    {
        return _name;
    }

    /**
     * @return the {@code filename} parameter, or null if absent or empty
     */
    public String getFilename()
    {
        return _filename;
    }

    /**
     * @return true if the part carries a non empty filename and is spooled to a file
     */
    public boolean isFile()
    {
        return _filename != null;
    }

    /**
     * @return the lower cased {@code type/subtype} of the part, {@code text/plain} by default
     */
    public String getContentType()
    {
        return _contentType;
    }

    public String getHeader(String name)
    {
        if (name == null)
            return null;
        List<String> values = _headers.get(name.toLowerCase(Locale.ENGLISH));
        return values == null ? null : values.get(0);
    }

    public Collection<String> getHeaders(String name)
    {
        if (name == null)
            return Collections.emptyList();
        List<String> values = _headers.get(name.toLowerCase(Locale.ENGLISH));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    public Collection<String> getHeaderNames()
    {
        return Collections.unmodifiableSet(_headers.keySet());
    }

    /**
     * @return true if the part declares a transfer encoding other than the identity ones
     */
    public boolean isTransferEncoded()
    {
        String encoding = getHeader(CONTENT_TRANSFER_ENCODING);
        return encoding != null &&
            !"7bit".equalsIgnoreCase(encoding) &&
            !"8bit".equalsIgnoreCase(encoding) &&
            !"binary".equalsIgnoreCase(encoding);
    }

    @Override
    public String toString()
    {
        return String.format("PartHeaders{n=%s,fn=%s,ct=%s}", _name, _filename, _contentType);
    }
}
