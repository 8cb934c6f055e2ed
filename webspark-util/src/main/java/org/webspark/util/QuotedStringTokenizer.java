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

package org.webspark.util;

import java.util.NoSuchElementException;

/**
 * Tokenizer for header values such as {@code form-data; name="a;b"; filename="c.txt"}.
 * <p>
 * Delimiters within double quoted strings are not considered delimiters.
 * Quotes within a quoted string can be escaped with '\'. Tokens are returned
 * with their quotes intact unless {@code returnQuotes} is false, in which
 * case the quotes and escapes are removed.
 */
public class QuotedStringTokenizer
{
    private final String _string;
    private final String _delim;
    private final boolean _returnQuotes;
    private final StringBuilder _token;
    private boolean _hasToken;
    private int _i;

    public QuotedStringTokenizer(String str, String delim, boolean returnQuotes)
    {
        if (delim.indexOf('"') >= 0)
            throw new IllegalArgumentException("Can't use quotes as delimiters: " + delim);
        _string = str;
        _delim = delim;
        _returnQuotes = returnQuotes;
        _token = new StringBuilder(Math.min(str.length(), 256));
    }

    public QuotedStringTokenizer(String str, String delim)
    {
        this(str, delim, true);
    }

    public boolean hasMoreTokens()
    {
        if (_hasToken)
            return true;

        boolean quoted = false;
        boolean escape = false;
        while (_i < _string.length())
        {
            char c = _string.charAt(_i++);
            if (quoted)
            {
                if (escape)
                {
                    escape = false;
                    _token.append(c);
                }
                else if (c == '"')
                {
                    if (_returnQuotes)
                        _token.append(c);
                    quoted = false;
                }
                else if (c == '\\')
                {
                    if (_returnQuotes)
                        _token.append(c);
                    escape = true;
                }
                else
                {
                    _token.append(c);
                }
            }
            else if (_delim.indexOf(c) >= 0)
            {
                if (_hasToken)
                    return true;
            }
            else
            {
                _hasToken = true;
                if (c == '"')
                {
                    quoted = true;
                    if (_returnQuotes)
                        _token.append(c);
                }
                else
                {
                    _token.append(c);
                }
            }
        }
        return _hasToken;
    }

    public String nextToken() throws NoSuchElementException
    {
        if (!hasMoreTokens())
            throw new NoSuchElementException();
        String t = _token.toString();
        _token.setLength(0);
        _hasToken = false;
        return t;
    }

    /**
     * Unquote a string, removing the surrounding double quotes and resolving escapes.
     * <p>
     * Only {@code \"} and {@code \\} are treated as escapes; any other backslash is
     * kept, as browsers send unescaped Windows paths as filenames.
     *
     * @param s The string to unquote.
     * @return unquoted string, or the trimmed input if it was not quoted
     */
    public static String unquote(String s)
    {
        if (s == null)
            return null;
        s = s.trim();
        if (s.length() < 2 || s.charAt(0) != '"' || s.charAt(s.length() - 1) != '"')
            return s;

        StringBuilder b = new StringBuilder(s.length() - 2);
        for (int i = 1; i < s.length() - 1; i++)
        {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length() - 1)
            {
                char next = s.charAt(i + 1);
                if (next == '"' || next == '\\')
                {
                    b.append(next);
                    i++;
                    continue;
                }
            }
            b.append(c);
        }
        return b.toString();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), _string);
    }
}
