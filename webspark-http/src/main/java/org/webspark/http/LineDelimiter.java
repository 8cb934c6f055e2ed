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

import java.util.Arrays;

import org.webspark.util.SearchPattern;

/**
 * The line terminator of a multipart body, detected once from the first boundary line.
 */
public enum LineDelimiter
{
    CRLF(new byte[]{'\r', '\n'}),
    LF(new byte[]{'\n'});

    private final byte[] _bytes;
    private final SearchPattern _double;

    LineDelimiter(byte[] bytes)
    {
        _bytes = bytes;
        byte[] twice = Arrays.copyOf(bytes, bytes.length * 2);
        System.arraycopy(bytes, 0, twice, bytes.length, bytes.length);
        _double = SearchPattern.compile(twice);
    }

    /**
     * @return a copy of the delimiter bytes
     */
    public byte[] getBytes()
    {
        return _bytes.clone();
    }

    public int getLength()
    {
        return _bytes.length;
    }

    /**
     * @return the pattern of two consecutive delimiters, which ends a part header block
     */
    SearchPattern getHeaderTerminator()
    {
        return _double;
    }

    /**
     * @param data the data to test
     * @param offset the offset of the first byte to test
     * @param length the number of bytes available from the offset
     * @return true if the data at the offset starts with this delimiter
     */
    public boolean isPrefixOf(byte[] data, int offset, int length)
    {
        if (length < _bytes.length)
            return false;
        for (int i = 0; i < _bytes.length; i++)
        {
            if (data[offset + i] != _bytes[i])
                return false;
        }
        return true;
    }

    /**
     * @param data the data to test
     * @param offset the offset of the first byte of the data
     * @param length the number of bytes of data
     * @return true if the data ends with this delimiter
     */
    public boolean isSuffixOf(byte[] data, int offset, int length)
    {
        return length >= _bytes.length && isPrefixOf(data, offset + length - _bytes.length, _bytes.length);
    }

    /**
     * Detect the delimiter from the bytes that follow the first occurrence of the boundary.
     *
     * @param data the first window of the body
     * @param offset the offset of the window
     * @param length the length of the window
     * @param boundary the boundary pattern, including its leading {@code --}
     * @return the detected delimiter
     * @throws MultiPartException if the boundary is absent or not followed by a line terminator
     */
    public static LineDelimiter detect(byte[] data, int offset, int length, SearchPattern boundary)
    {
        int idx = boundary.match(data, offset, length);
        if (idx < 0)
            throw new MultiPartException(MultiPartException.Violation.UNDETECTABLE_DELIMITER);
        int after = idx + boundary.getLength();
        int available = offset + length - after;
        if (CRLF.isPrefixOf(data, after, available))
            return CRLF;
        if (LF.isPrefixOf(data, after, available))
            return LF;
        throw new MultiPartException(MultiPartException.Violation.UNDETECTABLE_DELIMITER);
    }
}
