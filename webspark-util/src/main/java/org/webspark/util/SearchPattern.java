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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Searches for a fixed byte pattern within arbitrary binary data, using the
 * Boyer-Moore-Horspool bad character shift table.
 * <p>
 * Instances are immutable and may be shared.
 */
public class SearchPattern
{
    private static final int ALPHABET_SIZE = 256;
    private final int[] _table;
    private final byte[] _pattern;

    /**
     * @param pattern The pattern to search for.
     * @return A Pattern instance for the search pattern
     */
    public static SearchPattern compile(byte[] pattern)
    {
        return new SearchPattern(Arrays.copyOf(pattern, pattern.length));
    }

    /**
     * @param pattern The pattern to search for, encoded as {@link StandardCharsets#US_ASCII}.
     * @return A Pattern instance for the search pattern
     */
    public static SearchPattern compile(String pattern)
    {
        return new SearchPattern(pattern.getBytes(StandardCharsets.US_ASCII));
    }

    private SearchPattern(byte[] pattern)
    {
        if (pattern.length == 0)
            throw new IllegalArgumentException("Empty Pattern");

        _pattern = pattern;

        // Build up the pre-processed table for this pattern.
        _table = new int[ALPHABET_SIZE];
        Arrays.fill(_table, _pattern.length);
        for (int i = 0; i < _pattern.length - 1; ++i)
        {
            _table[0xff & _pattern[i]] = _pattern.length - 1 - i;
        }
    }

    /**
     * Search for a complete match of the pattern within the data
     *
     * @param data The data in which to search for. The data may be arbitrary binary data.
     * @param offset The offset within the data to start the search
     * @param length The length of the data to search
     * @return The index within the data array at which the first instance of the pattern or -1 if not found
     */
    public int match(byte[] data, int offset, int length)
    {
        validate(data, offset, length);
        int skip = offset;
        int end = offset + length;
        while (skip <= end - _pattern.length)
        {
            for (int i = _pattern.length - 1; data[skip + i] == _pattern[i]; i--)
            {
                if (i == 0)
                    return skip;
            }
            skip += _table[0xff & data[skip + _pattern.length - 1]];
        }
        return -1;
    }

    /**
     * Check whether the data starts with the complete pattern.
     *
     * @param data The data to check.
     * @param offset The offset within the data of the first byte to compare
     * @param length The number of bytes available from the offset
     * @return true if the whole pattern is found at the offset
     */
    public boolean isPrefixOf(byte[] data, int offset, int length)
    {
        validate(data, offset, length);
        if (length < _pattern.length)
            return false;
        for (int i = 0; i < _pattern.length; i++)
        {
            if (data[offset + i] != _pattern[i])
                return false;
        }
        return true;
    }

    /**
     * @return The length of the pattern in bytes.
     */
    public int getLength()
    {
        return _pattern.length;
    }

    private void validate(byte[] data, int offset, int length)
    {
        if (offset < 0)
            throw new IllegalArgumentException("offset was negative");
        if (length < 0)
            throw new IllegalArgumentException("length was negative");
        if (offset + length > data.length)
            throw new IllegalArgumentException("(offset+length) out of bounds of data[]");
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), new String(_pattern, StandardCharsets.ISO_8859_1));
    }
}
