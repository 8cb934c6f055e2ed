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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;

/**
 * ByteArrayOutputStream with public internals
 */
public class ByteArrayOutputStream2 extends ByteArrayOutputStream
{
    public ByteArrayOutputStream2()
    {
        super();
    }

    public ByteArrayOutputStream2(int size)
    {
        super(size);
    }

    public byte[] getBuf()
    {
        return buf;
    }

    public int getCount()
    {
        return count;
    }

    /**
     * Discard the content and release a buffer that grew beyond {@code maxSize}.
     *
     * @param maxSize the largest buffer worth keeping
     */
    public void release(int maxSize)
    {
        reset();
        if (buf.length > maxSize)
            buf = new byte[Math.min(32, maxSize)];
    }

    public String toString(Charset charset)
    {
        return new String(buf, 0, count, charset);
    }

    /**
     * Decode the content with an explicit policy for malformed or unmappable input.
     *
     * @param charset the charset to decode with
     * @param onError {@link CodingErrorAction#REPORT} to fail, or the action to apply to bad input
     * @return the decoded content
     * @throws CharacterCodingException if the content cannot be decoded and {@code onError} is REPORT
     */
    public String decode(Charset charset, CodingErrorAction onError) throws CharacterCodingException
    {
        return charset.newDecoder()
            .onMalformedInput(onError)
            .onUnmappableCharacter(onError)
            .decode(ByteBuffer.wrap(buf, 0, count))
            .toString();
    }
}
