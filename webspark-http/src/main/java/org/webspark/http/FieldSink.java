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
import java.util.Collections;

import org.webspark.util.ByteArrayOutputStream2;

/**
 * Accumulates the body of a form field in memory, to be decoded once complete.
 */
public class FieldSink implements PartSink
{
    private final String _name;
    private final ByteArrayOutputStream2 _bout = new ByteArrayOutputStream2(64);

    public FieldSink(String name)
    {
        _name = name;
    }

    @Override
    public void write(byte[] bytes, int offset, int length)
    {
        _bout.write(bytes, offset, length);
    }

    @Override
    public long getSize()
    {
        return _bout.getCount();
    }

    /**
     * @param charset the charset of the field value
     * @param errors the policy for undecodable bytes
     * @return the field value
     * @throws MultiPartException if the value cannot be decoded under the {@link EncodingErrors#STRICT} policy
     */
    public String complete(Charset charset, EncodingErrors errors)
    {
        try
        {
            return _bout.decode(charset, errors.getCodingErrorAction());
        }
        catch (CharacterCodingException x)
        {
            throw new MultiPartException(MultiPartException.Violation.UNDECODABLE_FIELD,
                MultiPartException.Violation.UNDECODABLE_FIELD.getReason() + " '" + _name + "' as " + charset.name(),
                Collections.singletonMap(_name, "invalid " + charset.name() + " content"), x);
        }
        finally
        {
            _bout.release(1024);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,size=%d}", getClass().getSimpleName(), hashCode(), _name, _bout.getCount());
    }
}
