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

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ByteArrayOutputStream2Test
{
    @Test
    public void testDecode() throws Exception
    {
        ByteArrayOutputStream2 out = new ByteArrayOutputStream2();
        out.writeBytes("caf".getBytes(StandardCharsets.US_ASCII));
        out.write(0xC3);
        out.write(0xA9);
        assertThat(out.getCount(), is(5));
        assertThat(out.decode(StandardCharsets.UTF_8, CodingErrorAction.REPORT), is("café"));
        assertThat(out.toString(StandardCharsets.ISO_8859_1), is("caf\u00C3\u00A9"));
    }

    @Test
    public void testDecodeErrors() throws Exception
    {
        ByteArrayOutputStream2 out = new ByteArrayOutputStream2();
        out.writeBytes("caf".getBytes(StandardCharsets.US_ASCII));
        out.write(0xE9);
        out.write('!');
        assertThrows(CharacterCodingException.class, () -> out.decode(StandardCharsets.UTF_8, CodingErrorAction.REPORT));
        assertThat(out.decode(StandardCharsets.UTF_8, CodingErrorAction.REPLACE), is("caf\uFFFD!"));
        assertThat(out.decode(StandardCharsets.UTF_8, CodingErrorAction.IGNORE), is("caf!"));
    }

    @Test
    public void testRelease()
    {
        ByteArrayOutputStream2 out = new ByteArrayOutputStream2(16);
        out.write(new byte[4096], 0, 4096);
        assertThat(out.getBuf().length >= 4096, is(true));
        out.release(1024);
        assertThat(out.getCount(), is(0));
        assertThat(out.getBuf().length <= 1024, is(true));
    }
}
