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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Spools the body of a file part to a registered temporary file.
 */
public class FileSink implements PartSink
{
    private final TempFileRegistry.TempFile _file;
    private long _size;

    public FileSink(TempFileRegistry.TempFile file)
    {
        _file = file;
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException
    {
        FileChannel channel = _file.getChannel();
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, length);
        while (buffer.hasRemaining())
        {
            channel.write(buffer);
        }
        _size += length;
    }

    @Override
    public long getSize()
    {
        return _size;
    }

    /**
     * Rewind the file and hand it over as a part.
     *
     * @param headers the headers of the part
     * @return the completed part, readable from offset 0
     * @throws IOException if the file cannot be rewound
     */
    public FilePart complete(PartHeaders headers) throws IOException
    {
        _file.getChannel().position(0);
        return new FilePart(headers, _file, _size);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,size=%d}", getClass().getSimpleName(), hashCode(), _file, _size);
    }
}
