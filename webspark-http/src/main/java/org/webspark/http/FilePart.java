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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;

import jakarta.servlet.http.Part;

/**
 * <p>An uploaded file, spooled to a temporary file owned by the parse that produced it.</p>
 * <p>The content is available through {@link #getChannel()}, which is positioned at
 * offset 0 when the part is handed over and shared by all callers, or through
 * {@link #getInputStream()}, which opens an independent stream on each call.
 * Both become unusable once the owning {@link MultiPartFormData} is closed.</p>
 */
public class FilePart implements Part
{
    private final PartHeaders _headers;
    private final TempFileRegistry.TempFile _file;
    private final long _size;

    FilePart(PartHeaders headers, TempFileRegistry.TempFile file, long size)
    {
        _headers = headers;
        _file = file;
        _size = size;
    }

    public PartHeaders getPartHeaders()
    {
        return _headers;
    }

    /**
     * @return the readable and seekable channel of the temporary file
     */
    public FileChannel getChannel()
    {
        return _file.getChannel();
    }

    /**
     * @return the path of the temporary file
     */
    public Path getPath()
    {
        return _file.getPath();
    }

    @Override
    public InputStream getInputStream() throws IOException
    {
        return new BufferedInputStream(Files.newInputStream(_file.getPath()));
    }

    @Override
    public String getContentType()
    {
        return _headers.getContentType();
    }

    @Override
    public String getName()
    {
        return _headers.getName();
    }

    @Override
    public String getSubmittedFileName()
    {
        return _headers.getFilename();
    }

    /**
     * @return the submitted file name, same as {@link #getSubmittedFileName()}
     */
    public String getFilename()
    {
        return _headers.getFilename();
    }

    @Override
    public long getSize()
    {
        return _size;
    }

    /**
     * Copy the content to a file. A relative name is resolved against the
     * directory of the temporary file, which is still deleted on close.
     */
    @Override
    public void write(String fileName) throws IOException
    {
        Path target = _file.getPath().resolveSibling(fileName);
        Files.copy(_file.getPath(), target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Close the channel and delete the temporary file ahead of the owning parse being closed.
     */
    @Override
    public void delete() throws IOException
    {
        _file.delete();
    }

    @Override
    public String getHeader(String name)
    {
        return _headers.getHeader(name);
    }

    @Override
    public Collection<String> getHeaders(String name)
    {
        return _headers.getHeaders(name);
    }

    @Override
    public Collection<String> getHeaderNames()
    {
        return _headers.getHeaderNames();
    }

    @Override
    public String toString()
    {
        return String.format("Part{n=%s,fn=%s,ct=%s,s=%d,file=%s}", getName(), getFilename(), getContentType(), _size, _file.getPath());
    }
}
