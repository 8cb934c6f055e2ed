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

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webspark.util.MultiException;

/**
 * <p>Owns every temporary file created for the parts of one request body.</p>
 * <p>A file is registered as soon as it exists on disk, before its channel is
 * opened and before any content is written, so that {@link #close()} finds it
 * whatever the point of failure. Closing is idempotent: the first call closes
 * every channel and deletes every file that still exists, later calls do nothing.</p>
 */
public class TempFileRegistry implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(TempFileRegistry.class);

    private final Path _directory;
    private final String _prefix;
    private final String _suffix;
    private final List<TempFile> _files = new ArrayList<>();
    private boolean _closed;

    public TempFileRegistry(Path directory, String prefix, String suffix)
    {
        _directory = directory;
        _prefix = prefix;
        _suffix = suffix;
    }

    /**
     * @return a new, empty, registered temporary file open for reading and writing
     * @throws IOException if the file cannot be created or opened
     */
    public synchronized TempFile create() throws IOException
    {
        if (_closed)
            throw new IllegalStateException("Registry closed");
        Path path = Files.createTempFile(_directory, _prefix, _suffix);
        TempFile file = new TempFile(path);
        _files.add(file);
        if (LOG.isDebugEnabled())
            LOG.debug("Created {}", path);
        file.open();
        return file;
    }

    public synchronized List<TempFile> getFiles()
    {
        return Collections.unmodifiableList(new ArrayList<>(_files));
    }

    public synchronized boolean isClosed()
    {
        return _closed;
    }

    /**
     * Close and delete every registered file.
     * Every file is attempted; failures are collected and thrown once all have been.
     */
    @Override
    public void close()
    {
        List<TempFile> files;
        synchronized (this)
        {
            if (_closed)
                return;
            _closed = true;
            files = new ArrayList<>(_files);
            _files.clear();
        }

        MultiException err = null;
        for (TempFile file : files)
        {
            try
            {
                file.delete();
            }
            catch (IOException | RuntimeException e)
            {
                LOG.warn("Unable to delete {}", file.getPath(), e);
                if (err == null)
                    err = new MultiException();
                err.add(e);
            }
        }

        if (LOG.isDebugEnabled())
            LOG.debug("Closed {} with {} temp files, err={}", this, files.size(), err);

        if (err != null)
            err.ifExceptionThrowRuntime();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{dir=%s,closed=%b}", getClass().getSimpleName(), hashCode(), _directory, _closed);
    }

    /**
     * A registered temporary file and its channel.
     */
    public static class TempFile
    {
        private final Path _path;
        private FileChannel _channel;

        private TempFile(Path path)
        {
            _path = path;
        }

        private void open() throws IOException
        {
            _channel = FileChannel.open(_path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        }

        public Path getPath()
        {
            return _path;
        }

        /**
         * @return the channel shared by all readers of this file
         * @throws IllegalStateException if the file has been deleted
         */
        public FileChannel getChannel()
        {
            if (_channel == null)
                throw new IllegalStateException("Not open " + _path);
            return _channel;
        }

        public boolean isOpen()
        {
            return _channel != null && _channel.isOpen();
        }

        /**
         * Close the channel, if open, and delete the file, if it exists.
         * Both are attempted even if closing fails.
         *
         * @throws IOException if either fails
         */
        public void delete() throws IOException
        {
            IOException failure = null;
            FileChannel channel = _channel;
            if (channel != null)
            {
                try
                {
                    channel.close();
                }
                catch (IOException x)
                {
                    failure = x;
                }
            }
            try
            {
                if (Files.deleteIfExists(_path) && LOG.isDebugEnabled())
                    LOG.debug("Deleted {}", _path);
            }
            catch (IOException x)
            {
                if (failure == null)
                    failure = x;
                else
                    failure.addSuppressed(x);
            }
            if (failure != null)
                throw failure;
        }

        @Override
        public String toString()
        {
            return String.format("TempFile{%s,open=%b}", _path, isOpen());
        }
    }
}
