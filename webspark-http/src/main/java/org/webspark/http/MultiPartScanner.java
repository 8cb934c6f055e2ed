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
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webspark.util.ByteArrayOutputStream2;
import org.webspark.util.SearchPattern;

/**
 * <p>Forward only scanner of a multipart body.</p>
 * <p>The body is read in chunks of at most {@link MultiPartConfig#getChunkSize()} bytes into a
 * single buffer, of which only the live window between {@code _start} and {@code _end} is
 * significant. While the closing boundary of a part is searched for, all but the last
 * {@code boundary length + 2} bytes of the window are flushed to the part sink before every
 * read, so a boundary split across reads is still found, together with the delimiter before it,
 * and the window never exceeds that tail plus one chunk.</p>
 * <p>No more than the declared content length is ever read. When the length is unknown, the
 * body is read to the end of the stream and may not exceed the maximum body size.</p>
 */
public class MultiPartScanner
{
    private static final Logger LOG = LoggerFactory.getLogger(MultiPartScanner.class);

    private final InputStream _in;
    private static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private final SearchPattern _boundary;
    private final int _chunkSize;
    private final long _maxBodySize;
    private final int _maxHeaderSize;
    private final boolean _lengthKnown;
    private final ByteArrayOutputStream2 _headerBlock = new ByteArrayOutputStream2(256);
    private LineDelimiter _delimiter;
    private byte[] _buffer;
    private int _start;
    private int _end;
    private long _remaining;
    private long _bytesRead;
    private int _peakWindow;
    private boolean _eof;

    /**
     * @param in the body
     * @param boundary the boundary as it appears on the wire, including its leading {@code --}
     * @param contentLength the declared length of the body, or -1 if unknown
     * @param config the limits to apply
     */
    public MultiPartScanner(InputStream in, byte[] boundary, long contentLength, MultiPartConfig config)
    {
        _in = in;
        _boundary = SearchPattern.compile(boundary);
        _chunkSize = config.getChunkSize();
        _maxBodySize = config.getMaxBodySize();
        _maxHeaderSize = config.getMaxPartHeaderSize();
        _lengthKnown = contentLength >= 0;
        // Reading one byte past the limit of an unknown length body detects the overflow.
        _remaining = _lengthKnown ? contentLength : (_maxBodySize == Long.MAX_VALUE ? Long.MAX_VALUE : _maxBodySize + 1);
        // The buffer starts at one read and grows as the window needs.
        _buffer = new byte[capacity(Math.max(Math.min(_chunkSize, _remaining), boundary.length + 2))];
    }

    private static int capacity(long size)
    {
        if (size > MAX_BUFFER_SIZE)
            throw new IllegalStateException("Window of " + size + " bytes exceeds " + MAX_BUFFER_SIZE);
        return (int)size;
    }

    private int window()
    {
        return _end - _start;
    }

    /**
     * Read at most one chunk into the window.
     *
     * @return false if no more bytes may be read, or the stream has ended
     * @throws IOException if the stream cannot be read
     */
    private boolean fill() throws IOException
    {
        if (_remaining <= 0 || _eof)
            return false;

        int length = (int)Math.min(_chunkSize, _remaining);
        if (_buffer.length - _end < length)
        {
            int live = window();
            if (_buffer.length - live < length)
            {
                long size = Math.max((long)live + length, Math.min(_buffer.length * 2L, MAX_BUFFER_SIZE));
                byte[] buffer = new byte[capacity(size)];
                System.arraycopy(_buffer, _start, buffer, 0, live);
                _buffer = buffer;
            }
            else
            {
                System.arraycopy(_buffer, _start, _buffer, 0, live);
            }
            _start = 0;
            _end = live;
        }

        int read = _in.read(_buffer, _end, length);
        if (read < 0)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("EOF after {} bytes, {} remaining", _bytesRead, _lengthKnown ? _remaining : "unknown");
            _eof = true;
            return false;
        }

        _end += read;
        _remaining -= read;
        _bytesRead += read;
        if (_bytesRead > _maxBodySize)
            throw new MultiPartException(MultiPartException.Violation.BODY_TOO_LARGE);
        if (window() > _peakWindow)
            _peakWindow = window();
        return true;
    }

    /**
     * Read until the window holds at least {@code length} bytes, or nothing more can be read.
     */
    private void ensure(int length) throws IOException
    {
        while (window() < length)
        {
            if (!fill())
                return;
        }
    }

    /**
     * Detect the line delimiter and position the window after the first boundary line.
     * The first window is one chunk, extended until it can hold the boundary and a delimiter,
     * and then until the delimiter after a boundary found in it is complete.
     * Bytes before the first boundary are discarded. A preamble that does not
     * leave the first boundary within the first chunk is not supported.
     *
     * @return the detected delimiter
     * @throws IOException if the stream cannot be read
     * @throws MultiPartException if no delimiter can be detected
     */
    public LineDelimiter start() throws IOException
    {
        fill();
        ensure(_boundary.getLength() + 2);
        int found = _boundary.match(_buffer, _start, window());
        if (found >= 0)
            ensure(found - _start + _boundary.getLength() + 2);
        _delimiter = LineDelimiter.detect(_buffer, _start, window(), _boundary);
        int idx = _boundary.match(_buffer, _start, window());
        if (LOG.isDebugEnabled())
            LOG.debug("Delimiter {} detected, preamble of {} bytes", _delimiter, idx - _start);
        _start = idx + _boundary.getLength() + _delimiter.getLength();
        return _delimiter;
    }

    /**
     * @return true if the window starts with the {@code --} that follows the closing boundary
     * @throws IOException if the stream cannot be read
     */
    public boolean atClose() throws IOException
    {
        ensure(2);
        return window() >= 2 && _buffer[_start] == '-' && _buffer[_start + 1] == '-';
    }

    /**
     * Consume a part header block and its terminating empty line.
     *
     * @return the header bytes, valid until the next call
     * @throws IOException if the stream cannot be read
     * @throws MultiPartException if the header block is malformed, truncated or too large
     */
    public ByteArrayOutputStream2 readHeaders() throws IOException
    {
        SearchPattern terminator = _delimiter.getHeaderTerminator();
        while (true)
        {
            int idx = terminator.match(_buffer, _start, window());
            if (idx >= 0)
            {
                int length = idx - _start;
                if (length > _maxHeaderSize)
                    throw new MultiPartException(MultiPartException.Violation.PART_HEADERS_TOO_LARGE);
                _headerBlock.reset();
                _headerBlock.write(_buffer, _start, length);
                _start = idx + terminator.getLength();
                return _headerBlock;
            }

            if (window() > _maxHeaderSize + terminator.getLength())
                throw new MultiPartException(MultiPartException.Violation.PART_HEADERS_TOO_LARGE);
            if (_remaining <= 0)
                throw new MultiPartException(MultiPartException.Violation.MALFORMED_PART_HEADERS);
            if (!fill())
                throw new MultiPartException(MultiPartException.Violation.HEADER_TERMINATOR_NOT_FOUND);
        }
    }

    /**
     * Consume a part body and the boundary that closes it, passing the content to the sink.
     * The delimiter that precedes the boundary is not content, nor is the one that follows it.
     *
     * @param sink the destination of the content
     * @throws IOException if the stream cannot be read, or the sink cannot be written
     * @throws MultiPartException if the body is not closed by a boundary
     */
    public void readBody(PartSink sink) throws IOException
    {
        int tail = _boundary.getLength() + 2;
        while (true)
        {
            int idx = _boundary.match(_buffer, _start, window());
            if (idx >= 0)
            {
                int length = idx - _start;
                if (_delimiter.isSuffixOf(_buffer, _start, length))
                    length -= _delimiter.getLength();
                sink.write(_buffer, _start, length);
                _start = idx + _boundary.getLength();
                ensure(_delimiter.getLength());
                if (_delimiter.isPrefixOf(_buffer, _start, window()))
                    _start += _delimiter.getLength();
                if (LOG.isDebugEnabled())
                    LOG.debug("Part complete {}", sink);
                return;
            }

            if (window() > tail)
            {
                int flush = window() - tail;
                sink.write(_buffer, _start, flush);
                _start += flush;
            }

            if (_remaining <= 0)
                throw new MultiPartException(MultiPartException.Violation.CLOSING_BOUNDARY_NOT_FOUND);
            if (!fill())
                throw new MultiPartException(MultiPartException.Violation.BODY_TERMINATOR_NOT_FOUND);
        }
    }

    public LineDelimiter getDelimiter()
    {
        return _delimiter;
    }

    /**
     * @return the number of bytes read from the stream
     */
    public long getBytesRead()
    {
        return _bytesRead;
    }

    /**
     * @return the largest live window held while scanning
     */
    public int getPeakWindowSize()
    {
        return _peakWindow;
    }

    /**
     * Drop the scan buffers. The scanner cannot be used afterwards.
     */
    public void release()
    {
        _buffer = new byte[0];
        _start = 0;
        _end = 0;
        _headerBlock.release(0);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{read=%d,window=%d,peak=%d,delimiter=%s}",
            getClass().getSimpleName(), hashCode(), _bytesRead, window(), _peakWindow, _delimiter);
    }
}
