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
import java.io.InputStream;
import java.lang.ref.Cleaner;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webspark.util.MultiValue;
import org.webspark.util.ReferenceCleaner;

/**
 * <p>Streaming parser of a {@code multipart/form-data} request body.</p>
 * <p>Form fields are decoded into strings held in memory; file parts, those with a non empty
 * {@code filename}, are spooled to temporary files and exposed as {@link FilePart}s. A name
 * seen once maps to a single value; a name seen again is promoted to a list of values in
 * the order of the body.</p>
 * <p>An instance parses a single body, once, and must be closed to delete its temporary
 * files. A failed parse closes the instance before the failure is propagated.</p>
 * <pre>
 * try (MultiPartFormData formData = new MultiPartFormData(in, contentType, contentLength, config))
 * {
 *     formData.parse();
 *     MultiValue&lt;String&gt; username = formData.getForms().get("username");
 *     MultiValue&lt;FilePart&gt; avatar = formData.getFiles().get("avatar");
 * }
 * </pre>
 * <p>An instance that becomes unreachable without having been closed has its temporary
 * files deleted when it is garbage collected, and a warning is logged.</p>
 */
public class MultiPartFormData implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(MultiPartFormData.class);

    /**
     * The request attribute under which {@link #getFormData(HttpServletRequest, MultiPartConfig)}
     * keeps the parsed body.
     */
    public static final String ATTRIBUTE = MultiPartFormData.class.getName();

    public enum NonCompliance
    {
        LF_LINE_TERMINATION("https://tools.ietf.org/html/rfc2046#section-5.1.1"),
        TRANSFER_ENCODING("https://tools.ietf.org/html/rfc7578#section-4.7");

        final String _rfcRef;

        NonCompliance(String rfcRef)
        {
            _rfcRef = rfcRef;
        }

        public String getURL()
        {
            return _rfcRef;
        }
    }

    private final EnumSet<NonCompliance> _nonComplianceWarnings = EnumSet.noneOf(NonCompliance.class);
    private final Map<String, MultiValue<String>> _forms = new LinkedHashMap<>();
    private final Map<String, MultiValue<FilePart>> _files = new LinkedHashMap<>();
    private final InputStream _in;
    private final String _contentType;
    private final long _contentLength;
    private final MultiPartConfig _config;
    private final TempFileRegistry _registry;
    private final Cleanup _cleanup;
    private final Cleaner.Cleanable _cleanable;
    private MultiPartScanner _scanner;
    private long _bytesRead;
    private int _peakWindowSize;
    private boolean _parsed;
    private boolean _closed;

    /**
     * @param in the request body
     * @param contentType the {@code Content-Type} header of the request
     * @param contentLength the declared length of the body, or -1 if unknown
     * @param config the limits and settings of the parse
     * @throws MultiPartException if the declared length exceeds the maximum body size
     */
    public MultiPartFormData(InputStream in, String contentType, long contentLength, MultiPartConfig config)
    {
        if (contentLength > config.getMaxBodySize())
            throw new MultiPartException(MultiPartException.Violation.CONTENT_LENGTH_TOO_LARGE,
                String.format("Content-Length %d exceeds max body size of %d.", contentLength, config.getMaxBodySize()));

        _in = in;
        _contentType = contentType;
        _contentLength = contentLength;
        _config = config;
        _registry = new TempFileRegistry(config.getTempDirectory(), config.getTempFilePrefix(), config.getTempFileSuffix());
        _cleanup = new Cleanup(_registry);
        _cleanable = ReferenceCleaner.register(this, _cleanup);
    }

    public MultiPartFormData(InputStream in, String contentType, long contentLength)
    {
        this(in, contentType, contentLength, new MultiPartConfig());
    }

    /**
     * Create a parser of the body of a servlet request.
     *
     * @param request the request
     * @param config the limits and settings of the parse
     * @return an unparsed instance
     * @throws IOException if the request body cannot be obtained
     */
    public static MultiPartFormData from(HttpServletRequest request, MultiPartConfig config) throws IOException
    {
        return new MultiPartFormData(request.getInputStream(), request.getContentType(), request.getContentLengthLong(), config);
    }

    /**
     * Parse the body of a servlet request, once per request.
     * The result is kept as the {@link #ATTRIBUTE} request attribute, which
     * {@link MultiPartCleanerListener} closes when the request is destroyed.
     *
     * @param request the request
     * @param config the limits and settings of the parse
     * @return the parsed body
     * @throws IOException if the request body cannot be read, or a temporary file written
     * @throws MultiPartException if the body cannot be parsed
     */
    public static MultiPartFormData getFormData(HttpServletRequest request, MultiPartConfig config) throws IOException
    {
        Object attribute = request.getAttribute(ATTRIBUTE);
        if (attribute instanceof MultiPartFormData)
            return (MultiPartFormData)attribute;

        MultiPartFormData formData = from(request, config);
        request.setAttribute(ATTRIBUTE, formData);
        try
        {
            formData.parse();
        }
        catch (IOException | RuntimeException x)
        {
            request.removeAttribute(ATTRIBUTE);
            throw x;
        }
        return formData;
    }

    /**
     * Parse the body. Calls after the first do nothing.
     *
     * @throws IOException if the body cannot be read, or a temporary file written
     * @throws MultiPartException if the body cannot be parsed
     * @throws IllegalStateException if this instance has been closed
     */
    public void parse() throws IOException
    {
        synchronized (this)
        {
            if (_closed)
                throw new IllegalStateException("Closed");
            if (_parsed)
                return;
            _parsed = true;
        }

        try
        {
            doParse();
        }
        catch (Throwable x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("MultiPart parsing failure {}", this, x);
            try
            {
                close();
            }
            catch (Throwable c)
            {
                if (c != x)
                    x.addSuppressed(c);
            }
            throw x;
        }
    }

    private void doParse() throws IOException
    {
        MultiPartContentType contentType = MultiPartContentType.parse(_contentType);
        Charset charset = contentType.getCharset(_config.getCharset());
        EncodingErrors errors = _config.getEncodingErrors();

        _scanner = new MultiPartScanner(_in, contentType.getDelimiterBytes(), _contentLength, _config);
        LineDelimiter delimiter = _scanner.start();
        if (delimiter == LineDelimiter.LF)
            _nonComplianceWarnings.add(NonCompliance.LF_LINE_TERMINATION);

        while (!_scanner.atClose())
        {
            PartHeaders headers = PartHeaders.parse(_scanner.readHeaders(), delimiter, charset, errors);
            if (LOG.isDebugEnabled())
                LOG.debug("Part start {}", headers);
            if (headers.isTransferEncoded())
                _nonComplianceWarnings.add(NonCompliance.TRANSFER_ENCODING);

            if (headers.isFile())
            {
                FileSink sink = new FileSink(_registry.create());
                _scanner.readBody(sink);
                MultiValue.add(_files, headers.getName(), sink.complete(headers));
            }
            else
            {
                FieldSink sink = new FieldSink(headers.getName());
                _scanner.readBody(sink);
                MultiValue.add(_forms, headers.getName(), sink.complete(charset, errors));
            }
        }

        _bytesRead = _scanner.getBytesRead();
        _peakWindowSize = _scanner.getPeakWindowSize();
        _scanner.release();
        _scanner = null;

        if (LOG.isDebugEnabled())
            LOG.debug("Parsing Complete {}", this);
    }

    /**
     * @return the form fields by name, in the order of the body
     */
    public Map<String, MultiValue<String>> getForms()
    {
        return Collections.unmodifiableMap(_forms);
    }

    /**
     * @return the file parts by name, in the order of the body
     */
    public Map<String, MultiValue<FilePart>> getFiles()
    {
        return Collections.unmodifiableMap(_files);
    }

    /**
     * @return an EnumSet of non compliances with the RFC that were accepted by this parser
     */
    public EnumSet<NonCompliance> getNonComplianceWarnings()
    {
        return _nonComplianceWarnings;
    }

    public long getBytesRead()
    {
        return _scanner == null ? _bytesRead : _scanner.getBytesRead();
    }

    /**
     * @return the largest window of the body held in memory at once
     */
    public int getPeakWindowSize()
    {
        return _scanner == null ? _peakWindowSize : _scanner.getPeakWindowSize();
    }

    /**
     * @return the temporary files of this parse, until it is closed
     */
    public TempFileRegistry getTempFileRegistry()
    {
        return _registry;
    }

    public synchronized boolean isClosed()
    {
        return _closed;
    }

    /**
     * Close the channels and delete the temporary files of every file part, and
     * forget all parsed values. Calls after the first do nothing.
     *
     * @throws RuntimeException if a temporary file could not be deleted, after every file has been attempted
     */
    @Override
    public void close()
    {
        synchronized (this)
        {
            if (_closed)
                return;
            _closed = true;
        }

        if (LOG.isDebugEnabled())
            LOG.debug("Closing {}", this);
        try
        {
            _cleanup.closed();
            _cleanable.clean();
        }
        finally
        {
            _forms.clear();
            _files.clear();
            if (_scanner != null)
            {
                _bytesRead = _scanner.getBytesRead();
                _peakWindowSize = _scanner.getPeakWindowSize();
                _scanner.release();
                _scanner = null;
            }
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{forms=%s,files=%s,closed=%b}", getClass().getSimpleName(), hashCode(), _forms.keySet(), _files.keySet(), _closed);
    }

    /**
     * Deletes the temporary files, whether explicitly closed or reclaimed.
     * Holds no reference to the {@link MultiPartFormData}, so that it can become unreachable.
     */
    private static class Cleanup implements Runnable
    {
        private final TempFileRegistry _registry;
        private volatile boolean _closed;

        private Cleanup(TempFileRegistry registry)
        {
            _registry = registry;
        }

        private void closed()
        {
            _closed = true;
        }

        @Override
        public void run()
        {
            if (!_closed)
                LOG.warn("MultiPartFormData was not closed, deleting {} temp files", _registry.getFiles().size());
            _registry.close();
        }

        @Override
        public String toString()
        {
            return String.format("Cleanup{%s}", _registry);
        }
    }
}
