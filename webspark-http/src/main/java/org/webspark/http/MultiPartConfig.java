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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Properties;

/**
 * <p>Limits and settings of a multipart/form-data parse.</p>
 * <p>A single instance may be shared by many parses, as long as it is not
 * modified while they run. Every setter validates its argument and throws
 * {@link IllegalArgumentException} for a value that cannot work.</p>
 */
public class MultiPartConfig
{
    public static final String PREFIX = "webspark.multipart.";
    public static final String MAX_BODY_SIZE = PREFIX + "maxBodySize";
    public static final String CHUNK_SIZE = PREFIX + "chunkSize";
    public static final String CHARSET = PREFIX + "charset";
    public static final String ENCODING_ERRORS = PREFIX + "encodingErrors";
    public static final String MAX_PART_HEADER_SIZE = PREFIX + "maxPartHeaderSize";
    public static final String TEMP_DIRECTORY = PREFIX + "tempDirectory";
    public static final String TEMP_FILE_PREFIX = PREFIX + "tempFilePrefix";
    public static final String TEMP_FILE_SUFFIX = PREFIX + "tempFileSuffix";

    private long _maxBodySize = 2 * 1024 * 1024;
    private int _chunkSize = 4096;
    private Charset _charset = StandardCharsets.UTF_8;
    private EncodingErrors _encodingErrors = EncodingErrors.STRICT;
    private int _maxPartHeaderSize = 16 * 1024;
    private Path _tempDirectory = Paths.get(System.getProperty("java.io.tmpdir"));
    private String _tempFilePrefix = "webspark-";
    private String _tempFileSuffix = ".tmp";

    public MultiPartConfig()
    {
    }

    /**
     * Create a configuration from another.
     *
     * @param config The configuration to copy.
     */
    public MultiPartConfig(MultiPartConfig config)
    {
        _maxBodySize = config._maxBodySize;
        _chunkSize = config._chunkSize;
        _charset = config._charset;
        _encodingErrors = config._encodingErrors;
        _maxPartHeaderSize = config._maxPartHeaderSize;
        _tempDirectory = config._tempDirectory;
        _tempFilePrefix = config._tempFilePrefix;
        _tempFileSuffix = config._tempFileSuffix;
    }

    /**
     * Create a configuration from {@code webspark.multipart.*} properties.
     * Settings without a property keep their default.
     *
     * @param properties the properties to read
     * @return a new configuration
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public static MultiPartConfig from(Properties properties)
    {
        MultiPartConfig config = new MultiPartConfig();
        String value = properties.getProperty(MAX_BODY_SIZE);
        if (value != null)
            config.setMaxBodySize(parseLong(MAX_BODY_SIZE, value));
        value = properties.getProperty(CHUNK_SIZE);
        if (value != null)
            config.setChunkSize(parseInt(CHUNK_SIZE, value));
        value = properties.getProperty(CHARSET);
        if (value != null)
            config.setCharset(Charset.forName(value.trim()));
        value = properties.getProperty(ENCODING_ERRORS);
        if (value != null)
            config.setEncodingErrors(EncodingErrors.from(value));
        value = properties.getProperty(MAX_PART_HEADER_SIZE);
        if (value != null)
            config.setMaxPartHeaderSize(parseInt(MAX_PART_HEADER_SIZE, value));
        value = properties.getProperty(TEMP_DIRECTORY);
        if (value != null)
            config.setTempDirectory(Paths.get(value.trim()));
        value = properties.getProperty(TEMP_FILE_PREFIX);
        if (value != null)
            config.setTempFilePrefix(value);
        value = properties.getProperty(TEMP_FILE_SUFFIX);
        if (value != null)
            config.setTempFileSuffix(value);
        return config;
    }

    private static long parseLong(String key, String value)
    {
        try
        {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException x)
        {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, x);
        }
    }

    private static int parseInt(String key, String value)
    {
        try
        {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException x)
        {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, x);
        }
    }

    /**
     * @return the largest body, in bytes, that will be read
     */
    public long getMaxBodySize()
    {
        return _maxBodySize;
    }

    public void setMaxBodySize(long maxBodySize)
    {
        if (maxBodySize <= 0)
            throw new IllegalArgumentException("Invalid max body size: " + maxBodySize);
        _maxBodySize = maxBodySize;
    }

    /**
     * @return the largest number of bytes requested from the stream by a single read
     */
    public int getChunkSize()
    {
        return _chunkSize;
    }

    public void setChunkSize(int chunkSize)
    {
        if (chunkSize <= 0)
            throw new IllegalArgumentException("Invalid chunk size: " + chunkSize);
        _chunkSize = chunkSize;
    }

    /**
     * @return the charset of field values and part headers, unless the request names one
     */
    public Charset getCharset()
    {
        return _charset;
    }

    public void setCharset(Charset charset)
    {
        _charset = Objects.requireNonNull(charset, "charset");
    }

    public EncodingErrors getEncodingErrors()
    {
        return _encodingErrors;
    }

    public void setEncodingErrors(EncodingErrors encodingErrors)
    {
        _encodingErrors = Objects.requireNonNull(encodingErrors, "encodingErrors");
    }

    /**
     * @return the largest header block, in bytes, accepted for a single part
     */
    public int getMaxPartHeaderSize()
    {
        return _maxPartHeaderSize;
    }

    public void setMaxPartHeaderSize(int maxPartHeaderSize)
    {
        if (maxPartHeaderSize <= 0)
            throw new IllegalArgumentException("Invalid max part header size: " + maxPartHeaderSize);
        _maxPartHeaderSize = maxPartHeaderSize;
    }

    public Path getTempDirectory()
    {
        return _tempDirectory;
    }

    public void setTempDirectory(Path tempDirectory)
    {
        _tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
    }

    public String getTempFilePrefix()
    {
        return _tempFilePrefix;
    }

    public void setTempFilePrefix(String tempFilePrefix)
    {
        _tempFilePrefix = Objects.requireNonNull(tempFilePrefix, "tempFilePrefix");
    }

    public String getTempFileSuffix()
    {
        return _tempFileSuffix;
    }

    public void setTempFileSuffix(String tempFileSuffix)
    {
        _tempFileSuffix = Objects.requireNonNull(tempFileSuffix, "tempFileSuffix");
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{max=%d,chunk=%d,charset=%s,errors=%s,maxHeader=%d,tmp=%s}",
            getClass().getSimpleName(), hashCode(), _maxBodySize, _chunkSize, _charset, _encodingErrors,
            _maxPartHeaderSize, _tempDirectory);
    }
}
