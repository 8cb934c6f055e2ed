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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Random;
import java.util.stream.Stream;
import java.util.zip.CRC32;

import org.eclipse.jetty.toolchain.test.jupiter.WorkDir;
import org.eclipse.jetty.toolchain.test.jupiter.WorkDirExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

@ExtendWith(WorkDirExtension.class)
public class MultiPartScannerTest
{
    public WorkDir workDir;

    /**
     * A body made of a head, a long run of generated content, and a tail, produced on demand.
     */
    private static class GeneratedBody extends InputStream
    {
        private final byte[] _head;
        private final long _contentLength;
        private final byte[] _tail;
        private final CRC32 _crc = new CRC32();
        private long _position;

        GeneratedBody(byte[] head, long contentLength, byte[] tail)
        {
            _head = head;
            _contentLength = contentLength;
            _tail = tail;
        }

        long length()
        {
            return _head.length + _contentLength + _tail.length;
        }

        static byte content(long index)
        {
            return (byte)('a' + (index % 26));
        }

        @Override
        public int read()
        {
            if (_position >= length())
                return -1;
            long p = _position++;
            if (p < _head.length)
                return _head[(int)p] & 0xff;
            p -= _head.length;
            if (p < _contentLength)
            {
                byte b = content(p);
                _crc.update(b);
                return b & 0xff;
            }
            return _tail[(int)(p - _contentLength)] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len)
        {
            if (_position >= length())
                return -1;
            int n = 0;
            while (n < len && _position < length())
            {
                b[off + n++] = (byte)read();
            }
            return n;
        }
    }

    private static class CountingSink implements PartSink
    {
        private final CRC32 _crc = new CRC32();
        private long _size;

        @Override
        public void write(byte[] bytes, int offset, int length)
        {
            _crc.update(bytes, offset, length);
            _size += length;
        }

        @Override
        public long getSize()
        {
            return _size;
        }
    }

    @Test
    public void testBoundedMemoryOnLargeBody() throws Exception
    {
        String boundary = "----WebSparkFormBoundary7MA4YWxkTrZu0gW";
        byte[] head = ("--" + boundary + "\r\n" +
            "Content-Disposition: form-data; name=\"upload\"; filename=\"big.bin\"\r\n" +
            "Content-Type: application/octet-stream\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] tail = ("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.US_ASCII);
        long contentLength = 16L * 1024 * 1024;
        GeneratedBody body = new GeneratedBody(head, contentLength, tail);

        MultiPartConfig config = new MultiPartConfig();
        config.setMaxBodySize(Long.MAX_VALUE);
        int chunk = config.getChunkSize();
        byte[] wire = ("--" + boundary).getBytes(StandardCharsets.US_ASCII);

        MultiPartScanner scanner = new MultiPartScanner(body, wire, body.length(), config);
        assertThat(scanner.start(), is(LineDelimiter.CRLF));
        assertThat(scanner.atClose(), is(false));
        PartHeaders headers = PartHeaders.parse(scanner.readHeaders(), LineDelimiter.CRLF, StandardCharsets.UTF_8, EncodingErrors.STRICT);
        assertThat(headers.getFilename(), is("big.bin"));

        CountingSink sink = new CountingSink();
        scanner.readBody(sink);
        assertThat(scanner.atClose(), is(true));

        assertThat(sink.getSize(), is(contentLength));
        assertThat(sink._crc.getValue(), is(body._crc.getValue()));
        assertThat(scanner.getBytesRead(), lessThanOrEqualTo(body.length()));
        assertThat(scanner.getPeakWindowSize(), lessThanOrEqualTo(2 * chunk + wire.length + 2));
    }

    @Test
    public void testBoundedMemorySpooledToFile() throws Exception
    {
        String boundary = "xYzZY";
        byte[] head = ("--" + boundary + "\r\n" +
            "Content-Disposition: form-data; name=\"note\"\r\n\r\n" +
            "small\r\n" +
            "--" + boundary + "\r\n" +
            "Content-Disposition: form-data; name=\"upload\"; filename=\"big.bin\"\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] tail = ("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.US_ASCII);
        long contentLength = 4L * 1024 * 1024;
        GeneratedBody body = new GeneratedBody(head, contentLength, tail);

        MultiPartConfig config = new MultiPartConfig();
        config.setMaxBodySize(16 * 1024 * 1024);
        config.setChunkSize(1024);
        config.setTempDirectory(workDir.getEmptyPathDir());

        try (MultiPartFormData formData = new MultiPartFormData(body, "multipart/form-data; boundary=" + boundary, body.length(), config))
        {
            formData.parse();
            assertThat(formData.getForms().get("note").getValue(), is("small"));
            FilePart part = formData.getFiles().get("upload").getValue();
            assertThat(part.getSize(), is(contentLength));

            CRC32 crc = new CRC32();
            FileChannel channel = part.getChannel();
            ByteBuffer buffer = ByteBuffer.allocate(8192);
            while (channel.read(buffer) >= 0)
            {
                buffer.flip();
                crc.update(buffer);
                buffer.clear();
            }
            assertThat(crc.getValue(), is(body._crc.getValue()));
            assertThat(formData.getPeakWindowSize(), lessThanOrEqualTo(2 * 1024 + boundary.length() + 4));
        }
    }

    public static Stream<Arguments> slidingWindowCases()
    {
        Stream.Builder<Arguments> cases = Stream.builder();
        for (int chunk : new int[]{1, 2, 3, 7, 64, 4096})
        {
            for (int boundaryLength : new int[]{1, 10, 70})
            {
                cases.add(Arguments.of(chunk, boundaryLength));
            }
        }
        return cases.build();
    }

    private static String boundary(int length)
    {
        String chars = "AbCdEfGhIjKlMnOpQrStUvWxZ0123456789";
        StringBuilder boundary = new StringBuilder();
        for (int i = 0; i < length; i++)
        {
            boundary.append(chars.charAt(i % chars.length()));
        }
        return boundary.toString();
    }

    /**
     * Content that no boundary line can match, but that holds near misses of
     * every length around a chunk edge: partial boundaries, stray delimiters and dashes.
     */
    private static byte[] trickyContent(String boundary, long seed) throws IOException
    {
        Random random = new Random(seed);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String nearMiss = "\r\n--" + boundary.substring(0, boundary.length() - 1) + "y";
        for (int i = 0; i < 20; i++)
        {
            int run = random.nextInt(40);
            for (int j = 0; j < run; j++)
            {
                int b = random.nextInt(256);
                out.write(b == '-' ? '+' : b);
            }
            switch (random.nextInt(5))
            {
                case 0:
                    out.write(nearMiss.getBytes(ISO_8859_1));
                    break;
                case 1:
                    out.write("\r\n\r\n".getBytes(ISO_8859_1));
                    break;
                case 2:
                    out.write("\r\n-".getBytes(ISO_8859_1));
                    break;
                case 3:
                    out.write('\r');
                    break;
                default:
                    out.write('\n');
                    break;
            }
        }
        out.write("\r\n".getBytes(ISO_8859_1));
        return out.toByteArray();
    }

    @ParameterizedTest
    @MethodSource("slidingWindowCases")
    public void testSlidingWindowPreservesContent(int chunk, int boundaryLength) throws Exception
    {
        Path dir = workDir.getEmptyPathDir();
        String boundary = boundary(boundaryLength);
        byte[] fieldContent = trickyContent(boundary, chunk * 1000L + boundaryLength);
        byte[] fileContent = trickyContent(boundary, chunk * 1000L + boundaryLength + 1);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(("--" + boundary + "\r\n" +
            "Content-Disposition: form-data; name=\"field\"\r\n\r\n").getBytes(ISO_8859_1));
        out.write(fieldContent);
        out.write(("\r\n--" + boundary + "\r\n" +
            "Content-Disposition: form-data; name=\"file\"; filename=\"tricky.bin\"\r\n\r\n").getBytes(ISO_8859_1));
        out.write(fileContent);
        out.write(("\r\n--" + boundary + "--\r\n").getBytes(ISO_8859_1));
        byte[] body = out.toByteArray();

        MultiPartConfig config = new MultiPartConfig();
        config.setChunkSize(chunk);
        config.setCharset(ISO_8859_1);
        config.setTempDirectory(dir);

        try (MultiPartFormData formData = new MultiPartFormData(new ByteArrayInputStream(body),
            "multipart/form-data; boundary=" + boundary, body.length, config))
        {
            formData.parse();
            assertThat(formData.getForms().get("field").getValue(), is(new String(fieldContent, ISO_8859_1)));
            FilePart part = formData.getFiles().get("file").getValue();
            assertThat(part.getSize(), is((long)fileContent.length));
            try (InputStream in = part.getInputStream())
            {
                assertArrayEquals(fileContent, in.readAllBytes());
            }
        }
    }
}
