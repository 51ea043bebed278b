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

package io.urikit.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link ByteStream} held in memory.</p>
 * <p>The stream is readable, writable and seekable. Writing after seeking
 * beyond the end fills the gap with zero bytes.</p>
 */
public class ByteArrayStream implements ByteStream
{
    private static final Logger LOG = LoggerFactory.getLogger(ByteArrayStream.class);
    private static final byte[] NO_BYTES = new byte[0];

    private final Map<String, Object> _metadata;
    private byte[] _buffer;
    private int _size;
    private int _position;
    private boolean _closed;

    public ByteArrayStream()
    {
        this(NO_BYTES);
    }

    public ByteArrayStream(byte[] content)
    {
        _buffer = Arrays.copyOf(content, Math.max(16, content.length));
        _size = content.length;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("uri", "memory");
        metadata.put("mode", "r+");
        metadata.put("seekable", Boolean.TRUE);
        _metadata = Collections.unmodifiableMap(metadata);
    }

    /**
     * @param content the initial content, encoded as UTF-8
     * @return a stream positioned at the start of the content
     */
    public static ByteArrayStream of(String content)
    {
        return new ByteArrayStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] read(int maxBytes) throws IOException
    {
        checkOpen();
        if (maxBytes < 0)
            throw new IllegalArgumentException("Length parameter cannot be negative");
        int length = Math.max(0, Math.min(maxBytes, _size - _position));
        if (length == 0)
            return NO_BYTES;
        byte[] bytes = Arrays.copyOfRange(_buffer, _position, _position + length);
        _position += length;
        return bytes;
    }

    @Override
    public int write(byte[] bytes) throws IOException
    {
        checkOpen();
        int end = _position + bytes.length;
        if (end > _buffer.length)
            _buffer = Arrays.copyOf(_buffer, Math.max(end, _buffer.length * 2));
        System.arraycopy(bytes, 0, _buffer, _position, bytes.length);
        _position = end;
        _size = Math.max(_size, end);
        return bytes.length;
    }

    @Override
    public void seek(long offset, Whence whence) throws IOException
    {
        checkOpen();
        long position;
        switch (whence)
        {
            case SET:
                position = offset;
                break;
            case CURRENT:
                position = _position + offset;
                break;
            case END:
                position = _size + offset;
                break;
            default:
                throw new IllegalStateException(whence.toString());
        }
        if (position < 0 || position > Integer.MAX_VALUE - 8)
            throw new IOException(String.format("Unable to seek to stream position %d with whence %s", offset, whence));
        _position = (int)position;
        if (LOG.isDebugEnabled())
            LOG.debug("seek {} {} -> {} on {}", offset, whence, _position, this);
    }

    @Override
    public long tell() throws IOException
    {
        checkOpen();
        return _position;
    }

    @Override
    public boolean eof()
    {
        return _closed || _position >= _size;
    }

    @Override
    public boolean isReadable()
    {
        return !_closed;
    }

    @Override
    public boolean isWritable()
    {
        return !_closed;
    }

    @Override
    public boolean isSeekable()
    {
        return !_closed;
    }

    @Override
    public long getSize()
    {
        return _closed ? -1 : _size;
    }

    @Override
    public Map<String, Object> getMetadata()
    {
        return _closed ? Collections.emptyMap() : _metadata;
    }

    @Override
    public byte[] getContents() throws IOException
    {
        checkOpen();
        return read(Math.max(0, _size - _position));
    }

    /**
     * @return a copy of the whole content, or null if already detached or closed
     */
    @Override
    public byte[] detach()
    {
        if (_closed)
            return null;
        byte[] content = Arrays.copyOf(_buffer, _size);
        close();
        return content;
    }

    @Override
    public void close()
    {
        _closed = true;
        _buffer = NO_BYTES;
        _size = 0;
        _position = 0;
    }

    private void checkOpen() throws StreamClosedException
    {
        if (_closed)
            throw new StreamClosedException();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{size=%d,position=%d,closed=%b}", getClass().getSimpleName(), hashCode(), _size, _position, _closed);
    }
}
