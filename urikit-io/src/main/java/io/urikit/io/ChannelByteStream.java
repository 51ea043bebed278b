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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link ByteStream} over a {@link SeekableByteChannel}, typically an open file.</p>
 * <p>The stream owns the channel: {@link #close()} closes it, while {@link #detach()}
 * hands it back to the caller without closing it.</p>
 */
public class ChannelByteStream implements ByteStream
{
    private static final Logger LOG = LoggerFactory.getLogger(ChannelByteStream.class);
    private static final int BUFFER_SIZE = 8192;

    private final boolean _readable;
    private final boolean _writable;
    private final Map<String, Object> _metadata;
    private SeekableByteChannel _channel;

    public ChannelByteStream(SeekableByteChannel channel, boolean readable, boolean writable)
    {
        this(channel, readable, writable, null);
    }

    public ChannelByteStream(SeekableByteChannel channel, boolean readable, boolean writable, String uri)
    {
        _channel = Objects.requireNonNull(channel);
        _readable = readable;
        _writable = writable;
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (uri != null)
            metadata.put("uri", uri);
        metadata.put("mode", readable ? (writable ? "r+" : "r") : "w");
        metadata.put("seekable", Boolean.TRUE);
        _metadata = Collections.unmodifiableMap(metadata);
    }

    /**
     * Open a file as a stream.
     *
     * @param path the file to open
     * @param options the options, as for {@link Files#newByteChannel(Path, OpenOption...)}
     * @return the stream positioned at the start of the file
     * @throws IOException if the file cannot be opened
     */
    public static ChannelByteStream open(Path path, OpenOption... options) throws IOException
    {
        Set<OpenOption> set = new HashSet<>(Arrays.asList(options));
        boolean writable = set.contains(StandardOpenOption.WRITE) || set.contains(StandardOpenOption.APPEND);
        boolean readable = set.contains(StandardOpenOption.READ) || !writable;
        if (readable && writable)
            set.add(StandardOpenOption.READ);
        SeekableByteChannel channel = Files.newByteChannel(path, set);
        if (LOG.isDebugEnabled())
            LOG.debug("opened {} with {}", path, set);
        return new ChannelByteStream(channel, readable, writable, path.toString());
    }

    @Override
    public byte[] read(int maxBytes) throws IOException
    {
        SeekableByteChannel channel = checkOpen();
        if (!_readable)
            throw new IOException("Cannot read from non-readable stream");
        if (maxBytes < 0)
            throw new IllegalArgumentException("Length parameter cannot be negative");

        ByteBuffer buffer = ByteBuffer.allocate(maxBytes);
        while (buffer.hasRemaining())
        {
            if (channel.read(buffer) < 0)
                break;
        }
        buffer.flip();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    @Override
    public int write(byte[] bytes) throws IOException
    {
        SeekableByteChannel channel = checkOpen();
        if (!_writable)
            throw new IOException("Cannot write to a non-writable stream");

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        int written = 0;
        while (buffer.hasRemaining())
        {
            written += channel.write(buffer);
        }
        return written;
    }

    @Override
    public void seek(long offset, Whence whence) throws IOException
    {
        SeekableByteChannel channel = checkOpen();
        long position;
        switch (whence)
        {
            case SET:
                position = offset;
                break;
            case CURRENT:
                position = channel.position() + offset;
                break;
            case END:
                position = channel.size() + offset;
                break;
            default:
                throw new IllegalStateException(whence.toString());
        }
        if (position < 0)
            throw new IOException(String.format("Unable to seek to stream position %d with whence %s", offset, whence));
        channel.position(position);
    }

    @Override
    public long tell() throws IOException
    {
        return checkOpen().position();
    }

    @Override
    public boolean eof()
    {
        if (_channel == null)
            return true;
        try
        {
            return _channel.position() >= _channel.size();
        }
        catch (IOException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Unable to determine eof of {}", this, x);
            return true;
        }
    }

    @Override
    public boolean isReadable()
    {
        return _channel != null && _readable;
    }

    @Override
    public boolean isWritable()
    {
        return _channel != null && _writable;
    }

    @Override
    public boolean isSeekable()
    {
        return _channel != null;
    }

    @Override
    public long getSize()
    {
        if (_channel == null)
            return -1;
        try
        {
            return _channel.size();
        }
        catch (IOException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Unable to determine size of {}", this, x);
            return -1;
        }
    }

    @Override
    public Map<String, Object> getMetadata()
    {
        return _channel == null ? Collections.emptyMap() : _metadata;
    }

    @Override
    public byte[] getContents() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (true)
        {
            byte[] bytes = read(BUFFER_SIZE);
            if (bytes.length == 0)
                break;
            out.write(bytes);
        }
        return out.toByteArray();
    }

    /**
     * @return the {@link SeekableByteChannel}, or null if already detached or closed
     */
    @Override
    public SeekableByteChannel detach()
    {
        SeekableByteChannel channel = _channel;
        _channel = null;
        return channel;
    }

    @Override
    public void close()
    {
        SeekableByteChannel channel = detach();
        if (channel == null)
            return;
        try
        {
            channel.close();
        }
        catch (IOException x)
        {
            LOG.warn("Unable to close {}", channel, x);
        }
    }

    private SeekableByteChannel checkOpen() throws StreamClosedException
    {
        SeekableByteChannel channel = _channel;
        if (channel == null)
            throw new StreamClosedException();
        return channel;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,r=%b,w=%b}", getClass().getSimpleName(), hashCode(), _metadata.get("uri"), _readable, _writable);
    }
}
