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

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * <p>A readable, writable and possibly seekable source of bytes, used to hold
 * the body of a message.</p>
 * <p>Implementations are not thread safe. Once {@link #close() closed} or
 * {@link #detach() detached} every I/O operation fails with a
 * {@link StreamClosedException}.</p>
 */
public interface ByteStream extends Closeable
{
    /**
     * The reference point of a {@link #seek(long, Whence)}.
     */
    enum Whence
    {
        /**
         * Offset from the start of the stream.
         */
        SET,
        /**
         * Offset from the current position.
         */
        CURRENT,
        /**
         * Offset from the end of the stream.
         */
        END
    }

    /**
     * Read up to {@code maxBytes} bytes from the current position.
     *
     * @param maxBytes the maximum number of bytes to read
     * @return the bytes read, an empty array at the end of the stream
     * @throws IOException if the stream is not readable or the read fails
     */
    byte[] read(int maxBytes) throws IOException;

    /**
     * Write bytes at the current position.
     *
     * @param bytes the bytes to write
     * @return the number of bytes written
     * @throws IOException if the stream is not writable or the write fails
     */
    int write(byte[] bytes) throws IOException;

    /**
     * Move the current position.
     *
     * @param offset the offset relative to {@code whence}
     * @param whence the reference point of the offset
     * @throws IOException if the stream is not seekable or the resulting position is invalid
     */
    void seek(long offset, Whence whence) throws IOException;

    /**
     * Seek to the start of the stream.
     *
     * @throws IOException if the stream is not seekable
     */
    default void rewind() throws IOException
    {
        seek(0, Whence.SET);
    }

    /**
     * @return the current position
     * @throws IOException if the position cannot be determined
     */
    long tell() throws IOException;

    /**
     * @return true if the current position is at the end of the stream, or if the stream is closed
     */
    boolean eof();

    boolean isReadable();

    boolean isWritable();

    boolean isSeekable();

    /**
     * @return the size of the stream in bytes, or -1 if unknown
     */
    long getSize();

    /**
     * @return an immutable view of the metadata of the stream, empty once closed
     */
    Map<String, Object> getMetadata();

    /**
     * @param key the metadata key
     * @return the metadata value or null
     */
    default Object getMetadata(String key)
    {
        return getMetadata().get(key);
    }

    /**
     * Read all the remaining bytes from the current position.
     *
     * @return the remaining bytes
     * @throws IOException if the stream cannot be read
     */
    byte[] getContents() throws IOException;

    /**
     * Read the whole stream as a UTF-8 string, seeking to the start first when the stream is seekable.
     *
     * @return the content of the stream
     * @throws IOException if the stream cannot be read
     */
    default String asString() throws IOException
    {
        if (isSeekable())
            rewind();
        return new String(getContents(), StandardCharsets.UTF_8);
    }

    /**
     * Separate the underlying resource from this stream.
     * The stream is unusable afterwards; the caller owns the returned resource.
     *
     * @return the underlying resource, or null if already detached or closed
     */
    Object detach();

    /**
     * Close the stream and release the underlying resource. Closing twice has no effect.
     */
    @Override
    void close();
}
