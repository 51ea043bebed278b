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
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChannelByteStreamTest
{
    @TempDir
    public Path workDir;

    @Test
    public void testReadFile() throws Exception
    {
        Path file = workDir.resolve("body.txt");
        Files.write(file, "file content".getBytes(StandardCharsets.UTF_8));

        try (ChannelByteStream stream = ChannelByteStream.open(file))
        {
            assertTrue(stream.isReadable());
            assertFalse(stream.isWritable());
            assertTrue(stream.isSeekable());
            assertThat(stream.getSize(), is(12L));
            assertThat(stream.getMetadata("uri"), is(file.toString()));
            assertThat(stream.getMetadata("mode"), is("r"));

            assertThat(new String(stream.read(4), StandardCharsets.UTF_8), is("file"));
            stream.seek(1, ByteStream.Whence.CURRENT);
            assertThat(new String(stream.getContents(), StandardCharsets.UTF_8), is("content"));
            assertTrue(stream.eof());
            assertThat(stream.read(8).length, is(0));

            assertThat(stream.asString(), is("file content"));
            assertThrows(IOException.class, () -> stream.write(new byte[1]));
        }
    }

    @Test
    public void testWriteFile() throws Exception
    {
        Path file = workDir.resolve("out.txt");
        try (ChannelByteStream stream = ChannelByteStream.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE))
        {
            assertTrue(stream.isWritable());
            assertTrue(stream.isReadable());
            assertThat(stream.getMetadata("mode"), is("r+"));
            assertThat(stream.write("written".getBytes(StandardCharsets.UTF_8)), is(7));
            assertThat(stream.tell(), is(7L));
            stream.seek(-3, ByteStream.Whence.END);
            assertThat(new String(stream.getContents(), StandardCharsets.UTF_8), is("ten"));
        }
        assertThat(Files.readString(file), is("written"));
    }

    @Test
    public void testDetachLeavesChannelOpen() throws Exception
    {
        Path file = workDir.resolve("detach.txt");
        Files.write(file, "x".getBytes(StandardCharsets.UTF_8));

        ChannelByteStream stream = ChannelByteStream.open(file);
        SeekableByteChannel channel = stream.detach();
        assertThat(channel, notNullValue());
        assertTrue(channel.isOpen());
        assertThat(stream.detach(), nullValue());
        assertFalse(stream.isReadable());
        assertTrue(stream.eof());
        assertThat(stream.getSize(), is(-1L));
        assertThrows(StreamClosedException.class, () -> stream.read(1));
        channel.close();
    }

    @Test
    public void testCloseClosesChannel() throws Exception
    {
        Path file = workDir.resolve("close.txt");
        Files.write(file, "x".getBytes(StandardCharsets.UTF_8));

        SeekableByteChannel channel = Files.newByteChannel(file);
        ChannelByteStream stream = new ChannelByteStream(channel, true, false);
        stream.close();
        assertFalse(channel.isOpen());
        assertTrue(stream.getMetadata().isEmpty());
        assertThrows(StreamClosedException.class, stream::tell);
    }

    @Test
    public void testInvalidSeek() throws Exception
    {
        Path file = workDir.resolve("seek.txt");
        Files.write(file, "abc".getBytes(StandardCharsets.UTF_8));
        try (ChannelByteStream stream = ChannelByteStream.open(file))
        {
            assertThrows(IOException.class, () -> stream.seek(-10, ByteStream.Whence.END));
        }
    }
}
