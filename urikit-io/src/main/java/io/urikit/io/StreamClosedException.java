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

/**
 * Thrown by a {@link ByteStream} operation attempted after the stream was closed or detached.
 */
public class StreamClosedException extends IOException
{
    public StreamClosedException()
    {
        super("Stream is detached or closed");
    }

    public StreamClosedException(String reason)
    {
        super(reason);
    }
}
