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

package io.urikit.http;

/**
 * Thrown when a URI string cannot be parsed.
 */
public class MalformedUriException extends UriException
{
    private final String _uri;

    public MalformedUriException(String uri, String reason)
    {
        this(uri, reason, null);
    }

    public MalformedUriException(String uri, String reason, Throwable cause)
    {
        super(String.format("Malformed URI \"%s\": %s", uri, reason), cause);
        _uri = uri;
    }

    /**
     * @return the string that failed to parse
     */
    public String getUri()
    {
        return _uri;
    }
}
