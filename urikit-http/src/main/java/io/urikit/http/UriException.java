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
 * Base of the exceptions thrown while building or deriving a {@link HttpURI}.
 */
public abstract class UriException extends IllegalArgumentException
{
    private final String _reason;

    protected UriException(String reason)
    {
        this(reason, null);
    }

    protected UriException(String reason, Throwable cause)
    {
        super(reason, cause);
        _reason = reason;
    }

    public String getReason()
    {
        return _reason;
    }
}
