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
 * Thrown when a single URI component is invalid, such as a port outside of 1-65535.
 */
public class InvalidUriComponentException extends UriException
{
    public InvalidUriComponentException(String reason)
    {
        super(reason);
    }
}
