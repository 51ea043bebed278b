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

import java.util.HashMap;
import java.util.Map;

public enum HttpVersion
{
    HTTP_1_0("HTTP/1.0"),
    HTTP_1_1("HTTP/1.1"),
    HTTP_2("HTTP/2.0");

    private static final Map<String, HttpVersion> CACHE = new HashMap<>();

    static
    {
        for (HttpVersion version : HttpVersion.values())
        {
            CACHE.put(version.asString(), version);
            CACHE.put(version.getProtocolVersion(), version);
        }
        CACHE.put("HTTP/2", HTTP_2);
        CACHE.put("2", HTTP_2);
    }

    /**
     * @param version a version as {@code HTTP/1.1} or as the bare {@code 1.1}
     * @return the matching version
     * @throws IllegalArgumentException if the version is unknown
     */
    public static HttpVersion fromString(String version)
    {
        HttpVersion v = version == null ? null : CACHE.get(version.trim());
        if (v == null)
            throw new IllegalArgumentException("Unknown HTTP version: " + version);
        return v;
    }

    private final String _string;

    HttpVersion(String s)
    {
        _string = s;
    }

    public String asString()
    {
        return _string;
    }

    /**
     * @return the version without the protocol name, e.g. {@code 1.1}
     */
    public String getProtocolVersion()
    {
        return _string.substring(_string.indexOf('/') + 1);
    }

    @Override
    public String toString()
    {
        return _string;
    }
}
