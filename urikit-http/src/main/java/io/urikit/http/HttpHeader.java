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

import io.urikit.util.StringUtil;

public enum HttpHeader
{
    /**
     * General Fields.
     */
    CACHE_CONTROL("Cache-Control"),
    CONNECTION("Connection"),
    DATE("Date"),

    /**
     * Entity Fields.
     */
    CONTENT_ENCODING("Content-Encoding"),
    CONTENT_LANGUAGE("Content-Language"),
    CONTENT_LENGTH("Content-Length"),
    CONTENT_TYPE("Content-Type"),

    /**
     * Request Fields.
     */
    ACCEPT("Accept"),
    ACCEPT_ENCODING("Accept-Encoding"),
    ACCEPT_LANGUAGE("Accept-Language"),
    AUTHORIZATION("Authorization"),
    FORWARDED("Forwarded"),
    HOST("Host"),
    REFERER("Referer"),
    USER_AGENT("User-Agent"),
    X_FORWARDED_FOR("X-Forwarded-For"),
    X_FORWARDED_HOST("X-Forwarded-Host"),
    X_FORWARDED_PROTO("X-Forwarded-Proto");

    private static final Map<String, HttpHeader> CACHE = new HashMap<>();

    static
    {
        for (HttpHeader header : HttpHeader.values())
        {
            CACHE.put(header.lowerCaseName(), header);
        }
    }

    /**
     * @param name a header name, in any case
     * @return the known header, or null
     */
    public static HttpHeader lookup(String name)
    {
        return name == null ? null : CACHE.get(StringUtil.asciiToLowerCase(name));
    }

    private final String _string;
    private final String _lowerCase;

    HttpHeader(String s)
    {
        _string = s;
        _lowerCase = StringUtil.asciiToLowerCase(s);
    }

    public String lowerCaseName()
    {
        return _lowerCase;
    }

    public boolean is(String s)
    {
        return _string.equalsIgnoreCase(s);
    }

    public String asString()
    {
        return _string;
    }

    @Override
    public String toString()
    {
        return _string;
    }
}
