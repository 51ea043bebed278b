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

/**
 * URI schemes with well known default ports.
 */
public enum HttpScheme
{
    HTTP("http", 80),
    HTTPS("https", 443),
    WS("ws", 80),
    WSS("wss", 443);

    private static final Map<String, Integer> DEFAULT_PORTS = new HashMap<>();

    static
    {
        for (HttpScheme scheme : HttpScheme.values())
        {
            DEFAULT_PORTS.put(scheme.asString(), scheme.getDefaultPort());
        }
        DEFAULT_PORTS.put("ftp", 21);
        DEFAULT_PORTS.put("gopher", 70);
        DEFAULT_PORTS.put("nntp", 119);
        DEFAULT_PORTS.put("news", 119);
        DEFAULT_PORTS.put("telnet", 23);
        DEFAULT_PORTS.put("tn3270", 23);
        DEFAULT_PORTS.put("imap", 143);
        DEFAULT_PORTS.put("pop", 110);
        DEFAULT_PORTS.put("ldap", 389);
    }

    private final String _string;
    private final int _defaultPort;

    HttpScheme(String s, int port)
    {
        _string = s;
        _defaultPort = port;
    }

    /**
     * @param scheme a scheme, in any case
     * @return the default port of the scheme, or 0 if the scheme has no known default port
     */
    public static int getDefaultPort(String scheme)
    {
        if (scheme == null)
            return 0;
        Integer port = DEFAULT_PORTS.get(StringUtil.asciiToLowerCase(scheme));
        return port == null ? 0 : port;
    }

    public boolean is(String s)
    {
        return _string.equalsIgnoreCase(s);
    }

    public String asString()
    {
        return _string;
    }

    public int getDefaultPort()
    {
        return _defaultPort;
    }

    @Override
    public String toString()
    {
        return _string;
    }
}
