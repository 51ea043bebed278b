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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.urikit.util.StringUtil;

/**
 * An HTTP field: a case insensitive name with an ordered list of values.
 * Names must be <a href="https://tools.ietf.org/html/rfc7230#section-3.2.6">RFC 7230 tokens</a>
 * and values are trimmed of leading and trailing spaces and tabs.
 */
public final class HttpField
{
    private static final String __tchar = "!#$%&'*+-.^_`|~";

    private final HttpHeader _header;
    private final String _name;
    private final List<String> _values;

    public HttpField(HttpHeader header, String... values)
    {
        this(header, header.asString(), List.of(values));
    }

    public HttpField(String name, String... values)
    {
        this(HttpHeader.lookup(name), name, List.of(values));
    }

    public HttpField(String name, List<String> values)
    {
        this(HttpHeader.lookup(name), name, values);
    }

    private HttpField(HttpHeader header, String name, List<String> values)
    {
        if (!isToken(name))
            throw new IllegalArgumentException("Invalid field name: " + name);
        if (values.isEmpty())
            throw new IllegalArgumentException("Field " + name + " must have at least one value");
        List<String> trimmed = new ArrayList<>(values.size());
        for (String value : values)
        {
            trimmed.add(filterValue(name, value));
        }
        _header = header;
        _name = name;
        _values = Collections.unmodifiableList(trimmed);
    }

    /**
     * @param name the candidate name
     * @return true if the name is a non empty sequence of token characters
     */
    public static boolean isToken(String name)
    {
        if (StringUtil.isEmpty(name))
            return false;
        for (int i = 0; i < name.length(); i++)
        {
            char c = name.charAt(i);
            boolean tchar = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || __tchar.indexOf(c) >= 0;
            if (!tchar)
                return false;
        }
        return true;
    }

    private static String filterValue(String name, String value)
    {
        Objects.requireNonNull(value, name);
        for (int i = 0; i < value.length(); i++)
        {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n' || c == 0)
                throw new IllegalArgumentException("Invalid value for field " + name);
        }
        return StringUtil.trimSpaceAndTab(value);
    }

    /**
     * @return the known header of this field, or null
     */
    public HttpHeader getHeader()
    {
        return _header;
    }

    public String getName()
    {
        return _name;
    }

    public String getLowerCaseName()
    {
        return _header != null ? _header.lowerCaseName() : StringUtil.asciiToLowerCase(_name);
    }

    /**
     * @return the values joined with {@code ", "}
     */
    public String getValue()
    {
        return String.join(", ", _values);
    }

    /**
     * @return the immutable list of values
     */
    public List<String> getValues()
    {
        return _values;
    }

    public boolean is(String name)
    {
        return _name.equalsIgnoreCase(name);
    }

    public boolean is(HttpHeader header)
    {
        return _header == header || header.is(_name);
    }

    /**
     * @param values the values to append
     * @return a field with the same name and the values of this field followed by the passed values
     */
    public HttpField withAddedValues(List<String> values)
    {
        List<String> all = new ArrayList<>(_values);
        all.addAll(values);
        return new HttpField(_header, _name, all);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof HttpField))
            return false;
        HttpField field = (HttpField)o;
        return is(field.getName()) && _values.equals(field.getValues());
    }

    @Override
    public int hashCode()
    {
        return getLowerCaseName().hashCode() ^ _values.hashCode();
    }

    @Override
    public String toString()
    {
        return _name + ": " + getValue();
    }
}
