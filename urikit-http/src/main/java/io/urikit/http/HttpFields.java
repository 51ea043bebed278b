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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import io.urikit.util.StringUtil;

/**
 * Immutable ordered collection of {@link HttpField}s with case insensitive names.
 * <p>
 * Use {@link #build()} to obtain a {@link Mutable} instance, and {@link Mutable#asImmutable()}
 * to freeze it.
 * </p>
 */
public final class HttpFields implements Iterable<HttpField>
{
    public static final HttpFields EMPTY = new HttpFields(Collections.emptyList());

    private final List<HttpField> _fields;
    private final Map<String, Integer> _index;

    private HttpFields(List<HttpField> fields)
    {
        _fields = Collections.unmodifiableList(new ArrayList<>(fields));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < _fields.size(); i++)
        {
            index.put(_fields.get(i).getLowerCaseName(), i);
        }
        _index = index;
    }

    public static Mutable build()
    {
        return new Mutable();
    }

    /**
     * @param fields the fields to start from
     * @return a {@link Mutable} instance holding a copy of the fields
     */
    public static Mutable build(HttpFields fields)
    {
        Mutable mutable = new Mutable();
        for (HttpField field : fields)
        {
            mutable.add(field);
        }
        return mutable;
    }

    public static HttpFields from(HttpField... fields)
    {
        Mutable mutable = new Mutable();
        for (HttpField field : fields)
        {
            mutable.add(field);
        }
        return mutable.asImmutable();
    }

    /**
     * @param name the field name, in any case
     * @return the field, or null
     */
    public HttpField getField(String name)
    {
        if (name == null)
            return null;
        Integer i = _index.get(StringUtil.asciiToLowerCase(name));
        return i == null ? null : _fields.get(i);
    }

    public HttpField getField(HttpHeader header)
    {
        return getField(header.asString());
    }

    /**
     * @param name the field name, in any case
     * @return the values joined with {@code ", "}, or null if there is no such field
     */
    public String get(String name)
    {
        HttpField field = getField(name);
        return field == null ? null : field.getValue();
    }

    public String get(HttpHeader header)
    {
        return get(header.asString());
    }

    /**
     * @param name the field name, in any case
     * @return the immutable list of values, empty if there is no such field
     */
    public List<String> getValuesList(String name)
    {
        HttpField field = getField(name);
        return field == null ? Collections.emptyList() : field.getValues();
    }

    public boolean contains(String name)
    {
        return getField(name) != null;
    }

    public boolean contains(HttpHeader header)
    {
        return getField(header) != null;
    }

    public int size()
    {
        return _fields.size();
    }

    public Stream<HttpField> stream()
    {
        return _fields.stream();
    }

    @Override
    public Iterator<HttpField> iterator()
    {
        return _fields.iterator();
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof HttpFields))
            return false;
        return _fields.equals(((HttpFields)o)._fields);
    }

    @Override
    public int hashCode()
    {
        return _fields.hashCode();
    }

    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder();
        for (HttpField field : _fields)
        {
            buffer.append(field).append("\r\n");
        }
        buffer.append("\r\n");
        return buffer.toString();
    }

    /**
     * Mutable ordered collection of {@link HttpField}s, holding at most one field per case insensitive name.
     */
    public static final class Mutable implements Iterable<HttpField>
    {
        private final List<HttpField> _fields = new ArrayList<>();

        private Mutable()
        {
        }

        private int indexOf(String name)
        {
            for (int i = 0; i < _fields.size(); i++)
            {
                if (_fields.get(i).is(name))
                    return i;
            }
            return -1;
        }

        /**
         * Set a field, replacing an existing field of the same name in place.
         *
         * @param field the field
         * @return this builder
         */
        public Mutable put(HttpField field)
        {
            int i = indexOf(field.getName());
            if (i < 0)
                _fields.add(field);
            else
                _fields.set(i, field);
            return this;
        }

        public Mutable put(String name, String... values)
        {
            return put(new HttpField(name, values));
        }

        public Mutable put(String name, List<String> values)
        {
            return put(new HttpField(name, values));
        }

        public Mutable put(HttpHeader header, String... values)
        {
            return put(new HttpField(header, values));
        }

        /**
         * Set a field as the first field, removing an existing field of the same name.
         *
         * @param field the field
         * @return this builder
         */
        public Mutable putFirst(HttpField field)
        {
            remove(field.getName());
            _fields.add(0, field);
            return this;
        }

        /**
         * Add a field, appending its values to an existing field of the same name.
         *
         * @param field the field
         * @return this builder
         */
        public Mutable add(HttpField field)
        {
            int i = indexOf(field.getName());
            if (i < 0)
                _fields.add(field);
            else
                _fields.set(i, _fields.get(i).withAddedValues(field.getValues()));
            return this;
        }

        public Mutable add(String name, String... values)
        {
            return add(new HttpField(name, values));
        }

        public Mutable add(String name, List<String> values)
        {
            return add(new HttpField(name, values));
        }

        /**
         * @param name the field name, in any case
         * @return the removed field, or null
         */
        public HttpField remove(String name)
        {
            int i = indexOf(name);
            return i < 0 ? null : _fields.remove(i);
        }

        public HttpField getField(String name)
        {
            int i = indexOf(name);
            return i < 0 ? null : _fields.get(i);
        }

        public boolean contains(String name)
        {
            return indexOf(name) >= 0;
        }

        public int size()
        {
            return _fields.size();
        }

        @Override
        public Iterator<HttpField> iterator()
        {
            return Collections.unmodifiableList(_fields).iterator();
        }

        public HttpFields asImmutable()
        {
            if (_fields.isEmpty())
                return EMPTY;
            return new HttpFields(_fields);
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), _fields);
        }
    }
}
