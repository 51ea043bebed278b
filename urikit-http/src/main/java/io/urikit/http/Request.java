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

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import io.urikit.io.ByteArrayStream;
import io.urikit.io.ByteStream;
import io.urikit.util.StringUtil;
import io.urikit.util.URIUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable HTTP request message: a method, a {@link HttpURI}, a protocol version,
 * {@link HttpFields} and a {@link ByteStream} body.
 * <p>
 * The {@code Host} field is kept in step with the URI: it is derived from the URI on construction
 * when absent, and is set as the first field whenever the URI is replaced, unless the host is preserved.
 * Each {@code with*} method returns a new instance, or the same instance when nothing changes.
 * </p>
 */
public final class Request
{
    private static final Logger LOG = LoggerFactory.getLogger(Request.class);

    private final String _method;
    private final HttpURI _uri;
    private final HttpFields _fields;
    private final ByteStream _body;
    private final HttpVersion _version;
    private final String _requestTarget;

    public Request(String method, HttpURI uri)
    {
        this(method, uri, HttpFields.EMPTY, null, HttpVersion.HTTP_1_1);
    }

    /**
     * @param method the method
     * @param uri the URI string
     * @throws MalformedUriException if the URI cannot be parsed
     */
    public Request(String method, String uri)
    {
        this(method, HttpURI.parse(uri));
    }

    public Request(String method, String uri, HttpFields fields, ByteStream body, HttpVersion version)
    {
        this(method, HttpURI.parse(uri), fields, body, version);
    }

    /**
     * @param method the method, which is stored upper case
     * @param uri the URI
     * @param fields the fields, or null for none
     * @param body the body, or null for an empty in memory body
     * @param version the protocol version, or null for HTTP/1.1
     */
    public Request(String method, HttpURI uri, HttpFields fields, ByteStream body, HttpVersion version)
    {
        this(filterMethod(method),
            Objects.requireNonNull(uri),
            fields == null || !fields.contains(HttpHeader.HOST) ? updateHostFromUri(fields == null ? HttpFields.EMPTY : fields, uri) : fields,
            body == null ? new ByteArrayStream() : body,
            version == null ? HttpVersion.HTTP_1_1 : version,
            null);
    }

    private Request(String method, HttpURI uri, HttpFields fields, ByteStream body, HttpVersion version, String requestTarget)
    {
        _method = method;
        _uri = uri;
        _fields = fields;
        _body = body;
        _version = version;
        _requestTarget = requestTarget;
    }

    private static String filterMethod(String method)
    {
        if (StringUtil.isEmpty(method))
            throw new IllegalArgumentException("Method must be a non-empty string");
        if (!HttpField.isToken(method))
            throw new IllegalArgumentException("Invalid method: " + method);
        return method.toUpperCase(Locale.ROOT);
    }

    private static HttpFields updateHostFromUri(HttpFields fields, HttpURI uri)
    {
        String host = uri.getHost();
        if (host.isEmpty())
            return fields;
        if (uri.getPort() != null)
            host = host + ':' + uri.getPort();
        if (LOG.isDebugEnabled())
            LOG.debug("Host {} from {}", host, uri);
        return HttpFields.build(fields).putFirst(new HttpField(HttpHeader.HOST, host)).asImmutable();
    }

    public String getMethod()
    {
        return _method;
    }

    public boolean isMethod(HttpMethod method)
    {
        return method.is(_method);
    }

    public HttpURI getUri()
    {
        return _uri;
    }

    public HttpVersion getProtocolVersion()
    {
        return _version;
    }

    public HttpFields getFields()
    {
        return _fields;
    }

    public ByteStream getBody()
    {
        return _body;
    }

    /**
     * @return the request target set by {@link #withRequestTarget(String)}, or else the path of the URI
     * (or {@code /} if empty) followed by its query, if any
     */
    public String getRequestTarget()
    {
        if (_requestTarget != null)
            return _requestTarget;

        String target = _uri.getPath();
        if (target.isEmpty())
            target = URIUtil.SLASH;
        if (!_uri.getQuery().isEmpty())
            target = target + '?' + _uri.getQuery();
        return target;
    }

    /**
     * @param requestTarget the request target, e.g. {@code *} or an absolute URI
     * @return a request with the target
     * @throws IllegalArgumentException if the target contains whitespace
     */
    public Request withRequestTarget(String requestTarget)
    {
        if (requestTarget == null || StringUtil.indexOfWhitespace(requestTarget) >= 0)
            throw new IllegalArgumentException("Invalid request target provided; cannot contain whitespace");
        if (requestTarget.equals(_requestTarget))
            return this;
        return new Request(_method, _uri, _fields, _body, _version, requestTarget);
    }

    public Request withMethod(String method)
    {
        String filtered = filterMethod(method);
        if (filtered.equals(_method))
            return this;
        return new Request(filtered, _uri, _fields, _body, _version, _requestTarget);
    }

    public Request withMethod(HttpMethod method)
    {
        return withMethod(method.asString());
    }

    public Request withUri(HttpURI uri)
    {
        return withUri(uri, false);
    }

    /**
     * Replace the URI.
     * <p>
     * Unless {@code preserveHost} is true and the request already has a {@code Host} field,
     * the {@code Host} field is set as the first field from the host and port of the URI.
     * A URI without host leaves the fields unchanged.
     * </p>
     *
     * @param uri the new URI
     * @param preserveHost true to keep an existing {@code Host} field
     * @return a request with the URI
     */
    public Request withUri(HttpURI uri, boolean preserveHost)
    {
        Objects.requireNonNull(uri);
        if (uri == _uri)
            return this;
        HttpFields fields = _fields;
        if (!preserveHost || !fields.contains(HttpHeader.HOST))
            fields = updateHostFromUri(fields, uri);
        return new Request(_method, uri, fields, _body, _version, _requestTarget);
    }

    public Request withProtocolVersion(HttpVersion version)
    {
        Objects.requireNonNull(version);
        if (version == _version)
            return this;
        return new Request(_method, _uri, _fields, _body, version, _requestTarget);
    }

    /**
     * @param version the version as {@code HTTP/1.1} or as the bare {@code 1.1}
     * @return a request with the protocol version
     * @throws IllegalArgumentException if the version is unknown
     */
    public Request withProtocolVersion(String version)
    {
        return withProtocolVersion(HttpVersion.fromString(version));
    }

    /**
     * @param name the field name
     * @param values the values that replace any existing values
     * @return a request with the field
     * @throws IllegalArgumentException if the name is not a token or a value is invalid
     */
    public Request withHeader(String name, String... values)
    {
        return withHeader(name, List.of(values));
    }

    public Request withHeader(String name, List<String> values)
    {
        HttpField field = new HttpField(name, values);
        if (field.equals(_fields.getField(name)))
            return this;
        return new Request(_method, _uri, HttpFields.build(_fields).put(field).asImmutable(), _body, _version, _requestTarget);
    }

    /**
     * @param name the field name
     * @param values the values to append to any existing values
     * @return a request with the values added
     */
    public Request withAddedHeader(String name, String... values)
    {
        HttpField field = new HttpField(name, values);
        return new Request(_method, _uri, HttpFields.build(_fields).add(field).asImmutable(), _body, _version, _requestTarget);
    }

    public Request withoutHeader(String name)
    {
        if (!_fields.contains(name))
            return this;
        HttpFields.Mutable fields = HttpFields.build(_fields);
        fields.remove(name);
        return new Request(_method, _uri, fields.asImmutable(), _body, _version, _requestTarget);
    }

    public Request withBody(ByteStream body)
    {
        Objects.requireNonNull(body);
        if (body == _body)
            return this;
        return new Request(_method, _uri, _fields, body, _version, _requestTarget);
    }

    public boolean hasHeader(String name)
    {
        return _fields.contains(name);
    }

    /**
     * @param name the field name, in any case
     * @return the values of the field, empty if the field is absent
     */
    public List<String> getHeader(String name)
    {
        return _fields.getValuesList(name);
    }

    /**
     * @param name the field name, in any case
     * @return the values of the field joined with {@code ", "}, or the empty string if the field is absent
     */
    public String getHeaderLine(String name)
    {
        return String.join(", ", getHeader(name));
    }

    @Override
    public String toString()
    {
        return String.format("%s{%s %s %s,fields=%d}", getClass().getSimpleName(), _method, _uri, _version, _fields.size());
    }
}
