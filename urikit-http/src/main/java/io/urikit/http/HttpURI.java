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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.urikit.util.StringUtil;
import io.urikit.util.TypeUtil;
import io.urikit.util.URIUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable URI reference as defined by <a href="https://tools.ietf.org/html/rfc3986">RFC 3986</a>.
 * <p>
 * An instance is obtained by {@link #parse(String) parsing} a string, from a set of {@link Parts}
 * with {@link #fromParts(Parts)}, or as the {@link #empty() empty} URI. Each {@code with*} method
 * returns a new instance with one component replaced, or the same instance when the component
 * already has the requested value.
 * </p>
 * <p>
 * Components are stored normalized: the scheme and host are lower case, the default port of the
 * scheme is dropped and the user information, path, query and fragment are percent encoded.
 * A {@code %} followed by two hex digits is never encoded again.
 * </p>
 * <p>
 * Every instance satisfies the RFC 3986 constraints between the authority and the path.
 * A rootless path combined with an authority and an http URI without a host are corrected
 * when allowed by the {@link UriCompliance} mode of the instance and rejected otherwise.
 * </p>
 */
public final class HttpURI
{
    private static final Logger LOG = LoggerFactory.getLogger(HttpURI.class);

    /**
     * The host used for an http or https URI that does not have one.
     */
    public static final String HTTP_DEFAULT_HOST = "localhost";

    /**
     * Name of the auxiliary parameter that provides the path of a URI parsed from an empty string.
     */
    public static final String PARAM_PATH = "path";

    /**
     * Name of the auxiliary parameter that provides the query of a URI parsed from an empty string.
     */
    public static final String PARAM_QUERY = "query";

    private static final String FILE_SCHEME = "file";

    private static final HttpURI EMPTY = new HttpURI("", "", "", null, "", "", "", Collections.emptyMap(), UriCompliance.DEFAULT, ComplianceViolation.Listener.NOOP);

    private enum State
    {
        START,
        SCHEME_OR_PATH,
        HOST_OR_PATH,
        HOST,
        IPV6,
        PORT,
        PATH,
        QUERY,
        FRAGMENT
    }

    private final String _scheme;
    private final String _userInfo;
    private final String _host;
    private final Integer _port;
    private final String _path;
    private final String _query;
    private final String _fragment;
    private final Map<String, String> _params;
    private final UriCompliance _compliance;
    private final ComplianceViolation.Listener _listener;
    private final String _uri;

    private HttpURI(String scheme, String userInfo, String host, Integer port, String path, String query, String fragment,
                    Map<String, String> params, UriCompliance compliance, ComplianceViolation.Listener listener)
    {
        _scheme = scheme;
        _userInfo = userInfo;
        _host = host;
        _port = port;
        _path = path;
        _query = query;
        _fragment = fragment;
        _params = params;
        _compliance = compliance;
        _listener = listener;
        _uri = composeComponents(scheme, composeAuthority(userInfo, host, port), path, query, fragment);
    }

    /**
     * @return the URI with every component empty
     */
    public static HttpURI empty()
    {
        return EMPTY;
    }

    /**
     * Parse a URI string with the {@link UriCompliance#DEFAULT} compliance mode.
     *
     * @param uri the URI string
     * @return the parsed URI
     * @throws MalformedUriException if the string is not a valid URI reference
     */
    public static HttpURI parse(String uri)
    {
        return parse(uri, Collections.emptyMap(), UriCompliance.DEFAULT, ComplianceViolation.Listener.NOOP);
    }

    /**
     * Parse a URI string with auxiliary parameters.
     *
     * @param uri the URI string
     * @param params values known from elsewhere; {@link #PARAM_PATH} and {@link #PARAM_QUERY}
     * provide the path and query when {@code uri} is empty
     * @return the parsed URI
     * @throws MalformedUriException if the string is not a valid URI reference
     */
    public static HttpURI parse(String uri, Map<String, String> params)
    {
        return parse(uri, params, UriCompliance.DEFAULT, ComplianceViolation.Listener.NOOP);
    }

    public static HttpURI parse(String uri, UriCompliance compliance, ComplianceViolation.Listener listener)
    {
        return parse(uri, Collections.emptyMap(), compliance, listener);
    }

    /**
     * Parse a URI string.
     *
     * @param uri the URI string
     * @param params the auxiliary parameters
     * @param compliance the compliance mode of the URI and of every URI derived from it
     * @param listener notified of every correction allowed by the compliance mode
     * @return the parsed URI
     * @throws MalformedUriException if the string is not a valid URI reference
     */
    public static HttpURI parse(String uri, Map<String, String> params, UriCompliance compliance, ComplianceViolation.Listener listener)
    {
        Objects.requireNonNull(uri);
        Map<String, String> frozen = params == null || params.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(params));
        try
        {
            Parts parts;
            if (uri.isEmpty())
            {
                parts = new Parts()
                    .path(frozen.getOrDefault(PARAM_PATH, ""))
                    .query(frozen.getOrDefault(PARAM_QUERY, ""));
            }
            else
            {
                parts = split(uri);
            }
            return apply(parts, frozen, compliance, listener);
        }
        catch (MalformedUriException e)
        {
            throw e;
        }
        catch (UriException e)
        {
            throw new MalformedUriException(uri, e.getReason(), e);
        }
    }

    /**
     * Build a URI from its components with the {@link UriCompliance#DEFAULT} compliance mode.
     *
     * @param parts the components
     * @return the URI
     * @throws InvalidUriComponentException if a component is invalid
     * @throws InvalidUriStateException if the components cannot be combined
     */
    public static HttpURI fromParts(Parts parts)
    {
        return fromParts(parts, UriCompliance.DEFAULT, ComplianceViolation.Listener.NOOP);
    }

    public static HttpURI fromParts(Parts parts, UriCompliance compliance, ComplianceViolation.Listener listener)
    {
        return apply(parts, Collections.emptyMap(), compliance, listener);
    }

    private static HttpURI apply(Parts parts, Map<String, String> params, UriCompliance compliance, ComplianceViolation.Listener listener)
    {
        String userInfo = URIUtil.encodeUserInfo(StringUtil.nonNull(parts.getUser()));
        if (parts.getPassword() != null)
            userInfo = userInfo + ':' + URIUtil.encodeUserInfo(parts.getPassword());

        return create(
            filterScheme(parts.getScheme()),
            userInfo,
            filterHost(parts.getHost()),
            filterPort(parts.getPort()),
            filterPath(parts.getPath()),
            filterQuery(parts.getQuery()),
            filterQuery(parts.getFragment()),
            params,
            compliance == null ? UriCompliance.DEFAULT : compliance,
            listener == null ? ComplianceViolation.Listener.NOOP : listener);
    }

    /**
     * Split a URI string into its components without normalizing them.
     *
     * @param uri the URI string
     * @return the components, with null for every absent component
     * @throws MalformedUriException if the string cannot be split into a URI reference
     */
    public static Parts split(String uri)
    {
        Parts parts = new Parts();
        State state = State.START;
        boolean authority = false;
        int mark = 0;
        int end = uri.length();

        for (int i = 0; i < end; i++)
        {
            char c = uri.charAt(i);

            switch (state)
            {
                case START:
                {
                    switch (c)
                    {
                        case '/':
                            mark = i;
                            state = State.HOST_OR_PATH;
                            break;
                        case '?':
                            parts.path("");
                            mark = i + 1;
                            state = State.QUERY;
                            break;
                        case '#':
                            parts.path("");
                            mark = i + 1;
                            state = State.FRAGMENT;
                            break;
                        default:
                            mark = i;
                            if (parts.getScheme() == null && URIUtil.isSchemeChar(c, true))
                                state = State.SCHEME_OR_PATH;
                            else
                                state = State.PATH;
                            break;
                    }
                    continue;
                }

                case SCHEME_OR_PATH:
                {
                    switch (c)
                    {
                        case ':':
                            parts.scheme(uri.substring(mark, i));
                            state = State.START;
                            break;
                        case '/':
                            state = State.PATH;
                            break;
                        case '?':
                            parts.path(uri.substring(mark, i));
                            mark = i + 1;
                            state = State.QUERY;
                            break;
                        case '#':
                            parts.path(uri.substring(mark, i));
                            mark = i + 1;
                            state = State.FRAGMENT;
                            break;
                        default:
                            if (!URIUtil.isSchemeChar(c, false))
                                state = State.PATH;
                            break;
                    }
                    continue;
                }

                case HOST_OR_PATH:
                {
                    if (c == '/')
                    {
                        authority = true;
                        parts.host("");
                        mark = i + 1;
                        state = State.HOST;
                    }
                    else
                    {
                        // reprocess the character as part of a path starting at the first slash
                        state = State.PATH;
                        i--;
                    }
                    continue;
                }

                case HOST:
                {
                    switch (c)
                    {
                        case '/':
                            parts.host(uri.substring(mark, i));
                            mark = i;
                            state = State.PATH;
                            break;
                        case '?':
                            parts.host(uri.substring(mark, i));
                            parts.path("");
                            mark = i + 1;
                            state = State.QUERY;
                            break;
                        case '#':
                            parts.host(uri.substring(mark, i));
                            parts.path("");
                            mark = i + 1;
                            state = State.FRAGMENT;
                            break;
                        case ':':
                            parts.host(uri.substring(mark, i));
                            mark = i + 1;
                            state = State.PORT;
                            break;
                        case '@':
                            if (parts.getUser() != null)
                                throw new MalformedUriException(uri, "Bad authority");
                            parts.user(uri.substring(mark, i));
                            mark = i + 1;
                            break;
                        case '[':
                            if (i != mark)
                                throw new MalformedUriException(uri, "Bad IPv6 literal");
                            state = State.IPV6;
                            break;
                        default:
                            break;
                    }
                    continue;
                }

                case IPV6:
                {
                    switch (c)
                    {
                        case '/':
                            throw new MalformedUriException(uri, "No closing ']' for IPv6 literal");
                        case ']':
                            parts.host(uri.substring(mark, i + 1));
                            mark = i + 1;
                            if (i + 1 == end)
                            {
                                state = State.PATH;
                                break;
                            }
                            switch (uri.charAt(i + 1))
                            {
                                case ':':
                                    i++;
                                    mark = i + 1;
                                    state = State.PORT;
                                    break;
                                case '/':
                                    state = State.PATH;
                                    break;
                                case '?':
                                    i++;
                                    parts.path("");
                                    mark = i + 1;
                                    state = State.QUERY;
                                    break;
                                case '#':
                                    i++;
                                    parts.path("");
                                    mark = i + 1;
                                    state = State.FRAGMENT;
                                    break;
                                default:
                                    throw new MalformedUriException(uri, "Bad character after IPv6 literal");
                            }
                            break;
                        default:
                            break;
                    }
                    continue;
                }

                case PORT:
                {
                    switch (c)
                    {
                        case '@':
                            if (parts.getUser() != null)
                                throw new MalformedUriException(uri, "Bad authority");
                            // the host and port were the user and password
                            parts.user(parts.getHost());
                            parts.password(uri.substring(mark, i));
                            parts.host(null);
                            mark = i + 1;
                            state = State.HOST;
                            break;
                        case '/':
                            parts.port(parsePort(uri, mark, i));
                            mark = i;
                            state = State.PATH;
                            break;
                        case '?':
                            parts.port(parsePort(uri, mark, i));
                            parts.path("");
                            mark = i + 1;
                            state = State.QUERY;
                            break;
                        case '#':
                            parts.port(parsePort(uri, mark, i));
                            parts.path("");
                            mark = i + 1;
                            state = State.FRAGMENT;
                            break;
                        default:
                            break;
                    }
                    continue;
                }

                case PATH:
                {
                    switch (c)
                    {
                        case '?':
                            parts.path(uri.substring(mark, i));
                            mark = i + 1;
                            state = State.QUERY;
                            break;
                        case '#':
                            parts.path(uri.substring(mark, i));
                            mark = i + 1;
                            state = State.FRAGMENT;
                            break;
                        default:
                            break;
                    }
                    continue;
                }

                case QUERY:
                {
                    if (c == '#')
                    {
                        parts.query(uri.substring(mark, i));
                        mark = i + 1;
                        state = State.FRAGMENT;
                    }
                    continue;
                }

                case FRAGMENT:
                {
                    i = end;
                    continue;
                }

                default:
                    throw new IllegalStateException(state.toString());
            }
        }

        switch (state)
        {
            case START:
                parts.path("");
                break;
            case SCHEME_OR_PATH:
            case HOST_OR_PATH:
            case PATH:
                parts.path(uri.substring(mark, end));
                break;
            case HOST:
                parts.host(uri.substring(mark, end));
                break;
            case IPV6:
                throw new MalformedUriException(uri, "No closing ']' for IPv6 literal");
            case PORT:
                parts.port(parsePort(uri, mark, end));
                break;
            case QUERY:
                parts.query(uri.substring(mark, end));
                break;
            case FRAGMENT:
                parts.fragment(uri.substring(mark, end));
                break;
            default:
                throw new IllegalStateException(state.toString());
        }

        if (authority && StringUtil.isEmpty(parts.getHost()) && !FILE_SCHEME.equalsIgnoreCase(parts.getScheme()))
            throw new MalformedUriException(uri, "Authority without host");

        if (LOG.isDebugEnabled())
            LOG.debug("split {} -> {}", uri, parts);
        return parts;
    }

    private static Integer parsePort(String uri, int start, int end)
    {
        if (start == end)
            return null;
        int port;
        try
        {
            port = TypeUtil.parseInt(uri, start, end - start, 10);
        }
        catch (NumberFormatException e)
        {
            throw new MalformedUriException(uri, "Bad port", e);
        }
        if (port > 65535)
            throw new MalformedUriException(uri, "Bad port");
        return port;
    }

    private static String filterScheme(String scheme)
    {
        if (StringUtil.isEmpty(scheme))
            return StringUtil.EMPTY;
        if (!URIUtil.isValidScheme(scheme))
            throw new InvalidUriComponentException("Invalid scheme: " + scheme);
        return StringUtil.asciiToLowerCase(scheme);
    }

    private static String filterHost(String host)
    {
        if (host == null)
            return StringUtil.EMPTY;
        return StringUtil.asciiToLowerCase(host);
    }

    private static Integer filterPort(Integer port)
    {
        if (port == null)
            return null;
        if (port < 1 || port > 65535)
            throw new InvalidUriComponentException(String.format("Invalid port: %d. Must be between 1 and 65535", port));
        return port;
    }

    private static String filterPath(String path)
    {
        if (path == null)
            return StringUtil.EMPTY;
        return URIUtil.encodePath(path);
    }

    private static String filterQuery(String queryOrFragment)
    {
        if (queryOrFragment == null)
            return StringUtil.EMPTY;
        return URIUtil.encodeQuery(queryOrFragment);
    }

    /**
     * Drop the default port of the scheme, correct or reject the combination of components,
     * and build the instance.
     */
    private static HttpURI create(String scheme, String userInfo, String host, Integer port, String path, String query, String fragment,
                                  Map<String, String> params, UriCompliance compliance, ComplianceViolation.Listener listener)
    {
        String effectiveScheme = scheme.isEmpty() ? HttpScheme.HTTP.asString() : scheme;
        if (port != null && port == HttpScheme.getDefaultPort(effectiveScheme))
            port = null;

        if (host.isEmpty() && (HttpScheme.HTTP.is(scheme) || HttpScheme.HTTPS.is(scheme)))
        {
            onComplianceViolation(compliance, listener, UriCompliance.Violation.DEFAULT_HTTP_HOST, scheme + " URI without host");
            host = HTTP_DEFAULT_HOST;
        }

        if (composeAuthority(userInfo, host, port).isEmpty())
        {
            if (path.startsWith("//"))
                throw new InvalidUriStateException("The path of a URI without an authority must not start with two slashes \"//\"");
            if (scheme.isEmpty())
            {
                int slash = path.indexOf('/');
                String segment = slash < 0 ? path : path.substring(0, slash);
                if (segment.indexOf(':') >= 0)
                    throw new InvalidUriStateException("A relative URI must not have a path beginning with a segment containing a colon");
            }
        }
        else if (!path.isEmpty() && path.charAt(0) != '/')
        {
            onComplianceViolation(compliance, listener, UriCompliance.Violation.AUTHORITY_RELATIVE_PATH, path);
            path = URIUtil.SLASH + path;
        }

        return new HttpURI(scheme, userInfo, host, port, path, query, fragment, params, compliance, listener);
    }

    private static void onComplianceViolation(UriCompliance compliance, ComplianceViolation.Listener listener, UriCompliance.Violation violation, String details)
    {
        if (!compliance.allows(violation))
            throw new InvalidUriStateException(violation.getDescription() + ": " + details);

        if (violation.isDeprecated())
            LOG.warn("Deprecated correction of URI {} ({}) by {}", violation.getDescription(), details, compliance.getName());
        else if (LOG.isDebugEnabled())
            LOG.debug("Correcting URI {} ({}) by {}", violation.getDescription(), details, compliance.getName());
        listener.onComplianceViolation(compliance, violation, details);
    }

    private HttpURI derive(String scheme, String userInfo, String host, Integer port, String path, String query, String fragment)
    {
        return create(scheme, userInfo, host, port, path, query, fragment, _params, _compliance, _listener);
    }

    /**
     * Compose a URI string from its components.
     * <p>
     * The authority is preceded by {@code //} when it is not empty or when the scheme is {@code file}.
     * </p>
     *
     * @param scheme the scheme, or empty
     * @param authority the authority, or empty
     * @param path the path
     * @param query the query, or empty
     * @param fragment the fragment, or empty
     * @return the URI string
     */
    public static String composeComponents(String scheme, String authority, String path, String query, String fragment)
    {
        StringBuilder out = new StringBuilder();

        if (!StringUtil.isEmpty(scheme))
            out.append(scheme).append(':');

        if (!StringUtil.isEmpty(authority) || FILE_SCHEME.equals(scheme))
            out.append("//").append(StringUtil.nonNull(authority));

        if (path != null)
            out.append(path);

        if (!StringUtil.isEmpty(query))
            out.append('?').append(query);

        if (!StringUtil.isEmpty(fragment))
            out.append('#').append(fragment);

        return out.toString();
    }

    private static String composeAuthority(String userInfo, String host, Integer port)
    {
        if (host.isEmpty() && userInfo.isEmpty() && port == null)
            return StringUtil.EMPTY;
        StringBuilder out = new StringBuilder();
        if (!userInfo.isEmpty())
            out.append(userInfo).append('@');
        out.append(host);
        if (port != null)
            out.append(':').append(port.intValue());
        return out.toString();
    }

    /**
     * @return the scheme, or {@code http} if the URI has no scheme
     * @see #hasScheme()
     */
    public String getScheme()
    {
        return _scheme.isEmpty() ? HttpScheme.HTTP.asString() : _scheme;
    }

    /**
     * @return true if the URI was given a scheme
     */
    public boolean hasScheme()
    {
        return !_scheme.isEmpty();
    }

    /**
     * @return true if the URI has a scheme, and is thus not a relative reference
     */
    public boolean isAbsolute()
    {
        return hasScheme();
    }

    public boolean hasAuthority()
    {
        return !getAuthority().isEmpty();
    }

    /**
     * @return the authority as {@code [userinfo@]host[:port]}, or the empty string
     */
    public String getAuthority()
    {
        return composeAuthority(_userInfo, _host, _port);
    }

    public String getUserInfo()
    {
        return _userInfo;
    }

    public String getHost()
    {
        return _host;
    }

    /**
     * @return the port, or null if the URI has no port or uses the default port of its scheme
     */
    public Integer getPort()
    {
        return _port;
    }

    public String getPath()
    {
        return _path;
    }

    public String getQuery()
    {
        return _query;
    }

    public String getFragment()
    {
        return _fragment;
    }

    /**
     * @return the path followed by the query, if any
     */
    public String getPathQuery()
    {
        if (_query.isEmpty())
            return _path;
        return _path + '?' + _query;
    }

    /**
     * @return the immutable auxiliary parameters the URI was parsed with
     */
    public Map<String, String> getParams()
    {
        return _params;
    }

    public UriCompliance getCompliance()
    {
        return _compliance;
    }

    /**
     * @return the default port of the scheme, or 0 if the scheme has no known default port
     */
    public int getDefaultPort()
    {
        return HttpScheme.getDefaultPort(getScheme());
    }

    /**
     * @return true if the URI has no port or its port is the default port of the scheme
     */
    public boolean isDefaultPort()
    {
        return _port == null || _port == getDefaultPort();
    }

    public HttpURI withScheme(String scheme)
    {
        String filtered = filterScheme(scheme);
        if (filtered.equals(_scheme))
            return this;
        return derive(filtered, _userInfo, _host, _port, _path, _query, _fragment);
    }

    public HttpURI withUserInfo(String user)
    {
        return withUserInfo(user, null);
    }

    /**
     * @param user the user, encoded as needed
     * @param password the password, or null or empty for none
     * @return a URI with the user information
     */
    public HttpURI withUserInfo(String user, String password)
    {
        String filtered = URIUtil.encodeUserInfo(StringUtil.nonNull(user));
        if (!StringUtil.isEmpty(password))
            filtered = filtered + ':' + URIUtil.encodeUserInfo(password);
        if (filtered.equals(_userInfo))
            return this;
        return derive(_scheme, filtered, _host, _port, _path, _query, _fragment);
    }

    public HttpURI withHost(String host)
    {
        String filtered = filterHost(host);
        if (filtered.equals(_host))
            return this;
        return derive(_scheme, _userInfo, filtered, _port, _path, _query, _fragment);
    }

    /**
     * @param port the port, or null to remove the port
     * @return a URI with the port
     * @throws InvalidUriComponentException if the port is not between 1 and 65535
     */
    public HttpURI withPort(Integer port)
    {
        Integer filtered = filterPort(port);
        if (Objects.equals(filtered, _port))
            return this;
        return derive(_scheme, _userInfo, _host, filtered, _path, _query, _fragment);
    }

    public HttpURI withPath(String path)
    {
        String filtered = filterPath(path);
        if (filtered.equals(_path))
            return this;
        return derive(_scheme, _userInfo, _host, _port, filtered, _query, _fragment);
    }

    public HttpURI withQuery(String query)
    {
        String filtered = filterQuery(query);
        if (filtered.equals(_query))
            return this;
        return derive(_scheme, _userInfo, _host, _port, _path, filtered, _fragment);
    }

    public HttpURI withFragment(String fragment)
    {
        String filtered = filterQuery(fragment);
        if (filtered.equals(_fragment))
            return this;
        return derive(_scheme, _userInfo, _host, _port, _path, _query, filtered);
    }

    /**
     * Replace every query pair with the key by a single pair.
     * <p>
     * Keys are compared after percent decoding. A {@code =} or {@code &} in the key or
     * value is encoded, other characters are encoded as by {@link #withQuery(String)}.
     * </p>
     *
     * @param uri the URI
     * @param key the key
     * @param value the value, or null for a key without value
     * @return a URI with the query pair appended
     */
    public static HttpURI withQueryValue(HttpURI uri, String key, String value)
    {
        List<String> pairs = getFilteredQueryPairs(uri, Collections.singleton(key));
        pairs.add(generateQueryPair(key, value));
        return uri.withQuery(String.join("&", pairs));
    }

    /**
     * Replace every query pair with one of the keys of the map, appending the new pairs in the map iteration order.
     *
     * @param uri the URI
     * @param values the keys and values
     * @return a URI with the query pairs appended
     */
    public static HttpURI withQueryValues(HttpURI uri, Map<String, String> values)
    {
        List<String> pairs = getFilteredQueryPairs(uri, values.keySet());
        for (Map.Entry<String, String> entry : values.entrySet())
        {
            pairs.add(generateQueryPair(entry.getKey(), entry.getValue()));
        }
        return uri.withQuery(String.join("&", pairs));
    }

    /**
     * Remove every query pair with the key.
     *
     * @param uri the URI
     * @param key the key
     * @return a URI without the query pairs
     */
    public static HttpURI withoutQueryValue(HttpURI uri, String key)
    {
        return uri.withQuery(String.join("&", getFilteredQueryPairs(uri, Collections.singleton(key))));
    }

    private static List<String> getFilteredQueryPairs(HttpURI uri, Collection<String> keys)
    {
        List<String> pairs = new ArrayList<>();
        String query = uri.getQuery();
        if (query.isEmpty())
            return pairs;

        Set<String> decodedKeys = new HashSet<>();
        for (String key : keys)
        {
            decodedKeys.add(URIUtil.decodeComponent(key));
        }

        for (String pair : StringUtil.split(query, '&'))
        {
            int equals = pair.indexOf('=');
            String name = equals < 0 ? pair : pair.substring(0, equals);
            if (!decodedKeys.contains(URIUtil.decodeComponent(name)))
                pairs.add(pair);
        }
        return pairs;
    }

    private static String generateQueryPair(String key, String value)
    {
        StringBuilder pair = new StringBuilder();
        appendQueryText(pair, key);
        if (value != null)
        {
            pair.append('=');
            appendQueryText(pair, value);
        }
        return pair.toString();
    }

    private static void appendQueryText(StringBuilder out, String text)
    {
        for (int i = 0; i < text.length(); i++)
        {
            char c = text.charAt(i);
            switch (c)
            {
                case '=':
                    out.append("%3D");
                    break;
                case '&':
                    out.append("%26");
                    break;
                default:
                    out.append(c);
                    break;
            }
        }
    }

    /**
     * @return the URI as a {@link URI}
     * @throws URISyntaxException if the URI is not accepted by {@link URI}
     */
    public URI toURI() throws URISyntaxException
    {
        return new URI(_uri);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof HttpURI))
            return false;
        return _uri.equals(o.toString());
    }

    @Override
    public int hashCode()
    {
        return _uri.hashCode();
    }

    @Override
    public String toString()
    {
        return _uri;
    }

    /**
     * The components of a URI before normalization, as produced by {@link HttpURI#split(String)}
     * and consumed by {@link HttpURI#fromParts(Parts)}. A null component is absent.
     */
    public static final class Parts
    {
        private String _scheme;
        private String _user;
        private String _password;
        private String _host;
        private Integer _port;
        private String _path;
        private String _query;
        private String _fragment;

        public Parts scheme(String scheme)
        {
            _scheme = scheme;
            return this;
        }

        public Parts user(String user)
        {
            _user = user;
            return this;
        }

        public Parts password(String password)
        {
            _password = password;
            return this;
        }

        public Parts host(String host)
        {
            _host = host;
            return this;
        }

        public Parts port(Integer port)
        {
            _port = port;
            return this;
        }

        public Parts path(String path)
        {
            _path = path;
            return this;
        }

        public Parts query(String query)
        {
            _query = query;
            return this;
        }

        public Parts fragment(String fragment)
        {
            _fragment = fragment;
            return this;
        }

        public String getScheme()
        {
            return _scheme;
        }

        public String getUser()
        {
            return _user;
        }

        public String getPassword()
        {
            return _password;
        }

        public String getHost()
        {
            return _host;
        }

        public Integer getPort()
        {
            return _port;
        }

        public String getPath()
        {
            return _path;
        }

        public String getQuery()
        {
            return _query;
        }

        public String getFragment()
        {
            return _fragment;
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x{s=%s,u=%s,h=%s,p=%s,path=%s,q=%s,f=%s}",
                getClass().getSimpleName(), hashCode(), _scheme, _user, _host, _port, _path, _query, _fragment);
        }
    }
}
