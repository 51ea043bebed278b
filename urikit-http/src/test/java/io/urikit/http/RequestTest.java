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
import java.util.stream.Collectors;

import io.urikit.io.ByteArrayStream;
import io.urikit.io.ByteStream;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestTest
{
    @Test
    public void testDefaults() throws Exception
    {
        Request request = new Request("get", "http://example.com:8080/path?q=1");
        assertThat(request.getMethod(), is("GET"));
        assertTrue(request.isMethod(HttpMethod.GET));
        assertThat(request.getProtocolVersion(), is(HttpVersion.HTTP_1_1));
        assertThat(request.getHeaderLine("Host"), is("example.com:8080"));
        assertThat(request.getRequestTarget(), is("/path?q=1"));
        assertThat(request.getBody().getContents().length, is(0));
    }

    @Test
    public void testHostIsFirstField()
    {
        HttpFields fields = HttpFields.build().put("Accept", "text/html").asImmutable();
        Request request = new Request("GET", HttpURI.parse("http://foo.com/"), fields, null, null);
        assertThat(names(request), contains("Host", "Accept"));
        assertThat(request.getHeaderLine("host"), is("foo.com"));
    }

    @Test
    public void testSuppliedHostKept()
    {
        HttpFields fields = HttpFields.build().put("Accept", "*/*").put("Host", "bar.com").asImmutable();
        Request request = new Request("GET", HttpURI.parse("http://foo.com/"), fields, null, HttpVersion.HTTP_1_0);
        assertThat(request.getHeaderLine("Host"), is("bar.com"));
        assertThat(names(request), contains("Accept", "Host"));
        assertThat(request.getProtocolVersion(), is(HttpVersion.HTTP_1_0));
    }

    @Test
    public void testWithUriUpdatesHost()
    {
        Request request = new Request("GET", "http://foo.com/").withHeader("Accept", "*/*");
        Request changed = request.withUri(HttpURI.parse("https://baz.com:8443/x"));
        assertThat(changed.getHeaderLine("Host"), is("baz.com:8443"));
        assertThat(names(changed), contains("Host", "Accept"));
        assertThat(changed.getRequestTarget(), is("/x"));
        assertThat(request.getHeaderLine("Host"), is("foo.com"));
    }

    @Test
    public void testWithUriPreserveHost()
    {
        Request request = new Request("GET", "http://foo.com/");
        Request preserved = request.withUri(HttpURI.parse("http://baz.com/"), true);
        assertThat(preserved.getHeaderLine("Host"), is("foo.com"));
        assertThat(preserved.getUri().getHost(), is("baz.com"));

        Request noHost = new Request("GET", "/path");
        assertFalse(noHost.hasHeader("Host"));
        assertThat(noHost.withUri(HttpURI.parse("http://a.com/"), true).getHeaderLine("Host"), is("a.com"));
    }

    @Test
    public void testWithUriWithoutHostKeepsFields()
    {
        Request request = new Request("GET", "http://foo.com/");
        Request changed = request.withUri(HttpURI.parse("/other"));
        assertThat(changed.getHeaderLine("Host"), is("foo.com"));
        assertThat(changed.getRequestTarget(), is("/other"));
    }

    @Test
    public void testWithSameUriIsSameInstance()
    {
        Request request = new Request("GET", "http://foo.com/");
        assertThat(request.withUri(request.getUri()), sameInstance(request));
    }

    @Test
    public void testRequestTarget()
    {
        Request request = new Request("OPTIONS", "http://foo.com");
        assertThat(request.getRequestTarget(), is("/"));
        Request star = request.withRequestTarget("*");
        assertThat(star.getRequestTarget(), is("*"));
        assertThat(star.withRequestTarget("*"), sameInstance(star));
        assertThrows(IllegalArgumentException.class, () -> request.withRequestTarget("/a b"));
        assertThrows(IllegalArgumentException.class, () -> request.withRequestTarget("/a\tb"));
    }

    @Test
    public void testHeaders()
    {
        Request request = new Request("GET", "/");
        Request withFoo = request.withHeader("X-Foo", "  bar\t");
        assertThat(withFoo.getHeader("x-foo"), contains("bar"));
        assertFalse(request.hasHeader("X-Foo"));

        Request added = withFoo.withAddedHeader("x-foo", "baz");
        assertThat(added.getHeader("X-FOO"), contains("bar", "baz"));
        assertThat(added.getHeaderLine("X-Foo"), is("bar, baz"));
        assertThat(added.getFields().getField("x-foo").getName(), is("X-Foo"));

        Request replaced = added.withHeader("X-Foo", List.of("one", "two"));
        assertThat(replaced.getHeader("x-foo"), contains("one", "two"));
        assertThat(replaced.withHeader("X-Foo", "one", "two"), sameInstance(replaced));

        Request removed = replaced.withoutHeader("X-FOO");
        assertFalse(removed.hasHeader("X-Foo"));
        assertThat(removed.getHeader("X-Foo"), empty());
        assertThat(removed.getHeaderLine("X-Foo"), is(""));
        assertThat(removed.withoutHeader("X-Foo"), sameInstance(removed));
    }

    @Test
    public void testInvalidHeaders()
    {
        Request request = new Request("GET", "/");
        assertThrows(IllegalArgumentException.class, () -> request.withHeader("bad name", "v"));
        assertThrows(IllegalArgumentException.class, () -> request.withAddedHeader("X", "a\r\nb"));
    }

    @Test
    public void testMethod()
    {
        Request request = new Request("GET", "/");
        assertThat(request.withMethod("GET"), sameInstance(request));
        Request post = request.withMethod("post");
        assertThat(post.getMethod(), is("POST"));
        assertTrue(post.isMethod(HttpMethod.POST));
        assertThat(request.withMethod(HttpMethod.PUT).getMethod(), is("PUT"));
        assertThat(request.withMethod("PURGE").getMethod(), is("PURGE"));
        assertThrows(IllegalArgumentException.class, () -> new Request("", HttpURI.empty()));
        assertThrows(IllegalArgumentException.class, () -> request.withMethod("GE T"));
    }

    @Test
    public void testBodyAndVersion() throws Exception
    {
        Request request = new Request("POST", "/");
        assertThat(request.withBody(request.getBody()), sameInstance(request));

        ByteStream body = ByteArrayStream.of("hello");
        Request withBody = request.withBody(body);
        assertThat(withBody.getBody(), sameInstance(body));
        assertThat(withBody.getBody().asString(), is("hello"));

        assertThat(request.withProtocolVersion(HttpVersion.HTTP_1_1), sameInstance(request));
        assertThat(request.withProtocolVersion("2").getProtocolVersion(), is(HttpVersion.HTTP_2));
        assertThat(request.withProtocolVersion("HTTP/1.1"), sameInstance(request));
        assertThat(HttpVersion.fromString("HTTP/1.0"), is(HttpVersion.HTTP_1_0));
        assertThat(HttpVersion.HTTP_1_1.getProtocolVersion(), is("1.1"));
        assertThrows(IllegalArgumentException.class, () -> HttpVersion.fromString("3.5"));
    }

    @Test
    public void testMalformedUri()
    {
        assertThrows(MalformedUriException.class, () -> new Request("GET", "http://"));
    }

    private static List<String> names(Request request)
    {
        return request.getFields().stream().map(HttpField::getName).collect(Collectors.toList());
    }
}
