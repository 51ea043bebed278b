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

import org.junit.jupiter.api.Test;

import static io.urikit.http.UriCompliance.Violation.AUTHORITY_RELATIVE_PATH;
import static io.urikit.http.UriCompliance.Violation.DEFAULT_HTTP_HOST;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UriComplianceTest
{
    @Test
    public void testKnownModes()
    {
        assertTrue(UriCompliance.DEFAULT.allows(AUTHORITY_RELATIVE_PATH));
        assertTrue(UriCompliance.DEFAULT.allows(DEFAULT_HTTP_HOST));
        assertThat(UriCompliance.RFC3986.getAllowed(), empty());
        assertThat(UriCompliance.valueOf("DEFAULT"), sameInstance(UriCompliance.DEFAULT));
        assertThat(UriCompliance.valueOf("RFC3986"), sameInstance(UriCompliance.RFC3986));
        assertThat(UriCompliance.valueOf("UNKNOWN"), nullValue());
    }

    @Test
    public void testFromString()
    {
        UriCompliance compliance = UriCompliance.from("RFC3986,DEFAULT_HTTP_HOST");
        assertTrue(compliance.allows(DEFAULT_HTTP_HOST));
        assertFalse(compliance.allows(AUTHORITY_RELATIVE_PATH));

        compliance = UriCompliance.from("*,-AUTHORITY_RELATIVE_PATH");
        assertThat(compliance.getAllowed(), contains(DEFAULT_HTTP_HOST));

        compliance = UriCompliance.from("0");
        assertThat(compliance.getAllowed(), empty());

        compliance = UriCompliance.from("DEFAULT, -DEFAULT_HTTP_HOST");
        assertThat(compliance.getAllowed(), contains(AUTHORITY_RELATIVE_PATH));

        assertThrows(IllegalArgumentException.class, () -> UriCompliance.from("DEFAULT,NO_SUCH_VIOLATION"));
    }

    @Test
    public void testWithAndWithout()
    {
        UriCompliance strict = UriCompliance.DEFAULT.without("STRICT", AUTHORITY_RELATIVE_PATH, DEFAULT_HTTP_HOST);
        assertThat(strict.getName(), is("STRICT"));
        assertThat(strict.getAllowed(), empty());

        UriCompliance relaxed = strict.with("RELAXED", AUTHORITY_RELATIVE_PATH);
        assertThat(relaxed.getAllowed(), contains(AUTHORITY_RELATIVE_PATH));
        assertTrue(AUTHORITY_RELATIVE_PATH.isAllowedBy(relaxed));
        assertFalse(DEFAULT_HTTP_HOST.isAllowedBy(relaxed));
    }

    @Test
    public void testAllowedSetIsImmutable()
    {
        assertThrows(UnsupportedOperationException.class, () -> UriCompliance.DEFAULT.getAllowed().clear());
    }

    @Test
    public void testViolationDescriptions()
    {
        assertThat(AUTHORITY_RELATIVE_PATH.getName(), is("AUTHORITY_RELATIVE_PATH"));
        assertTrue(AUTHORITY_RELATIVE_PATH.isDeprecated());
        assertFalse(DEFAULT_HTTP_HOST.isDeprecated());
        assertTrue(AUTHORITY_RELATIVE_PATH.getURL().startsWith("https://tools.ietf.org/html/rfc3986"));
    }

    @Test
    public void testCustomModeAppliedToUri()
    {
        UriCompliance compliance = UriCompliance.from("0,DEFAULT_HTTP_HOST");
        HttpURI uri = HttpURI.parse("https:", compliance, null);
        assertThat(uri.toString(), is("https://localhost"));
        assertThrows(InvalidUriStateException.class, () -> uri.withPath("rootless"));
    }
}
