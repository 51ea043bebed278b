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

package io.urikit.util;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StringUtilTest
{
    @Test
    public void testAsciiToLowerCase()
    {
        String lc = "ڐbc def 1ڐ";
        assertEquals(StringUtil.asciiToLowerCase("ڐBc DeF 1ڐ"), lc);
        assertThat(StringUtil.asciiToLowerCase(lc), sameInstance(lc));
        assertThat(StringUtil.asciiToLowerCase("EXAMPLE.COM"), is("example.com"));
    }

    @Test
    public void testIndexOfWhitespace()
    {
        assertThat(StringUtil.indexOfWhitespace("/path"), is(-1));
        assertThat(StringUtil.indexOfWhitespace("/pa th"), is(3));
        assertThat(StringUtil.indexOfWhitespace("/path\n"), is(5));
        assertThat(StringUtil.indexOfWhitespace(null), is(-1));
    }

    @Test
    public void testIsHex()
    {
        assertTrue(StringUtil.isHex("%2F", 1, 2));
        assertTrue(StringUtil.isHex("aF09", 0, 4));
        assertFalse(StringUtil.isHex("%2", 1, 2));
        assertFalse(StringUtil.isHex("%G1", 1, 2));
    }

    @Test
    public void testTrimSpaceAndTab()
    {
        assertThat(StringUtil.trimSpaceAndTab(" \tvalue\t "), is("value"));
        assertThat(StringUtil.trimSpaceAndTab("value"), is("value"));
        assertThat(StringUtil.trimSpaceAndTab("\t"), is(""));
    }

    @Test
    public void testSplit()
    {
        assertThat(StringUtil.split("a&b&&c", '&'), contains("a", "b", "", "c"));
        assertThat(StringUtil.split("", '&'), contains(""));
    }

    @Test
    public void testParseInt()
    {
        assertThat(TypeUtil.parseInt("host:8080", 5, 4, 10), is(8080));
        assertThat(TypeUtil.parseInt("65535", 0, -1, 10), is(65535));
        assertThrows(NumberFormatException.class, () -> TypeUtil.parseInt("8o", 0, 2, 10));
        assertThrows(NumberFormatException.class, () -> TypeUtil.parseInt("x", 1, 0, 10));
        assertThrows(NumberFormatException.class, () -> TypeUtil.parseInt("99999999999", 0, -1, 10));
        assertThrows(NumberFormatException.class, () -> TypeUtil.parseInt("\u0668\u0660\u0668\u0660", 0, -1, 10));
        assertThrows(NumberFormatException.class, () -> TypeUtil.parseInt("8`", 0, -1, 10));
        assertThrows(NumberFormatException.class, () -> TypeUtil.parseInt("1a", 0, -1, 10));
        assertThat(TypeUtil.parseInt("ff", 0, -1, 16), is(255));
    }
}
