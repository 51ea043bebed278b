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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * URI Utility methods.
 * <p>
 * This class assists with the percent encoding and decoding of the
 * individual components of a URI as defined by
 * <a href="https://tools.ietf.org/html/rfc3986#section-2">RFC 3986 section 2</a>.
 * All encoders are idempotent: a {@code %} that already starts a valid
 * {@code %XX} escape is kept as is, so an encoded value is never encoded twice.
 * </p>
 */
public class URIUtil
{
    // Use UTF-8 as per http://www.w3.org/TR/html40/appendix/notes.html#non-ascii-chars
    public static final Charset __CHARSET = StandardCharsets.UTF_8;

    public static final String SLASH = "/";

    /**
     * Characters allowed unencoded in a path in addition to unreserved and sub-delims.
     */
    public static final String PATH_LITERALS = ":@/";

    /**
     * Characters allowed unencoded in a query or fragment in addition to unreserved and sub-delims.
     */
    public static final String QUERY_LITERALS = ":@/?";

    private static final String UNRESERVED = "-._~";
    private static final String SUB_DELIMS = "!$&'()*+,;=";

    private static final boolean[] __allowed = new boolean[128];

    private static final byte[] REPLACEMENT_UTF8 = "\uFFFD".getBytes(StandardCharsets.UTF_8);

    static
    {
        for (char c = 'a'; c <= 'z'; c++)
            __allowed[c] = true;
        for (char c = 'A'; c <= 'Z'; c++)
            __allowed[c] = true;
        for (char c = '0'; c <= '9'; c++)
            __allowed[c] = true;
        for (char c : UNRESERVED.toCharArray())
            __allowed[c] = true;
        for (char c : SUB_DELIMS.toCharArray())
            __allowed[c] = true;
    }

    private URIUtil()
    {
    }

    /**
     * Encode the user or password part of a user information component.
     *
     * @param userInfo the user or password
     * @return the encoded value
     */
    public static String encodeUserInfo(String userInfo)
    {
        return encodeComponent(userInfo, StringUtil.EMPTY);
    }

    /**
     * Encode a URI path.
     *
     * @param path the path to encode
     * @return the encoded path
     */
    public static String encodePath(String path)
    {
        return encodeComponent(path, PATH_LITERALS);
    }

    /**
     * Encode a URI query or fragment.
     *
     * @param query the query or fragment to encode
     * @return the encoded query or fragment
     */
    public static String encodeQuery(String query)
    {
        return encodeComponent(query, QUERY_LITERALS);
    }

    /**
     * Percent encode every character that is neither unreserved, a sub-delim,
     * nor one of the passed literals. A {@code %} followed by two hex digits is
     * retained; any other {@code %} is encoded as {@code %25}.
     * Non ASCII characters are encoded as their UTF-8 bytes, with an unpaired
     * surrogate encoded as U+FFFD.
     *
     * @param component the component to encode (may be null)
     * @param literals the extra characters allowed by the component
     * @return the encoded component, or the passed instance if nothing needed encoding
     */
    public static String encodeComponent(String component, String literals)
    {
        if (component == null || component.isEmpty())
            return component;

        StringBuilder buf = null;
        int length = component.length();
        for (int i = 0; i < length; i++)
        {
            char c = component.charAt(i);
            if (isAllowed(component, i, literals))
            {
                if (buf != null)
                    buf.append(c);
                continue;
            }

            if (buf == null)
            {
                buf = new StringBuilder(length * 2);
                buf.append(component, 0, i);
            }

            if (c < 0x80)
            {
                buf.append('%');
                TypeUtil.toHex((byte)c, buf);
            }
            else
            {
                int end = Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(component.charAt(i + 1)) ? i + 2 : i + 1;
                for (byte b : toUtf8(component, i, end))
                {
                    buf.append('%');
                    TypeUtil.toHex(b, buf);
                }
                i = end - 1;
            }
        }
        return buf == null ? component : buf.toString();
    }

    /**
     * UTF-8 bytes of a single character or surrogate pair.
     * An unpaired surrogate is replaced by U+FFFD.
     */
    private static byte[] toUtf8(String component, int start, int end)
    {
        if (end - start == 1 && Character.isSurrogate(component.charAt(start)))
            return REPLACEMENT_UTF8.clone();
        return component.substring(start, end).getBytes(__CHARSET);
    }

    private static boolean isAllowed(String component, int index, String literals)
    {
        char c = component.charAt(index);
        if (c == '%')
            return StringUtil.isHex(component, index + 1, 2);
        if (c >= 0x80)
            return false;
        return __allowed[c] || literals.indexOf(c) >= 0;
    }

    /**
     * Decode every {@code %XX} escape of a component as UTF-8.
     * Unlike form decoding, {@code +} is not treated as a space.
     * A {@code %} that does not start a valid escape is kept as is.
     *
     * @param component the encoded component
     * @return the decoded component
     */
    public static String decodeComponent(String component)
    {
        if (component == null || component.indexOf('%') < 0)
            return component;

        int length = component.length();
        // a UTF-16 char never needs more than 3 UTF-8 bytes
        byte[] bytes = new byte[length * 3];
        int n = 0;
        for (int i = 0; i < length; i++)
        {
            char c = component.charAt(i);
            if (c == '%' && StringUtil.isHex(component, i + 1, 2))
            {
                bytes[n++] = (byte)((TypeUtil.convertHexDigit(component.charAt(i + 1)) << 4) +
                    TypeUtil.convertHexDigit(component.charAt(i + 2)));
                i += 2;
            }
            else if (c < 0x80)
            {
                bytes[n++] = (byte)c;
            }
            else
            {
                int chars = Character.charCount(component.codePointAt(i));
                byte[] utf8 = toUtf8(component, i, i + chars);
                System.arraycopy(utf8, 0, bytes, n, utf8.length);
                n += utf8.length;
                i += chars - 1;
            }
        }
        return new String(bytes, 0, n, __CHARSET);
    }

    /**
     * Test a scheme against the RFC 3986 grammar
     * {@code ALPHA *( ALPHA / DIGIT / "+" / "-" / "." )}.
     *
     * @param scheme the scheme, without the trailing ':'
     * @return true if the scheme is syntactically valid
     */
    public static boolean isValidScheme(String scheme)
    {
        if (StringUtil.isEmpty(scheme))
            return false;
        for (int i = 0; i < scheme.length(); i++)
        {
            if (!isSchemeChar(scheme.charAt(i), i == 0))
                return false;
        }
        return true;
    }

    /**
     * @param c the character
     * @param first true if the character is the first of the scheme
     * @return true if the character may appear at that position of a scheme
     */
    public static boolean isSchemeChar(char c, boolean first)
    {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))
            return true;
        if (first)
            return false;
        return (c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.';
    }
}
