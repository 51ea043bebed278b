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

/**
 * TYPE Utilities.
 * Provides various static utility methods for manipulating types and their
 * string representations.
 */
public class TypeUtil
{
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private TypeUtil()
    {
    }

    /**
     * Parse an int from a substring.
     * Negative numbers are not handled.
     *
     * @param s String
     * @param offset Offset within string
     * @param length Length of integer or -1 for remainder of string
     * @param base base of the integer, at most 16
     * @return the parsed integer
     * @throws NumberFormatException if the string cannot be parsed or overflows
     */
    public static int parseInt(String s, int offset, int length, int base)
        throws NumberFormatException
    {
        if (length < 0)
            length = s.length() - offset;
        if (length == 0)
            throw new NumberFormatException("empty");

        long value = 0;
        for (int i = 0; i < length; i++)
        {
            char c = s.charAt(offset + i);
            int digit = digitValue(c);
            if (digit < 0 || digit >= base)
                throw new NumberFormatException(s.substring(offset, offset + length));
            value = value * base + digit;
            if (value > Integer.MAX_VALUE)
                throw new NumberFormatException(s.substring(offset, offset + length));
        }
        return (int)value;
    }

    /**
     * @param c An ASCII encoded character 0-9 a-f A-F
     * @return The byte value of the character 0-16.
     */
    public static int convertHexDigit(char c)
    {
        int d = digitValue(c);
        if (d < 0)
            throw new NumberFormatException("!hex " + c);
        return d;
    }

    // ASCII only: RFC 3986 DIGIT and HEXDIG exclude other Unicode digits
    private static int digitValue(char c)
    {
        if (c >= '0' && c <= '9')
            return c - '0';
        if (c >= 'a' && c <= 'f')
            return c - 'a' + 10;
        if (c >= 'A' && c <= 'F')
            return c - 'A' + 10;
        return -1;
    }

    /**
     * Append the two upper case hex digits of a byte.
     *
     * @param b the byte
     * @param buf the buffer to append to
     */
    public static void toHex(byte b, StringBuilder buf)
    {
        int bi = 0xff & b;
        buf.append(HEX_DIGITS[bi >> 4]);
        buf.append(HEX_DIGITS[bi & 0xf]);
    }
}
