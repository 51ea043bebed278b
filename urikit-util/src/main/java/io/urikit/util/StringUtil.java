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

import java.util.ArrayList;
import java.util.List;

/**
 * Fast String Utilities.
 *
 * These utilities avoid object creation unless absolutely required
 * and only ever treat ASCII characters specially.
 */
public class StringUtil
{
    public static final String EMPTY = "";

    private StringUtil()
    {
    }

    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param c the char to convert
     * @return a lower case version of c
     */
    public static char asciiToLowerCase(char c)
    {
        return (c >= 'A' && c <= 'Z') ? (char)(c + ('a' - 'A')) : c;
    }

    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param s the string to convert
     * @return a lower case version of s, or s itself if it has no upper case ascii
     */
    public static String asciiToLowerCase(String s)
    {
        if (s == null)
            return null;

        char[] c = null;
        int i = s.length();
        // look for first conversion
        while (i-- > 0)
        {
            char c1 = s.charAt(i);
            char c2 = asciiToLowerCase(c1);
            if (c1 != c2)
            {
                c = s.toCharArray();
                c[i] = c2;
                break;
            }
        }
        while (i-- > 0)
        {
            c[i] = asciiToLowerCase(c[i]);
        }

        return c == null ? s : new String(c);
    }

    /**
     * <p>Checks if a String is empty ("") or null.</p>
     *
     * @param str the string to test.
     * @return true if string is null or empty.
     */
    public static boolean isEmpty(String str)
    {
        return str == null || str.isEmpty();
    }

    /**
     * @param s the string or null
     * @return the string, or the empty string if null
     */
    public static String nonNull(String s)
    {
        if (s == null)
            return EMPTY;
        return s;
    }

    /**
     * Find the first whitespace character.
     *
     * @param str the string to check
     * @return the index of the first character for which {@link Character#isWhitespace(int)} is true, or -1
     */
    public static int indexOfWhitespace(String str)
    {
        if (str == null)
            return -1;
        int len = str.length();
        for (int i = 0; i < len; i++)
        {
            if (Character.isWhitespace(str.codePointAt(i)))
                return i;
        }
        return -1;
    }

    public static boolean isHex(String str, int offset, int length)
    {
        if (offset < 0 || offset + length > str.length())
            return false;

        for (int i = offset; i < (offset + length); i++)
        {
            char c = str.charAt(i);
            if (!(((c >= 'a') && (c <= 'f')) ||
                ((c >= 'A') && (c <= 'F')) ||
                ((c >= '0') && (c <= '9'))))
            {
                return false;
            }
        }
        return true;
    }

    /**
     * Trim the characters space and horizontal tab from both ends.
     * Other whitespace is significant and retained.
     *
     * @param s the string to trim
     * @return the trimmed string
     */
    public static String trimSpaceAndTab(String s)
    {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == ' ' || s.charAt(start) == '\t'))
            start++;
        while (end > start && (s.charAt(end - 1) == ' ' || s.charAt(end - 1) == '\t'))
            end--;
        return (start == 0 && end == s.length()) ? s : s.substring(start, end);
    }

    /**
     * Split a string on a single character, keeping empty elements.
     *
     * @param s the string to split
     * @param delim the delimiter
     * @return the elements, one empty element for an empty string
     */
    public static List<String> split(String s, char delim)
    {
        List<String> list = new ArrayList<>();
        int mark = 0;
        for (int i = 0; i < s.length(); i++)
        {
            if (s.charAt(i) == delim)
            {
                list.add(s.substring(mark, i));
                mark = i + 1;
            }
        }
        list.add(s.substring(mark));
        return list;
    }
}
