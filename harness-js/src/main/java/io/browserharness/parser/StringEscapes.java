/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.browserharness.parser;

public class StringEscapes {

    private StringEscapes() {
        // only static methods
    }

    private static boolean isHex(String s, int start, int end) {
        if (end > s.length() || start >= end) {
            return false;
        }
        for (int i = start; i < end; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decodes JS escape sequences in the raw body of a string or template segment.
     * Unknown escapes resolve to the escaped char itself.
     */
    public static String unescape(String raw) {
        if (raw.indexOf('\\') == -1) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        int len = raw.length();
        int i = 0;
        while (i < len) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= len) {
                sb.append(c);
                i++;
                continue;
            }
            char next = raw.charAt(i + 1);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'v':
                    sb.append('\u000B');
                    break;
                case '0':
                    sb.append('\0');
                    break;
                case '\n':
                    break; // line continuation
                case 'u':
                    if (i + 2 < len && raw.charAt(i + 2) == '{') {
                        int close = raw.indexOf('}', i + 3);
                        if (close > 0 && isHex(raw, i + 3, close)) {
                            sb.appendCodePoint(Integer.parseInt(raw.substring(i + 3, close), 16));
                            i = close + 1;
                            continue;
                        }
                    } else if (isHex(raw, i + 2, i + 6)) {
                        sb.append((char) Integer.parseInt(raw.substring(i + 2, i + 6), 16));
                        i += 6;
                        continue;
                    }
                    sb.append('u');
                    break;
                case 'x':
                    if (isHex(raw, i + 2, i + 4)) {
                        sb.append((char) Integer.parseInt(raw.substring(i + 2, i + 4), 16));
                        i += 4;
                        continue;
                    }
                    sb.append('x');
                    break;
                default:
                    sb.append(next);
            }
            i += 2;
        }
        return sb.toString();
    }

    /**
     * Inverse of {@link #unescape(String)} for double-quoted output, used when printing strings as JSON-like text.
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

}
