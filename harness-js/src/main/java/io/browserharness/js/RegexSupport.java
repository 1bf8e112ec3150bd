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
package io.browserharness.js;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translation of JS regex source and flags to {@link java.util.regex}, and JS replacement-string
 * expansion.
 */
class RegexSupport {

    private RegexSupport() {
        // only static methods
    }

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    static Pattern compile(String source, String flags) {
        int javaFlags = 0;
        if (flags.indexOf('i') >= 0) {
            javaFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (flags.indexOf('m') >= 0) {
            javaFlags |= Pattern.MULTILINE;
        }
        if (flags.indexOf('s') >= 0) {
            javaFlags |= Pattern.DOTALL;
        }
        try {
            return Pattern.compile(toJavaSource(source), javaFlags);
        } catch (PatternSyntaxException e) {
            throw new ScriptRuntimeException("invalid regular expression: /" + source + "/: " + e.getDescription());
        }
    }

    /**
     * JS accepts {@code [^]} (any char) and {@code []} (nothing), which Java does not; both are
     * rewritten outside escapes.
     */
    static String toJavaSource(String source) {
        StringBuilder sb = new StringBuilder(source.length());
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                sb.append(c).append(source.charAt(++i));
            } else if (source.startsWith("[^]", i)) {
                sb.append("[\\s\\S]");
                i += 2;
            } else if (source.startsWith("[]", i)) {
                sb.append("(?!)");
                i += 1;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static List<String> groupNames(String source) {
        List<String> names = new ArrayList<>();
        Matcher matcher = GROUP_NAME.matcher(source);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Expands {@code $&}, {@code $1}..{@code $99}, {@code $<name>}, {@code $`}, {@code $'} and {@code $$}.
     */
    static String expand(Matcher matcher, String replacement, String input) {
        StringBuilder sb = new StringBuilder();
        int n = replacement.length();
        for (int i = 0; i < n; i++) {
            char c = replacement.charAt(i);
            if (c != '$' || i + 1 >= n) {
                sb.append(c);
                continue;
            }
            char next = replacement.charAt(i + 1);
            if (next == '$') {
                sb.append('$');
                i++;
            } else if (next == '&') {
                sb.append(matcher.group());
                i++;
            } else if (next == '`') {
                sb.append(input, 0, matcher.start());
                i++;
            } else if (next == '\'') {
                sb.append(input, matcher.end(), input.length());
                i++;
            } else if (Character.isDigit(next)) {
                int group = next - '0';
                int consumed = 1;
                if (i + 2 < n && Character.isDigit(replacement.charAt(i + 2))) {
                    int two = group * 10 + (replacement.charAt(i + 2) - '0');
                    if (two <= matcher.groupCount()) {
                        group = two;
                        consumed = 2;
                    }
                }
                if (group == 0 || group > matcher.groupCount()) {
                    sb.append(c);
                    continue;
                }
                String value = matcher.group(group);
                sb.append(value == null ? "" : value);
                i += consumed;
            } else if (next == '<') {
                int close = replacement.indexOf('>', i + 2);
                if (close < 0) {
                    sb.append(c);
                    continue;
                }
                String value;
                try {
                    value = matcher.group(replacement.substring(i + 2, close));
                } catch (IllegalArgumentException e) {
                    value = null;
                }
                sb.append(value == null ? "" : value);
                i = close;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

}
