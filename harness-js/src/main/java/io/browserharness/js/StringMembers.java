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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

import static io.browserharness.js.Members.ABSENT;
import static io.browserharness.js.Members.arg;

/**
 * {@code String.prototype} subset. Indexes are UTF-16 code units.
 */
class StringMembers {

    private StringMembers() {
        // only static methods
    }

    static final Set<String> METHODS = new HashSet<>(Arrays.asList(
            "toUpperCase", "toLowerCase", "trim", "trimStart", "trimEnd", "includes", "startsWith", "endsWith",
            "indexOf", "lastIndexOf", "slice", "substring", "substr", "charAt", "charCodeAt", "codePointAt",
            "split", "replace", "replaceAll", "match", "search", "padStart", "padEnd", "repeat", "at", "concat",
            "localeCompare"
    ));

    static Object property(String s, String name) {
        if ("length".equals(name)) {
            return (long) s.length();
        }
        int index = Terms.toIndex(name);
        if (index >= 0) {
            return index < s.length() ? String.valueOf(s.charAt(index)) : Terms.UNDEFINED;
        }
        return ABSENT;
    }

    static Object call(Interpreter interpreter, String s, String name, List<Object> args) {
        switch (name) {
            case "toUpperCase":
                return s.toUpperCase(Locale.ROOT);
            case "toLowerCase":
                return s.toLowerCase(Locale.ROOT);
            case "trim":
                return Terms.trim(s);
            case "trimStart":
                return Terms.trimStart(s);
            case "trimEnd":
                return Terms.trimEnd(s);
            case "includes": {
                String search = searchString(args, name);
                int from = Terms.relativeIndex(positive(arg(args, 1)), s.length(), 0);
                return s.indexOf(search, from) >= 0;
            }
            case "startsWith": {
                String search = searchString(args, name);
                int from = Terms.relativeIndex(positive(arg(args, 1)), s.length(), 0);
                return s.startsWith(search, from);
            }
            case "endsWith": {
                String search = searchString(args, name);
                int end = Terms.relativeIndex(positive(arg(args, 1)), s.length(), s.length());
                return s.substring(0, end).endsWith(search);
            }
            case "indexOf": {
                String search = Terms.toStr(arg(args, 0));
                int from = Terms.relativeIndex(positive(arg(args, 1)), s.length(), 0);
                return (long) s.indexOf(search, from);
            }
            case "lastIndexOf":
                return (long) s.lastIndexOf(Terms.toStr(arg(args, 0)));
            case "slice": {
                int start = Terms.relativeIndex(arg(args, 0), s.length(), 0);
                int end = Terms.relativeIndex(arg(args, 1), s.length(), s.length());
                return start < end ? s.substring(start, end) : "";
            }
            case "substring": {
                int start = clampIndex(arg(args, 0), s.length(), 0);
                int end = clampIndex(arg(args, 1), s.length(), s.length());
                return s.substring(Math.min(start, end), Math.max(start, end));
            }
            case "substr": {
                int start = Terms.relativeIndex(arg(args, 0), s.length(), 0);
                int length = clampIndex(arg(args, 1), s.length() - start, s.length() - start);
                return s.substring(start, start + length);
            }
            case "charAt": {
                double index = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                return index < 0 || index >= s.length() ? "" : String.valueOf(s.charAt((int) index));
            }
            case "charCodeAt": {
                double index = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                return index < 0 || index >= s.length() ? (Object) Double.NaN : (Object) (long) s.charAt((int) index);
            }
            case "codePointAt": {
                double index = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                return index < 0 || index >= s.length() ? Terms.UNDEFINED : (Object) (long) s.codePointAt((int) index);
            }
            case "split":
                return split(s, arg(args, 0), arg(args, 1));
            case "replace":
            case "replaceAll":
                return replace(interpreter, s, args, "replaceAll".equals(name));
            case "match": {
                Object pattern = arg(args, 0);
                JsRegex regex = pattern instanceof JsRegex ? (JsRegex) pattern
                        : new JsRegex(pattern == Terms.UNDEFINED ? "" : Terms.toStr(pattern), "");
                return regex.match(s);
            }
            case "search": {
                Object pattern = arg(args, 0);
                JsRegex regex = pattern instanceof JsRegex ? (JsRegex) pattern : new JsRegex(Terms.toStr(pattern), "");
                Matcher matcher = regex.pattern.matcher(s);
                return matcher.find() ? (long) matcher.start() : -1L;
            }
            case "padStart":
            case "padEnd": {
                int length = (int) Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                Object fillArg = arg(args, 1);
                String fill = fillArg == Terms.UNDEFINED ? " " : Terms.toStr(fillArg);
                if (length <= s.length() || fill.isEmpty()) {
                    return s;
                }
                StringBuilder padding = new StringBuilder();
                while (padding.length() < length - s.length()) {
                    padding.append(fill);
                }
                padding.setLength(length - s.length());
                return "padStart".equals(name) ? padding + s : s + padding;
            }
            case "repeat": {
                double count = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                if (count < 0 || Double.isInfinite(count)) {
                    throw new ScriptRuntimeException("invalid count value: " + Terms.toStr(arg(args, 0)));
                }
                return s.repeat((int) count);
            }
            case "at": {
                double index = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                if (index < 0) {
                    index += s.length();
                }
                return index < 0 || index >= s.length() ? Terms.UNDEFINED : String.valueOf(s.charAt((int) index));
            }
            case "concat": {
                StringBuilder sb = new StringBuilder(s);
                for (Object item : args) {
                    sb.append(Terms.toStr(item));
                }
                return sb.toString();
            }
            case "localeCompare": {
                int result = s.compareTo(Terms.toStr(arg(args, 0)));
                return (long) Integer.signum(result);
            }
            default:
                return ABSENT;
        }
    }

    private static String searchString(List<Object> args, String method) {
        Object search = arg(args, 0);
        if (search instanceof JsRegex) {
            throw new ScriptRuntimeException("first argument to String.prototype." + method + " must not be a regular expression");
        }
        return Terms.toStr(search);
    }

    private static Object positive(Object arg) {
        if (arg != Terms.UNDEFINED && Terms.toNumber(arg) < 0) {
            return 0L;
        }
        return arg;
    }

    private static int clampIndex(Object arg, int length, int defaultValue) {
        if (arg == Terms.UNDEFINED) {
            return defaultValue;
        }
        double d = Terms.toIntegerOrInfinity(Terms.toNumber(arg));
        return (int) Math.max(0, Math.min(d, length));
    }

    private static JsArray split(String s, Object separator, Object limitArg) {
        int limit = limitArg == Terms.UNDEFINED ? Integer.MAX_VALUE : (int) Terms.toUint32(Terms.toNumber(limitArg));
        if (limit < 0) {
            limit = Integer.MAX_VALUE;
        }
        List<Object> parts = new ArrayList<>();
        if (limit == 0) {
            return new JsArray(parts);
        }
        if (separator == Terms.UNDEFINED) {
            parts.add(s);
            return new JsArray(parts);
        }
        if (separator instanceof JsRegex) {
            return new JsArray(((JsRegex) separator).split(s, limit));
        }
        String sep = Terms.toStr(separator);
        if (sep.isEmpty()) {
            for (int i = 0; i < s.length() && parts.size() < limit; i++) {
                parts.add(String.valueOf(s.charAt(i)));
            }
            return new JsArray(parts);
        }
        int start = 0;
        while (parts.size() < limit) {
            int found = s.indexOf(sep, start);
            if (found < 0) {
                parts.add(s.substring(start));
                break;
            }
            parts.add(s.substring(start, found));
            start = found + sep.length();
        }
        return new JsArray(parts);
    }

    private static String replace(Interpreter interpreter, String s, List<Object> args, boolean all) {
        Object pattern = arg(args, 0);
        Object replacement = arg(args, 1);
        JsRegex regex;
        if (pattern instanceof JsRegex) {
            regex = (JsRegex) pattern;
            if (all && !regex.global) {
                throw new ScriptRuntimeException("replaceAll must be called with a global RegExp");
            }
        } else {
            regex = new JsRegex(escape(Terms.toStr(pattern)), all ? "g" : "");
        }
        return regex.replace(interpreter, s, replacement);
    }

    /**
     * Regular expression source matching the given text literally.
     */
    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ("\\^$.*+?()[]{}|/".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

}
