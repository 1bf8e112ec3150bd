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

/**
 * Compiled regular expression with JS {@code lastIndex} semantics for the global and sticky flags.
 */
public class JsRegex extends JsObject {

    final String source;
    final String flags;
    final Pattern pattern;
    final boolean global;
    final boolean sticky;
    private final List<String> groupNames;

    int lastIndex;

    JsRegex(String source, String flags) {
        this.source = source.isEmpty() ? "(?:)" : source;
        this.flags = flags == null ? "" : flags;
        this.global = this.flags.indexOf('g') >= 0;
        this.sticky = this.flags.indexOf('y') >= 0;
        this.pattern = RegexSupport.compile(source, this.flags);
        this.groupNames = RegexSupport.groupNames(source);
    }

    private boolean usesLastIndex() {
        return global || sticky;
    }

    private Matcher find(String input, int from) {
        if (from > input.length()) {
            return null;
        }
        Matcher matcher = pattern.matcher(input);
        if (sticky) {
            matcher.region(from, input.length());
            return matcher.lookingAt() ? matcher : null;
        }
        return matcher.find(from) ? matcher : null;
    }

    public boolean test(String input) {
        return exec(input) != null;
    }

    /**
     * @return the match array with {@code index}, {@code input} and {@code groups} members, or null
     */
    public JsArray exec(String input) {
        int from = usesLastIndex() ? lastIndex : 0;
        Matcher matcher = find(input, from);
        if (matcher == null) {
            if (usesLastIndex()) {
                lastIndex = 0;
            }
            return null;
        }
        if (usesLastIndex()) {
            lastIndex = matcher.end() == matcher.start() && !sticky ? matcher.end() + 1 : matcher.end();
        }
        return toMatchArray(matcher, input);
    }

    JsArray toMatchArray(Matcher matcher, String input) {
        List<Object> items = new ArrayList<>();
        items.add(matcher.group());
        for (int i = 1; i <= matcher.groupCount(); i++) {
            String group = matcher.group(i);
            items.add(group == null ? Terms.UNDEFINED : group);
        }
        JsArray result = new JsArray(items);
        result.putMember("index", (long) matcher.start());
        result.putMember("input", input);
        if (groupNames.isEmpty()) {
            result.putMember("groups", Terms.UNDEFINED);
        } else {
            JsObject groups = new JsObject();
            for (String name : groupNames) {
                String group = matcher.group(name);
                groups.putMember(name, group == null ? Terms.UNDEFINED : group);
            }
            result.putMember("groups", groups);
        }
        return result;
    }

    /**
     * {@code String.prototype.match}: all matched strings for a global regex, else the exec result.
     */
    Object match(String input) {
        if (!global) {
            return exec(input);
        }
        List<Object> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(input);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        lastIndex = 0;
        return matches.isEmpty() ? null : new JsArray(matches);
    }

    /**
     * Replaces the first match, or every match when global. A callable replacement receives the match,
     * the groups, the offset and the input.
     */
    String replace(Interpreter interpreter, String input, Object replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            sb.append(input, last, matcher.start());
            if (replacement instanceof JsCallable) {
                List<Object> args = new ArrayList<>();
                args.add(matcher.group());
                for (int i = 1; i <= matcher.groupCount(); i++) {
                    String group = matcher.group(i);
                    args.add(group == null ? Terms.UNDEFINED : group);
                }
                args.add((long) matcher.start());
                args.add(input);
                sb.append(Terms.toStr(((JsCallable) replacement).call(interpreter, Terms.UNDEFINED, args)));
            } else {
                sb.append(RegexSupport.expand(matcher, Terms.toStr(replacement), input));
            }
            last = matcher.end();
            if (!global) {
                break;
            }
        }
        sb.append(input, last, input.length());
        if (global) {
            lastIndex = 0;
        }
        return sb.toString();
    }

    List<Object> split(String input, int limit) {
        List<Object> parts = new ArrayList<>();
        if (input.isEmpty()) {
            if (!pattern.matcher(input).matches()) {
                parts.add(input);
            }
            return parts;
        }
        Matcher matcher = pattern.matcher(input);
        int last = 0;
        while (matcher.find() && parts.size() < limit) {
            if (matcher.end() == matcher.start() && (matcher.start() == 0 || matcher.start() >= input.length())) {
                continue;
            }
            parts.add(input.substring(last, matcher.start()));
            for (int i = 1; i <= matcher.groupCount() && parts.size() < limit; i++) {
                String group = matcher.group(i);
                parts.add(group == null ? Terms.UNDEFINED : group);
            }
            last = matcher.end();
        }
        if (parts.size() < limit) {
            parts.add(input.substring(last));
        }
        return parts;
    }

    @Override
    public String toString() {
        return "/" + source + "/" + flags;
    }

}
