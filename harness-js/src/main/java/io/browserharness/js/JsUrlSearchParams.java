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

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered name/value pairs in {@code application/x-www-form-urlencoded} form. When owned by a
 * {@link JsUrl}, every mutation rewrites the owner's query.
 */
public class JsUrlSearchParams extends JsObject implements JsIterable {

    final List<String[]> pairs = new ArrayList<>();
    JsUrl owner;

    JsUrlSearchParams() {
    }

    JsUrlSearchParams(String query) {
        parse(query);
    }

    void parse(String query) {
        pairs.clear();
        String q = query.startsWith("?") ? query.substring(1) : query;
        if (q.isEmpty()) {
            return;
        }
        for (String part : q.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            int eq = part.indexOf('=');
            String name = eq < 0 ? part : part.substring(0, eq);
            String value = eq < 0 ? "" : part.substring(eq + 1);
            pairs.add(new String[]{decode(name), decode(value)});
        }
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private void changed() {
        if (owner != null) {
            owner.setQuery(toString());
        }
    }

    public Object get(String name) {
        for (String[] pair : pairs) {
            if (pair[0].equals(name)) {
                return pair[1];
            }
        }
        return null;
    }

    List<Object> getAll(String name) {
        List<Object> values = new ArrayList<>();
        for (String[] pair : pairs) {
            if (pair[0].equals(name)) {
                values.add(pair[1]);
            }
        }
        return values;
    }

    public boolean has(String name) {
        for (String[] pair : pairs) {
            if (pair[0].equals(name)) {
                return true;
            }
        }
        return false;
    }

    public void append(String name, String value) {
        pairs.add(new String[]{name, value});
        changed();
    }

    public void set(String name, String value) {
        boolean found = false;
        Iterator<String[]> it = pairs.iterator();
        while (it.hasNext()) {
            String[] pair = it.next();
            if (pair[0].equals(name)) {
                if (found) {
                    it.remove();
                } else {
                    pair[1] = value;
                    found = true;
                }
            }
        }
        if (!found) {
            pairs.add(new String[]{name, value});
        }
        changed();
    }

    public void delete(String name) {
        pairs.removeIf(pair -> pair[0].equals(name));
        changed();
    }

    @Override
    public List<Object> values() {
        List<Object> list = new ArrayList<>();
        for (String[] pair : pairs) {
            list.add(new JsArray(new ArrayList<>(Arrays.asList((Object) pair[0], pair[1]))));
        }
        return list;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String[] pair : pairs) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(pair[0], StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(pair[1], StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

}
