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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered set with the same key equality as {@link JsMap}.
 */
public class JsSet extends JsObject implements JsIterable {

    private final Map<Object, Object> items = new LinkedHashMap<>();

    public int size() {
        return items.size();
    }

    public void add(Object value) {
        items.putIfAbsent(JsMap.normalize(value), value);
    }

    public boolean has(Object value) {
        return items.containsKey(JsMap.normalize(value));
    }

    public boolean delete(Object value) {
        Object key = JsMap.normalize(value);
        if (!items.containsKey(key)) {
            return false;
        }
        items.remove(key);
        return true;
    }

    public void clear() {
        items.clear();
    }

    @Override
    public List<Object> values() {
        return new ArrayList<>(items.values());
    }

    @Override
    public String toString() {
        return "[object Set]";
    }

}
