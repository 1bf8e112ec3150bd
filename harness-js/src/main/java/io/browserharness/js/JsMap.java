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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered map keyed by SameValueZero: numbers by value, {@code NaN} equal to itself,
 * containers by identity.
 */
public class JsMap extends JsObject implements JsIterable {

    private static final Object NULL_KEY = new Object();

    private final Map<Object, Object[]> entries = new LinkedHashMap<>();

    static Object normalize(Object key) {
        if (key == null) {
            return NULL_KEY;
        }
        if (Terms.isNumber(key)) {
            double d = ((Number) key).doubleValue();
            return d == 0 ? 0.0 : d;
        }
        return key;
    }

    public int size() {
        return entries.size();
    }

    public Object get(Object key) {
        Object[] entry = entries.get(normalize(key));
        return entry == null ? Terms.UNDEFINED : entry[1];
    }

    public void set(Object key, Object value) {
        Object normalized = normalize(key);
        Object[] entry = entries.get(normalized);
        if (entry == null) {
            entries.put(normalized, new Object[]{key, value});
        } else {
            entry[1] = value;
        }
    }

    public boolean has(Object key) {
        return entries.containsKey(normalize(key));
    }

    public boolean delete(Object key) {
        return entries.remove(normalize(key)) != null;
    }

    public void clear() {
        entries.clear();
    }

    List<Object> keys() {
        List<Object> list = new ArrayList<>();
        for (Object[] entry : entries.values()) {
            list.add(entry[0]);
        }
        return list;
    }

    List<Object> mapValues() {
        List<Object> list = new ArrayList<>();
        for (Object[] entry : entries.values()) {
            list.add(entry[1]);
        }
        return list;
    }

    /**
     * Entries as {@code [key, value]} arrays, which is what iterating a map yields.
     */
    @Override
    public List<Object> values() {
        List<Object> list = new ArrayList<>();
        for (Object[] entry : entries.values()) {
            list.add(new JsArray(new ArrayList<>(Arrays.asList(entry[0], entry[1]))));
        }
        return list;
    }

    @Override
    public String toString() {
        return "[object Map]";
    }

}
