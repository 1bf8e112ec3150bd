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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain object, and the base of every container so that each one carries an own-property bag.
 */
public class JsObject implements ObjectLike {

    final Map<String, Object> props;

    JsFunction constructedBy;
    boolean frozen;

    public JsObject() {
        this(new LinkedHashMap<>());
    }

    JsObject(Map<String, Object> props) {
        this.props = props;
    }

    @Override
    public Object getMember(String name) {
        Object value = props.get(name);
        if (value == null && !props.containsKey(name)) {
            return Terms.UNDEFINED;
        }
        return value;
    }

    @Override
    public void putMember(String name, Object value) {
        if (!frozen) {
            props.put(name, value);
        }
    }

    @Override
    public boolean hasMember(String name) {
        return props.containsKey(name);
    }

    @Override
    public boolean removeMember(String name) {
        if (frozen) {
            return false;
        }
        props.remove(name);
        return true;
    }

    @Override
    public Collection<String> memberNames() {
        return new ArrayList<>(props.keySet());
    }

    @Override
    public String toString() {
        return "[object Object]";
    }

}
