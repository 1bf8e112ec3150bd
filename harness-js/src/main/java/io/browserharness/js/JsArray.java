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

public class JsArray extends JsObject {

    final List<Object> list;

    public JsArray(List<Object> list) {
        this.list = list;
    }

    public JsArray() {
        this(new ArrayList<>());
    }

    public List<Object> getList() {
        return list;
    }

    Object get(int index) {
        if (index < 0 || index >= list.size()) {
            return Terms.UNDEFINED;
        }
        return list.get(index);
    }

    void set(int index, Object value) {
        if (frozen) {
            return;
        }
        while (list.size() <= index) {
            list.add(Terms.UNDEFINED);
        }
        list.set(index, value);
    }

    void setLength(int length) {
        while (list.size() > length) {
            list.remove(list.size() - 1);
        }
        while (list.size() < length) {
            list.add(Terms.UNDEFINED);
        }
    }

    @Override
    public String toString() {
        return Terms.join(list, ",");
    }

}
