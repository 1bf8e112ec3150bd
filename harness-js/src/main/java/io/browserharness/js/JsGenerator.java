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

/**
 * Result of calling a generator function. The body has already run to completion and its yields are
 * buffered, so iteration only walks the buffer. Iterating consumes it, as with a real generator.
 */
public class JsGenerator extends JsObject implements JsIterable {

    private final List<Object> yielded;
    private final Object returnValue;
    private int index;
    private boolean done;

    JsGenerator(List<Object> yielded, Object returnValue) {
        this.yielded = yielded;
        this.returnValue = returnValue;
    }

    /**
     * One {@code {value, done}} step. The return value of the body is reported once, with the first
     * {@code done: true} result.
     */
    JsObject next() {
        if (!done && index < yielded.size()) {
            return result(yielded.get(index++), false);
        }
        Object value = done ? Terms.UNDEFINED : returnValue;
        done = true;
        return result(value, true);
    }

    JsObject finish(Object value) {
        done = true;
        index = yielded.size();
        return result(value, true);
    }

    private static JsObject result(Object value, boolean done) {
        JsObject result = new JsObject();
        result.putMember("value", value);
        result.putMember("done", done);
        return result;
    }

    @Override
    public List<Object> values() {
        List<Object> remaining = done ? new ArrayList<>() : new ArrayList<>(yielded.subList(index, yielded.size()));
        index = yielded.size();
        done = true;
        return remaining;
    }

    @Override
    public String toString() {
        return "[object Generator]";
    }

}
