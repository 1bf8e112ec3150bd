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
import java.util.function.Consumer;

/**
 * Promise state cell. Settles at most once; reactions registered while pending are handed to the
 * scheduler as microtasks when it does.
 */
public class JsPromise extends JsObject {

    public enum State {
        PENDING, FULFILLED, REJECTED
    }

    State state = State.PENDING;
    Object value = Terms.UNDEFINED;
    boolean locked; // resolved with another promise, waiting for it
    final List<Consumer<JsPromise>> reactions = new ArrayList<>();

    public State getState() {
        return state;
    }

    public Object getValue() {
        return value;
    }

    public boolean isSettled() {
        return state != State.PENDING;
    }

    @Override
    public String toString() {
        return "[object Promise]";
    }

}
