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

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Execution state of one statement list: the flat environment, the names declared in it, and the
 * pending return.
 */
class Frame {

    final Map<String, Object> env;
    final String eventParam;
    final EventState event;
    final Set<String> locals = new HashSet<>();
    final Set<String> constants;

    boolean returned;
    Object returnValue = Terms.UNDEFINED;

    Frame(Map<String, Object> env, String eventParam, EventState event, Set<String> constants) {
        this.env = env;
        this.eventParam = eventParam;
        this.event = event;
        this.constants = constants;
    }

    Frame(Map<String, Object> env, String eventParam, EventState event) {
        this(env, eventParam, event, new HashSet<>());
    }

    void declare(String name, Object value, boolean constant) {
        locals.add(name);
        if (constant) {
            constants.add(name);
        } else {
            constants.remove(name);
        }
        env.put(name, value);
    }

    void assign(String name, Object value) {
        if (constants.contains(name)) {
            throw new ScriptRuntimeException("assignment to constant variable: " + name);
        }
        env.put(name, value);
    }

}
