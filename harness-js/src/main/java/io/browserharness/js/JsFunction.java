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

import io.browserharness.parser.ScriptHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Closure: a parsed handler bound to the environment it was created in. Functions created at the top
 * level share the global bindings; nested ones own a snapshot whose values alias the same containers.
 */
public class JsFunction extends JsObject implements JsCallable {

    final String name;
    final ScriptHandler handler;
    final Map<String, Object> captured;
    final Map<String, Object> origin; // environment the closure was created in
    final Set<String> globalNames;
    final boolean globalScope;
    final boolean async;
    final boolean arrow;
    final String eventParam;
    final EventState event;

    JsFunction(String name, ScriptHandler handler, Map<String, Object> captured, Map<String, Object> origin,
               Set<String> globalNames, boolean globalScope, boolean async, boolean arrow, String eventParam, EventState event) {
        this.name = name == null ? "" : name;
        this.handler = handler;
        this.captured = captured;
        this.origin = origin;
        this.globalNames = globalNames;
        this.globalScope = globalScope;
        this.async = async;
        this.arrow = arrow;
        this.eventParam = eventParam;
        this.event = event;
    }

    public String getName() {
        return name;
    }

    @Override
    public Object call(Interpreter interpreter, Object thisObject, List<Object> args) {
        return Executor.callFunction(interpreter, this, thisObject, args);
    }

    @Override
    public String toString() {
        return "function " + name + "() { [script code] }";
    }

}
