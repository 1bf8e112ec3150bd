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
package io.browserharness.parser;

import java.util.List;

/**
 * Parsed callable body: parameter list plus statements. Shared by closures, timer callbacks and
 * object-literal methods; the runtime binds it to a captured environment.
 */
public class ScriptHandler {

    public final List<FunctionParam> params;
    public final List<Stmt> stmts;
    public final boolean generator;

    public ScriptHandler(List<FunctionParam> params, List<Stmt> stmts, boolean generator) {
        this.params = List.copyOf(params);
        this.stmts = List.copyOf(stmts);
        this.generator = generator;
    }

    public ScriptHandler(List<FunctionParam> params, List<Stmt> stmts) {
        this(params, stmts, false);
    }

    public int getParamCount() {
        int count = 0;
        for (FunctionParam param : params) {
            if (param.rest || param.defaultValue != null) {
                break;
            }
            count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return (generator ? "*(" : "(") + params + ") => " + stmts;
    }

}
