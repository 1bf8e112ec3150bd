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

/**
 * Global namespace objects whose members are host functions and constants.
 */
public enum Namespace {

    MATH("Math"),
    JSON("JSON"),
    CONSOLE("console"),
    INTL("Intl"),
    DOCUMENT("document"),
    PERFORMANCE("performance");

    final String jsName;

    Namespace(String jsName) {
        this.jsName = jsName;
    }

    static Namespace byName(String name) {
        for (Namespace ns : values()) {
            if (ns.jsName.equals(name)) {
                return ns;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "[object " + (this == DOCUMENT ? "HTMLDocument" : jsName) + "]";
    }

}
