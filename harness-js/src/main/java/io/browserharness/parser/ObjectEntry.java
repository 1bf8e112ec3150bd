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

/**
 * One member of an object literal. Exactly one of {@code key} and {@code computedKey} is set,
 * except for a spread entry where neither is.
 */
public class ObjectEntry {

    public final String key;
    public final Expr computedKey;
    public final Expr value;
    public final boolean spread;

    private ObjectEntry(String key, Expr computedKey, Expr value, boolean spread) {
        this.key = key;
        this.computedKey = computedKey;
        this.value = value;
        this.spread = spread;
    }

    public static ObjectEntry of(String key, Expr value) {
        return new ObjectEntry(key, null, value, false);
    }

    public static ObjectEntry computed(Expr key, Expr value) {
        return new ObjectEntry(null, key, value, false);
    }

    public static ObjectEntry spread(Expr value) {
        return new ObjectEntry(null, null, value, true);
    }

    @Override
    public String toString() {
        if (spread) {
            return "..." + value;
        }
        return (key != null ? key : "[" + computedKey + "]") + ": " + value;
    }

}
