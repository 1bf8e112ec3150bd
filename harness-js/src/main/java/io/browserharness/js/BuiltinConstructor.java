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
 * Global constructor bindings such as {@code Map} or {@code Uint8Array}. They are values in their own
 * right: {@code instanceof} compares against them and {@code new} through an alias reaches them.
 */
public enum BuiltinConstructor {

    OBJECT("Object"),
    ARRAY("Array"),
    STRING("String"),
    NUMBER("Number"),
    BOOLEAN("Boolean"),
    BIGINT("BigInt"),
    SYMBOL("Symbol"),
    FUNCTION("Function"),
    DATE("Date"),
    REGEXP("RegExp"),
    MAP("Map"),
    SET("Set"),
    PROMISE("Promise"),
    ARRAY_BUFFER("ArrayBuffer"),
    INT8_ARRAY("Int8Array"),
    UINT8_ARRAY("Uint8Array"),
    UINT8_CLAMPED_ARRAY("Uint8ClampedArray"),
    INT16_ARRAY("Int16Array"),
    UINT16_ARRAY("Uint16Array"),
    INT32_ARRAY("Int32Array"),
    UINT32_ARRAY("Uint32Array"),
    FLOAT32_ARRAY("Float32Array"),
    FLOAT64_ARRAY("Float64Array"),
    BIGINT64_ARRAY("BigInt64Array"),
    BIGUINT64_ARRAY("BigUint64Array"),
    BLOB("Blob"),
    URL("URL"),
    URL_SEARCH_PARAMS("URLSearchParams"),
    ERROR("Error"),
    TYPE_ERROR("TypeError"),
    RANGE_ERROR("RangeError");

    final String jsName;

    BuiltinConstructor(String jsName) {
        this.jsName = jsName;
    }

    static BuiltinConstructor byName(String name) {
        for (BuiltinConstructor bc : values()) {
            if (bc.jsName.equals(name)) {
                return bc;
            }
        }
        return null;
    }

    boolean isTypedArray() {
        return jsName.endsWith("Array") && this != ARRAY;
    }

    @Override
    public String toString() {
        return "function " + jsName + "() { [native code] }";
    }

}
