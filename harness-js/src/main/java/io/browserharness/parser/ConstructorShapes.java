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
import java.util.Set;

/**
 * {@code new X(...)} forms.
 */
class ConstructorShapes {

    private ConstructorShapes() {
        // only static methods
    }

    static final Set<String> TYPED_ARRAYS = Set.of(
            "Int8Array", "Uint8Array", "Uint8ClampedArray", "Int16Array", "Uint16Array",
            "Int32Array", "Uint32Array", "Float32Array", "Float64Array", "BigInt64Array", "BigUint64Array"
    );

    static final Set<String> ERRORS = Set.of(
            "Error", "TypeError", "RangeError", "SyntaxError", "ReferenceError"
    );

    /**
     * Reads {@code new Path.To.Ctor[(args)]} spanning the whole source. Returns {@code {path, args}} or null.
     */
    static String[] readNew(String s) {
        Cursor cursor = new Cursor(s);
        if (!cursor.consumeKeyword("new")) {
            return null;
        }
        cursor.skipWs();
        String path = cursor.parseIdentifier();
        if (path == null) {
            return null;
        }
        while (cursor.peek() == '.') {
            cursor.consume('.');
            String part = cursor.parseIdentifier();
            if (part == null) {
                return null;
            }
            path = path + "." + part;
        }
        cursor.skipWs();
        if (cursor.eof()) {
            return new String[]{path, ""};
        }
        if (cursor.peek() != '(') {
            return null;
        }
        String inner = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        return cursor.eof() ? new String[]{path, inner} : null;
    }

    static Expr recognize(String s) {
        String[] parts = readNew(s);
        if (parts == null) {
            return null;
        }
        String ctor = parts[0];
        String inner = parts[1];
        switch (ctor) {
            case "Date":
                return Expr.builtin(ExprType.NEW_DATE, Shapes.parseArgs(inner, "Date", 0, 7));
            case "Map":
                return Expr.builtin(ExprType.NEW_MAP, Shapes.parseArgs(inner, "Map", 0, 1));
            case "Set":
                return Expr.builtin(ExprType.NEW_SET, Shapes.parseArgs(inner, "Set", 0, 1));
            case "Promise":
                return Expr.builtin(ExprType.NEW_PROMISE, Shapes.parseArgs(inner, "Promise", 1, 1));
            case "ArrayBuffer":
                return Expr.builtin(ExprType.NEW_ARRAY_BUFFER, Shapes.parseArgs(inner, "ArrayBuffer", 0, 2));
            case "Blob":
                return Expr.builtin(ExprType.NEW_BLOB, Shapes.parseArgs(inner, "Blob", 0, 2));
            case "URL":
                return Expr.builtin(ExprType.NEW_URL, Shapes.parseArgs(inner, "URL", 1, 2));
            case "URLSearchParams":
                return Expr.builtin(ExprType.NEW_URL_SEARCH_PARAMS, Shapes.parseArgs(inner, "URLSearchParams", 0, 1));
            case "RegExp":
                return Expr.builtin(ExprType.REGEX_NEW, Shapes.parseArgs(inner, "RegExp", 0, 2));
            case "Intl.NumberFormat":
            case "Intl.DateTimeFormat":
                String kind = ctor.substring(5);
                return Expr.builtin(ExprType.NEW_INTL, kind, Shapes.parseArgs(inner, ctor, 0, 2));
            default:
        }
        if (TYPED_ARRAYS.contains(ctor)) {
            return Expr.builtin(ExprType.NEW_TYPED_ARRAY, ctor, Shapes.parseArgs(inner, ctor, 0, 3));
        }
        if (ERRORS.contains(ctor)) {
            return Expr.builtin(ExprType.NEW_ERROR, ctor, Shapes.parseArgs(inner, ctor, 0, 2));
        }
        if (ctor.startsWith("Intl.")) {
            throw new ScriptParseException("unsupported Intl constructor", ctor);
        }
        List<Expr> args = Shapes.parseArgs(inner);
        return Expr.builtin(ExprType.NEW_CALLEE, ExprParser.parseExpr(ctor), null, args);
    }

}
