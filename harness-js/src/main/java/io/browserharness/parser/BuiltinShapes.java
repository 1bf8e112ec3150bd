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
 * Calls into builtin namespaces ({@code Math}, {@code JSON}, {@code Number}, ...) and global functions.
 */
class BuiltinShapes {

    private BuiltinShapes() {
        // only static methods
    }

    static final Set<String> MATH_CONSTANTS = Set.of(
            "E", "LN10", "LN2", "LOG10E", "LOG2E", "PI", "SQRT1_2", "SQRT2"
    );

    static final Set<String> MATH_UNARY = Set.of(
            "abs", "acos", "acosh", "asin", "asinh", "atan", "atanh", "cbrt", "ceil", "clz32", "cos", "cosh",
            "exp", "expm1", "floor", "fround", "log", "log10", "log1p", "log2", "round", "sign", "sin", "sinh",
            "sqrt", "tan", "tanh", "trunc"
    );

    static final Set<String> MATH_BINARY = Set.of("atan2", "pow", "imul");

    static final Set<String> MATH_VARIADIC = Set.of("max", "min", "hypot");

    static final Set<String> NUMBER_CONSTANTS = Set.of(
            "MAX_SAFE_INTEGER", "MIN_SAFE_INTEGER", "MAX_VALUE", "MIN_VALUE", "EPSILON",
            "POSITIVE_INFINITY", "NEGATIVE_INFINITY", "NaN"
    );

    static final Set<String> NUMBER_STATICS = Set.of(
            "isFinite", "isInteger", "isNaN", "isSafeInteger", "parseFloat", "parseInt"
    );

    static final Set<String> URI_CODECS = Set.of(
            "encodeURIComponent", "decodeURIComponent", "encodeURI", "decodeURI"
    );

    static Expr recognize(String s) {
        if (!Idents.isIdentStart(s.charAt(0))) {
            return null;
        }
        Expr expr = namespaces(s);
        return expr != null ? expr : globals(s);
    }

    private static Expr namespaces(String s) {
        String[] call;
        String name;
        if (s.startsWith("Math.")) {
            name = Shapes.memberName(s, "Math.");
            if (name != null && MATH_CONSTANTS.contains(name)) {
                return Expr.builtin(ExprType.MATH_CONST, name, List.of());
            }
            call = Shapes.methodCall(s, "Math.");
            if (call != null) {
                return mathCall(call[0], call[1]);
            }
            return null;
        }
        if (s.startsWith("Date.")) {
            String nowArgs = Shapes.callArgs(s, "Date.now");
            if (nowArgs != null) {
                Shapes.parseArgs(nowArgs, "Date.now", 0, 0);
                return Expr.builtin(ExprType.DATE_NOW, List.of());
            }
            call = Shapes.methodCall(s, "Date.");
            if (call == null) {
                return null;
            }
            switch (call[0]) {
                case "parse":
                    return Expr.builtin(ExprType.DATE_PARSE, Shapes.parseArgs(call[1], "Date.parse", 1, 1));
                case "UTC":
                    return Expr.builtin(ExprType.DATE_UTC, Shapes.parseArgs(call[1], "Date.UTC", 1, 7));
                default:
                    throw new ScriptParseException("unsupported Date method", call[0]);
            }
        }
        if (s.startsWith("performance.")) {
            String inner = Shapes.callArgs(s, "performance.now");
            if (inner != null) {
                Shapes.parseArgs(inner, "performance.now", 0, 0);
                return Expr.builtin(ExprType.PERFORMANCE_NOW, List.of());
            }
            return null;
        }
        if (s.startsWith("Number.")) {
            name = Shapes.memberName(s, "Number.");
            if (name != null && NUMBER_CONSTANTS.contains(name)) {
                return Expr.builtin(ExprType.NUMBER_CONST, name, List.of());
            }
            call = Shapes.methodCall(s, "Number.");
            if (call == null) {
                return null;
            }
            if (!NUMBER_STATICS.contains(call[0])) {
                throw new ScriptParseException("unsupported Number method", call[0]);
            }
            int max = call[0].equals("parseInt") ? 2 : 1;
            return Expr.builtin(ExprType.NUMBER_STATIC, call[0], Shapes.parseArgs(call[1], "Number." + call[0], 1, max));
        }
        if (s.startsWith("String.")) {
            call = Shapes.methodCall(s, "String.");
            if (call == null) {
                return null;
            }
            if (!call[0].equals("fromCharCode")) {
                throw new ScriptParseException("unsupported String method", call[0]);
            }
            return Expr.builtin(ExprType.STRING_CALL, call[0], Shapes.parseArgs(call[1]));
        }
        if (s.startsWith("Symbol.")) {
            String inner = Shapes.callArgs(s, "Symbol.for");
            if (inner != null) {
                return Expr.builtin(ExprType.SYMBOL_FOR, Shapes.parseArgs(inner, "Symbol.for", 1, 1));
            }
            return null;
        }
        if (s.startsWith("JSON.")) {
            call = Shapes.methodCall(s, "JSON.");
            if (call == null) {
                return null;
            }
            switch (call[0]) {
                case "parse":
                    return Expr.builtin(ExprType.JSON_PARSE, Shapes.parseArgs(call[1], "JSON.parse", 1, 2));
                case "stringify":
                    return Expr.builtin(ExprType.JSON_STRINGIFY, Shapes.parseArgs(call[1], "JSON.stringify", 1, 3));
                default:
                    throw new ScriptParseException("unsupported JSON method", call[0]);
            }
        }
        if (s.startsWith("Object.")) {
            call = Shapes.methodCall(s, "Object.");
            if (call == null) {
                return null;
            }
            String what = "Object." + call[0];
            switch (call[0]) {
                case "keys":
                case "values":
                case "entries":
                case "freeze":
                case "isFrozen":
                case "fromEntries":
                    return Expr.builtin(ExprType.OBJECT_STATIC, call[0], Shapes.parseArgs(call[1], what, 1, 1));
                case "assign":
                    return Expr.builtin(ExprType.OBJECT_STATIC, call[0], Shapes.parseArgs(call[1], what, 1, Integer.MAX_VALUE));
                case "hasOwn":
                    return Expr.builtin(ExprType.OBJECT_STATIC, call[0], Shapes.parseArgs(call[1], what, 2, 2));
                default:
                    throw new ScriptParseException("unsupported Object method", call[0]);
            }
        }
        if (s.startsWith("Array.")) {
            call = Shapes.methodCall(s, "Array.");
            if (call == null) {
                return null;
            }
            switch (call[0]) {
                case "isArray":
                    return Expr.builtin(ExprType.ARRAY_IS_ARRAY, Shapes.parseArgs(call[1], "Array.isArray", 1, 1));
                case "from":
                    return Expr.builtin(ExprType.ARRAY_STATIC, call[0], Shapes.parseArgs(call[1], "Array.from", 1, 2));
                case "of":
                    return Expr.builtin(ExprType.ARRAY_STATIC, call[0], Shapes.parseArgs(call[1]));
                default:
                    throw new ScriptParseException("unsupported Array method", call[0]);
            }
        }
        if (s.startsWith("Promise.")) {
            call = Shapes.methodCall(s, "Promise.");
            if (call == null) {
                return null;
            }
            switch (call[0]) {
                case "resolve":
                case "reject":
                    return Expr.builtin(ExprType.PROMISE_STATIC, call[0], Shapes.parseArgs(call[1], "Promise." + call[0], 0, 1));
                case "all":
                case "allSettled":
                case "race":
                case "any":
                    return Expr.builtin(ExprType.PROMISE_STATIC, call[0], Shapes.parseArgs(call[1], "Promise." + call[0], 1, 1));
                default:
                    throw new ScriptParseException("unsupported Promise method", call[0]);
            }
        }
        if (s.startsWith("ArrayBuffer.")) {
            String inner = Shapes.callArgs(s, "ArrayBuffer.isView");
            if (inner != null) {
                return Expr.builtin(ExprType.ARRAY_BUFFER_IS_VIEW, Shapes.parseArgs(inner, "ArrayBuffer.isView", 1, 1));
            }
        }
        return null;
    }

    private static Expr mathCall(String method, String inner) {
        String what = "Math." + method;
        if (MATH_UNARY.contains(method)) {
            return Expr.builtin(ExprType.MATH_CALL, method, Shapes.parseArgs(inner, what, 1, 1));
        }
        if (MATH_BINARY.contains(method)) {
            return Expr.builtin(ExprType.MATH_CALL, method, Shapes.parseArgs(inner, what, 2, 2));
        }
        if (MATH_VARIADIC.contains(method)) {
            return Expr.builtin(ExprType.MATH_CALL, method, Shapes.parseArgs(inner));
        }
        if (method.equals("random")) {
            return Expr.builtin(ExprType.MATH_CALL, method, Shapes.parseArgs(inner, what, 0, 0));
        }
        throw new ScriptParseException("unsupported Math method", method);
    }

    private static Expr globals(String s) {
        Cursor cursor = new Cursor(s);
        String name = cursor.parseIdentifier();
        if (name == null) {
            return null;
        }
        String inner = Shapes.callArgs(s, name);
        if (inner == null) {
            return null;
        }
        switch (name) {
            case "Number":
                return Expr.builtin(ExprType.NUMBER_CALL, Shapes.parseArgs(inner, name, 0, 1));
            case "String":
                return Expr.builtin(ExprType.STRING_CALL, Shapes.parseArgs(inner, name, 0, 1));
            case "BigInt":
                return Expr.builtin(ExprType.BIGINT_CALL, Shapes.parseArgs(inner, name, 1, 1));
            case "Symbol":
                return Expr.builtin(ExprType.SYMBOL_CALL, Shapes.parseArgs(inner, name, 0, 1));
            case "parseInt":
                return Expr.builtin(ExprType.PARSE_INT, Shapes.parseArgs(inner, name, 1, 2));
            case "parseFloat":
                return Expr.builtin(ExprType.PARSE_FLOAT, Shapes.parseArgs(inner, name, 1, 1));
            case "isNaN":
                return Expr.builtin(ExprType.IS_NAN, Shapes.parseArgs(inner, name, 1, 1));
            case "isFinite":
                return Expr.builtin(ExprType.IS_FINITE, Shapes.parseArgs(inner, name, 1, 1));
            case "atob":
                return Expr.builtin(ExprType.ATOB, Shapes.parseArgs(inner, name, 1, 1));
            case "btoa":
                return Expr.builtin(ExprType.BTOA, Shapes.parseArgs(inner, name, 1, 1));
            case "structuredClone":
                return Expr.builtin(ExprType.STRUCTURED_CLONE, Shapes.parseArgs(inner, name, 1, 1));
            default:
        }
        if (URI_CODECS.contains(name)) {
            return Expr.builtin(ExprType.URI_CODEC, name, Shapes.parseArgs(inner, name, 1, 1));
        }
        return null;
    }

}
