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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers shared by the shape recognizers.
 */
class Shapes {

    private Shapes() {
        // only static methods
    }

    /**
     * If {@code src} is exactly {@code callee(...)} returns the raw argument text, else null.
     */
    static String callArgs(String src, String callee) {
        Cursor cursor = new Cursor(src);
        if (!cursor.consumeAscii(callee)) {
            return null;
        }
        cursor.skipPlainWs();
        if (cursor.peek() != '(') {
            return null;
        }
        String inner = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        return cursor.eof() ? inner : null;
    }

    /**
     * If {@code src} is exactly {@code new Name(...)} or {@code new Name} returns the raw argument text
     * (empty when there are no parens), else null.
     */
    static String newArgs(String src, String ctor) {
        Cursor cursor = new Cursor(src);
        if (!cursor.consumeKeyword("new")) {
            return null;
        }
        cursor.skipWs();
        if (!cursor.consumeAscii(ctor)) {
            return null;
        }
        char next = cursor.peek();
        if (Idents.isIdentChar(next) || next == '.') {
            return null;
        }
        cursor.skipWs();
        if (cursor.eof()) {
            return "";
        }
        if (cursor.peek() != '(') {
            return null;
        }
        String inner = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        return cursor.eof() ? inner : null;
    }

    /**
     * If {@code src} is exactly {@code prefix + identifier + (...)} returns {@code {identifier, args}}.
     */
    static String[] methodCall(String src, String prefix) {
        Cursor cursor = new Cursor(src);
        if (!cursor.consumeAscii(prefix)) {
            return null;
        }
        String method = cursor.parseIdentifier();
        if (method == null) {
            return null;
        }
        cursor.skipPlainWs();
        if (cursor.peek() != '(') {
            return null;
        }
        String inner = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        return cursor.eof() ? new String[]{method, inner} : null;
    }

    /**
     * If {@code src} is exactly {@code prefix + identifier} returns the identifier.
     */
    static String memberName(String src, String prefix) {
        if (!src.startsWith(prefix)) {
            return null;
        }
        String rest = src.substring(prefix.length());
        return Idents.isIdent(rest) ? rest : null;
    }

    /**
     * Parses a call argument list. A single trailing comma is allowed, {@code ...x} becomes a spread.
     */
    static List<Expr> parseArgs(String inner) {
        if (inner.trim().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> parts = TopLevel.splitByChar(inner, ',');
        int count = parts.size();
        if (count > 1 && parts.get(count - 1).trim().isEmpty()) {
            count--;
        }
        List<Expr> args = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String part = parts.get(i).trim();
            if (part.isEmpty()) {
                throw new ScriptParseException("invalid argument list", inner);
            }
            if (part.startsWith("...")) {
                args.add(Expr.unary(ExprType.SPREAD, ExprParser.parseExpr(part.substring(3))));
            } else {
                args.add(ExprParser.parseExpr(part));
            }
        }
        return args;
    }

    static List<Expr> parseArgs(String inner, String what, int min, int max) {
        List<Expr> args = parseArgs(inner);
        checkArity(args, what, min, max);
        return args;
    }

    static void checkArity(List<Expr> args, String what, int min, int max) {
        int count = args.size();
        if (count < min || count > max) {
            String expected;
            if (min == max) {
                expected = min + "";
            } else if (max == Integer.MAX_VALUE) {
                expected = "at least " + min;
            } else {
                expected = min + " to " + max;
            }
            throw new ScriptParseException(what + " expects " + expected + " argument(s) but got " + count);
        }
    }

}
