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

class RegexShapes {

    private RegexShapes() {
        // only static methods
    }

    private static final String VALID_FLAGS = "dgimsuvy";

    /**
     * Returns the index just past the closing slash of a regex literal starting at 0, or -1.
     */
    static int literalEnd(String s) {
        if (s.length() < 2 || s.charAt(0) != '/' || s.charAt(1) == '/' || s.charAt(1) == '*') {
            return -1;
        }
        JsLexScanner scanner = new JsLexScanner();
        int i = scanner.advance(s, 0);
        if (scanner.getMode() != LexMode.REGEX) {
            return -1;
        }
        while (i < s.length()) {
            i = scanner.advance(s, i);
            if (scanner.inNormal()) {
                return i;
            }
        }
        return -1;
    }

    static int flagsEnd(String s, int from) {
        int i = from;
        while (i < s.length() && Idents.isIdentChar(s.charAt(i))) {
            i++;
        }
        return i;
    }

    static String validateFlags(String flags) {
        for (int i = 0; i < flags.length(); i++) {
            char c = flags.charAt(i);
            if (VALID_FLAGS.indexOf(c) == -1 || flags.indexOf(c, i + 1) != -1) {
                throw new ScriptParseException("invalid regular expression flags", flags);
            }
        }
        return flags;
    }

    static Expr regexLiteral(String s) {
        int end = literalEnd(s);
        if (end == -1) {
            return null;
        }
        int flagsEnd = flagsEnd(s, end);
        if (flagsEnd != s.length()) {
            return null;
        }
        String pattern = s.substring(1, end - 1);
        return Expr.regex(pattern, validateFlags(s.substring(end, flagsEnd)));
    }

    /**
     * {@code /re/flags.test(x)} and {@code /re/flags.exec(x)}.
     */
    static Expr regexMethod(String s) {
        int end = literalEnd(s);
        if (end == -1) {
            return null;
        }
        int flagsEnd = flagsEnd(s, end);
        String[] call = Shapes.methodCall(s.substring(flagsEnd), ".");
        if (call == null) {
            return null;
        }
        String method = call[0];
        if (!method.equals("test") && !method.equals("exec")) {
            return null;
        }
        Expr regex = Expr.regex(s.substring(1, end - 1), validateFlags(s.substring(end, flagsEnd)));
        List<Expr> args = Shapes.parseArgs(call[1], "RegExp." + method, 1, 1);
        return Expr.builtin(ExprType.REGEX_METHOD, regex, method, args);
    }

    /**
     * {@code new RegExp(pattern[, flags])}, also callable without {@code new}.
     */
    static Expr newRegExp(String s) {
        String inner = Shapes.newArgs(s, "RegExp");
        if (inner == null) {
            inner = Shapes.callArgs(s, "RegExp");
        }
        if (inner == null) {
            return null;
        }
        return Expr.builtin(ExprType.REGEX_NEW, Shapes.parseArgs(inner, "RegExp", 0, 2));
    }

}
