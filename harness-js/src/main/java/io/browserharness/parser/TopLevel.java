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
import java.util.List;

/**
 * Scanning helpers that only look at top-level positions, that is outside any string, template,
 * regex literal, comment or bracket pair.
 */
public class TopLevel {

    private TopLevel() {
        // only static methods
    }

    public static class Split {

        public final List<String> parts;
        public final List<String> ops;

        Split(List<String> parts, List<String> ops) {
            this.parts = parts;
            this.ops = ops;
        }

        public boolean hasOps() {
            return !ops.isEmpty();
        }

    }

    public static List<String> splitByChar(String src, char target) {
        List<String> parts = new ArrayList<>();
        JsLexScanner scanner = new JsLexScanner();
        int start = 0;
        int i = 0;
        while (i < src.length()) {
            if (scanner.isTopLevel() && src.charAt(i) == target) {
                parts.add(src.substring(start, i));
                start = i + 1;
            }
            i = scanner.advance(src, i);
        }
        parts.add(src.substring(start));
        return parts;
    }

    private static boolean isWordOp(String op) {
        for (int i = 0; i < op.length(); i++) {
            if (!Character.isLetter(op.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits at every top-level occurrence of one of {@code ops}, tried in order, so longer operators
     * must be listed before their prefixes. Keyword operators only match on identifier boundaries and a
     * lone {@code <} or {@code >} never matches next to another angle bracket.
     */
    public static Split splitByOps(String src, String... ops) {
        List<String> parts = new ArrayList<>();
        List<String> found = new ArrayList<>();
        JsLexScanner scanner = new JsLexScanner();
        int len = src.length();
        int start = 0;
        int i = 0;
        while (i < len) {
            if (scanner.isTopLevel()) {
                String matched = null;
                for (String op : ops) {
                    if (!src.startsWith(op, i)) {
                        continue;
                    }
                    if (isWordOp(op)) {
                        if (i > 0 && Idents.isIdentChar(src.charAt(i - 1))) {
                            continue;
                        }
                        int end = i + op.length();
                        if (end < len && Idents.isIdentChar(src.charAt(end))) {
                            continue;
                        }
                    } else if (op.equals("<") || op.equals(">")) {
                        char prev = i == 0 ? 0 : src.charAt(i - 1);
                        char next = i + 1 < len ? src.charAt(i + 1) : 0;
                        if (prev == '<' || prev == '>' || next == '<' || next == '>') {
                            continue;
                        }
                    }
                    matched = op;
                    break;
                }
                if (matched != null) {
                    parts.add(src.substring(start, i));
                    found.add(matched);
                    // an operand follows, so a slash after the operator starts a regex
                    scanner.consumeSignificant("=");
                    i += matched.length();
                    start = i;
                    continue;
                }
            }
            i = scanner.advance(src, i);
        }
        parts.add(src.substring(start));
        return new Split(parts, found);
    }

    public static Split splitAddSub(String src) {
        List<String> parts = new ArrayList<>();
        List<String> ops = new ArrayList<>();
        JsLexScanner scanner = new JsLexScanner();
        int start = 0;
        int i = 0;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (scanner.isTopLevel() && (c == '+' || c == '-') && isAddSubBinaryOperator(src, i)) {
                parts.add(src.substring(start, i));
                ops.add(String.valueOf(c));
                start = i + 1;
            }
            i = scanner.advance(src, i);
        }
        parts.add(src.substring(start));
        return new Split(parts, ops);
    }

    /**
     * A plus or minus is binary only when an operand precedes it and it is not the sign of an exponent.
     */
    static boolean isAddSubBinaryOperator(String src, int idx) {
        if (idx >= src.length()) {
            return false;
        }
        int left = idx;
        while (left > 0 && Character.isWhitespace(src.charAt(left - 1))) {
            left--;
        }
        if (left == 0) {
            return false;
        }
        char prev = src.charAt(left - 1);
        if ((prev == 'e' || prev == 'E') && isDecimalExponentSign(src, left - 1)) {
            return false;
        }
        return "([{,?:=!<>&|+-*/%".indexOf(prev) == -1;
    }

    static boolean isDecimalExponentSign(String src, int exponentIndex) {
        char e = src.charAt(exponentIndex);
        if (e != 'e' && e != 'E') {
            return false;
        }
        int start = exponentIndex;
        while (start > 0 && (Character.isDigit(src.charAt(start - 1)) || src.charAt(start - 1) == '.')) {
            start--;
        }
        if (start == exponentIndex) {
            return false;
        }
        if (start > 0 && Idents.isIdentChar(src.charAt(start - 1))) {
            return false;
        }
        boolean hasDigit = false;
        int dots = 0;
        for (int i = start; i < exponentIndex; i++) {
            char c = src.charAt(i);
            if (Character.isDigit(c)) {
                hasDigit = true;
            } else if (++dots > 1) {
                return false;
            }
        }
        return hasDigit;
    }

    public static String stripOuterParens(String src) {
        String s = src.trim();
        while (isFullyWrappedInParens(s)) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    public static boolean isFullyWrappedInParens(String src) {
        int len = src.length();
        if (len < 2 || src.charAt(0) != '(' || src.charAt(len - 1) != ')') {
            return false;
        }
        JsLexScanner scanner = new JsLexScanner();
        int i = 0;
        while (i < len) {
            if (scanner.inNormal() && src.charAt(i) == ')' && scanner.paren == 1) {
                int tail = i + 1;
                while (tail < len && Character.isWhitespace(src.charAt(tail))) {
                    tail++;
                }
                if (tail < len) {
                    return false;
                }
            }
            i = scanner.advance(src, i);
        }
        return scanner.inNormal() && scanner.depth() == 0;
    }

    /**
     * Finds the first top-level assignment operator and returns {@code {position, length}}, or null.
     * Comparison operators and arrows are skipped.
     */
    public static int[] findAssignment(String src) {
        JsLexScanner scanner = new JsLexScanner();
        int len = src.length();
        int i = 0;
        while (i < len) {
            if (scanner.isTopLevel() && src.charAt(i) == '=') {
                char next = i + 1 < len ? src.charAt(i + 1) : 0;
                if (next == '=' || next == '>') {
                    i = scanner.advance(src, i);
                    continue;
                }
                if (i >= 3 && src.startsWith(">>>=", i - 3)) {
                    return new int[]{i - 3, 4};
                }
                if (i >= 2) {
                    String three = src.substring(i - 2, i + 1);
                    switch (three) {
                        case "&&=":
                        case "||=":
                        case "??=":
                        case "**=":
                        case "<<=":
                        case ">>=":
                            return new int[]{i - 2, 3};
                        default:
                    }
                }
                if (i > 0) {
                    char prev = src.charAt(i - 1);
                    if ("+-*/%&|^".indexOf(prev) != -1) {
                        return new int[]{i - 1, 2};
                    }
                    if ("!<>=".indexOf(prev) != -1) {
                        i = scanner.advance(src, i);
                        continue;
                    }
                }
                return new int[]{i, 1};
            }
            i = scanner.advance(src, i);
        }
        return null;
    }

    private static boolean isTernaryQuestion(String src, int i) {
        int len = src.length();
        if (i + 1 < len && (src.charAt(i + 1) == '?' || src.charAt(i + 1) == '.')) {
            return false;
        }
        return !(i > 0 && src.charAt(i - 1) == '?');
    }

    public static int findTernaryQuestion(String src) {
        JsLexScanner scanner = new JsLexScanner();
        int i = 0;
        while (i < src.length()) {
            if (scanner.isTopLevel() && src.charAt(i) == '?' && isTernaryQuestion(src, i)) {
                return i;
            }
            i = scanner.advance(src, i);
        }
        return -1;
    }

    public static int findMatchingTernaryColon(String src, int from) {
        if (from >= src.length()) {
            return -1;
        }
        JsLexScanner scanner = new JsLexScanner();
        int nested = 0;
        int i = 0;
        while (i < src.length()) {
            if (i >= from && scanner.isTopLevel()) {
                char c = src.charAt(i);
                if (c == '?' && isTernaryQuestion(src, i)) {
                    nested++;
                } else if (c == ':') {
                    if (nested == 0) {
                        return i;
                    }
                    nested--;
                }
            }
            i = scanner.advance(src, i);
        }
        return -1;
    }

    /**
     * Returns the index of the first top-level occurrence of {@code token}, or -1.
     */
    public static int indexOf(String src, String token) {
        JsLexScanner scanner = new JsLexScanner();
        int i = 0;
        while (i < src.length()) {
            if (scanner.isTopLevel() && src.startsWith(token, i)) {
                return i;
            }
            i = scanner.advance(src, i);
        }
        return -1;
    }

    /**
     * Given the index just after a template {@code ${}, returns the index of the closing brace.
     */
    public static int findTemplateExprEnd(String inner, int start) {
        JsLexScanner scanner = new JsLexScanner();
        String wrapped = "`${" + inner.substring(start);
        int i = scanner.advance(wrapped, 0); // enter backtick
        i = scanner.advance(wrapped, i); // enter template expression
        while (i < wrapped.length()) {
            char c = wrapped.charAt(i);
            LexMode before = scanner.getMode();
            i = scanner.advance(wrapped, i);
            if (c == '}' && before == LexMode.TEMPLATE_EXPR
                    && scanner.getMode() == LexMode.BACKTICK && scanner.modeDepth() == 1) {
                return start + (i - 1) - 3;
            }
        }
        throw new ScriptParseException("unclosed template expression", inner);
    }

    public static String parseStringLiteralExact(String src) {
        int len = src.length();
        if (len < 2) {
            throw new ScriptParseException("invalid string literal", src);
        }
        char quote = src.charAt(0);
        if ((quote != '\'' && quote != '"') || src.charAt(len - 1) != quote) {
            throw new ScriptParseException("invalid string literal", src);
        }
        boolean escaped = false;
        for (int i = 1; i + 1 < len; i++) {
            char c = src.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == quote) {
                throw new ScriptParseException("unexpected quote in", src);
            }
        }
        return StringEscapes.unescape(src.substring(1, len - 1));
    }

    private enum CommentState {
        NORMAL, SINGLE, DOUBLE, TEMPLATE, REGEX
    }

    /**
     * Removes line and block comments in one pass, keeping string, template and regex literal text intact.
     * A line comment is replaced by its terminating newline.
     */
    public static String stripJsComments(String src) {
        StringBuilder out = new StringBuilder(src.length());
        CommentState state = CommentState.NORMAL;
        boolean inClass = false;
        char prevSignificant = 0;
        boolean prevIdentAllowsRegex = false;
        int len = src.length();
        int i = 0;
        while (i < len) {
            char c = src.charAt(i);
            switch (state) {
                case NORMAL:
                    if (c == '/' && i + 1 < len && src.charAt(i + 1) == '/') {
                        i += 2;
                        while (i < len && src.charAt(i) != '\n') {
                            i++;
                        }
                        if (i < len) {
                            out.append('\n');
                            i++;
                        }
                        continue;
                    }
                    if (c == '/' && i + 1 < len && src.charAt(i + 1) == '*') {
                        int end = src.indexOf("*/", i + 2);
                        i = end == -1 ? len : end + 2;
                        continue;
                    }
                    if (c == '/' && (Idents.canStartRegexAfter(prevSignificant) || prevIdentAllowsRegex)) {
                        state = CommentState.REGEX;
                        inClass = false;
                        out.append(c);
                        prevSignificant = '/';
                        prevIdentAllowsRegex = false;
                        i++;
                        continue;
                    }
                    if (Idents.isIdentStart(c)) {
                        int start = i++;
                        while (i < len && Idents.isIdentChar(src.charAt(i))) {
                            i++;
                        }
                        out.append(src, start, i);
                        char prev = prevSignificant;
                        prevSignificant = src.charAt(i - 1);
                        prevIdentAllowsRegex = prev != '.' && Idents.keywordAllowsRegex(src.substring(start, i));
                        continue;
                    }
                    if (c == '\'') {
                        state = CommentState.SINGLE;
                    } else if (c == '"') {
                        state = CommentState.DOUBLE;
                    } else if (c == '`') {
                        state = CommentState.TEMPLATE;
                    }
                    out.append(c);
                    if (!Character.isWhitespace(c)) {
                        prevSignificant = c;
                        prevIdentAllowsRegex = false;
                    }
                    i++;
                    break;
                default:
                    if (c == '\\') {
                        out.append(c);
                        if (i + 1 < len) {
                            out.append(src.charAt(i + 1));
                        }
                        i += 2;
                        continue;
                    }
                    out.append(c);
                    i++;
                    if (state == CommentState.REGEX) {
                        if (c == '[') {
                            inClass = true;
                        } else if (c == ']') {
                            inClass = false;
                        } else if (c == '/' && !inClass) {
                            state = CommentState.NORMAL;
                            prevSignificant = '/';
                        }
                    } else if ((state == CommentState.SINGLE && c == '\'')
                            || (state == CommentState.DOUBLE && c == '"')
                            || (state == CommentState.TEMPLATE && c == '`')) {
                        state = CommentState.NORMAL;
                        prevSignificant = c;
                        prevIdentAllowsRegex = false;
                    }
            }
        }
        return out.toString();
    }

}
