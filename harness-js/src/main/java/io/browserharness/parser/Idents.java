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

import java.util.Set;

public class Idents {

    private Idents() {
        // only static methods
    }

    private static final Set<String> REGEX_PREFIX_KEYWORDS = Set.of(
            "return", "throw", "case", "delete", "typeof", "void", "yield", "await", "in", "of", "instanceof"
    );

    private static final Set<String> OPERAND_KEYWORDS = Set.of("this", "let", "static", "async");

    private static final Set<String> RESERVED = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
            "else", "export", "extends", "false", "finally", "for", "function", "if", "import", "in",
            "instanceof", "new", "null", "return", "super", "switch", "this", "throw", "true", "try",
            "typeof", "var", "void", "while", "with", "let", "static", "yield", "await", "async"
    );

    public static boolean isIdentStart(char c) {
        return c == '_' || c == '$' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isIdentChar(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }

    public static boolean isIdent(String s) {
        if (s == null || s.isEmpty() || !isIdentStart(s.charAt(0))) {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            if (!isIdentChar(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isReserved(String s) {
        return RESERVED.contains(s);
    }

    /**
     * True when a bare word may stand as an operand: any identifier except the reserved words that
     * only start syntax. {@code this} and the contextual words stay usable.
     */
    public static boolean isOperandName(String s) {
        return isIdent(s) && (!RESERVED.contains(s) || OPERAND_KEYWORDS.contains(s));
    }

    /**
     * True when a slash following this keyword begins a regex literal, e.g. {@code return /x/.test(s)}.
     */
    static boolean keywordAllowsRegex(String word) {
        return REGEX_PREFIX_KEYWORDS.contains(word);
    }

    /**
     * True when a slash following the given significant char begins a regex literal rather than a division.
     * A zero char means start of input.
     */
    static boolean canStartRegexAfter(char prev) {
        if (prev == 0) {
            return true;
        }
        switch (prev) {
            case '(':
            case '[':
            case '{':
            case ',':
            case ';':
            case ':':
            case '=':
            case '!':
            case '?':
            case '&':
            case '|':
            case '^':
            case '~':
            case '<':
            case '>':
            case '+':
            case '-':
            case '*':
            case '%':
            case '/':
                return true;
            default:
                return false;
        }
    }

}
