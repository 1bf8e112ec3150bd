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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Incremental classifier for JS source positions. Callers drive it with {@link #advance(String, int)}
 * and ask {@link #isTopLevel()} before treating a char as an operator, which keeps every splitting
 * routine out of string, template, regex and comment bodies.
 */
public class JsLexScanner {

    private LexMode mode = LexMode.NORMAL;
    private int templateBraceDepth;
    private boolean regexInClass;
    private final Deque<LexMode> modeStack = new ArrayDeque<>();
    private final Deque<Integer> depthStack = new ArrayDeque<>();

    int paren;
    int bracket;
    int brace;

    private char previousSignificant; // zero at start of input
    private boolean previousIdentifierAllowsRegex;

    public LexMode getMode() {
        return mode;
    }

    public boolean inNormal() {
        return mode == LexMode.NORMAL;
    }

    public boolean isTopLevel() {
        return mode == LexMode.NORMAL && paren == 0 && bracket == 0 && brace == 0;
    }

    public int depth() {
        return paren + bracket + brace;
    }

    int modeDepth() {
        return modeStack.size();
    }

    public char getPreviousSignificant() {
        return previousSignificant;
    }

    /**
     * Records chars the caller consumed itself (e.g. a matched operator) so that regex detection
     * after them stays correct.
     */
    public void consumeSignificant(String chars) {
        for (int i = 0; i < chars.length(); i++) {
            noteSignificant(chars.charAt(i));
        }
    }

    public boolean slashStartsCommentOrRegex(String src, int i) {
        if (mode != LexMode.NORMAL || i >= src.length() || src.charAt(i) != '/') {
            return false;
        }
        if (i + 1 < src.length() && (src.charAt(i + 1) == '/' || src.charAt(i + 1) == '*')) {
            return true;
        }
        return regexAllowed();
    }

    private boolean regexAllowed() {
        return Idents.canStartRegexAfter(previousSignificant) || previousIdentifierAllowsRegex;
    }

    private void noteSignificant(char c) {
        switch (c) {
            case '(':
                paren++;
                break;
            case ')':
                paren = Math.max(0, paren - 1);
                break;
            case '[':
                bracket++;
                break;
            case ']':
                bracket = Math.max(0, bracket - 1);
                break;
            case '{':
                brace++;
                break;
            case '}':
                brace = Math.max(0, brace - 1);
                break;
            default:
        }
        previousSignificant = c;
        previousIdentifierAllowsRegex = false;
    }

    private void push(LexMode next) {
        modeStack.push(mode);
        depthStack.push(templateBraceDepth);
        mode = next;
        if (next == LexMode.REGEX) {
            regexInClass = false;
        }
    }

    private void pop() {
        if (modeStack.isEmpty()) {
            mode = LexMode.NORMAL;
            templateBraceDepth = 0;
        } else {
            mode = modeStack.pop();
            templateBraceDepth = depthStack.pop();
        }
    }

    private void closeQuote(char c) {
        pop();
        previousSignificant = c;
        previousIdentifierAllowsRegex = false;
    }

    /**
     * Classifies the char at {@code i} and returns the next position to scan, always greater than {@code i}.
     */
    public int advance(String src, int i) {
        char c = src.charAt(i);
        int len = src.length();
        switch (mode) {
            case NORMAL:
            case TEMPLATE_EXPR:
                return advanceCode(src, i, c);
            case SINGLE:
            case DOUBLE:
                if (c == '\\') {
                    return Math.min(i + 2, len);
                }
                if ((c == '\'' && mode == LexMode.SINGLE) || (c == '"' && mode == LexMode.DOUBLE)) {
                    closeQuote(c);
                }
                return i + 1;
            case BACKTICK:
                if (c == '\\') {
                    return Math.min(i + 2, len);
                }
                if (c == '$' && i + 1 < len && src.charAt(i + 1) == '{') {
                    push(LexMode.TEMPLATE_EXPR);
                    templateBraceDepth = 1;
                    return i + 2;
                }
                if (c == '`') {
                    closeQuote(c);
                }
                return i + 1;
            case LINE_COMMENT:
                if (c == '\n' || c == '\r') {
                    pop();
                }
                return i + 1;
            case BLOCK_COMMENT:
                if (c == '*' && i + 1 < len && src.charAt(i + 1) == '/') {
                    pop();
                    return i + 2;
                }
                return i + 1;
            case REGEX:
                if (c == '\\') {
                    return Math.min(i + 2, len);
                }
                if (c == '[') {
                    regexInClass = true;
                } else if (c == ']' && regexInClass) {
                    regexInClass = false;
                } else if (c == '/' && !regexInClass) {
                    closeQuote(c);
                }
                return i + 1;
            default:
                throw new IllegalStateException("unexpected mode: " + mode);
        }
    }

    private int advanceCode(String src, int i, char c) {
        int len = src.length();
        if (Character.isWhitespace(c)) {
            return i + 1;
        }
        if (Idents.isIdentStart(c)) {
            int end = i + 1;
            while (end < len && Idents.isIdentChar(src.charAt(end))) {
                end++;
            }
            char prev = previousSignificant;
            previousSignificant = src.charAt(end - 1);
            previousIdentifierAllowsRegex = prev != '.' && Idents.keywordAllowsRegex(src.substring(i, end));
            return end;
        }
        switch (c) {
            case '\'':
                push(LexMode.SINGLE);
                previousIdentifierAllowsRegex = false;
                return i + 1;
            case '"':
                push(LexMode.DOUBLE);
                previousIdentifierAllowsRegex = false;
                return i + 1;
            case '`':
                push(LexMode.BACKTICK);
                previousIdentifierAllowsRegex = false;
                return i + 1;
            case '/':
                if (i + 1 < len && src.charAt(i + 1) == '/') {
                    push(LexMode.LINE_COMMENT);
                    return i + 2;
                }
                if (i + 1 < len && src.charAt(i + 1) == '*') {
                    push(LexMode.BLOCK_COMMENT);
                    return i + 2;
                }
                if (regexAllowed()) {
                    push(LexMode.REGEX);
                    previousIdentifierAllowsRegex = false;
                    return i + 1;
                }
                noteSignificant(c);
                return i + 1;
            default:
        }
        if (mode == LexMode.TEMPLATE_EXPR) {
            if (c == '{') {
                templateBraceDepth++;
                noteSignificant(c);
                return i + 1;
            }
            if (c == '}') {
                if (templateBraceDepth == 1) {
                    closeQuote(c);
                } else {
                    templateBraceDepth--;
                    noteSignificant(c);
                }
                return i + 1;
            }
        }
        noteSignificant(c);
        return i + 1;
    }

}
