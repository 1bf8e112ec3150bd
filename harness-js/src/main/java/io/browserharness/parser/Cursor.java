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
 * Forward-only reader over a source string. All methods that fail throw {@link ScriptParseException}.
 */
public class Cursor {

    private final String src;
    private int pos;

    public Cursor(String src) {
        this.src = src;
    }

    public String getSource() {
        return src;
    }

    public boolean eof() {
        return pos >= src.length();
    }

    public int getPos() {
        return pos;
    }

    public void setPos(int pos) {
        this.pos = pos;
    }

    public String rest() {
        return src.substring(Math.min(pos, src.length()));
    }

    /**
     * Returns the current char or zero at end of input.
     */
    public char peek() {
        return pos < src.length() ? src.charAt(pos) : 0;
    }

    public char peek(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : 0;
    }

    public boolean consume(char c) {
        if (peek() == c && !eof()) {
            pos++;
            return true;
        }
        return false;
    }

    public void expect(char c) {
        if (!consume(c)) {
            throw new ScriptParseException("expected '" + c + "' at " + pos, src);
        }
    }

    public boolean consumeAscii(String token) {
        if (src.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    /**
     * Consumes a keyword only when it is not the prefix of a longer identifier.
     */
    public boolean consumeKeyword(String keyword) {
        if (!src.startsWith(keyword, pos)) {
            return false;
        }
        int end = pos + keyword.length();
        if (end < src.length() && Idents.isIdentChar(src.charAt(end))) {
            return false;
        }
        pos = end;
        return true;
    }

    public void skipWs() {
        while (true) {
            skipPlainWs();
            if (consumeAscii("//")) {
                while (!eof()) {
                    char c = src.charAt(pos++);
                    if (c == '\n') {
                        break;
                    }
                }
                continue;
            }
            if (consumeAscii("/*")) {
                while (!eof()) {
                    if (consumeAscii("*/")) {
                        break;
                    }
                    pos++;
                }
                continue;
            }
            break;
        }
    }

    public void skipPlainWs() {
        while (!eof() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    /**
     * Returns the identifier at the current position, or null if there is none.
     */
    public String parseIdentifier() {
        if (eof() || !Idents.isIdentStart(src.charAt(pos))) {
            return null;
        }
        int start = pos++;
        while (!eof() && Idents.isIdentChar(src.charAt(pos))) {
            pos++;
        }
        return src.substring(start, pos);
    }

    public String parseStringLiteral() {
        char quote = peek();
        if (quote != '\'' && quote != '"') {
            throw new ScriptParseException("expected string literal at " + pos, src);
        }
        pos++;
        int start = pos;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == quote) {
                String raw = src.substring(start, pos);
                pos++;
                return StringEscapes.unescape(raw);
            }
            pos++;
        }
        throw new ScriptParseException("unclosed string literal", src);
    }

    public String readUntil(char c) {
        int start = pos;
        while (!eof()) {
            if (src.charAt(pos) == c) {
                return src.substring(start, pos);
            }
            pos++;
        }
        throw new ScriptParseException("expected '" + c + "' before end of input", src);
    }

    /**
     * Expects {@code open} at the current position and returns the text up to its matching {@code close},
     * leaving the cursor after the close char. Delimiters inside strings, templates, regex literals and
     * comments are ignored.
     */
    public String readBalancedBlock(char open, char close) {
        expect(open);
        int start = pos;
        int depth = 1;
        int i = pos;
        JsLexScanner scanner = new JsLexScanner();
        while (i < src.length()) {
            char c = src.charAt(i);
            boolean wasNormal = scanner.inNormal();
            i = scanner.advance(src, i);
            if (wasNormal) {
                if (c == open) {
                    depth++;
                } else if (c == close) {
                    depth--;
                    if (depth == 0) {
                        pos = i;
                        return src.substring(start, i - 1);
                    }
                }
            }
        }
        throw new ScriptParseException("unclosed block", src);
    }

}
