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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsLexScannerTest {

    static List<Integer> topLevel(String src, char c) {
        List<Integer> found = new ArrayList<>();
        JsLexScanner scanner = new JsLexScanner();
        int i = 0;
        while (i < src.length()) {
            if (scanner.isTopLevel() && src.charAt(i) == c) {
                found.add(i);
            }
            i = scanner.advance(src, i);
        }
        return found;
    }

    static LexMode modeAfter(String src) {
        JsLexScanner scanner = new JsLexScanner();
        int i = 0;
        while (i < src.length()) {
            i = scanner.advance(src, i);
        }
        return scanner.getMode();
    }

    @Test
    void testStringsHideOperators() {
        assertEquals(List.of(3), topLevel("'a'+'b+c'", '+'));
        assertEquals(List.of(5), topLevel("\"a\\\"\"+b", '+'));
    }

    @Test
    void testNestingHidesOperators() {
        assertEquals(List.of(1, 8), topLevel("a,f(b,c),[d,e]", ','));
        assertEquals(List.of(), topLevel("{a:1,b:2}", ','));
    }

    @Test
    void testTemplateExpressions() {
        assertEquals(List.of(), topLevel("`a${b+c}d`", '+'));
        assertEquals(List.of(12), topLevel("`${ {a:1} }`+x", '+'));
        assertEquals(LexMode.BACKTICK, modeAfter("`abc ${x}"));
        assertEquals(LexMode.TEMPLATE_EXPR, modeAfter("`abc ${x"));
    }

    @Test
    void testRegexVersusDivision() {
        assertEquals(List.of(1, 3), topLevel("a/b/g", '/'));
        assertEquals(List.of(), topLevel("/a,b/.test(s)", ','));
        assertEquals(List.of(), topLevel("x.split(/[,/]/)", ','));
        assertEquals(LexMode.REGEX, modeAfter("return /ab"));
        assertEquals(LexMode.NORMAL, modeAfter("x = 4 / 2"));
    }

    @Test
    void testComments() {
        assertEquals(LexMode.LINE_COMMENT, modeAfter("a // b"));
        assertEquals(LexMode.NORMAL, modeAfter("a // b\nc"));
        assertEquals(LexMode.BLOCK_COMMENT, modeAfter("a /* b"));
        assertEquals(List.of(), topLevel("/* a,b */", ','));
    }

    @Test
    void testDepth() {
        JsLexScanner scanner = new JsLexScanner();
        String src = "f([{";
        int i = 0;
        while (i < src.length()) {
            i = scanner.advance(src, i);
        }
        assertEquals(3, scanner.depth());
        assertFalse(scanner.isTopLevel());
        assertTrue(scanner.inNormal());
        assertEquals('{', scanner.getPreviousSignificant());
    }

    @Test
    void testSlashStartsCommentOrRegex() {
        JsLexScanner scanner = new JsLexScanner();
        assertTrue(scanner.slashStartsCommentOrRegex("/x/", 0));
        assertTrue(scanner.slashStartsCommentOrRegex("// c", 0));
        scanner.consumeSignificant("a");
        assertFalse(scanner.slashStartsCommentOrRegex("a/b", 1));
        scanner.consumeSignificant("=");
        assertTrue(scanner.slashStartsCommentOrRegex("=/b/", 1));
    }

}
