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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopLevelTest {

    @Test
    void testSplitByChar() {
        assertEquals(List.of("a", "'b,c'", "d"), TopLevel.splitByChar("a,'b,c',d", ','));
        assertEquals(List.of("f(a,b)", " [c,d]"), TopLevel.splitByChar("f(a,b), [c,d]", ','));
        assertEquals(List.of(""), TopLevel.splitByChar("", ','));
    }

    @Test
    void testSplitByOpsPrefersLongerOperators() {
        TopLevel.Split split = TopLevel.splitByOps("a===b", "===", "==");
        assertEquals(List.of("a", "b"), split.parts);
        assertEquals(List.of("==="), split.ops);
    }

    @Test
    void testSplitByOpsKeywordBoundaries() {
        TopLevel.Split split = TopLevel.splitByOps("index in obj", "in");
        assertEquals(1, split.ops.size());
        assertEquals("index", split.parts.get(0).trim());
        assertEquals("obj", split.parts.get(1).trim());
        assertFalse(TopLevel.splitByOps("inner", "in").hasOps());
    }

    @Test
    void testSplitByOpsSkipsShiftForLessThan() {
        assertFalse(TopLevel.splitByOps("a<<b", "<").hasOps());
        assertTrue(TopLevel.splitByOps("a<b", "<").hasOps());
    }

    @Test
    void testSplitAddSub() {
        TopLevel.Split split = TopLevel.splitAddSub("1e+5+x");
        assertEquals(List.of("1e+5", "x"), split.parts);
        assertEquals(List.of("+"), split.ops);
        split = TopLevel.splitAddSub("-a - -b");
        assertEquals(List.of("-"), split.ops);
        assertEquals("-b", split.parts.get(1).trim());
        assertFalse(TopLevel.splitAddSub("'a+b'").hasOps());
    }

    @Test
    void testStripOuterParens() {
        assertEquals("a", TopLevel.stripOuterParens(" ((a)) "));
        assertEquals("(a)+(b)", TopLevel.stripOuterParens("(a)+(b)"));
        assertTrue(TopLevel.isFullyWrappedInParens("(a, ')')"));
        assertFalse(TopLevel.isFullyWrappedInParens("(a)(b)"));
    }

    @Test
    void testFindAssignment() {
        assertArrayEquals(new int[]{1, 1}, TopLevel.findAssignment("a=1"));
        assertArrayEquals(new int[]{2, 2}, TopLevel.findAssignment("a += 1"));
        assertArrayEquals(new int[]{2, 3}, TopLevel.findAssignment("a ??= b"));
        assertArrayEquals(new int[]{2, 4}, TopLevel.findAssignment("a >>>= 1"));
        assertNull(TopLevel.findAssignment("a == b"));
        assertNull(TopLevel.findAssignment("a <= b"));
        assertNull(TopLevel.findAssignment("x => y"));
        assertNull(TopLevel.findAssignment("f('a=b')"));
    }

    @Test
    void testFindTernaryQuestion() {
        assertEquals(5, TopLevel.findTernaryQuestion("a?.b ? c : d"));
        assertEquals(-1, TopLevel.findTernaryQuestion("a ?? b"));
        assertEquals(-1, TopLevel.findTernaryQuestion("'?'"));
    }

    @Test
    void testParseStringLiteralExact() {
        assertEquals("a\nb", TopLevel.parseStringLiteralExact("'a\\nb'"));
        assertEquals("it's", TopLevel.parseStringLiteralExact("\"it's\""));
        assertEquals("é", TopLevel.parseStringLiteralExact("'\\u00e9'"));
        assertThrows(ScriptParseException.class, () -> TopLevel.parseStringLiteralExact("'a'b'"));
        assertThrows(ScriptParseException.class, () -> TopLevel.parseStringLiteralExact("'"));
    }

    @Test
    void testStripJsComments() {
        assertEquals("a \nb", TopLevel.stripJsComments("a // c\nb"));
        assertEquals("x  z", TopLevel.stripJsComments("x /* y */ z"));
        assertEquals("'//not'", TopLevel.stripJsComments("'//not'"));
        assertEquals("a / b ", TopLevel.stripJsComments("a / b // c"));
        assertEquals("/\\/\\//.test(s)", TopLevel.stripJsComments("/\\/\\//.test(s)"));
    }

}
