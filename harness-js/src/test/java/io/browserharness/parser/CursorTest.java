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

import static org.junit.jupiter.api.Assertions.*;

class CursorTest {

    @Test
    void testIdentifierAndBlock() {
        Cursor cursor = new Cursor("foo(bar) baz");
        assertEquals("foo", cursor.parseIdentifier());
        assertEquals("bar", cursor.readBalancedBlock('(', ')'));
        cursor.skipWs();
        assertEquals("baz", cursor.rest());
        assertEquals("baz", cursor.parseIdentifier());
        assertTrue(cursor.eof());
        assertEquals(0, cursor.peek());
    }

    @Test
    void testBalancedBlockIgnoresLiterals() {
        Cursor cursor = new Cursor("(a, ')', `)`, /\\)/) x");
        assertEquals("a, ')', `)`, /\\)/", cursor.readBalancedBlock('(', ')'));
        assertEquals(" x", cursor.rest());
        cursor = new Cursor("{ if (a) { b } }");
        assertEquals(" if (a) { b } ", cursor.readBalancedBlock('{', '}'));
    }

    @Test
    void testUnclosedBlock() {
        ScriptParseException e = assertThrows(ScriptParseException.class,
                () -> new Cursor("(abc").readBalancedBlock('(', ')'));
        assertEquals("(abc", e.getSource());
        assertThrows(ScriptParseException.class, () -> new Cursor("abc").readBalancedBlock('(', ')'));
    }

    @Test
    void testKeywords() {
        assertFalse(new Cursor("letter").consumeKeyword("let"));
        Cursor cursor = new Cursor("let x");
        assertTrue(cursor.consumeKeyword("let"));
        assertEquals(3, cursor.getPos());
    }

    @Test
    void testStringLiteral() {
        Cursor cursor = new Cursor("'a\\'b' rest");
        assertEquals("a'b", cursor.parseStringLiteral());
        assertEquals(" rest", cursor.rest());
        assertThrows(ScriptParseException.class, () -> new Cursor("'abc").parseStringLiteral());
        assertThrows(ScriptParseException.class, () -> new Cursor("abc").parseStringLiteral());
    }

    @Test
    void testSkipWsSkipsComments() {
        Cursor cursor = new Cursor("  // c\n  /* d */ x");
        cursor.skipWs();
        assertEquals('x', cursor.peek());
    }

    @Test
    void testReadUntilAndExpect() {
        Cursor cursor = new Cursor("key: value");
        assertEquals("key", cursor.readUntil(':'));
        cursor.expect(':');
        cursor.skipWs();
        assertEquals("value", cursor.rest());
        assertThrows(ScriptParseException.class, () -> cursor.expect(';'));
        assertThrows(ScriptParseException.class, () -> new Cursor("abc").readUntil(';'));
    }

}
