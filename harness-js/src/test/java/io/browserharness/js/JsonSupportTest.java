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
package io.browserharness.js;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonSupportTest extends EvalBase {

    @Test
    void testParse() {
        matchEval("JSON.parse('{\"a\":[1,2.5,true,null],\"b\":{\"c\":\"d\"}}')", "{ a: [1, 2.5, true, null], b: { c: 'd' } }");
        assertEquals(3L, eval("JSON.parse('[1,2,3]').length"));
    }

    @Test
    void testParseKeepsKeyOrder() {
        matchEval("Object.keys(JSON.parse('{\"z\":1,\"a\":2,\"m\":3}'))", "['z', 'a', 'm']");
    }

    @Test
    void testParseRejectsLooseJson() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("JSON.parse(\"{'a':1}\")"));
        assertTrue(e.getMessage().startsWith("JSON.parse"));
    }

    @Test
    void testParseWithReviver() {
        matchEval("JSON.parse('{\"a\":1,\"b\":2}', (k, v) => k === 'a' ? undefined : v)", "{ b: 2 }");
        matchEval("JSON.parse('[1,2]', (k, v) => typeof v === 'number' ? v * 10 : v)", "[10, 20]");
    }

    @Test
    void testStringifySkipsUnserializable() {
        assertEquals("{\"a\":1,\"d\":[null,2]}", eval("JSON.stringify({ a: 1, b: undefined, c: () => 1, d: [undefined, 2] })"));
        assertNull(eval("JSON.stringify(undefined)"));
        assertEquals("[null,1.5,1e+21]", eval("JSON.stringify([NaN, 1.5, 1e21])"));
        assertEquals("null", eval("JSON.stringify(null)"));
    }

    @Test
    void testStringifyEscapes() {
        assertEquals("\"he\\\"y\\n\\t\"", eval("JSON.stringify('he\"y\\n\\t')"));
        assertEquals("\"\\u0001\"", eval("JSON.stringify('\\u0001')"));
    }

    @Test
    void testStringifyIndent() {
        assertEquals("{\n  \"a\": [\n    1\n  ],\n  \"b\": {}\n}", eval("JSON.stringify({ a: [1], b: {} }, null, 2)"));
        assertEquals("[\n\t1\n]", eval("JSON.stringify([1], null, '\\t')"));
    }

    @Test
    void testStringifyReplacers() {
        assertEquals("{\"c\":3,\"a\":1}", eval("JSON.stringify({ a: 1, b: 2, c: 3 }, ['c', 'a'])"));
        assertEquals("{\"a\":10,\"b\":\"x\"}", eval("JSON.stringify({ a: 1, b: 'x' }, (k, v) => typeof v === 'number' ? v * 10 : v)"));
    }

    @Test
    void testStringifyToJson() {
        assertEquals("{\"x\":\"custom\"}", eval("JSON.stringify({ x: { toJSON: () => 'custom' } })"));
        assertEquals("\"1970-01-01T00:00:00.000Z\"", eval("JSON.stringify(new Date(0))"));
    }

    @Test
    void testStringifyBigIntThrows() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("JSON.stringify({ n: 1n })"));
        assertEquals("Do not know how to serialize a BigInt", e.getMessage());
    }

    @Test
    void testStringifyCycleThrows() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const o = {}; o.o = o; JSON.stringify(o)"));
        assertTrue(e.getMessage().contains("circular"));
    }

    @Test
    void testSharedReferenceIsNotACycle() {
        assertEquals("[{},{}]", eval("const o = {}; JSON.stringify([o, o])"));
    }

}
