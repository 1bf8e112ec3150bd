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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinsTest extends EvalBase {

    @Test
    void testParseInt() {
        assertEquals(42L, eval("parseInt('42px')"));
        assertEquals(-7L, eval("parseInt('  -7')"));
        assertEquals(31L, eval("parseInt('0x1f')"));
        assertEquals(35L, eval("parseInt('z', 36)"));
        assertEquals(5L, eval("parseInt('101', 2)"));
        assertEquals(Double.NaN, eval("parseInt('abc')"));
        assertEquals(Double.NaN, eval("parseInt('12', 1)"));
    }

    @Test
    void testParseFloat() {
        assertEquals(3.14, eval("parseFloat('3.14abc')"));
        assertEquals(0.5, eval("parseFloat('.5')"));
        assertEquals(1000L, eval("parseFloat('1e3')"));
        assertEquals(Double.NEGATIVE_INFINITY, eval("parseFloat('-Infinityx')"));
        assertEquals(Double.NaN, eval("parseFloat('x1')"));
    }

    @Test
    void testIsNaNAndIsFinite() {
        assertEquals(true, eval("isNaN('abc')"));
        assertEquals(false, eval("isNaN('12')"));
        assertEquals(true, eval("isFinite('12')"));
        assertEquals(false, eval("isFinite(1 / 0)"));
    }

    @Test
    void testMath() {
        assertEquals(3L, eval("Math.max(1, 3, 2)"));
        assertEquals(-1L, eval("Math.min(4, -1)"));
        assertEquals(Double.NaN, eval("Math.max(1, 'x')"));
        assertEquals(Double.NEGATIVE_INFINITY, eval("Math.max()"));
        assertEquals(3L, eval("Math.round(2.5)"));
        assertEquals(-2L, eval("Math.round(-2.5)"));
        assertEquals(2L, eval("Math.floor(2.9)"));
        assertEquals(-2L, eval("Math.trunc(-2.9)"));
        assertEquals(5L, eval("Math.hypot(3, 4)"));
        assertEquals(1024L, eval("Math.pow(2, 10)"));
        assertEquals(3L, eval("Math.log2(8)"));
        assertEquals(Math.PI, eval("Math.PI"));
    }

    @Test
    void testMathRandomIsSeeded() {
        Object first = eval("Math.random()");
        Object second = eval("Math.random()");
        assertEquals(first, second);
        assertTrue((Double) first >= 0 && (Double) first < 1);
    }

    @Test
    void testMathWithBigIntThrows() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("Math.abs(1n)"));
        assertTrue(e.getMessage().contains("BigInt"));
    }

    @Test
    void testUriCodecs() {
        assertEquals("a%20b%26c%2F%C3%A9", eval("encodeURIComponent('a b&c/é')"));
        assertEquals("http://x.com/a%20b?q=1&r=%C3%A9", eval("encodeURI('http://x.com/a b?q=1&r=é')"));
        assertEquals("€", eval("decodeURIComponent('%E2%82%AC')"));
        assertEquals("a/b", eval("decodeURIComponent('a%2Fb')"));
        assertEquals("%2F ", eval("decodeURI('%2F%20')"));
    }

    @Test
    void testUriMalformed() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("decodeURIComponent('%')"));
        assertEquals("URI malformed", e.getMessage());
        assertThrows(ScriptRuntimeException.class, () -> eval("decodeURIComponent('%E2%82')"));
        assertThrows(ScriptRuntimeException.class, () -> eval("decodeURIComponent('%zz')"));
    }

    @Test
    void testBase64() {
        assertEquals("aGVsbG8=", eval("btoa('hello')"));
        assertEquals("hello", eval("atob('aGVs bG8=')"));
        assertEquals("ÿ", eval("atob(btoa('ÿ'))"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("btoa('€')"));
        assertTrue(e.getMessage().contains("Latin1"));
        assertThrows(ScriptRuntimeException.class, () -> eval("atob('a')"));
    }

    @Test
    void testStructuredClone() {
        assertEquals(1L, eval("const a = { x: [1] }; const b = structuredClone(a); b.x.push(2); a.x.length"));
        assertEquals(true, eval("const o = {}; o.self = o; const c = structuredClone(o); c.self === c && c !== o"));
        assertEquals(3L, eval("const m = new Map(); m.set('k', 3); structuredClone(m).get('k')"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("structuredClone(() => 1)"));
        assertTrue(e.getMessage().contains("could not be cloned"));
    }

    @Test
    void testObjectStatics() {
        matchEval("Object.keys({ a: 1, b: 2 })", "['a', 'b']");
        matchEval("Object.values({ a: 1, b: 2 })", "[1, 2]");
        matchEval("Object.entries({ a: 1 })", "[['a', 1]]");
        matchEval("Object.fromEntries([['a', 1], ['b', 2]])", "{ a: 1, b: 2 }");
        matchEval("Object.assign({ a: 1 }, { b: 2 }, null)", "{ a: 1, b: 2 }");
        matchEval("Object.keys([7, 8])", "['0', '1']");
        assertEquals(true, eval("Object.hasOwn({ a: 1 }, 'a')"));
        assertEquals(true, eval("Object.isFrozen(Object.freeze({}))"));
        assertEquals(false, eval("Object.isFrozen({})"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("Object.keys(null)"));
        assertTrue(e.getMessage().contains("Object.keys"));
    }

    @Test
    void testArrayStatics() {
        assertEquals(true, eval("Array.isArray([])"));
        assertEquals(false, eval("Array.isArray({})"));
        matchEval("Array.of(1, 2)", "[1, 2]");
        matchEval("Array.from('ab')", "['a', 'b']");
        matchEval("Array.from({ length: 3 }, (v, i) => i * 2)", "[0, 2, 4]");
        assertThrows(ScriptRuntimeException.class, () -> eval("Array.from(null)"));
    }

    @Test
    void testConsoleLog() {
        List<String> lines = new ArrayList<>();
        Engine engine = new Engine();
        engine.setOnConsoleLog(lines::add);
        engine.run("console.log('a', 1, [1, 2], { k: 'v' }); console.warn('w')");
        assertEquals(List.of("a 1 [1,2] {\"k\":\"v\"}", "w"), lines);
    }

}
