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

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class EvalTest extends EvalBase {

    @Test
    void testArithmetic() {
        assertEquals(7L, eval("1+2*3"));
        assertEquals(512L, eval("2**3**2"));
        assertEquals(5L, eval("10-2-3"));
        assertEquals(3.5, eval("7 / 2"));
        assertEquals(3L, eval("6 / 2"));
        assertEquals(1L, eval("7 % 3"));
        assertEquals(0.30000000000000004, eval("0.1 + 0.2"));
        assertEquals(1.5, eval("1.5"));
        assertEquals(1L, eval("1.0"));
        assertEquals(-4L, eval("-(2 + 2)"));
        assertEquals(8L, eval("1 << 3"));
    }

    @Test
    void testBigInt() {
        assertEquals(BigInteger.TEN, eval("10n"));
        assertEquals(BigInteger.valueOf(15), eval("10n + 5n"));
        assertEquals("bigint", eval("typeof 10n"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("10n + 1"));
        assertTrue(e.getMessage().contains("cannot mix BigInt"));
    }

    @Test
    void testStringConcatenation() {
        assertEquals("a12", eval("'a' + 1 + 2"));
        assertEquals("3a", eval("1 + 2 + 'a'"));
        assertEquals("a+b", eval("'a+b'"));
        assertEquals("1.5", eval("'' + 1.5"));
        assertEquals("1e+21", eval("'' + 1e21"));
        assertEquals("a2b", eval("`a${1+1}b`"));
        assertEquals("x=2", eval("let n = 2; `x=${n}`"));
    }

    @Test
    void testEquality() {
        assertEquals(true, eval("1 == '1'"));
        assertEquals(false, eval("1 === '1'"));
        assertEquals(true, eval("null == undefined"));
        assertEquals(false, eval("null === undefined"));
        assertEquals(false, eval("NaN === NaN"));
        assertEquals(true, eval("1 === 1.0"));
        assertEquals(true, eval("'b' > 'a'"));
    }

    @Test
    void testLogicalOperators() {
        assertEquals("x", eval("0 || 'x'"));
        assertEquals(0L, eval("0 ?? 'x'"));
        assertEquals("d", eval("null ?? 'd'"));
        assertEquals(2L, eval("1 && 2"));
        assertEquals(false, eval("let called = false; function f() { called = true; return 1 } false && f(); called"));
        assertEquals(true, eval("let called = false; function f() { called = true; return 1 } true && f(); called"));
    }

    @Test
    void testTypeof() {
        assertEquals("undefined", eval("typeof notDeclared"));
        assertEquals("number", eval("typeof 1"));
        assertEquals("string", eval("typeof ''"));
        assertEquals("object", eval("typeof null"));
        assertEquals("function", eval("typeof (() => 1)"));
        assertEquals("object", eval("typeof []"));
    }

    @Test
    void testUnknownVariable() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("notDeclared + 1"));
        assertTrue(e.getMessage().contains("notDeclared"));
    }

    @Test
    void testOptionalChaining() {
        assertNull(eval("let o = null; o?.a.b"));
        assertEquals(1L, eval("let o = {a: {b: 1}}; o?.a.b"));
        assertNull(eval("let arr = null; arr?.[0]"));
    }

    @Test
    void testObjectsAndArrays() {
        matchEval("let o = {a: 1, b: [1, 2]}; o.b.push(3); o", "{ a: 1, b: [1, 2, 3] }");
        matchEval("let a = [1, 2]; [...a, 3]", "[1, 2, 3]");
        matchEval("let o = {a: 1}; let p = {...o, b: 2}; p", "{ a: 1, b: 2 }");
        matchEval("let k = 'x'; let o = {[k]: 1, k}; o", "{ x: 1, k: 'x' }");
        assertEquals(4L, eval("let o = {n: 2, dbl() { return this.n * 2 }}; o.dbl()"));
        assertNull(eval("let arr = [1]; arr[5]"));
        assertEquals(3L, eval("'abc'.length"));
    }

    @Test
    void testArrayAliasing() {
        matchEval("let a = [1]; let b = a; b.push(2); a", "[1, 2]");
        matchEval("function add(arr) { arr.push(9) } let xs = []; add(xs); xs", "[9]");
        matchEval("let o = {list: []}; let l = o.list; l.push('x'); o", "{ list: ['x'] }");
    }

    @Test
    void testFunctions() {
        assertEquals(5L, eval("function add(a, b) { return a + b } add(2, 3)"));
        assertEquals(11L, eval("function f(a, b = 10) { return a + b } f(1)"));
        assertEquals(3L, eval("function f(...xs) { return xs.length } f(1, 2, 3)"));
        assertEquals(6L, eval("const sq = x => x * x; sq(2) + 2"));
        assertEquals(2L, eval("let n = 0; const inc = () => n++; inc(); inc(); n"));
        assertEquals(2L, eval("function counter() { let c = 0; return () => { c++; return c } } const f = counter(); f(); f()"));
        assertEquals(10L, eval("(function (x) { return x * 2 })(5)"));
    }

    @Test
    void testControlFlow() {
        assertEquals(10L, eval("let s = 0; for (let i = 0; i < 5; i++) { s += i } s"));
        assertEquals("ab", eval("let s = ''; for (const c of ['a', 'b']) { s += c } s"));
        assertEquals(3L, eval("let i = 0; while (i < 3) i++; i"));
        assertEquals("big", eval("let x = 5; let r; if (x > 3) { r = 'big' } else { r = 'small' } r"));
        assertEquals("neg", eval("function sign(x) { if (x < 0) return 'neg'; return 'pos' } sign(-1)"));
    }

    @Test
    void testConstAssignment() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const c = 1; c = 2"));
        assertTrue(e.getMessage().contains("assignment to constant"));
    }

    @Test
    void testThrow() {
        ScriptThrownException e = assertThrows(ScriptThrownException.class, () -> eval("throw new Error('bad')"));
        JsError error = (JsError) e.getValue();
        assertEquals("Error", error.getName());
        assertEquals("bad", error.getMessage());
        e = assertThrows(ScriptThrownException.class, () -> eval("throw 'plain'"));
        assertEquals("plain", e.getValue());
    }

    @Test
    void testCompoundAssignment() {
        assertEquals(6L, eval("let x = 2; x *= 3; x"));
        assertEquals("ab", eval("let s = 'a'; s += 'b'; s"));
        assertEquals(5L, eval("let x = null; x ??= 5; x"));
        assertEquals(1L, eval("let x = 1; x ||= 5; x"));
        matchEval("let o = {n: 1}; o.n += 2; o['m'] = 4; o", "{ n: 3, m: 4 }");
    }

    @Test
    void testNegationKeepsIntegers() {
        assertEquals(-4L, eval("-4"));
        assertEquals(-12L, eval("-a", "{ a: 12 }"));
        assertEquals(-3L, eval("let n = 3; -n"));
        assertEquals(-1.5, eval("-1.5"));
        assertEquals(0L, eval("1 + -1"));
        assertEquals("-7", eval("'' + -7"));
    }

    @Test
    void testLiteralReceivers() {
        assertNull(eval("null?.b"));
        assertNull(eval("undefined?.b.c"));
        assertEquals("true", eval("true.toString()"));
        assertEquals("0.10", eval("0.1.toFixed(2)"));
        assertEquals("ff", eval("0xff.toString(16)"));
    }

    @Test
    void testNamedFunctionExpressionRecursion() {
        assertEquals(120L, eval("let f = function fact(n) { return n <= 1 ? 1 : n * fact(n - 1) }\nf(5)"));
        assertEquals("function", eval("const g = function inner() { return typeof inner }; g()"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> eval("const g = function inner() { return 1 }; inner()"));
        assertTrue(e.getMessage().contains("inner"));
    }

    @Test
    void testGenerators() {
        assertEquals(3L, eval("function* g() { yield 1; yield 2 }\nlet s = 0; for (const v of g()) { s += v } s"));
        matchEval("function* g() { yield 1; yield 2 }\n[...g()]", "[1, 2]");
        matchEval("const g = function* () { yield 'x' }; [...g()]", "['x']");
        matchEval("function* g() { yield 0; yield* [1, 2]; yield* 'ab' }\n[...g()]", "[0, 1, 2, 'a', 'b']");
        matchEval("function* g(n) { for (let i = 0; i < n; i++) { yield i * 10 } }\nArray.from(g(3))", "[0, 10, 20]");
    }

    @Test
    void testGeneratorNextAndReturn() {
        matchEval("function* g() { yield 1; return 'end' }\n"
                + "const it = g(); const a = it.next(); const b = it.next(); const c = it.next();\n"
                + "[a.value, a.done, b.value, b.done, c.value, c.done]", "[1, false, 'end', true, null, true]");
        matchEval("function* g() { yield 1; yield 2 }\n"
                + "const it = g(); it.next(); const r = it.return(9); const n = it.next();\n"
                + "[r.value, r.done, n.done, [...it].length]", "[9, true, true, 0]");
        assertEquals("[object Generator]", eval("function* g() {}\nString(g())"));
    }

    @Test
    void testGeneratorStopsAtYieldLimit() {
        assertEquals((long) Interpreter.MAX_BUFFERED_YIELDS,
                eval("function* nat() { let i = 0; while (true) { yield i; i = i + 1 } }\n[...nat()].length"));
    }

    @Test
    void testYieldStarRequiresIterable() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("function* g() { yield* 5 }\ng()"));
        assertTrue(e.getMessage().contains("is not iterable"));
    }

    @Test
    void testBindingsFromHost() {
        assertEquals(3L, eval("a + b", "{ a: 1, b: 2 }"));
        matchEval("items.push(4); items", "[1, 2, 3, 4]", "{ items: [1, 2, 3] }");
        eval("let created = 'yes'");
        assertEquals("yes", get("created"));
    }

}
