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

class MembersTest extends EvalBase {

    @Test
    void testArrayMutators() {
        matchEval("const a = [1, 2]; a.push(3, 4); a", "[1, 2, 3, 4]");
        assertEquals(3L, eval("const a = [1, 2]; a.push(3)"));
        assertEquals(2L, eval("const a = [1, 2]; a.pop()"));
        assertNull(eval("const a = []; a.pop()"));
        matchEval("const a = [1, 2]; a.unshift(0); a", "[0, 1, 2]");
        matchEval("const a = [1, 2, 3, 4]; const r = a.splice(1, 2, 'x'); [a, r]", "[[1, 'x', 4], [2, 3]]");
        matchEval("const a = [1, 2, 3]; a.reverse(); a", "[3, 2, 1]");
        matchEval("const a = [0, 0, 0]; a.fill(7, 1); a", "[0, 7, 7]");
    }

    @Test
    void testArraySearch() {
        assertEquals(1L, eval("const a = [1, 2, 3]; a.indexOf(2)"));
        assertEquals(-1L, eval("const a = [1, 2, 3]; a.indexOf('2')"));
        assertEquals(true, eval("const a = [NaN]; a.includes(NaN)"));
        assertEquals(-1L, eval("const a = [NaN]; a.indexOf(NaN)"));
        assertEquals(3L, eval("const a = [1, 3, 5]; a.find(x => x > 2)"));
        assertEquals(2L, eval("const a = [1, 3, 5]; a.findIndex(x => x > 4)"));
        assertNull(eval("const a = [1]; a.find(x => x > 4)"));
        assertEquals(3L, eval("const a = [1, 2, 3]; a.at(-1)"));
    }

    @Test
    void testArrayIteration() {
        matchEval("const a = [1, 2, 3]; a.map((x, i) => x * 10 + i)", "[10, 21, 32]");
        matchEval("const a = [1, 2, 3, 4]; a.filter(x => x % 2 === 0)", "[2, 4]");
        assertEquals(10L, eval("const a = [1, 2, 3, 4]; a.reduce((s, x) => s + x, 0)"));
        assertEquals("cba", eval("const a = ['a', 'b', 'c']; a.reduceRight((s, x) => s + x)"));
        assertEquals(true, eval("const a = [1, 2]; a.some(x => x > 1)"));
        assertEquals(false, eval("const a = [1, 2]; a.every(x => x > 1)"));
        assertEquals(6L, eval("let sum = 0; const a = [1, 2, 3]; a.forEach(x => { sum += x }); sum"));
        matchEval("const a = [1, [2, [3]]]; a.flat()", "[1, 2, [3]]");
        matchEval("const a = [1, 2]; a.flatMap(x => [x, x])", "[1, 1, 2, 2]");
    }

    @Test
    void testReduceEmptyArrayThrows() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const a = []; a.reduce((s, x) => s + x)"));
        assertTrue(e.getMessage().contains("reduce of empty array"));
    }

    @Test
    void testArraySort() {
        matchEval("const a = [10, 9, 1]; a.sort()", "[1, 10, 9]");
        matchEval("const a = [10, 9, 1]; a.sort((x, y) => x - y)", "[1, 9, 10]");
        matchEval("const a = [{ k: 2, v: 'a' }, { k: 1, v: 'b' }, { k: 2, v: 'c' }]; a.sort((x, y) => x.k - y.k).map(o => o.v)", "['b', 'a', 'c']");
    }

    @Test
    void testArrayCopies() {
        matchEval("const a = [1, 2, 3]; a.slice(1)", "[2, 3]");
        matchEval("const a = [1, 2, 3]; a.slice(-2, -1)", "[2]");
        matchEval("const a = [1]; a.concat([2, 3], 4)", "[1, 2, 3, 4]");
        assertEquals("1-2-", eval("const a = [1, 2, null]; a.join('-')"));
        assertEquals("1,2", eval("const a = [1, 2]; a.join()"));
    }

    @Test
    void testFrozenArray() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const a = Object.freeze([1]); a.push(2)"));
        assertTrue(e.getMessage().contains("frozen"));
    }

    @Test
    void testCallbackMustBeFunction() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const a = [1]; a.map(5)"));
        assertTrue(e.getMessage().contains("is not a function"));
    }

    @Test
    void testStringMethods() {
        assertEquals("ABC", eval("const s = 'abc'; s.toUpperCase()"));
        assertEquals("x", eval("const s = '  x \\n'; s.trim()"));
        assertEquals(true, eval("const s = 'hello'; s.startsWith('he') && s.endsWith('lo') && s.includes('ell')"));
        assertEquals("ell", eval("const s = 'hello'; s.slice(1, -1)"));
        assertEquals("el", eval("const s = 'hello'; s.substring(3, 1)"));
        assertEquals("e", eval("const s = 'hello'; s.charAt(1)"));
        assertEquals(104L, eval("const s = 'hello'; s.charCodeAt(0)"));
        assertEquals("o", eval("const s = 'hello'; s.at(-1)"));
        assertEquals(5L, eval("const s = 'hello'; s.length"));
        assertEquals("007", eval("const s = '7'; s.padStart(3, '0')"));
        assertEquals("7..", eval("const s = '7'; s.padEnd(3, '.')"));
        assertEquals("ababab", eval("const s = 'ab'; s.repeat(3)"));
        assertEquals(-1L, eval("const s = 'a'; s.localeCompare('b')"));
    }

    @Test
    void testStringSplitAndReplace() {
        matchEval("const s = 'a,b,,c'; s.split(',')", "['a', 'b', '', 'c']");
        matchEval("const s = 'abc'; s.split('')", "['a', 'b', 'c']");
        matchEval("const s = 'a,b,c'; s.split(',', 2)", "['a', 'b']");
        matchEval("const s = 'a1b22c'; s.split(/\\d+/)", "['a', 'b', 'c']");
        assertEquals("a+b-c", eval("const s = 'a-b-c'; s.replace('-', '+')"));
        assertEquals("a+b+c", eval("const s = 'a-b-c'; s.replaceAll('-', '+')"));
        assertEquals("a+b+c", eval("const s = 'a-b-c'; s.replace(/-/g, '+')"));
        assertEquals("b-a", eval("const s = 'a-b'; s.replace(/(\\w)-(\\w)/, '$2-$1')"));
        assertEquals("A-B", eval("const s = 'a-b'; s.replace(/\\w/g, c => c.toUpperCase())"));
        assertEquals("1.5", eval("const s = '1.5'; s.replaceAll('.', '.')"));
    }

    @Test
    void testReplaceAllRequiresGlobalRegex() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const s = 'aa'; s.replaceAll(/a/, 'b')"));
        assertTrue(e.getMessage().contains("global"));
    }

    @Test
    void testStringMatch() {
        matchEval("const s = 'a1b22'; s.match(/\\d+/g)", "['1', '22']");
        assertEquals("22", eval("const s = 'a1b22'; const m = s.match(/b(\\d+)/); m[1]"));
        assertEquals(2L, eval("const s = 'a1b22'; const m = s.match(/b(\\d+)/); m.index"));
        assertNull(eval("const s = 'abc'; s.match(/\\d/g)"));
        assertEquals("2024", eval("const s = 'on 2024-05'; s.match(/(?<year>\\d{4})-(?<month>\\d{2})/).groups.year"));
    }

    @Test
    void testRegexState() {
        assertEquals(true, eval("const r = /a/g; r.test('aa')"));
        assertEquals(1L, eval("const r = /a/g; r.test('aa'); r.lastIndex"));
        assertEquals(0L, eval("const r = /a/g; r.test('aa'); r.test('aa'); r.test('aa'); r.lastIndex"));
        assertEquals("gi", eval("const r = /x/gi; r.flags"));
        assertEquals("x", eval("const r = new RegExp('x', 'g'); r.source"));
        assertEquals(true, eval("/ab+c/i.test('xABBBC')"));
    }

    @Test
    void testNumberMethods() {
        assertEquals("3.14", eval("const n = 3.14159; n.toFixed(2)"));
        assertEquals("2", eval("const n = 1.5; n.toFixed(0)"));
        assertEquals("ff", eval("const n = 255; n.toString(16)"));
        assertEquals("101", eval("const n = 5; n.toString(2)"));
        assertEquals("1.2e+3", eval("const n = 1234; n.toPrecision(2)"));
        assertEquals("ff", eval("const n = 255n; n.toString(16)"));
        assertThrows(ScriptRuntimeException.class, () -> eval("const n = 1; n.toString(1)"));
    }

    @Test
    void testMapMembers() {
        matchEval("const m = new Map([['a', 1]]); m.set('b', 2); [m.size, m.get('a'), m.has('b'), m.keys()]", "[2, 1, true, ['a', 'b']]");
        assertEquals(true, eval("const m = new Map(); m.set(1, 'one'); m.has(1.0)"));
        assertEquals("obj", eval("const k = {}; const m = new Map(); m.set(k, 'obj'); m.get(k)"));
        assertNull(eval("const m = new Map(); m.set({}, 'obj'); m.get({})"));
        matchEval("const m = new Map([['a', 1], ['b', 2]]); m.delete('a'); m.entries()", "[['b', 2]]");
        assertEquals("a1b2", eval("let out = ''; const m = new Map([['a', 1], ['b', 2]]); m.forEach((v, k) => { out += k + v }); out"));
        assertEquals(3L, eval("let total = 0; const m = new Map([['a', 1], ['b', 2]]); for (const e of m) { total += e[1] } total"));
    }

    @Test
    void testSetMembers() {
        matchEval("const s = new Set([1, 2, 2, 3]); s.add(1); [s.size, s.has(2), s.values()]", "[3, true, [1, 2, 3]]");
        assertEquals(true, eval("const s = new Set([NaN]); s.has(NaN)"));
        assertEquals(false, eval("const s = new Set([1]); s.delete(1); s.has(1)"));
        assertEquals(0L, eval("const s = new Set([1, 2]); s.clear(); s.size"));
    }

    @Test
    void testDateMembers() {
        assertEquals(true, eval("const d = new Date(Date.UTC(2024, 0, 15, 10, 30)); d.getFullYear() === 2024 && d.getMonth() === 0 && d.getDate() === 15 && d.getHours() === 10"));
        assertEquals("2024-01-15T10:30:00.000Z", eval("const d = new Date(Date.UTC(2024, 0, 15, 10, 30)); d.toISOString()"));
        assertEquals(1000L, eval("const d = new Date('1970-01-01T00:00:01Z'); d.getTime()"));
        assertEquals(1L, eval("const d = new Date(0); d.getDay() + d.getMonth() + d.getDate() - 4"));
        assertEquals(5L, eval("const d = new Date(0); d.setTime(5); d.getTime()"));
        assertEquals(Double.NaN, eval("const d = new Date('not a date'); d.getFullYear()"));
    }

    @Test
    void testDateNowFollowsVirtualClock() {
        Engine engine = new Engine();
        engine.setStartTime(1000);
        engine.run("setTimeout(() => 0, 500)");
        engine.flush();
        assertEquals(1500L, engine.run("Date.now()"));
        assertEquals(1500L, engine.run("const d = new Date(); d.getTime()"));
    }

    @Test
    void testFunctionCallApplyBind() {
        assertEquals(5L, eval("function add(a, b) { return a + b }\nadd.call(null, 2, 3)"));
        assertEquals(5L, eval("function add(a, b) { return a + b }\nadd.apply(null, [2, 3])"));
        assertEquals(12L, eval("function mul(a, b) { return a * b }\nconst twice = mul.bind(null, 2); twice(6)"));
        assertEquals(7L, eval("const o = { v: 7 }; function readV() { return this.v }\nreadV.call(o)"));
        assertEquals(2L, eval("function f(a, b) { return a }\nf.length"));
    }

    @Test
    void testOwnMembersShadowBuiltins() {
        assertEquals("own", eval("const m = new Map(); m.get = k => 'own'; m.get('x')"));
        assertEquals("custom", eval("const a = [1]; a.join = () => 'custom'; a.join(',')"));
        assertEquals("me", eval("const o = { toString: () => 'me' }; o.toString()"));
        assertEquals(true, eval("const o = { a: 1 }; o.hasOwnProperty('a')"));
    }

    @Test
    void testReadFromNullThrows() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const o = null; o.x"));
        assertEquals("cannot read properties of null (reading 'x')", e.getMessage());
    }

}
