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

class OperatorsTest extends EvalBase {

    @Test
    void testOperatorCoercionDoesNotTrim() {
        assertEquals(-0.0, eval("-'abc'"));
        assertEquals(-1L, eval("true - 1"));
        assertEquals(3L, eval("'5' - 2"));
        assertEquals(-1L, eval("' 5 ' - 1"));
        assertEquals(5L, eval("' 5 ' * 1"));
        assertEquals(10L, eval("'5' * '2'"));
        assertEquals(-1L, eval("null - 1"));
        assertEquals(Double.NaN, eval("undefined - 1"));
    }

    @Test
    void testDivisionAndRemainder() {
        assertEquals(Double.NaN, eval("5 % 0"));
        assertEquals(1L, eval("7 % 3"));
        assertEquals(-1L, eval("-7 % 3"));
        assertEquals(Double.POSITIVE_INFINITY, eval("5 / 0"));
        assertEquals(Double.NEGATIVE_INFINITY, eval("-5 / 0"));
        assertEquals(Double.NaN, eval("1 ** Infinity"));
    }

    @Test
    void testBigIntArithmetic() {
        assertEquals(BigInteger.valueOf(3), eval("7n / 2n"));
        assertEquals(BigInteger.valueOf(1), eval("7n % 2n"));
        assertEquals(BigInteger.valueOf(1024), eval("2n ** 10n"));
        assertEquals(BigInteger.valueOf(-5), eval("-5n"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("10n / 0n"));
        assertEquals("BigInt division by zero", e.getMessage());
        assertThrows(ScriptRuntimeException.class, () -> eval("2n ** -1n"));
        assertThrows(ScriptRuntimeException.class, () -> eval("+1n"));
    }

    @Test
    void testBitwise() {
        assertEquals(4294967295L, eval("-1 >>> 0"));
        assertEquals(-2147483648L, eval("1 << 31"));
        assertEquals(-6L, eval("~5"));
        assertEquals(2L, eval("6 & 3"));
        assertEquals(7L, eval("6 | 3"));
        assertEquals(5L, eval("6 ^ 3"));
        assertEquals(-2L, eval("-8 >> 2"));
        assertEquals(BigInteger.ONE, eval("5n & 3n"));
        assertThrows(ScriptRuntimeException.class, () -> eval("1n >>> 0n"));
        assertThrows(ScriptRuntimeException.class, () -> eval("1n & 1"));
    }

    @Test
    void testLooseEquality() {
        assertEquals(true, eval("null == undefined"));
        assertEquals(false, eval("null == 0"));
        assertEquals(true, eval("'1' == 1"));
        assertEquals(true, eval("true == 1"));
        assertEquals(true, eval("1n == 1"));
        assertEquals(true, eval("'10' == 10n"));
        assertEquals(true, eval("const a = [1]; a == 1"));
        assertEquals(false, eval("NaN == NaN"));
        assertEquals(true, eval("0 === -0"));
        assertEquals(true, eval("1 === 1.0"));
        assertEquals(false, eval("'1' === 1"));
    }

    @Test
    void testRelational() {
        assertEquals(true, eval("'a' < 'b'"));
        assertEquals(true, eval("'10' < '9'"));
        assertEquals(false, eval("'10' < 9"));
        assertEquals(true, eval("1n < 2"));
        assertEquals(false, eval("NaN < 1"));
        assertEquals(false, eval("NaN >= 1"));
        assertEquals(true, eval("2 >= 2"));
    }

    @Test
    void testIn() {
        assertEquals(true, eval("'a' in { a: 1 }"));
        assertEquals(true, eval("const a = [5, 6]; 1 in a"));
        assertEquals(false, eval("const a = [5, 6]; 2 in a"));
        assertEquals(true, eval("const a = []; 'length' in a"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("'x' in 5"));
        assertTrue(e.getMessage().contains("cannot use 'in' operator"));
    }

    @Test
    void testInstanceOf() {
        assertEquals(true, eval("const a = []; a instanceof Array"));
        assertEquals(true, eval("const m = new Map(); m instanceof Map && m instanceof Object"));
        assertEquals(false, eval("const o = {}; o instanceof Array"));
        assertEquals(true, eval("const e = new TypeError('t'); e instanceof TypeError && e instanceof Error"));
        assertEquals(true, eval("function P() { return 1 }\nconst p = new P(); p instanceof P"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("1 instanceof 2"));
        assertTrue(e.getMessage().contains("not callable"));
    }

    @Test
    void testDelete() {
        matchEval("const o = { a: 1, b: 2 }; delete o.a; Object.keys(o)", "['b']");
        matchEval("const a = [1, 2]; delete a[0]; [a.length, a[0]]", "[2, null]");
    }

    @Test
    void testUnary() {
        assertNull(eval("void 0"));
        assertEquals(5L, eval("+'5'"));
        assertEquals(Double.NaN, eval("+'5px'"));
        assertEquals(0L, eval("+''"));
        assertEquals(true, eval("!''"));
        assertEquals(false, eval("!!0n"));
        assertEquals(-0.0, eval("-0"));
    }

    @Test
    void testNegateKeepsLong() {
        assertEquals(-4L, Operators.negate(4L));
        assertEquals(4L, Operators.negate(-4L));
        assertEquals(9.223372036854775808E18, Operators.negate(Long.MIN_VALUE));
        assertEquals(-2.5, Operators.negate(2.5));
        assertEquals(-3L, Operators.negate(3.0));
        assertEquals(BigInteger.valueOf(-7), Operators.negate(BigInteger.valueOf(7)));
    }

    @Test
    void testObjectToPrimitive() {
        assertEquals(43L, eval("const o = { valueOf: () => 42 }; o + 1"));
        assertEquals("xy", eval("const o = { toString: () => 'x' }; o + 'y'"));
        assertEquals("[object Object]!", eval("const o = {}; o + '!'"));
        assertEquals("1,2|", eval("const a = [1, 2]; a + '|'"));
        assertEquals(84L, eval("const o = { valueOf: () => 42 }; o * 2"));
    }

    @Test
    void testNullishAndComma() {
        assertEquals("d", eval("null ?? 'd'"));
        assertEquals(0L, eval("0 ?? 'd'"));
        assertEquals("d", eval("0 || 'd'"));
        assertEquals(3L, eval("(1, 2, 3)"));
    }

}
