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
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class TermsTest {

    @Test
    void testFormatNumber() {
        assertEquals("1.5", Terms.formatNumber(1.5));
        assertEquals("0", Terms.formatNumber(-0.0));
        assertEquals("100000000000000000000", Terms.formatNumber(1e20));
        assertEquals("1e+21", Terms.formatNumber(1e21));
        assertEquals("0.000001", Terms.formatNumber(0.000001));
        assertEquals("1e-7", Terms.formatNumber(1e-7));
        assertEquals("-123.456", Terms.formatNumber(-123.456));
        assertEquals("0.30000000000000004", Terms.formatNumber(0.1 + 0.2));
        assertEquals("NaN", Terms.formatNumber(Double.NaN));
        assertEquals("-Infinity", Terms.formatNumber(Double.NEGATIVE_INFINITY));
    }

    @Test
    void testNarrow() {
        assertEquals(2L, Terms.narrow(2.0));
        assertEquals(1.5, Terms.narrow(1.5));
        assertEquals(-0.0, Terms.narrow(-0.0));
        assertEquals(1e19, Terms.narrow(1e19));
        assertEquals(Double.POSITIVE_INFINITY, Terms.narrow(Double.POSITIVE_INFINITY));
    }

    @Test
    void testParseJsNumber() {
        assertEquals(16.0, Terms.parseJsNumber(" 0x10 "));
        assertEquals(1000.0, Terms.parseJsNumber("1e3"));
        assertEquals(0.0, Terms.parseJsNumber("   "));
        assertTrue(Double.isNaN(Terms.parseJsNumber("0b2")));
        assertTrue(Double.isNaN(Terms.parseJsNumber("-0x10")));
        assertTrue(Double.isNaN(Terms.parseJsNumber("12px")));
        assertEquals(Double.NEGATIVE_INFINITY, Terms.parseJsNumber("-Infinity"));
    }

    @Test
    void testNumericValueDoesNotTrim() {
        assertEquals(0.0, Terms.numericValue(" 5 "));
        assertEquals(5.0, Terms.numericValue("5"));
        assertEquals(0.0, Terms.numericValue(null));
        assertTrue(Double.isNaN(Terms.numericValue(Terms.UNDEFINED)));
    }

    @Test
    void testInt32() {
        assertEquals(-2147483648, Terms.toInt32(2147483648.0));
        assertEquals(0, Terms.toInt32(4294967296.0));
        assertEquals(-1, Terms.toInt32(-1.9));
        assertEquals(0, Terms.toInt32(Double.NaN));
        assertEquals(4294967295L, Terms.toUint32(-1));
    }

    @Test
    void testToIndex() {
        assertEquals(3, Terms.toIndex("3"));
        assertEquals(-1, Terms.toIndex("01"));
        assertEquals(-1, Terms.toIndex("-1"));
        assertEquals(2, Terms.toIndex(2.0));
        assertEquals(-1, Terms.toIndex(2.5));
    }

    @Test
    void testBigIntConversion() {
        assertEquals(BigInteger.valueOf(31), Terms.parseBigInt("0x1f"));
        assertNull(Terms.parseBigInt("1.5"));
        assertEquals(BigInteger.ONE, Terms.toBigInt(true));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> Terms.toBigInt(1.5));
        assertEquals("cannot convert 1.5 to a BigInt", e.getMessage());
    }

    @Test
    void testToStrAndTruthiness() {
        JsArray array = new JsArray(Arrays.asList(1L, null, "x"));
        assertEquals("1,,x", Terms.toStr(array));
        assertFalse(Terms.isTruthy(""));
        assertFalse(Terms.isTruthy(-0.0));
        assertFalse(Terms.isTruthy(BigInteger.ZERO));
        assertTrue(Terms.isTruthy(new JsObject()));
        assertEquals("undefined", Terms.typeOf(Terms.UNDEFINED));
        assertEquals("object", Terms.typeOf(null));
    }

    @Test
    void testFromJava() {
        assertEquals(3L, Terms.fromJava(3));
        Object converted = Terms.fromJava(Collections.singletonMap("a", 1));
        assertTrue(converted instanceof JsObject);
        assertEquals(1L, ((JsObject) converted).getMember("a"));
    }

}
