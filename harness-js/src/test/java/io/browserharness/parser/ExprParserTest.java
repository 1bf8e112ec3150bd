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

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExprParserTest {

    static Expr parse(String text) {
        return ExprParser.parseExpr(text);
    }

    @Test
    void testNumericLiterals() {
        Expr expr = parse("1.5");
        assertEquals(ExprType.FLOAT, expr.type);
        assertEquals(1.5d, expr.value);
        expr = parse("42");
        assertEquals(ExprType.NUMBER, expr.type);
        assertEquals(42L, expr.value);
        assertEquals(255L, parse("0xff").value);
        assertEquals(8L, parse("0o10").value);
        assertEquals(5L, parse("0b101").value);
        assertEquals(1000.0d, parse("1e3").value);
        expr = parse("10n");
        assertEquals(ExprType.BIGINT, expr.type);
        assertEquals(BigInteger.TEN, expr.value);
        assertEquals(BigInteger.valueOf(255), parse("0xffn").value);
    }

    @Test
    void testInvalidNumericLiterals() {
        assertThrows(ScriptParseException.class, () -> parse("0x"));
        assertThrows(ScriptParseException.class, () -> parse("012n"));
        assertThrows(ScriptParseException.class, () -> parse("99999999999999999999"));
        ScriptParseException e = assertThrows(ScriptParseException.class, () -> parse("1e400"));
        assertTrue(e.getMessage().contains("invalid numeric literal"));
        assertThrows(ScriptParseException.class, () -> parse("1e400.toFixed(1)"));
    }

    @Test
    void testKeywordLiterals() {
        assertSame(Expr.TRUE, parse("true"));
        assertSame(Expr.NULL, parse("null"));
        assertEquals(ExprType.UNDEFINED, parse("undefined").type);
        assertTrue(Double.isNaN((Double) parse("NaN").value));
        assertEquals(Double.POSITIVE_INFINITY, parse("Infinity").value);
    }

    @Test
    void testStringLiteralIsNotSplit() {
        Expr expr = parse("'a+b'");
        assertEquals(ExprType.STRING, expr.type);
        assertEquals("a+b", expr.value);
        expr = parse("\"x ? y : z\"");
        assertEquals(ExprType.STRING, expr.type);
        assertEquals("x ? y : z", expr.value);
    }

    @Test
    void testTemplateLiteral() {
        Expr expr = parse("`a${1+1}b`");
        assertEquals(ExprType.ADD, expr.type);
        assertEquals(3, expr.args.size());
        assertEquals("a", expr.arg(0).value);
        assertEquals(ExprType.ADD, expr.arg(1).type);
        assertEquals("b", expr.arg(2).value);
        expr = parse("`plain`");
        assertEquals(ExprType.STRING, expr.type);
        assertEquals("plain", expr.value);
        expr = parse("`${x}`");
        assertEquals(ExprType.ADD, expr.type);
        assertEquals("", expr.arg(0).value);
        assertEquals(ExprType.VAR, expr.arg(1).type);
    }

    @Test
    void testPrecedence() {
        Expr expr = parse("1+2*3");
        assertEquals(ExprType.ADD, expr.type);
        assertEquals(1L, expr.arg(0).value);
        assertEquals(BinaryOp.MUL, expr.arg(1).op);
        expr = parse("a || b && c");
        assertEquals(BinaryOp.OR, expr.op);
        assertEquals(BinaryOp.AND, expr.right().op);
        expr = parse("a == b < c");
        assertEquals(BinaryOp.EQ, expr.op);
        assertEquals(BinaryOp.LT, expr.right().op);
        expr = parse("(1+2)*3");
        assertEquals(BinaryOp.MUL, expr.op);
        assertEquals(ExprType.ADD, expr.left().type);
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        Expr expr = parse("10-2-3");
        assertEquals(BinaryOp.SUB, expr.op);
        assertEquals(BinaryOp.SUB, expr.left().op);
        assertEquals(3L, expr.right().value);
    }

    @Test
    void testPowIsRightAssociative() {
        Expr expr = parse("2**3**2");
        assertEquals(BinaryOp.POW, expr.op);
        assertEquals(2L, expr.left().value);
        assertEquals(BinaryOp.POW, expr.right().op);
    }

    @Test
    void testDivisionVersusRegex() {
        Expr expr = parse("a/b/g");
        assertEquals(BinaryOp.DIV, expr.op);
        assertEquals(BinaryOp.DIV, expr.left().op);
        assertEquals("g", expr.right().name);
        expr = parse("/ab/g.test(x)");
        assertEquals(ExprType.REGEX_METHOD, expr.type);
        assertEquals("test", expr.name);
        assertEquals("ab", expr.target.name);
        assertEquals("g", expr.target.flags);
        expr = parse("/a+b/i");
        assertEquals(ExprType.REGEX_LITERAL, expr.type);
        assertEquals("a+b", expr.name);
        assertEquals("i", expr.flags);
    }

    @Test
    void testInvalidRegexFlags() {
        assertThrows(ScriptParseException.class, () -> parse("/a/gg"));
    }

    @Test
    void testTernary() {
        Expr expr = parse("a ? b : c ? d : e");
        assertEquals(ExprType.TERNARY, expr.type);
        assertEquals(ExprType.TERNARY, expr.arg(2).type);
        expr = parse("a ?? b");
        assertEquals(BinaryOp.NULLISH, expr.op);
    }

    @Test
    void testUnary() {
        assertEquals(ExprType.TYPEOF, parse("typeof x").type);
        assertEquals(ExprType.NOT, parse("!x").type);
        assertEquals(ExprType.NEG, parse("-x").type);
        assertEquals(ExprType.AWAIT, parse("await p").type);
    }

    @Test
    void testPostfixChain() {
        Expr expr = parse("a?.b");
        assertEquals(ExprType.MEMBER_GET, expr.type);
        assertTrue(expr.optional);
        assertEquals("b", expr.name);
        expr = parse("a.b(1, 2)");
        assertEquals(ExprType.MEMBER_CALL, expr.type);
        assertEquals("b", expr.name);
        assertEquals(2, expr.args.size());
        expr = parse("a[0]");
        assertEquals(ExprType.INDEX_GET, expr.type);
        expr = parse("f(x)");
        assertEquals(ExprType.FUNCTION_CALL, expr.type);
        assertEquals("f", expr.name);
    }

    @Test
    void testLiteralHeads() {
        Expr expr = parse("null?.b");
        assertEquals(ExprType.MEMBER_GET, expr.type);
        assertSame(Expr.NULL, expr.target);
        assertTrue(expr.optional);
        expr = parse("true.toString()");
        assertEquals(ExprType.MEMBER_CALL, expr.type);
        assertSame(Expr.TRUE, expr.target);
        expr = parse("0.1.toFixed(2)");
        assertEquals(ExprType.MEMBER_CALL, expr.type);
        assertEquals("toFixed", expr.name);
        assertEquals(0.1d, expr.target.value);
        expr = parse("0xff.toString(16)");
        assertEquals(255L, expr.target.value);
    }

    @Test
    void testJsonParseTakesReviver() {
        Expr expr = parse("JSON.parse(text, (k, v) => v)");
        assertEquals(ExprType.JSON_PARSE, expr.type);
        assertEquals(2, expr.args.size());
        assertThrows(ScriptParseException.class, () -> parse("JSON.parse(a, b, c)"));
    }

    @Test
    void testGeneratorFunction() {
        Expr expr = parse("function* g() { yield 1 }");
        assertEquals(ExprType.FUNCTION, expr.type);
        assertTrue(expr.handler.generator);
        assertFalse(parse("function g() { return 1 }").handler.generator);
        assertEquals(ExprType.YIELD_STAR, parse("yield* xs").type);
        expr = parse("yield a + b");
        assertEquals(ExprType.YIELD, expr.type);
        assertEquals(ExprType.BINARY, expr.arg(0).type);
    }

    @Test
    void testArrowFunction() {
        Expr expr = parse("x => x * 2");
        assertEquals(ExprType.FUNCTION, expr.type);
        assertTrue(expr.arrow);
        assertFalse(expr.async);
        List<Stmt> stmts = expr.handler.stmts;
        assertEquals(1, stmts.size());
        assertEquals(StmtType.RETURN, stmts.get(0).type);
        expr = parse("async (a, b = 1, ...rest) => { return a; }");
        assertTrue(expr.async);
        assertEquals(3, expr.handler.params.size());
        assertNotNull(expr.handler.params.get(1).defaultValue);
        assertTrue(expr.handler.params.get(2).rest);
    }

    @Test
    void testComma() {
        Expr expr = parse("a, b, c");
        assertEquals(ExprType.COMMA, expr.type);
        assertEquals(3, expr.args.size());
    }

    @Test
    void testOuterParensStripped() {
        assertEquals(1L, parse("((1))").value);
    }

    @Test
    void testParseErrors() {
        ScriptParseException e = assertThrows(ScriptParseException.class, () -> parse(""));
        assertTrue(e.getMessage().contains("empty expression"));
        assertThrows(ScriptParseException.class, () -> parse("1 +"));
    }

    @Test
    void testMalformedOperands() {
        ScriptParseException e = assertThrows(ScriptParseException.class, () -> parse("new"));
        assertTrue(e.getMessage().contains("missing constructor"));
        e = assertThrows(ScriptParseException.class, () -> parse("a +* b"));
        assertTrue(e.getMessage().contains("missing operand"));
        assertTrue(e.getMessage().contains("* b"));
        e = assertThrows(ScriptParseException.class, () -> parse("-"));
        assertTrue(e.getMessage().contains("missing operand"));
        e = assertThrows(ScriptParseException.class, () -> parse("class"));
        assertTrue(e.getMessage().contains("unexpected keyword: class"));
        assertEquals(ExprType.VAR, parse("this").type);
    }

}
