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

class StatementParserTest {

    static List<Stmt> parse(String text) {
        return StatementParser.parseStatements(text);
    }

    @Test
    void testDeclarations() {
        List<Stmt> stmts = parse("let a = 1; const b = 2\nb");
        assertEquals(3, stmts.size());
        assertEquals(StmtType.DECLARE, stmts.get(0).type);
        assertEquals("let", stmts.get(0).kind);
        assertEquals("a", stmts.get(0).name);
        assertEquals("const", stmts.get(1).kind);
        assertEquals(StmtType.EXPR, stmts.get(2).type);
        stmts = parse("var x, y = 2");
        assertEquals(2, stmts.size());
        assertNull(stmts.get(0).expr);
        assertEquals(2L, stmts.get(1).expr.value);
    }

    @Test
    void testConstRequiresInitializer() {
        assertThrows(ScriptParseException.class, () -> parse("const c"));
    }

    @Test
    void testFunctionDeclarationsAreHoisted() {
        List<Stmt> stmts = parse("f(); function f() { return 1 }");
        assertEquals(2, stmts.size());
        assertEquals(StmtType.FUNCTION_DECL, stmts.get(0).type);
        assertEquals("f", stmts.get(0).name);
        assertEquals(StmtType.EXPR, stmts.get(1).type);
    }

    @Test
    void testIfElse() {
        List<Stmt> stmts = parse("if (a) b = 1; else b = 2");
        assertEquals(1, stmts.size());
        Stmt stmt = stmts.get(0);
        assertEquals(StmtType.IF, stmt.type);
        assertEquals(StmtType.ASSIGN, stmt.body.get(0).type);
        assertEquals(StmtType.ASSIGN, stmt.elseBody.get(0).type);
        stmt = parse("if (a) { b() }").get(0);
        assertNull(stmt.elseBody);
    }

    @Test
    void testClassicForLoop() {
        Stmt stmt = parse("for (let i = 0; i < 3; i++) { s += i }").get(0);
        assertEquals(StmtType.BLOCK, stmt.type);
        assertEquals(StmtType.DECLARE, stmt.body.get(0).type);
        Stmt loop = stmt.body.get(1);
        assertEquals(StmtType.WHILE, loop.type);
        assertEquals(2, loop.body.size());
        assertEquals(StmtType.ASSIGN, loop.body.get(0).type);
        assertEquals("+=", loop.body.get(0).op);
        assertEquals(StmtType.UPDATE, loop.body.get(1).type);
    }

    @Test
    void testForOf() {
        Stmt stmt = parse("for (const x of xs) { total += x }").get(0);
        assertEquals(StmtType.FOR_OF, stmt.type);
        assertEquals("x", stmt.name);
        assertEquals("const", stmt.kind);
        assertEquals("xs", stmt.expr.name);
        assertThrows(ScriptParseException.class, () -> parse("for (k in obj) {}"));
    }

    @Test
    void testUpdateAndAssignment() {
        Stmt stmt = parse("x++").get(0);
        assertEquals(StmtType.UPDATE, stmt.type);
        assertFalse(stmt.prefix);
        stmt = parse("--x").get(0);
        assertTrue(stmt.prefix);
        assertEquals("--", stmt.op);
        stmt = parse("a.b = c").get(0);
        assertEquals(StmtType.ASSIGN, stmt.type);
        assertEquals(ExprType.MEMBER_GET, stmt.target.type);
        stmt = parse("a == b").get(0);
        assertEquals(StmtType.EXPR, stmt.type);
    }

    @Test
    void testLineBreaks() {
        assertEquals(1, parse("let x = 1 +\n 2").size());
        assertEquals(1, parse("a\n.b()").size());
        assertEquals(2, parse("let a = 1 // one\nlet b = 2").size());
        assertEquals(2, parse("a\nb").size());
    }

    @Test
    void testReturnAndThrow() {
        Stmt stmt = parse("return;").get(0);
        assertEquals(StmtType.RETURN, stmt.type);
        assertNull(stmt.expr);
        assertEquals(StmtType.THROW, parse("throw new Error('x')").get(0).type);
        assertThrows(ScriptParseException.class, () -> parse("throw"));
    }

    @Test
    void testStrayBrace() {
        assertThrows(ScriptParseException.class, () -> parse("a; }"));
    }

}
