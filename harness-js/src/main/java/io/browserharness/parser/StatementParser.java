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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script or function body into statements. Statements end at a top-level semicolon, at the
 * end of a block statement, or at a top-level line break after which the expression cannot continue.
 */
public class StatementParser {

    static final Logger logger = LoggerFactory.getLogger(StatementParser.class);

    private StatementParser() {
        // only static methods
    }

    public static List<Stmt> parseStatements(String src) {
        String s = src;
        if (s.indexOf("//") != -1 || s.indexOf("/*") != -1) {
            s = TopLevel.stripJsComments(s);
        }
        Cursor cursor = new Cursor(s);
        List<Stmt> functions = new ArrayList<>();
        List<Stmt> stmts = new ArrayList<>();
        while (true) {
            cursor.skipWs();
            if (cursor.eof()) {
                break;
            }
            if (cursor.consume(';')) {
                continue;
            }
            if (cursor.peek() == '}') {
                throw new ScriptParseException("unexpected '}'", s);
            }
            for (Stmt stmt : parseStatement(cursor)) {
                // function declarations are hoisted to the start of their body
                if (stmt.type == StmtType.FUNCTION_DECL) {
                    functions.add(stmt);
                } else {
                    stmts.add(stmt);
                }
            }
        }
        if (functions.isEmpty()) {
            return stmts;
        }
        functions.addAll(stmts);
        return functions;
    }

    static List<Stmt> parseStatement(Cursor cursor) {
        if (cursor.peek() == '{') {
            String block = cursor.readBalancedBlock('{', '}');
            return List.of(Stmt.block(parseStatements(block)));
        }
        int start = cursor.getPos();
        if (cursor.consumeKeyword("if")) {
            Expr cond = condition(cursor, "if");
            List<Stmt> then = branch(cursor);
            int beforeElse = cursor.getPos();
            cursor.skipWs();
            cursor.consume(';');
            cursor.skipWs();
            List<Stmt> otherwise = null;
            if (cursor.consumeKeyword("else")) {
                otherwise = branch(cursor);
            } else {
                cursor.setPos(beforeElse);
            }
            return List.of(Stmt.ifElse(cond, then, otherwise));
        }
        if (cursor.consumeKeyword("while")) {
            Expr cond = condition(cursor, "while");
            return List.of(Stmt.whileLoop(cond, branch(cursor)));
        }
        if (cursor.consumeKeyword("for")) {
            return List.of(forLoop(cursor));
        }
        if (cursor.consumeKeyword("return")) {
            String rest = readStatementEnd(cursor).trim();
            return List.of(Stmt.ret(rest.isEmpty() ? null : ExprParser.parseExpr(rest)));
        }
        if (cursor.consumeKeyword("throw")) {
            String rest = readStatementEnd(cursor).trim();
            if (rest.isEmpty()) {
                throw new ScriptParseException("throw requires an operand");
            }
            return List.of(Stmt.throwValue(ExprParser.parseExpr(rest)));
        }
        boolean async = false;
        if (cursor.consumeKeyword("async")) {
            cursor.skipWs();
            async = true;
        }
        if (cursor.consumeKeyword("function")) {
            return List.of(functionDeclaration(cursor, async));
        }
        if (async) {
            cursor.setPos(start);
        }
        for (String kind : new String[]{"let", "const", "var"}) {
            if (cursor.consumeKeyword(kind)) {
                return declarations(kind, readStatementEnd(cursor));
            }
        }
        String text = readStatementEnd(cursor).trim();
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(parseSimpleStatement(text));
    }

    private static Expr condition(Cursor cursor, String keyword) {
        cursor.skipWs();
        if (cursor.peek() != '(') {
            throw new ScriptParseException("expected '(' after " + keyword, cursor.getSource());
        }
        return ExprParser.parseExpr(cursor.readBalancedBlock('(', ')'));
    }

    private static List<Stmt> branch(Cursor cursor) {
        cursor.skipWs();
        if (cursor.eof()) {
            throw new ScriptParseException("missing statement body", cursor.getSource());
        }
        if (cursor.peek() == '{') {
            return parseStatements(cursor.readBalancedBlock('{', '}'));
        }
        return parseStatement(cursor);
    }

    private static Stmt forLoop(Cursor cursor) {
        cursor.skipWs();
        if (cursor.peek() != '(') {
            throw new ScriptParseException("expected '(' after for", cursor.getSource());
        }
        String head = cursor.readBalancedBlock('(', ')');
        List<Stmt> body = branch(cursor);
        List<String> clauses = TopLevel.splitByChar(head, ';');
        if (clauses.size() == 3) {
            // classic for loop runs as a block holding the init and a while loop
            List<Stmt> loopBody = new ArrayList<>(body);
            String update = clauses.get(2).trim();
            if (!update.isEmpty()) {
                loopBody.add(parseSimpleStatement(update));
            }
            String condText = clauses.get(1).trim();
            Expr cond = condText.isEmpty() ? Expr.TRUE : ExprParser.parseExpr(condText);
            List<Stmt> block = new ArrayList<>(parseStatements(clauses.get(0)));
            block.add(Stmt.whileLoop(cond, loopBody));
            return Stmt.block(block);
        }
        Cursor headCursor = new Cursor(head.trim());
        String kind = null;
        for (String k : new String[]{"const", "let", "var"}) {
            if (headCursor.consumeKeyword(k)) {
                kind = k;
                break;
            }
        }
        headCursor.skipWs();
        String name = headCursor.parseIdentifier();
        headCursor.skipWs();
        if (name == null || !headCursor.consumeKeyword("of")) {
            throw new ScriptParseException("unsupported for statement", head);
        }
        Expr iterable = ExprParser.parseExpr(headCursor.rest());
        return Stmt.forOf(kind == null ? "var" : kind, name, iterable, body);
    }

    private static Stmt functionDeclaration(Cursor cursor, boolean async) {
        cursor.skipWs();
        boolean generator = cursor.consume('*');
        cursor.skipWs();
        String name = cursor.parseIdentifier();
        if (name == null) {
            throw new ScriptParseException("function declaration requires a name", cursor.getSource());
        }
        cursor.skipWs();
        String params = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        String body = cursor.readBalancedBlock('{', '}');
        ScriptHandler handler = new ScriptHandler(FunctionShapes.parseParams(params), parseStatements(body), generator);
        return Stmt.functionDecl(name, Expr.function(name, handler, async, false));
    }

    private static List<Stmt> declarations(String kind, String text) {
        List<Stmt> stmts = new ArrayList<>();
        for (String part : TopLevel.splitByChar(text, ',')) {
            String decl = part.trim();
            int[] eq = TopLevel.findAssignment(decl);
            String name;
            Expr init = null;
            if (eq != null) {
                if (eq[1] != 1) {
                    throw new ScriptParseException("invalid declaration", decl);
                }
                name = decl.substring(0, eq[0]).trim();
                init = ExprParser.parseExpr(decl.substring(eq[0] + 1));
            } else {
                name = decl;
            }
            if (!Idents.isIdent(name) || Idents.isReserved(name)) {
                throw new ScriptParseException("unsupported declaration target", name);
            }
            if (init == null && kind.equals("const")) {
                throw new ScriptParseException("missing initializer in const declaration", name);
            }
            stmts.add(Stmt.declare(kind, name, init));
        }
        return stmts;
    }

    private static boolean isAssignable(Expr expr) {
        switch (expr.type) {
            case VAR:
            case MEMBER_GET:
            case INDEX_GET:
            case EVENT_PROP:
                return true;
            default:
                return false;
        }
    }

    /**
     * Classifies one statement that is not a keyword form: update, assignment or plain expression.
     */
    public static Stmt parseSimpleStatement(String src) {
        String text = src.trim();
        if (text.startsWith("++") || text.startsWith("--")) {
            Expr target = ExprParser.parseExpr(text.substring(2));
            if (isAssignable(target)) {
                return Stmt.update(target, text.substring(0, 2), true);
            }
        }
        if (text.endsWith("++") || text.endsWith("--")) {
            String head = text.substring(0, text.length() - 2).trim();
            if (!head.isEmpty()) {
                Expr target = ExprParser.parseExpr(head);
                if (isAssignable(target)) {
                    return Stmt.update(target, text.substring(text.length() - 2), false);
                }
            }
        }
        int[] eq = TopLevel.findAssignment(text);
        if (eq != null) {
            String left = text.substring(0, eq[0]).trim();
            Expr target = left.isEmpty() ? null : parseTargetOrNull(left);
            if (target != null && isAssignable(target)) {
                String op = text.substring(eq[0], eq[0] + eq[1]);
                String right = text.substring(eq[0] + eq[1]);
                if (right.trim().isEmpty()) {
                    throw new ScriptParseException("assignment requires a value", text);
                }
                return Stmt.assign(target, op, ExprParser.parseExpr(right));
            }
        }
        return Stmt.expr(ExprParser.parseExpr(text));
    }

    private static Expr parseTargetOrNull(String left) {
        try {
            return ExprParser.parseExpr(left);
        } catch (ScriptParseException e) {
            logger.trace("not an assignment target: {}", left);
            return null;
        }
    }

    private static final String CONTINUES_BEFORE = "+-*/%=&|^!<>?:,.([{";
    private static final String CONTINUES_AFTER = ".?:+-*/%&|^=,)]}<>";

    /**
     * Reads up to the end of the current statement and consumes a terminating semicolon.
     */
    static String readStatementEnd(Cursor cursor) {
        String src = cursor.getSource();
        int start = cursor.getPos();
        JsLexScanner scanner = new JsLexScanner();
        int i = start;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (scanner.isTopLevel()) {
                if (c == ';') {
                    cursor.setPos(i + 1);
                    return src.substring(start, i);
                }
                if (c == '}') {
                    // stray closing brace ends the statement, the caller reports it
                    cursor.setPos(i);
                    return src.substring(start, i);
                }
                if (c == '\n' && endsAtLineBreak(src, start, i)) {
                    cursor.setPos(i + 1);
                    return src.substring(start, i);
                }
            }
            i = scanner.advance(src, i);
        }
        cursor.setPos(src.length());
        return src.substring(start);
    }

    private static boolean endsAtLineBreak(String src, int start, int newline) {
        String before = src.substring(start, newline).trim();
        if (before.isEmpty()) {
            return false;
        }
        char last = before.charAt(before.length() - 1);
        boolean postfixUpdate = before.endsWith("++") || before.endsWith("--");
        if (!postfixUpdate && CONTINUES_BEFORE.indexOf(last) != -1) {
            return false;
        }
        int j = newline + 1;
        while (j < src.length() && Character.isWhitespace(src.charAt(j))) {
            j++;
        }
        if (j >= src.length()) {
            return true;
        }
        char next = src.charAt(j);
        if (src.startsWith("++", j) || src.startsWith("--", j)) {
            return true;
        }
        return CONTINUES_AFTER.indexOf(next) == -1;
    }

}
