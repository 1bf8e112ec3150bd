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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arrow functions and {@code function} expressions.
 */
public class FunctionShapes {

    private FunctionShapes() {
        // only static methods
    }

    static Expr recognize(String s) {
        char first = s.charAt(0);
        if (first != '(' && !Idents.isIdentStart(first)) {
            return null;
        }
        String src = s;
        boolean async = false;
        if (src.startsWith("async") && src.length() > 5 && Character.isWhitespace(src.charAt(5))) {
            src = src.substring(5).trim();
            async = true;
        }
        if (src.indexOf("//") != -1 || src.indexOf("/*") != -1) {
            src = TopLevel.stripJsComments(src).trim();
        }
        Cursor cursor = new Cursor(src);
        if (cursor.consumeKeyword("function")) {
            return functionExpression(cursor, async);
        }
        Expr arrow = arrow(cursor, async);
        if (arrow == null && async) {
            return null;
        }
        return arrow;
    }

    private static Expr functionExpression(Cursor cursor, boolean async) {
        cursor.skipWs();
        boolean generator = cursor.consume('*');
        cursor.skipWs();
        String name = cursor.parseIdentifier();
        cursor.skipWs();
        if (cursor.peek() != '(') {
            throw new ScriptParseException("expected '(' after function", cursor.getSource());
        }
        String params = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        if (cursor.peek() != '{') {
            throw new ScriptParseException("expected '{' for function body", cursor.getSource());
        }
        String body = cursor.readBalancedBlock('{', '}');
        cursor.skipWs();
        if (!cursor.eof()) {
            return null; // e.g. an immediately invoked function, left to the postfix chain
        }
        ScriptHandler handler = new ScriptHandler(parseParams(params), StatementParser.parseStatements(body), generator);
        return Expr.function(name, handler, async, false);
    }

    private static Expr arrow(Cursor cursor, boolean async) {
        String params;
        if (cursor.peek() == '(') {
            params = cursor.readBalancedBlock('(', ')');
        } else {
            params = cursor.parseIdentifier();
            if (params == null || Idents.isReserved(params)) {
                return null;
            }
        }
        cursor.skipWs();
        if (!cursor.consumeAscii("=>")) {
            return null;
        }
        String body = cursor.rest().trim();
        if (body.isEmpty()) {
            throw new ScriptParseException("arrow function requires a body", cursor.getSource());
        }
        List<FunctionParam> parsedParams = parseParams(params);
        List<Stmt> stmts;
        if (body.charAt(0) == '{') {
            Cursor bodyCursor = new Cursor(body);
            String block = bodyCursor.readBalancedBlock('{', '}');
            bodyCursor.skipWs();
            if (!bodyCursor.eof()) {
                return null;
            }
            stmts = StatementParser.parseStatements(block);
        } else {
            stmts = expressionBody(body);
        }
        return Expr.function(null, new ScriptHandler(parsedParams, stmts), async, true);
    }

    /**
     * A concise arrow body returns its value, except for assignment and update forms which run as statements.
     */
    static List<Stmt> expressionBody(String body) {
        Stmt stmt = StatementParser.parseSimpleStatement(body);
        if (stmt.type == StmtType.EXPR) {
            return List.of(Stmt.ret(stmt.expr));
        }
        return List.of(stmt);
    }

    static List<FunctionParam> parseParams(String src) {
        if (src.trim().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> parts = TopLevel.splitByChar(src, ',');
        int count = parts.size();
        if (count > 1 && parts.get(count - 1).trim().isEmpty()) {
            count--;
        }
        List<FunctionParam> params = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String part = parts.get(i).trim();
            boolean rest = false;
            if (part.startsWith("...")) {
                rest = true;
                part = part.substring(3).trim();
                if (i != count - 1) {
                    throw new ScriptParseException("rest parameter must be last", src);
                }
            }
            String name = part;
            Expr defaultValue = null;
            int[] eq = TopLevel.findAssignment(part);
            if (eq != null && eq[1] == 1) {
                name = part.substring(0, eq[0]).trim();
                defaultValue = ExprParser.parseExpr(part.substring(eq[0] + 1));
            }
            if (!Idents.isIdent(name) || Idents.isReserved(name)) {
                throw new ScriptParseException("unsupported parameter", part);
            }
            params.add(new FunctionParam(name, defaultValue, rest));
        }
        return params;
    }

}
