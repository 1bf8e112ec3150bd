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

import java.util.Collections;
import java.util.List;

public class Stmt {

    public final StmtType type;
    public final String name; // declared or iterated variable, function name
    public final String kind; // let, const or var
    public final String op; // assignment or update operator
    public final Expr target; // assignment and update target
    public final Expr expr;
    public final List<Stmt> body;
    public final List<Stmt> elseBody; // null when there is no else branch
    public final boolean prefix;

    private Stmt(StmtType type, String name, String kind, String op, Expr target, Expr expr,
                 List<Stmt> body, List<Stmt> elseBody, boolean prefix) {
        this.type = type;
        this.name = name;
        this.kind = kind;
        this.op = op;
        this.target = target;
        this.expr = expr;
        this.body = body == null ? Collections.emptyList() : List.copyOf(body);
        this.elseBody = elseBody == null ? null : List.copyOf(elseBody);
        this.prefix = prefix;
    }

    public static Stmt expr(Expr expr) {
        return new Stmt(StmtType.EXPR, null, null, null, null, expr, null, null, false);
    }

    public static Stmt declare(String kind, String name, Expr init) {
        return new Stmt(StmtType.DECLARE, name, kind, null, null, init, null, null, false);
    }

    public static Stmt assign(Expr target, String op, Expr value) {
        return new Stmt(StmtType.ASSIGN, null, null, op, target, value, null, null, false);
    }

    public static Stmt update(Expr target, String op, boolean prefix) {
        return new Stmt(StmtType.UPDATE, null, null, op, target, null, null, null, prefix);
    }

    public static Stmt ret(Expr value) {
        return new Stmt(StmtType.RETURN, null, null, null, null, value, null, null, false);
    }

    public static Stmt ifElse(Expr cond, List<Stmt> then, List<Stmt> otherwise) {
        return new Stmt(StmtType.IF, null, null, null, null, cond, then, otherwise, false);
    }

    public static Stmt whileLoop(Expr cond, List<Stmt> body) {
        return new Stmt(StmtType.WHILE, null, null, null, null, cond, body, null, false);
    }

    public static Stmt forOf(String kind, String name, Expr iterable, List<Stmt> body) {
        return new Stmt(StmtType.FOR_OF, name, kind, null, null, iterable, body, null, false);
    }

    public static Stmt block(List<Stmt> body) {
        return new Stmt(StmtType.BLOCK, null, null, null, null, null, body, null, false);
    }

    public static Stmt functionDecl(String name, Expr function) {
        return new Stmt(StmtType.FUNCTION_DECL, name, null, null, null, function, null, null, false);
    }

    public static Stmt throwValue(Expr value) {
        return new Stmt(StmtType.THROW, null, null, null, null, value, null, null, false);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (kind != null) {
            sb.append(' ').append(kind);
        }
        if (name != null) {
            sb.append(' ').append(name);
        }
        if (target != null) {
            sb.append(' ').append(target);
        }
        if (op != null) {
            sb.append(' ').append(op);
        }
        if (expr != null) {
            sb.append(' ').append(expr);
        }
        if (!body.isEmpty()) {
            sb.append(' ').append(body);
        }
        if (elseBody != null) {
            sb.append(" else ").append(elseBody);
        }
        return sb.toString();
    }

}
