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

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * Immutable expression tree node. Which fields are populated depends on {@link #type}:
 * <ul>
 * <li>{@code name} holds variable, member, method or builtin-kind names, and the pattern of a regex literal</li>
 * <li>{@code target} is the receiver of member access and calls, or the callee of {@code CALL}</li>
 * <li>{@code args} holds operands and call arguments in source order</li>
 * </ul>
 */
public class Expr {

    public final ExprType type;
    public final BinaryOp op;
    public final String name;
    public final String flags;
    public final Object value;
    public final Expr target;
    public final List<Expr> args;
    public final List<ObjectEntry> entries;
    public final ScriptHandler handler;
    public final boolean optional;
    public final boolean async;
    public final boolean arrow;

    private Expr(ExprType type, BinaryOp op, String name, String flags, Object value, Expr target,
                 List<Expr> args, List<ObjectEntry> entries, ScriptHandler handler,
                 boolean optional, boolean async, boolean arrow) {
        this.type = type;
        this.op = op;
        this.name = name;
        this.flags = flags;
        this.value = value;
        this.target = target;
        this.args = args == null ? Collections.emptyList() : List.copyOf(args);
        this.entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
        this.handler = handler;
        this.optional = optional;
        this.async = async;
        this.arrow = arrow;
    }

    private Expr(ExprType type, String name, Expr target, List<Expr> args) {
        this(type, null, name, null, null, target, args, null, null, false, false, false);
    }

    public static final Expr NULL = new Expr(ExprType.NULL, null, null, null);
    public static final Expr UNDEFINED = new Expr(ExprType.UNDEFINED, null, null, null);
    public static final Expr TRUE = bool(true);
    public static final Expr FALSE = bool(false);

    //==================================================================================================================
    // literals

    public static Expr string(String value) {
        return new Expr(ExprType.STRING, null, null, null, value, null, null, null, null, false, false, false);
    }

    public static Expr number(long value) {
        return new Expr(ExprType.NUMBER, null, null, null, value, null, null, null, null, false, false, false);
    }

    public static Expr floating(double value) {
        return new Expr(ExprType.FLOAT, null, null, null, value, null, null, null, null, false, false, false);
    }

    public static Expr bigint(BigInteger value) {
        return new Expr(ExprType.BIGINT, null, null, null, value, null, null, null, null, false, false, false);
    }

    private static Expr bool(boolean value) {
        return new Expr(ExprType.BOOL, null, null, null, value, null, null, null, null, false, false, false);
    }

    public static Expr regex(String pattern, String flags) {
        return new Expr(ExprType.REGEX_LITERAL, null, pattern, flags, null, null, null, null, null, false, false, false);
    }

    public static Expr array(List<Expr> items) {
        return new Expr(ExprType.ARRAY_LITERAL, null, null, items);
    }

    public static Expr object(List<ObjectEntry> entries) {
        return new Expr(ExprType.OBJECT_LITERAL, null, null, null, null, null, null, entries, null, false, false, false);
    }

    public static Expr function(String name, ScriptHandler handler, boolean async, boolean arrow) {
        return new Expr(ExprType.FUNCTION, null, name, null, null, null, null, null, handler, false, async, arrow);
    }

    //==================================================================================================================
    // operators

    public static Expr binary(Expr left, BinaryOp op, Expr right) {
        return new Expr(ExprType.BINARY, op, null, null, null, null, List.of(left, right), null, null, false, false, false);
    }

    public static Expr add(List<Expr> parts) {
        return new Expr(ExprType.ADD, null, null, parts);
    }

    /**
     * Appends to an existing {@code ADD} chain so that repeated {@code +} forms one n-ary node.
     */
    public static Expr appendConcat(Expr lhs, Expr rhs) {
        if (lhs.type == ExprType.ADD) {
            List<Expr> parts = new java.util.ArrayList<>(lhs.args);
            parts.add(rhs);
            return add(parts);
        }
        return add(List.of(lhs, rhs));
    }

    public static Expr ternary(Expr cond, Expr onTrue, Expr onFalse) {
        return new Expr(ExprType.TERNARY, null, null, List.of(cond, onTrue, onFalse));
    }

    public static Expr comma(List<Expr> items) {
        return new Expr(ExprType.COMMA, null, null, items);
    }

    public static Expr unary(ExprType type, Expr operand) {
        return new Expr(type, null, null, List.of(operand));
    }

    //==================================================================================================================
    // references and calls

    public static Expr var(String name) {
        return new Expr(ExprType.VAR, name, null, null);
    }

    public static Expr memberGet(Expr target, String member, boolean optional) {
        return new Expr(ExprType.MEMBER_GET, null, member, null, null, target, null, null, null, optional, false, false);
    }

    public static Expr indexGet(Expr target, Expr index, boolean optional) {
        return new Expr(ExprType.INDEX_GET, null, null, null, null, target, List.of(index), null, null, optional, false, false);
    }

    public static Expr memberCall(Expr target, String member, List<Expr> args, boolean optional) {
        return new Expr(ExprType.MEMBER_CALL, null, member, null, null, target, args, null, null, optional, false, false);
    }

    public static Expr functionCall(String name, List<Expr> args) {
        return new Expr(ExprType.FUNCTION_CALL, name, null, args);
    }

    public static Expr call(Expr callee, List<Expr> args, boolean optional) {
        return new Expr(ExprType.CALL, null, null, null, null, callee, args, null, null, optional, false, false);
    }

    /**
     * Builtin shape with a kind name and already-parsed arguments, e.g. {@code MATH_CALL "max" [a, b]}.
     */
    public static Expr builtin(ExprType type, String name, List<Expr> args) {
        return new Expr(type, name, null, args);
    }

    public static Expr builtin(ExprType type, List<Expr> args) {
        return new Expr(type, null, null, args);
    }

    public static Expr builtin(ExprType type, Expr target, String name, List<Expr> args) {
        return new Expr(type, name, target, args);
    }

    //==================================================================================================================

    public Expr arg(int index) {
        return args.get(index);
    }

    public Expr left() {
        return args.get(0);
    }

    public Expr right() {
        return args.get(1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type);
        if (op != null) {
            sb.append('[').append(op.text).append(']');
        }
        if (name != null) {
            sb.append(':').append(name);
        }
        if (flags != null && !flags.isEmpty()) {
            sb.append('/').append(flags);
        }
        if (value != null) {
            sb.append('(').append(value).append(')');
        }
        if (target != null) {
            sb.append('{').append(target).append('}');
        }
        if (!args.isEmpty()) {
            sb.append(args);
        }
        if (!entries.isEmpty()) {
            sb.append(entries);
        }
        if (handler != null) {
            sb.append(handler);
        }
        return sb.toString();
    }

}
