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

import io.browserharness.parser.BinaryOp;
import io.browserharness.parser.Expr;
import io.browserharness.parser.ExprType;
import io.browserharness.parser.FunctionParam;
import io.browserharness.parser.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs statement lists and invokes closures.
 */
class Executor {

    static final Logger logger = LoggerFactory.getLogger(Executor.class);

    private Executor() {
        // only static methods
    }

    static void run(Interpreter interpreter, List<Stmt> stmts, Frame frame) {
        for (Stmt stmt : stmts) {
            exec(interpreter, stmt, frame);
            if (frame.returned) {
                return;
            }
        }
    }

    /**
     * @return the value of an expression statement, else {@link Terms#UNDEFINED}
     */
    static Object exec(Interpreter interpreter, Stmt stmt, Frame frame) {
        switch (stmt.type) {
            case EXPR:
                return interpreter.eval(stmt.expr, frame);
            case DECLARE: {
                Object value = stmt.expr == null ? Terms.UNDEFINED : interpreter.eval(stmt.expr, frame);
                if (value instanceof JsFunction && stmt.expr.type == ExprType.FUNCTION) {
                    value = named((JsFunction) value, stmt.name);
                }
                frame.declare(stmt.name, value, "const".equals(stmt.kind));
                interpreter.bindTimerId(stmt.name, stmt.expr, value);
                return Terms.UNDEFINED;
            }
            case ASSIGN:
                assign(interpreter, stmt, frame);
                return Terms.UNDEFINED;
            case UPDATE:
                update(interpreter, stmt, frame);
                return Terms.UNDEFINED;
            case RETURN:
                frame.returnValue = stmt.expr == null ? Terms.UNDEFINED : interpreter.eval(stmt.expr, frame);
                frame.returned = true;
                return Terms.UNDEFINED;
            case IF:
                if (Terms.isTruthy(interpreter.eval(stmt.expr, frame))) {
                    run(interpreter, stmt.body, frame);
                } else if (stmt.elseBody != null) {
                    run(interpreter, stmt.elseBody, frame);
                }
                return Terms.UNDEFINED;
            case WHILE:
                while (!frame.returned && Terms.isTruthy(interpreter.eval(stmt.expr, frame))) {
                    run(interpreter, stmt.body, frame);
                }
                return Terms.UNDEFINED;
            case FOR_OF: {
                Object iterable = interpreter.eval(stmt.expr, frame);
                if (Terms.isNullish(iterable)) {
                    throw new ScriptRuntimeException(Terms.toStr(iterable) + " is not iterable");
                }
                for (Object item : Terms.arrayLikeValues(iterable)) {
                    frame.declare(stmt.name, item, false);
                    run(interpreter, stmt.body, frame);
                    if (frame.returned) {
                        break;
                    }
                }
                return Terms.UNDEFINED;
            }
            case BLOCK:
                run(interpreter, stmt.body, frame);
                return Terms.UNDEFINED;
            case FUNCTION_DECL:
                frame.declare(stmt.name, interpreter.eval(stmt.expr, frame), false);
                return Terms.UNDEFINED;
            case THROW:
                throw new ScriptThrownException(interpreter.eval(stmt.expr, frame));
            default:
                throw new ScriptRuntimeException("unsupported statement: " + stmt.type);
        }
    }

    static JsFunction named(JsFunction fn, String name) {
        if (!fn.name.isEmpty()) {
            return fn;
        }
        return new JsFunction(name, fn.handler, fn.captured, fn.origin, fn.globalNames, fn.globalScope,
                fn.async, fn.arrow, fn.eventParam, fn.event);
    }

    //==================================================================================================================
    // assignment

    private static void assign(Interpreter interpreter, Stmt stmt, Frame frame) {
        Expr target = stmt.target;
        String op = stmt.op;
        switch (target.type) {
            case VAR: {
                String name = target.name;
                Object value;
                if ("=".equals(op)) {
                    value = interpreter.eval(stmt.expr, frame);
                } else {
                    Object current = interpreter.lookup(name, frame);
                    if (shortCircuits(op, current)) {
                        return;
                    }
                    value = compound(interpreter, op, current, interpreter.eval(stmt.expr, frame));
                }
                frame.assign(name, value);
                if ("=".equals(op)) {
                    interpreter.bindTimerId(name, stmt.expr, value);
                }
                return;
            }
            case MEMBER_GET:
            case INDEX_GET:
            case EVENT_PROP: {
                Object object = interpreter.eval(target.target, frame);
                Object key;
                if (target.type == ExprType.INDEX_GET) {
                    key = interpreter.eval(target.arg(0), frame);
                } else if (target.type == ExprType.EVENT_PROP && target.name.indexOf('.') > 0) {
                    int dot = target.name.lastIndexOf('.');
                    object = Members.getMember(interpreter, object, target.name.substring(0, dot));
                    key = target.name.substring(dot + 1);
                } else {
                    key = target.name;
                }
                Object value;
                if ("=".equals(op)) {
                    value = interpreter.eval(stmt.expr, frame);
                } else {
                    Object current = Members.getIndex(interpreter, object, key);
                    if (shortCircuits(op, current)) {
                        return;
                    }
                    value = compound(interpreter, op, current, interpreter.eval(stmt.expr, frame));
                }
                Members.setIndex(interpreter, object, key, value);
                return;
            }
            default:
                throw new ScriptRuntimeException("invalid assignment target: " + target);
        }
    }

    private static boolean shortCircuits(String op, Object current) {
        switch (op) {
            case "&&=":
                return !Terms.isTruthy(current);
            case "||=":
                return Terms.isTruthy(current);
            case "??=":
                return !Terms.isNullish(current);
            default:
                return false;
        }
    }

    private static Object compound(Interpreter interpreter, String op, Object current, Object value) {
        switch (op) {
            case "+=":
                return Operators.add(interpreter, current, value);
            case "&&=":
            case "||=":
            case "??=":
                return value;
            default:
                String binary = op.substring(0, op.length() - 1);
                return Operators.binary(interpreter, BinaryOp.fromText(binary), current, value);
        }
    }

    private static void update(Interpreter interpreter, Stmt stmt, Frame frame) {
        Expr target = stmt.target;
        boolean increment = "++".equals(stmt.op);
        if (target.type == ExprType.VAR) {
            Object current = interpreter.lookup(target.name, frame);
            frame.assign(target.name, step(current, increment));
            return;
        }
        if (target.type == ExprType.MEMBER_GET || target.type == ExprType.INDEX_GET) {
            Object object = interpreter.eval(target.target, frame);
            Object key = target.type == ExprType.INDEX_GET ? interpreter.eval(target.arg(0), frame) : target.name;
            Object current = Members.getIndex(interpreter, object, key);
            Members.setIndex(interpreter, object, key, step(current, increment));
            return;
        }
        throw new ScriptRuntimeException("invalid update target: " + target);
    }

    private static Object step(Object current, boolean increment) {
        if (current instanceof BigInteger) {
            return increment ? ((BigInteger) current).add(BigInteger.ONE) : ((BigInteger) current).subtract(BigInteger.ONE);
        }
        if (current instanceof Long) {
            long l = (Long) current;
            if (increment && l < Long.MAX_VALUE || !increment && l > Long.MIN_VALUE) {
                return increment ? l + 1 : l - 1;
            }
        }
        double d = Terms.toNumber(current);
        return Terms.narrow(increment ? d + 1 : d - 1);
    }

    //==================================================================================================================
    // closures

    static JsFunction createFunction(Interpreter interpreter, Expr expr, Frame frame) {
        Map<String, Object> globals = interpreter.globals;
        boolean globalScope = frame.env == globals;
        Set<String> globalNames = new HashSet<>();
        Map<String, Object> captured;
        if (globalScope) {
            captured = globals;
        } else {
            captured = new HashMap<>(frame.env);
            for (Map.Entry<String, Object> entry : frame.env.entrySet()) {
                String name = entry.getKey();
                if (!frame.locals.contains(name) && globals.containsKey(name) && globals.get(name) == entry.getValue()) {
                    globalNames.add(name);
                }
            }
        }
        return new JsFunction(expr.name, expr.handler, captured, frame.env, globalNames, globalScope,
                expr.async, expr.arrow, frame.eventParam, frame.event);
    }

    static Object callFunction(Interpreter interpreter, JsFunction fn, Object thisObject, List<Object> args) {
        if (!fn.async || fn.handler.generator) {
            return invoke(interpreter, fn, thisObject, args);
        }
        JsPromise promise = new JsPromise();
        try {
            Promises.resolve(interpreter, promise, invoke(interpreter, fn, thisObject, args));
        } catch (ScriptRuntimeException e) {
            Promises.reject(interpreter, promise, Interpreter.thrownValue(e));
        }
        return promise;
    }

    private static Object invoke(Interpreter interpreter, JsFunction fn, Object thisObject, List<Object> args) {
        Map<String, Object> globals = interpreter.globals;
        Map<String, Object> env = new HashMap<>(fn.captured);
        if (!fn.globalScope) {
            for (String name : fn.globalNames) {
                if (globals.containsKey(name)) {
                    env.put(name, globals.get(name));
                }
            }
            for (Map.Entry<String, Object> entry : globals.entrySet()) {
                env.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        Map<String, Object> initial = new HashMap<>(env);
        Frame frame = new Frame(env, fn.eventParam, fn.event);
        if (!fn.arrow) {
            frame.declare("this", thisObject, false);
            frame.declare("arguments", new JsArray(new ArrayList<>(args)), false);
        }
        List<FunctionParam> params = fn.handler.params;
        for (int i = 0; i < params.size(); i++) {
            FunctionParam param = params.get(i);
            Object value;
            if (param.rest) {
                value = new JsArray(i < args.size() ? new ArrayList<>(args.subList(i, args.size())) : new ArrayList<>());
            } else {
                value = i < args.size() ? args.get(i) : Terms.UNDEFINED;
                if (value == Terms.UNDEFINED && param.defaultValue != null) {
                    value = interpreter.eval(param.defaultValue, frame);
                }
            }
            frame.declare(param.name, value, false);
        }
        // a named function expression sees itself under its own name
        if (!fn.arrow && !fn.name.isEmpty() && !env.containsKey(fn.name)) {
            frame.declare(fn.name, fn, false);
        }
        if (logger.isTraceEnabled()) {
            logger.trace("call {}({})", fn.name, args);
        }
        List<Object> yields = null;
        if (fn.handler.generator) {
            yields = new ArrayList<>();
            interpreter.yieldBuffers.push(yields);
        }
        try {
            run(interpreter, fn.handler.stmts, frame);
        } catch (Interpreter.YieldLimitException e) {
            if (yields == null) {
                throw e;
            }
            logger.warn("generator {} stopped: {}", fn.name, e.getMessage());
        } finally {
            if (yields != null) {
                interpreter.yieldBuffers.pop();
            }
            writeBack(interpreter, fn, frame, initial);
        }
        if (yields != null) {
            return new JsGenerator(yields, frame.returnValue);
        }
        return frame.returnValue;
    }

    /**
     * Publishes the non-local names a call changed: to the globals when they are global, and to the
     * closure snapshot and the creating environment otherwise.
     */
    private static void writeBack(Interpreter interpreter, JsFunction fn, Frame frame, Map<String, Object> initial) {
        Map<String, Object> globals = interpreter.globals;
        for (Map.Entry<String, Object> entry : frame.env.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            if (frame.locals.contains(name) || initial.containsKey(name) && initial.get(name) == value) {
                continue;
            }
            if (fn.globalScope) {
                globals.put(name, value);
                continue;
            }
            boolean known = fn.captured.containsKey(name);
            if (fn.globalNames.contains(name) || !known) {
                globals.put(name, value);
            }
            if (known) {
                fn.captured.put(name, value);
                if (fn.origin.containsKey(name)) {
                    fn.origin.put(name, value);
                }
            }
        }
    }

}
