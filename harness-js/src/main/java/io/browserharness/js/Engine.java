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

import io.browserharness.parser.Expr;
import io.browserharness.parser.ExprParser;
import io.browserharness.parser.StatementParser;
import io.browserharness.parser.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Entry point for hosts: evaluates expressions and scripts against one set of global bindings and
 * drives the virtual clock.
 */
public class Engine {

    static final Logger logger = LoggerFactory.getLogger(Engine.class);

    public static boolean DEBUG = false;

    private final Map<String, Object> bindings;
    private final Interpreter interpreter;

    private String eventParam;
    private EventState event;

    public Engine() {
        this(new HashMap<>());
    }

    /**
     * Creates an Engine backed by the given map. Script declarations and assignments at the top level
     * land in it, and host writes are visible to script.
     *
     * @param bindings the external map to use for global bindings
     */
    public Engine(Map<String, Object> bindings) {
        this.bindings = bindings;
        this.interpreter = new Interpreter(bindings);
    }

    /**
     * Evaluates a single expression.
     */
    public Object eval(String expression) {
        Expr expr = ExprParser.parseExpr(expression);
        if (DEBUG) {
            logger.debug("eval: {} -> {}", expression, expr);
        }
        return interpreter.eval(expr, globalFrame());
    }

    /**
     * Runs a statement list. The result is the value of the last expression statement, or the value of
     * a top-level {@code return}.
     */
    public Object run(String script) {
        List<Stmt> stmts = StatementParser.parseStatements(script);
        if (DEBUG) {
            logger.debug("run: {} statement(s)", stmts.size());
        }
        Frame frame = globalFrame();
        Object result = Terms.UNDEFINED;
        for (Stmt stmt : stmts) {
            result = Executor.exec(interpreter, stmt, frame);
            if (frame.returned) {
                return frame.returnValue;
            }
        }
        return result;
    }

    private Frame globalFrame() {
        return new Frame(bindings, eventParam, event, interpreter.globalConstants);
    }

    public Object get(String name) {
        Object value = bindings.get(name);
        return value == null && !bindings.containsKey(name) ? Terms.UNDEFINED : value;
    }

    public void put(String name, Object value) {
        bindings.put(name, Terms.fromJava(value));
    }

    public void remove(String name) {
        bindings.remove(name);
        interpreter.globalConstants.remove(name);
    }

    public Map<String, Object> getBindings() {
        return bindings;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    //==================================================================================================================
    // clock

    public Scheduler getScheduler() {
        return interpreter.scheduler;
    }

    public int advanceTime(long ms) {
        return interpreter.scheduler.advanceTime(ms);
    }

    public int runDueTimers() {
        return interpreter.scheduler.runDueTimers();
    }

    public int flush() {
        return interpreter.scheduler.flush();
    }

    public int runMicrotasks() {
        return interpreter.scheduler.runMicrotasks();
    }

    public long getNowMs() {
        return interpreter.scheduler.getNowMs();
    }

    public void setStartTime(long nowMs) {
        interpreter.scheduler.setNowMs(nowMs);
    }

    public void setTimerStepLimit(int stepLimit) {
        interpreter.scheduler.setStepLimit(stepLimit);
    }

    //==================================================================================================================
    // host collaborators

    public void setDom(DomHost dom) {
        interpreter.dom = dom;
    }

    public DomHost getDom() {
        return interpreter.dom;
    }

    /**
     * Binds the event a handler body sees through its parameter name, or clears it when the event is
     * null.
     */
    public void setEvent(String param, EventState event) {
        this.eventParam = event == null ? null : param;
        this.event = event;
    }

    public void setOnConsoleLog(Consumer<String> onConsoleLog) {
        interpreter.onConsoleLog = onConsoleLog;
    }

    public void setRandom(Random random) {
        interpreter.random = random;
    }

    public JsStorage getLocalStorage() {
        return interpreter.localStorage;
    }

    public JsStorage getSessionStorage() {
        return interpreter.sessionStorage;
    }

    /**
     * Script values to plain Java: undefined becomes null, arrays become lists and plain objects become
     * ordered maps. Other values are returned as is.
     */
    public static Object toJava(Object value) {
        if (value == Terms.UNDEFINED) {
            return null;
        }
        if (value instanceof JsArray) {
            List<Object> list = new ArrayList<>();
            for (Object item : ((JsArray) value).list) {
                list.add(toJava(item));
            }
            return list;
        }
        if (value != null && value.getClass() == JsObject.class) {
            JsObject object = (JsObject) value;
            Map<String, Object> map = new LinkedHashMap<>();
            for (String name : object.memberNames()) {
                map.put(name, toJava(object.getMember(name)));
            }
            return map;
        }
        return value;
    }

}
