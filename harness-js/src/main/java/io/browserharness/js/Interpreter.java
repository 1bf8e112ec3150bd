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
import io.browserharness.parser.ObjectEntry;
import io.browserharness.parser.StatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Tree-walking evaluator. One instance owns the global bindings and the collaborators that script can
 * reach: the scheduler, the DOM host, the two storages and the symbol registry.
 */
public class Interpreter {

    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    private static final Object SKIPPED = new Object();

    private static final Object NOT_BUILTIN = new Object();

    static final int MAX_BUFFERED_YIELDS = 10_000;

    final Map<String, Object> globals;
    final Set<String> globalConstants = new HashSet<>();
    final Scheduler scheduler = new Scheduler();
    final JsStorage localStorage = new JsStorage();
    final JsStorage sessionStorage = new JsStorage();
    final Map<String, JsSymbol> symbolRegistry = new HashMap<>();
    final Deque<List<Object>> yieldBuffers = new ArrayDeque<>();

    DomHost dom = new MemoryDom();
    Consumer<String> onConsoleLog;
    Random random = new Random(0);

    public Interpreter(Map<String, Object> globals) {
        this.globals = globals;
        scheduler.setRunner(this::runTask);
    }

    public Interpreter() {
        this(new HashMap<>());
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    /**
     * Evaluates one expression against an environment. Containers in the environment may be mutated,
     * and scheduler, DOM and storage registrations may happen on the way.
     */
    public Object eval(Expr expr, Map<String, Object> env, String eventParam, EventState event) {
        Set<String> constants = env == globals ? globalConstants : new HashSet<>();
        return eval(expr, new Frame(env, eventParam, event, constants));
    }

    Object eval(Expr expr, Frame frame) {
        switch (expr.type) {
            case STRING:
            case NUMBER:
            case BIGINT:
            case BOOL:
                return expr.value;
            case FLOAT:
                return Terms.narrow((Double) expr.value);
            case NULL:
                return null;
            case UNDEFINED:
                return Terms.UNDEFINED;
            case REGEX_LITERAL:
                return new JsRegex(expr.name, expr.flags == null ? "" : expr.flags);
            case ARRAY_LITERAL:
                return new JsArray(evalArgs(expr.args, frame));
            case OBJECT_LITERAL:
                return evalObject(expr, frame);
            case FUNCTION:
                return Executor.createFunction(this, expr, frame);
            case BINARY:
                if (expr.op.isShortCircuit()) {
                    return evalShortCircuit(expr, frame);
                }
                Object lhs = eval(expr.left(), frame);
                Object rhs = eval(expr.right(), frame);
                return Operators.binary(this, expr.op, lhs, rhs);
            case ADD: {
                List<Object> values = new ArrayList<>(expr.args.size());
                for (Expr part : expr.args) {
                    values.add(eval(part, frame));
                }
                Object result = values.get(0);
                for (int i = 1; i < values.size(); i++) {
                    result = Operators.add(this, result, values.get(i));
                }
                return result;
            }
            case TERNARY:
                return Terms.isTruthy(eval(expr.arg(0), frame)) ? eval(expr.arg(1), frame) : eval(expr.arg(2), frame);
            case COMMA: {
                Object result = Terms.UNDEFINED;
                for (Expr item : expr.args) {
                    result = eval(item, frame);
                }
                return result;
            }
            case SPREAD:
                throw new ScriptRuntimeException("unexpected spread: " + expr);
            case NEG:
                return Operators.negate(eval(expr.arg(0), frame));
            case POS:
                return Operators.plus(eval(expr.arg(0), frame));
            case NOT:
                return !Terms.isTruthy(eval(expr.arg(0), frame));
            case BIT_NOT:
                return Operators.bitNot(eval(expr.arg(0), frame));
            case VOID:
                eval(expr.arg(0), frame);
                return Terms.UNDEFINED;
            case TYPEOF: {
                Expr operand = expr.arg(0);
                if (operand.type == ExprType.VAR && !isBound(operand.name, frame)) {
                    return "undefined";
                }
                return Terms.typeOf(eval(operand, frame));
            }
            case DELETE:
                return evalDelete(expr.arg(0), frame);
            case AWAIT:
                return await(eval(expr.arg(0), frame));
            case YIELD: {
                Object value = expr.args.isEmpty() ? Terms.UNDEFINED : eval(expr.arg(0), frame);
                yieldValue(value);
                return value;
            }
            case YIELD_STAR: {
                Object value = eval(expr.arg(0), frame);
                if (!Terms.isIterable(value)) {
                    throw new ScriptRuntimeException(Terms.toStr(value) + " is not iterable");
                }
                for (Object item : Terms.arrayLikeValues(value)) {
                    yieldValue(item);
                }
                return Terms.UNDEFINED;
            }
            case VAR:
                return lookup(expr.name, frame);
            case MEMBER_GET:
            case INDEX_GET:
            case MEMBER_CALL:
            case CALL: {
                Object result = evalChainLink(expr, frame);
                return result == SKIPPED ? Terms.UNDEFINED : result;
            }
            case FUNCTION_CALL: {
                Object callee = lookup(expr.name, frame);
                List<Object> args = evalArgs(expr.args, frame);
                return call(callee, Terms.UNDEFINED, args, expr.name);
            }
            case REGEX_NEW:
            case NEW_DATE:
            case NEW_MAP:
            case NEW_SET:
            case NEW_PROMISE:
            case NEW_ARRAY_BUFFER:
            case NEW_TYPED_ARRAY:
            case NEW_BLOB:
            case NEW_URL:
            case NEW_URL_SEARCH_PARAMS:
            case NEW_ERROR:
            case NEW_INTL:
                return Constructors.evaluate(this, expr, evalArgs(expr.args, frame));
            case NEW_CALLEE: {
                Object callee = eval(expr.target, frame);
                return construct(callee, evalArgs(expr.args, frame));
            }
            case REGEX_METHOD: {
                JsRegex regex = (JsRegex) eval(expr.target, frame);
                String input = Terms.toStr(eval(expr.arg(0), frame));
                return "test".equals(expr.name) ? regex.test(input) : regex.exec(input);
            }
            case SET_TIMEOUT:
            case SET_INTERVAL:
            case REQUEST_ANIMATION_FRAME:
                return evalTimer(expr, frame);
            case CLEAR_TIMER: {
                if (!expr.args.isEmpty()) {
                    Object id = eval(expr.arg(0), frame);
                    if (Terms.isNumber(id)) {
                        scheduler.clearTimer((long) Terms.toNumber(id));
                    }
                }
                return Terms.UNDEFINED;
            }
            case QUEUE_MICROTASK: {
                Object callback = eval(expr.arg(0), frame);
                if (!(callback instanceof JsCallable)) {
                    throw new ScriptRuntimeException("queueMicrotask: callback is not a function");
                }
                scheduler.queueMicrotask("queueMicrotask",
                        () -> ((JsCallable) callback).call(this, Terms.UNDEFINED, Collections.emptyList()));
                return Terms.UNDEFINED;
            }
            case DOM_QUERY: {
                String arg = Terms.toStr(eval(expr.arg(0), frame));
                DomNode node = "getElementById".equals(expr.name) ? dom.getElementById(arg) : dom.querySelector(arg);
                return node;
            }
            case DOM_CREATE: {
                String arg = Terms.toStr(eval(expr.arg(0), frame));
                return "createElement".equals(expr.name) ? dom.createElement(arg) : dom.createTextNode(arg);
            }
            case EVENT_PROP:
                return evalEventProp(expr, frame);
            default:
                return Builtins.evaluate(this, expr, evalArgs(expr.args, frame));
        }
    }

    //==================================================================================================================
    // operators

    private Object evalShortCircuit(Expr expr, Frame frame) {
        BinaryOp op = expr.op;
        List<Expr> operands = new ArrayList<>();
        Expr current = expr;
        while (current.type == ExprType.BINARY && current.op == op) {
            operands.add(current.right());
            current = current.left();
        }
        operands.add(current);
        Collections.reverse(operands);
        Object value = null;
        for (int i = 0; i < operands.size(); i++) {
            value = eval(operands.get(i), frame);
            if (i == operands.size() - 1) {
                break;
            }
            boolean decided;
            switch (op) {
                case AND:
                    decided = !Terms.isTruthy(value);
                    break;
                case OR:
                    decided = Terms.isTruthy(value);
                    break;
                default:
                    decided = !Terms.isNullish(value);
            }
            if (decided) {
                break;
            }
        }
        return value;
    }

    private Object evalDelete(Expr operand, Frame frame) {
        switch (operand.type) {
            case MEMBER_GET:
            case INDEX_GET: {
                Object object = evalChainTarget(operand.target, frame);
                if (object == SKIPPED || operand.optional && Terms.isNullish(object)) {
                    return true;
                }
                Object key = operand.type == ExprType.INDEX_GET ? eval(operand.arg(0), frame) : operand.name;
                return Members.delete(object, key);
            }
            case VAR:
                return !isBound(operand.name, frame);
            default:
                eval(operand, frame);
                return true;
        }
    }

    /**
     * Buffers a yielded value for the innermost running generator body. Outside a generator the value
     * is discarded.
     */
    private void yieldValue(Object value) {
        List<Object> buffer = yieldBuffers.peek();
        if (buffer == null) {
            return;
        }
        if (buffer.size() >= MAX_BUFFERED_YIELDS) {
            throw new YieldLimitException();
        }
        buffer.add(value);
    }

    /**
     * Ends a generator body that keeps yielding past {@link #MAX_BUFFERED_YIELDS}. The call treats it
     * as normal completion.
     */
    static final class YieldLimitException extends ScriptRuntimeException {

        YieldLimitException() {
            super("generator yielded more than " + MAX_BUFFERED_YIELDS + " values");
        }

    }

    /**
     * While the promise is pending, microtasks are drained and then the timers already due are run,
     * until it settles or neither makes progress. The clock does not move. A promise that stays
     * pending gives undefined.
     */
    private Object await(Object value) {
        if (!(value instanceof JsPromise)) {
            return value;
        }
        JsPromise promise = (JsPromise) value;
        while (!promise.isSettled()) {
            int progressed = scheduler.runMicrotasks();
            if (!promise.isSettled()) {
                progressed += scheduler.runDueTimers();
            }
            if (progressed == 0) {
                break;
            }
        }
        switch (promise.state) {
            case FULFILLED:
                return promise.value;
            case REJECTED:
                throw new ScriptThrownException(promise.value);
            default:
                logger.debug("await on a pending promise yields undefined");
                return Terms.UNDEFINED;
        }
    }

    //==================================================================================================================
    // literals

    private JsObject evalObject(Expr expr, Frame frame) {
        JsObject object = new JsObject();
        for (ObjectEntry entry : expr.entries) {
            if (entry.spread) {
                Object source = eval(entry.value, frame);
                copyOwnMembers(source, object);
                continue;
            }
            String key = entry.key != null ? entry.key : Terms.toPropertyKey(eval(entry.computedKey, frame));
            Object value = eval(entry.value, frame);
            if (value instanceof JsFunction && entry.value.type == ExprType.FUNCTION) {
                value = Executor.named((JsFunction) value, key);
            }
            object.putMember(key, value);
        }
        return object;
    }

    static void copyOwnMembers(Object source, JsObject target) {
        if (source instanceof JsArray) {
            List<Object> list = ((JsArray) source).list;
            for (int i = 0; i < list.size(); i++) {
                target.putMember(String.valueOf(i), list.get(i));
            }
        } else if (source instanceof String) {
            String s = (String) source;
            for (int i = 0; i < s.length(); i++) {
                target.putMember(String.valueOf(i), String.valueOf(s.charAt(i)));
            }
        }
        if (source instanceof JsObject) {
            JsObject object = (JsObject) source;
            for (String name : object.memberNames()) {
                target.putMember(name, object.getMember(name));
            }
        }
    }

    List<Object> evalArgs(List<Expr> exprs, Frame frame) {
        List<Object> values = new ArrayList<>(exprs.size());
        for (Expr arg : exprs) {
            if (arg.type == ExprType.SPREAD) {
                Object spread = eval(arg.arg(0), frame);
                if (Terms.isNullish(spread)) {
                    throw new ScriptRuntimeException(Terms.toStr(spread) + " is not iterable");
                }
                values.addAll(Terms.arrayLikeValues(spread));
            } else {
                values.add(eval(arg, frame));
            }
        }
        return values;
    }

    //==================================================================================================================
    // member chains

    private Object evalChainTarget(Expr target, Frame frame) {
        switch (target.type) {
            case MEMBER_GET:
            case INDEX_GET:
            case MEMBER_CALL:
            case CALL:
                return evalChainLink(target, frame);
            default:
                return eval(target, frame);
        }
    }

    /**
     * Evaluates one link of a member chain. An optional link on a nullish receiver returns a marker that
     * skips the rest of the chain.
     */
    private Object evalChainLink(Expr expr, Frame frame) {
        if (expr.type == ExprType.CALL) {
            Object thisObject = Terms.UNDEFINED;
            Object callee;
            Expr target = expr.target;
            if (target.type == ExprType.INDEX_GET) {
                thisObject = evalChainTarget(target.target, frame);
                if (thisObject == SKIPPED || target.optional && Terms.isNullish(thisObject)) {
                    return SKIPPED;
                }
                callee = Members.getIndex(this, thisObject, eval(target.arg(0), frame));
            } else {
                callee = evalChainTarget(target, frame);
                if (callee == SKIPPED) {
                    return SKIPPED;
                }
            }
            if (expr.optional && Terms.isNullish(callee)) {
                return SKIPPED;
            }
            return call(callee, thisObject, evalArgs(expr.args, frame), describe(target));
        }
        Object object = evalChainTarget(expr.target, frame);
        if (object == SKIPPED || expr.optional && Terms.isNullish(object)) {
            return SKIPPED;
        }
        switch (expr.type) {
            case MEMBER_GET:
                return Members.getMember(this, object, expr.name);
            case INDEX_GET:
                return Members.getIndex(this, object, eval(expr.arg(0), frame));
            default:
                return Members.callMember(this, object, expr.name, evalArgs(expr.args, frame));
        }
    }

    private static String describe(Expr expr) {
        switch (expr.type) {
            case VAR:
                return expr.name;
            case MEMBER_GET:
                return describe(expr.target) + "." + expr.name;
            case INDEX_GET:
                return describe(expr.target) + "[...]";
            default:
                return "expression";
        }
    }

    //==================================================================================================================
    // names

    Object lookup(String name, Frame frame) {
        Map<String, Object> env = frame.env;
        Object value = env.get(name);
        if (value != null || env.containsKey(name)) {
            return value;
        }
        value = globals.get(name);
        if (value != null || globals.containsKey(name)) {
            return value;
        }
        if (frame.event != null && name.equals(frame.eventParam)) {
            return frame.event;
        }
        value = builtin(name);
        if (value != NOT_BUILTIN) {
            return value;
        }
        throw new ScriptRuntimeException("unknown variable: " + name);
    }

    private boolean isBound(String name, Frame frame) {
        return frame.env.containsKey(name) || globals.containsKey(name)
                || frame.event != null && name.equals(frame.eventParam)
                || builtin(name) != NOT_BUILTIN;
    }

    private Object builtin(String name) {
        BuiltinConstructor constructor = BuiltinConstructor.byName(name);
        if (constructor != null) {
            return constructor;
        }
        Namespace namespace = Namespace.byName(name);
        if (namespace != null) {
            return namespace;
        }
        switch (name) {
            case "localStorage":
                return localStorage;
            case "sessionStorage":
                return sessionStorage;
            case "window":
            case "globalThis":
            case "self":
                return new JsObject(globals);
            case "this":
                return Terms.UNDEFINED;
            default:
        }
        NativeFunction function = Builtins.globalFunction(name);
        return function == null ? NOT_BUILTIN : function;
    }

    //==================================================================================================================
    // calls

    Object call(Object callee, Object thisObject, List<Object> args) {
        return call(callee, thisObject, args, Terms.toStr(callee));
    }

    Object call(Object callee, Object thisObject, List<Object> args, String description) {
        if (callee instanceof JsCallable) {
            return ((JsCallable) callee).call(this, thisObject, args);
        }
        if (callee instanceof BuiltinConstructor) {
            return Constructors.callAsFunction(this, (BuiltinConstructor) callee, args);
        }
        throw new ScriptRuntimeException(description + " is not a function");
    }

    Object construct(Object callee, List<Object> args) {
        if (callee instanceof BuiltinConstructor) {
            return Constructors.construct(this, (BuiltinConstructor) callee, args);
        }
        if (callee instanceof JsFunction && !((JsFunction) callee).arrow && !((JsFunction) callee).async) {
            return Constructors.constructFunction(this, (JsFunction) callee, args);
        }
        throw new ScriptRuntimeException(Terms.toStr(callee) + " is not a constructor");
    }

    /**
     * The value a failed evaluation throws into script: the thrown value itself, or an Error carrying the
     * message of an internal failure.
     */
    static Object thrownValue(RuntimeException e) {
        if (e instanceof ScriptThrownException) {
            return ((ScriptThrownException) e).getValue();
        }
        return new JsError("Error", e.getMessage());
    }

    //==================================================================================================================
    // platform

    private Object evalTimer(Expr expr, Frame frame) {
        Object callback = eval(expr.arg(0), frame);
        if (!(callback instanceof JsCallable) && !(callback instanceof String)) {
            throw new ScriptRuntimeException(expr.type == ExprType.REQUEST_ANIMATION_FRAME
                    ? "requestAnimationFrame: callback is not a function" : "timer callback is not a function");
        }
        Map<String, Object> env = callback instanceof JsFunction ? ((JsFunction) callback).captured : new HashMap<>();
        if (expr.type == ExprType.REQUEST_ANIMATION_FRAME) {
            List<Object> args = new ArrayList<>(1);
            args.add((double) (scheduler.getNowMs() + 16));
            return scheduler.scheduleTimeout(callback, 16, args, env);
        }
        long delay = 0;
        if (expr.args.size() > 1) {
            double d = Terms.toNumber(eval(expr.arg(1), frame));
            delay = Double.isNaN(d) ? 0 : (long) d;
        }
        List<Object> args = new ArrayList<>();
        for (int i = 2; i < expr.args.size(); i++) {
            args.add(eval(expr.arg(i), frame));
        }
        if (expr.type == ExprType.SET_INTERVAL) {
            return scheduler.scheduleInterval(callback, delay, args, env);
        }
        return scheduler.scheduleTimeout(callback, delay, args, env);
    }

    private Object evalEventProp(Expr expr, Frame frame) {
        Expr param = expr.target;
        if (frame.event != null && param.name.equals(frame.eventParam) && !frame.env.containsKey(param.name)) {
            return frame.event.property(expr.name);
        }
        Object value = eval(param, frame);
        for (String part : expr.name.split("\\.")) {
            if (Terms.isNullish(value)) {
                throw new ScriptRuntimeException("cannot read property '" + part + "' of " + Terms.toStr(value));
            }
            value = Members.getMember(this, value, part);
        }
        return value;
    }

    /**
     * Stores the id of a timer under the name it was just bound to, inside that timer's own environment.
     */
    void bindTimerId(String name, Expr expr, Object value) {
        if (expr == null || !(value instanceof Long)) {
            return;
        }
        switch (expr.type) {
            case SET_TIMEOUT:
            case SET_INTERVAL:
            case REQUEST_ANIMATION_FRAME:
                scheduler.bindTimerId(name, (Long) value);
                break;
            default:
        }
    }

    void runTask(ScheduledTask task) {
        if (task.callback instanceof String) {
            Frame frame = new Frame(globals, null, null, globalConstants);
            Executor.run(this, StatementParser.parseStatements((String) task.callback), frame);
        } else {
            call(task.callback, Terms.UNDEFINED, new ArrayList<>(task.args));
        }
    }

    void consoleLog(String line) {
        if (onConsoleLog != null) {
            onConsoleLog.accept(line);
        }
        logger.info("[console] {}", line);
    }

}
