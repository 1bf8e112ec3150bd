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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Promise settlement and reactions. Every reaction runs as a microtask, never synchronously.
 */
class Promises {

    private Promises() {
        // only static methods
    }

    /**
     * Resolves with a value, adopting the state of another promise when given one.
     *
     * @return false when the promise was already settled or locked onto another promise
     */
    static boolean resolve(Interpreter interpreter, JsPromise promise, Object value) {
        if (promise.isSettled() || promise.locked) {
            return false;
        }
        if (value == promise) {
            settle(interpreter, promise, JsPromise.State.REJECTED,
                    new JsError("TypeError", "chaining cycle detected for promise"));
            return true;
        }
        if (value instanceof JsPromise) {
            JsPromise source = (JsPromise) value;
            promise.locked = true;
            subscribe(interpreter, source, settled -> {
                promise.locked = false;
                settle(interpreter, promise, settled.state, settled.value);
            });
            return true;
        }
        settle(interpreter, promise, JsPromise.State.FULFILLED, value);
        return true;
    }

    static boolean reject(Interpreter interpreter, JsPromise promise, Object reason) {
        if (promise.isSettled() || promise.locked) {
            return false;
        }
        settle(interpreter, promise, JsPromise.State.REJECTED, reason);
        return true;
    }

    private static void settle(Interpreter interpreter, JsPromise promise, JsPromise.State state, Object value) {
        promise.state = state;
        promise.value = value;
        List<Consumer<JsPromise>> reactions = new ArrayList<>(promise.reactions);
        promise.reactions.clear();
        for (Consumer<JsPromise> reaction : reactions) {
            interpreter.scheduler.queueMicrotask("promise reaction", () -> reaction.accept(promise));
        }
    }

    private static void subscribe(Interpreter interpreter, JsPromise promise, Consumer<JsPromise> reaction) {
        if (promise.isSettled()) {
            interpreter.scheduler.queueMicrotask("promise reaction", () -> reaction.accept(promise));
        } else {
            promise.reactions.add(reaction);
        }
    }

    static JsPromise then(Interpreter interpreter, JsPromise promise, Object onFulfilled, Object onRejected) {
        JsPromise result = new JsPromise();
        subscribe(interpreter, promise, settled -> {
            Object handler = settled.state == JsPromise.State.FULFILLED ? onFulfilled : onRejected;
            if (!(handler instanceof JsCallable)) {
                if (settled.state == JsPromise.State.FULFILLED) {
                    resolve(interpreter, result, settled.value);
                } else {
                    reject(interpreter, result, settled.value);
                }
                return;
            }
            try {
                Object value = ((JsCallable) handler).call(interpreter, Terms.UNDEFINED, Collections.singletonList(settled.value));
                resolve(interpreter, result, value);
            } catch (ScriptRuntimeException e) {
                reject(interpreter, result, Interpreter.thrownValue(e));
            }
        });
        return result;
    }

    static JsPromise doFinally(Interpreter interpreter, JsPromise promise, Object onFinally) {
        JsPromise result = new JsPromise();
        subscribe(interpreter, promise, settled -> {
            try {
                if (onFinally instanceof JsCallable) {
                    Object value = ((JsCallable) onFinally).call(interpreter, Terms.UNDEFINED, Collections.emptyList());
                    if (value instanceof JsPromise && ((JsPromise) value).state == JsPromise.State.REJECTED) {
                        reject(interpreter, result, ((JsPromise) value).value);
                        return;
                    }
                }
            } catch (ScriptRuntimeException e) {
                reject(interpreter, result, Interpreter.thrownValue(e));
                return;
            }
            if (settled.state == JsPromise.State.FULFILLED) {
                resolve(interpreter, result, settled.value);
            } else {
                reject(interpreter, result, settled.value);
            }
        });
        return result;
    }

    /**
     * {@code new Promise(executor)}: the executor runs synchronously with resolve and reject functions.
     */
    static JsPromise construct(Interpreter interpreter, Object executor) {
        if (!(executor instanceof JsCallable)) {
            throw new ScriptRuntimeException("Promise resolver " + Terms.toStr(executor) + " is not a function");
        }
        JsPromise promise = new JsPromise();
        NativeFunction resolveFn = new NativeFunction("resolve",
                (in, self, args) -> resolve(in, promise, args.isEmpty() ? Terms.UNDEFINED : args.get(0)));
        NativeFunction rejectFn = new NativeFunction("reject",
                (in, self, args) -> reject(in, promise, args.isEmpty() ? Terms.UNDEFINED : args.get(0)));
        try {
            ((JsCallable) executor).call(interpreter, Terms.UNDEFINED, Arrays.asList(resolveFn, rejectFn));
        } catch (ScriptRuntimeException e) {
            reject(interpreter, promise, Interpreter.thrownValue(e));
        }
        return promise;
    }

    static JsPromise resolved(Interpreter interpreter, Object value) {
        if (value instanceof JsPromise) {
            return (JsPromise) value;
        }
        JsPromise promise = new JsPromise();
        resolve(interpreter, promise, value);
        return promise;
    }

    static JsPromise rejected(Interpreter interpreter, Object reason) {
        JsPromise promise = new JsPromise();
        reject(interpreter, promise, reason);
        return promise;
    }

    //==================================================================================================================
    // combinators

    static JsPromise all(Interpreter interpreter, Object iterable) {
        List<Object> items = Terms.arrayLikeValues(iterable);
        JsPromise result = new JsPromise();
        Object[] values = new Object[items.size()];
        int[] remaining = {items.size()};
        if (items.isEmpty()) {
            resolve(interpreter, result, new JsArray());
            return result;
        }
        for (int i = 0; i < items.size(); i++) {
            int index = i;
            subscribe(interpreter, resolved(interpreter, items.get(i)), settled -> {
                if (settled.state == JsPromise.State.REJECTED) {
                    reject(interpreter, result, settled.value);
                    return;
                }
                values[index] = settled.value;
                if (--remaining[0] == 0) {
                    resolve(interpreter, result, new JsArray(new ArrayList<>(Arrays.asList(values))));
                }
            });
        }
        return result;
    }

    static JsPromise allSettled(Interpreter interpreter, Object iterable) {
        List<Object> items = Terms.arrayLikeValues(iterable);
        JsPromise result = new JsPromise();
        Object[] values = new Object[items.size()];
        int[] remaining = {items.size()};
        if (items.isEmpty()) {
            resolve(interpreter, result, new JsArray());
            return result;
        }
        for (int i = 0; i < items.size(); i++) {
            int index = i;
            subscribe(interpreter, resolved(interpreter, items.get(i)), settled -> {
                JsObject outcome = new JsObject();
                if (settled.state == JsPromise.State.FULFILLED) {
                    outcome.putMember("status", "fulfilled");
                    outcome.putMember("value", settled.value);
                } else {
                    outcome.putMember("status", "rejected");
                    outcome.putMember("reason", settled.value);
                }
                values[index] = outcome;
                if (--remaining[0] == 0) {
                    resolve(interpreter, result, new JsArray(new ArrayList<>(Arrays.asList(values))));
                }
            });
        }
        return result;
    }

    static JsPromise race(Interpreter interpreter, Object iterable) {
        JsPromise result = new JsPromise();
        for (Object item : Terms.arrayLikeValues(iterable)) {
            subscribe(interpreter, resolved(interpreter, item), settled -> {
                if (settled.state == JsPromise.State.FULFILLED) {
                    resolve(interpreter, result, settled.value);
                } else {
                    reject(interpreter, result, settled.value);
                }
            });
        }
        return result;
    }

    static JsPromise any(Interpreter interpreter, Object iterable) {
        List<Object> items = Terms.arrayLikeValues(iterable);
        JsPromise result = new JsPromise();
        Object[] errors = new Object[items.size()];
        int[] remaining = {items.size()};
        if (items.isEmpty()) {
            reject(interpreter, result, aggregateError(errors));
            return result;
        }
        for (int i = 0; i < items.size(); i++) {
            int index = i;
            subscribe(interpreter, resolved(interpreter, items.get(i)), settled -> {
                if (settled.state == JsPromise.State.FULFILLED) {
                    resolve(interpreter, result, settled.value);
                    return;
                }
                errors[index] = settled.value;
                if (--remaining[0] == 0) {
                    reject(interpreter, result, aggregateError(errors));
                }
            });
        }
        return result;
    }

    private static JsError aggregateError(Object[] errors) {
        JsError error = new JsError("AggregateError", "All promises were rejected");
        error.putMember("errors", new JsArray(new ArrayList<>(Arrays.asList(errors))));
        return error;
    }

}
