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
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.browserharness.js.Members.ABSENT;
import static io.browserharness.js.Members.arg;

/**
 * {@code Array.prototype} subset. Callbacks receive {@code (item, index, array)}.
 */
class ArrayMembers {

    private ArrayMembers() {
        // only static methods
    }

    static final Set<String> METHODS = new HashSet<>(Arrays.asList(
            "push", "pop", "shift", "unshift", "indexOf", "lastIndexOf", "includes", "join", "slice", "splice",
            "concat", "reverse", "map", "filter", "forEach", "find", "findIndex", "findLast", "findLastIndex",
            "some", "every", "reduce", "reduceRight", "sort", "at", "flat", "flatMap", "fill", "keys",
            "values", "entries"
    ));

    static Object property(JsArray array, String name) {
        if ("length".equals(name)) {
            return (long) array.list.size();
        }
        return ABSENT;
    }

    static Object call(Interpreter interpreter, JsArray array, String name, List<Object> args) {
        List<Object> list = array.list;
        switch (name) {
            case "push":
                checkNotFrozen(array);
                list.addAll(args);
                return (long) list.size();
            case "pop":
                checkNotFrozen(array);
                return list.isEmpty() ? Terms.UNDEFINED : list.remove(list.size() - 1);
            case "shift":
                checkNotFrozen(array);
                return list.isEmpty() ? Terms.UNDEFINED : list.remove(0);
            case "unshift":
                checkNotFrozen(array);
                list.addAll(0, args);
                return (long) list.size();
            case "indexOf": {
                Object search = arg(args, 0);
                int from = Terms.relativeIndex(arg(args, 1), list.size(), 0);
                for (int i = from; i < list.size(); i++) {
                    if (Terms.strictEquals(list.get(i), search)) {
                        return (long) i;
                    }
                }
                return -1L;
            }
            case "lastIndexOf": {
                Object search = arg(args, 0);
                for (int i = list.size() - 1; i >= 0; i--) {
                    if (Terms.strictEquals(list.get(i), search)) {
                        return (long) i;
                    }
                }
                return -1L;
            }
            case "includes": {
                Object search = arg(args, 0);
                for (Object item : list) {
                    if (Terms.sameValueZero(item, search)) {
                        return true;
                    }
                }
                return false;
            }
            case "join": {
                Object separator = arg(args, 0);
                return Terms.join(list, separator == Terms.UNDEFINED ? "," : Terms.toStr(separator));
            }
            case "slice": {
                int start = Terms.relativeIndex(arg(args, 0), list.size(), 0);
                int end = Terms.relativeIndex(arg(args, 1), list.size(), list.size());
                return new JsArray(start < end ? new ArrayList<>(list.subList(start, end)) : new ArrayList<>());
            }
            case "splice":
                return splice(array, args);
            case "concat": {
                List<Object> result = new ArrayList<>(list);
                for (Object item : args) {
                    if (item instanceof JsArray) {
                        result.addAll(((JsArray) item).list);
                    } else {
                        result.add(item);
                    }
                }
                return new JsArray(result);
            }
            case "reverse":
                checkNotFrozen(array);
                Collections.reverse(list);
                return array;
            case "map": {
                JsCallable fn = callback(args, name);
                List<Object> result = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    result.add(invoke(interpreter, fn, list.get(i), i, array));
                }
                return new JsArray(result);
            }
            case "filter": {
                JsCallable fn = callback(args, name);
                List<Object> result = new ArrayList<>();
                for (int i = 0; i < list.size(); i++) {
                    Object item = list.get(i);
                    if (Terms.isTruthy(invoke(interpreter, fn, item, i, array))) {
                        result.add(item);
                    }
                }
                return new JsArray(result);
            }
            case "forEach": {
                JsCallable fn = callback(args, name);
                for (int i = 0; i < list.size(); i++) {
                    invoke(interpreter, fn, list.get(i), i, array);
                }
                return Terms.UNDEFINED;
            }
            case "find":
            case "findIndex": {
                JsCallable fn = callback(args, name);
                for (int i = 0; i < list.size(); i++) {
                    Object item = list.get(i);
                    if (Terms.isTruthy(invoke(interpreter, fn, item, i, array))) {
                        return "find".equals(name) ? item : (Object) (long) i;
                    }
                }
                return "find".equals(name) ? Terms.UNDEFINED : (Object) (-1L);
            }
            case "findLast":
            case "findLastIndex": {
                JsCallable fn = callback(args, name);
                for (int i = list.size() - 1; i >= 0; i--) {
                    Object item = list.get(i);
                    if (Terms.isTruthy(invoke(interpreter, fn, item, i, array))) {
                        return "findLast".equals(name) ? item : (Object) (long) i;
                    }
                }
                return "findLast".equals(name) ? Terms.UNDEFINED : (Object) (-1L);
            }
            case "some": {
                JsCallable fn = callback(args, name);
                for (int i = 0; i < list.size(); i++) {
                    if (Terms.isTruthy(invoke(interpreter, fn, list.get(i), i, array))) {
                        return true;
                    }
                }
                return false;
            }
            case "every": {
                JsCallable fn = callback(args, name);
                for (int i = 0; i < list.size(); i++) {
                    if (!Terms.isTruthy(invoke(interpreter, fn, list.get(i), i, array))) {
                        return false;
                    }
                }
                return true;
            }
            case "reduce":
            case "reduceRight":
                return reduce(interpreter, array, args, "reduceRight".equals(name));
            case "sort":
                checkNotFrozen(array);
                sort(interpreter, list, arg(args, 0));
                return array;
            case "at": {
                double index = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                if (index < 0) {
                    index += list.size();
                }
                return index < 0 || index >= list.size() ? Terms.UNDEFINED : list.get((int) index);
            }
            case "flat": {
                Object depthArg = arg(args, 0);
                double depth = depthArg == Terms.UNDEFINED ? 1 : Terms.toIntegerOrInfinity(Terms.toNumber(depthArg));
                List<Object> result = new ArrayList<>();
                flatten(list, depth, result);
                return new JsArray(result);
            }
            case "flatMap": {
                JsCallable fn = callback(args, name);
                List<Object> result = new ArrayList<>();
                for (int i = 0; i < list.size(); i++) {
                    Object mapped = invoke(interpreter, fn, list.get(i), i, array);
                    if (mapped instanceof JsArray) {
                        result.addAll(((JsArray) mapped).list);
                    } else {
                        result.add(mapped);
                    }
                }
                return new JsArray(result);
            }
            case "fill": {
                checkNotFrozen(array);
                Object value = arg(args, 0);
                int start = Terms.relativeIndex(arg(args, 1), list.size(), 0);
                int end = Terms.relativeIndex(arg(args, 2), list.size(), list.size());
                for (int i = start; i < end; i++) {
                    list.set(i, value);
                }
                return array;
            }
            case "keys": {
                List<Object> result = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    result.add((long) i);
                }
                return new JsArray(result);
            }
            case "values":
                return new JsArray(new ArrayList<>(list));
            case "entries": {
                List<Object> result = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    result.add(new JsArray(new ArrayList<>(Arrays.asList((long) i, list.get(i)))));
                }
                return new JsArray(result);
            }
            default:
                return ABSENT;
        }
    }

    private static void checkNotFrozen(JsArray array) {
        if (array.frozen) {
            throw new ScriptRuntimeException("cannot modify a frozen array");
        }
    }

    static JsCallable callback(List<Object> args, String method) {
        Object fn = arg(args, 0);
        if (!(fn instanceof JsCallable)) {
            throw new ScriptRuntimeException(method + ": " + Terms.toStr(fn) + " is not a function");
        }
        return (JsCallable) fn;
    }

    static Object invoke(Interpreter interpreter, JsCallable fn, Object item, int index, Object array) {
        return fn.call(interpreter, Terms.UNDEFINED, Arrays.asList(item, (long) index, array));
    }

    private static Object splice(JsArray array, List<Object> args) {
        checkNotFrozen(array);
        List<Object> list = array.list;
        int start = Terms.relativeIndex(arg(args, 0), list.size(), 0);
        int deleteCount;
        if (args.isEmpty()) {
            deleteCount = 0;
        } else if (args.size() == 1) {
            deleteCount = list.size() - start;
        } else {
            double count = Terms.toIntegerOrInfinity(Terms.toNumber(args.get(1)));
            deleteCount = (int) Math.max(0, Math.min(count, list.size() - start));
        }
        List<Object> window = list.subList(start, start + deleteCount);
        List<Object> removed = new ArrayList<>(window);
        window.clear();
        if (args.size() > 2) {
            list.addAll(start, args.subList(2, args.size()));
        }
        return new JsArray(removed);
    }

    private static Object reduce(Interpreter interpreter, JsArray array, List<Object> args, boolean fromRight) {
        JsCallable fn = callback(args, fromRight ? "reduceRight" : "reduce");
        List<Object> list = array.list;
        int size = list.size();
        int i = fromRight ? size - 1 : 0;
        int step = fromRight ? -1 : 1;
        Object accumulator;
        if (args.size() > 1) {
            accumulator = args.get(1);
        } else {
            if (size == 0) {
                throw new ScriptRuntimeException("reduce of empty array with no initial value");
            }
            accumulator = list.get(i);
            i += step;
        }
        for (; i >= 0 && i < list.size(); i += step) {
            accumulator = fn.call(interpreter, Terms.UNDEFINED, Arrays.asList(accumulator, list.get(i), (long) i, array));
        }
        return accumulator;
    }

    /**
     * Stable sort; undefined values always go last, and without a comparator items compare as strings.
     */
    private static void sort(Interpreter interpreter, List<Object> list, Object comparator) {
        List<Object> defined = new ArrayList<>(list.size());
        int undefinedCount = 0;
        for (Object item : list) {
            if (item == Terms.UNDEFINED) {
                undefinedCount++;
            } else {
                defined.add(item);
            }
        }
        Comparator<Object> order;
        if (comparator instanceof JsCallable) {
            JsCallable fn = (JsCallable) comparator;
            order = (a, b) -> {
                double d = Terms.toNumber(fn.call(interpreter, Terms.UNDEFINED, Arrays.asList(a, b)));
                return d < 0 ? -1 : d > 0 ? 1 : 0;
            };
        } else if (comparator == Terms.UNDEFINED) {
            order = Comparator.comparing(Terms::toStr);
        } else {
            throw new ScriptRuntimeException("the comparison function must be either a function or undefined");
        }
        try {
            defined.sort(order);
        } catch (IllegalArgumentException e) {
            throw new ScriptRuntimeException("inconsistent comparison function", e);
        }
        list.clear();
        list.addAll(defined);
        for (int i = 0; i < undefinedCount; i++) {
            list.add(Terms.UNDEFINED);
        }
    }

    private static void flatten(List<Object> items, double depth, List<Object> result) {
        for (Object item : items) {
            if (item instanceof JsArray && depth >= 1) {
                flatten(((JsArray) item).list, depth - 1, result);
            } else {
                result.add(item);
            }
        }
    }

}
