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
import java.util.List;

import static io.browserharness.js.Members.ABSENT;
import static io.browserharness.js.Members.arg;

/**
 * Map, Set, Storage and URLSearchParams members.
 */
class CollectionMembers {

    private CollectionMembers() {
        // only static methods
    }

    static Object property(Object target, String name) {
        if ("size".equals(name)) {
            if (target instanceof JsMap) {
                return (long) ((JsMap) target).size();
            }
            if (target instanceof JsSet) {
                return (long) ((JsSet) target).size();
            }
            if (target instanceof JsUrlSearchParams) {
                return (long) ((JsUrlSearchParams) target).pairs.size();
            }
        }
        if (target instanceof JsStorage) {
            JsStorage storage = (JsStorage) target;
            if ("length".equals(name)) {
                return (long) storage.length();
            }
            if (!isMethod(target, name)) {
                String item = storage.getItem(name);
                return item == null ? Terms.UNDEFINED : item;
            }
        }
        return ABSENT;
    }

    static boolean isMethod(Object target, String name) {
        if (target instanceof JsMap) {
            switch (name) {
                case "get":
                case "set":
                case "has":
                case "delete":
                case "clear":
                case "keys":
                case "values":
                case "entries":
                case "forEach":
                    return true;
                default:
                    return false;
            }
        }
        if (target instanceof JsSet) {
            switch (name) {
                case "add":
                case "has":
                case "delete":
                case "clear":
                case "keys":
                case "values":
                case "entries":
                case "forEach":
                    return true;
                default:
                    return false;
            }
        }
        if (target instanceof JsStorage) {
            switch (name) {
                case "getItem":
                case "setItem":
                case "removeItem":
                case "clear":
                case "key":
                    return true;
                default:
                    return false;
            }
        }
        if (target instanceof JsUrlSearchParams) {
            switch (name) {
                case "get":
                case "getAll":
                case "set":
                case "has":
                case "append":
                case "delete":
                case "forEach":
                case "toString":
                    return true;
                default:
                    return false;
            }
        }
        return false;
    }

    static Object call(Interpreter interpreter, Object target, String name, List<Object> args) {
        if (target instanceof JsMap) {
            return callMap(interpreter, (JsMap) target, name, args);
        }
        if (target instanceof JsSet) {
            return callSet(interpreter, (JsSet) target, name, args);
        }
        if (target instanceof JsStorage) {
            return callStorage((JsStorage) target, name, args);
        }
        if (target instanceof JsUrlSearchParams) {
            return callSearchParams(interpreter, (JsUrlSearchParams) target, name, args);
        }
        return ABSENT;
    }

    private static Object callMap(Interpreter interpreter, JsMap map, String name, List<Object> args) {
        switch (name) {
            case "get":
                return map.get(arg(args, 0));
            case "set":
                map.set(arg(args, 0), arg(args, 1));
                return map;
            case "has":
                return map.has(arg(args, 0));
            case "delete":
                return map.delete(arg(args, 0));
            case "clear":
                map.clear();
                return Terms.UNDEFINED;
            case "keys":
                return new JsArray(map.keys());
            case "values":
                return new JsArray(map.mapValues());
            case "entries":
                return new JsArray(map.values());
            case "forEach": {
                JsCallable fn = ArrayMembers.callback(args, "Map.forEach");
                List<Object> keys = map.keys();
                for (Object key : keys) {
                    if (map.has(key)) {
                        fn.call(interpreter, Terms.UNDEFINED, Arrays.asList(map.get(key), key, map));
                    }
                }
                return Terms.UNDEFINED;
            }
            default:
                return ABSENT;
        }
    }

    private static Object callSet(Interpreter interpreter, JsSet set, String name, List<Object> args) {
        switch (name) {
            case "add":
                set.add(arg(args, 0));
                return set;
            case "has":
                return set.has(arg(args, 0));
            case "delete":
                return set.delete(arg(args, 0));
            case "clear":
                set.clear();
                return Terms.UNDEFINED;
            case "keys":
            case "values":
                return new JsArray(set.values());
            case "entries": {
                List<Object> entries = new ArrayList<>();
                for (Object value : set.values()) {
                    entries.add(new JsArray(new ArrayList<>(Arrays.asList(value, value))));
                }
                return new JsArray(entries);
            }
            case "forEach": {
                JsCallable fn = ArrayMembers.callback(args, "Set.forEach");
                for (Object value : set.values()) {
                    if (set.has(value)) {
                        fn.call(interpreter, Terms.UNDEFINED, Arrays.asList(value, value, set));
                    }
                }
                return Terms.UNDEFINED;
            }
            default:
                return ABSENT;
        }
    }

    private static Object callStorage(JsStorage storage, String name, List<Object> args) {
        switch (name) {
            case "getItem":
                return storage.getItem(Terms.toStr(arg(args, 0)));
            case "setItem":
                storage.setItem(Terms.toStr(arg(args, 0)), Terms.toStr(arg(args, 1)));
                return Terms.UNDEFINED;
            case "removeItem":
                storage.removeItem(Terms.toStr(arg(args, 0)));
                return Terms.UNDEFINED;
            case "clear":
                storage.clear();
                return Terms.UNDEFINED;
            case "key":
                return storage.key((int) Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0))));
            default:
                return ABSENT;
        }
    }

    private static Object callSearchParams(Interpreter interpreter, JsUrlSearchParams params, String name, List<Object> args) {
        switch (name) {
            case "get":
                return params.get(Terms.toStr(arg(args, 0)));
            case "getAll":
                return new JsArray(params.getAll(Terms.toStr(arg(args, 0))));
            case "set":
                params.set(Terms.toStr(arg(args, 0)), Terms.toStr(arg(args, 1)));
                return Terms.UNDEFINED;
            case "has":
                return params.has(Terms.toStr(arg(args, 0)));
            case "append":
                params.append(Terms.toStr(arg(args, 0)), Terms.toStr(arg(args, 1)));
                return Terms.UNDEFINED;
            case "delete":
                params.delete(Terms.toStr(arg(args, 0)));
                return Terms.UNDEFINED;
            case "forEach": {
                JsCallable fn = ArrayMembers.callback(args, "URLSearchParams.forEach");
                for (String[] pair : new ArrayList<>(params.pairs)) {
                    fn.call(interpreter, Terms.UNDEFINED, Arrays.asList(pair[1], pair[0], params));
                }
                return Terms.UNDEFINED;
            }
            case "toString":
                return params.toString();
            default:
                return ABSENT;
        }
    }

}
