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

import java.math.BigInteger;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Member access and member calls. Own members of a container are looked up first and shadow the
 * built-in members of its kind, which stands in for the prototype chain.
 */
class Members {

    private Members() {
        // only static methods
    }

    /**
     * Returned by the per-kind helpers when a name is not theirs.
     */
    static final Object ABSENT = new Object();

    private static final Set<String> OBJECT_METHODS = new HashSet<>(Arrays.asList(
            "hasOwnProperty", "toString", "valueOf", "toLocaleString"
    ));

    private static final Set<String> DATE_METHODS = new HashSet<>(Arrays.asList(
            "getTime", "valueOf", "toISOString", "toJSON", "toUTCString", "toString", "getFullYear", "getMonth",
            "getDate", "getDay", "getHours", "getMinutes", "getSeconds", "getMilliseconds", "getTimezoneOffset",
            "getUTCFullYear", "getUTCMonth", "getUTCDate", "getUTCDay", "getUTCHours", "getUTCMinutes",
            "getUTCSeconds", "getUTCMilliseconds", "setTime"
    ));

    private static final Set<String> DOM_METHODS = new HashSet<>(Arrays.asList(
            "getAttribute", "setAttribute", "hasAttribute", "removeAttribute", "appendChild"
    ));

    private static final Set<String> NUMBER_METHODS = new HashSet<>(Arrays.asList(
            "toFixed", "toPrecision", "toString", "valueOf", "toLocaleString"
    ));

    static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : Terms.UNDEFINED;
    }

    private static void checkReadable(Object target, Object key) {
        if (Terms.isNullish(target)) {
            throw new ScriptRuntimeException("cannot read properties of " + Terms.toStr(target)
                    + " (reading '" + Terms.toStr(key) + "')");
        }
    }

    //==================================================================================================================
    // reads

    static Object getIndex(Interpreter interpreter, Object target, Object key) {
        checkReadable(target, key);
        if (target instanceof JsArray) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                return ((JsArray) target).get(index);
            }
        } else if (target instanceof JsTypedArray) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                return ((JsTypedArray) target).get(index);
            }
        } else if (target instanceof String) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                String s = (String) target;
                return index < s.length() ? String.valueOf(s.charAt(index)) : Terms.UNDEFINED;
            }
        }
        return getMember(interpreter, target, Terms.toPropertyKey(key));
    }

    static Object getMember(Interpreter interpreter, Object target, String name) {
        checkReadable(target, name);
        if (target instanceof JsObject) {
            JsObject object = (JsObject) target;
            if (object.hasMember(name)) {
                return object.getMember(name);
            }
        }
        Object value = property(interpreter, target, name);
        if (value != ABSENT) {
            return value;
        }
        if (isMethod(target, name)) {
            return new NativeFunction(name, (in, self, args) -> callMember(in, target, name, args));
        }
        return Terms.UNDEFINED;
    }

    private static Object property(Interpreter interpreter, Object target, String name) {
        if (target instanceof String) {
            return StringMembers.property((String) target, name);
        }
        if (target instanceof JsArray) {
            return ArrayMembers.property((JsArray) target, name);
        }
        if (target instanceof JsMap || target instanceof JsSet || target instanceof JsStorage
                || target instanceof JsUrlSearchParams) {
            return CollectionMembers.property(target, name);
        }
        if (target instanceof JsArrayBuffer || target instanceof JsTypedArray || target instanceof JsBlob) {
            return BufferMembers.property(target, name);
        }
        if (target instanceof JsSymbol) {
            return NumberMembers.property(target, name);
        }
        if (target instanceof JsRegex) {
            return regexProperty((JsRegex) target, name);
        }
        if (target instanceof JsUrl) {
            return urlProperty((JsUrl) target, name);
        }
        if (target instanceof DomNode) {
            return domProperty((DomNode) target, name);
        }
        if (target instanceof EventState) {
            Object value = ((EventState) target).property(name);
            return value == Terms.UNDEFINED ? ABSENT : value;
        }
        if (target instanceof JsFunction) {
            JsFunction fn = (JsFunction) target;
            if ("name".equals(name)) {
                return fn.name;
            }
            if ("length".equals(name)) {
                return (long) fn.handler.getParamCount();
            }
        }
        if (target instanceof NativeFunction && "name".equals(name)) {
            return ((NativeFunction) target).name;
        }
        if (target instanceof Namespace) {
            return Builtins.namespaceProperty(interpreter, (Namespace) target, name);
        }
        if (target instanceof BuiltinConstructor) {
            if ("name".equals(name)) {
                return ((BuiltinConstructor) target).jsName;
            }
            return Builtins.staticProperty((BuiltinConstructor) target, name);
        }
        return ABSENT;
    }

    private static Object regexProperty(JsRegex regex, String name) {
        switch (name) {
            case "source":
                return regex.source;
            case "flags":
                return regex.flags;
            case "global":
                return regex.global;
            case "sticky":
                return regex.sticky;
            case "ignoreCase":
                return regex.flags.indexOf('i') >= 0;
            case "multiline":
                return regex.flags.indexOf('m') >= 0;
            case "lastIndex":
                return (long) regex.lastIndex;
            default:
                return ABSENT;
        }
    }

    private static Object urlProperty(JsUrl url, String name) {
        switch (name) {
            case "href":
                return url.href();
            case "protocol":
                return url.protocol;
            case "username":
                return url.username;
            case "password":
                return url.password;
            case "host":
                return url.host();
            case "hostname":
                return url.hostname;
            case "port":
                return url.port;
            case "pathname":
                return url.pathname;
            case "search":
                return url.search;
            case "hash":
                return url.hash;
            case "origin":
                return url.origin();
            case "searchParams":
                return url.searchParams;
            default:
                return ABSENT;
        }
    }

    private static Object domProperty(DomNode node, String name) {
        switch (name) {
            case "id":
                return node.getId();
            case "tagName":
            case "nodeName":
                return node.isText() ? "#text" : node.getTagName();
            case "textContent":
                return node.getTextContent();
            case "className": {
                String classes = node.getAttribute("class");
                return classes == null ? "" : classes;
            }
            case "parentNode":
            case "parentElement":
                return node.getParent();
            case "children":
                return new JsArray(new ArrayList<>(node.getChildren()));
            case "firstChild":
                return node.getChildren().isEmpty() ? null : node.getChildren().get(0);
            default:
                return ABSENT;
        }
    }

    private static boolean isMethod(Object target, String name) {
        if (OBJECT_METHODS.contains(name)) {
            return true;
        }
        if (target instanceof String) {
            return StringMembers.METHODS.contains(name);
        }
        if (target instanceof JsArray) {
            return ArrayMembers.METHODS.contains(name);
        }
        if (target instanceof Long || target instanceof Double || target instanceof BigInteger) {
            return NUMBER_METHODS.contains(name);
        }
        if (target instanceof JsDate) {
            return DATE_METHODS.contains(name);
        }
        if (target instanceof DomNode) {
            return DOM_METHODS.contains(name);
        }
        if (target instanceof JsRegex) {
            return "test".equals(name) || "exec".equals(name);
        }
        if (target instanceof JsPromise) {
            return "then".equals(name) || "catch".equals(name) || "finally".equals(name);
        }
        if (target instanceof JsIntlFormatter) {
            return "format".equals(name);
        }
        if (target instanceof JsUrl) {
            return "toJSON".equals(name);
        }
        if (target instanceof EventState) {
            return "preventDefault".equals(name) || "stopPropagation".equals(name)
                    || "stopImmediatePropagation".equals(name);
        }
        if (target instanceof JsCallable && ("call".equals(name) || "apply".equals(name) || "bind".equals(name))) {
            return true;
        }
        if (target instanceof Namespace) {
            return Builtins.isNamespaceMethod((Namespace) target, name);
        }
        if (target instanceof BuiltinConstructor) {
            return Builtins.isStaticMethod((BuiltinConstructor) target, name);
        }
        return CollectionMembers.isMethod(target, name) || BufferMembers.isMethod(target, name);
    }

    //==================================================================================================================
    // writes

    static void setIndex(Interpreter interpreter, Object target, Object key, Object value) {
        if (Terms.isNullish(target)) {
            throw new ScriptRuntimeException("cannot set properties of " + Terms.toStr(target)
                    + " (setting '" + Terms.toStr(key) + "')");
        }
        if (target instanceof JsArray) {
            JsArray array = (JsArray) target;
            int index = Terms.toIndex(key);
            if (index >= 0) {
                array.set(index, value);
                return;
            }
            if ("length".equals(key)) {
                double length = Terms.toNumber(value);
                if (length < 0 || length != Math.floor(length) || length > Integer.MAX_VALUE) {
                    throw new ScriptRuntimeException("invalid array length: " + Terms.toStr(value));
                }
                if (!array.frozen) {
                    array.setLength((int) length);
                }
                return;
            }
        }
        if (target instanceof JsTypedArray) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                ((JsTypedArray) target).set(index, value);
                return;
            }
        }
        String name = Terms.toPropertyKey(key);
        if (target instanceof JsRegex && "lastIndex".equals(name)) {
            ((JsRegex) target).lastIndex = (int) Terms.toIntegerOrInfinity(Terms.toNumber(value));
            return;
        }
        if (target instanceof DomNode && setDomProperty((DomNode) target, name, value)) {
            return;
        }
        if (target instanceof JsStorage && !CollectionMembers.isMethod(target, name) && !"length".equals(name)) {
            ((JsStorage) target).setItem(name, Terms.toStr(value));
            return;
        }
        if (target instanceof JsObject) {
            ((JsObject) target).putMember(name, value);
        }
        // writes to primitives and builtin markers are ignored
    }

    private static boolean setDomProperty(DomNode node, String name, Object value) {
        switch (name) {
            case "id":
                node.setAttribute("id", Terms.toStr(value));
                return true;
            case "className":
                node.setAttribute("class", Terms.toStr(value));
                return true;
            case "textContent":
                node.setTextContent(Terms.isNullish(value) ? "" : Terms.toStr(value));
                return true;
            default:
                return false;
        }
    }

    static boolean delete(Object target, Object key) {
        if (Terms.isNullish(target)) {
            throw new ScriptRuntimeException("cannot convert " + Terms.toStr(target) + " to object");
        }
        if (target instanceof JsArray) {
            JsArray array = (JsArray) target;
            int index = Terms.toIndex(key);
            if (index >= 0) {
                if (array.frozen) {
                    return false;
                }
                if (index < array.list.size()) {
                    array.list.set(index, Terms.UNDEFINED);
                }
                return true;
            }
        }
        if (target instanceof JsObject) {
            return ((JsObject) target).removeMember(Terms.toPropertyKey(key));
        }
        return true;
    }

    //==================================================================================================================
    // calls

    static Object callMember(Interpreter interpreter, Object target, String name, List<Object> args) {
        checkReadable(target, name);
        if (target instanceof JsObject && ((JsObject) target).hasMember(name)) {
            Object fn = ((JsObject) target).getMember(name);
            return interpreter.call(fn, target, args, name);
        }
        Object result = callBuiltin(interpreter, target, name, args);
        if (result != ABSENT) {
            return result;
        }
        result = callObjectMethod(target, name, args);
        if (result != ABSENT) {
            return result;
        }
        throw new ScriptRuntimeException(name + " is not a function");
    }

    private static Object callGenerator(JsGenerator generator, String name, List<Object> args) {
        switch (name) {
            case "next":
                return generator.next();
            case "return":
                return generator.finish(arg(args, 0));
            default:
                return ABSENT;
        }
    }

    private static Object callBuiltin(Interpreter interpreter, Object target, String name, List<Object> args) {
        if (target instanceof String) {
            return StringMembers.call(interpreter, (String) target, name, args);
        }
        if (target instanceof JsArray) {
            return ArrayMembers.call(interpreter, (JsArray) target, name, args);
        }
        if (target instanceof Long || target instanceof Double || target instanceof BigInteger
                || target instanceof Boolean || target instanceof JsSymbol) {
            return NumberMembers.call(target, name, args);
        }
        if (target instanceof JsGenerator) {
            return callGenerator((JsGenerator) target, name, args);
        }
        if (target instanceof JsMap || target instanceof JsSet || target instanceof JsStorage
                || target instanceof JsUrlSearchParams) {
            return CollectionMembers.call(interpreter, target, name, args);
        }
        if (target instanceof JsArrayBuffer || target instanceof JsTypedArray || target instanceof JsBlob) {
            return BufferMembers.call(interpreter, target, name, args);
        }
        if (target instanceof JsDate) {
            return callDate((JsDate) target, name, args);
        }
        if (target instanceof JsRegex) {
            JsRegex regex = (JsRegex) target;
            switch (name) {
                case "test":
                    return regex.test(Terms.toStr(arg(args, 0)));
                case "exec":
                    return regex.exec(Terms.toStr(arg(args, 0)));
                default:
                    return ABSENT;
            }
        }
        if (target instanceof JsPromise) {
            JsPromise promise = (JsPromise) target;
            switch (name) {
                case "then":
                    return Promises.then(interpreter, promise, arg(args, 0), arg(args, 1));
                case "catch":
                    return Promises.then(interpreter, promise, Terms.UNDEFINED, arg(args, 0));
                case "finally":
                    return Promises.doFinally(interpreter, promise, arg(args, 0));
                default:
                    return ABSENT;
            }
        }
        if (target instanceof JsIntlFormatter && "format".equals(name)) {
            return ((JsIntlFormatter) target).format(arg(args, 0));
        }
        if (target instanceof JsUrl && "toJSON".equals(name)) {
            return ((JsUrl) target).href();
        }
        if (target instanceof DomNode) {
            return callDom((DomNode) target, name, args);
        }
        if (target instanceof EventState) {
            EventState event = (EventState) target;
            switch (name) {
                case "preventDefault":
                    event.preventDefault();
                    return Terms.UNDEFINED;
                case "stopPropagation":
                case "stopImmediatePropagation":
                    event.propagationStopped = true;
                    return Terms.UNDEFINED;
                default:
                    return ABSENT;
            }
        }
        if (target instanceof JsCallable) {
            return callFunctionMethod(interpreter, (JsCallable) target, name, args);
        }
        if (target instanceof Namespace) {
            return Builtins.callNamespace(interpreter, (Namespace) target, name, args);
        }
        if (target instanceof BuiltinConstructor) {
            return Builtins.callStatic(interpreter, (BuiltinConstructor) target, name, args);
        }
        return ABSENT;
    }

    private static Object callObjectMethod(Object target, String name, List<Object> args) {
        switch (name) {
            case "hasOwnProperty":
                return hasOwn(target, arg(args, 0));
            case "toString":
            case "toLocaleString":
                return Terms.toStr(target);
            case "valueOf":
                return target;
            default:
                return ABSENT;
        }
    }

    static boolean hasOwn(Object target, Object key) {
        if (target instanceof JsArray) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                return index < ((JsArray) target).list.size();
            }
            if ("length".equals(key)) {
                return true;
            }
        }
        if (target instanceof String) {
            int index = Terms.toIndex(key);
            return index >= 0 && index < ((String) target).length() || "length".equals(key);
        }
        if (target instanceof JsObject) {
            return ((JsObject) target).hasMember(Terms.toPropertyKey(key));
        }
        return false;
    }

    private static Object callFunctionMethod(Interpreter interpreter, JsCallable fn, String name, List<Object> args) {
        switch (name) {
            case "call":
                return fn.call(interpreter, arg(args, 0), args.size() > 1 ? new ArrayList<>(args.subList(1, args.size())) : new ArrayList<>());
            case "apply": {
                Object list = arg(args, 1);
                List<Object> callArgs = Terms.isNullish(list) ? new ArrayList<>() : Terms.arrayLikeValues(list);
                return fn.call(interpreter, arg(args, 0), callArgs);
            }
            case "bind": {
                Object thisObject = arg(args, 0);
                List<Object> bound = args.size() > 1 ? new ArrayList<>(args.subList(1, args.size())) : new ArrayList<>();
                return new NativeFunction("bound", (in, self, callArgs) -> {
                    List<Object> all = new ArrayList<>(bound);
                    all.addAll(callArgs);
                    return fn.call(in, thisObject, all);
                });
            }
            default:
                return ABSENT;
        }
    }

    private static Object callDate(JsDate date, String name, List<Object> args) {
        switch (name) {
            case "getTime":
            case "valueOf":
                return Terms.narrow(date.getTime());
            case "toISOString":
                return DateSupport.toIsoString(date);
            case "toJSON":
                return date.isValid() ? DateSupport.toIsoString(date) : null;
            case "toUTCString":
                return date.isValid() ? DateSupport.toUtcString(date) : "Invalid Date";
            case "toString":
                return date.toString();
            case "setTime":
                date.setTime(Terms.toNumber(arg(args, 0)));
                return Terms.narrow(date.getTime());
            case "getTimezoneOffset":
                return date.isValid() ? (Object) 0L : (Object) Double.NaN;
            default:
        }
        if (!DATE_METHODS.contains(name)) {
            return ABSENT;
        }
        if (!date.isValid()) {
            return Double.NaN;
        }
        ZonedDateTime zdt = date.toZonedDateTime();
        switch (name.replace("UTC", "")) {
            case "getFullYear":
                return (long) zdt.getYear();
            case "getMonth":
                return (long) zdt.getMonthValue() - 1;
            case "getDate":
                return (long) zdt.getDayOfMonth();
            case "getDay":
                return (long) (zdt.getDayOfWeek().getValue() % 7);
            case "getHours":
                return (long) zdt.getHour();
            case "getMinutes":
                return (long) zdt.getMinute();
            case "getSeconds":
                return (long) zdt.getSecond();
            case "getMilliseconds":
                return (long) (zdt.getNano() / 1_000_000);
            default:
                return ABSENT;
        }
    }

    private static Object callDom(DomNode node, String name, List<Object> args) {
        switch (name) {
            case "getAttribute":
                return node.getAttribute(Terms.toStr(arg(args, 0)));
            case "setAttribute":
                node.setAttribute(Terms.toStr(arg(args, 0)), Terms.toStr(arg(args, 1)));
                return Terms.UNDEFINED;
            case "hasAttribute":
                return node.hasAttribute(Terms.toStr(arg(args, 0)));
            case "removeAttribute":
                node.attributes.remove(Terms.toStr(arg(args, 0)).toLowerCase(Locale.ROOT));
                return Terms.UNDEFINED;
            case "appendChild": {
                Object child = arg(args, 0);
                if (!(child instanceof DomNode)) {
                    throw new ScriptRuntimeException("appendChild: parameter 1 is not of type 'Node'");
                }
                return node.appendChild((DomNode) child);
            }
            default:
                return ABSENT;
        }
    }

}
