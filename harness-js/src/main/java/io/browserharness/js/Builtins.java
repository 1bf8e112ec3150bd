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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.browserharness.js.Members.ABSENT;
import static io.browserharness.js.Members.arg;

/**
 * Global functions, namespace members ({@code Math}, {@code JSON}, {@code console}, {@code document},
 * {@code performance}) and constructor statics. The parser turns direct calls into dedicated nodes;
 * the same behavior is reachable through aliases such as {@code const m = Math; m.max(..)}.
 */
class Builtins {

    private Builtins() {
        // only static methods
    }

    static final Set<String> MATH_UNARY = new HashSet<>(Arrays.asList(
            "abs", "acos", "acosh", "asin", "asinh", "atan", "atanh", "cbrt", "ceil", "clz32", "cos", "cosh",
            "exp", "expm1", "floor", "fround", "log", "log10", "log1p", "log2", "round", "sign", "sin", "sinh",
            "sqrt", "tan", "tanh", "trunc"
    ));

    private static final Set<String> MATH_OTHER = new HashSet<>(Arrays.asList(
            "atan2", "pow", "imul", "max", "min", "hypot", "random"
    ));

    private static final List<String> GLOBAL_FUNCTIONS = Arrays.asList(
            "parseInt", "parseFloat", "isNaN", "isFinite", "encodeURIComponent", "decodeURIComponent",
            "encodeURI", "decodeURI", "atob", "btoa", "structuredClone"
    );

    private static final Pattern FLOAT_PREFIX = Pattern.compile("^[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");

    static Object evaluate(Interpreter interpreter, Expr expr, List<Object> args) {
        switch (expr.type) {
            case MATH_CONST:
                return mathConstant(expr.name);
            case MATH_CALL:
                return math(interpreter, expr.name, args);
            case DATE_NOW:
                return dateStatic(interpreter, "now", args);
            case DATE_PARSE:
                return dateStatic(interpreter, "parse", args);
            case DATE_UTC:
                return dateStatic(interpreter, "UTC", args);
            case PERFORMANCE_NOW:
                return (double) interpreter.scheduler.getNowMs();
            case NUMBER_CONST:
                return numberConstant(expr.name);
            case NUMBER_STATIC:
                return numberStatic(expr.name, args);
            case NUMBER_CALL:
                return Constructors.callAsFunction(interpreter, BuiltinConstructor.NUMBER, args);
            case STRING_CALL:
                return expr.name == null
                        ? Constructors.callAsFunction(interpreter, BuiltinConstructor.STRING, args)
                        : fromCharCode(args);
            case BIGINT_CALL:
                return Constructors.callAsFunction(interpreter, BuiltinConstructor.BIGINT, args);
            case SYMBOL_CALL:
                return Constructors.callAsFunction(interpreter, BuiltinConstructor.SYMBOL, args);
            case SYMBOL_FOR:
                return symbolFor(interpreter, arg(args, 0));
            case PARSE_INT:
                return global(interpreter, "parseInt", args);
            case PARSE_FLOAT:
                return global(interpreter, "parseFloat", args);
            case IS_NAN:
                return global(interpreter, "isNaN", args);
            case IS_FINITE:
                return global(interpreter, "isFinite", args);
            case ATOB:
                return global(interpreter, "atob", args);
            case BTOA:
                return global(interpreter, "btoa", args);
            case STRUCTURED_CLONE:
                return global(interpreter, "structuredClone", args);
            case URI_CODEC:
                return global(interpreter, expr.name, args);
            case JSON_PARSE:
                return json(interpreter, "parse", args);
            case JSON_STRINGIFY:
                return json(interpreter, "stringify", args);
            case OBJECT_STATIC:
                return objectStatic(interpreter, expr.name, args);
            case ARRAY_IS_ARRAY:
                return arrayStatic(interpreter, "isArray", args);
            case ARRAY_STATIC:
                return arrayStatic(interpreter, expr.name, args);
            case PROMISE_STATIC:
                return promiseStatic(interpreter, expr.name, args);
            case ARRAY_BUFFER_IS_VIEW:
                return arg(args, 0) instanceof JsTypedArray;
            default:
                throw new ScriptRuntimeException("unsupported expression: " + expr.type);
        }
    }

    //==================================================================================================================
    // global functions

    static NativeFunction globalFunction(String name) {
        if (!GLOBAL_FUNCTIONS.contains(name)) {
            return null;
        }
        return new NativeFunction(name, (in, self, args) -> global(in, name, args));
    }

    private static Object global(Interpreter interpreter, String name, List<Object> args) {
        Object value = arg(args, 0);
        switch (name) {
            case "parseInt":
                return parseInt(Terms.toStr(value), arg(args, 1));
            case "parseFloat":
                return parseFloat(Terms.toStr(value));
            case "isNaN":
                return Double.isNaN(Terms.toNumber(value));
            case "isFinite": {
                double d = Terms.toNumber(value);
                return !Double.isNaN(d) && !Double.isInfinite(d);
            }
            case "atob":
                return Encoding.atob(Terms.toStr(value));
            case "btoa":
                return Encoding.btoa(Terms.toStr(value));
            case "structuredClone":
                return structuredClone(value, new IdentityHashMap<>());
            default:
                return Encoding.uriCodec(name, Terms.toStr(value));
        }
    }

    static Object parseInt(String input, Object radixArg) {
        String s = Terms.trimStart(input);
        int i = 0;
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-')) {
            negative = s.charAt(0) == '-';
            i++;
        }
        int radix = radixArg == Terms.UNDEFINED ? 0 : Terms.toInt32(Terms.toNumber(radixArg));
        boolean hexPrefix = s.startsWith("0x", i) || s.startsWith("0X", i);
        if (radix == 0) {
            radix = hexPrefix ? 16 : 10;
        } else if (radix < 2 || radix > 36) {
            return Double.NaN;
        }
        if (radix == 16 && hexPrefix) {
            i += 2;
        }
        double value = 0;
        boolean parsed = false;
        for (; i < s.length(); i++) {
            int digit = Character.digit(s.charAt(i), radix);
            if (digit < 0 || s.charAt(i) > 'z') {
                break;
            }
            value = value * radix + digit;
            parsed = true;
        }
        if (!parsed) {
            return Double.NaN;
        }
        return Terms.narrow(negative ? -value : value);
    }

    static Object parseFloat(String input) {
        Matcher matcher = FLOAT_PREFIX.matcher(Terms.trimStart(input));
        if (!matcher.find()) {
            return Double.NaN;
        }
        String match = matcher.group();
        if (match.endsWith("Infinity")) {
            return match.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Terms.narrow(Double.parseDouble(match));
    }

    static Object structuredClone(Object value, Map<Object, Object> seen) {
        if (value instanceof JsSymbol) {
            throw new ScriptRuntimeException(value + " could not be cloned");
        }
        if (Terms.isPrimitive(value)) {
            return value;
        }
        Object existing = seen.get(value);
        if (existing != null) {
            return existing;
        }
        if (value instanceof JsCallable || value instanceof JsPromise
                || value instanceof DomNode || value instanceof BuiltinConstructor || value instanceof Namespace) {
            throw new ScriptRuntimeException(Terms.toStr(value) + " could not be cloned");
        }
        if (value instanceof JsArray) {
            JsArray copy = new JsArray();
            seen.put(value, copy);
            for (Object item : ((JsArray) value).list) {
                copy.list.add(structuredClone(item, seen));
            }
            return copy;
        }
        if (value instanceof JsDate) {
            return new JsDate(((JsDate) value).getTime());
        }
        if (value instanceof JsRegex) {
            JsRegex regex = (JsRegex) value;
            return new JsRegex(regex.source, regex.flags);
        }
        if (value instanceof JsMap) {
            JsMap source = (JsMap) value;
            JsMap copy = new JsMap();
            seen.put(value, copy);
            for (Object key : source.keys()) {
                copy.set(structuredClone(key, seen), structuredClone(source.get(key), seen));
            }
            return copy;
        }
        if (value instanceof JsSet) {
            JsSet copy = new JsSet();
            seen.put(value, copy);
            for (Object item : ((JsSet) value).values()) {
                copy.add(structuredClone(item, seen));
            }
            return copy;
        }
        if (value instanceof JsArrayBuffer) {
            JsArrayBuffer buffer = (JsArrayBuffer) value;
            return JsArrayBuffer.wrap(buffer.copyBytes(0, buffer.getByteLength()));
        }
        if (value instanceof JsError) {
            JsError error = (JsError) value;
            return new JsError(error.getName(), error.getMessage());
        }
        if (value.getClass() == JsObject.class) {
            JsObject source = (JsObject) value;
            JsObject copy = new JsObject();
            seen.put(value, copy);
            for (String name : source.memberNames()) {
                if (!name.startsWith("@@symbol:")) {
                    copy.putMember(name, structuredClone(source.getMember(name), seen));
                }
            }
            return copy;
        }
        throw new ScriptRuntimeException(Terms.toStr(value) + " could not be cloned");
    }

    //==================================================================================================================
    // Math

    static Object mathConstant(String name) {
        switch (name) {
            case "E":
                return Math.E;
            case "LN10":
                return Math.log(10);
            case "LN2":
                return Math.log(2);
            case "LOG10E":
                return 1 / Math.log(10);
            case "LOG2E":
                return 1 / Math.log(2);
            case "PI":
                return Math.PI;
            case "SQRT1_2":
                return Math.sqrt(0.5);
            case "SQRT2":
                return Math.sqrt(2);
            default:
                return ABSENT;
        }
    }

    static Object math(Interpreter interpreter, String name, List<Object> args) {
        if (MATH_UNARY.contains(name)) {
            return Terms.narrow(unary(name, number(arg(args, 0))));
        }
        switch (name) {
            case "atan2":
                return Terms.narrow(Math.atan2(number(arg(args, 0)), number(arg(args, 1))));
            case "pow":
                return Terms.narrow(Operators.pow(number(arg(args, 0)), number(arg(args, 1))));
            case "imul":
                return (long) (Terms.toInt32(number(arg(args, 0))) * Terms.toInt32(number(arg(args, 1))));
            case "max":
            case "min": {
                boolean max = "max".equals(name);
                double result = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
                boolean nan = false;
                for (Object value : args) {
                    double d = number(value);
                    if (Double.isNaN(d)) {
                        nan = true;
                    } else if (max ? d > result || d == 0 && result == 0 && 1 / result < 0
                            : d < result || d == 0 && result == 0 && 1 / d < 0) {
                        result = d;
                    }
                }
                return nan ? Double.NaN : Terms.narrow(result);
            }
            case "hypot": {
                double sum = 0;
                boolean infinite = false;
                boolean nan = false;
                for (Object value : args) {
                    double d = number(value);
                    infinite |= Double.isInfinite(d);
                    nan |= Double.isNaN(d);
                    sum += d * d;
                }
                if (infinite) {
                    return Double.POSITIVE_INFINITY;
                }
                return nan ? Double.NaN : Terms.narrow(Math.sqrt(sum));
            }
            case "random":
                return interpreter.random.nextDouble();
            default:
                return ABSENT;
        }
    }

    private static double number(Object value) {
        if (value instanceof BigInteger) {
            throw new ScriptRuntimeException("cannot convert a BigInt value to a number");
        }
        return Terms.toNumber(value);
    }

    private static double unary(String name, double x) {
        switch (name) {
            case "abs":
                return Math.abs(x);
            case "acos":
                return Math.acos(x);
            case "acosh":
                return x < 1 ? Double.NaN : Math.log(x + Math.sqrt(x * x - 1));
            case "asin":
                return Math.asin(x);
            case "asinh":
                return x == 0 || Double.isInfinite(x) ? x : Math.log(x + Math.sqrt(x * x + 1));
            case "atan":
                return Math.atan(x);
            case "atanh":
                return x == 0 ? x : 0.5 * Math.log((1 + x) / (1 - x));
            case "cbrt":
                return Math.cbrt(x);
            case "ceil":
                return Math.ceil(x);
            case "clz32":
                return Integer.numberOfLeadingZeros((int) Terms.toUint32(x));
            case "cos":
                return Math.cos(x);
            case "cosh":
                return Math.cosh(x);
            case "exp":
                return Math.exp(x);
            case "expm1":
                return Math.expm1(x);
            case "floor":
                return Math.floor(x);
            case "fround":
                return (double) (float) x;
            case "log":
                return Math.log(x);
            case "log10":
                return Math.log10(x);
            case "log1p":
                return Math.log1p(x);
            case "log2":
                if (x > 0 && !Double.isInfinite(x) && x == Math.scalb(1.0, Math.getExponent(x))) {
                    return Math.getExponent(x);
                }
                return Math.log(x) / Math.log(2);
            case "round": {
                if (Double.isNaN(x) || Double.isInfinite(x)) {
                    return x;
                }
                double floor = Math.floor(x);
                double rounded = x - floor >= 0.5 ? floor + 1 : floor;
                return rounded == 0 && (x < 0 || 1 / x < 0) ? -0.0 : rounded;
            }
            case "sign":
                return Math.signum(x);
            case "sin":
                return Math.sin(x);
            case "sinh":
                return Math.sinh(x);
            case "sqrt":
                return Math.sqrt(x);
            case "tan":
                return Math.tan(x);
            case "tanh":
                return Math.tanh(x);
            case "trunc":
                return x < 0 ? Math.ceil(x) : Math.floor(x);
            default:
                throw new ScriptRuntimeException("unsupported Math function: " + name);
        }
    }

    //==================================================================================================================
    // Number, String, Symbol, Date

    static Object numberConstant(String name) {
        switch (name) {
            case "MAX_SAFE_INTEGER":
                return 9007199254740991L;
            case "MIN_SAFE_INTEGER":
                return -9007199254740991L;
            case "MAX_VALUE":
                return Double.MAX_VALUE;
            case "MIN_VALUE":
                return Double.MIN_VALUE;
            case "EPSILON":
                return Math.ulp(1.0);
            case "POSITIVE_INFINITY":
                return Double.POSITIVE_INFINITY;
            case "NEGATIVE_INFINITY":
                return Double.NEGATIVE_INFINITY;
            case "NaN":
                return Double.NaN;
            default:
                return ABSENT;
        }
    }

    private static final Set<String> NUMBER_STATICS = new HashSet<>(Arrays.asList(
            "isFinite", "isInteger", "isNaN", "isSafeInteger", "parseFloat", "parseInt"
    ));

    static Object numberStatic(String name, List<Object> args) {
        Object value = arg(args, 0);
        double d = Terms.isNumber(value) ? ((Number) value).doubleValue() : Double.NaN;
        switch (name) {
            case "isFinite":
                return Terms.isNumber(value) && !Double.isNaN(d) && !Double.isInfinite(d);
            case "isInteger":
                return Terms.isNumber(value) && !Double.isInfinite(d) && d == Math.floor(d);
            case "isNaN":
                return Terms.isNumber(value) && Double.isNaN(d);
            case "isSafeInteger":
                return Terms.isNumber(value) && !Double.isInfinite(d) && d == Math.floor(d)
                        && Math.abs(d) <= 9007199254740991.0;
            case "parseFloat":
                return parseFloat(Terms.toStr(value));
            case "parseInt":
                return parseInt(Terms.toStr(value), arg(args, 1));
            default:
                return ABSENT;
        }
    }

    static String fromCharCode(List<Object> args) {
        StringBuilder sb = new StringBuilder(args.size());
        for (Object code : args) {
            sb.append((char) (Terms.toUint32(Terms.toNumber(code)) & 0xFFFF));
        }
        return sb.toString();
    }

    static JsSymbol symbolFor(Interpreter interpreter, Object keyArg) {
        String key = Terms.toStr(keyArg);
        return interpreter.symbolRegistry.computeIfAbsent(key, k -> new JsSymbol(k, k));
    }

    static Object dateStatic(Interpreter interpreter, String name, List<Object> args) {
        switch (name) {
            case "now":
                return interpreter.scheduler.getNowMs();
            case "parse":
                return Terms.narrow(DateSupport.parse(Terms.toStr(arg(args, 0))));
            case "UTC":
                return Terms.narrow(DateSupport.fromFields(args));
            default:
                return ABSENT;
        }
    }

    //==================================================================================================================
    // Object, Array, Promise

    static Object objectStatic(Interpreter interpreter, String name, List<Object> args) {
        Object target = arg(args, 0);
        switch (name) {
            case "keys":
            case "values":
            case "entries": {
                checkObjectCoercible(target, name);
                List<Object> result = new ArrayList<>();
                for (String key : ownKeys(target)) {
                    Object value = Members.getIndex(interpreter, target, key);
                    if ("keys".equals(name)) {
                        result.add(key);
                    } else if ("values".equals(name)) {
                        result.add(value);
                    } else {
                        result.add(new JsArray(new ArrayList<>(Arrays.asList(key, value))));
                    }
                }
                return new JsArray(result);
            }
            case "freeze":
                if (target instanceof JsObject) {
                    ((JsObject) target).frozen = true;
                }
                return target;
            case "isFrozen":
                return !(target instanceof JsObject) || ((JsObject) target).frozen;
            case "fromEntries": {
                JsObject object = new JsObject();
                for (Object entry : Terms.arrayLikeValues(target)) {
                    if (!(entry instanceof JsArray)) {
                        throw new ScriptRuntimeException("iterator value " + Terms.toStr(entry) + " is not an entry object");
                    }
                    List<Object> pair = ((JsArray) entry).list;
                    Object key = pair.isEmpty() ? Terms.UNDEFINED : pair.get(0);
                    object.putMember(Terms.toPropertyKey(key), pair.size() > 1 ? pair.get(1) : Terms.UNDEFINED);
                }
                return object;
            }
            case "assign": {
                checkObjectCoercible(target, name);
                if (!(target instanceof JsObject)) {
                    throw new ScriptRuntimeException("Object.assign target must be an object");
                }
                JsObject object = (JsObject) target;
                for (int i = 1; i < args.size(); i++) {
                    if (!Terms.isNullish(args.get(i))) {
                        Interpreter.copyOwnMembers(args.get(i), object);
                    }
                }
                return object;
            }
            case "hasOwn":
                checkObjectCoercible(target, name);
                return Members.hasOwn(target, arg(args, 1));
            default:
                return ABSENT;
        }
    }

    private static void checkObjectCoercible(Object target, String method) {
        if (Terms.isNullish(target)) {
            throw new ScriptRuntimeException("Object." + method + " called on " + Terms.toStr(target));
        }
    }

    /**
     * Own enumerable string keys in insertion order, array indexes first.
     */
    static List<String> ownKeys(Object target) {
        List<String> keys = new ArrayList<>();
        if (target instanceof JsArray) {
            for (int i = 0; i < ((JsArray) target).list.size(); i++) {
                keys.add(String.valueOf(i));
            }
        } else if (target instanceof String) {
            for (int i = 0; i < ((String) target).length(); i++) {
                keys.add(String.valueOf(i));
            }
        } else if (target instanceof JsTypedArray) {
            for (int i = 0; i < ((JsTypedArray) target).length(); i++) {
                keys.add(String.valueOf(i));
            }
        }
        if (target instanceof JsObject) {
            for (String name : ((JsObject) target).memberNames()) {
                if (!name.startsWith("@@symbol:")) {
                    keys.add(name);
                }
            }
        }
        return keys;
    }

    static Object arrayStatic(Interpreter interpreter, String name, List<Object> args) {
        switch (name) {
            case "isArray":
                return arg(args, 0) instanceof JsArray;
            case "of":
                return new JsArray(new ArrayList<>(args));
            case "from": {
                Object source = arg(args, 0);
                Object mapper = arg(args, 1);
                List<Object> values;
                if (Terms.isNullish(source)) {
                    throw new ScriptRuntimeException(Terms.toStr(source) + " is not iterable");
                } else if (Terms.isIterable(source)) {
                    values = Terms.arrayLikeValues(source);
                } else if (source instanceof JsObject) {
                    values = arrayLike((JsObject) source, interpreter);
                } else {
                    values = new ArrayList<>();
                }
                if (mapper != Terms.UNDEFINED) {
                    if (!(mapper instanceof JsCallable)) {
                        throw new ScriptRuntimeException(Terms.toStr(mapper) + " is not a function");
                    }
                    for (int i = 0; i < values.size(); i++) {
                        values.set(i, ((JsCallable) mapper).call(interpreter, Terms.UNDEFINED,
                                Arrays.asList(values.get(i), (long) i)));
                    }
                }
                return new JsArray(values);
            }
            default:
                return ABSENT;
        }
    }

    private static List<Object> arrayLike(JsObject source, Interpreter interpreter) {
        double length = Terms.toIntegerOrInfinity(Terms.toNumber(source.getMember("length")));
        if (length > JsArrayBuffer.MAX_LENGTH) {
            throw new ScriptRuntimeException("invalid array length");
        }
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            values.add(Members.getIndex(interpreter, source, (long) i));
        }
        return values;
    }

    static Object promiseStatic(Interpreter interpreter, String name, List<Object> args) {
        Object value = arg(args, 0);
        switch (name) {
            case "resolve":
                return Promises.resolved(interpreter, value);
            case "reject":
                return Promises.rejected(interpreter, value);
            case "all":
                return Promises.all(interpreter, value);
            case "allSettled":
                return Promises.allSettled(interpreter, value);
            case "race":
                return Promises.race(interpreter, value);
            case "any":
                return Promises.any(interpreter, value);
            default:
                return ABSENT;
        }
    }

    //==================================================================================================================
    // JSON, console, document, performance

    private static Object json(Interpreter interpreter, String name, List<Object> args) {
        switch (name) {
            case "parse":
                return JsonSupport.parse(interpreter, Terms.toStr(arg(args, 0)), arg(args, 1));
            case "stringify":
                return JsonSupport.stringify(interpreter, arg(args, 0), arg(args, 1), arg(args, 2));
            default:
                return ABSENT;
        }
    }

    static String display(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof JsArray || value != null && value.getClass() == JsObject.class) {
            try {
                Object json = JsonSupport.stringify(null, value, Terms.UNDEFINED, Terms.UNDEFINED);
                return json == Terms.UNDEFINED ? Terms.toStr(value) : (String) json;
            } catch (ScriptRuntimeException e) {
                return Terms.toStr(value);
            }
        }
        return Terms.toStr(value);
    }

    static Object namespaceProperty(Interpreter interpreter, Namespace namespace, String name) {
        switch (namespace) {
            case MATH:
                return mathConstant(name);
            case DOCUMENT:
                if ("body".equals(name)) {
                    return interpreter.dom.getBody();
                }
                if ("documentElement".equals(name)) {
                    return interpreter.dom.getRoot();
                }
                return ABSENT;
            default:
                return ABSENT;
        }
    }

    static boolean isNamespaceMethod(Namespace namespace, String name) {
        switch (namespace) {
            case MATH:
                return MATH_UNARY.contains(name) || MATH_OTHER.contains(name);
            case JSON:
                return "parse".equals(name) || "stringify".equals(name);
            case CONSOLE:
                return isConsoleMethod(name);
            case DOCUMENT:
                return "getElementById".equals(name) || "querySelector".equals(name)
                        || "createElement".equals(name) || "createTextNode".equals(name);
            case PERFORMANCE:
                return "now".equals(name);
            default:
                return false;
        }
    }

    private static boolean isConsoleMethod(String name) {
        switch (name) {
            case "log":
            case "info":
            case "warn":
            case "error":
            case "debug":
                return true;
            default:
                return false;
        }
    }

    static Object callNamespace(Interpreter interpreter, Namespace namespace, String name, List<Object> args) {
        if (!isNamespaceMethod(namespace, name)) {
            return ABSENT;
        }
        switch (namespace) {
            case MATH:
                return math(interpreter, name, args);
            case JSON:
                return json(interpreter, name, args);
            case CONSOLE: {
                StringJoiner joiner = new StringJoiner(" ");
                for (Object value : args) {
                    joiner.add(display(value));
                }
                interpreter.consoleLog(joiner.toString());
                return Terms.UNDEFINED;
            }
            case DOCUMENT: {
                String value = Terms.toStr(arg(args, 0));
                switch (name) {
                    case "getElementById":
                        return interpreter.dom.getElementById(value);
                    case "querySelector":
                        return interpreter.dom.querySelector(value);
                    case "createElement":
                        return interpreter.dom.createElement(value);
                    default:
                        return interpreter.dom.createTextNode(value);
                }
            }
            case PERFORMANCE:
                return (double) interpreter.scheduler.getNowMs();
            default:
                return ABSENT;
        }
    }

    //==================================================================================================================
    // constructor statics

    static Object staticProperty(BuiltinConstructor constructor, String name) {
        if (constructor == BuiltinConstructor.NUMBER) {
            return numberConstant(name);
        }
        if (constructor.isTypedArray() && "BYTES_PER_ELEMENT".equals(name)) {
            return (long) JsTypedArray.Kind.of(constructor.jsName).bytes;
        }
        return ABSENT;
    }

    static boolean isStaticMethod(BuiltinConstructor constructor, String name) {
        switch (constructor) {
            case OBJECT:
                switch (name) {
                    case "keys":
                    case "values":
                    case "entries":
                    case "freeze":
                    case "isFrozen":
                    case "fromEntries":
                    case "assign":
                    case "hasOwn":
                        return true;
                    default:
                        return false;
                }
            case ARRAY:
                return "isArray".equals(name) || "from".equals(name) || "of".equals(name);
            case NUMBER:
                return NUMBER_STATICS.contains(name);
            case PROMISE:
                switch (name) {
                    case "resolve":
                    case "reject":
                    case "all":
                    case "allSettled":
                    case "race":
                    case "any":
                        return true;
                    default:
                        return false;
                }
            case STRING:
                return "fromCharCode".equals(name);
            case SYMBOL:
                return "for".equals(name);
            case DATE:
                return "now".equals(name) || "parse".equals(name) || "UTC".equals(name);
            case ARRAY_BUFFER:
                return "isView".equals(name);
            default:
                return false;
        }
    }

    static Object callStatic(Interpreter interpreter, BuiltinConstructor constructor, String name, List<Object> args) {
        if (!isStaticMethod(constructor, name)) {
            return ABSENT;
        }
        switch (constructor) {
            case OBJECT:
                return objectStatic(interpreter, name, args);
            case ARRAY:
                return arrayStatic(interpreter, name, args);
            case NUMBER:
                return numberStatic(name, args);
            case PROMISE:
                return promiseStatic(interpreter, name, args);
            case STRING:
                return fromCharCode(args);
            case SYMBOL:
                return symbolFor(interpreter, arg(args, 0));
            case DATE:
                return dateStatic(interpreter, name, args);
            case ARRAY_BUFFER:
                return arg(args, 0) instanceof JsTypedArray;
            default:
                return ABSENT;
        }
    }

}
