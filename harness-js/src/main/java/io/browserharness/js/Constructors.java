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

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static io.browserharness.js.Members.arg;

/**
 * {@code new} for the builtin constructors and for script functions, plus the builtins that are also
 * callable without {@code new} ({@code Number(..)}, {@code String(..)}, {@code Error(..)} and so on).
 */
class Constructors {

    private Constructors() {
        // only static methods
    }

    static Object evaluate(Interpreter interpreter, Expr expr, List<Object> args) {
        switch (expr.type) {
            case REGEX_NEW:
                return construct(interpreter, BuiltinConstructor.REGEXP, args);
            case NEW_DATE:
                return construct(interpreter, BuiltinConstructor.DATE, args);
            case NEW_MAP:
                return construct(interpreter, BuiltinConstructor.MAP, args);
            case NEW_SET:
                return construct(interpreter, BuiltinConstructor.SET, args);
            case NEW_PROMISE:
                return construct(interpreter, BuiltinConstructor.PROMISE, args);
            case NEW_ARRAY_BUFFER:
                return construct(interpreter, BuiltinConstructor.ARRAY_BUFFER, args);
            case NEW_BLOB:
                return construct(interpreter, BuiltinConstructor.BLOB, args);
            case NEW_URL:
                return construct(interpreter, BuiltinConstructor.URL, args);
            case NEW_URL_SEARCH_PARAMS:
                return construct(interpreter, BuiltinConstructor.URL_SEARCH_PARAMS, args);
            case NEW_TYPED_ARRAY:
                return typedArray(interpreter, JsTypedArray.Kind.of(expr.name), args);
            case NEW_ERROR:
                return error(expr.name, args);
            case NEW_INTL: {
                Object options = arg(args, 1);
                return new JsIntlFormatter("DateTimeFormat".equals(expr.name), IntlSupport.toLocale(arg(args, 0)),
                        options instanceof JsObject ? (JsObject) options : new JsObject());
            }
            default:
                throw new ScriptRuntimeException("unsupported constructor expression: " + expr.type);
        }
    }

    static Object construct(Interpreter interpreter, BuiltinConstructor constructor, List<Object> args) {
        Object first = arg(args, 0);
        switch (constructor) {
            case OBJECT:
                return first instanceof JsObject ? first : new JsObject();
            case ARRAY:
                return array(args);
            case STRING:
            case NUMBER:
            case BOOLEAN:
                // primitive wrappers are not modeled, the converted primitive stands in
                return callAsFunction(interpreter, constructor, args);
            case DATE:
                return date(interpreter, args);
            case REGEXP:
                return regex(first, arg(args, 1));
            case MAP: {
                JsMap map = new JsMap();
                if (!Terms.isNullish(first)) {
                    for (Object entry : Terms.arrayLikeValues(first)) {
                        if (!(entry instanceof JsArray)) {
                            throw new ScriptRuntimeException("iterator value " + Terms.toStr(entry) + " is not an entry object");
                        }
                        JsArray pair = (JsArray) entry;
                        map.set(pair.get(0), pair.get(1));
                    }
                }
                return map;
            }
            case SET: {
                JsSet set = new JsSet();
                if (!Terms.isNullish(first)) {
                    for (Object value : Terms.arrayLikeValues(first)) {
                        set.add(value);
                    }
                }
                return set;
            }
            case PROMISE:
                return Promises.construct(interpreter, first);
            case ARRAY_BUFFER: {
                int length = toLength(first, "array buffer");
                Object options = arg(args, 1);
                Integer max = null;
                if (options instanceof JsObject) {
                    Object maxValue = ((JsObject) options).getMember("maxByteLength");
                    if (maxValue != Terms.UNDEFINED) {
                        max = toLength(maxValue, "array buffer max");
                    }
                }
                return new JsArrayBuffer(length, max);
            }
            case BLOB:
                return blob(first, arg(args, 1));
            case URL: {
                Object base = arg(args, 1);
                return new JsUrl(Terms.toStr(first), base == Terms.UNDEFINED ? null : Terms.toStr(base));
            }
            case URL_SEARCH_PARAMS:
                return searchParams(first);
            case ERROR:
            case TYPE_ERROR:
            case RANGE_ERROR:
                return error(constructor.jsName, args);
            default:
                if (constructor.isTypedArray()) {
                    return typedArray(interpreter, JsTypedArray.Kind.of(constructor.jsName), args);
                }
                throw new ScriptRuntimeException(constructor.jsName + " is not a constructor");
        }
    }

    static Object callAsFunction(Interpreter interpreter, BuiltinConstructor constructor, List<Object> args) {
        Object first = arg(args, 0);
        switch (constructor) {
            case NUMBER: {
                if (args.isEmpty()) {
                    return 0L;
                }
                Object primitive = Operators.toPrimitive(interpreter, first, "number");
                if (primitive instanceof BigInteger) {
                    return Terms.narrow(((BigInteger) primitive).doubleValue());
                }
                return Terms.narrow(Terms.toNumber(primitive));
            }
            case STRING:
                if (args.isEmpty()) {
                    return "";
                }
                if (first instanceof JsSymbol) {
                    return first.toString();
                }
                return Terms.toStr(Operators.toPrimitive(interpreter, first, "string"));
            case BOOLEAN:
                return Terms.isTruthy(first);
            case BIGINT: {
                Object primitive = Operators.toPrimitive(interpreter, first, "number");
                if (Terms.isNumber(primitive)) {
                    double d = ((Number) primitive).doubleValue();
                    if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                        throw new ScriptRuntimeException("The number " + Terms.formatNumber(d)
                                + " cannot be converted to a BigInt because it is not an integer");
                    }
                }
                return Terms.toBigInt(primitive);
            }
            case SYMBOL:
                return new JsSymbol(first == Terms.UNDEFINED ? null : Terms.toStr(first), null);
            case OBJECT:
                return Terms.isNullish(first) ? new JsObject() : first;
            case ARRAY:
            case ERROR:
            case TYPE_ERROR:
            case RANGE_ERROR:
                return construct(interpreter, constructor, args);
            case REGEXP:
                if (first instanceof JsRegex && arg(args, 1) == Terms.UNDEFINED) {
                    return first;
                }
                return construct(interpreter, constructor, args);
            case DATE:
                return DateSupport.toDisplayString(new JsDate(interpreter.scheduler.getNowMs()));
            default:
                throw new ScriptRuntimeException("Constructor " + constructor.jsName + " requires 'new'");
        }
    }

    /**
     * {@code new f(..)} for a script function: the new object records its constructor for
     * {@code instanceof}, and an object returned by the body replaces it.
     */
    static Object constructFunction(Interpreter interpreter, JsFunction fn, List<Object> args) {
        JsObject object = new JsObject();
        object.constructedBy = fn;
        Object result = Executor.callFunction(interpreter, fn, object, args);
        return result instanceof JsObject ? result : object;
    }

    //==================================================================================================================
    // helpers

    private static int toLength(Object value, String what) {
        double d = Terms.toIntegerOrInfinity(Terms.toNumber(value));
        if (d < 0 || d > JsArrayBuffer.MAX_LENGTH) {
            throw new ScriptRuntimeException("invalid " + what + " length: " + Terms.toStr(value));
        }
        return (int) d;
    }

    private static JsArray array(List<Object> args) {
        if (args.size() == 1 && Terms.isNumber(args.get(0))) {
            double d = ((Number) args.get(0)).doubleValue();
            if (d < 0 || d != Math.floor(d) || d > JsArrayBuffer.MAX_LENGTH) {
                throw new ScriptRuntimeException("invalid array length");
            }
            return new JsArray(new ArrayList<>(Collections.nCopies((int) d, Terms.UNDEFINED)));
        }
        return new JsArray(new ArrayList<>(args));
    }

    private static JsDate date(Interpreter interpreter, List<Object> args) {
        if (args.isEmpty()) {
            return new JsDate(interpreter.scheduler.getNowMs());
        }
        if (args.size() > 1) {
            return new JsDate(DateSupport.fromFields(args));
        }
        Object value = args.get(0);
        if (value instanceof JsDate) {
            return new JsDate(((JsDate) value).getTime());
        }
        Object primitive = Operators.toPrimitive(interpreter, value, "default");
        if (primitive instanceof String) {
            return new JsDate(DateSupport.parse((String) primitive));
        }
        return new JsDate(DateSupport.timeClip(Terms.toNumber(primitive)));
    }

    private static JsRegex regex(Object pattern, Object flags) {
        if (pattern instanceof JsRegex) {
            JsRegex source = (JsRegex) pattern;
            return new JsRegex(source.source, flags == Terms.UNDEFINED ? source.flags : Terms.toStr(flags));
        }
        String source = pattern == Terms.UNDEFINED ? "(?:)" : Terms.toStr(pattern);
        return new JsRegex(source, flags == Terms.UNDEFINED ? "" : Terms.toStr(flags));
    }

    static JsError error(String name, List<Object> args) {
        Object message = arg(args, 0);
        JsError error = new JsError(name, message == Terms.UNDEFINED ? "" : Terms.toStr(message));
        Object options = arg(args, 1);
        if (options instanceof JsObject && ((JsObject) options).hasMember("cause")) {
            error.putMember("cause", ((JsObject) options).getMember("cause"));
        }
        return error;
    }

    private static JsTypedArray typedArray(Interpreter interpreter, JsTypedArray.Kind kind, List<Object> args) {
        Object first = arg(args, 0);
        if (first == Terms.UNDEFINED || first == null) {
            return new JsTypedArray(kind, 0);
        }
        if (Terms.isNumber(first)) {
            return new JsTypedArray(kind, toLength(first, "typed array"));
        }
        if (first instanceof JsArrayBuffer) {
            JsArrayBuffer buffer = (JsArrayBuffer) first;
            Object offset = arg(args, 1);
            Object length = arg(args, 2);
            return new JsTypedArray(kind, buffer,
                    offset == Terms.UNDEFINED ? 0 : toLength(offset, "typed array offset"),
                    length == Terms.UNDEFINED ? null : toLength(length, "typed array"));
        }
        List<Object> values;
        if (Terms.isIterable(first)) {
            values = Terms.arrayLikeValues(first);
        } else if (first instanceof JsObject) {
            values = Terms.arrayLikeValues(Builtins.arrayStatic(interpreter, "from", Collections.singletonList(first)));
        } else {
            values = Collections.emptyList();
        }
        JsTypedArray array = new JsTypedArray(kind, values.size());
        for (int i = 0; i < values.size(); i++) {
            array.set(i, values.get(i));
        }
        return array;
    }

    private static JsBlob blob(Object parts, Object options) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!Terms.isNullish(parts)) {
            for (Object part : Terms.arrayLikeValues(parts)) {
                byte[] bytes;
                if (part instanceof JsArrayBuffer) {
                    JsArrayBuffer buffer = (JsArrayBuffer) part;
                    bytes = buffer.copyBytes(0, buffer.getByteLength());
                } else if (part instanceof JsTypedArray) {
                    JsTypedArray view = (JsTypedArray) part;
                    bytes = view.buffer.copyBytes(view.byteOffset, view.byteOffset + view.byteLength());
                } else if (part instanceof JsBlob) {
                    bytes = ((JsBlob) part).bytes;
                } else {
                    bytes = Terms.toStr(part).getBytes(StandardCharsets.UTF_8);
                }
                out.write(bytes, 0, bytes.length);
            }
        }
        String type = "";
        if (options instanceof JsObject) {
            Object value = ((JsObject) options).getMember("type");
            if (value != Terms.UNDEFINED) {
                type = Terms.toStr(value).toLowerCase(Locale.ROOT);
            }
        }
        return new JsBlob(out.toByteArray(), type);
    }

    private static JsUrlSearchParams searchParams(Object init) {
        JsUrlSearchParams params = new JsUrlSearchParams();
        if (Terms.isNullish(init)) {
            return params;
        }
        if (init instanceof JsUrlSearchParams) {
            for (String[] pair : ((JsUrlSearchParams) init).pairs) {
                params.pairs.add(new String[]{pair[0], pair[1]});
            }
        } else if (init instanceof JsArray) {
            for (Object entry : ((JsArray) init).list) {
                List<Object> pair = Terms.arrayLikeValues(entry);
                if (pair.size() != 2) {
                    throw new ScriptRuntimeException("each query pair must be an iterable [name, value] tuple");
                }
                params.pairs.add(new String[]{Terms.toStr(pair.get(0)), Terms.toStr(pair.get(1))});
            }
        } else if (init instanceof JsObject) {
            JsObject object = (JsObject) init;
            for (String name : object.memberNames()) {
                params.pairs.add(new String[]{name, Terms.toStr(object.getMember(name))});
            }
        } else {
            params.parse(Terms.toStr(init));
        }
        return params;
    }

}
