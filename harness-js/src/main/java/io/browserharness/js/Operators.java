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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;

/**
 * Operator semantics over already-evaluated operands.
 */
class Operators {

    private Operators() {
        // only static methods
    }

    static Object binary(Interpreter interpreter, BinaryOp op, Object lhs, Object rhs) {
        switch (op) {
            case EQ:
                return Terms.looseEquals(primitiveForEquality(interpreter, lhs, rhs), primitiveForEquality(interpreter, rhs, lhs));
            case NE:
                return !Terms.looseEquals(primitiveForEquality(interpreter, lhs, rhs), primitiveForEquality(interpreter, rhs, lhs));
            case STRICT_EQ:
                return Terms.strictEquals(lhs, rhs);
            case STRICT_NE:
                return !Terms.strictEquals(lhs, rhs);
            case LT:
                return lessThan(interpreter, lhs, rhs) == Boolean.TRUE;
            case GT:
                return lessThan(interpreter, rhs, lhs) == Boolean.TRUE;
            case LE: {
                Object result = lessThan(interpreter, rhs, lhs);
                return result == Boolean.FALSE;
            }
            case GE: {
                Object result = lessThan(interpreter, lhs, rhs);
                return result == Boolean.FALSE;
            }
            case IN:
                return in(lhs, rhs);
            case INSTANCE_OF:
                return instanceOf(lhs, rhs);
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case POW:
                return arithmetic(interpreter, op, lhs, rhs);
            case BIT_AND:
            case BIT_OR:
            case BIT_XOR:
            case SHIFT_LEFT:
            case SHIFT_RIGHT:
            case UNSIGNED_SHIFT_RIGHT:
                return bitwise(interpreter, op, lhs, rhs);
            default:
                throw new ScriptRuntimeException("not a plain binary operator: " + op.text);
        }
    }

    //==================================================================================================================
    // primitives

    /**
     * ToPrimitive. Own {@code valueOf} / {@code toString} functions of a plain object are honored; dates
     * convert to their string form unless a number is asked for.
     */
    static Object toPrimitive(Interpreter interpreter, Object o, String hint) {
        if (Terms.isPrimitive(o)) {
            return o;
        }
        if (o instanceof JsDate) {
            return "number".equals(hint) ? Terms.narrow(((JsDate) o).getTime()) : o.toString();
        }
        if (o instanceof JsObject && interpreter != null) {
            JsObject object = (JsObject) o;
            String[] order = "string".equals(hint)
                    ? new String[]{"toString", "valueOf"} : new String[]{"valueOf", "toString"};
            for (String name : order) {
                Object fn = object.getMember(name);
                if (fn instanceof JsCallable) {
                    Object result = ((JsCallable) fn).call(interpreter, object, Collections.emptyList());
                    if (Terms.isPrimitive(result)) {
                        return result;
                    }
                }
            }
        }
        return Terms.toStr(o);
    }

    private static Object primitiveForEquality(Interpreter interpreter, Object value, Object other) {
        if (!Terms.isPrimitive(value) && Terms.isPrimitive(other) && !Terms.isNullish(other)) {
            return toPrimitive(interpreter, value, "default");
        }
        return value;
    }

    private static void checkNotSymbol(Object o) {
        if (o instanceof JsSymbol) {
            throw new ScriptRuntimeException("cannot convert a Symbol value to a string");
        }
    }

    //==================================================================================================================
    // addition

    static Object add(Interpreter interpreter, Object lhs, Object rhs) {
        Object l = toPrimitive(interpreter, lhs, "default");
        Object r = toPrimitive(interpreter, rhs, "default");
        if (l instanceof String || r instanceof String) {
            checkNotSymbol(l);
            checkNotSymbol(r);
            return Terms.toStr(l) + Terms.toStr(r);
        }
        if (l instanceof BigInteger && r instanceof BigInteger) {
            return ((BigInteger) l).add((BigInteger) r);
        }
        checkNoBigIntMix(l, r);
        if (l instanceof Long && r instanceof Long) {
            long a = (Long) l;
            long b = (Long) r;
            long sum = a + b;
            if (((a ^ sum) & (b ^ sum)) >= 0) {
                return sum;
            }
        }
        return Terms.narrow(Terms.toNumber(l) + Terms.toNumber(r));
    }

    private static void checkNoBigIntMix(Object l, Object r) {
        if (l instanceof BigInteger || r instanceof BigInteger) {
            throw new ScriptRuntimeException("cannot mix BigInt and other types, use explicit conversions");
        }
    }

    //==================================================================================================================
    // arithmetic

    private static Object arithmetic(Interpreter interpreter, BinaryOp op, Object lhs, Object rhs) {
        Object l = toPrimitive(interpreter, lhs, "number");
        Object r = toPrimitive(interpreter, rhs, "number");
        if (l instanceof BigInteger && r instanceof BigInteger) {
            return bigArithmetic(op, (BigInteger) l, (BigInteger) r);
        }
        checkNoBigIntMix(l, r);
        switch (op) {
            case SUB:
                return Terms.narrow(Terms.numericValue(l) - Terms.numericValue(r));
            case MOD:
                return Terms.narrow(Terms.numericValue(l) % Terms.numericValue(r));
            case MUL:
                return Terms.narrow(Terms.toNumber(l) * Terms.toNumber(r));
            case DIV:
                return Terms.narrow(Terms.toNumber(l) / Terms.toNumber(r));
            default:
                return Terms.narrow(pow(Terms.toNumber(l), Terms.toNumber(r)));
        }
    }

    static double pow(double base, double exponent) {
        if (Math.abs(base) == 1 && Double.isInfinite(exponent)) {
            return Double.NaN;
        }
        return Math.pow(base, exponent);
    }

    private static BigInteger bigArithmetic(BinaryOp op, BigInteger l, BigInteger r) {
        switch (op) {
            case SUB:
                return l.subtract(r);
            case MUL:
                return l.multiply(r);
            case DIV:
                if (r.signum() == 0) {
                    throw new ScriptRuntimeException("BigInt division by zero");
                }
                return l.divide(r);
            case MOD:
                if (r.signum() == 0) {
                    throw new ScriptRuntimeException("BigInt division by zero");
                }
                return l.remainder(r);
            default:
                if (r.signum() < 0) {
                    throw new ScriptRuntimeException("BigInt negative exponent");
                }
                if (r.bitLength() > 31) {
                    throw new ScriptRuntimeException("maximum BigInt size exceeded");
                }
                return l.pow(r.intValue());
        }
    }

    private static Object bitwise(Interpreter interpreter, BinaryOp op, Object lhs, Object rhs) {
        Object l = toPrimitive(interpreter, lhs, "number");
        Object r = toPrimitive(interpreter, rhs, "number");
        if (l instanceof BigInteger && r instanceof BigInteger) {
            BigInteger a = (BigInteger) l;
            BigInteger b = (BigInteger) r;
            switch (op) {
                case BIT_AND:
                    return a.and(b);
                case BIT_OR:
                    return a.or(b);
                case BIT_XOR:
                    return a.xor(b);
                case SHIFT_LEFT:
                    return a.shiftLeft(b.intValueExact());
                case SHIFT_RIGHT:
                    return a.shiftRight(b.intValueExact());
                default:
                    throw new ScriptRuntimeException("BigInts have no unsigned right shift, use >> instead");
            }
        }
        checkNoBigIntMix(l, r);
        int a = Terms.toInt32(Terms.numericValue(l));
        double rd = Terms.numericValue(r);
        int shift = (int) (Terms.toUint32(rd) & 0x1f);
        switch (op) {
            case BIT_AND:
                return (long) (a & Terms.toInt32(rd));
            case BIT_OR:
                return (long) (a | Terms.toInt32(rd));
            case BIT_XOR:
                return (long) (a ^ Terms.toInt32(rd));
            case SHIFT_LEFT:
                return (long) (a << shift);
            case SHIFT_RIGHT:
                return (long) (a >> shift);
            default:
                return (a & 0xffffffffL) >>> shift;
        }
    }

    //==================================================================================================================
    // unary

    static Object negate(Object value) {
        if (value instanceof Long) {
            long l = (Long) value;
            if (l == 0) {
                return -0.0;
            }
            if (l == Long.MIN_VALUE) {
                return -(double) l;
            }
            return -l;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).negate();
        }
        return Terms.narrow(-Terms.numericValue(value));
    }

    static Object plus(Object value) {
        if (value instanceof BigInteger) {
            throw new ScriptRuntimeException("cannot convert a BigInt value to a number");
        }
        return Terms.narrow(Terms.toNumber(value));
    }

    static Object bitNot(Object value) {
        if (value instanceof BigInteger) {
            return ((BigInteger) value).not();
        }
        return (long) ~Terms.toInt32(Terms.numericValue(value));
    }

    //==================================================================================================================
    // comparison

    /**
     * Abstract relational comparison: {@code TRUE} / {@code FALSE}, or {@link Terms#UNDEFINED} when
     * either side is {@code NaN}.
     */
    static Object lessThan(Interpreter interpreter, Object lhs, Object rhs) {
        Object l = toPrimitive(interpreter, lhs, "number");
        Object r = toPrimitive(interpreter, rhs, "number");
        if (l instanceof String && r instanceof String) {
            return ((String) l).compareTo((String) r) < 0;
        }
        if (l instanceof BigInteger || r instanceof BigInteger) {
            Object x = bigOrDouble(l);
            Object y = bigOrDouble(r);
            if (x instanceof BigDecimal && y instanceof BigDecimal) {
                return ((BigDecimal) x).compareTo((BigDecimal) y) < 0;
            }
            double dx = x instanceof BigDecimal ? ((BigDecimal) x).doubleValue() : (Double) x;
            double dy = y instanceof BigDecimal ? ((BigDecimal) y).doubleValue() : (Double) y;
            if (Double.isNaN(dx) || Double.isNaN(dy)) {
                return Terms.UNDEFINED;
            }
            return dx < dy;
        }
        double x = Terms.toNumber(l);
        double y = Terms.toNumber(r);
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return Terms.UNDEFINED;
        }
        return x < y;
    }

    private static Object bigOrDouble(Object o) {
        if (o instanceof BigInteger) {
            return new BigDecimal((BigInteger) o);
        }
        if (o instanceof String) {
            BigInteger parsed = Terms.parseBigInt((String) o);
            return parsed == null ? Double.NaN : new BigDecimal(parsed);
        }
        double d = Terms.toNumber(o);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return d;
        }
        return new BigDecimal(d);
    }

    static boolean in(Object key, Object target) {
        if (Terms.isPrimitive(target)) {
            throw new ScriptRuntimeException("cannot use 'in' operator to search for '"
                    + Terms.toStr(key) + "' in " + Terms.toStr(target));
        }
        if (target instanceof JsArray) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                return index < ((JsArray) target).list.size();
            }
            if ("length".equals(key)) {
                return true;
            }
        }
        if (target instanceof JsTypedArray) {
            int index = Terms.toIndex(key);
            if (index >= 0) {
                return index < ((JsTypedArray) target).length();
            }
        }
        if (target instanceof ObjectLike) {
            return ((ObjectLike) target).hasMember(Terms.toPropertyKey(key));
        }
        return false;
    }

    static boolean instanceOf(Object value, Object type) {
        if (type instanceof BuiltinConstructor) {
            return isInstance(value, (BuiltinConstructor) type);
        }
        if (type instanceof JsFunction) {
            return value instanceof JsObject && ((JsObject) value).constructedBy == type;
        }
        throw new ScriptRuntimeException("right-hand side of 'instanceof' is not callable");
    }

    static boolean isInstance(Object value, BuiltinConstructor type) {
        switch (type) {
            case OBJECT:
                return value instanceof JsObject;
            case ARRAY:
                return value instanceof JsArray;
            case FUNCTION:
                return value instanceof JsCallable;
            case DATE:
                return value instanceof JsDate;
            case REGEXP:
                return value instanceof JsRegex;
            case MAP:
                return value instanceof JsMap;
            case SET:
                return value instanceof JsSet;
            case PROMISE:
                return value instanceof JsPromise;
            case ARRAY_BUFFER:
                return value instanceof JsArrayBuffer;
            case BLOB:
                return value instanceof JsBlob;
            case URL:
                return value instanceof JsUrl;
            case URL_SEARCH_PARAMS:
                return value instanceof JsUrlSearchParams;
            case ERROR:
                return value instanceof JsError;
            case TYPE_ERROR:
            case RANGE_ERROR:
                return value instanceof JsError && ((JsError) value).getName().equals(type.jsName);
            default:
                if (type.isTypedArray()) {
                    return value instanceof JsTypedArray && ((JsTypedArray) value).kind.jsName.equals(type.jsName);
                }
                return false;
        }
    }

}
