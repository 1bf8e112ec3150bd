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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Value coercions. Numbers are {@link Long} or {@link Double}, BigInt is {@link BigInteger}, and
 * {@link #UNDEFINED} stands for JS {@code undefined}.
 */
public class Terms {

    private Terms() {
        // only static methods
    }

    public static final Object UNDEFINED = new Object() {
        @Override
        public String toString() {
            return "undefined";
        }
    };

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern RADIX_DIGITS = Pattern.compile("[0-9a-zA-Z]+");

    private static final double LONG_MIN = -9.223372036854775808E18;
    private static final double LONG_MAX = 9.223372036854775807E18;

    public static Object narrow(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && d >= LONG_MIN && d < LONG_MAX) {
            if (d == 0 && 1 / d < 0) {
                return d;
            }
            return (long) d;
        }
        return d;
    }

    static boolean isNumber(Object o) {
        return o instanceof Number && !(o instanceof BigInteger);
    }

    static boolean isNullish(Object o) {
        return o == null || o == UNDEFINED;
    }

    static boolean isTruthy(Object o) {
        if (o == null || o == UNDEFINED) {
            return false;
        }
        if (o instanceof Boolean) {
            return (Boolean) o;
        }
        if (o instanceof BigInteger) {
            return ((BigInteger) o).signum() != 0;
        }
        if (o instanceof Number) {
            double d = ((Number) o).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (o instanceof String) {
            return !((String) o).isEmpty();
        }
        return true;
    }

    public static String typeOf(Object o) {
        if (o == UNDEFINED) {
            return "undefined";
        }
        if (o == null) {
            return "object";
        }
        if (o instanceof String) {
            return "string";
        }
        if (o instanceof Boolean) {
            return "boolean";
        }
        if (o instanceof BigInteger) {
            return "bigint";
        }
        if (o instanceof Number) {
            return "number";
        }
        if (o instanceof JsSymbol) {
            return "symbol";
        }
        if (o instanceof JsCallable || o instanceof BuiltinConstructor) {
            return "function";
        }
        return "object";
    }

    //==================================================================================================================
    // to string

    public static String toStr(Object o) {
        if (o == null) {
            return "null";
        }
        if (o instanceof String) {
            return (String) o;
        }
        if (o instanceof Double || o instanceof Float) {
            return formatNumber(((Number) o).doubleValue());
        }
        if (o instanceof JsArray) {
            return join(((JsArray) o).list, ",");
        }
        return o.toString();
    }

    static String join(List<Object> list, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            Object item = list.get(i);
            if (!isNullish(item)) {
                sb.append(toStr(item));
            }
        }
        return sb.toString();
    }

    /**
     * Number to string as JS prints it: integral values without a fraction, and exponent form outside
     * {@code [1e-7, 1e21)}.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0) {
            return "0";
        }
        String sign = d < 0 ? "-" : "";
        BigDecimal bd = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
        String digits = bd.unscaledValue().toString();
        int k = digits.length();
        int n = k - bd.scale();
        StringBuilder sb = new StringBuilder(sign);
        if (k <= n && n <= 21) {
            sb.append(digits);
            for (int i = 0; i < n - k; i++) {
                sb.append('0');
            }
        } else if (0 < n && n <= 21) {
            sb.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (-6 < n && n <= 0) {
            sb.append("0.");
            for (int i = 0; i < -n; i++) {
                sb.append('0');
            }
            sb.append(digits);
        } else {
            int e = n - 1;
            sb.append(digits.charAt(0));
            if (k > 1) {
                sb.append('.').append(digits, 1, k);
            }
            sb.append('e').append(e < 0 ? '-' : '+').append(Math.abs(e));
        }
        return sb.toString();
    }

    //==================================================================================================================
    // to number

    /**
     * ToNumber, as used by {@code Number()}, unary plus, multiplication, division, exponent, comparison
     * and loose equality.
     */
    static double toNumber(Object o) {
        if (o instanceof BigInteger) {
            return ((BigInteger) o).doubleValue();
        }
        if (o instanceof Number) {
            return ((Number) o).doubleValue();
        }
        if (o == null) {
            return 0;
        }
        if (o == UNDEFINED) {
            return Double.NaN;
        }
        if (o instanceof Boolean) {
            return (Boolean) o ? 1 : 0;
        }
        if (o instanceof String) {
            return parseJsNumber((String) o);
        }
        if (o instanceof JsDate) {
            return ((JsDate) o).getTime();
        }
        if (o instanceof JsSymbol) {
            throw new ScriptRuntimeException("cannot convert a Symbol value to a number");
        }
        if (o instanceof JsArray) {
            return parseJsNumber(toStr(o));
        }
        return Double.NaN;
    }

    /**
     * Operator coercion for unary minus, binary minus, remainder and the bitwise operators. Anything
     * that is not already numeric goes through its string form, and an unparsable string yields zero.
     */
    static double numericValue(Object o) {
        if (o instanceof Number) {
            return ((Number) o).doubleValue();
        }
        if (o instanceof JsDate) {
            return ((JsDate) o).getTime();
        }
        if (o == null) {
            return 0;
        }
        if (o == UNDEFINED) {
            return Double.NaN;
        }
        if (o instanceof JsSymbol) {
            throw new ScriptRuntimeException("cannot convert a Symbol value to a number");
        }
        return parseFloatOrZero(toStr(o));
    }

    private static double parseFloatOrZero(String s) {
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        String lower = s.toLowerCase();
        boolean negative = lower.startsWith("-");
        if (negative || lower.startsWith("+")) {
            lower = lower.substring(1);
        }
        switch (lower) {
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                return 0;
        }
    }

    static double parseJsNumber(String s) {
        String t = trim(s);
        if (t.isEmpty()) {
            return 0;
        }
        switch (t) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
        }
        if (t.length() > 2 && t.charAt(0) == '0') {
            int radix = radixOf(t.charAt(1));
            if (radix > 0) {
                String digits = t.substring(2);
                if (!RADIX_DIGITS.matcher(digits).matches()) {
                    return Double.NaN;
                }
                try {
                    return new BigInteger(digits, radix).doubleValue();
                } catch (NumberFormatException e) {
                    return Double.NaN;
                }
            }
        }
        if (!DECIMAL.matcher(t).matches()) {
            return Double.NaN;
        }
        return Double.parseDouble(t);
    }

    static int radixOf(char c) {
        switch (c) {
            case 'x':
            case 'X':
                return 16;
            case 'o':
            case 'O':
                return 8;
            case 'b':
            case 'B':
                return 2;
            default:
                return 0;
        }
    }

    static boolean isJsWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }

    static String trim(String s) {
        return trimEnd(trimStart(s));
    }

    static String trimStart(String s) {
        int i = 0;
        while (i < s.length() && isJsWhitespace(s.charAt(i))) {
            i++;
        }
        return s.substring(i);
    }

    static String trimEnd(String s) {
        int i = s.length();
        while (i > 0 && isJsWhitespace(s.charAt(i - 1))) {
            i--;
        }
        return s.substring(0, i);
    }

    static int toInt32(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return 0;
        }
        double m = (d < 0 ? Math.ceil(d) : Math.floor(d)) % 4294967296.0;
        return (int) (long) m;
    }

    static long toUint32(double d) {
        return toInt32(d) & 0xffffffffL;
    }

    static double toIntegerOrInfinity(double d) {
        if (Double.isNaN(d)) {
            return 0;
        }
        return d < 0 ? Math.ceil(d) : Math.floor(d);
    }

    /**
     * Relative index argument as used by {@code slice}, {@code at} and friends, clamped to {@code [0, length]}.
     */
    static int relativeIndex(Object arg, int length, int defaultValue) {
        if (arg == UNDEFINED) {
            return defaultValue;
        }
        double d = toIntegerOrInfinity(toNumber(arg));
        if (d < 0) {
            return (int) Math.max(0, length + d);
        }
        return (int) Math.min(d, length);
    }

    static BigInteger toBigInt(Object o) {
        if (o instanceof BigInteger) {
            return (BigInteger) o;
        }
        if (o instanceof Boolean) {
            return (Boolean) o ? BigInteger.ONE : BigInteger.ZERO;
        }
        if (o instanceof Number) {
            double d = ((Number) o).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                throw new ScriptRuntimeException("cannot convert " + formatNumber(d) + " to a BigInt");
            }
            return o instanceof Long ? BigInteger.valueOf((Long) o) : new BigDecimal(d).toBigInteger();
        }
        if (o instanceof String) {
            BigInteger parsed = parseBigInt((String) o);
            if (parsed == null) {
                throw new ScriptRuntimeException("cannot convert " + o + " to a BigInt");
            }
            return parsed;
        }
        throw new ScriptRuntimeException("cannot convert " + toStr(o) + " to a BigInt");
    }

    static BigInteger parseBigInt(String s) {
        String t = trim(s);
        if (t.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            if (t.length() > 2 && t.charAt(0) == '0' && radixOf(t.charAt(1)) > 0) {
                String digits = t.substring(2);
                return RADIX_DIGITS.matcher(digits).matches() ? new BigInteger(digits, radixOf(t.charAt(1))) : null;
            }
            return new BigInteger(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    //==================================================================================================================
    // equality

    static boolean strictEquals(Object lhs, Object rhs) {
        if (isNumber(lhs) && isNumber(rhs)) {
            return ((Number) lhs).doubleValue() == ((Number) rhs).doubleValue();
        }
        if (lhs == rhs) {
            return true;
        }
        if (lhs == null || rhs == null) {
            return false;
        }
        if (lhs instanceof String || lhs instanceof Boolean || lhs instanceof BigInteger) {
            return lhs.equals(rhs);
        }
        return false;
    }

    static boolean sameValueZero(Object lhs, Object rhs) {
        if (isNumber(lhs) && isNumber(rhs)) {
            double l = ((Number) lhs).doubleValue();
            double r = ((Number) rhs).doubleValue();
            return l == r || Double.isNaN(l) && Double.isNaN(r);
        }
        return strictEquals(lhs, rhs);
    }

    static boolean looseEquals(Object lhs, Object rhs) {
        if (isNullish(lhs) || isNullish(rhs)) {
            return isNullish(lhs) && isNullish(rhs);
        }
        if (sameKind(lhs, rhs)) {
            return strictEquals(lhs, rhs);
        }
        if (lhs instanceof Boolean) {
            return looseEquals(narrow(toNumber(lhs)), rhs);
        }
        if (rhs instanceof Boolean) {
            return looseEquals(lhs, narrow(toNumber(rhs)));
        }
        if (lhs instanceof BigInteger || rhs instanceof BigInteger) {
            BigInteger big = (BigInteger) (lhs instanceof BigInteger ? lhs : rhs);
            Object other = lhs instanceof BigInteger ? rhs : lhs;
            if (other instanceof String) {
                BigInteger parsed = parseBigInt((String) other);
                return parsed != null && parsed.equals(big);
            }
            if (isNumber(other)) {
                double d = ((Number) other).doubleValue();
                return !Double.isNaN(d) && !Double.isInfinite(d) && new BigDecimal(big).compareTo(new BigDecimal(d)) == 0;
            }
        }
        if (isNumber(lhs) && rhs instanceof String || lhs instanceof String && isNumber(rhs)) {
            return toNumber(lhs) == toNumber(rhs);
        }
        if (isPrimitive(lhs) && !isPrimitive(rhs)) {
            return !(rhs instanceof JsSymbol) && looseEquals(lhs, toPrimitive(rhs));
        }
        if (!isPrimitive(lhs) && isPrimitive(rhs)) {
            return !(lhs instanceof JsSymbol) && looseEquals(toPrimitive(lhs), rhs);
        }
        return false;
    }

    private static boolean sameKind(Object lhs, Object rhs) {
        if (isNumber(lhs)) {
            return isNumber(rhs);
        }
        if (isPrimitive(lhs) && isPrimitive(rhs)) {
            return lhs.getClass() == rhs.getClass();
        }
        return !isPrimitive(lhs) && !isPrimitive(rhs);
    }

    static boolean isPrimitive(Object o) {
        return o == null || o == UNDEFINED || o instanceof String || o instanceof Number
                || o instanceof Boolean || o instanceof JsSymbol;
    }

    /**
     * Default-hint conversion of a container to a primitive, used where no script function can be
     * invoked. Dates become their string form.
     */
    static Object toPrimitive(Object o) {
        if (isPrimitive(o)) {
            return o;
        }
        return toStr(o);
    }

    //==================================================================================================================
    // conversions

    /**
     * Values of an iterable, as spread, {@code for...of} and {@code Array.from} see them.
     */
    static List<Object> arrayLikeValues(Object o) {
        if (o instanceof JsArray) {
            return new ArrayList<>(((JsArray) o).list);
        }
        if (o instanceof String) {
            String s = (String) o;
            List<Object> list = new ArrayList<>();
            s.codePoints().forEach(cp -> list.add(new String(Character.toChars(cp))));
            return list;
        }
        if (o instanceof JsIterable) {
            return ((JsIterable) o).values();
        }
        throw new ScriptRuntimeException(toStr(o) + " is not iterable");
    }

    static boolean isIterable(Object o) {
        return o instanceof JsArray || o instanceof String || o instanceof JsIterable;
    }

    /**
     * Property key for a computed member access. Integral numbers print without a fraction.
     */
    static String toPropertyKey(Object key) {
        if (key instanceof Double) {
            return toStr(narrow((Double) key));
        }
        if (key instanceof JsSymbol) {
            return ((JsSymbol) key).key();
        }
        return toStr(key);
    }

    /**
     * Array index of a member key, or -1 when the key is not a canonical non-negative integer.
     */
    static int toIndex(Object key) {
        if (key instanceof Long) {
            long l = (Long) key;
            return l >= 0 && l < Integer.MAX_VALUE ? (int) l : -1;
        }
        if (key instanceof Double) {
            Object n = narrow((Double) key);
            return n instanceof Long ? toIndex(n) : -1;
        }
        if (key instanceof String) {
            String s = (String) key;
            if (s.isEmpty() || s.length() > 9 || s.length() > 1 && s.charAt(0) == '0') {
                return -1;
            }
            for (int i = 0; i < s.length(); i++) {
                if (!Character.isDigit(s.charAt(i))) {
                    return -1;
                }
            }
            return Integer.parseInt(s);
        }
        return -1;
    }

    /**
     * Java host values to script values: boxed integers widen to {@link Long}, maps and lists become
     * {@link JsObject} and {@link JsArray}.
     */
    @SuppressWarnings("unchecked")
    public static Object fromJava(Object o) {
        if (o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return ((Number) o).longValue();
        }
        if (o instanceof Float) {
            return narrow(((Float) o).doubleValue());
        }
        if (o instanceof Map) {
            JsObject object = new JsObject();
            ((Map<Object, Object>) o).forEach((k, v) -> object.putMember(String.valueOf(k), fromJava(v)));
            return object;
        }
        if (o instanceof List) {
            JsArray array = new JsArray();
            for (Object item : (List<Object>) o) {
                array.list.add(fromJava(item));
            }
            return array;
        }
        return o;
    }

}
