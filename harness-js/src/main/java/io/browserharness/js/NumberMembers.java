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
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

import static io.browserharness.js.Members.ABSENT;
import static io.browserharness.js.Members.arg;

/**
 * Members of the number, BigInt, boolean and symbol primitives.
 */
class NumberMembers {

    private NumberMembers() {
        // only static methods
    }

    static Object call(Object value, String name, List<Object> args) {
        if (value instanceof JsSymbol) {
            return "toString".equals(name) ? value.toString() : ABSENT;
        }
        if (value instanceof Boolean) {
            switch (name) {
                case "toString":
                    return value.toString();
                case "valueOf":
                    return value;
                default:
                    return ABSENT;
            }
        }
        if (value instanceof BigInteger) {
            switch (name) {
                case "toString":
                    return ((BigInteger) value).toString(radix(arg(args, 0)));
                case "toLocaleString":
                    return String.format("%,d", value);
                case "valueOf":
                    return value;
                default:
                    return ABSENT;
            }
        }
        double d = ((Number) value).doubleValue();
        switch (name) {
            case "toFixed":
                return toFixed(d, arg(args, 0));
            case "toPrecision":
                return toPrecision(d, arg(args, 0));
            case "toString": {
                int radix = radix(arg(args, 0));
                return radix == 10 ? Terms.toStr(value) : toRadixString(d, radix);
            }
            case "valueOf":
                return value;
            default:
                return ABSENT;
        }
    }

    static Object property(Object value, String name) {
        if (value instanceof JsSymbol && "description".equals(name)) {
            String description = ((JsSymbol) value).description;
            return description == null ? Terms.UNDEFINED : description;
        }
        return ABSENT;
    }

    private static int radix(Object arg) {
        if (arg == Terms.UNDEFINED) {
            return 10;
        }
        int radix = (int) Terms.toIntegerOrInfinity(Terms.toNumber(arg));
        if (radix < 2 || radix > 36) {
            throw new ScriptRuntimeException("toString() radix must be between 2 and 36");
        }
        return radix;
    }

    static String toFixed(double d, Object digitsArg) {
        double digits = Terms.toIntegerOrInfinity(Terms.toNumber(digitsArg));
        if (digits < 0 || digits > 100) {
            throw new ScriptRuntimeException("toFixed() digits argument must be between 0 and 100");
        }
        if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 1e21) {
            return Terms.formatNumber(d);
        }
        String result = new BigDecimal(d).setScale((int) digits, RoundingMode.HALF_UP).toPlainString();
        if (d < 0 && result.matches("-0(\\.0*)?")) {
            return result.substring(1);
        }
        return result;
    }

    private static String toPrecision(double d, Object precisionArg) {
        if (precisionArg == Terms.UNDEFINED || Double.isNaN(d) || Double.isInfinite(d)) {
            return Terms.formatNumber(d);
        }
        double precision = Terms.toIntegerOrInfinity(Terms.toNumber(precisionArg));
        if (precision < 1 || precision > 100) {
            throw new ScriptRuntimeException("toPrecision() argument must be between 1 and 100");
        }
        if (d == 0) {
            return precision == 1 ? "0" : "0." + "0".repeat((int) precision - 1);
        }
        BigDecimal rounded = new BigDecimal(d).round(new MathContext((int) precision, RoundingMode.HALF_UP));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -6 || exponent >= precision) {
            String digits = rounded.unscaledValue().abs().toString();
            digits = (digits + "0".repeat((int) precision)).substring(0, (int) precision);
            String mantissa = digits.length() > 1 ? digits.charAt(0) + "." + digits.substring(1) : digits;
            return (d < 0 ? "-" : "") + mantissa + "e" + (exponent < 0 ? "-" : "+") + Math.abs(exponent);
        }
        return rounded.setScale(Math.max(0, (int) precision - exponent - 1), RoundingMode.HALF_UP).toPlainString();
    }

    private static String toRadixString(double d, int radix) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Terms.formatNumber(d);
        }
        boolean negative = d < 0;
        double abs = Math.abs(d);
        double integral = Math.floor(abs);
        StringBuilder sb = new StringBuilder(new BigDecimal(integral).toBigInteger().toString(radix));
        double fraction = abs - integral;
        if (fraction > 0) {
            sb.append('.');
            for (int i = 0; i < 52 && fraction > 0; i++) {
                fraction *= radix;
                int digit = (int) fraction;
                sb.append(Character.forDigit(digit, radix));
                fraction -= digit;
            }
        }
        return negative ? "-" + sb : sb.toString();
    }

}
