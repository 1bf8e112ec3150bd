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
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Currency;
import java.util.Locale;

/**
 * Locale-aware formatting over {@link java.text} and {@link java.time.format}.
 */
class IntlSupport {

    private IntlSupport() {
        // only static methods
    }

    static Locale toLocale(Object value) {
        if (Terms.isNullish(value)) {
            return Locale.US;
        }
        if (value instanceof JsArray) {
            JsArray array = (JsArray) value;
            return array.list.isEmpty() ? Locale.US : toLocale(array.list.get(0));
        }
        String tag = Terms.toStr(value);
        Locale locale = Locale.forLanguageTag(tag);
        if (locale.getLanguage().isEmpty()) {
            throw new ScriptRuntimeException("incorrect locale information provided: " + tag);
        }
        return locale;
    }

    static String formatNumber(JsIntlFormatter formatter, Object value) {
        String style = formatter.option("style", "decimal");
        NumberFormat format;
        switch (style) {
            case "percent":
                format = NumberFormat.getPercentInstance(formatter.locale);
                break;
            case "currency":
                String code = formatter.option("currency", null);
                if (code == null) {
                    throw new ScriptRuntimeException("currency code is required with currency style");
                }
                format = NumberFormat.getCurrencyInstance(formatter.locale);
                try {
                    Currency currency = Currency.getInstance(code.toUpperCase(Locale.ROOT));
                    format.setCurrency(currency);
                    format.setMinimumFractionDigits(currency.getDefaultFractionDigits());
                    format.setMaximumFractionDigits(currency.getDefaultFractionDigits());
                } catch (IllegalArgumentException e) {
                    throw new ScriptRuntimeException("invalid currency code: " + code);
                }
                break;
            case "decimal":
                format = NumberFormat.getNumberInstance(formatter.locale);
                format.setMaximumFractionDigits(3);
                break;
            default:
                throw new ScriptRuntimeException("invalid style: " + style);
        }
        Integer min = formatter.intOption("minimumFractionDigits");
        Integer max = formatter.intOption("maximumFractionDigits");
        if (min != null) {
            format.setMinimumFractionDigits(min);
            if (format.getMaximumFractionDigits() < min) {
                format.setMaximumFractionDigits(min);
            }
        }
        if (max != null) {
            if (min != null && max < min) {
                throw new ScriptRuntimeException("maximumFractionDigits value is out of range");
            }
            format.setMaximumFractionDigits(max);
            if (format.getMinimumFractionDigits() > max) {
                format.setMinimumFractionDigits(max);
            }
        }
        if ("false".equals(formatter.option("useGrouping", "true"))) {
            format.setGroupingUsed(false);
        }
        if (format instanceof DecimalFormat) {
            ((DecimalFormat) format).setRoundingMode(RoundingMode.HALF_UP);
        }
        if (value instanceof BigInteger) {
            return format.format(value);
        }
        double d = Terms.toNumber(value);
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "\u221e" : "-\u221e";
        }
        return format.format(d);
    }

    static String formatDate(JsIntlFormatter formatter, Object value) {
        double time = value == Terms.UNDEFINED ? Double.NaN : value instanceof JsDate
                ? ((JsDate) value).getTime() : Terms.toNumber(value);
        if (Double.isNaN(time)) {
            throw new ScriptRuntimeException("invalid time value");
        }
        ZoneId zone = ZoneOffset.UTC;
        String timeZone = formatter.option("timeZone", null);
        if (timeZone != null) {
            try {
                zone = ZoneId.of(timeZone);
            } catch (RuntimeException e) {
                throw new ScriptRuntimeException("invalid time zone: " + timeZone);
            }
        }
        String dateStyle = formatter.option("dateStyle", null);
        String timeStyle = formatter.option("timeStyle", null);
        DateTimeFormatter dtf;
        if (dateStyle != null && timeStyle != null) {
            dtf = DateTimeFormatter.ofLocalizedDateTime(formatStyle(dateStyle), formatStyle(timeStyle));
        } else if (dateStyle != null) {
            dtf = DateTimeFormatter.ofLocalizedDate(formatStyle(dateStyle));
        } else if (timeStyle != null) {
            dtf = DateTimeFormatter.ofLocalizedTime(formatStyle(timeStyle));
        } else if (formatter.locale.getLanguage().equals("en") && "US".equals(formatter.locale.getCountry())) {
            dtf = DateTimeFormatter.ofPattern("M/d/yyyy");
        } else {
            dtf = DateTimeFormatter.ofLocalizedDate(FormatStyle.SHORT);
        }
        return dtf.withLocale(formatter.locale).withZone(zone).format(Instant.ofEpochMilli((long) time));
    }

    private static FormatStyle formatStyle(String style) {
        switch (style) {
            case "full":
                return FormatStyle.FULL;
            case "long":
                return FormatStyle.LONG;
            case "medium":
                return FormatStyle.MEDIUM;
            case "short":
                return FormatStyle.SHORT;
            default:
                throw new ScriptRuntimeException("invalid style: " + style);
        }
    }

}
