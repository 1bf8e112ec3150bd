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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Epoch conversions behind {@code new Date(..)}, {@code Date.parse} and {@code Date.UTC}.
 */
class DateSupport {

    private DateSupport() {
        // only static methods
    }

    static final double MAX_TIME = 8.64e15;

    private static final DateTimeFormatter ISO_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter DISPLAY_FORMATTER =
            DateTimeFormatter.ofPattern("EEE MMM dd yyyy HH:mm:ss 'GMT+0000 (Coordinated Universal Time)'", Locale.US)
                    .withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter UTC_STRING_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    static double timeClip(double time) {
        if (Double.isNaN(time) || Double.isInfinite(time) || Math.abs(time) > MAX_TIME) {
            return Double.NaN;
        }
        return time < 0 ? Math.ceil(time) : Math.floor(time);
    }

    /**
     * Parses the ISO forms and falls back to {@code NaN}. Date-only strings are UTC, date-time strings
     * without an offset are read in the harness zone, which is also UTC.
     */
    static double parse(String text) {
        String s = Terms.trim(text);
        if (s.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Instant.parse(s).toEpochMilli();
        } catch (DateTimeParseException e) {
            // next form
        }
        try {
            return OffsetDateTime.parse(s).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            // next form
        }
        try {
            if (s.indexOf('T') > 0) {
                return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC).toEpochMilli();
            }
        } catch (DateTimeParseException e) {
            // next form
        }
        try {
            return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            // next form
        }
        try {
            return ZonedDateTime.parse(s, UTC_STRING_FORMATTER).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return Double.NaN;
        }
    }

    /**
     * Milliseconds from calendar fields, month zero-based, as {@code Date.UTC} and the multi-argument
     * constructor take them. Missing trailing fields default to the first day at midnight.
     */
    static double fromFields(List<Object> args) {
        double[] fields = {Double.NaN, 0, 1, 0, 0, 0, 0};
        for (int i = 0; i < fields.length && i < args.size(); i++) {
            fields[i] = Terms.toNumber(args.get(i));
        }
        for (double field : fields) {
            if (Double.isNaN(field) || Double.isInfinite(field)) {
                return Double.NaN;
            }
        }
        long year = (long) fields[0];
        if (year >= 0 && year <= 99) {
            year += 1900;
        }
        long month = (long) fields[1];
        try {
            LocalDateTime ldt = LocalDateTime.of((int) (year + Math.floorDiv(month, 12)), (int) Math.floorMod(month, 12) + 1, 1, 0, 0)
                    .plusDays((long) fields[2] - 1)
                    .plusHours((long) fields[3])
                    .plusMinutes((long) fields[4])
                    .plusSeconds((long) fields[5]);
            return timeClip(ldt.toInstant(ZoneOffset.UTC).toEpochMilli() + (long) fields[6]);
        } catch (DateTimeException | ArithmeticException e) {
            return Double.NaN;
        }
    }

    static String toIsoString(JsDate date) {
        if (!date.isValid()) {
            throw new ScriptRuntimeException("invalid time value");
        }
        return ISO_FORMATTER.format(Instant.ofEpochMilli((long) date.getTime()));
    }

    static String toDisplayString(JsDate date) {
        return DISPLAY_FORMATTER.format(Instant.ofEpochMilli((long) date.getTime()));
    }

    static String toUtcString(JsDate date) {
        if (!date.isValid()) {
            return "Invalid Date";
        }
        return UTC_STRING_FORMATTER.format(Instant.ofEpochMilli((long) date.getTime()));
    }

}
