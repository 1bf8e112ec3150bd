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

import java.util.Locale;

/**
 * {@code Intl.NumberFormat} or {@code Intl.DateTimeFormat} instance; formatting is done by
 * {@link IntlSupport}.
 */
public class JsIntlFormatter extends JsObject {

    final boolean dateTime;
    final Locale locale;
    final JsObject options;

    JsIntlFormatter(boolean dateTime, Locale locale, JsObject options) {
        this.dateTime = dateTime;
        this.locale = locale;
        this.options = options;
    }

    String format(Object value) {
        return dateTime ? IntlSupport.formatDate(this, value) : IntlSupport.formatNumber(this, value);
    }

    String option(String name, String defaultValue) {
        Object value = options.getMember(name);
        return value == Terms.UNDEFINED ? defaultValue : Terms.toStr(value);
    }

    Integer intOption(String name) {
        Object value = options.getMember(name);
        if (value == Terms.UNDEFINED) {
            return null;
        }
        double d = Terms.toNumber(value);
        if (Double.isNaN(d) || d < 0 || d > 100) {
            throw new ScriptRuntimeException(name + " value is out of range");
        }
        return (int) d;
    }

    @Override
    public String toString() {
        return dateTime ? "[object Intl.DateTimeFormat]" : "[object Intl.NumberFormat]";
    }

}
