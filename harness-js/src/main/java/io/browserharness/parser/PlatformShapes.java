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
package io.browserharness.parser;

import java.util.List;
import java.util.Set;

/**
 * Timer, microtask, DOM and event forms that talk to the host rather than to the value model.
 */
class PlatformShapes {

    private PlatformShapes() {
        // only static methods
    }

    static final Set<String> EVENT_PROPS = Set.of(
            "type", "target", "currentTarget", "target.name", "currentTarget.name", "target.id", "currentTarget.id",
            "defaultPrevented", "isTrusted", "bubbles", "cancelable", "eventPhase", "timeStamp"
    );

    static Expr recognize(String s) {
        if (!Idents.isIdentStart(s.charAt(0))) {
            return null;
        }
        String src = s.startsWith("window.") ? s.substring(7) : s;
        Expr expr = timers(src);
        if (expr != null) {
            return expr;
        }
        if (src.startsWith("document.")) {
            return document(src);
        }
        return eventProperty(s);
    }

    private static Expr timers(String s) {
        String[] call = Shapes.methodCall(s, "");
        if (call == null) {
            return null;
        }
        String name = call[0];
        switch (name) {
            case "setTimeout":
                return Expr.builtin(ExprType.SET_TIMEOUT, Shapes.parseArgs(call[1], name, 1, Integer.MAX_VALUE));
            case "setInterval":
                return Expr.builtin(ExprType.SET_INTERVAL, Shapes.parseArgs(call[1], name, 1, Integer.MAX_VALUE));
            case "clearTimeout":
            case "clearInterval":
            case "cancelAnimationFrame":
                return Expr.builtin(ExprType.CLEAR_TIMER, name, Shapes.parseArgs(call[1], name, 0, 1));
            case "requestAnimationFrame":
                return Expr.builtin(ExprType.REQUEST_ANIMATION_FRAME, Shapes.parseArgs(call[1], name, 1, 1));
            case "queueMicrotask":
                return Expr.builtin(ExprType.QUEUE_MICROTASK, Shapes.parseArgs(call[1], name, 1, 1));
            default:
                return null;
        }
    }

    private static Expr document(String s) {
        String[] call = Shapes.methodCall(s, "document.");
        if (call == null) {
            return null;
        }
        String name = call[0];
        switch (name) {
            case "getElementById":
            case "querySelector":
                return Expr.builtin(ExprType.DOM_QUERY, name, Shapes.parseArgs(call[1], "document." + name, 1, 1));
            case "createElement":
            case "createTextNode":
                return Expr.builtin(ExprType.DOM_CREATE, name, Shapes.parseArgs(call[1], "document." + name, 1, 1));
            default:
                return null;
        }
    }

    /**
     * {@code e.type}, {@code e.target.id} and similar reads, resolved against the current event when
     * {@code e} is the handler's event parameter.
     */
    private static Expr eventProperty(String s) {
        Cursor cursor = new Cursor(s);
        String var = cursor.parseIdentifier();
        if (var == null || var.equals("history") || !cursor.consume('.')) {
            return null;
        }
        String head = cursor.parseIdentifier();
        if (head == null) {
            return null;
        }
        String prop = head;
        if (cursor.consume('.')) {
            String nested = cursor.parseIdentifier();
            if (nested == null) {
                return null;
            }
            prop = head + "." + nested;
        }
        if (!cursor.eof() || !EVENT_PROPS.contains(prop)) {
            return null;
        }
        return Expr.builtin(ExprType.EVENT_PROP, Expr.var(var), prop, List.of());
    }

}
