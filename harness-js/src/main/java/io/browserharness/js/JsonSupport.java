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

import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;
import net.minidev.json.writer.JsonReaderI;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code JSON.parse} and {@code JSON.stringify}. Parsing is strict RFC 4627 through json-smart with key
 * order kept; serialization follows script rules for {@code toJSON}, replacers, indentation and the
 * values that are skipped.
 */
class JsonSupport {

    private JsonSupport() {
        // only static methods
    }

    static Object parse(Interpreter interpreter, String text, Object reviver) {
        Object parsed;
        try {
            JsonReaderI<?> mapper = JSONValue.defaultReader.DEFAULT_ORDERED;
            parsed = new JSONParser(JSONParser.MODE_RFC4627).parse(text, mapper);
        } catch (ParseException e) {
            throw new ScriptRuntimeException("JSON.parse: " + e.getMessage(), e);
        }
        Object value = fromJson(parsed);
        if (reviver instanceof JsCallable) {
            JsObject holder = new JsObject();
            holder.putMember("", value);
            return revive(interpreter, (JsCallable) reviver, holder, "");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Object fromJson(Object o) {
        if (o instanceof Map) {
            JsObject object = new JsObject();
            ((Map<String, Object>) o).forEach((k, v) -> object.putMember(k, fromJson(v)));
            return object;
        }
        if (o instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<Object>) o) {
                list.add(fromJson(item));
            }
            return new JsArray(list);
        }
        if (o instanceof Number) {
            return Terms.narrow(((Number) o).doubleValue());
        }
        return o;
    }

    private static Object revive(Interpreter interpreter, JsCallable reviver, JsObject holder, String key) {
        Object value = holder.getMember(key);
        if (value instanceof JsArray) {
            List<Object> list = ((JsArray) value).list;
            JsObject indexed = new JsObject();
            for (int i = 0; i < list.size(); i++) {
                indexed.putMember(String.valueOf(i), list.get(i));
                Object revived = revive(interpreter, reviver, indexed, String.valueOf(i));
                list.set(i, revived);
            }
        } else if (value instanceof JsObject) {
            JsObject object = (JsObject) value;
            for (String name : new ArrayList<>(object.memberNames())) {
                Object revived = revive(interpreter, reviver, object, name);
                if (revived == Terms.UNDEFINED) {
                    object.removeMember(name);
                } else {
                    object.putMember(name, revived);
                }
            }
        }
        return reviver.call(interpreter, holder, Arrays.asList(key, value));
    }

    //==================================================================================================================
    // stringify

    static Object stringify(Interpreter interpreter, Object value, Object replacer, Object space) {
        Writer writer = new Writer(interpreter, replacer, indent(space));
        JsObject holder = new JsObject();
        holder.putMember("", value);
        StringBuilder sb = new StringBuilder();
        return writer.write(holder, "", value, sb, "") ? sb.toString() : Terms.UNDEFINED;
    }

    private static String indent(Object space) {
        if (Terms.isNumber(space)) {
            int count = (int) Math.max(0, Math.min(10, Terms.toIntegerOrInfinity(Terms.toNumber(space))));
            return " ".repeat(count);
        }
        if (space instanceof String) {
            String s = (String) space;
            return s.length() > 10 ? s.substring(0, 10) : s;
        }
        return "";
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    boolean loneSurrogate = Character.isHighSurrogate(c)
                            ? i + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(i + 1))
                            : Character.isLowSurrogate(c) && (i == 0 || !Character.isHighSurrogate(s.charAt(i - 1)));
                    if (c < 0x20 || loneSurrogate) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    private static class Writer {

        final Interpreter interpreter;
        final JsCallable replacerFunction;
        final List<String> allowList;
        final String gap;
        final Map<Object, Boolean> stack = new IdentityHashMap<>();

        Writer(Interpreter interpreter, Object replacer, String gap) {
            this.interpreter = interpreter;
            this.gap = gap;
            if (replacer instanceof JsCallable) {
                replacerFunction = (JsCallable) replacer;
                allowList = null;
            } else if (replacer instanceof JsArray) {
                replacerFunction = null;
                allowList = new ArrayList<>();
                for (Object item : ((JsArray) replacer).list) {
                    if (item instanceof String || Terms.isNumber(item)) {
                        String key = Terms.toStr(item);
                        if (!allowList.contains(key)) {
                            allowList.add(key);
                        }
                    }
                }
            } else {
                replacerFunction = null;
                allowList = null;
            }
        }

        /**
         * Appends the serialized value, returning false when the value is skipped.
         */
        boolean write(Object holder, String key, Object value, StringBuilder sb, String indent) {
            value = prepare(holder, key, value);
            if (value == null) {
                sb.append("null");
                return true;
            }
            if (value == Terms.UNDEFINED || value instanceof JsCallable || value instanceof JsSymbol
                    || value instanceof BuiltinConstructor) {
                return false;
            }
            if (value instanceof Boolean) {
                sb.append(value);
                return true;
            }
            if (value instanceof String) {
                sb.append(quote((String) value));
                return true;
            }
            if (value instanceof BigInteger) {
                throw new ScriptRuntimeException("Do not know how to serialize a BigInt");
            }
            if (value instanceof Number) {
                double d = ((Number) value).doubleValue();
                sb.append(Double.isNaN(d) || Double.isInfinite(d) ? "null" : Terms.formatNumber(d));
                return true;
            }
            if (stack.containsKey(value)) {
                throw new ScriptRuntimeException("Converting circular structure to JSON");
            }
            stack.put(value, Boolean.TRUE);
            try {
                if (value instanceof JsArray) {
                    writeArray(((JsArray) value).list, value, sb, indent);
                } else if (value instanceof JsTypedArray) {
                    writeTypedArray((JsTypedArray) value, sb, indent);
                } else if (value instanceof JsObject) {
                    writeObject((JsObject) value, sb, indent);
                } else {
                    sb.append("{}");
                }
            } finally {
                stack.remove(value);
            }
            return true;
        }

        private Object prepare(Object holder, String key, Object value) {
            if (value instanceof JsDate) {
                JsDate date = (JsDate) value;
                value = date.isValid() ? DateSupport.toIsoString(date) : null;
            } else if (value instanceof JsUrl) {
                value = ((JsUrl) value).href();
            } else if (value instanceof JsObject && !(value instanceof JsCallable)) {
                Object toJson = ((JsObject) value).getMember("toJSON");
                if (toJson instanceof JsCallable) {
                    value = ((JsCallable) toJson).call(interpreter, value, Arrays.asList(key));
                }
            }
            if (replacerFunction != null) {
                value = replacerFunction.call(interpreter, holder, Arrays.asList(key, value));
            }
            return value;
        }

        private void writeArray(List<Object> list, Object holder, StringBuilder sb, String indent) {
            if (list.isEmpty()) {
                sb.append("[]");
                return;
            }
            String inner = indent + gap;
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                newline(sb, inner);
                if (!write(holder, String.valueOf(i), list.get(i), sb, inner)) {
                    sb.append("null");
                }
            }
            newline(sb, indent);
            sb.append(']');
        }

        private void writeTypedArray(JsTypedArray array, StringBuilder sb, String indent) {
            List<Object> values = array.values();
            JsObject indexed = new JsObject();
            for (int i = 0; i < values.size(); i++) {
                indexed.putMember(String.valueOf(i), values.get(i));
            }
            writeObject(indexed, sb, indent);
        }

        private void writeObject(JsObject object, StringBuilder sb, String indent) {
            Collection<String> names = allowList != null ? allowList : new ArrayList<>(object.memberNames());
            String inner = indent + gap;
            boolean empty = true;
            sb.append('{');
            for (String name : names) {
                if (name.startsWith("@@symbol:") || !object.hasMember(name)) {
                    continue;
                }
                int mark = sb.length();
                if (!empty) {
                    sb.append(',');
                }
                newline(sb, inner);
                sb.append(quote(name)).append(':');
                if (!gap.isEmpty()) {
                    sb.append(' ');
                }
                if (write(object, name, object.getMember(name), sb, inner)) {
                    empty = false;
                } else {
                    sb.setLength(mark);
                }
            }
            if (!empty) {
                newline(sb, indent);
            }
            sb.append('}');
        }

        private void newline(StringBuilder sb, String indent) {
            if (!gap.isEmpty()) {
                sb.append('\n').append(indent);
            }
        }

    }

}
