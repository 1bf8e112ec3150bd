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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.browserharness.js.Members.ABSENT;
import static io.browserharness.js.Members.arg;

/**
 * ArrayBuffer, typed array and Blob members. Every byte access goes through the buffer, which refuses
 * it once detached.
 */
class BufferMembers {

    private BufferMembers() {
        // only static methods
    }

    static Object property(Object target, String name) {
        if (target instanceof JsArrayBuffer) {
            JsArrayBuffer buffer = (JsArrayBuffer) target;
            switch (name) {
                case "byteLength":
                    return (long) buffer.getByteLength();
                case "maxByteLength":
                    return (long) buffer.getMaxByteLength();
                case "resizable":
                    return buffer.isResizable();
                case "detached":
                    return buffer.isDetached();
                default:
                    return ABSENT;
            }
        }
        if (target instanceof JsTypedArray) {
            JsTypedArray array = (JsTypedArray) target;
            switch (name) {
                case "length":
                    return (long) array.length();
                case "byteLength":
                    return (long) array.byteLength();
                case "byteOffset":
                    return array.buffer.isDetached() ? 0L : (long) array.byteOffset;
                case "buffer":
                    return array.buffer;
                case "BYTES_PER_ELEMENT":
                    return (long) array.kind.bytes;
                default:
                    return ABSENT;
            }
        }
        if (target instanceof JsBlob) {
            JsBlob blob = (JsBlob) target;
            switch (name) {
                case "size":
                    return (long) blob.size();
                case "type":
                    return blob.getType();
                default:
                    return ABSENT;
            }
        }
        return ABSENT;
    }

    static boolean isMethod(Object target, String name) {
        if (target instanceof JsArrayBuffer) {
            switch (name) {
                case "slice":
                case "resize":
                case "transfer":
                case "transferToFixedLength":
                    return true;
                default:
                    return false;
            }
        }
        if (target instanceof JsTypedArray) {
            switch (name) {
                case "fill":
                case "set":
                case "subarray":
                case "at":
                case "join":
                case "indexOf":
                case "includes":
                case "forEach":
                    return true;
                default:
                    return false;
            }
        }
        if (target instanceof JsBlob) {
            return "text".equals(name) || "arrayBuffer".equals(name);
        }
        return false;
    }

    static Object call(Interpreter interpreter, Object target, String name, List<Object> args) {
        if (target instanceof JsArrayBuffer) {
            return callBuffer((JsArrayBuffer) target, name, args);
        }
        if (target instanceof JsTypedArray) {
            return callTypedArray(interpreter, (JsTypedArray) target, name, args);
        }
        if (target instanceof JsBlob) {
            JsBlob blob = (JsBlob) target;
            switch (name) {
                case "text":
                    return Promises.resolved(interpreter, new String(blob.bytes, StandardCharsets.UTF_8));
                case "arrayBuffer":
                    return Promises.resolved(interpreter, JsArrayBuffer.wrap(blob.bytes.clone()));
                default:
                    return ABSENT;
            }
        }
        return ABSENT;
    }

    private static Object callBuffer(JsArrayBuffer buffer, String name, List<Object> args) {
        switch (name) {
            case "slice": {
                int length = buffer.getByteLength();
                int begin = Terms.relativeIndex(arg(args, 0), length, 0);
                int end = Terms.relativeIndex(arg(args, 1), length, length);
                return buffer.slice(begin, end);
            }
            case "resize":
                buffer.resize(length(arg(args, 0)));
                return Terms.UNDEFINED;
            case "transfer":
            case "transferToFixedLength": {
                Object newLength = arg(args, 0);
                Integer length = newLength == Terms.UNDEFINED ? null : length(newLength);
                return buffer.transfer(length, "transfer".equals(name));
            }
            default:
                return ABSENT;
        }
    }

    private static Object callTypedArray(Interpreter interpreter, JsTypedArray array, String name, List<Object> args) {
        switch (name) {
            case "fill": {
                array.buffer.checkAttached();
                int length = array.length();
                int start = Terms.relativeIndex(arg(args, 1), length, 0);
                int end = Terms.relativeIndex(arg(args, 2), length, length);
                for (int i = start; i < end; i++) {
                    array.set(i, arg(args, 0));
                }
                return array;
            }
            case "set": {
                array.buffer.checkAttached();
                List<Object> source = Terms.arrayLikeValues(arg(args, 0));
                int offset = (int) Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 1) == Terms.UNDEFINED ? 0L : arg(args, 1)));
                if (offset < 0 || offset + source.size() > array.length()) {
                    throw new ScriptRuntimeException("offset is out of bounds");
                }
                for (int i = 0; i < source.size(); i++) {
                    array.set(offset + i, source.get(i));
                }
                return Terms.UNDEFINED;
            }
            case "subarray": {
                array.buffer.checkAttached();
                int length = array.length();
                int begin = Terms.relativeIndex(arg(args, 0), length, 0);
                int end = Terms.relativeIndex(arg(args, 1), length, length);
                return new JsTypedArray(array.kind, array.buffer, array.byteOffset + begin * array.kind.bytes,
                        Math.max(0, end - begin));
            }
            case "at": {
                double index = Terms.toIntegerOrInfinity(Terms.toNumber(arg(args, 0)));
                if (index < 0) {
                    index += array.length();
                }
                return index < 0 || index >= array.length() ? Terms.UNDEFINED : array.get((int) index);
            }
            case "join": {
                Object separator = arg(args, 0);
                return Terms.join(array.values(), separator == Terms.UNDEFINED ? "," : Terms.toStr(separator));
            }
            case "indexOf":
            case "includes": {
                List<Object> values = array.values();
                for (int i = 0; i < values.size(); i++) {
                    if (Terms.strictEquals(values.get(i), arg(args, 0))) {
                        return "includes".equals(name) ? (Object) true : (Object) (long) i;
                    }
                }
                return "includes".equals(name) ? (Object) false : (Object) (-1L);
            }
            case "forEach": {
                JsCallable fn = ArrayMembers.callback(args, "forEach");
                List<Object> values = new ArrayList<>(array.values());
                for (int i = 0; i < values.size(); i++) {
                    ArrayMembers.invoke(interpreter, fn, values.get(i), i, array);
                }
                return Terms.UNDEFINED;
            }
            default:
                return ABSENT;
        }
    }

    private static int length(Object value) {
        double d = Terms.toIntegerOrInfinity(Terms.toNumber(value));
        if (d < 0 || d > JsArrayBuffer.MAX_LENGTH) {
            throw new ScriptRuntimeException("invalid array buffer length: " + Terms.toStr(value));
        }
        return (int) d;
    }

}
