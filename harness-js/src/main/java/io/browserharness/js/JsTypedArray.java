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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view over a {@link JsArrayBuffer}. A view created without an explicit length tracks the length
 * of a resizable buffer.
 */
public class JsTypedArray extends JsObject implements JsIterable {

    public enum Kind {

        INT8("Int8Array", 1),
        UINT8("Uint8Array", 1),
        UINT8_CLAMPED("Uint8ClampedArray", 1),
        INT16("Int16Array", 2),
        UINT16("Uint16Array", 2),
        INT32("Int32Array", 4),
        UINT32("Uint32Array", 4),
        FLOAT32("Float32Array", 4),
        FLOAT64("Float64Array", 8),
        BIGINT64("BigInt64Array", 8),
        BIGUINT64("BigUint64Array", 8);

        final String jsName;
        final int bytes;

        Kind(String jsName, int bytes) {
            this.jsName = jsName;
            this.bytes = bytes;
        }

        static Kind of(String jsName) {
            for (Kind kind : values()) {
                if (kind.jsName.equals(jsName)) {
                    return kind;
                }
            }
            throw new ScriptRuntimeException("unknown typed array: " + jsName);
        }

        boolean isBigInt() {
            return this == BIGINT64 || this == BIGUINT64;
        }

    }

    private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);

    final Kind kind;
    final JsArrayBuffer buffer;
    final int byteOffset;
    final Integer fixedLength; // null when tracking the buffer length

    JsTypedArray(Kind kind, JsArrayBuffer buffer, int byteOffset, Integer fixedLength) {
        buffer.checkAttached();
        if (byteOffset % kind.bytes != 0) {
            throw new ScriptRuntimeException("start offset of " + kind.jsName + " should be a multiple of " + kind.bytes);
        }
        if (byteOffset > buffer.getByteLength()) {
            throw new ScriptRuntimeException("start offset " + byteOffset + " is outside the bounds of the buffer");
        }
        if (fixedLength == null && !buffer.isResizable() && (buffer.getByteLength() - byteOffset) % kind.bytes != 0) {
            throw new ScriptRuntimeException("byte length of " + kind.jsName + " should be a multiple of " + kind.bytes);
        }
        if (fixedLength != null && byteOffset + (long) fixedLength * kind.bytes > buffer.getByteLength()) {
            throw new ScriptRuntimeException("invalid typed array length: " + fixedLength);
        }
        this.kind = kind;
        this.buffer = buffer;
        this.byteOffset = byteOffset;
        this.fixedLength = fixedLength;
    }

    JsTypedArray(Kind kind, int length) {
        this(kind, new JsArrayBuffer(length * kind.bytes, null), 0, length);
    }

    public int length() {
        if (buffer.isDetached()) {
            return 0;
        }
        int available = buffer.getByteLength() - byteOffset;
        if (fixedLength != null) {
            return (long) fixedLength * kind.bytes > available ? 0 : fixedLength;
        }
        return Math.max(0, available / kind.bytes);
    }

    public int byteLength() {
        return length() * kind.bytes;
    }

    private ByteBuffer view() {
        return ByteBuffer.wrap(buffer.bytes()).order(ByteOrder.LITTLE_ENDIAN);
    }

    public Object get(int index) {
        buffer.checkAttached();
        if (index < 0 || index >= length()) {
            return Terms.UNDEFINED;
        }
        ByteBuffer bb = view();
        int pos = byteOffset + index * kind.bytes;
        switch (kind) {
            case INT8:
                return (long) bb.get(pos);
            case UINT8:
            case UINT8_CLAMPED:
                return (long) (bb.get(pos) & 0xff);
            case INT16:
                return (long) bb.getShort(pos);
            case UINT16:
                return (long) (bb.getShort(pos) & 0xffff);
            case INT32:
                return (long) bb.getInt(pos);
            case UINT32:
                return bb.getInt(pos) & 0xffffffffL;
            case FLOAT32:
                return Terms.narrow(bb.getFloat(pos));
            case FLOAT64:
                return Terms.narrow(bb.getDouble(pos));
            case BIGINT64:
                return BigInteger.valueOf(bb.getLong(pos));
            default:
                BigInteger signed = BigInteger.valueOf(bb.getLong(pos));
                return signed.signum() < 0 ? signed.add(TWO_64) : signed;
        }
    }

    public void set(int index, Object value) {
        buffer.checkAttached();
        if (kind.isBigInt()) {
            long bits = Terms.toBigInt(value).longValue();
            if (index >= 0 && index < length()) {
                view().putLong(byteOffset + index * kind.bytes, bits);
            }
            return;
        }
        double d = Terms.toNumber(value);
        if (index < 0 || index >= length()) {
            return;
        }
        ByteBuffer bb = view();
        int pos = byteOffset + index * kind.bytes;
        switch (kind) {
            case INT8:
            case UINT8:
                bb.put(pos, (byte) Terms.toInt32(d));
                break;
            case UINT8_CLAMPED:
                bb.put(pos, (byte) clamp(d));
                break;
            case INT16:
            case UINT16:
                bb.putShort(pos, (short) Terms.toInt32(d));
                break;
            case INT32:
            case UINT32:
                bb.putInt(pos, Terms.toInt32(d));
                break;
            case FLOAT32:
                bb.putFloat(pos, (float) d);
                break;
            default:
                bb.putDouble(pos, d);
        }
    }

    private static int clamp(double d) {
        if (Double.isNaN(d) || d <= 0) {
            return 0;
        }
        if (d >= 255) {
            return 255;
        }
        return (int) Math.rint(d);
    }

    @Override
    public List<Object> values() {
        List<Object> list = new ArrayList<>();
        int length = length();
        for (int i = 0; i < length; i++) {
            list.add(get(i));
        }
        return list;
    }

    @Override
    public String toString() {
        return Terms.join(values(), ",");
    }

}
