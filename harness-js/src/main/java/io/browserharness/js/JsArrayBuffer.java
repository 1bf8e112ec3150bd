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

import java.util.Arrays;

/**
 * Byte buffer with optional resizability. Transfer detaches the source; every byte access checks the
 * detached flag first.
 */
public class JsArrayBuffer extends JsObject {

    static final int MAX_LENGTH = 1 << 30;

    private byte[] data;
    private int byteLength;
    final Integer maxByteLength; // null for a fixed-length buffer
    private boolean detached;

    JsArrayBuffer(int byteLength, Integer maxByteLength) {
        if (byteLength < 0 || byteLength > MAX_LENGTH) {
            throw new ScriptRuntimeException("invalid array buffer length: " + byteLength);
        }
        if (maxByteLength != null && (maxByteLength < byteLength || maxByteLength > MAX_LENGTH)) {
            throw new ScriptRuntimeException("invalid array buffer max length: " + maxByteLength);
        }
        this.data = new byte[maxByteLength == null ? byteLength : maxByteLength];
        this.byteLength = byteLength;
        this.maxByteLength = maxByteLength;
    }

    static JsArrayBuffer wrap(byte[] bytes) {
        JsArrayBuffer buffer = new JsArrayBuffer(0, null);
        buffer.data = bytes;
        buffer.byteLength = bytes.length;
        return buffer;
    }

    void checkAttached() {
        if (detached) {
            throw new ScriptRuntimeException("ArrayBuffer is detached");
        }
    }

    byte[] bytes() {
        checkAttached();
        return data;
    }

    public int getByteLength() {
        return detached ? 0 : byteLength;
    }

    public int getMaxByteLength() {
        if (detached) {
            return 0;
        }
        return maxByteLength == null ? byteLength : maxByteLength;
    }

    public boolean isResizable() {
        return maxByteLength != null;
    }

    public boolean isDetached() {
        return detached;
    }

    byte[] copyBytes(int from, int to) {
        checkAttached();
        return Arrays.copyOfRange(data, from, Math.max(from, to));
    }

    void resize(int newLength) {
        checkAttached();
        if (maxByteLength == null) {
            throw new ScriptRuntimeException("ArrayBuffer is not resizable");
        }
        if (newLength < 0 || newLength > maxByteLength) {
            throw new ScriptRuntimeException("invalid length for resize: " + newLength);
        }
        if (newLength < byteLength) {
            Arrays.fill(data, newLength, byteLength, (byte) 0);
        }
        byteLength = newLength;
    }

    JsArrayBuffer slice(int begin, int end) {
        return wrap(copyBytes(begin, end));
    }

    /**
     * Moves the contents into a new buffer, optionally of another length, and detaches this one.
     */
    JsArrayBuffer transfer(Integer newLength, boolean preserveResizability) {
        checkAttached();
        int length = newLength == null ? byteLength : newLength;
        JsArrayBuffer target = new JsArrayBuffer(length, preserveResizability ? maxByteLength : null);
        System.arraycopy(data, 0, target.data, 0, Math.min(length, byteLength));
        data = new byte[0];
        byteLength = 0;
        detached = true;
        return target;
    }

    @Override
    public String toString() {
        return "[object ArrayBuffer]";
    }

}
