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

import java.io.ByteArrayOutputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.Base64;

/**
 * URI component codecs and the Latin-1 base64 pair behind {@code atob} / {@code btoa}.
 */
class Encoding {

    private Encoding() {
        // only static methods
    }

    private static final String URI_UNRESERVED = "-_.!~*'()";
    private static final String URI_RESERVED = ";/?:@&=+$,#";

    static String uriCodec(String name, String input) {
        switch (name) {
            case "encodeURIComponent":
                return encodeUri(input, true);
            case "encodeURI":
                return encodeUri(input, false);
            case "decodeURIComponent":
                return decodeUri(input, true);
            case "decodeURI":
                return decodeUri(input, false);
            default:
                throw new ScriptRuntimeException("unknown uri function: " + name);
        }
    }

    private static boolean unescaped(char c, boolean component) {
        if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9') {
            return true;
        }
        return URI_UNRESERVED.indexOf(c) >= 0 || !component && URI_RESERVED.indexOf(c) >= 0;
    }

    static String encodeUri(String input, boolean component) {
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c < 0x80 && unescaped(c, component)) {
                sb.append(c);
                continue;
            }
            int cp;
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= input.length() || !Character.isLowSurrogate(input.charAt(i + 1))) {
                    throw new ScriptRuntimeException("URI malformed");
                }
                cp = Character.toCodePoint(c, input.charAt(++i));
            } else if (Character.isLowSurrogate(c)) {
                throw new ScriptRuntimeException("URI malformed");
            } else {
                cp = c;
            }
            for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(hex((b >> 4) & 0x0F)).append(hex(b & 0x0F));
            }
        }
        return sb.toString();
    }

    private static char hex(int digit) {
        return "0123456789ABCDEF".charAt(digit);
    }

    static String decodeUri(String input, boolean component) {
        StringBuilder sb = new StringBuilder(input.length());
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c != '%') {
                sb.append(c);
                i++;
                continue;
            }
            int first = percentByte(input, i);
            if (first < 0x80) {
                if (!component && URI_RESERVED.indexOf((char) first) >= 0) {
                    sb.append(input, i, i + 3);
                } else {
                    sb.append((char) first);
                }
                i += 3;
                continue;
            }
            int length = sequenceLength(first);
            ByteArrayOutputStream bytes = new ByteArrayOutputStream(length);
            bytes.write(first);
            int end = i + 3;
            for (int k = 1; k < length; k++) {
                if (end >= input.length() || input.charAt(end) != '%') {
                    throw new ScriptRuntimeException("URI malformed");
                }
                bytes.write(percentByte(input, end));
                end += 3;
            }
            try {
                sb.append(StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes.toByteArray())));
            } catch (CharacterCodingException e) {
                throw new ScriptRuntimeException("URI malformed");
            }
            i = end;
        }
        return sb.toString();
    }

    private static int percentByte(String input, int index) {
        if (index + 2 >= input.length()) {
            throw new ScriptRuntimeException("URI malformed");
        }
        int high = Character.digit(input.charAt(index + 1), 16);
        int low = Character.digit(input.charAt(index + 2), 16);
        if (high < 0 || low < 0) {
            throw new ScriptRuntimeException("URI malformed");
        }
        return high << 4 | low;
    }

    private static int sequenceLength(int first) {
        if ((first & 0xE0) == 0xC0) {
            return 2;
        }
        if ((first & 0xF0) == 0xE0) {
            return 3;
        }
        if ((first & 0xF8) == 0xF0) {
            return 4;
        }
        throw new ScriptRuntimeException("URI malformed");
    }

    //==================================================================================================================
    // base64

    static String btoa(String input) {
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) > 0xFF) {
                throw new ScriptRuntimeException("btoa input contains non-Latin1 character");
            }
        }
        return Base64.getEncoder().encodeToString(input.getBytes(StandardCharsets.ISO_8859_1));
    }

    static String atob(String input) {
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        if (sb.length() % 4 == 1) {
            throw new ScriptRuntimeException("atob invalid base64 input");
        }
        try {
            return new String(Base64.getDecoder().decode(sb.toString()), StandardCharsets.ISO_8859_1);
        } catch (IllegalArgumentException e) {
            throw new ScriptRuntimeException("atob invalid base64 input");
        }
    }

}
