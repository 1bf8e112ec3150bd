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

public enum BinaryOp {

    OR("||"),
    AND("&&"),
    NULLISH("??"),
    EQ("=="),
    NE("!="),
    STRICT_EQ("==="),
    STRICT_NE("!=="),
    BIT_OR("|"),
    BIT_XOR("^"),
    BIT_AND("&"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    UNSIGNED_SHIFT_RIGHT(">>>"),
    POW("**"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    IN("in"),
    INSTANCE_OF("instanceof"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%");

    public final String text;

    BinaryOp(String text) {
        this.text = text;
    }

    /**
     * The logical operators evaluate their right operand only when the left one does not decide the result.
     */
    public boolean isShortCircuit() {
        return this == OR || this == AND || this == NULLISH;
    }

    public static BinaryOp fromText(String text) {
        for (BinaryOp op : values()) {
            if (op.text.equals(text)) {
                return op;
            }
        }
        throw new ScriptParseException("unknown operator", text);
    }

}
