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

import java.util.ArrayList;
import java.util.List;

/**
 * Array and object literals, and chains of member access, indexing and calls.
 */
class PostfixShapes {

    private PostfixShapes() {
        // only static methods
    }

    private static String wholeBlock(String s, char open, char close) {
        if (s.charAt(0) != open) {
            return null;
        }
        Cursor cursor = new Cursor(s);
        String inner = cursor.readBalancedBlock(open, close);
        cursor.skipWs();
        return cursor.eof() ? inner : null;
    }

    private static List<String> elements(String inner) {
        List<String> parts = TopLevel.splitByChar(inner, ',');
        int count = parts.size();
        if (count > 0 && parts.get(count - 1).trim().isEmpty()) {
            parts = parts.subList(0, count - 1);
        }
        return parts;
    }

    static Expr arrayLiteral(String s) {
        String inner = wholeBlock(s, '[', ']');
        if (inner == null) {
            return null;
        }
        List<Expr> items = new ArrayList<>();
        for (String part : elements(inner)) {
            String item = part.trim();
            if (item.isEmpty()) {
                items.add(Expr.UNDEFINED); // hole
            } else if (item.startsWith("...")) {
                items.add(Expr.unary(ExprType.SPREAD, ExprParser.parseExpr(item.substring(3))));
            } else {
                items.add(ExprParser.parseExpr(item));
            }
        }
        return Expr.array(items);
    }

    static Expr objectLiteral(String s) {
        String inner = wholeBlock(s, '{', '}');
        if (inner == null) {
            return null;
        }
        List<ObjectEntry> entries = new ArrayList<>();
        for (String part : elements(inner)) {
            String entry = part.trim();
            if (entry.isEmpty()) {
                throw new ScriptParseException("invalid object literal", s);
            }
            entries.add(objectEntry(entry));
        }
        return Expr.object(entries);
    }

    private static ObjectEntry objectEntry(String entry) {
        if (entry.startsWith("...")) {
            return ObjectEntry.spread(ExprParser.parseExpr(entry.substring(3)));
        }
        if (entry.charAt(0) == '[') {
            Cursor cursor = new Cursor(entry);
            String key = cursor.readBalancedBlock('[', ']');
            cursor.skipWs();
            cursor.expect(':');
            return ObjectEntry.computed(ExprParser.parseExpr(key), ExprParser.parseExpr(cursor.rest()));
        }
        ObjectEntry method = methodShorthand(entry);
        if (method != null) {
            return method;
        }
        int colon = TopLevel.indexOf(entry, ":");
        if (colon == -1) {
            if (!Idents.isIdent(entry)) {
                throw new ScriptParseException("invalid object literal entry", entry);
            }
            return ObjectEntry.of(entry, Expr.var(entry));
        }
        String keyText = entry.substring(0, colon).trim();
        String key;
        if (keyText.startsWith("'") || keyText.startsWith("\"")) {
            key = TopLevel.parseStringLiteralExact(keyText);
        } else if (Idents.isIdent(keyText) || isDigits(keyText)) {
            key = keyText;
        } else {
            throw new ScriptParseException("invalid object literal key", keyText);
        }
        String valueText = entry.substring(colon + 1).trim();
        if (valueText.isEmpty()) {
            throw new ScriptParseException("missing value for key", keyText);
        }
        return ObjectEntry.of(key, ExprParser.parseExpr(valueText));
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static ObjectEntry methodShorthand(String entry) {
        Cursor cursor = new Cursor(entry);
        boolean async = false;
        if (cursor.consumeKeyword("async")) {
            cursor.skipWs();
            async = true;
        }
        String name = cursor.parseIdentifier();
        if (name == null) {
            return null;
        }
        cursor.skipWs();
        if (cursor.peek() != '(') {
            return null;
        }
        String params = cursor.readBalancedBlock('(', ')');
        cursor.skipWs();
        if (cursor.peek() != '{') {
            return null;
        }
        String body = cursor.readBalancedBlock('{', '}');
        cursor.skipWs();
        if (!cursor.eof()) {
            return null;
        }
        ScriptHandler handler = new ScriptHandler(FunctionShapes.parseParams(params), StatementParser.parseStatements(body));
        return ObjectEntry.of(name, Expr.function(name, handler, async, false));
    }

    /**
     * A builtin form spanning the chain so far, so that {@code Math.max(a, b).toFixed(1)} keeps its
     * {@code MATH_CALL} head.
     */
    private static Expr builtinPrefix(String prefix) {
        Expr expr = BuiltinShapes.recognize(prefix);
        if (expr == null) {
            expr = PlatformShapes.recognize(prefix);
        }
        if (expr == null) {
            expr = RegexShapes.newRegExp(prefix);
        }
        return expr;
    }

    private static Expr head(Cursor cursor, String s) {
        char c = cursor.peek();
        if (c == '(') {
            return ExprParser.parseExpr(cursor.readBalancedBlock('(', ')'));
        }
        if (c == '[') {
            int start = cursor.getPos();
            cursor.readBalancedBlock('[', ']');
            return arrayLiteral(s.substring(start, cursor.getPos()));
        }
        if (c == '\'' || c == '"') {
            return Expr.string(cursor.parseStringLiteral());
        }
        if (c == '`') {
            JsLexScanner scanner = new JsLexScanner();
            int i = scanner.advance(s, 0);
            while (i < s.length() && !scanner.inNormal()) {
                i = scanner.advance(s, i);
            }
            cursor.setPos(i);
            return ExprParser.parseTemplateLiteral(s.substring(0, i));
        }
        if (c == '/') {
            int end = RegexShapes.literalEnd(s);
            if (end == -1) {
                return null;
            }
            int flagsEnd = RegexShapes.flagsEnd(s, end);
            cursor.setPos(flagsEnd);
            return Expr.regex(s.substring(1, end - 1), RegexShapes.validateFlags(s.substring(end, flagsEnd)));
        }
        if (Character.isDigit(c)) {
            return numberHead(cursor, s);
        }
        if (cursor.consumeKeyword("new")) {
            cursor.skipWs();
            if (cursor.parseIdentifier() == null) {
                throw new ScriptParseException("missing constructor after 'new'", s);
            }
            while (cursor.peek() == '.') {
                cursor.consume('.');
                if (cursor.parseIdentifier() == null) {
                    return null;
                }
            }
            int afterPath = cursor.getPos();
            cursor.skipWs();
            if (cursor.peek() == '(') {
                cursor.readBalancedBlock('(', ')');
            } else {
                cursor.setPos(afterPath);
            }
            return ConstructorShapes.recognize(s.substring(0, cursor.getPos()));
        }
        String name = cursor.parseIdentifier();
        if (name == null) {
            return null;
        }
        switch (name) {
            case "true":
                return Expr.TRUE;
            case "false":
                return Expr.FALSE;
            case "null":
                return Expr.NULL;
            case "undefined":
                return Expr.UNDEFINED;
            case "NaN":
                return Expr.floating(Double.NaN);
            case "Infinity":
                return Expr.floating(Double.POSITIVE_INFINITY);
            default:
                return Expr.var(name);
        }
    }

    /**
     * A numeric literal receiver such as {@code 0.1} in {@code 0.1.toFixed(2)}. A dot belongs to the
     * number only when a digit follows it.
     */
    private static Expr numberHead(Cursor cursor, String s) {
        int start = cursor.getPos();
        int len = s.length();
        int i = start;
        if (i + 1 < len && s.charAt(i) == '0' && "xXoObB".indexOf(s.charAt(i + 1)) != -1) {
            i += 2;
            while (i < len && Character.isLetterOrDigit(s.charAt(i))) {
                i++;
            }
        } else {
            i = digitsEnd(s, i);
            if (i + 1 < len && s.charAt(i) == '.' && Character.isDigit(s.charAt(i + 1))) {
                i = digitsEnd(s, i + 1);
            }
            if (i < len && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
                int j = i + 1;
                if (j < len && (s.charAt(j) == '+' || s.charAt(j) == '-')) {
                    j++;
                }
                if (j < len && Character.isDigit(s.charAt(j))) {
                    i = digitsEnd(s, j);
                }
            }
            if (i < len && s.charAt(i) == 'n') {
                i++;
            }
        }
        Expr literal = ExprParser.parseNumericLiteral(s.substring(start, i));
        if (literal != null) {
            cursor.setPos(i);
        }
        return literal;
    }

    private static int digitsEnd(String s, int from) {
        int i = from;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            i++;
        }
        return i;
    }

    static Expr postfixChain(String s) {
        Cursor cursor = new Cursor(s);
        Expr current = head(cursor, s);
        if (current == null) {
            return null;
        }
        boolean builtinCandidate = current.type == ExprType.VAR;
        int steps = 0;
        while (true) {
            int before = cursor.getPos();
            cursor.skipWs();
            boolean optional = cursor.consumeAscii("?.");
            char c = cursor.peek();
            if (!optional && c == '.') {
                cursor.consume('.');
            }
            if (c == '(') {
                List<Expr> args = Shapes.parseArgs(cursor.readBalancedBlock('(', ')'));
                if (current.type == ExprType.VAR && !optional) {
                    current = Expr.functionCall(current.name, args);
                } else if (current.type == ExprType.MEMBER_GET && !optional) {
                    current = Expr.memberCall(current.target, current.name, args, current.optional);
                } else {
                    current = Expr.call(current, args, optional);
                }
            } else if (c == '[') {
                Expr index = ExprParser.parseExpr(cursor.readBalancedBlock('[', ']'));
                current = Expr.indexGet(current, index, optional);
            } else if (optional || c == '.') {
                cursor.skipWs();
                String member = cursor.parseIdentifier();
                if (member == null) {
                    if (c == '.' && !optional && Character.isDigit(cursor.peek())) {
                        return null;
                    }
                    throw new ScriptParseException("expected member name", s);
                }
                current = Expr.memberGet(current, member, optional);
            } else {
                cursor.setPos(before);
                break;
            }
            steps++;
            if (builtinCandidate) {
                Expr builtin = builtinPrefix(s.substring(0, cursor.getPos()));
                if (builtin != null) {
                    current = builtin;
                    builtinCandidate = false;
                }
            }
        }
        cursor.skipWs();
        if (!cursor.eof()) {
            return null;
        }
        if (steps == 0 && current.type == ExprType.VAR) {
            return null;
        }
        return current;
    }

}
