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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Precedence-climbing expression parser working directly on source slices. Each level splits its
 * input at top-level operators of that level and hands the operands to the next tighter level;
 * a level that finds its input fully wrapped in parentheses restarts from the top.
 */
public class ExprParser {

    static final Logger logger = LoggerFactory.getLogger(ExprParser.class);

    private ExprParser() {
        // only static methods
    }

    /**
     * Forms tried after the literals, in order. The first one that claims the source wins.
     */
    private static final List<ShapeRecognizer> PRIMARY_SHAPES = List.of(
            RegexShapes::regexMethod,
            RegexShapes::newRegExp,
            ConstructorShapes::recognize,
            BuiltinShapes::recognize,
            PlatformShapes::recognize,
            FunctionShapes::recognize,
            PostfixShapes::arrayLiteral,
            PostfixShapes::objectLiteral,
            PostfixShapes::postfixChain
    );

    public static Expr parseExpr(String src) {
        String s = TopLevel.stripOuterParens(src);
        if (s.isEmpty()) {
            throw new ScriptParseException("empty expression");
        }
        Expr expr = RegexShapes.regexMethod(s);
        if (expr != null) {
            return expr;
        }
        expr = RegexShapes.regexLiteral(s);
        if (expr != null) {
            return expr;
        }
        expr = RegexShapes.newRegExp(s);
        if (expr != null) {
            return expr;
        }
        expr = FunctionShapes.recognize(s);
        if (expr != null) {
            return expr;
        }
        return parseComma(s);
    }

    static Expr parseComma(String src) {
        String s = TopLevel.stripOuterParens(src);
        List<String> parts = TopLevel.splitByChar(s, ',');
        if (parts.size() == 1) {
            return parseTernary(s);
        }
        List<Expr> items = new ArrayList<>(parts.size());
        for (String part : parts) {
            String p = part.trim();
            if (p.isEmpty()) {
                throw new ScriptParseException("invalid comma expression", s);
            }
            items.add(parseTernary(p));
        }
        return Expr.comma(items);
    }

    static Expr parseTernary(String src) {
        String s = TopLevel.stripOuterParens(src);
        Expr yield = parseYield(s);
        if (yield != null) {
            return yield;
        }
        int q = TopLevel.findTernaryQuestion(s);
        if (q == -1) {
            return parseLogicalOr(s);
        }
        int colon = TopLevel.findMatchingTernaryColon(s, q + 1);
        if (colon == -1) {
            throw new ScriptParseException("invalid ternary expression (missing ':')", s);
        }
        return Expr.ternary(
                parseTernary(s.substring(0, q)),
                parseTernary(s.substring(q + 1, colon)),
                parseTernary(s.substring(colon + 1)));
    }

    /**
     * {@code yield} binds looser than every binary operator: {@code yield a + b} yields the sum.
     */
    private static Expr parseYield(String s) {
        ExprType type;
        String rest;
        if (s.startsWith("yield*")) {
            type = ExprType.YIELD_STAR;
            rest = s.substring(6).trim();
        } else {
            rest = stripKeywordOperator(s, "yield");
            if (rest == null) {
                return null;
            }
            type = ExprType.YIELD;
        }
        if (rest.isEmpty()) {
            throw new ScriptParseException(type == ExprType.YIELD ? "yield operator requires an operand"
                    : "yield* operator requires an operand");
        }
        return Expr.unary(type, parseTernary(rest));
    }

    /**
     * Shared body of the left-associative binary levels. {@code ops} must list longer operators first.
     */
    private static Expr level(String src, Function<String, Expr> next, String... ops) {
        String trimmed = src.trim();
        String s = TopLevel.stripOuterParens(trimmed);
        if (s.length() != trimmed.length()) {
            return parseExpr(s);
        }
        TopLevel.Split split = TopLevel.splitByOps(s, ops);
        if (!split.hasOps()) {
            return next.apply(s);
        }
        return fold(s, split, next);
    }

    static Expr fold(String src, TopLevel.Split split, Function<String, Expr> leaf) {
        for (String part : split.parts) {
            if (part.trim().isEmpty()) {
                throw new ScriptParseException("missing operand", src);
            }
        }
        Expr expr = leaf.apply(split.parts.get(0).trim());
        for (int i = 0; i < split.ops.size(); i++) {
            Expr rhs = leaf.apply(split.parts.get(i + 1).trim());
            expr = Expr.binary(expr, BinaryOp.fromText(split.ops.get(i)), rhs);
        }
        return expr;
    }

    static Expr parseLogicalOr(String src) {
        return level(src, ExprParser::parseNullish, "||");
    }

    static Expr parseNullish(String src) {
        return level(src, ExprParser::parseLogicalAnd, "??");
    }

    static Expr parseLogicalAnd(String src) {
        return level(src, ExprParser::parseBitOr, "&&");
    }

    static Expr parseBitOr(String src) {
        return level(src, ExprParser::parseBitXor, "|");
    }

    static Expr parseBitXor(String src) {
        return level(src, ExprParser::parseBitAnd, "^");
    }

    static Expr parseBitAnd(String src) {
        return level(src, ExprParser::parseEquality, "&");
    }

    static Expr parseEquality(String src) {
        return level(src, ExprParser::parseRelational, "!==", "===", "!=", "==");
    }

    static Expr parseRelational(String src) {
        return level(src, ExprParser::parseShift, "<=", ">=", "<", ">", "instanceof", "in");
    }

    static Expr parseShift(String src) {
        return level(src, ExprParser::parseAdditive, ">>>", "<<", ">>");
    }

    static Expr parseAdditive(String src) {
        String trimmed = src.trim();
        String s = TopLevel.stripOuterParens(trimmed);
        if (s.length() != trimmed.length()) {
            return parseExpr(s);
        }
        TopLevel.Split split = TopLevel.splitAddSub(s);
        if (!split.hasOps()) {
            return parseMultiplicative(s);
        }
        for (String part : split.parts) {
            if (part.trim().isEmpty()) {
                throw new ScriptParseException("missing operand", s);
            }
        }
        Expr expr = parseMultiplicative(split.parts.get(0).trim());
        for (int i = 0; i < split.ops.size(); i++) {
            Expr rhs = parseExpr(split.parts.get(i + 1).trim());
            if (split.ops.get(i).equals("+")) {
                expr = Expr.appendConcat(expr, rhs);
            } else {
                expr = Expr.binary(expr, BinaryOp.SUB, rhs);
            }
        }
        return expr;
    }

    static Expr parseMultiplicative(String src) {
        String trimmed = src.trim();
        String s = TopLevel.stripOuterParens(trimmed);
        if (s.length() != trimmed.length()) {
            return parseExpr(s);
        }
        Expr regex = RegexShapes.regexMethod(s);
        if (regex == null) {
            regex = RegexShapes.regexLiteral(s);
        }
        if (regex != null) {
            return regex;
        }
        if (s.startsWith("yield*")) {
            return parsePow(s);
        }
        List<String> parts = new ArrayList<>();
        List<String> ops = new ArrayList<>();
        JsLexScanner scanner = new JsLexScanner();
        int len = s.length();
        int start = 0;
        int i = 0;
        while (i < len) {
            char c = s.charAt(i);
            if (scanner.isTopLevel()) {
                boolean split = false;
                if (c == '/') {
                    split = !scanner.slashStartsCommentOrRegex(s, i);
                } else if (c == '%') {
                    split = true;
                } else if (c == '*') {
                    split = !(i + 1 < len && s.charAt(i + 1) == '*') && !(i > 0 && s.charAt(i - 1) == '*');
                }
                if (split) {
                    parts.add(s.substring(start, i));
                    ops.add(String.valueOf(c));
                    start = i + 1;
                }
            }
            i = scanner.advance(s, i);
        }
        if (ops.isEmpty()) {
            return parsePow(s);
        }
        parts.add(s.substring(start));
        return fold(s, new TopLevel.Split(parts, ops), ExprParser::parsePow);
    }

    static Expr parsePow(String src) {
        String trimmed = src.trim();
        String s = TopLevel.stripOuterParens(trimmed);
        if (s.length() != trimmed.length()) {
            return parseExpr(s);
        }
        JsLexScanner scanner = new JsLexScanner();
        int i = 0;
        while (i < s.length()) {
            if (scanner.isTopLevel() && s.startsWith("**", i)) {
                Expr left = parseExpr(s.substring(0, i));
                Expr right = parsePow(s.substring(i + 2));
                return Expr.binary(left, BinaryOp.POW, right);
            }
            i = scanner.advance(s, i);
        }
        return parseUnary(s);
    }

    /**
     * Returns the operand text after a keyword operator, or null when {@code src} does not start
     * with the keyword as a whole word.
     */
    static String stripKeywordOperator(String src, String keyword) {
        if (!src.startsWith(keyword)) {
            return null;
        }
        String after = src.substring(keyword.length());
        if (after.isEmpty() || !Idents.isIdentChar(after.charAt(0))) {
            return after.trim();
        }
        return null;
    }

    private static Expr requireOperand(ExprType type, String keyword, String rest) {
        if (rest.isEmpty()) {
            throw new ScriptParseException(keyword + " operator requires an operand");
        }
        return Expr.unary(type, parseUnary(rest));
    }

    static Expr parseUnary(String src) {
        String trimmed = src.trim();
        String s = TopLevel.stripOuterParens(trimmed);
        if (s.length() != trimmed.length()) {
            return parseExpr(s);
        }
        String rest = stripKeywordOperator(s, "await");
        if (rest != null) {
            return requireOperand(ExprType.AWAIT, "await", rest);
        }
        if (s.startsWith("yield*")) {
            return requireOperand(ExprType.YIELD_STAR, "yield*", s.substring(6).trim());
        }
        rest = stripKeywordOperator(s, "yield");
        if (rest != null) {
            return requireOperand(ExprType.YIELD, "yield", rest);
        }
        rest = stripKeywordOperator(s, "typeof");
        if (rest != null) {
            return Expr.unary(ExprType.TYPEOF, parseUnary(rest));
        }
        rest = stripKeywordOperator(s, "void");
        if (rest != null) {
            return Expr.unary(ExprType.VOID, parseUnary(rest));
        }
        rest = stripKeywordOperator(s, "delete");
        if (rest != null) {
            return Expr.unary(ExprType.DELETE, parseUnary(rest));
        }
        if (s.isEmpty()) {
            return parsePrimary(s);
        }
        char first = s.charAt(0);
        if ((first == '+' || first == '-' || first == '!' || first == '~') && s.substring(1).trim().isEmpty()) {
            throw new ScriptParseException("missing operand", s);
        }
        switch (first) {
            case '+':
                return Expr.unary(ExprType.POS, parseUnary(s.substring(1)));
            case '-':
                return Expr.unary(ExprType.NEG, parseUnary(s.substring(1)));
            case '!':
                return Expr.unary(ExprType.NOT, parseUnary(s.substring(1)));
            case '~':
                return Expr.unary(ExprType.BIT_NOT, parseUnary(s.substring(1)));
            default:
                return parsePrimary(s);
        }
    }

    static Expr parsePrimary(String src) {
        String s = src.trim();
        switch (s) {
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
        }
        if (s.isEmpty()) {
            throw new ScriptParseException("unsupported expression", s);
        }
        Expr numeric = parseNumericLiteral(s);
        if (numeric != null) {
            return numeric;
        }
        if (s.length() >= 2 && s.startsWith("`") && s.endsWith("`")) {
            Expr template = parseTemplateLiteral(s);
            if (template != null) {
                return template;
            }
        }
        char first = s.charAt(0);
        if ((first == '\'' || first == '"') && s.charAt(s.length() - 1) == first && isSingleStringLiteral(s)) {
            return Expr.string(TopLevel.parseStringLiteralExact(s));
        }
        Expr regex = RegexShapes.regexLiteral(s);
        if (regex != null) {
            return regex;
        }
        for (ShapeRecognizer shape : PRIMARY_SHAPES) {
            Expr expr = shape.recognize(s);
            if (expr != null) {
                return expr;
            }
        }
        if (Idents.isOperandName(s)) {
            return Expr.var(s);
        }
        if (Idents.isReserved(s)) {
            throw new ScriptParseException("unexpected keyword", s);
        }
        if (logger.isTraceEnabled()) {
            logger.trace("no shape matched: {}", s);
        }
        throw new ScriptParseException("unsupported expression", s);
    }

    /**
     * True when the whole source is one quoted string, so {@code 'a' + 'b'} is not mistaken for one.
     */
    private static boolean isSingleStringLiteral(String s) {
        JsLexScanner scanner = new JsLexScanner();
        int i = scanner.advance(s, 0);
        while (i < s.length()) {
            i = scanner.advance(s, i);
            if (scanner.inNormal()) {
                return i == s.length();
            }
        }
        return scanner.inNormal();
    }

    private static boolean isSingleTemplateLiteral(String s) {
        return isSingleStringLiteral(s);
    }

    //==================================================================================================================
    // literals

    static Expr parseNumericLiteral(String src) {
        if (src.isEmpty()) {
            return null;
        }
        Expr bigint = parseBigIntLiteral(src);
        if (bigint != null) {
            return bigint;
        }
        Expr prefixed = parsePrefixedInteger(src, "0x", 16);
        if (prefixed == null) {
            prefixed = parsePrefixedInteger(src, "0o", 8);
        }
        if (prefixed == null) {
            prefixed = parsePrefixedInteger(src, "0b", 2);
        }
        if (prefixed != null) {
            return prefixed;
        }
        char first = src.charAt(0);
        if (src.indexOf('e') != -1 || src.indexOf('E') != -1) {
            if (!Character.isDigit(first) && first != '.') {
                return null;
            }
            if (!isDecimalText(src)) {
                return null;
            }
            return finiteFloat(src);
        }
        boolean allDigits = true;
        int dots = 0;
        for (int i = 0; i < src.length(); i++) {
            char c = src.charAt(i);
            if (c == '.') {
                dots++;
                allDigits = false;
            } else if (c < '0' || c > '9') {
                return null;
            }
        }
        if (allDigits) {
            try {
                return Expr.number(Long.parseLong(src));
            } catch (NumberFormatException e) {
                throw new ScriptParseException("invalid numeric literal", src);
            }
        }
        if (dots != 1 || src.startsWith(".") || src.endsWith(".")) {
            return null;
        }
        return finiteFloat(src);
    }

    /**
     * Digits with at most one dot and one exponent part, so identifiers containing an {@code e} are
     * left to the other shapes.
     */
    private static boolean isDecimalText(String src) {
        int i = 0;
        int len = src.length();
        boolean digits = false;
        while (i < len && Character.isDigit(src.charAt(i))) {
            i++;
            digits = true;
        }
        if (i < len && src.charAt(i) == '.') {
            i++;
            while (i < len && Character.isDigit(src.charAt(i))) {
                i++;
                digits = true;
            }
        }
        if (!digits || i >= len || (src.charAt(i) != 'e' && src.charAt(i) != 'E')) {
            return false;
        }
        i++;
        if (i < len && (src.charAt(i) == '+' || src.charAt(i) == '-')) {
            i++;
        }
        int expStart = i;
        while (i < len && Character.isDigit(src.charAt(i))) {
            i++;
        }
        return i == len && i > expStart;
    }

    private static Expr finiteFloat(String src) {
        double value;
        try {
            value = Double.parseDouble(src);
        } catch (NumberFormatException e) {
            throw new ScriptParseException("invalid numeric literal", src);
        }
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new ScriptParseException("invalid numeric literal", src);
        }
        return Expr.floating(value);
    }

    static Expr parseBigIntLiteral(String src) {
        if (!src.endsWith("n")) {
            return null;
        }
        String raw = src.substring(0, src.length() - 1);
        if (raw.isEmpty() || !Character.isDigit(raw.charAt(0))) {
            return null;
        }
        String lower = raw.toLowerCase();
        String digits;
        int radix;
        if (lower.startsWith("0x")) {
            digits = raw.substring(2);
            radix = 16;
        } else if (lower.startsWith("0o")) {
            digits = raw.substring(2);
            radix = 8;
        } else if (lower.startsWith("0b")) {
            digits = raw.substring(2);
            radix = 2;
        } else {
            if (raw.length() > 1 && raw.startsWith("0")) {
                throw new ScriptParseException("invalid numeric literal", src);
            }
            digits = raw;
            radix = 10;
        }
        if (digits.isEmpty()) {
            throw new ScriptParseException("invalid numeric literal", src);
        }
        try {
            return Expr.bigint(new BigInteger(digits, radix));
        } catch (NumberFormatException e) {
            throw new ScriptParseException("invalid numeric literal", src);
        }
    }

    static Expr parsePrefixedInteger(String src, String prefix, int radix) {
        String lower = src.toLowerCase();
        if (!lower.startsWith(prefix)) {
            return null;
        }
        String digits = lower.substring(prefix.length());
        if (digits.isEmpty()) {
            throw new ScriptParseException("invalid numeric literal", src);
        }
        for (int i = 0; i < digits.length(); i++) {
            // 0xff.toString(16) is a member access on the literal
            if (!Character.isLetterOrDigit(digits.charAt(i))) {
                return null;
            }
        }
        try {
            return Expr.number(Long.parseLong(digits, radix));
        } catch (NumberFormatException e) {
            throw new ScriptParseException("invalid numeric literal", src);
        }
    }

    /**
     * Returns null when the backticks at both ends do not delimit one single template.
     */
    static Expr parseTemplateLiteral(String src) {
        if (!isSingleTemplateLiteral(src)) {
            return null;
        }
        String inner = src.substring(1, src.length() - 1);
        List<Expr> parts = new ArrayList<>();
        int textStart = 0;
        int i = 0;
        while (i < inner.length()) {
            char c = inner.charAt(i);
            if (c == '\\') {
                i = Math.min(i + 2, inner.length());
                continue;
            }
            if (c == '$' && i + 1 < inner.length() && inner.charAt(i + 1) == '{') {
                String text = StringEscapes.unescape(inner.substring(textStart, i));
                if (!text.isEmpty()) {
                    parts.add(Expr.string(text));
                }
                int exprStart = i + 2;
                int exprEnd = TopLevel.findTemplateExprEnd(inner, exprStart);
                parts.add(parseExpr(inner.substring(exprStart, exprEnd)));
                i = exprEnd + 1;
                textStart = i;
                continue;
            }
            i++;
        }
        String text = StringEscapes.unescape(inner.substring(textStart));
        if (!text.isEmpty()) {
            parts.add(Expr.string(text));
        }
        if (parts.isEmpty()) {
            return Expr.string("");
        }
        if (parts.size() == 1) {
            Expr only = parts.get(0);
            // a lone interpolation still yields a string
            return only.type == ExprType.STRING ? only : Expr.add(List.of(Expr.string(""), only));
        }
        if (parts.get(0).type != ExprType.STRING) {
            parts.add(0, Expr.string(""));
        }
        return Expr.add(parts);
    }

}
