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

public enum ExprType {

    // literals
    STRING,
    NUMBER,
    FLOAT,
    BIGINT,
    BOOL,
    NULL,
    UNDEFINED,
    REGEX_LITERAL,
    ARRAY_LITERAL,
    OBJECT_LITERAL,
    FUNCTION,

    // operators
    BINARY,
    ADD,
    TERNARY,
    COMMA,
    SPREAD,
    NEG,
    POS,
    NOT,
    BIT_NOT,
    TYPEOF,
    VOID,
    DELETE,
    AWAIT,
    YIELD,
    YIELD_STAR,

    // references and calls
    VAR,
    MEMBER_GET,
    INDEX_GET,
    MEMBER_CALL,
    FUNCTION_CALL,
    CALL,

    // regex
    REGEX_NEW,
    REGEX_METHOD,

    // constructors
    NEW_DATE,
    NEW_MAP,
    NEW_SET,
    NEW_PROMISE,
    NEW_ARRAY_BUFFER,
    NEW_TYPED_ARRAY,
    NEW_BLOB,
    NEW_URL,
    NEW_URL_SEARCH_PARAMS,
    NEW_ERROR,
    NEW_INTL,
    NEW_CALLEE,

    // builtin namespaces and globals
    DATE_NOW,
    DATE_PARSE,
    DATE_UTC,
    PERFORMANCE_NOW,
    MATH_CONST,
    MATH_CALL,
    NUMBER_CALL,
    NUMBER_STATIC,
    NUMBER_CONST,
    STRING_CALL,
    BIGINT_CALL,
    SYMBOL_CALL,
    SYMBOL_FOR,
    PARSE_INT,
    PARSE_FLOAT,
    IS_NAN,
    IS_FINITE,
    URI_CODEC,
    ATOB,
    BTOA,
    STRUCTURED_CLONE,
    JSON_PARSE,
    JSON_STRINGIFY,
    OBJECT_STATIC,
    ARRAY_IS_ARRAY,
    ARRAY_STATIC,
    PROMISE_STATIC,
    ARRAY_BUFFER_IS_VIEW,

    // platform
    SET_TIMEOUT,
    SET_INTERVAL,
    CLEAR_TIMER,
    REQUEST_ANIMATION_FRAME,
    QUEUE_MICROTASK,
    DOM_QUERY,
    DOM_CREATE,
    EVENT_PROP

}
