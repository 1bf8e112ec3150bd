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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvalBase {

    static final Logger logger = LoggerFactory.getLogger(EvalBase.class);

    Engine engine;

    Object eval(String text) {
        return eval(text, null);
    }

    @SuppressWarnings("unchecked")
    Object eval(String text, String vars) {
        engine = new Engine();
        if (vars != null) {
            Map<String, Object> map = (Map<String, Object>) JSONValue.parse(vars);
            map.forEach(engine::put);
        }
        return Engine.toJava(engine.run(text));
    }

    void matchEval(String text, String expected) {
        matchEval(text, expected, null);
    }

    void matchEval(String text, String expected, String vars) {
        match(eval(text, vars), expected);
    }

    void match(Object actual, String expected) {
        assertEquals(normalize(JSONValue.parse(expected)), normalize(actual));
    }

    Object get(String name) {
        return engine.get(name);
    }

    /**
     * Integral numbers compare as longs so that parsed JSON and script values line up.
     */
    @SuppressWarnings("unchecked")
    static Object normalize(Object o) {
        if (o instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<>();
            ((Map<String, Object>) o).forEach((k, v) -> map.put(k, normalize(v)));
            return map;
        }
        if (o instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<Object>) o) {
                list.add(normalize(item));
            }
            return list;
        }
        if (o instanceof Number && !(o instanceof java.math.BigInteger)) {
            double d = ((Number) o).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
            return d;
        }
        return o;
    }

}
