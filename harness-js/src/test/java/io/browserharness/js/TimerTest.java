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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimerTest extends EvalBase {

    @Test
    void testTimeoutOrder() {
        eval("let log = []; setTimeout(() => log.push('b'), 20); setTimeout(() => log.push('a'), 10)");
        assertEquals(0, engine.advanceTime(5));
        match(Engine.toJava(get("log")), "[]");
        assertEquals(2, engine.advanceTime(20));
        match(Engine.toJava(get("log")), "['a', 'b']");
        assertEquals(25, engine.getNowMs());
    }

    @Test
    void testIntervalClearsItselfThroughBoundId() {
        eval("let count = 0; let id = setInterval(() => { count++; clearInterval(id) }, 10)");
        engine.advanceTime(100);
        assertEquals(1L, get("count"));
        assertTrue(engine.getScheduler().getPendingTasks().isEmpty());
    }

    @Test
    void testConciseIntervalClearRunsOnce() {
        eval("let id = setInterval(() => clearInterval(id), 10)");
        assertEquals(1, engine.advanceTime(100));
    }

    @Test
    void testTimerIdBoundInsideFunction() {
        eval("let ticks = 0; function start() { let id = setInterval(() => { ticks++; clearInterval(id) }, 10) } start()");
        engine.advanceTime(50);
        assertEquals(1L, get("ticks"));
    }

    @Test
    void testClearBeforeDue() {
        eval("let hit = false; const t = setTimeout(() => { hit = true }, 10); clearTimeout(t)");
        engine.advanceTime(20);
        assertEquals(false, get("hit"));
    }

    @Test
    void testExtraArgumentsArePassed() {
        eval("let got; setTimeout((a, b) => { got = a + b }, 0, 2, 3)");
        assertEquals(1, engine.runDueTimers());
        assertEquals(5L, get("got"));
    }

    @Test
    void testStringCallback() {
        eval("let hits = 0; setTimeout('hits = hits + 1', 5)");
        engine.advanceTime(5);
        assertEquals(1L, get("hits"));
    }

    @Test
    void testAnimationFrame() {
        eval("let ts; requestAnimationFrame(t => { ts = t })");
        engine.advanceTime(16);
        assertEquals(16.0, get("ts"));
    }

    @Test
    void testTimerIdsAreNumbers() {
        assertEquals(1L, eval("setTimeout(() => 1, 0)"));
        assertEquals("number", eval("typeof setTimeout(() => 1, 0)"));
    }

    @Test
    void testMicrotasksBeforeTimers() {
        eval("let log = []; setTimeout(() => log.push('t'), 0);"
                + " Promise.resolve().then(() => log.push('p'));"
                + " queueMicrotask(() => log.push('m'));"
                + " log.push('s')");
        engine.flush();
        match(Engine.toJava(get("log")), "['s', 'p', 'm', 't']");
    }

    @Test
    void testRunawayIntervalHitsStepLimit() {
        eval("setInterval(() => {}, 0)");
        engine.setTimerStepLimit(50);
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> engine.flush());
        assertTrue(e.getMessage().contains("step limit"));
    }

    @Test
    void testCallbackMustBeFunction() {
        assertThrows(ScriptRuntimeException.class, () -> eval("setTimeout(42, 0)"));
    }

}
