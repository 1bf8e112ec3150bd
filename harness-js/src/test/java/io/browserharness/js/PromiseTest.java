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

class PromiseTest extends EvalBase {

    @Test
    void testSettlesOnce() {
        eval("let r; let j; const p = new Promise((res, rej) => { r = res; j = rej }); r(1); r(2); j('no')");
        JsPromise p = (JsPromise) get("p");
        assertEquals(JsPromise.State.FULFILLED, p.getState());
        assertEquals(1L, p.getValue());
    }

    @Test
    void testThenRunsAsMicrotask() {
        eval("let out = 'sync'; Promise.resolve(1).then(v => { out = v })");
        assertEquals("sync", get("out"));
        assertEquals(1, engine.runMicrotasks());
        assertEquals(1L, get("out"));
    }

    @Test
    void testChainedThen() {
        eval("let out; Promise.resolve(1).then(v => v + 1).then(v => { out = v * 10 })");
        engine.flush();
        assertEquals(20L, get("out"));
    }

    @Test
    void testCatchAndFinally() {
        eval("let err; let done = false; Promise.reject(new Error('boom')).catch(e => { err = e.message }).finally(() => { done = true })");
        engine.flush();
        assertEquals("boom", get("err"));
        assertEquals(true, get("done"));
    }

    @Test
    void testExecutorThrowRejects() {
        eval("let msg; new Promise(() => { throw new Error('inside') }).catch(e => { msg = e.message })");
        engine.flush();
        assertEquals("inside", get("msg"));
    }

    @Test
    void testAsyncFunction() {
        eval("async function f() { return 5 }\nlet out; const p = f(); p.then(v => { out = v })");
        assertInstanceOf(JsPromise.class, get("p"));
        engine.flush();
        assertEquals(5L, get("out"));
    }

    @Test
    void testAsyncFunctionThrowRejects() {
        eval("async function f() { throw new Error('x') }\nlet msg; f().catch(e => { msg = e.message })");
        engine.flush();
        assertEquals("x", get("msg"));
    }

    @Test
    void testAwaitSettledPromise() {
        eval("async function g() { const v = await Promise.resolve(3); return v * 2 }\nlet res; g().then(v => { res = v })");
        engine.flush();
        assertEquals(6L, get("res"));
        assertEquals(4L, eval("await 4"));
    }

    @Test
    void testAwaitRunsDueTimers() {
        assertEquals(5L, eval("let p = new Promise(r => setTimeout(() => r(5), 0)); await p"));
        assertEquals(0L, engine.getNowMs());
    }

    @Test
    void testAwaitFutureTimerStaysPending() {
        assertNull(eval("let p = new Promise(r => setTimeout(() => r(5), 100)); await p"));
        assertEquals(0L, engine.getNowMs());
        assertEquals(1, engine.getScheduler().getPendingTasks().size());
    }

    @Test
    void testRepeatedAwaitSameValue() {
        eval("const p = Promise.resolve({ n: 1 }); const a = await p; const b = await p");
        assertSame(get("a"), get("b"));
        assertEquals(7L, eval("let p = new Promise(r => setTimeout(() => r(7), 0)); let x = await p; let y = await p; x === y ? y : -1"));
    }

    @Test
    void testAwaitRejectedThrows() {
        ScriptThrownException e = assertThrows(ScriptThrownException.class, () -> eval("await Promise.reject('nope')"));
        assertEquals("nope", e.getValue());
    }

    @Test
    void testAll() {
        eval("let out; Promise.all([1, Promise.resolve(2), new Promise(r => setTimeout(() => r(3), 10))]).then(v => { out = v })");
        engine.flush();
        match(Engine.toJava(get("out")), "[1, 2, 3]");
        assertEquals(10L, engine.getNowMs());
    }

    @Test
    void testAllRejectsOnFirstFailure() {
        eval("let why; Promise.all([Promise.resolve(1), Promise.reject('bad')]).catch(e => { why = e })");
        engine.flush();
        assertEquals("bad", get("why"));
    }

    @Test
    void testAllSettled() {
        eval("let out; Promise.allSettled([Promise.resolve(1), Promise.reject('e')]).then(v => { out = v })");
        engine.flush();
        match(Engine.toJava(get("out")), "[{ status: 'fulfilled', value: 1 }, { status: 'rejected', reason: 'e' }]");
    }

    @Test
    void testRaceAndAny() {
        eval("let first; Promise.race([new Promise(r => setTimeout(() => r('slow'), 20)), new Promise(r => setTimeout(() => r('fast'), 5))]).then(v => { first = v })");
        engine.flush();
        assertEquals("fast", get("first"));
        eval("let name; Promise.any([Promise.reject(1), Promise.reject(2)]).catch(e => { name = e.name })");
        engine.flush();
        assertEquals("AggregateError", get("name"));
    }

    @Test
    void testResolveWithPromiseAdoptsState() {
        eval("let out; new Promise(res => res(Promise.resolve('inner'))).then(v => { out = v })");
        engine.flush();
        assertEquals("inner", get("out"));
    }

    @Test
    void testNonFunctionExecutor() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("new Promise(1)"));
        assertTrue(e.getMessage().contains("is not a function"));
    }

}
