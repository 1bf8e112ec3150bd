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

class PlatformTest extends EvalBase {

    @Test
    void testDomBuildAndQuery() {
        matchEval("const div = document.createElement('div'); div.id = 'box'; div.setAttribute('class', 'a b');"
                        + " document.body.appendChild(div); div.textContent = 'hi';"
                        + " const found = document.getElementById('box');"
                        + " [found === div, document.querySelector('div.b') === div, found.tagName, found.textContent, document.body.textContent]",
                "[true, true, 'DIV', 'hi', 'hi']");
        DomNode box = engine.getDom().getElementById("box");
        assertEquals("DIV", box.getTagName());
        assertEquals("a b", box.getAttribute("class"));
        assertSame(engine.getDom().getBody(), box.getParent());
        assertNull(eval("document.getElementById('missing')"));
    }

    @Test
    void testDomErrors() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("document.querySelector('div > p')"));
        assertTrue(e.getMessage().contains("is not a valid selector"));
        e = assertThrows(ScriptRuntimeException.class, () -> eval("const d = document.createElement('div'); d.appendChild('text')"));
        assertTrue(e.getMessage().contains("appendChild"));
        e = assertThrows(ScriptRuntimeException.class, () -> eval("const d = document.createElement('div'); const c = document.createElement('p'); c.appendChild(d); d.appendChild(c)"));
        assertTrue(e.getMessage().contains("ancestor"));
    }

    @Test
    void testEventBinding() {
        Engine engine = new Engine();
        DomNode button = DomNode.element("button").setAttribute("id", "go").setAttribute("name", "submit");
        engine.getDom().getBody().appendChild(button);
        EventState event = new EventState("click", button).cancelable(true);
        engine.setEvent("e", event);
        assertEquals("click", engine.run("e.type"));
        assertEquals("go", engine.run("e.target.id"));
        assertEquals("submit", engine.run("e.target.name"));
        assertEquals(true, engine.run("e.isTrusted"));
        engine.run("e.preventDefault(); e.stopPropagation()");
        assertTrue(event.isDefaultPrevented());
        assertTrue(event.isPropagationStopped());
        assertEquals(true, engine.run("e.defaultPrevented"));
    }

    @Test
    void testPreventDefaultNeedsCancelable() {
        Engine engine = new Engine();
        EventState event = new EventState("input", DomNode.element("input"));
        engine.setEvent("ev", event);
        engine.run("ev.preventDefault()");
        assertFalse(event.isDefaultPrevented());
    }

    @Test
    void testEventVisibleToTimerCallback() {
        Engine engine = new Engine();
        EventState event = new EventState("click", DomNode.element("a"));
        engine.setEvent("e", event);
        engine.run("let seen; setTimeout(() => { seen = e.type }, 5)");
        engine.flush();
        assertEquals("click", engine.get("seen"));
    }

    @Test
    void testStorage() {
        matchEval("localStorage.setItem('k', 1); [localStorage.getItem('k'), localStorage.length, localStorage.getItem('missing'), localStorage.k]",
                "['1', 1, null, '1']");
        assertEquals("1", engine.getLocalStorage().getItem("k"));
        assertEquals("a", eval("localStorage.setItem('a', 'x'); localStorage.key(0)"));
        assertEquals(0L, eval("sessionStorage.setItem('a', 'x'); sessionStorage.clear(); sessionStorage.length"));
        assertEquals("5", eval("localStorage.n = 5; localStorage.getItem('n')"));
    }

    @Test
    void testUrl() {
        matchEval("const u = new URL('https://Example.com:443/a/b?x=1&y=two#frag');"
                        + " [u.protocol, u.hostname, u.port, u.pathname, u.search, u.hash, u.origin, u.searchParams.get('y')]",
                "['https:', 'example.com', '', '/a/b', '?x=1&y=two', '#frag', 'https://example.com', 'two']");
        assertEquals("http://h.com/a/c?q=1", eval("const u = new URL('../c?q=1', 'http://h.com/a/b/'); u.href"));
        assertEquals("h.com:8080", eval("const u = new URL('http://h.com:8080/'); u.host"));
    }

    @Test
    void testUrlSearchParamsUpdateOwner() {
        assertEquals("https://e.com/p?x=a+b&y=2#f",
                eval("const u = new URL('https://e.com/p?x=1&y=2#f'); u.searchParams.set('x', 'a b'); u.href"));
        assertEquals("https://e.com/p", eval("const u = new URL('https://e.com/p?x=1'); u.searchParams.delete('x'); u.href"));
    }

    @Test
    void testInvalidUrl() {
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("new URL('nope')"));
        assertEquals("Invalid URL: nope", e.getMessage());
    }

    @Test
    void testUrlSearchParams() {
        matchEval("const p = new URLSearchParams('a=1&b=2&a=3'); [p.getAll('a'), p.has('b'), p.get('zz'), p.size]",
                "[['1', '3'], true, null, 3]");
        assertEquals("a=1&b=2&a=3", eval("const p = new URLSearchParams('a=1&b=2&a=3'); p.toString()"));
        assertEquals("k=v", eval("const p = new URLSearchParams({ k: 'v' }); p.toString()"));
    }

    @Test
    void testTypedArraysShareBuffer() {
        matchEval("const b = new ArrayBuffer(8); const v = new Uint8Array(b); v[0] = 255; v[1] = 256;"
                + " const w = new Int8Array(b); [v[0], v[1], w[0], b.byteLength, v.length]", "[255, 0, -1, 8, 8]");
        matchEval("const a = new Uint8Array([1, 2, 3, 4]); const s = a.subarray(1, 3); s[0] = 9; [a[1], s.length]", "[9, 2]");
        matchEval("const c = new Uint8ClampedArray([300, -5, 7]); [c[0], c[1], c[2]]", "[255, 0, 7]");
        assertEquals(0.5, eval("const f = new Float64Array([0.5]); f[0]"));
        assertEquals(4L, eval("const i = new Int32Array(4); i.BYTES_PER_ELEMENT"));
    }

    @Test
    void testDetachedBuffer() {
        matchEval("const b = new ArrayBuffer(4); const v = new Uint8Array(b); const t = b.transfer();"
                + " [b.detached, b.byteLength, t.byteLength, v.length]", "[true, 0, 4, 0]");
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> eval("const b = new ArrayBuffer(4); const v = new Uint8Array(b); b.transfer(); v.fill(1)"));
        assertEquals("ArrayBuffer is detached", e.getMessage());
        assertThrows(ScriptRuntimeException.class, () -> eval("const b = new ArrayBuffer(4); b.transfer(); b.slice(0)"));
    }

    @Test
    void testResizableBuffer() {
        matchEval("const b = new ArrayBuffer(2, { maxByteLength: 8 }); const v = new Uint16Array(b); b.resize(6); [b.resizable, b.maxByteLength, v.length]",
                "[true, 8, 3]");
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> eval("const b = new ArrayBuffer(2); b.resize(4)"));
        assertTrue(e.getMessage().contains("not resizable"));
    }

    @Test
    void testBlob() {
        matchEval("const bl = new Blob(['ab', 'c'], { type: 'Text/Plain' }); [bl.size, bl.type]", "[3, 'text/plain']");
        eval("let out; const bl = new Blob(['ab', 'c']); bl.text().then(t => { out = t })");
        engine.flush();
        assertEquals("abc", get("out"));
    }

    @Test
    void testIntlNumberFormat() {
        assertEquals("1,234.5", eval("const f = new Intl.NumberFormat('en-US'); f.format(1234.5)"));
        assertEquals("1,234.50", eval("const f = new Intl.NumberFormat('en-US', { minimumFractionDigits: 2 }); f.format(1234.5)"));
        assertEquals("$3.50", eval("const f = new Intl.NumberFormat('en-US', { style: 'currency', currency: 'USD' }); f.format(3.5)"));
        assertEquals("1234", eval("const f = new Intl.NumberFormat('en-US', { useGrouping: false }); f.format(1234)"));
        assertThrows(ScriptRuntimeException.class, () -> eval("const f = new Intl.NumberFormat('en-US', { style: 'currency' }); f.format(1)"));
    }

}
