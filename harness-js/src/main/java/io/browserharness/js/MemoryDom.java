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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Document held in memory: an {@code html} root with a {@code body}. Selectors are limited to one
 * compound of tag name, {@code #id} and {@code .class} parts.
 */
public class MemoryDom implements DomHost {

    private final DomNode root = DomNode.element("html");
    private final DomNode body = DomNode.element("body");

    public MemoryDom() {
        root.appendChild(body);
    }

    @Override
    public DomNode getRoot() {
        return root;
    }

    @Override
    public DomNode getBody() {
        return body;
    }

    @Override
    public DomNode getElementById(String id) {
        for (DomNode node : elements()) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }

    @Override
    public DomNode querySelector(String selector) {
        String s = selector.trim();
        if (s.isEmpty()) {
            throw new ScriptRuntimeException("'" + selector + "' is not a valid selector");
        }
        String tag = null;
        String id = null;
        List<String> classes = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            boolean prefixed = c == '#' || c == '.';
            int from = prefixed ? i + 1 : i;
            int end = from;
            while (end < s.length() && isNameChar(s.charAt(end))) {
                end++;
            }
            if (end == from || !prefixed && i != 0) {
                throw new ScriptRuntimeException("'" + selector + "' is not a valid selector");
            }
            String name = s.substring(from, end);
            if (c == '#') {
                id = name;
            } else if (c == '.') {
                classes.add(name);
            } else {
                tag = name.toUpperCase(Locale.ROOT);
            }
            i = end;
        }
        for (DomNode node : elements()) {
            if (tag != null && !tag.equals(node.tagName)) {
                continue;
            }
            if (id != null && !id.equals(node.getId())) {
                continue;
            }
            boolean match = true;
            for (String c : classes) {
                if (!node.hasClass(c)) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return node;
            }
        }
        return null;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_';
    }

    @Override
    public DomNode createElement(String tagName) {
        if (tagName.isEmpty()) {
            throw new ScriptRuntimeException("invalid tag name");
        }
        return DomNode.element(tagName);
    }

    @Override
    public DomNode createTextNode(String text) {
        return DomNode.text(text);
    }

    private List<DomNode> elements() {
        List<DomNode> list = new ArrayList<>();
        collect(root, list);
        return list;
    }

    private static void collect(DomNode node, List<DomNode> list) {
        if (node.isText()) {
            return;
        }
        list.add(node);
        for (DomNode child : node.children) {
            collect(child, list);
        }
    }

}
