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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Element or text node of the minimal in-memory document.
 */
public class DomNode extends JsObject {

    final String tagName; // null for a text node
    String text;
    final Map<String, String> attributes = new LinkedHashMap<>();
    final List<DomNode> children = new ArrayList<>();
    DomNode parent;

    private DomNode(String tagName, String text) {
        this.tagName = tagName;
        this.text = text;
    }

    public static DomNode element(String tagName) {
        return new DomNode(tagName.toUpperCase(Locale.ROOT), null);
    }

    public static DomNode text(String text) {
        return new DomNode(null, text);
    }

    public boolean isText() {
        return tagName == null;
    }

    public String getTagName() {
        return tagName;
    }

    public String getId() {
        String id = attributes.get("id");
        return id == null ? "" : id;
    }

    public String getAttribute(String name) {
        return attributes.get(name.toLowerCase(Locale.ROOT));
    }

    public DomNode setAttribute(String name, String value) {
        attributes.put(name.toLowerCase(Locale.ROOT), value);
        return this;
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public List<DomNode> getChildren() {
        return children;
    }

    public DomNode getParent() {
        return parent;
    }

    public DomNode appendChild(DomNode child) {
        if (isText()) {
            throw new ScriptRuntimeException("cannot append a child to a text node");
        }
        for (DomNode node = this; node != null; node = node.parent) {
            if (node == child) {
                throw new ScriptRuntimeException("the new child is an ancestor of the parent");
            }
        }
        if (child.parent != null) {
            child.parent.children.remove(child);
        }
        child.parent = this;
        children.add(child);
        return child;
    }

    public String getTextContent() {
        if (isText()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (DomNode child : children) {
            sb.append(child.getTextContent());
        }
        return sb.toString();
    }

    public void setTextContent(String value) {
        if (isText()) {
            text = value;
            return;
        }
        for (DomNode child : children) {
            child.parent = null;
        }
        children.clear();
        if (!value.isEmpty()) {
            appendChild(text(value));
        }
    }

    boolean hasClass(String name) {
        String classes = attributes.get("class");
        if (classes == null) {
            return false;
        }
        for (String c : classes.trim().split("\\s+")) {
            if (c.equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (isText()) {
            return "[object Text]";
        }
        return "[object HTML" + tagName.charAt(0) + tagName.substring(1).toLowerCase(Locale.ROOT) + "Element]";
    }

}
