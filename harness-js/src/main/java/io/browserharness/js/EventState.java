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

/**
 * Event snapshot visible to a handler through its event parameter.
 */
public class EventState {

    final String type;
    final DomNode target;
    DomNode currentTarget;
    long timeStamp;
    boolean bubbles;
    boolean cancelable;
    boolean defaultPrevented;
    boolean isTrusted = true;
    boolean propagationStopped;
    int eventPhase = 2;

    public EventState(String type, DomNode target) {
        this.type = type;
        this.target = target;
        this.currentTarget = target;
    }

    public EventState currentTarget(DomNode node) {
        this.currentTarget = node;
        return this;
    }

    public EventState timeStamp(long timeStamp) {
        this.timeStamp = timeStamp;
        return this;
    }

    public EventState bubbles(boolean bubbles) {
        this.bubbles = bubbles;
        return this;
    }

    public EventState cancelable(boolean cancelable) {
        this.cancelable = cancelable;
        return this;
    }

    public EventState trusted(boolean trusted) {
        this.isTrusted = trusted;
        return this;
    }

    public EventState eventPhase(int eventPhase) {
        this.eventPhase = eventPhase;
        return this;
    }

    public String getType() {
        return type;
    }

    public boolean isDefaultPrevented() {
        return defaultPrevented;
    }

    public boolean isPropagationStopped() {
        return propagationStopped;
    }

    void preventDefault() {
        if (cancelable) {
            defaultPrevented = true;
        }
    }

    /**
     * Value of {@code event.<path>} for the paths the parser recognizes, e.g. {@code target.id}.
     */
    Object property(String path) {
        switch (path) {
            case "type":
                return type;
            case "target":
                return nodeOrNull(target);
            case "currentTarget":
                return nodeOrNull(currentTarget);
            case "target.id":
                return target == null ? Terms.UNDEFINED : target.getId();
            case "currentTarget.id":
                return currentTarget == null ? Terms.UNDEFINED : currentTarget.getId();
            case "target.name":
                return nameOf(target);
            case "currentTarget.name":
                return nameOf(currentTarget);
            case "defaultPrevented":
                return defaultPrevented;
            case "isTrusted":
                return isTrusted;
            case "bubbles":
                return bubbles;
            case "cancelable":
                return cancelable;
            case "eventPhase":
                return (long) eventPhase;
            case "timeStamp":
                return timeStamp;
            default:
                return Terms.UNDEFINED;
        }
    }

    private static Object nodeOrNull(DomNode node) {
        return node == null ? null : node;
    }

    private static Object nameOf(DomNode node) {
        if (node == null) {
            return Terms.UNDEFINED;
        }
        String name = node.getAttribute("name");
        return name == null ? "" : name;
    }

    @Override
    public String toString() {
        return "[object Event]";
    }

}
