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

import java.util.List;
import java.util.Map;

/**
 * A queued timer. {@code env} is the environment the callback runs against, so a timer id bound
 * after scheduling is visible to the callback itself.
 */
public class ScheduledTask {

    final long id;
    long dueAt;
    long order;
    final Long intervalMs; // null for a one-shot timer
    final Object callback;
    final List<Object> args;
    final Map<String, Object> env;

    ScheduledTask(long id, long dueAt, long order, Long intervalMs, Object callback, List<Object> args,
                  Map<String, Object> env) {
        this.id = id;
        this.dueAt = dueAt;
        this.order = order;
        this.intervalMs = intervalMs;
        this.callback = callback;
        this.args = args;
        this.env = env;
    }

    public long getId() {
        return id;
    }

    public long getDueAt() {
        return dueAt;
    }

    public boolean isInterval() {
        return intervalMs != null;
    }

    @Override
    public String toString() {
        return (intervalMs == null ? "timeout#" : "interval#") + id + "@" + dueAt;
    }

}
