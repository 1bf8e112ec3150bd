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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Cooperative single-threaded scheduler over a virtual clock. Tasks run in {@code (dueAt, order)}
 * order and the microtask queue is drained before the first task and after every task.
 */
public class Scheduler {

    static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

    public static final int DEFAULT_STEP_LIMIT = 10_000;
    static final int MICROTASK_LIMIT = 100_000;

    private static final Comparator<ScheduledTask> DUE_ORDER =
            Comparator.comparingLong((ScheduledTask t) -> t.dueAt).thenComparingLong(t -> t.order);

    private long nowMs;
    private long nextTimerId = 1;
    private long nextOrder;
    private int stepLimit = DEFAULT_STEP_LIMIT;

    private final Map<Long, ScheduledTask> tasks = new LinkedHashMap<>();
    private final Deque<Microtask> microtasks = new ArrayDeque<>();

    private ScheduledTask running;
    private boolean runningCancelled;
    private Consumer<ScheduledTask> runner;

    void setRunner(Consumer<ScheduledTask> runner) {
        this.runner = runner;
    }

    public long getNowMs() {
        return nowMs;
    }

    public void setNowMs(long nowMs) {
        this.nowMs = nowMs;
    }

    public int getStepLimit() {
        return stepLimit;
    }

    public void setStepLimit(int stepLimit) {
        this.stepLimit = stepLimit;
    }

    public long scheduleTimeout(Object callback, long delayMs, List<Object> args, Map<String, Object> env) {
        return schedule(callback, Math.max(0, delayMs), null, args, env);
    }

    public long scheduleInterval(Object callback, long delayMs, List<Object> args, Map<String, Object> env) {
        long interval = Math.max(0, delayMs);
        return schedule(callback, interval, interval, args, env);
    }

    private long schedule(Object callback, long delay, Long interval, List<Object> args, Map<String, Object> env) {
        long id = nextTimerId++;
        ScheduledTask task = new ScheduledTask(id, nowMs + delay, nextOrder++, interval, callback, args, env);
        tasks.put(id, task);
        if (logger.isTraceEnabled()) {
            logger.trace("scheduled {}", task);
        }
        return id;
    }

    public void queueMicrotask(String label, Runnable job) {
        microtasks.add(new Microtask(label, job));
    }

    /**
     * Removes a queued timer; when called from inside a running interval's own callback, also stops it
     * from being re-queued.
     */
    public boolean clearTimer(long id) {
        if (running != null && running.id == id) {
            runningCancelled = true;
        }
        return tasks.remove(id) != null;
    }

    /**
     * Stores a timer's id under {@code name} in the environment of that same queued timer.
     */
    public void bindTimerId(String name, long id) {
        ScheduledTask task = tasks.get(id);
        if (task != null && task.env != null) {
            task.env.put(name, id);
        }
    }

    public List<ScheduledTask> getPendingTasks() {
        List<ScheduledTask> list = new ArrayList<>(tasks.values());
        list.sort(DUE_ORDER);
        return list;
    }

    public int getMicrotaskCount() {
        return microtasks.size();
    }

    public int runMicrotasks() {
        int count = 0;
        while (!microtasks.isEmpty()) {
            if (++count > MICROTASK_LIMIT) {
                throw new ScriptRuntimeException("microtask limit exceeded: " + MICROTASK_LIMIT);
            }
            Microtask microtask = microtasks.poll();
            try {
                microtask.job.run();
            } catch (RuntimeException e) {
                logger.warn("microtask '{}' failed: {}", microtask.label, e.getMessage());
                throw e;
            }
        }
        return count;
    }

    /**
     * Runs the tasks already due at the current time.
     */
    public int runDueTimers() {
        return run(nowMs, false);
    }

    /**
     * Moves the clock forward, running every task that falls due on the way at its own due time.
     */
    public int advanceTime(long ms) {
        if (ms < 0) {
            throw new ScriptRuntimeException("cannot move time backwards: " + ms);
        }
        return run(nowMs + ms, false);
    }

    /**
     * Runs tasks until none is left, moving the clock as far as needed.
     */
    public int flush() {
        return run(Long.MAX_VALUE, true);
    }

    private int run(long until, boolean all) {
        runMicrotasks();
        int steps = 0;
        while (true) {
            ScheduledTask task = nextTask();
            if (task == null || !all && task.dueAt > until) {
                break;
            }
            if (++steps > stepLimit) {
                throw new ScriptRuntimeException("timer step limit exceeded: " + stepLimit);
            }
            tasks.remove(task.id);
            if (task.dueAt > nowMs) {
                nowMs = task.dueAt;
            }
            if (logger.isDebugEnabled()) {
                logger.debug("running {} at {}", task, nowMs);
            }
            running = task;
            runningCancelled = false;
            try {
                runner.accept(task);
            } catch (RuntimeException e) {
                logger.warn("timer {} failed: {}", task.id, e.getMessage());
                throw e;
            } finally {
                running = null;
            }
            if (task.intervalMs != null && !runningCancelled) {
                task.dueAt = nowMs + task.intervalMs;
                task.order = nextOrder++;
                tasks.put(task.id, task);
            }
            runMicrotasks();
        }
        if (!all && until > nowMs) {
            nowMs = until;
        }
        return steps;
    }

    private ScheduledTask nextTask() {
        ScheduledTask next = null;
        for (ScheduledTask task : tasks.values()) {
            if (next == null || DUE_ORDER.compare(task, next) < 0) {
                next = task;
            }
        }
        return next;
    }

}
