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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    final List<String> log = new ArrayList<>();

    Scheduler scheduler() {
        Scheduler scheduler = new Scheduler();
        scheduler.setRunner(task -> log.add(task.callback + "@" + scheduler.getNowMs()));
        return scheduler;
    }

    @Test
    void testDueOrderThenInsertionOrder() {
        Scheduler scheduler = scheduler();
        scheduler.scheduleTimeout("b", 20, Collections.emptyList(), null);
        scheduler.scheduleTimeout("a", 10, Collections.emptyList(), null);
        scheduler.scheduleTimeout("c", 20, Collections.emptyList(), null);
        assertEquals(3, scheduler.advanceTime(25));
        assertEquals(List.of("a@10", "b@20", "c@20"), log);
        assertEquals(25, scheduler.getNowMs());
    }

    @Test
    void testTimerIdsIncrease() {
        Scheduler scheduler = scheduler();
        long first = scheduler.scheduleTimeout("x", 0, Collections.emptyList(), null);
        long second = scheduler.scheduleInterval("y", 5, Collections.emptyList(), null);
        assertEquals(1, first);
        assertEquals(2, second);
        List<ScheduledTask> pending = scheduler.getPendingTasks();
        assertEquals(2, pending.size());
        assertFalse(pending.get(0).isInterval());
        assertTrue(pending.get(1).isInterval());
    }

    @Test
    void testNegativeDelayIsZero() {
        Scheduler scheduler = scheduler();
        scheduler.scheduleTimeout("x", -50, Collections.emptyList(), null);
        assertEquals(1, scheduler.runDueTimers());
        assertEquals(List.of("x@0"), log);
    }

    @Test
    void testIntervalRequeues() {
        Scheduler scheduler = scheduler();
        scheduler.scheduleInterval("tick", 10, Collections.emptyList(), null);
        assertEquals(3, scheduler.advanceTime(35));
        assertEquals(List.of("tick@10", "tick@20", "tick@30"), log);
        assertEquals(1, scheduler.getPendingTasks().size());
        assertEquals(40, scheduler.getPendingTasks().get(0).getDueAt());
    }

    @Test
    void testClearTimer() {
        Scheduler scheduler = scheduler();
        long id = scheduler.scheduleTimeout("x", 10, Collections.emptyList(), null);
        assertTrue(scheduler.clearTimer(id));
        assertFalse(scheduler.clearTimer(id));
        assertFalse(scheduler.clearTimer(999));
        assertEquals(0, scheduler.advanceTime(20));
        assertTrue(log.isEmpty());
    }

    @Test
    void testIntervalCancelledFromOwnCallback() {
        Scheduler scheduler = new Scheduler();
        long[] id = new long[1];
        scheduler.setRunner(task -> {
            log.add("run");
            scheduler.clearTimer(id[0]);
        });
        id[0] = scheduler.scheduleInterval("x", 10, Collections.emptyList(), null);
        scheduler.advanceTime(100);
        assertEquals(List.of("run"), log);
        assertTrue(scheduler.getPendingTasks().isEmpty());
    }

    @Test
    void testMicrotasksDrainBeforeAndAfterTasks() {
        Scheduler scheduler = new Scheduler();
        scheduler.setRunner(task -> {
            log.add("task");
            scheduler.queueMicrotask("after", () -> log.add("micro-after"));
        });
        scheduler.scheduleTimeout("x", 0, Collections.emptyList(), null);
        scheduler.scheduleTimeout("y", 0, Collections.emptyList(), null);
        scheduler.queueMicrotask("before", () -> log.add("micro-before"));
        scheduler.flush();
        assertEquals(List.of("micro-before", "task", "micro-after", "task", "micro-after"), log);
        assertEquals(0, scheduler.getMicrotaskCount());
    }

    @Test
    void testMicrotasksQueuedByMicrotasksRunInSameDrain() {
        Scheduler scheduler = scheduler();
        scheduler.queueMicrotask("outer", () -> {
            log.add("outer");
            scheduler.queueMicrotask("inner", () -> log.add("inner"));
        });
        assertEquals(2, scheduler.runMicrotasks());
        assertEquals(List.of("outer", "inner"), log);
    }

    @Test
    void testFlushMovesClock() {
        Scheduler scheduler = scheduler();
        scheduler.scheduleTimeout("late", 5000, Collections.emptyList(), null);
        assertEquals(1, scheduler.flush());
        assertEquals(5000, scheduler.getNowMs());
    }

    @Test
    void testStepLimit() {
        Scheduler scheduler = scheduler();
        scheduler.setStepLimit(5);
        scheduler.scheduleInterval("spin", 0, Collections.emptyList(), null);
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, scheduler::flush);
        assertTrue(e.getMessage().contains("timer step limit exceeded"));
        assertEquals(5, log.size());
    }

    @Test
    void testCannotMoveBackwards() {
        assertThrows(ScriptRuntimeException.class, () -> scheduler().advanceTime(-1));
    }

    @Test
    void testBindTimerId() {
        Scheduler scheduler = scheduler();
        Map<String, Object> env = new HashMap<>();
        long id = scheduler.scheduleTimeout("x", 10, Collections.emptyList(), env);
        scheduler.bindTimerId("handle", id);
        assertEquals(id, env.get("handle"));
        scheduler.bindTimerId("other", 42);
        assertFalse(env.containsKey("other"));
    }

}
