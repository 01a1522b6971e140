package com.obsidx.watch;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChangeWatcherTest {

    private static final Duration DEBOUNCE = Duration.ofMillis(500);

    @Test
    void shouldRunOneCycleAtEndOfFixedWindow() throws Exception {
        ScriptedSource source = new ScriptedSource(100, 300, 550);
        List<Long> cycleTimes = new ArrayList<>();
        ChangeWatcher watcher = new ChangeWatcher(source, DEBOUNCE, () -> cycleTimes.add(source.nowMillis()), source::nowNanos);

        watcher.run();

        assertEquals(List.of(600L), cycleTimes);
        assertEquals(1, watcher.completedCycles());
        assertEquals(ChangeWatcher.State.IDLE, watcher.state());
    }

    @Test
    void shouldStartNewWindowForEventsAfterExpiry() throws Exception {
        ScriptedSource source = new ScriptedSource(0, 200, 700, 1500);
        List<Long> cycleTimes = new ArrayList<>();
        ChangeWatcher watcher = new ChangeWatcher(source, DEBOUNCE, () -> cycleTimes.add(source.nowMillis()), source::nowNanos);

        watcher.run();

        assertEquals(List.of(500L, 1200L, 2000L), cycleTimes);
    }

    @Test
    void shouldContinueAfterFailingCycle() throws Exception {
        ScriptedSource source = new ScriptedSource(0, 1000);
        List<Long> attempts = new ArrayList<>();
        ChangeWatcher watcher = new ChangeWatcher(source, DEBOUNCE, () -> {
            attempts.add(source.nowMillis());
            if (attempts.size() == 1) {
                throw new IOException("disk full");
            }
        }, source::nowNanos);

        watcher.run();

        assertEquals(List.of(500L, 1500L), attempts);
        assertEquals(1, watcher.failedCycles());
        assertEquals(1, watcher.completedCycles());
    }

    @Test
    void shouldStopWithoutCycleWhenStopRequestedDuringWindow() throws Exception {
        ScriptedSource source = new ScriptedSource(0, 100);
        List<Long> cycleTimes = new ArrayList<>();
        ChangeWatcher[] holder = new ChangeWatcher[1];
        source.onPoll = () -> holder[0].requestStop();
        holder[0] = new ChangeWatcher(source, DEBOUNCE, () -> cycleTimes.add(source.nowMillis()), source::nowNanos);

        holder[0].run();

        assertEquals(List.of(), cycleTimes);
        assertEquals(0, holder[0].completedCycles());
    }

    @Test
    void shouldRejectNegativeDebounce() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChangeWatcher(new ScriptedSource(), Duration.ofMillis(-1), () -> {
                }));
    }

    /**
     * Replays events at fixed millisecond offsets on a virtual clock. Waiting
     * in {@link #poll} advances the clock instead of sleeping; the source
     * reports closed once the script is exhausted.
     */
    private static final class ScriptedSource implements ChangeEventSource {
        private final Deque<Long> events = new ArrayDeque<>();
        private long nowNanos;
        Runnable onPoll = () -> {
        };

        ScriptedSource(long... eventMillis) {
            for (long millis : eventMillis) {
                events.add(TimeUnit.MILLISECONDS.toNanos(millis));
            }
        }

        long nowNanos() {
            return nowNanos;
        }

        long nowMillis() {
            return TimeUnit.NANOSECONDS.toMillis(nowNanos);
        }

        @Override
        public Path take() {
            Long next = events.poll();
            if (next == null) {
                return null;
            }
            nowNanos = Math.max(nowNanos, next);
            return Path.of("note.md");
        }

        @Override
        public Path poll(long timeout, TimeUnit unit) {
            onPoll.run();
            long deadline = nowNanos + unit.toNanos(timeout);
            Long next = events.peek();
            if (next != null && next <= deadline) {
                events.poll();
                nowNanos = Math.max(nowNanos, next);
                return Path.of("note.md");
            }
            nowNanos = deadline;
            return null;
        }

        @Override
        public void close() {
        }
    }
}
