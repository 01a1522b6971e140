package com.obsidx.watch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debounced reindex loop. The first event arms one timer of fixed length;
 * events arriving before it expires are drained without re-arming it. On
 * expiry exactly one reindex cycle runs on the loop thread, so cycles never
 * overlap, and a failing cycle is logged and the loop re-arms.
 */
public class ChangeWatcher {
    private static final Logger log = LoggerFactory.getLogger(ChangeWatcher.class);

    public enum State {
        IDLE,
        DEBOUNCING,
        REINDEXING
    }

    @FunctionalInterface
    public interface ReindexCycle {
        void run() throws Exception;
    }

    private final ChangeEventSource events;
    private final Duration debounce;
    private final ReindexCycle cycle;
    private final LongSupplier nanoClock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private volatile State state = State.IDLE;

    public ChangeWatcher(ChangeEventSource events, Duration debounce, ReindexCycle cycle) {
        this(events, debounce, cycle, System::nanoTime);
    }

    ChangeWatcher(ChangeEventSource events, Duration debounce, ReindexCycle cycle, LongSupplier nanoClock) {
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must be >= 0");
        }
        this.events = events;
        this.debounce = debounce;
        this.cycle = cycle;
        this.nanoClock = nanoClock;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public void run() throws InterruptedException {
        log.info("watch.started debounceMs={}", debounce.toMillis());
        while (!stopRequested.get()) {
            state = State.IDLE;
            Path first = events.take();
            if (first == null) {
                break;
            }

            state = State.DEBOUNCING;
            long deadline = nanoClock.getAsLong() + debounce.toNanos();
            int absorbed = drainUntil(deadline);
            if (stopRequested.get()) {
                break;
            }

            state = State.REINDEXING;
            runCycle(first, absorbed);
        }
        state = State.IDLE;
        log.info("watch.stopped cycles={} failed={}", completedCycles.get(), failedCycles.get());
    }

    public State state() {
        return state;
    }

    public long completedCycles() {
        return completedCycles.get();
    }

    public long failedCycles() {
        return failedCycles.get();
    }

    private int drainUntil(long deadlineNanos) throws InterruptedException {
        int absorbed = 0;
        long remaining;
        while (!stopRequested.get() && (remaining = deadlineNanos - nanoClock.getAsLong()) > 0) {
            if (events.poll(remaining, TimeUnit.NANOSECONDS) != null) {
                absorbed++;
            }
        }
        return absorbed;
    }

    private void runCycle(Path trigger, int absorbed) throws InterruptedException {
        long started = nanoClock.getAsLong();
        log.info("watch.cycle.started trigger={} absorbedEvents={}", trigger, absorbed);
        try {
            cycle.run();
            completedCycles.incrementAndGet();
            log.info("watch.cycle.completed elapsedMs={}", (nanoClock.getAsLong() - started) / 1_000_000);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            failedCycles.incrementAndGet();
            log.error("watch.cycle.failed reason={}", e.getMessage(), e);
        }
    }
}
