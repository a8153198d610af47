package org.example.ratelimit.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Runs a sweep task at a fixed delay while there is something to sweep.
 * <p>
 * The task is scheduled lazily by {@link #ensureRunning()}, cancels itself once a sweep
 * reports that nothing is left, and is scheduled again on the next call to
 * {@link #ensureRunning()}.
 */
public class CacheSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(CacheSweepScheduler.class);

    private final ScheduledExecutorService executor;
    private final long intervalMillis;
    private final Runnable sweep;
    private final BooleanSupplier hasEntries;
    private final AtomicReference<ScheduledFuture<?>> task = new AtomicReference<>();
    private volatile boolean shutdown;

    /**
     * @param sweep      runs one sweep pass
     * @param hasEntries reports whether anything is left to sweep
     */
    public CacheSweepScheduler(Duration interval, Runnable sweep, BooleanSupplier hasEntries) {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limit-cache-sweep");
            thread.setDaemon(true);
            return thread;
        }), interval, sweep, hasEntries);
    }

    CacheSweepScheduler(
            ScheduledExecutorService executor,
            Duration interval,
            Runnable sweep,
            BooleanSupplier hasEntries) {
        this.executor = executor;
        this.intervalMillis = Math.max(1, interval.toMillis());
        this.sweep = sweep;
        this.hasEntries = hasEntries;
    }

    public void ensureRunning() {
        if (shutdown || task.get() != null) {
            return;
        }
        ScheduledFuture<?> scheduled;
        try {
            scheduled = executor.scheduleWithFixedDelay(
                    this::runSweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // Lost a race with shutdown().
            log.debug("Rate limit cache sweep not started: executor is shut down");
            return;
        }
        if (!task.compareAndSet(null, scheduled)) {
            scheduled.cancel(false);
            return;
        }
        log.debug("Rate limit cache sweep started (interval={}ms)", intervalMillis);
    }

    public boolean isRunning() {
        return task.get() != null;
    }

    public void shutdown() {
        shutdown = true;
        ScheduledFuture<?> current = task.getAndSet(null);
        if (current != null) {
            current.cancel(false);
        }
        executor.shutdownNow();
    }

    void runSweep() {
        try {
            sweep.run();
        } catch (RuntimeException e) {
            log.warn("Rate limit cache sweep failed: {}", e.getMessage(), e);
            return;
        }
        if (hasEntries.getAsBoolean()) {
            return;
        }

        ScheduledFuture<?> current = task.getAndSet(null);
        if (current != null) {
            current.cancel(false);
            log.debug("Rate limit cache drained; sweep stopped");
        }
        // A write may have landed between the emptiness check and the cancel.
        if (hasEntries.getAsBoolean()) {
            ensureRunning();
        }
    }
}
