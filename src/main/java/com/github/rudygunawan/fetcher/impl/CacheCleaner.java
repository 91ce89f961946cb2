package com.github.rudygunawan.fetcher.impl;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a cache sweep periodically on a scheduler.
 *
 * <p>Sweeps are scheduled with a fixed delay, so a sweep never overlaps the previous one. Starting
 * a running cleaner restarts it with the new interval; stopping a stopped cleaner does nothing.
 *
 * <p>When no scheduler is supplied the cleaner creates a single daemon thread named
 * {@code fetcher-cache-cleanup} on first start and shuts it down on {@link #close()}. A supplied
 * scheduler is never shut down by the cleaner.
 */
public class CacheCleaner {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.fetcher.Cleaner");

    private final Runnable sweep;
    private final boolean ownsScheduler;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;
    private long intervalNanos;
    private boolean closed;

    /**
     * Creates a stopped cleaner.
     *
     * @param sweep the sweep to run
     * @param scheduler the scheduler to run it on, or {@code null} to create one on demand
     */
    public CacheCleaner(Runnable sweep, ScheduledExecutorService scheduler) {
        this.sweep = Objects.requireNonNull(sweep, "sweep cannot be null");
        this.scheduler = scheduler;
        this.ownsScheduler = scheduler == null;
    }

    /**
     * Starts sweeping every {@code interval}, replacing any running schedule. An interval of zero
     * or less leaves the cleaner stopped.
     *
     * @throws IllegalStateException if the cleaner was closed
     */
    public synchronized void start(long interval, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit cannot be null");
        if (closed) {
            throw new IllegalStateException("cleaner is closed");
        }
        stop();
        if (interval <= 0) {
            return;
        }
        long nanos = unit.toNanos(interval);
        task = scheduler().scheduleWithFixedDelay(this::runSweep, nanos, nanos, TimeUnit.NANOSECONDS);
        intervalNanos = nanos;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cache cleaner started: interval=" + TimeUnit.NANOSECONDS.toMillis(nanos) + "ms");
        }
    }

    /**
     * Cancels the periodic sweep. A sweep already running is allowed to finish.
     */
    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        intervalNanos = 0;
        LOGGER.fine("Cache cleaner stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * Returns the interval of the running schedule in nanoseconds, or 0 when stopped.
     */
    public synchronized long getIntervalNanos() {
        return intervalNanos;
    }

    /**
     * Stops the cleaner for good and shuts down the scheduler if this cleaner created it.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        stop();
        closed = true;
        if (ownsScheduler && scheduler != null) {
            scheduler.shutdown();
        }
    }

    private ScheduledExecutorService scheduler() {
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "fetcher-cache-cleanup");
                t.setDaemon(true);
                return t;
            });
        }
        return scheduler;
    }

    private void runSweep() {
        try {
            sweep.run();
        } catch (RuntimeException e) {
            // A throwing task would be silently descheduled by the executor
            LOGGER.log(Level.WARNING, "Cache sweep failed, will retry on next interval", e);
        }
    }
}
