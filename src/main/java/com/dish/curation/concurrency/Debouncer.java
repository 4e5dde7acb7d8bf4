package com.dish.curation.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delays execution until a quiet period follows the latest submission.
 *
 * <p>Each {@link #submit(Runnable)} cancels the previously scheduled, not yet fired
 * task and schedules the new one. Cancelling only affects the timer: work already
 * started by an earlier task keeps running.</p>
 */
public class Debouncer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Duration delay;
    private ScheduledFuture<?> pending;

    public Debouncer(Duration delay) {
        this(delay, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "debouncer");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public Debouncer(Duration delay, ScheduledExecutorService scheduler) {
        this(delay, scheduler, false);
    }

    private Debouncer(Duration delay, ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        this.delay = delay;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Schedules the task, superseding any task that has not fired yet.
     */
    public synchronized void submit(Runnable task) {
        if (pending != null && !pending.isDone()) {
            pending.cancel(false);
            log.trace("Superseded pending debounced task");
        }
        pending = scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Cancels the scheduled task, if any, without running it.
     */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean hasPending() {
        return pending != null && !pending.isDone();
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public void close() {
        cancel();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
