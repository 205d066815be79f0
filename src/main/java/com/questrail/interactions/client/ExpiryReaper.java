package com.questrail.interactions.client;

import com.questrail.interactions.internal.time.Cancellable;
import com.questrail.interactions.internal.time.MonotonicClock;
import com.questrail.interactions.internal.time.MonotonicScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * ExpiryReaper
 * =============================================================================
 * Runs a sweep at a fixed interval on a {@link MonotonicScheduler}.
 *
 * <p>Each tick schedules the next one after the sweep finished, so sweeps
 * never overlap. {@link #start()} and {@link #stop()} are idempotent; a stop
 * followed by a start never leaves two tick chains running.</p>
 *
 * <p>A failing sweep is logged and the next tick is still scheduled.</p>
 */
public final class ExpiryReaper
{
    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Runnable sweep;

    private final Object lock = new Object();
    private boolean running;
    private long generation;
    private Cancellable pending;

    public ExpiryReaper(MonotonicScheduler scheduler, MonotonicClock clock, Duration interval, Runnable sweep)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.sweep = Objects.requireNonNull(sweep, "sweep");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public void start()
    {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            generation++;
            scheduleNext(generation);
        }
        log.debug("Expiry reaper started, interval {}", interval);
    }

    public void stop()
    {
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }
        log.debug("Expiry reaper stopped");
    }

    public boolean isRunning()
    {
        synchronized (lock) {
            return running;
        }
    }

    private void tick(long tickGeneration)
    {
        if (!isCurrent(tickGeneration)) {
            return;
        }
        try {
            sweep.run();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        } finally {
            synchronized (lock) {
                if (running && generation == tickGeneration) {
                    scheduleNext(tickGeneration);
                }
            }
        }
    }

    private boolean isCurrent(long tickGeneration)
    {
        synchronized (lock) {
            return running && generation == tickGeneration;
        }
    }

    // Caller holds lock.
    private void scheduleNext(long tickGeneration)
    {
        pending = scheduler.scheduleAfter(interval, clock, () -> tick(tickGeneration));
    }
}
