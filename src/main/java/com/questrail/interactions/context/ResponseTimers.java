package com.questrail.interactions.context;

import com.questrail.interactions.internal.time.Cancellable;
import com.questrail.interactions.internal.time.MonotonicClock;
import com.questrail.interactions.internal.time.MonotonicScheduler;
import com.questrail.interactions.internal.time.WallClock;

import java.time.Duration;
import java.util.Objects;

/**
 * Time sources a context uses for delayed deletes.
 *
 * <p>The scheduler runs the deletes, measured on the monotonic clock. The wall
 * clock is compared against {@link InteractionContext#expiresAt()} to reject
 * delays the platform would not honour.</p>
 */
public record ResponseTimers(MonotonicScheduler scheduler, MonotonicClock clock, WallClock wallClock)
{
    public ResponseTimers {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    Cancellable runAfter(Duration delay, Runnable task) {
        return scheduler.scheduleAfter(delay, clock, task);
    }
}
