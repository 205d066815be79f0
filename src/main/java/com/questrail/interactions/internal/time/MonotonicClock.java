package com.questrail.interactions.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for everything that decides whether a registration is still alive.
 *
 * <h2>Binding invariant</h2>
 * Sliding expiry and the reaper cadence MUST be computed from a monotonic
 * source. Wall-clock time is only used for fixed deadlines and for event
 * timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
