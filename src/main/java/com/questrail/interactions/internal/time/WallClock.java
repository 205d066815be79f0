package com.questrail.interactions.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for fixed deadlines, interaction lifetimes and
 * observability timestamps.
 *
 * <p>
 * This clock may jump. Anything measuring an elapsed interval uses
 * {@link MonotonicClock} instead.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
