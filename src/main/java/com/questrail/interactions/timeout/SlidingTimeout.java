package com.questrail.interactions.timeout;

import com.questrail.interactions.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * SlidingTimeout
 * =============================================================================
 * Expires once more than {@code timeout} has passed since the last use, or
 * when {@code maxUses} uses have been recorded.
 *
 * <p>Creation counts as the first reference point, so an entry nobody touches
 * lives exactly {@code timeout}. Elapsed time equal to the timeout is still
 * alive; the comparison is strictly greater-than.</p>
 */
public final class SlidingTimeout implements Timeout {

    private final MonotonicClock clock;
    private final long timeoutNanos;
    private volatile long lastTriggeredNanos;
    private volatile int usesLeft;

    public SlidingTimeout(Duration timeout, MonotonicClock clock) {
        this(timeout, UNLIMITED_USES, clock);
    }

    /**
     * @param timeout  idle period after which the entry expires
     * @param maxUses  number of uses allowed, or {@link #UNLIMITED_USES}
     * @param clock    monotonic source for elapsed time
     */
    public SlidingTimeout(Duration timeout, int maxUses, MonotonicClock clock) {
        Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        Timeout.checkMaxUses(maxUses);

        this.timeoutNanos = timeout.toNanos();
        this.usesLeft = maxUses;
        this.lastTriggeredNanos = clock.nowNanos();
    }

    @Override
    public boolean hasExpired() {
        return expiredAt(clock.nowNanos());
    }

    @Override
    public boolean incrementUses() {
        long now = clock.nowNanos();
        if (expiredAt(now)) {
            throw new UsesDepletedException();
        }
        if (usesLeft > 0) {
            usesLeft--;
        }
        lastTriggeredNanos = now;
        return usesLeft == 0;
    }

    private boolean expiredAt(long nowNanos) {
        return usesLeft == 0 || nowNanos - lastTriggeredNanos > timeoutNanos;
    }

    /** Remaining uses, or {@link #UNLIMITED_USES}. */
    public int usesLeft() {
        return usesLeft;
    }

    @Override
    public String toString() {
        return "SlidingTimeout[timeout=" + Duration.ofNanos(timeoutNanos) + ", usesLeft=" + usesLeft + "]";
    }
}
