package com.questrail.interactions.timeout;

import com.questrail.interactions.internal.time.WallClock;

import java.time.Instant;
import java.util.Objects;

/**
 * Expires at a fixed wall-clock deadline or after {@code maxUses} uses,
 * whichever comes first. Uses never move the deadline.
 */
public final class StaticTimeout implements Timeout {

    private final Instant deadline;
    private final WallClock clock;
    private volatile int usesLeft;

    public StaticTimeout(Instant deadline, WallClock clock) {
        this(deadline, UNLIMITED_USES, clock);
    }

    public StaticTimeout(Instant deadline, int maxUses, WallClock clock) {
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.clock = Objects.requireNonNull(clock, "clock");
        Timeout.checkMaxUses(maxUses);
        this.usesLeft = maxUses;
    }

    @Override
    public boolean hasExpired() {
        return usesLeft == 0 || !clock.now().isBefore(deadline);
    }

    @Override
    public boolean incrementUses() {
        if (hasExpired()) {
            throw new UsesDepletedException();
        }
        if (usesLeft > 0) {
            usesLeft--;
        }
        return usesLeft == 0;
    }

    public int usesLeft() {
        return usesLeft;
    }

    @Override
    public String toString() {
        return "StaticTimeout[deadline=" + deadline + ", usesLeft=" + usesLeft + "]";
    }
}
