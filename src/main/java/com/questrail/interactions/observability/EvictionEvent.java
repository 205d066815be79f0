package com.questrail.interactions.observability;

import com.questrail.interactions.api.InteractionKind;

import java.time.Instant;

/**
 * Record of registry keys being removed without an explicit unregister call.
 */
public record EvictionEvent(
    Instant timestamp,
    InteractionKind kind,
    int removedKeys,
    Reason reason
) {
    public enum Reason {
        EXPIRED,
        USES_EXHAUSTED,
        EXECUTOR_CLOSED
    }
}
