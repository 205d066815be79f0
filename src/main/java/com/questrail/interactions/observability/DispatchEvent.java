package com.questrail.interactions.observability;

import com.questrail.interactions.api.InteractionKind;

import java.time.Instant;

/**
 * Record of one interaction passing through a client.
 */
public record DispatchEvent(
    Instant timestamp,
    InteractionKind kind,
    String interactionId,
    String customId,
    Ingress ingress,
    Outcome outcome
) {
    public enum Ingress {
        PUSH,
        PULL
    }

    public enum Outcome {
        /** The executor ran to completion. */
        EXECUTED,
        /** No live registration; the timed-out response was sent. */
        TIMED_OUT,
        /** The executor reported itself closed and was evicted. */
        EXECUTOR_CLOSED,
        /** A callback error was turned into a response. */
        ERROR_RESPONSE,
        /** The executor failed; the exception was propagated. */
        FAILED
    }
}
