package com.questrail.interactions.observability;

import java.time.Instant;

/**
 * Record of an error raised while dispatching an interaction.
 */
public record InteractionErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
