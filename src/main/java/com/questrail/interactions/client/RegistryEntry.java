package com.questrail.interactions.client;

import com.questrail.interactions.executor.InteractionExecutor;
import com.questrail.interactions.timeout.Timeout;

import java.util.Objects;

/**
 * An executor together with the policy that decides how long it stays
 * registered. One entry may be bound to several keys.
 */
public record RegistryEntry<E extends InteractionExecutor<?>>(Timeout timeout, E executor) {
    public RegistryEntry {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(executor, "executor");
    }
}
