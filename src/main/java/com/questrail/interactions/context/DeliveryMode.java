package com.questrail.interactions.context;

import com.questrail.interactions.api.InteractionResponse;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Where the initial response of an interaction goes.
 */
public sealed interface DeliveryMode permits DeliveryMode.Push, DeliveryMode.Pull
{
    /** Initial response is sent through the outbound transport. */
    record Push() implements DeliveryMode {
    }

    /**
     * Initial response completes {@code future}, which the pull ingress is
     * waiting on. The future is completed at most once.
     */
    record Pull(CompletableFuture<InteractionResponse> future) implements DeliveryMode {
        public Pull {
            Objects.requireNonNull(future, "future");
        }
    }

    static DeliveryMode push() {
        return new Push();
    }

    static DeliveryMode pull(CompletableFuture<InteractionResponse> future) {
        return new Pull(future);
    }
}
