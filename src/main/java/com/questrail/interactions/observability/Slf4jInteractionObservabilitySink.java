package com.questrail.interactions.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of InteractionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jInteractionObservabilitySink implements InteractionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jInteractionObservabilitySink.class);

    @Override
    public void onDispatch(DispatchEvent event) {
        switch (event.outcome()) {
            case EXECUTED -> log.debug("{} {} '{}' executed ({})",
                event.ingress(), event.kind(), event.customId(), event.interactionId());
            case TIMED_OUT -> log.info("{} {} '{}' has no live handler; sent timed-out response",
                event.ingress(), event.kind(), event.customId());
            case EXECUTOR_CLOSED -> log.debug("{} {} '{}' hit a closed executor",
                event.ingress(), event.kind(), event.customId());
            case ERROR_RESPONSE -> log.debug("{} {} '{}' answered with an error response",
                event.ingress(), event.kind(), event.customId());
            case FAILED -> log.warn("{} {} '{}' failed ({})",
                event.ingress(), event.kind(), event.customId(), event.interactionId());
        }
    }

    @Override
    public void onEviction(EvictionEvent event) {
        log.debug("Evicted {} {} key(s): {}", event.removedKeys(), event.kind(), event.reason());
    }

    @Override
    public void onError(InteractionErrorEvent event) {
        log.error("Interaction error: {}", event.message(), event.cause());
    }
}
