package com.questrail.interactions.observability;

/**
 * Receives dispatch, eviction and error events from interaction clients.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on dispatch threads and must not block.</p>
 */
public interface InteractionObservabilitySink {
    void onDispatch(DispatchEvent event);

    void onEviction(EvictionEvent event);

    void onError(InteractionErrorEvent event);
}
