package com.questrail.interactions.observability;

/**
 * No-op implementation of InteractionObservabilitySink.
 */
public final class NullObservabilitySink implements InteractionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDispatch(DispatchEvent event) {}

    @Override
    public void onEviction(EvictionEvent event) {}

    @Override
    public void onError(InteractionErrorEvent event) {}
}
