package com.questrail.interactions.transport;

import com.questrail.interactions.api.Interaction;

/**
 * Callback for interactions delivered by an {@link InteractionGateway}.
 *
 * <p>Listeners may be invoked concurrently from gateway threads. A listener
 * only looks at interactions of the kind it handles.</p>
 */
@FunctionalInterface
public interface InteractionGatewayListener
{
    void onInteraction(Interaction interaction);
}
