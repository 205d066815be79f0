package com.questrail.interactions.transport;

/**
 * Push ingress: a long-lived event stream that hands interactions to its
 * listeners and expects responses through an {@link InteractionTransport}.
 */
public interface InteractionGateway
{
    void addListener(InteractionGatewayListener listener);

    /**
     * Remove a previously added listener. Unknown listeners are ignored.
     */
    void removeListener(InteractionGatewayListener listener);
}
