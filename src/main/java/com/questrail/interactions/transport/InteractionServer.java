package com.questrail.interactions.transport;

import com.questrail.interactions.api.InteractionKind;

/**
 * InteractionServer
 * -----------------------------------------------------------------------------
 * Pull ingress: receives interactions as requests and replies with the
 * handler's response.
 *
 * <p>At most one handler is installed per {@link InteractionKind}. Requests of
 * a kind without a handler are rejected by the server itself.</p>
 */
public interface InteractionServer
{
    /**
     * Install the handler for {@code kind}, replacing any previous one.
     */
    void setRequestHandler(InteractionKind kind, InteractionRequestHandler handler);

    /**
     * Remove the handler for {@code kind} if it is {@code expected}.
     *
     * <p>The identity check lets a closing client avoid removing a handler
     * that a newer client installed in the meantime.</p>
     */
    void clearRequestHandler(InteractionKind kind, InteractionRequestHandler expected);
}
