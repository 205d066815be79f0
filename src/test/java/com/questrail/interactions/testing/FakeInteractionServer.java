package com.questrail.interactions.testing;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.api.InteractionResponse;
import com.questrail.interactions.transport.InteractionRequestHandler;
import com.questrail.interactions.transport.InteractionServer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory pull ingress.
 */
public final class FakeInteractionServer implements InteractionServer {

    private final Map<InteractionKind, InteractionRequestHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void setRequestHandler(InteractionKind kind, InteractionRequestHandler handler) {
        handlers.put(kind, handler);
    }

    @Override
    public void clearRequestHandler(InteractionKind kind, InteractionRequestHandler expected) {
        handlers.remove(kind, expected);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public boolean hasHandler(InteractionKind kind) {
        return handlers.containsKey(kind);
    }

    /**
     * @throws IllegalStateException if no handler is installed for the interaction's kind
     */
    public InteractionResponse request(Interaction interaction) {
        InteractionRequestHandler handler = handlers.get(interaction.kind());
        if (handler == null) {
            throw new IllegalStateException("No handler for " + interaction.kind());
        }
        return handler.handle(interaction);
    }
}
