package com.questrail.interactions.executor;

import com.questrail.interactions.context.ComponentContext;
import com.questrail.interactions.id.CustomIds;
import com.questrail.interactions.internal.routing.IdTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * ComponentExecutor
 * =============================================================================
 * Keyed table of component callbacks.
 *
 * <p>Callbacks are keyed by the match segment of the id they are added with.
 * An interaction is routed to the exact key first and then to the longest
 * prefix key.</p>
 *
 * <p>Callbacks may be added and removed while interactions are dispatched.</p>
 */
public class ComponentExecutor implements InteractionExecutor<ComponentContext>
{
    private static final Logger log = LoggerFactory.getLogger(ComponentExecutor.class);

    private final IdTable<ComponentCallback> callbacks = new IdTable<>();
    private final boolean ephemeralDefault;

    public ComponentExecutor() {
        this(false);
    }

    /**
     * @param ephemeralDefault whether responses with default visibility are ephemeral
     */
    public ComponentExecutor(boolean ephemeralDefault) {
        this.ephemeralDefault = ephemeralDefault;
    }

    public boolean ephemeralDefault() {
        return ephemeralDefault;
    }

    /**
     * @throws IllegalArgumentException if the match segment is already taken
     */
    public ComponentExecutor addCallback(String customId, ComponentCallback callback) {
        return add(customId, callback, false);
    }

    /**
     * Route every id whose match segment starts with {@code prefix} to
     * {@code callback}, unless an exact or longer prefix key matches first.
     */
    public ComponentExecutor addPrefixCallback(String prefix, ComponentCallback callback) {
        return add(prefix, callback, true);
    }

    /**
     * @throws NoSuchElementException if nothing is registered under the id
     */
    public ComponentExecutor removeCallback(String customId) {
        String match = CustomIds.split(customId).idMatch();
        synchronized (callbacks) {
            if (callbacks.remove(match).isEmpty()) {
                throw new NoSuchElementException("No callback registered for '" + match + "'");
            }
        }
        return this;
    }

    @Override
    public Set<String> customIds() {
        synchronized (callbacks) {
            return callbacks.exactKeys();
        }
    }

    @Override
    public Set<String> prefixIds() {
        synchronized (callbacks) {
            return callbacks.prefixKeys();
        }
    }

    @Override
    public void execute(ComponentContext context) {
        ComponentCallback callback;
        synchronized (callbacks) {
            callback = callbacks.find(context.idMatch()).orElse(null);
        }
        if (callback == null) {
            log.error("No callback for component id '{}' in {}", context.idMatch(), this);
            throw new RoutingException("No callback found for '" + context.idMatch() + "'");
        }

        context.setEphemeralDefault(ephemeralDefault);
        callback.handle(context);
    }

    private ComponentExecutor add(String customId, ComponentCallback callback, boolean prefix) {
        Objects.requireNonNull(callback, "callback");
        String match = CustomIds.split(customId).idMatch();
        synchronized (callbacks) {
            callbacks.put(match, callback, prefix);
        }
        return this;
    }
}
