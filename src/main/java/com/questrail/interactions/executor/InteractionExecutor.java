package com.questrail.interactions.executor;

import com.questrail.interactions.context.InteractionContext;

import java.util.Set;

/**
 * InteractionExecutor
 * =============================================================================
 * Something that can handle interactions routed to it by a client.
 *
 * <p>{@link #customIds()} and {@link #prefixIds()} list the match segments
 * the executor answers to on its own; a client may also register it under an
 * explicit id.</p>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link ExecutorClosedException}: the executor is finished and should
 *       be evicted from the registry.</li>
 *   <li>{@link RoutingException}: the executor was handed an id it has no
 *       callback for.</li>
 * </ul>
 *
 * @param <C> the context type this executor handles
 */
public interface InteractionExecutor<C extends InteractionContext>
{
    /** Snapshot of exact match segments. */
    Set<String> customIds();

    /** Snapshot of prefix match segments. */
    default Set<String> prefixIds() {
        return Set.of();
    }

    void execute(C context);
}
