package com.questrail.interactions.executor;

import com.questrail.interactions.context.ComponentContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * MultiComponentExecutor
 * =============================================================================
 * Combines several component executors behind one registration.
 *
 * <p>The ids of this executor are the union of its children's. An interaction
 * goes to the first child, in the order added, that lists its match segment
 * as an exact id; failing that, to the child with the longest matching
 * prefix id.</p>
 *
 * <p>Children report their ids when asked, so callbacks added to a child
 * after registration are reachable only once the client is told about them.</p>
 */
public class MultiComponentExecutor implements InteractionExecutor<ComponentContext>
{
    private static final Logger log = LoggerFactory.getLogger(MultiComponentExecutor.class);

    private final List<InteractionExecutor<ComponentContext>> executors = new ArrayList<>();

    public MultiComponentExecutor add(InteractionExecutor<ComponentContext> executor) {
        Objects.requireNonNull(executor, "executor");
        if (executor == this) {
            throw new IllegalArgumentException("An executor cannot contain itself");
        }
        synchronized (executors) {
            executors.add(executor);
        }
        return this;
    }

    public List<InteractionExecutor<ComponentContext>> executors() {
        synchronized (executors) {
            return List.copyOf(executors);
        }
    }

    @Override
    public Set<String> customIds() {
        Set<String> ids = new LinkedHashSet<>();
        executors().forEach(executor -> ids.addAll(executor.customIds()));
        return Set.copyOf(ids);
    }

    @Override
    public Set<String> prefixIds() {
        Set<String> ids = new LinkedHashSet<>();
        executors().forEach(executor -> ids.addAll(executor.prefixIds()));
        return Set.copyOf(ids);
    }

    @Override
    public void execute(ComponentContext context) {
        String match = context.idMatch();
        List<InteractionExecutor<ComponentContext>> snapshot = executors();

        InteractionExecutor<ComponentContext> target = null;
        for (InteractionExecutor<ComponentContext> executor : snapshot) {
            if (executor.customIds().contains(match)) {
                target = executor;
                break;
            }
        }

        if (target == null) {
            int longest = -1;
            for (InteractionExecutor<ComponentContext> executor : snapshot) {
                for (String prefix : executor.prefixIds()) {
                    if (match.startsWith(prefix) && prefix.length() > longest) {
                        longest = prefix.length();
                        target = executor;
                    }
                }
            }
        }

        if (target == null) {
            log.error("No child executor for component id '{}' among {} executor(s)", match, snapshot.size());
            throw new RoutingException("No executor found for '" + match + "'");
        }
        target.execute(context);
    }
}
