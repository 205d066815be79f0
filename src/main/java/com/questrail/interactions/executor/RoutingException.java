package com.questrail.interactions.executor;

/**
 * An interaction reached an executor which has no callback for its id.
 *
 * <p>This indicates the registry and the executor's own table disagree.</p>
 */
public class RoutingException extends IllegalStateException {
    public RoutingException(String message) {
        super(message);
    }
}
