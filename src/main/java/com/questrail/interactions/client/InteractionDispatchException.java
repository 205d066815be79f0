package com.questrail.interactions.client;

/**
 * A pull request that could not produce an initial response: it timed out,
 * the waiting thread was interrupted, or the executor failed with a checked
 * exception.
 */
public class InteractionDispatchException extends RuntimeException {
    public InteractionDispatchException(String message) {
        super(message);
    }

    public InteractionDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
