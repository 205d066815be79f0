package com.questrail.interactions.context;

/**
 * A response call that the current {@link ResponseState} does not allow.
 */
public class ResponseStateException extends IllegalStateException {
    public ResponseStateException(String message) {
        super(message);
    }
}
