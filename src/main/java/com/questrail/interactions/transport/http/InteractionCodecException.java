package com.questrail.interactions.transport.http;

/**
 * A request body that is not a well-formed interaction payload.
 */
public class InteractionCodecException extends RuntimeException {
    public InteractionCodecException(String message) {
        super(message);
    }

    public InteractionCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
