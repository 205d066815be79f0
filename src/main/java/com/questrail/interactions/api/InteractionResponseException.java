package com.questrail.interactions.api;

import java.util.Objects;

/**
 * Thrown by a callback to abort its work and answer the user with
 * {@link #response()} instead.
 *
 * <p>The client catches this and sends the response through the context, so
 * the usual one-initial-response rules apply.</p>
 */
public class InteractionResponseException extends RuntimeException {

    private final ResponseMessage response;

    public InteractionResponseException(ResponseMessage response) {
        super(Objects.requireNonNull(response, "response").content());
        this.response = response;
    }

    public InteractionResponseException(String content) {
        this(ResponseMessage.ephemeral(content));
    }

    public ResponseMessage response() {
        return response;
    }
}
