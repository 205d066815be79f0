package com.questrail.interactions.api;

import java.util.Objects;

/**
 * Content of a response as written by a callback, before visibility has been
 * resolved against the context.
 */
public record ResponseMessage(String content, Visibility visibility) {
    public ResponseMessage {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(visibility, "visibility");
    }

    public static ResponseMessage of(String content) {
        return new ResponseMessage(content, Visibility.DEFAULT);
    }

    public static ResponseMessage ephemeral(String content) {
        return new ResponseMessage(content, Visibility.EPHEMERAL);
    }

    public static ResponseMessage visible(String content) {
        return new ResponseMessage(content, Visibility.PUBLIC);
    }
}
