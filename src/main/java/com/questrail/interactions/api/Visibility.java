package com.questrail.interactions.api;

/**
 * Requested visibility of a response message.
 *
 * <p>{@link #DEFAULT} defers to the ephemeral default of the executor that is
 * handling the interaction, and only for responses which create a message.</p>
 */
public enum Visibility {
    DEFAULT,
    EPHEMERAL,
    PUBLIC
}
