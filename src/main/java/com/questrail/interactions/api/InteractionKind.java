package com.questrail.interactions.api;

/**
 * The two interaction families this library dispatches.
 */
public enum InteractionKind {
    /** Button or select menu use on a message. */
    COMPONENT,
    /** Submission of a modal dialog. */
    MODAL
}
