package com.questrail.interactions.timeout;

/**
 * Raised when a use is recorded against a policy that has already expired.
 */
public class UsesDepletedException extends IllegalStateException {
    public UsesDepletedException() {
        super("Uses already depleted");
    }

    public UsesDepletedException(String message) {
        super(message);
    }
}
