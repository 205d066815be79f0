package com.questrail.interactions.modal;

/**
 * A modal submission that does not satisfy the template. Raised before the
 * callback runs.
 */
public class ModalFieldException extends IllegalArgumentException {

    private final String fieldId;

    public ModalFieldException(String fieldId, String message) {
        super(message);
        this.fieldId = fieldId;
    }

    public String fieldId() {
        return fieldId;
    }
}
