package com.questrail.interactions.modal;

public class MissingFieldException extends ModalFieldException {
    public MissingFieldException(String fieldId) {
        super(fieldId, "Missing required modal field '" + fieldId + "'");
    }
}
