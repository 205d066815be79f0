package com.questrail.interactions.modal;

import com.questrail.interactions.api.FieldType;

public class FieldTypeMismatchException extends ModalFieldException {
    public FieldTypeMismatchException(String fieldId, FieldType expected, FieldType actual) {
        super(fieldId, "Modal field '" + fieldId + "' expected " + expected + " but got " + actual);
    }
}
