package com.questrail.interactions.api;

import java.util.Objects;

/**
 * One field of a modal submission as received from the platform.
 *
 * @param type  field type declared by the platform
 * @param value submitted value; may be empty, never {@code null}
 */
public record SubmittedField(FieldType type, String value) {
    public SubmittedField {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public static SubmittedField text(String value) {
        return new SubmittedField(FieldType.TEXT_INPUT, value);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }
}
