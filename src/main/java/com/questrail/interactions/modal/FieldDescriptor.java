package com.questrail.interactions.modal;

import com.questrail.interactions.api.FieldType;
import com.questrail.interactions.api.InteractionResponse;

import java.util.Objects;

/**
 * Declaration of one modal field: how it is rendered and how its submitted
 * value is extracted.
 *
 * @param customId     field custom id (match segment when {@code prefixMatch})
 * @param type         expected submitted type
 * @param label        label shown above the field
 * @param hasDefault   whether {@code defaultValue} applies when the field is missing or empty
 * @param defaultValue value used in place of a missing field; may be {@code null}
 * @param prefixMatch  match submitted fields whose id starts with {@code customId}
 */
public record FieldDescriptor(
    String customId,
    FieldType type,
    String label,
    boolean hasDefault,
    Object defaultValue,
    boolean prefixMatch
) {
    public FieldDescriptor {
        Objects.requireNonNull(customId, "customId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(label, "label");
        if (customId.isEmpty()) {
            throw new IllegalArgumentException("customId must not be empty");
        }
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue given without hasDefault");
        }
    }

    public static FieldDescriptor textInput(String customId, String label) {
        return new FieldDescriptor(customId, FieldType.TEXT_INPUT, label, false, null, false);
    }

    public static FieldDescriptor textInput(String customId, String label, Object defaultValue) {
        return new FieldDescriptor(customId, FieldType.TEXT_INPUT, label, true, defaultValue, false);
    }

    public FieldDescriptor withPrefixMatch() {
        return new FieldDescriptor(customId, type, label, hasDefault, defaultValue, true);
    }

    InteractionResponse.PromptField toPromptField() {
        return new InteractionResponse.PromptField(customId, type, label, !hasDefault);
    }
}
