package com.questrail.interactions.modal;

import com.questrail.interactions.api.InteractionResponse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ModalTemplate
 * =============================================================================
 * Ordered, immutable list of {@link FieldDescriptor}s.
 *
 * <p>Templates compose by explicit concatenation: {@code a.concat(b)} holds
 * the fields of {@code a} followed by those of {@code b}, which is also the
 * order of the values handed to the modal callback. Field ids must be unique.</p>
 */
public final class ModalTemplate
{
    private final List<FieldDescriptor> fields;

    private ModalTemplate(List<FieldDescriptor> fields) {
        this.fields = List.copyOf(fields);

        Set<String> seen = new HashSet<>();
        for (FieldDescriptor field : this.fields) {
            if (!seen.add(field.customId())) {
                throw new IllegalArgumentException("Duplicate modal field '" + field.customId() + "'");
            }
        }
    }

    public static ModalTemplate of(FieldDescriptor... fields) {
        return new ModalTemplate(List.of(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FieldDescriptor> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public ModalTemplate concat(ModalTemplate other) {
        Objects.requireNonNull(other, "other");
        List<FieldDescriptor> merged = new ArrayList<>(fields);
        merged.addAll(other.fields);
        return new ModalTemplate(merged);
    }

    public ModalTemplate with(FieldDescriptor field) {
        return concat(of(field));
    }

    /** Render this template as a modal prompt to send in reply to a component. */
    public InteractionResponse.ModalPrompt toPrompt(String title, String customId) {
        return new InteractionResponse.ModalPrompt(
            title, customId, fields.stream().map(FieldDescriptor::toPromptField).toList());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModalTemplate other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ModalTemplate" + fields;
    }

    public static final class Builder {
        private final List<FieldDescriptor> fields = new ArrayList<>();

        private Builder() {
        }

        public Builder add(FieldDescriptor field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        public Builder textInput(String customId, String label) {
            return add(FieldDescriptor.textInput(customId, label));
        }

        public Builder textInput(String customId, String label, Object defaultValue) {
            return add(FieldDescriptor.textInput(customId, label, defaultValue));
        }

        public ModalTemplate build() {
            return new ModalTemplate(fields);
        }
    }
}
