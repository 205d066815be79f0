package com.questrail.interactions.api;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Interaction
 * =============================================================================
 * Immutable view of one interaction received from the platform.
 *
 * <p>The library only reads the fields below. Anything else the platform sends
 * stays with the transport that produced the value.</p>
 *
 * @param id        platform interaction id
 * @param kind      component use or modal submission
 * @param customId  full custom identifier of the component or modal
 * @param userId    id of the user that triggered the interaction
 * @param createdAt creation time reported by the platform
 * @param fields    submitted modal fields keyed by their custom id; empty for components
 */
public record Interaction(
    String id,
    InteractionKind kind,
    String customId,
    String userId,
    Instant createdAt,
    Map<String, SubmittedField> fields
) {
    public Interaction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(customId, "customId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(createdAt, "createdAt");
        fields = Map.copyOf(Objects.requireNonNull(fields, "fields"));
    }

    public static Interaction component(String id, String customId, String userId, Instant createdAt) {
        return new Interaction(id, InteractionKind.COMPONENT, customId, userId, createdAt, Map.of());
    }

    public static Interaction modal(String id, String customId, String userId, Instant createdAt,
                                    Map<String, SubmittedField> fields) {
        return new Interaction(id, InteractionKind.MODAL, customId, userId, createdAt, fields);
    }
}
