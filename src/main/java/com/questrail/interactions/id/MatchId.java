package com.questrail.interactions.id;

import java.util.Objects;

/**
 * Result of {@link CustomIds#generate(String)}: the registry key and the full
 * identifier the caller should put on the outgoing component.
 */
public record MatchId(String idMatch, String customId) {
    public MatchId {
        Objects.requireNonNull(idMatch, "idMatch");
        Objects.requireNonNull(customId, "customId");
    }
}
