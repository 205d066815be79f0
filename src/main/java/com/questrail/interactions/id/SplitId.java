package com.questrail.interactions.id;

import java.util.Objects;

/**
 * A custom identifier split into its routing key and its opaque metadata.
 *
 * @param idMatch    the segment before the first {@code ':'}; keys the registry
 * @param idMetadata everything after the first {@code ':'}, or {@code ""}
 */
public record SplitId(String idMatch, String idMetadata) {
    public SplitId {
        Objects.requireNonNull(idMatch, "idMatch");
        Objects.requireNonNull(idMetadata, "idMetadata");
    }

    public boolean hasMetadata() {
        return !idMetadata.isEmpty();
    }
}
