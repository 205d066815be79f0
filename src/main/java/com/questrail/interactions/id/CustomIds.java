package com.questrail.interactions.id;

import java.util.Objects;
import java.util.UUID;

/**
 * CustomIds
 * =============================================================================
 * Codec for the {@code <match>[:<metadata>]} custom identifier format.
 *
 * <p>Only the first {@code ':'} is significant. Metadata may itself contain
 * colons and is never interpreted here.</p>
 *
 * <pre>
 *   split("vote:42:up")  -> ("vote", "42:up")
 *   split("vote")        -> ("vote", "")
 *   split(":x")          -> ("", "x")
 * </pre>
 */
public final class CustomIds {

    public static final char DELIMITER = ':';

    private CustomIds() {
    }

    public static SplitId split(String customId) {
        Objects.requireNonNull(customId, "customId");

        int index = customId.indexOf(DELIMITER);
        if (index < 0) {
            return new SplitId(customId, "");
        }
        return new SplitId(customId.substring(0, index), customId.substring(index + 1));
    }

    /**
     * Resolve the registry key for an identifier, minting a random one when
     * {@code customId} is {@code null}.
     *
     * <p>A minted identifier is a 32 character lowercase hex token which is
     * both the match segment and the full identifier.</p>
     */
    public static MatchId generate(String customId) {
        if (customId == null) {
            String token = UUID.randomUUID().toString().replace("-", "");
            return new MatchId(token, token);
        }
        return new MatchId(split(customId).idMatch(), customId);
    }

    public static String join(String idMatch, String idMetadata) {
        Objects.requireNonNull(idMatch, "idMatch");
        Objects.requireNonNull(idMetadata, "idMetadata");

        return idMetadata.isEmpty() ? idMatch : idMatch + DELIMITER + idMetadata;
    }
}
