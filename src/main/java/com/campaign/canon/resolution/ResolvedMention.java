package com.campaign.canon.resolution;

import com.campaign.canon.core.model.Mention;

import java.util.Objects;

/**
 * A raw mention with the canonical entity it resolved to. The mention itself is kept
 * as extracted.
 */
public record ResolvedMention(Mention mention, String entityId, String canonicalName, MatchKind matchKind) {

    public ResolvedMention {
        Objects.requireNonNull(mention, "mention is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(matchKind, "matchKind is required");
    }
}
