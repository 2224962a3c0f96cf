package com.campaign.canon.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Raw, pre-resolution reference to something named in a transcript.
 * Immutable once created; resolution attaches an entity id through
 * {@code ResolvedMention} and never rewrites the mention itself.
 */
public record Mention(
        String id,
        String campaignId,
        String sessionId,
        String runId,
        String rawText,
        EntityType type,
        String description,
        List<EvidenceSpan> evidence,
        Double confidence,
        boolean evidenceComplete
) {
    public Mention {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(campaignId, "campaignId is required");
        rawText = rawText != null ? rawText : "";
        type = type != null ? type : EntityType.OTHER;
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static Mention of(String campaignId, String sessionId, String runId,
                             String rawText, EntityType type, List<EvidenceSpan> evidence) {
        return new Mention(UUID.randomUUID().toString(), campaignId, sessionId, runId,
                rawText, type, null, evidence, null, true);
    }
}
