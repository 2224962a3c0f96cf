package com.campaign.canon.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Append-only per-session note on a story thread.
 */
public record ThreadUpdate(
        String id,
        String threadId,
        String sessionId,
        String runId,
        String updateType,
        String note,
        List<String> relatedEventIds,
        List<String> relatedEntityIds,
        List<EvidenceSpan> evidence
) {
    public ThreadUpdate {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(threadId, "threadId is required");
        relatedEventIds = relatedEventIds != null ? List.copyOf(relatedEventIds) : List.of();
        relatedEntityIds = relatedEntityIds != null ? List.copyOf(relatedEntityIds) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}
