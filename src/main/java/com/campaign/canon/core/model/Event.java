package com.campaign.canon.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An atomic event persisted from an extraction. Entity names are the extracted
 * names; entity ids are filled in by resolution.
 */
public record Event(
        String id,
        String sessionId,
        String runId,
        String eventType,
        String summary,
        long startMs,
        long endMs,
        List<String> entityNames,
        List<String> entityIds,
        List<EvidenceSpan> evidence,
        Double confidence,
        boolean evidenceComplete
) {
    public Event {
        Objects.requireNonNull(id, "id is required");
        entityNames = entityNames != null ? List.copyOf(entityNames) : List.of();
        entityIds = entityIds != null ? List.copyOf(entityIds) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public Event withEntities(List<String> names, List<String> ids) {
        return new Event(id, sessionId, runId, eventType, summary, startMs, endMs,
                names, ids, evidence, confidence, evidenceComplete);
    }
}
