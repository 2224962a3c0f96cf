package com.campaign.canon.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param targetId the correction, entity, thread or run the action applies to
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String campaignId,
        String targetId,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(campaignId, "campaignId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    /**
     * Creates an entry with a fresh id stamped now.
     */
    static AuditEntry of(AuditAction action, String campaignId, String targetId,
                         String actorId, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, campaignId, targetId,
                actorId, details, Instant.now());
    }

    /**
     * Returns a detail value as text, or null when absent.
     */
    public String detail(String key) {
        Object value = details.get(key);
        return value != null ? value.toString() : null;
    }
}
