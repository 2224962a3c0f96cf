package com.campaign.canon.correction;

import java.util.Map;
import java.util.Objects;

/**
 * A correction as submitted, before the ledger assigns id, time and sequence.
 *
 * @param sessionId optional session scope; null for campaign-wide
 */
public record CorrectionRequest(
        String campaignId,
        String sessionId,
        TargetType targetType,
        String targetId,
        CorrectionAction action,
        Map<String, String> payload
) {
    public CorrectionRequest {
        Objects.requireNonNull(campaignId, "campaignId is required");
        Objects.requireNonNull(targetType, "targetType is required");
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(action, "action is required");
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static CorrectionRequest entity(String campaignId, String entityId,
                                           CorrectionAction action, Map<String, String> payload) {
        return new CorrectionRequest(campaignId, null, TargetType.ENTITY, entityId, action, payload);
    }

    public static CorrectionRequest thread(String campaignId, String threadId,
                                           CorrectionAction action, Map<String, String> payload) {
        return new CorrectionRequest(campaignId, null, TargetType.THREAD, threadId, action, payload);
    }

    public CorrectionRequest forSession(String scopeSessionId) {
        return new CorrectionRequest(campaignId, scopeSessionId, targetType, targetId, action, payload);
    }
}
