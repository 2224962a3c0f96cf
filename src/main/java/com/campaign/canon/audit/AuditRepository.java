package com.campaign.canon.audit;

import java.util.List;

/**
 * Storage for audit entries. Append-only.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByCampaignId(String campaignId);

    List<AuditEntry> findByTargetId(String targetId);

    List<AuditEntry> findByAction(AuditAction action);

    int count();
}
