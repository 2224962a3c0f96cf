package com.campaign.canon.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records and queries audit entries for corrections, resolution and runs.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditAction action, String campaignId, String targetId,
                             String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.of(action, campaignId, targetId, actorId, details);
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} by {}", action, targetId, actorId);
        return entry;
    }

    public AuditEntry record(AuditAction action, String campaignId, String targetId, String actorId) {
        return record(action, campaignId, targetId, actorId, null);
    }

    public List<AuditEntry> getEntriesForTarget(String targetId) {
        return repository.findByTargetId(targetId);
    }

    public List<AuditEntry> getEntriesForCampaign(String campaignId) {
        return repository.findByCampaignId(campaignId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
