package com.campaign.canon.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory {@link AuditRepository}. Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findByCampaignId(String campaignId) {
        return filter(e -> campaignId.equals(e.campaignId()));
    }

    @Override
    public List<AuditEntry> findByTargetId(String targetId) {
        return filter(e -> targetId.equals(e.targetId()));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public int count() {
        return entries.size();
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
