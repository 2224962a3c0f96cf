package com.campaign.canon.correction;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link CorrectionRepository}. Suitable for tests and single-JVM deployments.
 */
public class InMemoryCorrectionRepository implements CorrectionRepository {

    private final ConcurrentMap<String, Correction> corrections = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    @Override
    public Correction save(Correction correction) {
        Correction existing = corrections.putIfAbsent(correction.getId(), correction);
        if (existing != null && existing != correction) {
            throw new IllegalStateException("Correction already recorded: " + correction.getId());
        }
        return correction;
    }

    @Override
    public Optional<Correction> findById(String correctionId) {
        return Optional.ofNullable(corrections.get(correctionId));
    }

    @Override
    public List<Correction> findByCampaign(String campaignId) {
        return corrections.values().stream()
                .filter(c -> c.getCampaignId().equals(campaignId))
                .sorted(Correction.LEDGER_ORDER)
                .toList();
    }

    @Override
    public List<Correction> findByCampaignAndState(String campaignId, CorrectionState state) {
        return corrections.values().stream()
                .filter(c -> c.getCampaignId().equals(campaignId))
                .filter(c -> c.getState() == state)
                .sorted(Correction.LEDGER_ORDER)
                .toList();
    }
}
