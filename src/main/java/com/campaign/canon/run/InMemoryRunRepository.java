package com.campaign.canon.run;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link RunRepository}.
 */
public class InMemoryRunRepository implements RunRepository {

    private final ConcurrentMap<String, Run> runs = new ConcurrentHashMap<>();

    @Override
    public Run save(Run run) {
        runs.put(run.getId(), run);
        return run;
    }

    @Override
    public Optional<Run> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<Run> findBySession(String campaignId, String sessionId) {
        return runs.values().stream()
                .filter(r -> r.getCampaignId().equals(campaignId) && r.getSessionId().equals(sessionId))
                .sorted(Comparator.comparing(Run::getCreatedAt).thenComparingLong(Run::getSequence))
                .toList();
    }
}
