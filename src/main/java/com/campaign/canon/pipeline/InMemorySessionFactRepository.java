package com.campaign.canon.pipeline;

import com.campaign.canon.core.model.Utterance;
import com.campaign.canon.extract.SessionFacts;
import com.campaign.canon.narrative.RenderedDocument;
import com.campaign.canon.narrative.SummaryPlan;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link SessionFactRepository}.
 */
public class InMemorySessionFactRepository implements SessionFactRepository {

    private final ConcurrentMap<String, List<Utterance>> utterances = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SessionFacts> facts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PersistedFacts> persisted = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ResolvedSession> resolved = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SummaryPlan> plans = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> summaries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RenderedDocument> documents = new ConcurrentHashMap<>();

    @Override
    public void saveUtterances(String runId, List<Utterance> list) {
        utterances.put(runId, List.copyOf(list));
    }

    @Override
    public List<Utterance> utterances(String runId) {
        return utterances.getOrDefault(runId, List.of());
    }

    @Override
    public void saveFacts(String runId, SessionFacts sessionFacts) {
        facts.put(runId, sessionFacts);
    }

    @Override
    public Optional<SessionFacts> facts(String runId) {
        return Optional.ofNullable(facts.get(runId));
    }

    @Override
    public void savePersisted(String runId, PersistedFacts value) {
        persisted.put(runId, value);
    }

    @Override
    public Optional<PersistedFacts> persisted(String runId) {
        return Optional.ofNullable(persisted.get(runId));
    }

    @Override
    public void saveResolved(String runId, ResolvedSession value) {
        resolved.put(runId, value);
    }

    @Override
    public Optional<ResolvedSession> resolved(String runId) {
        return Optional.ofNullable(resolved.get(runId));
    }

    @Override
    public void savePlan(String runId, SummaryPlan plan) {
        plans.put(runId, plan);
    }

    @Override
    public Optional<SummaryPlan> plan(String runId) {
        return Optional.ofNullable(plans.get(runId));
    }

    @Override
    public void saveSummary(String runId, String summaryText) {
        summaries.put(runId, summaryText);
    }

    @Override
    public Optional<String> summary(String runId) {
        return Optional.ofNullable(summaries.get(runId));
    }

    @Override
    public void saveDocument(String runId, RenderedDocument document) {
        documents.put(runId, document);
    }

    @Override
    public Optional<RenderedDocument> document(String runId) {
        return Optional.ofNullable(documents.get(runId));
    }
}
