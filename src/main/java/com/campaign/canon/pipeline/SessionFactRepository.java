package com.campaign.canon.pipeline;

import com.campaign.canon.core.model.Utterance;
import com.campaign.canon.extract.SessionFacts;
import com.campaign.canon.narrative.RenderedDocument;
import com.campaign.canon.narrative.SummaryPlan;

import java.util.List;
import java.util.Optional;

/**
 * Per-run stage outputs. Each stage reads what earlier stages stored, so a resumed
 * run continues from persisted output instead of recomputing it.
 */
public interface SessionFactRepository {

    void saveUtterances(String runId, List<Utterance> utterances);

    List<Utterance> utterances(String runId);

    void saveFacts(String runId, SessionFacts facts);

    Optional<SessionFacts> facts(String runId);

    /**
     * Replaces whatever an earlier attempt of the persist stage stored.
     */
    void savePersisted(String runId, PersistedFacts persisted);

    Optional<PersistedFacts> persisted(String runId);

    void saveResolved(String runId, ResolvedSession resolved);

    Optional<ResolvedSession> resolved(String runId);

    void savePlan(String runId, SummaryPlan plan);

    Optional<SummaryPlan> plan(String runId);

    void saveSummary(String runId, String summaryText);

    Optional<String> summary(String runId);

    void saveDocument(String runId, RenderedDocument document);

    Optional<RenderedDocument> document(String runId);
}
