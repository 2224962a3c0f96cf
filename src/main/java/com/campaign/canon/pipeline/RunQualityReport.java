package com.campaign.canon.pipeline;

import com.campaign.canon.resolution.ResolutionCounters;
import com.campaign.canon.resolution.ResolutionIssue;
import com.campaign.canon.resolution.ThreadCounters;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality counters of a run: what was repaired, dropped, created or reported.
 * Nothing extracted disappears without showing up here.
 */
public record RunQualityReport(
        String runId,
        int utterances,
        EvidenceCounters evidence,
        ResolutionCounters mentions,
        ThreadCounters threads,
        List<ResolutionIssue> issues
) {
    public RunQualityReport {
        evidence = evidence != null ? evidence : EvidenceCounters.empty();
        mentions = mentions != null ? mentions : ResolutionCounters.empty();
        threads = threads != null ? threads : ThreadCounters.empty();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    static RunQualityReport of(String runId, int utterances, PersistedFacts persisted, ResolvedSession resolved) {
        List<ResolutionIssue> issues = new ArrayList<>();
        if (resolved != null) {
            issues.addAll(resolved.mentions().issues());
            issues.addAll(resolved.threads().issues());
        }
        return new RunQualityReport(runId, utterances,
                persisted != null ? persisted.counters() : null,
                resolved != null ? resolved.mentions().counters() : null,
                resolved != null ? resolved.threads().counters() : null,
                issues);
    }
}
