package com.campaign.canon.resolution;

import com.campaign.canon.core.model.CampaignEntity;

import java.util.List;

/**
 * Result of resolving a batch of mentions.
 *
 * @param resolved        mentions attached to entities, in input order
 * @param createdEntities entities created by this pass
 * @param counters        quality counters
 * @param issues          reported problems, in input order
 */
public record ResolvedMentions(
        List<ResolvedMention> resolved,
        List<CampaignEntity> createdEntities,
        ResolutionCounters counters,
        List<ResolutionIssue> issues
) {
    public ResolvedMentions {
        resolved = List.copyOf(resolved);
        createdEntities = List.copyOf(createdEntities);
        issues = List.copyOf(issues);
    }
}
