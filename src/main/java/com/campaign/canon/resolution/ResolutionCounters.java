package com.campaign.canon.resolution;

/**
 * Quality counters of one mention resolution pass.
 */
public record ResolutionCounters(
        int mentionsResolved,
        int entitiesCreated,
        int aliasesLearned,
        int mentionsDroppedHidden,
        int mentionsDroppedSuppressed,
        int mentionsDroppedBlank,
        int aliasCollisions
) {
    public static ResolutionCounters empty() {
        return new ResolutionCounters(0, 0, 0, 0, 0, 0, 0);
    }

    public int mentionsDropped() {
        return mentionsDroppedHidden + mentionsDroppedSuppressed + mentionsDroppedBlank;
    }
}
