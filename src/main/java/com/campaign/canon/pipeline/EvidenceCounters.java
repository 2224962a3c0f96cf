package com.campaign.canon.pipeline;

/**
 * Evidence cleaning counters of the persist stage.
 */
public record EvidenceCounters(
        int quotesKept,
        int quotesRepaired,
        int quotesDropped,
        int spansRepaired,
        int spansDropped,
        int ownersIncomplete
) {
    public static EvidenceCounters empty() {
        return new EvidenceCounters(0, 0, 0, 0, 0, 0);
    }
}
