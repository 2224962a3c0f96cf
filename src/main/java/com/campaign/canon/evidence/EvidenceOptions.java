package com.campaign.canon.evidence;

/**
 * Evidence cleaning options.
 *
 * @param fillMissingOffsets  treat an unranged span as citing its whole utterance
 * @param confidenceDemotion  factor applied to the confidence of an owner that lost spans
 */
public record EvidenceOptions(boolean fillMissingOffsets, double confidenceDemotion) {

    public EvidenceOptions {
        if (confidenceDemotion < 0.0 || confidenceDemotion > 1.0) {
            throw new IllegalArgumentException("confidenceDemotion must be within [0, 1]");
        }
    }

    public static EvidenceOptions defaults() {
        return new EvidenceOptions(false, 0.5);
    }
}
