package com.campaign.canon.correction;

import java.util.List;

/**
 * Checks that a set of approved corrections folds cleanly.
 * Implemented by the canonical map builder; the ledger calls it before a
 * correction becomes effective.
 */
public interface LedgerValidator {

    /**
     * Folds {@code corrections} strictly for the given scope.
     *
     * @param campaignId the campaign
     * @param sessionId  session scope, or null for the campaign-wide fold
     * @param corrections approved corrections plus the candidate, in any order
     * @throws CycleDetectedException     if a merge chain would loop
     * @throws InvalidCorrectionException if a correction cannot apply
     */
    void validate(String campaignId, String sessionId, List<Correction> corrections);
}
