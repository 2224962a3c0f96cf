package com.campaign.canon.correction;

/**
 * Review state of a correction. Only {@link #APPROVED} corrections are effective.
 */
public enum CorrectionState {
    PENDING,
    APPROVED,
    REJECTED
}
