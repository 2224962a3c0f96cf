package com.campaign.canon.core;

/**
 * Stable error codes for the failures the canonical-state core reports.
 * Transports map these to their own status representation.
 */
public enum ErrorCode {
    NOT_AUTHORIZED,
    ALREADY_DECIDED,
    INVALID_CORRECTION,
    CYCLE_DETECTED,
    EVIDENCE_INTEGRITY_VIOLATION,
    IDEMPOTENCY_CONFLICT,
    STAGE_FAILURE
}
