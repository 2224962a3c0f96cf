package com.campaign.canon.audit;

/**
 * Types of auditable actions on canonical campaign state.
 */
public enum AuditAction {
    CORRECTION_SUBMITTED,
    CORRECTION_APPROVED,
    CORRECTION_REJECTED,
    ENTITY_CREATED,
    ALIAS_ADDED,
    THREAD_CREATED,
    RUN_STARTED,
    RUN_STATUS_CHANGED,
    RUN_CANCELLED,
    STAGE_FAILED
}
