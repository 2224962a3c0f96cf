package com.campaign.canon.resolution;

/**
 * Something resolution could not settle on its own and reports for review.
 *
 * @param kind     what went wrong
 * @param text     the mention text or thread title involved
 * @param entityId the record involved, null if none
 * @param detail   human-readable detail
 */
public record ResolutionIssue(Kind kind, String text, String entityId, String detail) {

    public enum Kind {
        HIDDEN_ENTITY,
        SUPPRESSED_NAME,
        ALIAS_COLLISION,
        BLANK_MENTION,
        HIDDEN_THREAD
    }
}
