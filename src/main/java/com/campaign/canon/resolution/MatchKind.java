package com.campaign.canon.resolution;

/**
 * How a mention or thread title was attached to a canonical record.
 */
public enum MatchKind {
    /** Case-insensitive exact match on a canonical name or alias. */
    EXACT,
    /** Match on the article/punctuation-insensitive normalized form. */
    NORMALIZED,
    /** No match; a new base record was created. */
    CREATED
}
