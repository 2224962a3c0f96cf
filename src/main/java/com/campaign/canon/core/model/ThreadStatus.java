package com.campaign.canon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a story thread.
 */
public enum ThreadStatus {
    PROPOSED,
    ACTIVE,
    BLOCKED,
    COMPLETED,
    FAILED,
    ABANDONED;

    /**
     * Parses a status value, failing on anything unrecognised.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static ThreadStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Thread status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Lenient variant used for extractor output, defaulting to {@link #PROPOSED}.
     */
    @JsonCreator
    public static ThreadStatus fromValue(String value) {
        try {
            return parse(value);
        } catch (IllegalArgumentException e) {
            return PROPOSED;
        }
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
