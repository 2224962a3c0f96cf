package com.campaign.canon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of story threads.
 */
public enum ThreadKind {
    QUEST,
    MYSTERY,
    PERSONAL_ARC,
    FACTION_ARC,
    OTHER;

    @JsonCreator
    public static ThreadKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
