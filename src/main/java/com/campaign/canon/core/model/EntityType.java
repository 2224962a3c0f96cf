package com.campaign.canon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of campaign entities an extraction can mention.
 */
public enum EntityType {
    CHARACTER,
    LOCATION,
    ITEM,
    FACTION,
    MONSTER,
    DEITY,
    ORGANIZATION,
    OTHER;

    /**
     * Parses the lower-case wire value. Unrecognised values map to {@link #OTHER}.
     */
    @JsonCreator
    public static EntityType fromValue(String value) {
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
