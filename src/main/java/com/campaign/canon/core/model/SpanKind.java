package com.campaign.canon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What an evidence span is used for.
 */
public enum SpanKind {
    QUOTE,
    SUPPORT,
    MENTION,
    OTHER;

    @JsonCreator
    public static SpanKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SUPPORT;
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
