package com.campaign.canon.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses raw Extractor JSON into {@link SessionFacts}. Unknown properties are
 * ignored and enum values are read leniently.
 */
public class SessionFactsParser {

    private final ObjectMapper objectMapper;

    public SessionFactsParser() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    /**
     * @throws IllegalArgumentException if the payload is not valid session facts JSON
     */
    public SessionFacts parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Extractor returned an empty payload");
        }
        try {
            SessionFacts facts = objectMapper.readValue(json, SessionFacts.class);
            return facts != null ? facts : SessionFacts.empty();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed session facts: " + e.getOriginalMessage(), e);
        }
    }

    public String write(SessionFacts facts) {
        try {
            return objectMapper.writeValueAsString(facts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session facts", e);
        }
    }
}
