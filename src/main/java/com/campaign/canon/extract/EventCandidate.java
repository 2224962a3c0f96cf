package com.campaign.canon.extract;

import com.campaign.canon.core.model.EvidenceSpan;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EventCandidate(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("start_ms") long startMs,
        @JsonProperty("end_ms") long endMs,
        @JsonProperty("summary") String summary,
        @JsonProperty("entities") List<String> entities,
        @JsonProperty("evidence") List<EvidenceSpan> evidence,
        @JsonProperty("confidence") Double confidence
) {
    public EventCandidate {
        eventType = eventType != null && !eventType.isBlank() ? eventType : "generic";
        entities = entities != null ? List.copyOf(entities) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}
