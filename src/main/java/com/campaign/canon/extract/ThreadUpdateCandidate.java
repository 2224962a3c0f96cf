package com.campaign.canon.extract;

import com.campaign.canon.core.model.EvidenceSpan;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A proposed thread update. {@code relatedEventIndexes} point into
 * {@link SessionFacts#events()} of the same extraction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadUpdateCandidate(
        @JsonProperty("update_type") String updateType,
        @JsonProperty("note") String note,
        @JsonProperty("evidence") List<EvidenceSpan> evidence,
        @JsonProperty("related_event_indexes") List<Integer> relatedEventIndexes
) {
    public ThreadUpdateCandidate {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        relatedEventIndexes = relatedEventIndexes != null ? List.copyOf(relatedEventIndexes) : List.of();
    }
}
