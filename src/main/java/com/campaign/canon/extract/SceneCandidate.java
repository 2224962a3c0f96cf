package com.campaign.canon.extract;

import com.campaign.canon.core.model.EvidenceSpan;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SceneCandidate(
        @JsonProperty("title") String title,
        @JsonProperty("start_ms") long startMs,
        @JsonProperty("end_ms") long endMs,
        @JsonProperty("summary") String summary,
        @JsonProperty("location") String location,
        @JsonProperty("participants") List<String> participants,
        @JsonProperty("evidence") List<EvidenceSpan> evidence
) {
    public SceneCandidate {
        participants = participants != null ? List.copyOf(participants) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public SceneCandidate withEvidence(List<EvidenceSpan> cleaned) {
        return new SceneCandidate(title, startMs, endMs, summary, location, participants, cleaned);
    }
}
