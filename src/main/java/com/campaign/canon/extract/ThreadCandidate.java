package com.campaign.canon.extract;

import com.campaign.canon.core.model.EvidenceSpan;
import com.campaign.canon.core.model.ThreadKind;
import com.campaign.canon.core.model.ThreadStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadCandidate(
        @JsonProperty("title") String title,
        @JsonProperty("kind") ThreadKind kind,
        @JsonProperty("status") ThreadStatus status,
        @JsonProperty("summary") String summary,
        @JsonProperty("updates") List<ThreadUpdateCandidate> updates,
        @JsonProperty("evidence") List<EvidenceSpan> evidence,
        @JsonProperty("confidence") Double confidence
) {
    public ThreadCandidate {
        kind = kind != null ? kind : ThreadKind.OTHER;
        status = status != null ? status : ThreadStatus.PROPOSED;
        updates = updates != null ? List.copyOf(updates) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}
