package com.campaign.canon.extract;

import com.campaign.canon.core.model.EntityType;
import com.campaign.canon.core.model.EvidenceSpan;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MentionCandidate(
        @JsonProperty("text") String text,
        @JsonProperty("entity_type") EntityType entityType,
        @JsonProperty("description") String description,
        @JsonProperty("evidence") List<EvidenceSpan> evidence,
        @JsonProperty("confidence") Double confidence
) {
    public MentionCandidate {
        entityType = entityType != null ? entityType : EntityType.OTHER;
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}
