package com.campaign.canon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Pointer into transcript text substantiating a fact.
 *
 * <p>When both offsets are present, {@code utterance.text[charStart, charEnd)} is the
 * cited text. Offsets are UTF-16 code unit indexes into the newline-normalized
 * utterance text.</p>
 *
 * @param utteranceId the referenced utterance
 * @param charStart   inclusive start offset, or null for an unranged span
 * @param charEnd     exclusive end offset, or null for an unranged span
 * @param kind        what the span is used for
 * @param confidence  optional extractor confidence
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceSpan(
        @JsonProperty("utterance_id") String utteranceId,
        @JsonProperty("char_start") Integer charStart,
        @JsonProperty("char_end") Integer charEnd,
        @JsonProperty("kind") SpanKind kind,
        @JsonProperty("confidence") Double confidence
) {
    public EvidenceSpan {
        kind = kind != null ? kind : SpanKind.SUPPORT;
    }

    public static EvidenceSpan of(String utteranceId, Integer charStart, Integer charEnd) {
        return new EvidenceSpan(utteranceId, charStart, charEnd, SpanKind.SUPPORT, null);
    }

    public static EvidenceSpan unranged(String utteranceId) {
        return new EvidenceSpan(utteranceId, null, null, SpanKind.SUPPORT, null);
    }

    public boolean isRanged() {
        return charStart != null && charEnd != null;
    }

    public EvidenceSpan withRange(int start, int end) {
        return new EvidenceSpan(utteranceId, start, end, kind, confidence);
    }

    public EvidenceSpan withKind(SpanKind newKind) {
        return new EvidenceSpan(utteranceId, charStart, charEnd, Objects.requireNonNull(newKind), confidence);
    }
}
