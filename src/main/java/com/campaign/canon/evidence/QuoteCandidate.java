package com.campaign.canon.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A quote proposed by the Extractor. Offsets may be missing or wrong; only
 * {@link EvidenceValidator} turns a candidate into a {@link Quote}.
 *
 * @param utteranceId  the cited utterance
 * @param charStart    proposed start offset
 * @param charEnd      proposed end offset
 * @param speaker      speaker override, defaults to the utterance speaker
 * @param note         free-form note
 * @param expectedText the text the Extractor believes it is quoting, if it said
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteCandidate(
        @JsonProperty("utterance_id") String utteranceId,
        @JsonProperty("char_start") Integer charStart,
        @JsonProperty("char_end") Integer charEnd,
        @JsonProperty("speaker") String speaker,
        @JsonProperty("note") String note,
        @JsonProperty("clean_text") String expectedText
) {
    public static QuoteCandidate of(String utteranceId, Integer charStart, Integer charEnd) {
        return new QuoteCandidate(utteranceId, charStart, charEnd, null, null, null);
    }

    public boolean hasExpectedText() {
        return expectedText != null && !expectedText.isBlank();
    }
}
