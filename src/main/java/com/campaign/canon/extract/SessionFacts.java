package com.campaign.canon.extract;

import com.campaign.canon.evidence.QuoteCandidate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Typed Extractor output for one session. Offsets and names in here are untrusted
 * until the persist and resolve stages have run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionFacts(
        @JsonProperty("mentions") List<MentionCandidate> mentions,
        @JsonProperty("scenes") List<SceneCandidate> scenes,
        @JsonProperty("events") List<EventCandidate> events,
        @JsonProperty("threads") List<ThreadCandidate> threads,
        @JsonProperty("quotes") List<QuoteCandidate> quotes
) {
    public SessionFacts {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        scenes = scenes != null ? List.copyOf(scenes) : List.of();
        events = events != null ? List.copyOf(events) : List.of();
        threads = threads != null ? List.copyOf(threads) : List.of();
        quotes = quotes != null ? List.copyOf(quotes) : List.of();
    }

    public static SessionFacts empty() {
        return new SessionFacts(null, null, null, null, null);
    }
}
