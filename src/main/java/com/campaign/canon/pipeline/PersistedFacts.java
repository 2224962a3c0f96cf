package com.campaign.canon.pipeline;

import com.campaign.canon.core.model.Event;
import com.campaign.canon.core.model.Mention;
import com.campaign.canon.evidence.Quote;
import com.campaign.canon.extract.SceneCandidate;
import com.campaign.canon.extract.ThreadCandidate;

import java.util.List;

/**
 * Output of the persist stage: extraction output with every span validated.
 * Events keep the extraction's order so thread update event indexes stay valid.
 */
public record PersistedFacts(
        List<Mention> mentions,
        List<Event> events,
        List<Quote> quotes,
        List<SceneCandidate> scenes,
        List<ThreadCandidate> threads,
        EvidenceCounters counters
) {
    public PersistedFacts {
        mentions = List.copyOf(mentions);
        events = List.copyOf(events);
        quotes = List.copyOf(quotes);
        scenes = List.copyOf(scenes);
        threads = List.copyOf(threads);
    }
}
