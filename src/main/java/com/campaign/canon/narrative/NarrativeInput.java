package com.campaign.canon.narrative;

import com.campaign.canon.core.model.Event;
import com.campaign.canon.core.model.Utterance;
import com.campaign.canon.evidence.Quote;

import java.util.List;

/**
 * Persisted, resolved session data handed to the narrative collaborators.
 *
 * @param campaignId the campaign
 * @param sessionId  the session
 * @param runId      the run
 * @param utterances session utterances
 * @param events     resolved events
 * @param quotes     validated quotes, the only text a summary may quote
 */
public record NarrativeInput(
        String campaignId,
        String sessionId,
        String runId,
        List<Utterance> utterances,
        List<Event> events,
        List<Quote> quotes
) {
    public NarrativeInput {
        utterances = List.copyOf(utterances);
        events = List.copyOf(events);
        quotes = List.copyOf(quotes);
    }
}
