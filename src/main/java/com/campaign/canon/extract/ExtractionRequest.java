package com.campaign.canon.extract;

import com.campaign.canon.canonical.CanonicalSnapshot;
import com.campaign.canon.core.model.Utterance;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Input to the Extractor for one session.
 *
 * @param campaignId    the campaign
 * @param sessionId     the session
 * @param runId         the run doing the extraction
 * @param utterances    session utterances in transcript order
 * @param characterMap  speaker to character name, may be empty
 * @param snapshot      current canonical names and hidden names
 * @param promptVersion prompt version of the run
 * @param model         model identifier of the run
 */
public record ExtractionRequest(
        String campaignId,
        String sessionId,
        String runId,
        List<Utterance> utterances,
        Map<String, String> characterMap,
        CanonicalSnapshot snapshot,
        String promptVersion,
        String model
) {
    public ExtractionRequest {
        Objects.requireNonNull(campaignId, "campaignId is required");
        Objects.requireNonNull(sessionId, "sessionId is required");
        utterances = List.copyOf(utterances);
        characterMap = characterMap != null ? Map.copyOf(characterMap) : Map.of();
    }

    public SortedSet<String> speakers() {
        SortedSet<String> speakers = new TreeSet<>();
        utterances.forEach(u -> speakers.add(u.speaker()));
        return speakers;
    }

    public String transcriptText() {
        return TranscriptFormatter.format(utterances, characterMap);
    }
}
