package com.campaign.canon.extract;

import com.campaign.canon.core.model.Utterance;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders utterances as the line-per-utterance transcript the Extractor reads:
 * {@code [id] speaker start-end text}. Speakers are mapped to character names
 * where a mapping exists.
 */
public final class TranscriptFormatter {

    private TranscriptFormatter() {
    }

    public static String format(List<Utterance> utterances, Map<String, String> characterMap) {
        return utterances.stream()
                .map(u -> "[" + u.id() + "] "
                        + characterMap.getOrDefault(u.speaker(), u.speaker()) + " "
                        + u.startMs() + "-" + u.endMs() + " "
                        + u.text())
                .collect(Collectors.joining("\n"));
    }
}
