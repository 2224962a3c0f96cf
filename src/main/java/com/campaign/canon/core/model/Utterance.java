package com.campaign.canon.core.model;

import java.util.Objects;

/**
 * One transcript line. Text is stored with newlines normalized to {@code \n},
 * which is the form every evidence offset refers to.
 */
public record Utterance(
        String id,
        String sessionId,
        String speaker,
        long startMs,
        long endMs,
        String text
) {
    public Utterance {
        Objects.requireNonNull(id, "id is required");
        speaker = speaker == null || speaker.isBlank() ? "unknown" : speaker.trim();
        text = normalizeNewlines(text);
    }

    /**
     * Converts CRLF and lone CR line endings to LF.
     */
    public static String normalizeNewlines(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
