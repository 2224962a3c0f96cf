package com.campaign.canon.evidence;

import java.util.Objects;
import java.util.UUID;

/**
 * A persisted quote. {@code text} always equals
 * {@code utterance.text.substring(charStart, charEnd)}; instances are only created by
 * {@link EvidenceValidator}.
 */
public final class Quote {

    private final String id;
    private final String sessionId;
    private final String runId;
    private final String utteranceId;
    private final int charStart;
    private final int charEnd;
    private final String speaker;
    private final String note;
    private final String text;

    Quote(String sessionId, String runId, String utteranceId, int charStart, int charEnd,
          String speaker, String note, String text) {
        this.id = UUID.randomUUID().toString();
        this.sessionId = sessionId;
        this.runId = runId;
        this.utteranceId = Objects.requireNonNull(utteranceId);
        this.charStart = charStart;
        this.charEnd = charEnd;
        this.speaker = speaker;
        this.note = note;
        this.text = Objects.requireNonNull(text);
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRunId() {
        return runId;
    }

    public String getUtteranceId() {
        return utteranceId;
    }

    public int getCharStart() {
        return charStart;
    }

    public int getCharEnd() {
        return charEnd;
    }

    public String getSpeaker() {
        return speaker;
    }

    public String getNote() {
        return note;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Quote) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Quote{utteranceId='" + utteranceId + "', range=[" + charStart + "," + charEnd
                + "), text='" + text + "'}";
    }
}
