package com.campaign.canon.transcript;

public enum TranscriptFormat {
    /** One JSON object per line: speaker, start and end in seconds, text. */
    JSONL,
    /** One line per utterance: {@code speaker HH:MM:SS text}. */
    TXT
}
