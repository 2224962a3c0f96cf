package com.campaign.canon.transcript;

/**
 * Where session transcripts come from.
 */
public interface TranscriptSource {

    /**
     * Loads the transcript of a session.
     *
     * @throws IllegalArgumentException if the session has no transcript
     */
    RawTranscript load(String campaignSlug, String sessionSlug);
}
