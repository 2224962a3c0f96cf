package com.campaign.canon.transcript;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code <root>/campaigns/<campaign>/sessions/<session>/transcript.jsonl},
 * falling back to {@code transcript.txt}.
 */
public class FileSystemTranscriptSource implements TranscriptSource {
    private static final Logger log = LoggerFactory.getLogger(FileSystemTranscriptSource.class);

    private final Path root;

    public FileSystemTranscriptSource(Path root) {
        this.root = root;
    }

    @Override
    public RawTranscript load(String campaignSlug, String sessionSlug) {
        Path sessionDir = root.resolve("campaigns").resolve(campaignSlug).resolve("sessions").resolve(sessionSlug);
        Path jsonl = sessionDir.resolve("transcript.jsonl");
        Path txt = sessionDir.resolve("transcript.txt");
        try {
            if (Files.isRegularFile(jsonl)) {
                log.debug("Loading transcript {}", jsonl);
                return new RawTranscript(TranscriptFormat.JSONL, Files.readAllBytes(jsonl));
            }
            if (Files.isRegularFile(txt)) {
                log.debug("Loading transcript {}", txt);
                return new RawTranscript(TranscriptFormat.TXT, Files.readAllBytes(txt));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read transcript in " + sessionDir, e);
        }
        throw new IllegalArgumentException("No transcript found in " + sessionDir);
    }
}
