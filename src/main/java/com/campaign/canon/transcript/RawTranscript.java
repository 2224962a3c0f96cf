package com.campaign.canon.transcript;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Transcript bytes as loaded from a {@link TranscriptSource}.
 */
public final class RawTranscript {

    private final TranscriptFormat format;
    private final byte[] content;

    public RawTranscript(TranscriptFormat format, byte[] content) {
        this.format = Objects.requireNonNull(format, "format is required");
        this.content = Objects.requireNonNull(content, "content is required").clone();
    }

    public static RawTranscript of(TranscriptFormat format, String content) {
        return new RawTranscript(format, content.getBytes(StandardCharsets.UTF_8));
    }

    public TranscriptFormat getFormat() {
        return format;
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /**
     * Hex SHA-256 of the raw bytes; part of the run idempotency key.
     */
    public String sha256() {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
