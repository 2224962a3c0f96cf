package com.campaign.canon.run;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of a processing request. Two runs with equal keys would produce the
 * same output, so a running or finished run with the same key is reused.
 */
public record IdempotencyKey(
        String campaignId,
        String sessionId,
        String transcriptHash,
        String promptVersion,
        String model
) {
    public IdempotencyKey {
        Objects.requireNonNull(campaignId, "campaignId is required");
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(transcriptHash, "transcriptHash is required");
        promptVersion = promptVersion != null ? promptVersion : "";
        model = model != null ? model : "";
    }

    /**
     * Stable hex SHA-256 of the key fields.
     */
    public String digest() {
        String joined = String.join("\u001f", campaignId, sessionId, transcriptHash, promptVersion, model);
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(joined.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
