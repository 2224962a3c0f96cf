package com.campaign.canon.run;

import java.util.Objects;

/**
 * Request to start processing a session.
 *
 * @param key       idempotency key of the request
 * @param reprocess create a new run even when a finished run has the same key
 */
public record RunRequest(IdempotencyKey key, boolean reprocess) {

    public RunRequest {
        Objects.requireNonNull(key, "key is required");
    }

    public static RunRequest of(IdempotencyKey key) {
        return new RunRequest(key, false);
    }
}
