package com.campaign.canon.run;

/**
 * What a stage handler knows about the attempt it is running.
 *
 * @param runId      the run
 * @param key        the run's idempotency key
 * @param stage      the stage being executed
 * @param attempt    1-based attempt number
 */
public record StageContext(String runId, IdempotencyKey key, PipelineStage stage, int attempt) {

    public String campaignId() {
        return key.campaignId();
    }

    public String sessionId() {
        return key.sessionId();
    }
}
