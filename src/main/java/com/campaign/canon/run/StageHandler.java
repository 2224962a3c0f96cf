package com.campaign.canon.run;

/**
 * Step function of one pipeline stage. Must be safe to invoke again after a failed
 * attempt; anything it throws is retried unless it is a non-retryable
 * {@link StageFailureException}.
 */
@FunctionalInterface
public interface StageHandler {

    void run(StageContext context) throws Exception;
}
