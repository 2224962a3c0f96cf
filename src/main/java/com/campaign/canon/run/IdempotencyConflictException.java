package com.campaign.canon.run;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Thrown when a run is requested for a session that already has a different run
 * in flight.
 */
public class IdempotencyConflictException extends CanonException {

    private final String runningRunId;

    public IdempotencyConflictException(String message, String runningRunId) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT, message);
        this.runningRunId = runningRunId;
    }

    public String getRunningRunId() {
        return runningRunId;
    }
}
