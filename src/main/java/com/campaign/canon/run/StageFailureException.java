package com.campaign.canon.run;

import com.campaign.canon.core.CanonException;
import com.campaign.canon.core.ErrorCode;

/**
 * Failure of a pipeline stage. Handlers throw it with {@code retryable=false} for
 * failures another attempt cannot fix.
 */
public class StageFailureException extends CanonException {

    private final PipelineStage stage;
    private final boolean retryable;

    public StageFailureException(PipelineStage stage, String message, boolean retryable) {
        super(ErrorCode.STAGE_FAILURE, message);
        this.stage = stage;
        this.retryable = retryable;
    }

    public StageFailureException(PipelineStage stage, String message, Throwable cause, boolean retryable) {
        super(ErrorCode.STAGE_FAILURE, message, cause);
        this.stage = stage;
        this.retryable = retryable;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
