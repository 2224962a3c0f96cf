package com.campaign.canon.metrics;

import com.campaign.canon.correction.CorrectionState;
import com.campaign.canon.run.PipelineStage;
import com.campaign.canon.run.RunStatus;
import com.campaign.canon.run.StepStatus;

import java.time.Duration;

/**
 * Records quality and throughput metrics of the canonical-state core.
 * The default {@link NoOpCanonMetrics} does nothing, so the library works
 * without a metrics backend.
 */
public interface CanonMetrics {

    void recordCorrectionDecided(CorrectionState state);

    void incrementEntitiesCreated(int count);

    void incrementMentionsDroppedHidden(int count);

    void incrementMentionsDroppedSuppressed(int count);

    void incrementAliasCollisions(int count);

    void incrementEvidenceRepaired(int count);

    void incrementEvidenceDropped(int count);

    void recordStage(PipelineStage stage, StepStatus outcome, Duration duration);

    void recordRunFinished(RunStatus status);
}
