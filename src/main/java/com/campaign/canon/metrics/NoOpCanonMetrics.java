package com.campaign.canon.metrics;

import com.campaign.canon.correction.CorrectionState;
import com.campaign.canon.run.PipelineStage;
import com.campaign.canon.run.RunStatus;
import com.campaign.canon.run.StepStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link CanonMetrics}.
 */
public class NoOpCanonMetrics implements CanonMetrics {

    @Override
    public void recordCorrectionDecided(CorrectionState state) {
    }

    @Override
    public void incrementEntitiesCreated(int count) {
    }

    @Override
    public void incrementMentionsDroppedHidden(int count) {
    }

    @Override
    public void incrementMentionsDroppedSuppressed(int count) {
    }

    @Override
    public void incrementAliasCollisions(int count) {
    }

    @Override
    public void incrementEvidenceRepaired(int count) {
    }

    @Override
    public void incrementEvidenceDropped(int count) {
    }

    @Override
    public void recordStage(PipelineStage stage, StepStatus outcome, Duration duration) {
    }

    @Override
    public void recordRunFinished(RunStatus status) {
    }
}
