package com.campaign.canon.run;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution of a stage within a run. Steps are appended, never replaced: a
 * resumed stage gets a new step.
 */
public class RunStep {

    private final String id;
    private final PipelineStage stage;
    private StepStatus status;
    private int attempts;
    private final Instant startedAt;
    private Instant finishedAt;
    private String error;

    RunStep(PipelineStage stage, Instant startedAt) {
        this.id = UUID.randomUUID().toString();
        this.stage = Objects.requireNonNull(stage);
        this.status = StepStatus.RUNNING;
        this.startedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public synchronized StepStatus getStatus() {
        return status;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * Captured error text of a failed step, null otherwise.
     */
    public synchronized String getError() {
        return error;
    }

    synchronized int nextAttempt() {
        return ++attempts;
    }

    synchronized void succeed(Instant when) {
        requireRunning();
        this.status = StepStatus.SUCCEEDED;
        this.finishedAt = when;
        this.error = null;
    }

    synchronized void fail(String error, Instant when) {
        requireRunning();
        this.status = StepStatus.FAILED;
        this.finishedAt = when;
        this.error = error;
    }

    private void requireRunning() {
        if (status != StepStatus.RUNNING) {
            throw new IllegalStateException("Step " + id + " is already " + status);
        }
    }

    /**
     * Immutable copy for status reads.
     */
    public synchronized StepView view() {
        return new StepView(id, stage, status, attempts, startedAt, finishedAt, error);
    }

    @Override
    public String toString() {
        return "RunStep{stage=" + stage + ", status=" + getStatus() + ", attempts=" + getAttempts() + "}";
    }

    /**
     * Snapshot of a step.
     */
    public record StepView(String id, PipelineStage stage, StepStatus status, int attempts,
                           Instant startedAt, Instant finishedAt, String error) {
    }
}
