package com.campaign.canon.run;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One processing attempt of a session under an idempotency key.
 * State changes go through {@link RunController}.
 */
public class Run {

    /** Failure reason recorded for cancelled runs. */
    public static final String CANCELLED = "CANCELLED";

    private final String id;
    private final IdempotencyKey key;
    private final Instant createdAt;
    private final long sequence;
    private final List<RunStep> steps = new ArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private RunStatus status;
    private List<PipelineStage> plannedStages = List.of();
    private Instant finishedAt;
    private String failureReason;

    Run(IdempotencyKey key, Instant createdAt, long sequence) {
        this.id = UUID.randomUUID().toString();
        this.key = Objects.requireNonNull(key);
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.status = RunStatus.RUNNING;
    }

    public String getId() {
        return id;
    }

    public IdempotencyKey getKey() {
        return key;
    }

    public String getCampaignId() {
        return key.campaignId();
    }

    public String getSessionId() {
        return key.sessionId();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Creation order among runs of the same controller.
     */
    public long getSequence() {
        return sequence;
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public synchronized List<PipelineStage> getPlannedStages() {
        return plannedStages;
    }

    public synchronized List<RunStep> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    /**
     * The most recent step of a stage, if the stage ran at all.
     */
    public synchronized Optional<RunStep> latestStep(PipelineStage stage) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i).getStage() == stage) {
                return Optional.of(steps.get(i));
            }
        }
        return Optional.empty();
    }

    public boolean hasSucceeded(PipelineStage stage) {
        return latestStep(stage).map(s -> s.getStatus() == StepStatus.SUCCEEDED).orElse(false);
    }

    synchronized void plan(List<PipelineStage> stages) {
        this.plannedStages = List.copyOf(stages);
    }

    synchronized RunStep appendStep(PipelineStage stage, Instant when) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " is " + status);
        }
        RunStep step = new RunStep(stage, when);
        steps.add(step);
        return step;
    }

    synchronized void transitionTo(RunStatus next, String reason, Instant when) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.failureReason = next == RunStatus.COMPLETED ? null : reason;
        if (next.isTerminal() || next == RunStatus.PARTIAL) {
            this.finishedAt = when;
        }
    }

    synchronized void updateFailureReason(String reason) {
        this.failureReason = reason;
    }

    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    boolean beginExecution() {
        return executing.compareAndSet(false, true);
    }

    void endExecution() {
        executing.set(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Run) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Run{id='" + id + "', sessionId='" + getSessionId() + "', status=" + getStatus() + "}";
    }
}
