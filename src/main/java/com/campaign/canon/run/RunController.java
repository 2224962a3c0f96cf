package com.campaign.canon.run;

import com.campaign.canon.audit.AuditAction;
import com.campaign.canon.audit.AuditService;
import com.campaign.canon.lock.LockKeys;
import com.campaign.canon.lock.SerializationLock;
import com.campaign.canon.logging.LogContext;
import com.campaign.canon.metrics.CanonMetrics;
import com.campaign.canon.metrics.NoOpCanonMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run state machine: idempotent run creation, stage execution with bounded retries,
 * cancellation between steps and resumption of partial runs.
 *
 * <p>The controller does not schedule anything itself; a caller (the facade, or an
 * external workflow engine) invokes {@link #execute} and {@link #resume} with the
 * stage handlers. At most one run per session is {@code RUNNING} at a time.</p>
 */
public class RunController {
    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    public static final int DEFAULT_ERROR_TRUNCATE_LENGTH = 2000;

    private final RunRepository repository;
    private final SerializationLock lock;
    private final AuditService auditService;
    private final CanonMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int errorTruncateLength;
    private final AtomicLong sequence = new AtomicLong();

    public RunController(RunRepository repository, SerializationLock lock, AuditService auditService) {
        this(repository, lock, auditService, new NoOpCanonMetrics(), RetryPolicy.defaults(), Sleeper.system(),
                Clock.systemUTC(), DEFAULT_ERROR_TRUNCATE_LENGTH);
    }

    public RunController(RunRepository repository, SerializationLock lock, AuditService auditService,
                         CanonMetrics metrics, RetryPolicy retryPolicy, Sleeper sleeper, Clock clock,
                         int errorTruncateLength) {
        if (errorTruncateLength <= 0) {
            throw new IllegalArgumentException("errorTruncateLength must be > 0");
        }
        this.repository = repository;
        this.lock = lock;
        this.auditService = auditService;
        this.metrics = metrics;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.errorTruncateLength = errorTruncateLength;
    }

    /**
     * Creates a run or returns the one the key already identifies.
     *
     * @throws IdempotencyConflictException if another run of the session is running
     *                                      under a different key, or reprocessing is
     *                                      requested while a run is in flight
     */
    public RunStart startRun(RunRequest request) {
        IdempotencyKey key = request.key();
        return lock.withLock(LockKeys.session(key.campaignId(), key.sessionId()), () -> {
            List<Run> runs = repository.findBySession(key.campaignId(), key.sessionId());
            String digest = key.digest();

            Optional<Run> running = runs.stream().filter(r -> r.getStatus() == RunStatus.RUNNING).findFirst();
            if (running.isPresent()) {
                Run current = running.get();
                if (!request.reprocess() && current.getKey().digest().equals(digest)) {
                    log.info("run.reused runId={} status=RUNNING", current.getId());
                    return new RunStart(current, false);
                }
                throw new IdempotencyConflictException("Session " + key.sessionId()
                        + " already has a running run: " + current.getId(), current.getId());
            }

            if (!request.reprocess()) {
                for (int i = runs.size() - 1; i >= 0; i--) {
                    Run previous = runs.get(i);
                    if (previous.getKey().digest().equals(digest)) {
                        log.info("run.reused runId={} status={}", previous.getId(), previous.getStatus());
                        return new RunStart(previous, false);
                    }
                }
            }

            Run run = repository.save(new Run(key, clock.instant(), sequence.incrementAndGet()));
            try (LogContext ctx = LogContext.forRun(run.getId(), key.campaignId(), key.sessionId())) {
                auditService.record(AuditAction.RUN_STARTED, key.campaignId(), run.getId(), "system",
                        Map.of("sessionId", key.sessionId(), "key", digest, "reprocess", request.reprocess()));
                log.info("run.started runId={} key={} reprocess={}", run.getId(), digest, request.reprocess());
            }
            return new RunStart(run, true);
        });
    }

    /**
     * Executes stages of a running run in order, stopping at the first failed stage.
     *
     * @return the run in its resulting status
     * @throws IllegalStateException    if the run is not running or already executing
     * @throws IllegalArgumentException if a stage has no handler
     */
    public Run execute(String runId, List<PipelineStage> stages, Map<PipelineStage, StageHandler> handlers) {
        Run run = get(runId);
        requireHandlers(stages, handlers);
        if (run.getStatus() != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is not running: " + run.getStatus());
        }
        if (!run.beginExecution()) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        try (LogContext ctx = LogContext.forRun(runId, run.getCampaignId(), run.getSessionId())) {
            run.plan(stages);
            for (PipelineStage stage : stages) {
                if (run.isCancelRequested()) {
                    finish(run, RunStatus.FAILED, Run.CANCELLED);
                    auditService.record(AuditAction.RUN_CANCELLED, run.getCampaignId(), runId, "system");
                    return run;
                }
                if (!runStage(run, stage, handlers.get(stage))) {
                    break;
                }
            }
            finish(run, outcome(run, stages), lastError(run));
            return run;
        } finally {
            run.endExecution();
        }
    }

    /**
     * Re-enters the stages of a partial run whose latest step did not succeed.
     * Succeeded stages, structural ones in particular, are never run again.
     *
     * @throws IllegalStateException if the run is not partial
     */
    public Run resume(String runId, Map<PipelineStage, StageHandler> handlers) {
        Run run = get(runId);
        if (run.getStatus() != RunStatus.PARTIAL) {
            throw new IllegalStateException("Run " + runId + " is not partial: " + run.getStatus());
        }
        List<PipelineStage> remaining = new ArrayList<>();
        for (PipelineStage stage : run.getPlannedStages()) {
            if (!run.hasSucceeded(stage)) {
                remaining.add(stage);
            }
        }
        requireHandlers(remaining, handlers);
        if (!run.beginExecution()) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        try (LogContext ctx = LogContext.forRun(runId, run.getCampaignId(), run.getSessionId())) {
            log.info("run.resuming runId={} stages={}", runId, remaining);
            for (PipelineStage stage : remaining) {
                if (!runStage(run, stage, handlers.get(stage))) {
                    String error = lastError(run);
                    lock.withLock(LockKeys.run(runId), () -> run.updateFailureReason(error));
                    log.warn("run.resume_failed runId={} stage={} status=PARTIAL", runId, stage);
                    return run;
                }
            }
            finish(run, RunStatus.COMPLETED, null);
            return run;
        } finally {
            run.endExecution();
        }
    }

    /**
     * Requests cancellation of a running run; honoured before the next step starts.
     *
     * @return false if the run is not running or cancellation was already requested
     */
    public boolean cancel(String runId) {
        Run run = get(runId);
        if (run.getStatus() != RunStatus.RUNNING) {
            return false;
        }
        boolean requested = run.requestCancel();
        if (requested) {
            log.info("run.cancel_requested runId={}", runId);
        }
        return requested;
    }

    public RunStatusView getRunStatus(String runId) {
        return RunStatusView.of(get(runId));
    }

    public List<Run> runsForSession(String campaignId, String sessionId) {
        return repository.findBySession(campaignId, sessionId);
    }

    /**
     * @throws IllegalArgumentException if no such run exists
     */
    public Run get(String runId) {
        return repository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
    }

    private boolean runStage(Run run, PipelineStage stage, StageHandler handler) {
        RunStep step = lock.withLock(LockKeys.run(run.getId()), () -> run.appendStep(stage, clock.instant()));
        try (LogContext ctx = LogContext.forStage(stage.stageName())) {
            Instant started = clock.instant();
            Exception lastFailure = null;
            while (true) {
                int attempt = step.nextAttempt();
                try {
                    handler.run(new StageContext(run.getId(), run.getKey(), stage, attempt));
                    lock.withLock(LockKeys.run(run.getId()), () -> step.succeed(clock.instant()));
                    metrics.recordStage(stage, StepStatus.SUCCEEDED, Duration.between(started, clock.instant()));
                    log.info("stage.succeeded stage={} attempts={}", stage.stageName(), attempt);
                    return true;
                } catch (Exception e) {
                    lastFailure = e;
                    boolean retryable = !(e instanceof StageFailureException sfe) || sfe.isRetryable();
                    if (!retryable || attempt >= retryPolicy.maxAttempts()) {
                        break;
                    }
                    Duration backoff = retryPolicy.backoffFor(attempt);
                    log.warn("stage.retry stage={} attempt={} backoffMs={} error={}",
                            stage.stageName(), attempt, backoff.toMillis(), e.getMessage());
                    try {
                        sleeper.sleep(backoff);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        lastFailure = ie;
                        break;
                    }
                }
            }

            String error = truncate(describe(lastFailure));
            lock.withLock(LockKeys.run(run.getId()), () -> step.fail(error, clock.instant()));
            metrics.recordStage(stage, StepStatus.FAILED, Duration.between(started, clock.instant()));
            auditService.record(AuditAction.STAGE_FAILED, run.getCampaignId(), run.getId(), "system",
                    Map.of("stage", stage.stageName(), "attempts", step.getAttempts(), "error", error));
            log.error("stage.failed stage={} attempts={} error={}", stage.stageName(), step.getAttempts(), error,
                    lastFailure);
            return false;
        }
    }

    private RunStatus outcome(Run run, List<PipelineStage> stages) {
        boolean allSucceeded = stages.stream().allMatch(run::hasSucceeded);
        if (allSucceeded) {
            return RunStatus.COMPLETED;
        }
        boolean structuralSucceeded = stages.stream()
                .filter(PipelineStage::isStructural)
                .allMatch(run::hasSucceeded);
        return structuralSucceeded ? RunStatus.PARTIAL : RunStatus.FAILED;
    }

    private void finish(Run run, RunStatus status, String reason) {
        lock.withLock(LockKeys.run(run.getId()), () -> run.transitionTo(status, reason, clock.instant()));
        metrics.recordRunFinished(status);
        Map<String, Object> details = reason != null
                ? Map.of("status", status.name(), "reason", reason)
                : Map.of("status", status.name());
        auditService.record(AuditAction.RUN_STATUS_CHANGED, run.getCampaignId(), run.getId(), "system", details);
        log.info("run.finished runId={} status={} reason={}", run.getId(), status, reason);
    }

    private String lastError(Run run) {
        List<RunStep> steps = run.getSteps();
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i).getStatus() == StepStatus.FAILED) {
                return steps.get(i).getStage().stageName() + ": " + steps.get(i).getError();
            }
        }
        return null;
    }

    private void requireHandlers(List<PipelineStage> stages, Map<PipelineStage, StageHandler> handlers) {
        for (PipelineStage stage : stages) {
            if (!handlers.containsKey(stage)) {
                throw new IllegalArgumentException("No handler for stage: " + stage);
            }
        }
    }

    private static String describe(Exception e) {
        if (e == null) {
            return "unknown error";
        }
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    String truncate(String error) {
        return error.length() <= errorTruncateLength ? error : error.substring(0, errorTruncateLength);
    }
}
