package com.campaign.canon.metrics;

import com.campaign.canon.correction.CorrectionState;
import com.campaign.canon.run.PipelineStage;
import com.campaign.canon.run.RunStatus;
import com.campaign.canon.run.StepStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link CanonMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code canon.correction.decided} - Counter (tag: state)</li>
 *   <li>{@code canon.entity.created} - Counter</li>
 *   <li>{@code canon.mention.dropped} - Counter (tag: reason = hidden | suppressed)</li>
 *   <li>{@code canon.alias.collision} - Counter</li>
 *   <li>{@code canon.evidence.span} - Counter (tag: outcome = repaired | dropped)</li>
 *   <li>{@code canon.stage.duration} - Timer (tags: stage, outcome)</li>
 *   <li>{@code canon.run.finished} - Counter (tag: status)</li>
 * </ul>
 */
public class MicrometerCanonMetrics implements CanonMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();

    public MicrometerCanonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordCorrectionDecided(CorrectionState state) {
        counter("canon.correction.decided", "Corrections approved or rejected", "state", state.name())
                .increment();
    }

    @Override
    public void incrementEntitiesCreated(int count) {
        counter("canon.entity.created", "Canonical entities created by resolution", null, null)
                .increment(count);
    }

    @Override
    public void incrementMentionsDroppedHidden(int count) {
        counter("canon.mention.dropped", "Mentions dropped during resolution", "reason", "hidden")
                .increment(count);
    }

    @Override
    public void incrementMentionsDroppedSuppressed(int count) {
        counter("canon.mention.dropped", "Mentions dropped during resolution", "reason", "suppressed")
                .increment(count);
    }

    @Override
    public void incrementAliasCollisions(int count) {
        counter("canon.alias.collision", "Aliases colliding with explicitly removed aliases", null, null)
                .increment(count);
    }

    @Override
    public void incrementEvidenceRepaired(int count) {
        counter("canon.evidence.span", "Evidence spans repaired or dropped", "outcome", "repaired")
                .increment(count);
    }

    @Override
    public void incrementEvidenceDropped(int count) {
        counter("canon.evidence.span", "Evidence spans repaired or dropped", "outcome", "dropped")
                .increment(count);
    }

    @Override
    public void recordStage(PipelineStage stage, StepStatus outcome, Duration duration) {
        String key = stage.name() + ":" + outcome.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("canon.stage.duration")
                        .description("Duration of pipeline stage executions")
                        .tag("stage", stage.name())
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRunFinished(RunStatus status) {
        counter("canon.run.finished", "Runs reaching a settled status", "status", status.name())
                .increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name).description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            return builder.register(registry);
        });
    }
}
