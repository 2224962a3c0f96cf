package com.campaign.canon.metrics;

import com.campaign.canon.correction.CorrectionState;
import com.campaign.canon.run.PipelineStage;
import com.campaign.canon.run.RunStatus;
import com.campaign.canon.run.StepStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CanonMetrics Tests")
class MicrometerCanonMetricsTest {

    @Nested
    @DisplayName("NoOpCanonMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpCanonMetrics noOp = new NoOpCanonMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordCorrectionDecided(CorrectionState.APPROVED);
                noOp.incrementEntitiesCreated(2);
                noOp.incrementMentionsDroppedHidden(1);
                noOp.incrementMentionsDroppedSuppressed(1);
                noOp.incrementAliasCollisions(1);
                noOp.incrementEvidenceRepaired(3);
                noOp.incrementEvidenceDropped(1);
                noOp.recordStage(PipelineStage.INGEST, StepStatus.SUCCEEDED, Duration.ofMillis(5));
                noOp.recordRunFinished(RunStatus.COMPLETED);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerCanonMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerCanonMetrics metrics = new MicrometerCanonMetrics(registry);

        @Test
        @DisplayName("Should count decided corrections per state")
        void recordCorrectionDecided() {
            metrics.recordCorrectionDecided(CorrectionState.APPROVED);
            metrics.recordCorrectionDecided(CorrectionState.APPROVED);
            metrics.recordCorrectionDecided(CorrectionState.REJECTED);

            Counter approved = registry.find("canon.correction.decided").tag("state", "APPROVED").counter();
            Counter rejected = registry.find("canon.correction.decided").tag("state", "REJECTED").counter();

            assertNotNull(approved);
            assertEquals(2.0, approved.count());
            assertEquals(1.0, rejected.count());
        }

        @Test
        @DisplayName("Should tag dropped mentions by reason")
        void mentionDrops() {
            metrics.incrementMentionsDroppedHidden(2);
            metrics.incrementMentionsDroppedSuppressed(1);

            assertEquals(2.0, registry.find("canon.mention.dropped").tag("reason", "hidden").counter().count());
            assertEquals(1.0, registry.find("canon.mention.dropped").tag("reason", "suppressed").counter().count());
        }

        @Test
        @DisplayName("Should count created entities and alias collisions")
        void untaggedCounters() {
            metrics.incrementEntitiesCreated(3);
            metrics.incrementAliasCollisions(1);

            assertEquals(3.0, registry.find("canon.entity.created").counter().count());
            assertEquals(1.0, registry.find("canon.alias.collision").counter().count());
        }

        @Test
        @DisplayName("Should tag evidence spans by outcome")
        void evidenceOutcomes() {
            metrics.incrementEvidenceRepaired(4);
            metrics.incrementEvidenceDropped(1);

            assertEquals(4.0, registry.find("canon.evidence.span").tag("outcome", "repaired").counter().count());
            assertEquals(1.0, registry.find("canon.evidence.span").tag("outcome", "dropped").counter().count());
        }

        @Test
        @DisplayName("Should time stages per stage and outcome")
        void recordStage() {
            metrics.recordStage(PipelineStage.EXTRACT, StepStatus.SUCCEEDED, Duration.ofMillis(120));
            metrics.recordStage(PipelineStage.EXTRACT, StepStatus.SUCCEEDED, Duration.ofMillis(80));
            metrics.recordStage(PipelineStage.EXTRACT, StepStatus.FAILED, Duration.ofMillis(10));

            Timer succeeded = registry.find("canon.stage.duration")
                    .tag("stage", "EXTRACT")
                    .tag("outcome", "SUCCEEDED")
                    .timer();

            assertNotNull(succeeded);
            assertEquals(2, succeeded.count());
            assertEquals(1, registry.find("canon.stage.duration").tag("outcome", "FAILED").timer().count());
        }

        @Test
        @DisplayName("Should count finished runs per status")
        void recordRunFinished() {
            metrics.recordRunFinished(RunStatus.PARTIAL);

            assertEquals(1.0, registry.find("canon.run.finished").tag("status", "PARTIAL").counter().count());
        }
    }
}
