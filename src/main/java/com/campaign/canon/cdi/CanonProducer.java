package com.campaign.canon.cdi;

import com.campaign.canon.api.CampaignCanon;
import com.campaign.canon.api.CanonOptions;
import com.campaign.canon.cache.CacheConfig;
import com.campaign.canon.evidence.EvidenceOptions;
import com.campaign.canon.extract.Extractor;
import com.campaign.canon.lock.LockConfig;
import com.campaign.canon.metrics.MicrometerCanonMetrics;
import com.campaign.canon.narrative.DocumentRenderer;
import com.campaign.canon.narrative.SummaryPlanner;
import com.campaign.canon.narrative.SummaryWriter;
import com.campaign.canon.run.RetryPolicy;
import com.campaign.canon.transcript.FileSystemTranscriptSource;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * CDI producer that wires the campaign canon library from MicroProfile Config properties.
 *
 * <p>The application supplies the {@link Extractor} bean. Narrative stages are enabled
 * when {@link SummaryPlanner}, {@link SummaryWriter} and {@link DocumentRenderer} beans
 * are all resolvable; a {@link MeterRegistry} bean, when present, receives the metrics.</p>
 *
 * <pre>
 * campaign-canon:
 *   transcripts:
 *     root: /data
 *   run:
 *     prompt-version: v3
 *     model: extractor-large
 * </pre>
 */
@ApplicationScoped
public class CanonProducer {

    private static final Logger log = LoggerFactory.getLogger(CanonProducer.class);

    // ── Transcripts ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "campaign-canon.transcripts.root", defaultValue = ".")
    String transcriptsRoot;

    // ── Runs ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "campaign-canon.run.prompt-version", defaultValue = "v1")
    String promptVersion;

    @Inject
    @ConfigProperty(name = "campaign-canon.run.model", defaultValue = "default")
    String model;

    @Inject
    @ConfigProperty(name = "campaign-canon.run.max-attempts", defaultValue = "3")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = "campaign-canon.run.initial-backoff-millis", defaultValue = "500")
    long initialBackoffMillis;

    @Inject
    @ConfigProperty(name = "campaign-canon.run.backoff-multiplier", defaultValue = "2.0")
    double backoffMultiplier;

    @Inject
    @ConfigProperty(name = "campaign-canon.run.max-backoff-millis", defaultValue = "10000")
    long maxBackoffMillis;

    @Inject
    @ConfigProperty(name = "campaign-canon.run.error-truncate-length", defaultValue = "2000")
    int errorTruncateLength;

    // ── Lock ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "campaign-canon.lock.timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "campaign-canon.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "campaign-canon.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "campaign-canon.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Evidence ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "campaign-canon.evidence.fill-missing-offsets", defaultValue = "false")
    boolean fillMissingOffsets;

    @Inject
    @ConfigProperty(name = "campaign-canon.evidence.confidence-demotion", defaultValue = "0.5")
    double confidenceDemotion;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CanonOptions canonOptions() {
        CanonOptions options = CanonOptions.builder()
                .promptVersion(promptVersion)
                .model(model)
                .retryPolicy(new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMillis),
                        backoffMultiplier, Duration.ofMillis(maxBackoffMillis)))
                .lockConfig(new LockConfig(lockTimeoutMillis))
                .cacheConfig(new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled))
                .evidenceOptions(new EvidenceOptions(fillMissingOffsets, confidenceDemotion))
                .errorTruncateLength(errorTruncateLength)
                .build();
        log.info("Canon options: promptVersion={} model={} maxAttempts={} cacheEnabled={}",
                promptVersion, model, maxAttempts, cacheEnabled);
        return options;
    }

    @Produces
    @ApplicationScoped
    public CampaignCanon campaignCanon(CanonOptions options, Extractor extractor,
                                       Instance<SummaryPlanner> planner,
                                       Instance<SummaryWriter> writer,
                                       Instance<DocumentRenderer> renderer,
                                       Instance<MeterRegistry> meterRegistry) {
        log.info("Producing CampaignCanon: transcriptsRoot={}", transcriptsRoot);

        CampaignCanon.Builder builder = CampaignCanon.builder()
                .options(options)
                .transcriptSource(new FileSystemTranscriptSource(Path.of(transcriptsRoot)))
                .extractor(extractor);

        if (planner.isResolvable() && writer.isResolvable() && renderer.isResolvable()) {
            builder.narrative(planner.get(), writer.get(), renderer.get());
            log.info("Narrative stages enabled");
        } else {
            log.info("Narrative stages disabled");
        }

        if (meterRegistry.isResolvable()) {
            builder.metrics(new MicrometerCanonMetrics(meterRegistry.get()));
        }
        return builder.build();
    }
}
