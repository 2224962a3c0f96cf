package com.campaign.canon.pipeline;

import com.campaign.canon.canonical.CanonicalMap;
import com.campaign.canon.canonical.CanonicalMapService;
import com.campaign.canon.core.model.Event;
import com.campaign.canon.core.model.EvidenceSpan;
import com.campaign.canon.core.model.Mention;
import com.campaign.canon.core.model.Utterance;
import com.campaign.canon.evidence.CleanedEvidence;
import com.campaign.canon.evidence.EvidenceValidator;
import com.campaign.canon.evidence.Quote;
import com.campaign.canon.evidence.QuoteCandidate;
import com.campaign.canon.evidence.QuoteValidation;
import com.campaign.canon.evidence.SpanValidation;
import com.campaign.canon.extract.EventCandidate;
import com.campaign.canon.extract.ExtractionRequest;
import com.campaign.canon.extract.Extractor;
import com.campaign.canon.extract.MentionCandidate;
import com.campaign.canon.extract.SceneCandidate;
import com.campaign.canon.extract.SessionFacts;
import com.campaign.canon.extract.ThreadCandidate;
import com.campaign.canon.extract.ThreadUpdateCandidate;
import com.campaign.canon.metrics.CanonMetrics;
import com.campaign.canon.metrics.NoOpCanonMetrics;
import com.campaign.canon.narrative.DocumentRenderer;
import com.campaign.canon.narrative.NarrativeInput;
import com.campaign.canon.narrative.RenderedDocument;
import com.campaign.canon.narrative.SummaryPlan;
import com.campaign.canon.narrative.SummaryPlanner;
import com.campaign.canon.narrative.SummaryWriter;
import com.campaign.canon.resolution.ResolutionEngine;
import com.campaign.canon.resolution.ResolvedMentions;
import com.campaign.canon.resolution.ResolvedThreads;
import com.campaign.canon.run.PipelineStage;
import com.campaign.canon.run.StageContext;
import com.campaign.canon.run.StageFailureException;
import com.campaign.canon.run.StageHandler;
import com.campaign.canon.transcript.RawTranscript;
import com.campaign.canon.transcript.TranscriptParser;
import com.campaign.canon.transcript.TranscriptSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Step functions of the session pipeline, one {@link StageHandler} per stage.
 *
 * <p>Every handler reads the output of earlier stages from the
 * {@link SessionFactRepository} and stores its own; extraction and resolution are
 * skipped when their output already exists for the run, so a retried or resumed
 * stage never extracts or resolves twice. Narrative stages are only offered when
 * their collaborators are configured.</p>
 */
public class SessionPipeline {
    private static final Logger log = LoggerFactory.getLogger(SessionPipeline.class);

    private final TranscriptSource transcriptSource;
    private final TranscriptParser transcriptParser;
    private final Extractor extractor;
    private final EvidenceValidator evidenceValidator;
    private final ResolutionEngine resolutionEngine;
    private final CanonicalMapService mapService;
    private final SessionFactRepository facts;
    private final SummaryPlanner planner;
    private final SummaryWriter writer;
    private final DocumentRenderer renderer;
    private final CanonMetrics metrics;
    private final Map<String, String> characterMap;

    private SessionPipeline(Builder builder) {
        this.transcriptSource = Objects.requireNonNull(builder.transcriptSource, "transcriptSource is required");
        this.extractor = Objects.requireNonNull(builder.extractor, "extractor is required");
        this.resolutionEngine = Objects.requireNonNull(builder.resolutionEngine, "resolutionEngine is required");
        this.mapService = Objects.requireNonNull(builder.mapService, "mapService is required");
        this.transcriptParser = builder.transcriptParser != null ? builder.transcriptParser : new TranscriptParser();
        this.evidenceValidator = builder.evidenceValidator != null ? builder.evidenceValidator : new EvidenceValidator();
        this.facts = builder.facts != null ? builder.facts : new InMemorySessionFactRepository();
        this.planner = builder.planner;
        this.writer = builder.writer;
        this.renderer = builder.renderer;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpCanonMetrics();
        this.characterMap = Map.copyOf(builder.characterMap);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Stages this pipeline can run, in order: the structural stages always, the
     * narrative stages when planner, writer and renderer are all configured.
     */
    public List<PipelineStage> stages() {
        List<PipelineStage> stages = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.ordered()) {
            if (stage.isStructural() || narrativeConfigured()) {
                stages.add(stage);
            }
        }
        return stages;
    }

    public Map<PipelineStage, StageHandler> handlers() {
        Map<PipelineStage, StageHandler> handlers = new EnumMap<>(PipelineStage.class);
        handlers.put(PipelineStage.INGEST, this::ingest);
        handlers.put(PipelineStage.EXTRACT, this::extract);
        handlers.put(PipelineStage.PERSIST, this::persist);
        handlers.put(PipelineStage.RESOLVE, this::resolve);
        if (narrativeConfigured()) {
            handlers.put(PipelineStage.PLAN, this::plan);
            handlers.put(PipelineStage.WRITE, this::write);
            handlers.put(PipelineStage.RENDER, this::render);
        }
        return handlers;
    }

    public SessionFactRepository getFacts() {
        return facts;
    }

    private boolean narrativeConfigured() {
        return planner != null && writer != null && renderer != null;
    }

    void ingest(StageContext ctx) {
        RawTranscript raw = transcriptSource.load(ctx.campaignId(), ctx.sessionId());
        if (!raw.sha256().equals(ctx.key().transcriptHash())) {
            throw new StageFailureException(PipelineStage.INGEST,
                    "Transcript of session " + ctx.sessionId() + " changed after the run was started", false);
        }
        List<Utterance> utterances = transcriptParser.parse(raw, ctx.sessionId());
        if (utterances.isEmpty()) {
            throw new StageFailureException(PipelineStage.INGEST,
                    "No utterances found for session " + ctx.sessionId(), false);
        }
        facts.saveUtterances(ctx.runId(), utterances);
        log.info("ingest.completed utterances={}", utterances.size());
    }

    void extract(StageContext ctx) {
        if (facts.facts(ctx.runId()).isPresent()) {
            log.info("extract.skipped reason=already_extracted");
            return;
        }
        List<Utterance> utterances = requireUtterances(ctx);
        ExtractionRequest request = new ExtractionRequest(ctx.campaignId(), ctx.sessionId(), ctx.runId(),
                utterances, characterMap, mapService.snapshot(ctx.campaignId(), ctx.sessionId()),
                ctx.key().promptVersion(), ctx.key().model());
        SessionFacts extracted = extractor.extract(request);
        if (extracted == null) {
            throw new StageFailureException(PipelineStage.EXTRACT, "Extractor returned no facts", true);
        }
        facts.saveFacts(ctx.runId(), extracted);
        log.info("extract.completed mentions={} events={} threads={} quotes={}",
                extracted.mentions().size(), extracted.events().size(),
                extracted.threads().size(), extracted.quotes().size());
    }

    void persist(StageContext ctx) {
        SessionFacts extracted = facts.facts(ctx.runId())
                .orElseThrow(() -> new StageFailureException(PipelineStage.PERSIST,
                        "Missing session facts for run " + ctx.runId(), false));
        List<Utterance> utterances = requireUtterances(ctx);
        Map<String, Utterance> byId = new HashMap<>();
        utterances.forEach(u -> byId.put(u.id(), u));
        Function<String, String> textOf = id -> {
            Utterance u = byId.get(id);
            return u != null ? u.text() : null;
        };

        EvidenceTally tally = new EvidenceTally();

        List<Mention> mentions = new ArrayList<>();
        for (MentionCandidate candidate : extracted.mentions()) {
            CleanedEvidence cleaned = tally.clean(candidate.evidence(), textOf);
            mentions.add(new Mention(UUID.randomUUID().toString(), ctx.campaignId(), ctx.sessionId(), ctx.runId(),
                    candidate.text(), candidate.entityType(), candidate.description(), cleaned.spans(),
                    evidenceValidator.adjustConfidence(candidate.confidence(), cleaned), cleaned.complete()));
        }

        List<Event> events = new ArrayList<>();
        for (EventCandidate candidate : extracted.events()) {
            CleanedEvidence cleaned = tally.clean(candidate.evidence(), textOf);
            events.add(new Event(UUID.randomUUID().toString(), ctx.sessionId(), ctx.runId(), candidate.eventType(),
                    candidate.summary(), candidate.startMs(), candidate.endMs(), candidate.entities(), List.of(),
                    cleaned.spans(), evidenceValidator.adjustConfidence(candidate.confidence(), cleaned),
                    cleaned.complete()));
        }

        List<SceneCandidate> scenes = new ArrayList<>();
        for (SceneCandidate scene : extracted.scenes()) {
            scenes.add(scene.withEvidence(tally.clean(scene.evidence(), textOf).spans()));
        }

        List<ThreadCandidate> threads = new ArrayList<>();
        for (ThreadCandidate thread : extracted.threads()) {
            CleanedEvidence cleaned = tally.clean(thread.evidence(), textOf);
            List<ThreadUpdateCandidate> updates = new ArrayList<>();
            for (ThreadUpdateCandidate update : thread.updates()) {
                updates.add(new ThreadUpdateCandidate(update.updateType(), update.note(),
                        tally.clean(update.evidence(), textOf).spans(), update.relatedEventIndexes()));
            }
            threads.add(new ThreadCandidate(thread.title(), thread.kind(), thread.status(), thread.summary(),
                    updates, cleaned.spans(), evidenceValidator.adjustConfidence(thread.confidence(), cleaned)));
        }

        List<Quote> quotes = new ArrayList<>();
        int quotesRepaired = 0;
        int quotesDropped = 0;
        for (QuoteCandidate candidate : extracted.quotes()) {
            QuoteValidation result = evidenceValidator.validateQuote(candidate,
                    candidate.utteranceId() != null ? byId.get(candidate.utteranceId()) : null, ctx.runId());
            if (!result.isKept()) {
                quotesDropped++;
                log.debug("Quote dropped: {}", result.reason());
                continue;
            }
            if (result.outcome() == SpanValidation.Outcome.REPAIRED) {
                quotesRepaired++;
            }
            quotes.add(result.quote());
        }

        EvidenceCounters counters = new EvidenceCounters(quotes.size(), quotesRepaired, quotesDropped,
                tally.repaired, tally.dropped, tally.incomplete);
        facts.savePersisted(ctx.runId(), new PersistedFacts(mentions, events, quotes, scenes, threads, counters));
        metrics.incrementEvidenceRepaired(tally.repaired + quotesRepaired);
        metrics.incrementEvidenceDropped(tally.dropped + quotesDropped);
        log.info("persist.completed mentions={} events={} quotes={} quotesDropped={} spansRepaired={} spansDropped={}",
                mentions.size(), events.size(), quotes.size(), quotesDropped, tally.repaired, tally.dropped);
    }

    void resolve(StageContext ctx) {
        if (facts.resolved(ctx.runId()).isPresent()) {
            log.info("resolve.skipped reason=already_resolved");
            return;
        }
        PersistedFacts persisted = facts.persisted(ctx.runId())
                .orElseThrow(() -> new StageFailureException(PipelineStage.RESOLVE,
                        "Missing persisted facts for run " + ctx.runId(), false));

        // Maps are fetched under the campaign lock so concurrent sessions see each other's creations.
        ResolvedMentions mentions = resolutionEngine.resolve(ctx.campaignId(), ctx.runId(),
                persisted.mentions(), () -> mapService.get(ctx.campaignId(), ctx.sessionId()).entities());

        CanonicalMap refreshed = mapService.get(ctx.campaignId(), ctx.sessionId());
        List<Event> events = resolutionEngine.resolveEventEntities(persisted.events(), refreshed.entities());
        ResolvedThreads threads = resolutionEngine.resolveThreads(ctx.campaignId(), ctx.sessionId(), ctx.runId(),
                persisted.threads(), events, () -> mapService.get(ctx.campaignId(), ctx.sessionId()).threads());

        facts.saveResolved(ctx.runId(), new ResolvedSession(mentions, events, threads));
        log.info("resolve.completed mentions={} entitiesCreated={} threadUpdates={}",
                mentions.resolved().size(), mentions.createdEntities().size(), threads.updates().size());
    }

    void plan(StageContext ctx) {
        SummaryPlan plan = planner.plan(narrativeInput(ctx));
        facts.savePlan(ctx.runId(), plan != null ? plan : new SummaryPlan(List.of()));
        log.info("plan.completed beats={}", plan != null ? plan.beats().size() : 0);
    }

    void write(StageContext ctx) {
        SummaryPlan plan = facts.plan(ctx.runId())
                .orElseThrow(() -> new StageFailureException(PipelineStage.WRITE,
                        "Missing summary plan for run " + ctx.runId(), false));
        NarrativeInput input = narrativeInput(ctx);
        String text = writer.write(input, plan);
        evidenceValidator.verifySummaryQuotes(text, input.quotes());
        facts.saveSummary(ctx.runId(), text);
        log.info("write.completed chars={}", text != null ? text.length() : 0);
    }

    void render(StageContext ctx) {
        String summary = facts.summary(ctx.runId())
                .orElseThrow(() -> new StageFailureException(PipelineStage.RENDER,
                        "Missing summary for run " + ctx.runId(), false));
        RenderedDocument document = renderer.render(narrativeInput(ctx), summary);
        facts.saveDocument(ctx.runId(), document);
        log.info("render.completed contentType={} bytes={}", document.getContentType(), document.size());
    }

    /**
     * Quality report of a run from whatever stages have stored so far.
     */
    public Optional<RunQualityReport> qualityReport(String runId) {
        Optional<PersistedFacts> persisted = facts.persisted(runId);
        Optional<ResolvedSession> resolved = facts.resolved(runId);
        if (persisted.isEmpty() && resolved.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RunQualityReport.of(runId, facts.utterances(runId).size(),
                persisted.orElse(null), resolved.orElse(null)));
    }

    private NarrativeInput narrativeInput(StageContext ctx) {
        PersistedFacts persisted = facts.persisted(ctx.runId())
                .orElseThrow(() -> new StageFailureException(ctx.stage(),
                        "Missing persisted facts for run " + ctx.runId(), false));
        List<Event> events = facts.resolved(ctx.runId()).map(ResolvedSession::events).orElse(persisted.events());
        return new NarrativeInput(ctx.campaignId(), ctx.sessionId(), ctx.runId(),
                facts.utterances(ctx.runId()), events, persisted.quotes());
    }

    private List<Utterance> requireUtterances(StageContext ctx) {
        List<Utterance> utterances = facts.utterances(ctx.runId());
        if (utterances.isEmpty()) {
            throw new StageFailureException(ctx.stage(), "No utterances ingested for run " + ctx.runId(), false);
        }
        return utterances;
    }

    private final class EvidenceTally {
        private int repaired;
        private int dropped;
        private int incomplete;

        CleanedEvidence clean(List<EvidenceSpan> spans, Function<String, String> textOf) {
            CleanedEvidence cleaned = evidenceValidator.cleanEvidence(spans, textOf);
            repaired += cleaned.repaired();
            dropped += cleaned.dropped();
            if (!cleaned.complete()) {
                incomplete++;
            }
            return cleaned;
        }
    }

    public static class Builder {
        private TranscriptSource transcriptSource;
        private TranscriptParser transcriptParser;
        private Extractor extractor;
        private EvidenceValidator evidenceValidator;
        private ResolutionEngine resolutionEngine;
        private CanonicalMapService mapService;
        private SessionFactRepository facts;
        private SummaryPlanner planner;
        private SummaryWriter writer;
        private DocumentRenderer renderer;
        private CanonMetrics metrics;
        private Map<String, String> characterMap = Map.of();

        public Builder transcriptSource(TranscriptSource transcriptSource) {
            this.transcriptSource = transcriptSource;
            return this;
        }

        public Builder transcriptParser(TranscriptParser transcriptParser) {
            this.transcriptParser = transcriptParser;
            return this;
        }

        public Builder extractor(Extractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder evidenceValidator(EvidenceValidator evidenceValidator) {
            this.evidenceValidator = evidenceValidator;
            return this;
        }

        public Builder resolutionEngine(ResolutionEngine resolutionEngine) {
            this.resolutionEngine = resolutionEngine;
            return this;
        }

        public Builder mapService(CanonicalMapService mapService) {
            this.mapService = mapService;
            return this;
        }

        public Builder facts(SessionFactRepository facts) {
            this.facts = facts;
            return this;
        }

        public Builder planner(SummaryPlanner planner) {
            this.planner = planner;
            return this;
        }

        public Builder writer(SummaryWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder renderer(DocumentRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder metrics(CanonMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Speaker to character name mapping used when formatting transcripts.
         */
        public Builder characterMap(Map<String, String> characterMap) {
            this.characterMap = characterMap != null ? characterMap : Map.of();
            return this;
        }

        public SessionPipeline build() {
            return new SessionPipeline(this);
        }
    }
}
