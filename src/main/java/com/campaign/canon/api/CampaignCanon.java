package com.campaign.canon.api;

import com.campaign.canon.audit.AuditRepository;
import com.campaign.canon.audit.AuditService;
import com.campaign.canon.cache.CaffeineCanonicalMapCache;
import com.campaign.canon.cache.CanonicalMapCache;
import com.campaign.canon.cache.NoOpCanonicalMapCache;
import com.campaign.canon.canonical.CanonicalMap;
import com.campaign.canon.canonical.CanonicalMapBuilder;
import com.campaign.canon.canonical.CanonicalMapService;
import com.campaign.canon.canonical.CanonicalSnapshot;
import com.campaign.canon.canonical.EntityCanonicalMap;
import com.campaign.canon.canonical.ThreadCanonicalMap;
import com.campaign.canon.core.model.CampaignEntity;
import com.campaign.canon.core.model.StoryThread;
import com.campaign.canon.correction.Actor;
import com.campaign.canon.correction.Correction;
import com.campaign.canon.correction.CorrectionAction;
import com.campaign.canon.correction.CorrectionLedger;
import com.campaign.canon.correction.CorrectionRepository;
import com.campaign.canon.correction.CorrectionRequest;
import com.campaign.canon.correction.InMemoryCorrectionRepository;
import com.campaign.canon.correction.TargetType;
import com.campaign.canon.evidence.EvidenceValidator;
import com.campaign.canon.evidence.Quote;
import com.campaign.canon.extract.Extractor;
import com.campaign.canon.lock.LocalSerializationLock;
import com.campaign.canon.lock.SerializationLock;
import com.campaign.canon.logging.LogContext;
import com.campaign.canon.metrics.CanonMetrics;
import com.campaign.canon.metrics.NoOpCanonMetrics;
import com.campaign.canon.narrative.DocumentRenderer;
import com.campaign.canon.narrative.SummaryPlanner;
import com.campaign.canon.narrative.SummaryWriter;
import com.campaign.canon.pipeline.InMemorySessionFactRepository;
import com.campaign.canon.pipeline.PersistedFacts;
import com.campaign.canon.pipeline.RunQualityReport;
import com.campaign.canon.pipeline.SessionFactRepository;
import com.campaign.canon.pipeline.SessionPipeline;
import com.campaign.canon.repository.EntityRepository;
import com.campaign.canon.repository.InMemoryEntityRepository;
import com.campaign.canon.repository.InMemoryThreadRepository;
import com.campaign.canon.repository.RecordTargetDirectory;
import com.campaign.canon.repository.ThreadRepository;
import com.campaign.canon.resolution.ResolutionEngine;
import com.campaign.canon.run.IdempotencyKey;
import com.campaign.canon.run.InMemoryRunRepository;
import com.campaign.canon.run.Run;
import com.campaign.canon.run.RunController;
import com.campaign.canon.run.RunRepository;
import com.campaign.canon.run.RunRequest;
import com.campaign.canon.run.RunStart;
import com.campaign.canon.run.RunStatusView;
import com.campaign.canon.run.Sleeper;
import com.campaign.canon.transcript.RawTranscript;
import com.campaign.canon.transcript.TranscriptSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point of the campaign canonical-state library.
 *
 * <p>Wires the correction ledger, the canonical map, entity and thread resolution,
 * evidence validation and the run controller behind one facade. Every read path
 * goes through the canonical map, so hidden and merged records never leak into
 * a view.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CampaignCanon canon = CampaignCanon.builder()
 *     .transcriptSource(new FileSystemTranscriptSource(root))
 *     .extractor(extractor)
 *     .build();
 *
 * String runId = canon.startRun("curse-of-strahd", "session-07");
 * RunStatusView status = canon.getRunStatus(runId);
 *
 * Correction c = canon.submitCorrection(TargetType.ENTITY, entityId,
 *     CorrectionAction.ENTITY_RENAME, Map.of("name", "Baba Yaga"), Actor.player("p1"));
 * canon.decideCorrection(c.getId(), Decision.APPROVE, Actor.dm("dm"));
 * </pre>
 */
public class CampaignCanon {
    private static final Logger log = LoggerFactory.getLogger(CampaignCanon.class);

    private final CanonOptions options;
    private final EntityRepository entityRepository;
    private final ThreadRepository threadRepository;
    private final TranscriptSource transcriptSource;
    private final AuditService auditService;
    private final CanonicalMapService mapService;
    private final CorrectionLedger ledger;
    private final RunController runController;
    private final SessionPipeline pipeline;
    private final SessionFactRepository facts;

    private CampaignCanon(Builder builder) {
        if (builder.transcriptSource == null) {
            throw new IllegalStateException("A transcript source must be configured");
        }
        if (builder.extractor == null) {
            throw new IllegalStateException("An extractor must be configured");
        }
        this.options = builder.options;
        this.transcriptSource = builder.transcriptSource;
        this.entityRepository = builder.entityRepository != null
                ? builder.entityRepository : new InMemoryEntityRepository();
        this.threadRepository = builder.threadRepository != null
                ? builder.threadRepository : new InMemoryThreadRepository();
        CorrectionRepository correctionRepository = builder.correctionRepository != null
                ? builder.correctionRepository : new InMemoryCorrectionRepository();
        RunRepository runRepository = builder.runRepository != null
                ? builder.runRepository : new InMemoryRunRepository();
        this.facts = builder.facts != null ? builder.facts : new InMemorySessionFactRepository();
        CanonMetrics metrics = builder.metrics != null ? builder.metrics : new NoOpCanonMetrics();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        SerializationLock lock = builder.lock != null
                ? builder.lock : new LocalSerializationLock(options.getLockConfig());
        CanonicalMapCache cache;
        if (builder.cache != null) {
            cache = builder.cache;
        } else if (options.getCacheConfig().enabled()) {
            cache = new CaffeineCanonicalMapCache(options.getCacheConfig());
        } else {
            cache = new NoOpCanonicalMapCache();
        }

        CanonicalMapBuilder mapBuilder = new CanonicalMapBuilder(
                entityRepository, threadRepository, correctionRepository);
        this.mapService = new CanonicalMapService(mapBuilder, cache);

        this.ledger = new CorrectionLedger(correctionRepository,
                new RecordTargetDirectory(entityRepository, threadRepository),
                mapBuilder, lock, auditService, metrics, clock);
        ledger.addListener(mapService);

        ResolutionEngine resolutionEngine = new ResolutionEngine(
                entityRepository, threadRepository, lock, auditService, metrics, clock);
        resolutionEngine.addListener(mapService);

        this.runController = new RunController(runRepository, lock, auditService, metrics,
                options.getRetryPolicy(), sleeper, clock, options.getErrorTruncateLength());

        this.pipeline = SessionPipeline.builder()
                .transcriptSource(transcriptSource)
                .extractor(builder.extractor)
                .evidenceValidator(new EvidenceValidator(options.getEvidenceOptions()))
                .resolutionEngine(resolutionEngine)
                .mapService(mapService)
                .facts(facts)
                .planner(builder.planner)
                .writer(builder.writer)
                .renderer(builder.renderer)
                .metrics(metrics)
                .characterMap(builder.characterMap)
                .build();

        log.info("CampaignCanon initialized: promptVersion={} model={} cacheEnabled={} stages={}",
                options.getPromptVersion(), options.getModel(), options.getCacheConfig().enabled(),
                pipeline.stages().size());
    }

    // ========== Corrections ==========

    /**
     * Submits a campaign-wide correction against an existing entity or thread. The
     * campaign is taken from the target record.
     *
     * @throws IllegalArgumentException if the target does not exist
     */
    public Correction submitCorrection(TargetType targetType, String targetId, CorrectionAction action,
                                       Map<String, String> payload, Actor actor) {
        String campaignId = campaignOf(targetType, targetId);
        return ledger.submit(new CorrectionRequest(campaignId, null, targetType, targetId, action, payload), actor);
    }

    /**
     * Submits a correction, optionally scoped to one session.
     */
    public Correction submitCorrection(CorrectionRequest request, Actor actor) {
        return ledger.submit(request, actor);
    }

    public Correction decideCorrection(String correctionId, Decision decision, Actor reviewer) {
        return switch (decision) {
            case APPROVE -> ledger.approve(correctionId, reviewer);
            case REJECT -> ledger.reject(correctionId, reviewer);
        };
    }

    public Page<Correction> pendingCorrections(String campaignId, PageRequest page) {
        return ledger.pending(campaignId, page);
    }

    public List<Correction> correctionHistory(String campaignId) {
        return ledger.history(campaignId);
    }

    // ========== Runs ==========

    /**
     * Starts processing a session and executes the run to a terminal or partial state.
     * A request with the same transcript, prompt version and model as an existing run
     * returns that run's id without processing again.
     *
     * @return the id of the run
     */
    public String startRun(String campaignSlug, String sessionSlug) {
        return startRun(campaignSlug, sessionSlug, false);
    }

    /**
     * @param reprocess create a new run even when a finished run with the same key exists
     */
    public String startRun(String campaignSlug, String sessionSlug, boolean reprocess) {
        try (LogContext ctx = LogContext.forSession(campaignSlug, sessionSlug)) {
            RawTranscript transcript = transcriptSource.load(campaignSlug, sessionSlug);
            IdempotencyKey key = new IdempotencyKey(campaignSlug, sessionSlug, transcript.sha256(),
                    options.getPromptVersion(), options.getModel());
            RunStart start = runController.startRun(new RunRequest(key, reprocess));
            if (!start.created()) {
                log.info("run.reused runId={} sessionId={} status={}",
                        start.run().getId(), sessionSlug, start.run().getStatus());
                return start.run().getId();
            }
            Run run = runController.execute(start.run().getId(), pipeline.stages(), pipeline.handlers());
            return run.getId();
        }
    }

    public RunStatusView getRunStatus(String runId) {
        return runController.getRunStatus(runId);
    }

    /**
     * Re-runs the stages of a partial run that have not succeeded.
     *
     * @throws IllegalStateException if the run is not partial
     */
    public RunStatusView resumeRun(String runId) {
        Run run = runController.resume(runId, pipeline.handlers());
        return runController.getRunStatus(run.getId());
    }

    public boolean cancelRun(String runId) {
        return runController.cancel(runId);
    }

    public List<Run> runsForSession(String campaignId, String sessionId) {
        return runController.runsForSession(campaignId, sessionId);
    }

    // ========== Canonical state ==========

    public CanonicalMap canonicalMap(String campaignId) {
        return mapService.get(campaignId);
    }

    public CanonicalMap canonicalMap(String campaignId, String sessionId) {
        return mapService.get(campaignId, sessionId);
    }

    public CanonicalSnapshot snapshot(String campaignId) {
        return mapService.snapshot(campaignId);
    }

    /**
     * Visible entities of a campaign, ordered by type and canonical name. Hidden
     * entities and entities merged into another are left out.
     */
    public List<EntityView> listEntities(String campaignId) {
        EntityCanonicalMap map = mapService.get(campaignId).entities();
        List<EntityView> views = new ArrayList<>();
        for (String id : map.visibleIds()) {
            entityRepository.findById(id).ifPresent(entity -> views.add(toView(entity, map)));
        }
        views.sort(Comparator.comparing(EntityView::type)
                .thenComparing(EntityView::canonicalName)
                .thenComparing(EntityView::id));
        return views;
    }

    /**
     * Looks up an entity. A merged entity resolves to its merge target; a hidden
     * entity is not returned.
     */
    public Optional<EntityView> getEntity(String entityId) {
        Optional<CampaignEntity> record = entityRepository.findById(entityId);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        EntityCanonicalMap map = mapService.get(record.get().getCampaignId()).entities();
        if (map.isHidden(entityId)) {
            return Optional.empty();
        }
        return entityRepository.findById(map.resolveId(entityId)).map(root -> toView(root, map));
    }

    /**
     * Visible threads of a campaign in creation order.
     */
    public List<ThreadView> listThreads(String campaignId) {
        ThreadCanonicalMap map = mapService.get(campaignId).threads();
        List<ThreadView> views = new ArrayList<>();
        for (StoryThread thread : threadRepository.findByCampaign(campaignId)) {
            if (map.visibleIds().contains(thread.getId())) {
                views.add(new ThreadView(thread.getId(), campaignId,
                        map.title(thread.getId()).orElse(thread.getTitle()),
                        thread.getKind(),
                        map.status(thread.getId()).orElse(thread.getStatus()),
                        map.summary(thread.getId()).orElse(null),
                        map.isCorrected(thread.getId())));
            }
        }
        return views;
    }

    /**
     * Validated quotes persisted by a run.
     *
     * @throws IllegalArgumentException if the run does not exist
     */
    public List<Quote> quotes(String runId) {
        runController.get(runId);
        return facts.persisted(runId).map(PersistedFacts::quotes).orElse(List.of());
    }

    /**
     * @throws IllegalArgumentException if the run does not exist
     */
    public Optional<RunQualityReport> qualityReport(String runId) {
        runController.get(runId);
        return pipeline.qualityReport(runId);
    }

    // ========== Accessors ==========

    public CorrectionLedger getLedger() {
        return ledger;
    }

    public RunController getRunController() {
        return runController;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public SessionFactRepository getFacts() {
        return facts;
    }

    public CanonOptions getOptions() {
        return options;
    }

    private String campaignOf(TargetType targetType, String targetId) {
        if (targetType == TargetType.ENTITY) {
            return entityRepository.findById(targetId)
                    .map(CampaignEntity::getCampaignId)
                    .orElseThrow(() -> new IllegalArgumentException("Entity not found: " + targetId));
        }
        return threadRepository.findById(targetId)
                .map(StoryThread::getCampaignId)
                .orElseThrow(() -> new IllegalArgumentException("Thread not found: " + targetId));
    }

    private static EntityView toView(CampaignEntity entity, EntityCanonicalMap map) {
        String id = entity.getId();
        return new EntityView(id, entity.getCampaignId(), entity.getType(),
                map.canonicalName(id).orElse(entity.getCanonicalName()),
                new ArrayList<>(map.aliases(id)),
                entity.getDescription(),
                map.isCorrected(id));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CanonOptions options = CanonOptions.defaults();
        private TranscriptSource transcriptSource;
        private Extractor extractor;
        private SummaryPlanner planner;
        private SummaryWriter writer;
        private DocumentRenderer renderer;
        private EntityRepository entityRepository;
        private ThreadRepository threadRepository;
        private CorrectionRepository correctionRepository;
        private RunRepository runRepository;
        private SessionFactRepository facts;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private SerializationLock lock;
        private CanonicalMapCache cache;
        private CanonMetrics metrics;
        private Clock clock;
        private Sleeper sleeper;
        private Map<String, String> characterMap = Map.of();

        public Builder options(CanonOptions options) {
            this.options = options;
            return this;
        }

        public Builder transcriptSource(TranscriptSource transcriptSource) {
            this.transcriptSource = transcriptSource;
            return this;
        }

        public Builder extractor(Extractor extractor) {
            this.extractor = extractor;
            return this;
        }

        /**
         * Narrative stages run only when planner, writer and renderer are all set.
         */
        public Builder narrative(SummaryPlanner planner, SummaryWriter writer, DocumentRenderer renderer) {
            this.planner = planner;
            this.writer = writer;
            this.renderer = renderer;
            return this;
        }

        public Builder entityRepository(EntityRepository entityRepository) {
            this.entityRepository = entityRepository;
            return this;
        }

        public Builder threadRepository(ThreadRepository threadRepository) {
            this.threadRepository = threadRepository;
            return this;
        }

        public Builder correctionRepository(CorrectionRepository correctionRepository) {
            this.correctionRepository = correctionRepository;
            return this;
        }

        public Builder runRepository(RunRepository runRepository) {
            this.runRepository = runRepository;
            return this;
        }

        public Builder sessionFactRepository(SessionFactRepository facts) {
            this.facts = facts;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder serializationLock(SerializationLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder cache(CanonicalMapCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(CanonMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder characterMap(Map<String, String> characterMap) {
            this.characterMap = characterMap;
            return this;
        }

        public CampaignCanon build() {
            return new CampaignCanon(this);
        }
    }
}
