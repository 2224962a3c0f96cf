package com.campaign.canon.resolution;

import com.campaign.canon.audit.AuditAction;
import com.campaign.canon.audit.AuditService;
import com.campaign.canon.cache.LedgerListener;
import com.campaign.canon.canonical.EntityCanonicalMap;
import com.campaign.canon.canonical.NameResolution;
import com.campaign.canon.canonical.ThreadCanonicalMap;
import com.campaign.canon.canonical.ThreadResolution;
import com.campaign.canon.core.NameKeys;
import com.campaign.canon.core.model.CampaignEntity;
import com.campaign.canon.core.model.Event;
import com.campaign.canon.core.model.Mention;
import com.campaign.canon.core.model.StoryThread;
import com.campaign.canon.core.model.ThreadUpdate;
import com.campaign.canon.extract.ThreadCandidate;
import com.campaign.canon.extract.ThreadUpdateCandidate;
import com.campaign.canon.lock.LockKeys;
import com.campaign.canon.lock.SerializationLock;
import com.campaign.canon.logging.LogContext;
import com.campaign.canon.metrics.CanonMetrics;
import com.campaign.canon.metrics.NoOpCanonMetrics;
import com.campaign.canon.repository.EntityRepository;
import com.campaign.canon.repository.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Attaches raw mentions and thread candidates to canonical records.
 *
 * <p>Matching is deterministic string matching only: the name key first, then the
 * normalized form. Hidden records swallow their mentions (counted, never silent);
 * unknown names create new base records. Creation and alias learning run under the
 * campaign lock so two runs cannot create the same entity twice.</p>
 */
public class ResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private static final String SYSTEM_ACTOR = "resolution";

    private final EntityRepository entityRepository;
    private final ThreadRepository threadRepository;
    private final SerializationLock lock;
    private final AuditService auditService;
    private final CanonMetrics metrics;
    private final Clock clock;
    private final List<LedgerListener> listeners = new CopyOnWriteArrayList<>();

    public ResolutionEngine(EntityRepository entityRepository, ThreadRepository threadRepository,
                            SerializationLock lock, AuditService auditService) {
        this(entityRepository, threadRepository, lock, auditService, new NoOpCanonMetrics(), Clock.systemUTC());
    }

    public ResolutionEngine(EntityRepository entityRepository, ThreadRepository threadRepository,
                            SerializationLock lock, AuditService auditService,
                            CanonMetrics metrics, Clock clock) {
        this.entityRepository = entityRepository;
        this.threadRepository = threadRepository;
        this.lock = lock;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a listener notified when resolution changed base records.
     */
    public void addListener(LedgerListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public ResolvedMentions resolve(String campaignId, String runId, List<Mention> mentions,
                                    EntityCanonicalMap map) {
        return resolve(campaignId, runId, mentions, () -> map);
    }

    /**
     * Resolves mentions against the entity map.
     *
     * @param campaignId the campaign
     * @param runId      the run, for logging; may be null
     * @param mentions   raw mentions in extraction order
     * @param map        supplies the session's entity canonical map; called once the
     *                   campaign lock is held, so the map reflects every entity created
     *                   by runs that resolved earlier
     */
    public ResolvedMentions resolve(String campaignId, String runId, List<Mention> mentions,
                                    Supplier<EntityCanonicalMap> map) {
        return lock.withLock(LockKeys.campaign(campaignId), () -> {
            try (LogContext ctx = LogContext.forResolution(campaignId, runId)) {
                MentionPass pass = new MentionPass(campaignId, map.get());
                for (Mention mention : mentions) {
                    pass.resolve(mention);
                }
                ResolvedMentions result = pass.result();

                ResolutionCounters c = result.counters();
                metrics.incrementEntitiesCreated(c.entitiesCreated());
                metrics.incrementMentionsDroppedHidden(c.mentionsDroppedHidden());
                metrics.incrementMentionsDroppedSuppressed(c.mentionsDroppedSuppressed());
                metrics.incrementAliasCollisions(c.aliasCollisions());
                if (c.entitiesCreated() > 0 || c.aliasesLearned() > 0) {
                    notifyListeners(campaignId);
                }
                log.info("resolution.mentions resolved={} created={} aliasesLearned={} droppedHidden={} "
                                + "droppedSuppressed={} droppedBlank={} aliasCollisions={}",
                        c.mentionsResolved(), c.entitiesCreated(), c.aliasesLearned(), c.mentionsDroppedHidden(),
                        c.mentionsDroppedSuppressed(), c.mentionsDroppedBlank(), c.aliasCollisions());
                return result;
            }
        });
    }

    /**
     * Maps event entity names to canonical names and ids. Hidden names are removed;
     * names the map does not know are kept without an id.
     */
    public List<Event> resolveEventEntities(List<Event> events, EntityCanonicalMap map) {
        List<Event> resolved = new ArrayList<>(events.size());
        for (Event event : events) {
            Set<String> names = new LinkedHashSet<>();
            Set<String> ids = new LinkedHashSet<>();
            for (String name : event.entityNames()) {
                NameResolution r = map.resolveEntityName(name);
                if (r.isLive()) {
                    names.add(r.canonicalName());
                    ids.add(r.entityId());
                } else if (r.isUnknown() && !NameKeys.isBlank(name)) {
                    names.add(name.trim());
                }
            }
            resolved.add(event.withEntities(new ArrayList<>(names), new ArrayList<>(ids)));
        }
        return resolved;
    }

    public ResolvedThreads resolveThreads(String campaignId, String sessionId, String runId,
                                          List<ThreadCandidate> candidates, List<Event> events,
                                          ThreadCanonicalMap map) {
        return resolveThreads(campaignId, sessionId, runId, candidates, events, () -> map);
    }

    /**
     * Resolves thread candidates by title and builds their updates.
     *
     * @param events the persisted events of the run, index-aligned with the extraction's
     *               events so that update event indexes can be mapped to ids
     * @param map    supplies the thread canonical map; called once the campaign lock is held
     */
    public ResolvedThreads resolveThreads(String campaignId, String sessionId, String runId,
                                          List<ThreadCandidate> candidates, List<Event> events,
                                          Supplier<ThreadCanonicalMap> map) {
        return lock.withLock(LockKeys.campaign(campaignId), () -> {
            try (LogContext ctx = LogContext.forResolution(campaignId, runId)) {
                ThreadCanonicalMap threadMap = map.get();
                Map<String, String> idsByTitle = new LinkedHashMap<>();
                Map<String, StoryThread> createdByKey = new LinkedHashMap<>();
                Map<String, StoryThread> createdByNormalized = new LinkedHashMap<>();
                List<ThreadUpdate> updates = new ArrayList<>();
                List<ResolutionIssue> issues = new ArrayList<>();
                int resolvedCount = 0;
                int droppedHidden = 0;
                int droppedBlank = 0;
                int updatesDropped = 0;

                for (ThreadCandidate candidate : candidates) {
                    String title = candidate.title() != null ? candidate.title().trim() : "";
                    if (title.isEmpty()) {
                        droppedBlank++;
                        updatesDropped += candidate.updates().size();
                        continue;
                    }
                    String key = NameKeys.key(title);
                    String threadId;
                    ThreadResolution r = threadMap.resolveThreadTitle(title);
                    if (r.isHidden()) {
                        droppedHidden++;
                        updatesDropped += candidate.updates().size();
                        issues.add(new ResolutionIssue(ResolutionIssue.Kind.HIDDEN_THREAD, title, r.threadId(),
                                "thread is hidden by a correction"));
                        log.debug("Thread candidate dropped, hidden: title={}", title);
                        continue;
                    } else if (r.isLive()) {
                        threadId = r.threadId();
                    } else if (createdByKey.containsKey(key)) {
                        threadId = createdByKey.get(key).getId();
                    } else if (createdByNormalized.containsKey(NameKeys.normalizedForm(title))) {
                        threadId = createdByNormalized.get(NameKeys.normalizedForm(title)).getId();
                    } else {
                        StoryThread thread = StoryThread.builder()
                                .campaignId(campaignId)
                                .title(title)
                                .kind(candidate.kind())
                                .status(candidate.status())
                                .summary(candidate.summary())
                                .createdAt(clock.instant())
                                .build();
                        threadRepository.save(thread);
                        createdByKey.put(key, thread);
                        createdByNormalized.putIfAbsent(NameKeys.normalizedForm(title), thread);
                        auditService.record(AuditAction.THREAD_CREATED, campaignId, thread.getId(), SYSTEM_ACTOR,
                                Map.of("title", title, "sessionId", String.valueOf(sessionId)));
                        threadId = thread.getId();
                    }
                    resolvedCount++;
                    idsByTitle.put(title, threadId);

                    for (ThreadUpdateCandidate update : candidate.updates()) {
                        updates.add(toThreadUpdate(threadId, sessionId, runId, update, events));
                    }
                }

                if (!createdByKey.isEmpty()) {
                    notifyListeners(campaignId);
                }
                ThreadCounters counters = new ThreadCounters(resolvedCount, createdByKey.size(), droppedHidden,
                        droppedBlank, updates.size(), updatesDropped);
                log.info("resolution.threads resolved={} created={} droppedHidden={} updates={} updatesDropped={}",
                        resolvedCount, createdByKey.size(), droppedHidden, updates.size(), updatesDropped);
                return new ResolvedThreads(idsByTitle, new ArrayList<>(createdByKey.values()), updates,
                        counters, issues);
            }
        });
    }

    private ThreadUpdate toThreadUpdate(String threadId, String sessionId, String runId,
                                        ThreadUpdateCandidate update, List<Event> events) {
        List<String> eventIds = new ArrayList<>();
        Set<String> entityIds = new LinkedHashSet<>();
        for (Integer index : update.relatedEventIndexes()) {
            if (index != null && index >= 0 && index < events.size()) {
                Event event = events.get(index);
                eventIds.add(event.id());
                entityIds.addAll(event.entityIds());
            }
        }
        return new ThreadUpdate(UUID.randomUUID().toString(), threadId, sessionId, runId,
                update.updateType() != null ? update.updateType() : "note",
                update.note(), eventIds, new ArrayList<>(entityIds), update.evidence());
    }

    private void notifyListeners(String campaignId) {
        for (LedgerListener listener : listeners) {
            listener.onLedgerChanged(campaignId);
        }
    }

    /**
     * State of one mention resolution call. Entities created earlier in the call are
     * matched before anything is created again.
     */
    private final class MentionPass {
        private final String campaignId;
        private final EntityCanonicalMap map;
        private final Map<String, CampaignEntity> createdByKey = new LinkedHashMap<>();
        private final Map<String, CampaignEntity> createdByNormalized = new LinkedHashMap<>();
        private final List<ResolvedMention> resolved = new ArrayList<>();
        private final List<ResolutionIssue> issues = new ArrayList<>();
        private int aliasesLearned;
        private int droppedHidden;
        private int droppedSuppressed;
        private int droppedBlank;
        private int aliasCollisions;

        MentionPass(String campaignId, EntityCanonicalMap map) {
            this.campaignId = campaignId;
            this.map = map;
        }

        void resolve(Mention mention) {
            String raw = mention.rawText().trim();
            if (NameKeys.isBlank(raw)) {
                droppedBlank++;
                issues.add(new ResolutionIssue(ResolutionIssue.Kind.BLANK_MENTION, raw, null, "blank mention text"));
                return;
            }

            NameResolution r = map.resolveEntityName(raw);
            switch (r.outcome()) {
                case LIVE -> {
                    if (r.viaNormalizedForm()) {
                        learnAlias(r.entityId(), raw);
                        link(mention, r.entityId(), r.canonicalName(), MatchKind.NORMALIZED);
                    } else {
                        link(mention, r.entityId(), r.canonicalName(), MatchKind.EXACT);
                    }
                }
                case HIDDEN -> {
                    if (r.viaNormalizedForm()) {
                        droppedSuppressed++;
                        issues.add(new ResolutionIssue(ResolutionIssue.Kind.SUPPRESSED_NAME, raw, r.entityId(),
                                "name collides with a hidden entity"));
                    } else {
                        droppedHidden++;
                        issues.add(new ResolutionIssue(ResolutionIssue.Kind.HIDDEN_ENTITY, raw, r.entityId(),
                                "entity is hidden by a correction"));
                    }
                    log.debug("Mention dropped: text={} hiddenEntity={}", raw, r.entityId());
                }
                case UNKNOWN -> resolveUnknown(mention, raw);
            }
        }

        private void resolveUnknown(Mention mention, String raw) {
            String key = NameKeys.key(raw);
            CampaignEntity existing = createdByKey.get(key);
            if (existing != null) {
                link(mention, existing.getId(), existing.getCanonicalName(), MatchKind.EXACT);
                return;
            }
            existing = createdByNormalized.get(NameKeys.normalizedForm(raw));
            if (existing != null) {
                if (existing.addAlias(raw)) {
                    createdByKey.put(key, existing);
                    aliasesLearned++;
                }
                link(mention, existing.getId(), existing.getCanonicalName(), MatchKind.NORMALIZED);
                return;
            }

            SortedSet<String> removedFrom = map.removedAliasOwners(key);
            if (!removedFrom.isEmpty()) {
                aliasCollisions++;
                issues.add(new ResolutionIssue(ResolutionIssue.Kind.ALIAS_COLLISION, raw, removedFrom.first(),
                        "name was removed from entity " + String.join(",", removedFrom)));
            }

            CampaignEntity entity = CampaignEntity.builder()
                    .campaignId(campaignId)
                    .canonicalName(raw)
                    .type(mention.type())
                    .description(mention.description())
                    .createdAt(clock.instant())
                    .build();
            entityRepository.save(entity);
            createdByKey.put(key, entity);
            createdByNormalized.putIfAbsent(NameKeys.normalizedForm(raw), entity);
            auditService.record(AuditAction.ENTITY_CREATED, campaignId, entity.getId(), SYSTEM_ACTOR,
                    Map.of("name", raw, "type", entity.getType().name()));
            log.debug("Entity created: id={} name={} type={}", entity.getId(), raw, entity.getType());
            link(mention, entity.getId(), entity.getCanonicalName(), MatchKind.CREATED);
        }

        private void learnAlias(String entityId, String raw) {
            String key = NameKeys.key(raw);
            SortedSet<String> removedFrom = map.removedAliasOwners(key);
            if (!removedFrom.isEmpty()) {
                if (removedFrom.stream().anyMatch(id -> !id.equals(entityId))) {
                    aliasCollisions++;
                    issues.add(new ResolutionIssue(ResolutionIssue.Kind.ALIAS_COLLISION, raw, entityId,
                            "alias was removed from entity " + String.join(",", removedFrom)));
                }
                return;
            }
            if (entityRepository.addAlias(entityId, raw)) {
                aliasesLearned++;
                auditService.record(AuditAction.ALIAS_ADDED, campaignId, entityId, SYSTEM_ACTOR,
                        Map.of("alias", raw));
            }
        }

        private void link(Mention mention, String entityId, String canonicalName, MatchKind kind) {
            resolved.add(new ResolvedMention(mention, entityId, canonicalName, kind));
        }

        ResolvedMentions result() {
            Map<String, CampaignEntity> created = new LinkedHashMap<>();
            createdByKey.values().forEach(e -> created.putIfAbsent(e.getId(), e));
            ResolutionCounters counters = new ResolutionCounters(resolved.size(), created.size(), aliasesLearned,
                    droppedHidden, droppedSuppressed, droppedBlank, aliasCollisions);
            return new ResolvedMentions(resolved, new ArrayList<>(created.values()), counters, issues);
        }
    }
}
