package com.campaign.canon.canonical;

import com.campaign.canon.core.NameKeys;
import com.campaign.canon.core.model.CampaignEntity;
import com.campaign.canon.core.model.StoryThread;
import com.campaign.canon.core.model.ThreadStatus;
import com.campaign.canon.correction.Correction;
import com.campaign.canon.correction.CorrectionAction;
import com.campaign.canon.correction.CorrectionRepository;
import com.campaign.canon.correction.CorrectionState;
import com.campaign.canon.correction.CycleDetectedException;
import com.campaign.canon.correction.InvalidCorrectionException;
import com.campaign.canon.correction.LedgerValidator;
import com.campaign.canon.repository.EntityRepository;
import com.campaign.canon.repository.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds {@link CanonicalMap}s by folding approved corrections, in ledger order, over
 * the base entity and thread records.
 *
 * <p>The fold is pure: the same base records and ledger always produce an equal map.
 * A normal build is lenient and skips, with a warning, any stored correction that no
 * longer applies. Validation ahead of approval uses the strict fold and fails on the
 * first such correction.</p>
 */
public class CanonicalMapBuilder implements LedgerValidator {
    private static final Logger log = LoggerFactory.getLogger(CanonicalMapBuilder.class);

    private final EntityRepository entityRepository;
    private final ThreadRepository threadRepository;
    private final CorrectionRepository correctionRepository;

    public CanonicalMapBuilder(EntityRepository entityRepository, ThreadRepository threadRepository,
                               CorrectionRepository correctionRepository) {
        this.entityRepository = entityRepository;
        this.threadRepository = threadRepository;
        this.correctionRepository = correctionRepository;
    }

    /**
     * Builds the campaign-wide map from unscoped approved corrections.
     */
    public CanonicalMap build(String campaignId) {
        return build(campaignId, null);
    }

    /**
     * Builds the map for a session scope: unscoped corrections plus those scoped to
     * {@code sessionId}.
     */
    public CanonicalMap build(String campaignId, String sessionId) {
        List<Correction> approved = correctionRepository
                .findByCampaignAndState(campaignId, CorrectionState.APPROVED);
        CanonicalMap map = fold(campaignId, sessionId, approved, false);
        log.debug("canonical.built campaignId={} sessionId={} corrections={} fingerprint={}",
                campaignId, sessionId, approved.size(), map.fingerprint());
        return map;
    }

    @Override
    public void validate(String campaignId, String sessionId, List<Correction> corrections) {
        fold(campaignId, sessionId, corrections, true);
    }

    /**
     * Folds the given corrections over the current base records.
     *
     * @param strict fail on the first inapplicable correction instead of skipping it
     */
    public CanonicalMap fold(String campaignId, String sessionId, List<Correction> corrections, boolean strict) {
        Fold fold = new Fold(entityRepository.findByCampaign(campaignId),
                threadRepository.findByCampaign(campaignId));

        List<Correction> ordered = new ArrayList<>(corrections);
        ordered.sort(Correction.LEDGER_ORDER);
        for (Correction correction : ordered) {
            if (!correction.getCampaignId().equals(campaignId) || !correction.appliesTo(sessionId)) {
                continue;
            }
            try {
                fold.apply(correction);
            } catch (CycleDetectedException | InvalidCorrectionException e) {
                if (strict) {
                    throw e;
                }
                log.warn("canonical.correction_skipped correctionId={} action={} targetId={} reason={}",
                        correction.getId(), correction.getAction(), correction.getTargetId(), e.getMessage());
            }
        }
        return fold.toMap(campaignId, sessionId);
    }

    /**
     * Mutable fold state. Each {@code apply} checks everything before it mutates, so a
     * rejected correction leaves the state untouched.
     */
    private static final class Fold {
        private final SortedMap<String, String> canonicalNames = new TreeMap<>();
        private final SortedMap<String, String> keyOwner = new TreeMap<>();
        private final SortedMap<String, String> keyDisplay = new TreeMap<>();
        private final MergePointers entityMerges = new MergePointers();
        private final SortedSet<String> hiddenEntities = new TreeSet<>();
        private final SortedMap<String, SortedSet<String>> removedAliases = new TreeMap<>();
        private final SortedMap<String, SortedSet<String>> heldNameKeys = new TreeMap<>();

        private final SortedMap<String, String> titles = new TreeMap<>();
        private final SortedMap<String, ThreadStatus> statuses = new TreeMap<>();
        private final SortedMap<String, String> summaries = new TreeMap<>();
        private final SortedMap<String, String> titleOwner = new TreeMap<>();
        private final MergePointers threadMerges = new MergePointers();
        private final SortedSet<String> hiddenThreads = new TreeSet<>();

        private final SortedMap<String, String> baseNames;
        private final SortedMap<String, String> baseKeyOwner;
        private final SortedMap<String, String> baseTitles;
        private final SortedMap<String, ThreadStatus> baseStatuses;
        private final SortedMap<String, String> baseSummaries;

        Fold(List<CampaignEntity> entities, List<StoryThread> threads) {
            for (CampaignEntity entity : entities) {
                canonicalNames.put(entity.getId(), entity.getCanonicalName());
                holdName(entity.getId(), entity.getCanonicalName());
                claimIfFree(entity.getCanonicalName(), entity.getId());
            }
            // Learned aliases never displace another entity's canonical name.
            for (CampaignEntity entity : entities) {
                for (String alias : entity.getAliases()) {
                    claimIfFree(alias, entity.getId());
                }
            }
            for (StoryThread thread : threads) {
                titles.put(thread.getId(), thread.getTitle());
                statuses.put(thread.getId(), thread.getStatus());
                if (thread.getSummary() != null) {
                    summaries.put(thread.getId(), thread.getSummary());
                }
                titleOwner.putIfAbsent(NameKeys.key(thread.getTitle()), thread.getId());
            }
            baseNames = new TreeMap<>(canonicalNames);
            baseKeyOwner = new TreeMap<>(keyOwner);
            baseTitles = new TreeMap<>(titles);
            baseStatuses = new TreeMap<>(statuses);
            baseSummaries = new TreeMap<>(summaries);
        }

        void apply(Correction c) {
            CorrectionAction action = c.getAction();
            switch (action.targetType()) {
                case ENTITY -> applyEntity(c);
                case THREAD -> applyThread(c);
            }
        }

        private void applyEntity(Correction c) {
            String id = c.getTargetId();
            if (!canonicalNames.containsKey(id)) {
                throw new InvalidCorrectionException("Entity not found: " + id);
            }
            String value = c.payloadValue();
            switch (c.getAction()) {
                case ENTITY_RENAME -> {
                    String name = requireValue(c, value);
                    String old = canonicalNames.put(id, name);
                    holdName(id, name);
                    claimIfFree(old, id);
                    claim(name, id);
                }
                case ENTITY_ALIAS_ADD -> claim(requireValue(c, value), id);
                case ENTITY_ALIAS_REMOVE -> {
                    String key = NameKeys.key(requireValue(c, value));
                    if (key.equals(NameKeys.key(canonicalNames.get(id)))) {
                        throw new InvalidCorrectionException(
                                "Cannot remove the canonical name of entity " + id + ": " + value);
                    }
                    if (id.equals(keyOwner.get(key))) {
                        keyOwner.remove(key);
                        keyDisplay.remove(key);
                    }
                    removedAliases.computeIfAbsent(key, k -> new TreeSet<>()).add(id);
                }
                case ENTITY_MERGE -> {
                    String into = requireValue(c, value);
                    if (!canonicalNames.containsKey(into)) {
                        throw new InvalidCorrectionException("Merge target not found: " + into);
                    }
                    if (into.equals(id) || entityMerges.wouldCycle(id, into)) {
                        throw new CycleDetectedException("Merging entity " + id + " into " + into
                                + " would create a cycle");
                    }
                    entityMerges.merge(id, into);
                }
                case ENTITY_UNMERGE -> entityMerges.unmerge(id);
                case ENTITY_HIDE -> hiddenEntities.add(id);
                case ENTITY_UNHIDE -> hiddenEntities.remove(id);
                default -> throw new InvalidCorrectionException("Not an entity action: " + c.getAction());
            }
        }

        private void applyThread(Correction c) {
            String id = c.getTargetId();
            if (!titles.containsKey(id)) {
                throw new InvalidCorrectionException("Thread not found: " + id);
            }
            String value = c.payloadValue();
            switch (c.getAction()) {
                case THREAD_STATUS -> {
                    ThreadStatus status;
                    try {
                        status = ThreadStatus.parse(value);
                    } catch (IllegalArgumentException e) {
                        throw new InvalidCorrectionException("Unknown thread status: " + value);
                    }
                    statuses.put(id, status);
                }
                case THREAD_TITLE -> {
                    String title = requireValue(c, value);
                    titles.put(id, title);
                    titleOwner.put(NameKeys.key(title), id);
                }
                case THREAD_SUMMARY -> {
                    if (value == null || value.isBlank()) {
                        summaries.remove(id);
                    } else {
                        summaries.put(id, value.trim());
                    }
                }
                case THREAD_MERGE -> {
                    String into = requireValue(c, value);
                    if (!titles.containsKey(into)) {
                        throw new InvalidCorrectionException("Merge target not found: " + into);
                    }
                    if (into.equals(id) || threadMerges.wouldCycle(id, into)) {
                        throw new CycleDetectedException("Merging thread " + id + " into " + into
                                + " would create a cycle");
                    }
                    threadMerges.merge(id, into);
                }
                case THREAD_UNMERGE -> threadMerges.unmerge(id);
                case THREAD_HIDE -> hiddenThreads.add(id);
                case THREAD_UNHIDE -> hiddenThreads.remove(id);
                default -> throw new InvalidCorrectionException("Not a thread action: " + c.getAction());
            }
        }

        private String requireValue(Correction c, String value) {
            if (value == null || value.isBlank()) {
                throw new InvalidCorrectionException(
                        "Correction " + c.getId() + " is missing payload '" + c.getAction().payloadKey() + "'");
            }
            return value.trim();
        }

        private void claim(String name, String id) {
            String key = NameKeys.key(name);
            if (key.isEmpty()) {
                return;
            }
            keyOwner.put(key, id);
            keyDisplay.put(key, name.trim());
            SortedSet<String> removed = removedAliases.get(key);
            if (removed != null && removed.remove(id) && removed.isEmpty()) {
                removedAliases.remove(key);
            }
        }

        private void claimIfFree(String name, String id) {
            String key = NameKeys.key(name);
            if (key.isEmpty()) {
                return;
            }
            String owner = keyOwner.get(key);
            if (owner == null || owner.equals(id)) {
                keyOwner.put(key, id);
                keyDisplay.putIfAbsent(key, name.trim());
            }
        }

        private void holdName(String id, String name) {
            heldNameKeys.computeIfAbsent(id, k -> new TreeSet<>()).add(NameKeys.key(name));
        }

        /**
         * Entities whose folded state differs from the base record. Aliases an entity keeps
         * from its own earlier names do not count, so renaming back restores the original.
         */
        private SortedSet<String> correctedEntities() {
            SortedSet<String> corrected = new TreeSet<>();
            for (String id : canonicalNames.keySet()) {
                if (!canonicalNames.get(id).equals(baseNames.get(id))
                        || hiddenEntities.contains(id)
                        || entityMerges.isMerged(id)
                        || entityMerges.asMap().containsValue(id)
                        || !aliasKeys(keyOwner, id).equals(aliasKeys(baseKeyOwner, id))) {
                    corrected.add(id);
                }
            }
            return corrected;
        }

        private SortedSet<String> aliasKeys(SortedMap<String, String> owners, String id) {
            SortedSet<String> held = heldNameKeys.getOrDefault(id, new TreeSet<>());
            SortedSet<String> keys = new TreeSet<>();
            owners.forEach((key, owner) -> {
                if (owner.equals(id) && !held.contains(key)) {
                    keys.add(key);
                }
            });
            return keys;
        }

        private SortedSet<String> correctedThreads() {
            SortedSet<String> corrected = new TreeSet<>();
            for (String id : titles.keySet()) {
                if (!titles.get(id).equals(baseTitles.get(id))
                        || statuses.get(id) != baseStatuses.get(id)
                        || !Objects.equals(summaries.get(id), baseSummaries.get(id))
                        || hiddenThreads.contains(id)
                        || threadMerges.isMerged(id)
                        || threadMerges.asMap().containsValue(id)) {
                    corrected.add(id);
                }
            }
            return corrected;
        }

        CanonicalMap toMap(String campaignId, String sessionId) {
            EntityCanonicalMap entities = new EntityCanonicalMap(canonicalNames, keyOwner, keyDisplay,
                    entityMerges, hiddenEntities, removedAliases, correctedEntities());
            ThreadCanonicalMap threads = new ThreadCanonicalMap(titles, statuses, summaries, titleOwner,
                    threadMerges, hiddenThreads, correctedThreads());
            return new CanonicalMap(campaignId, sessionId, entities, threads);
        }
    }
}
