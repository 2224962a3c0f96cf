package com.campaign.canon.canonical;

import com.campaign.canon.core.NameKeys;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable entity half of a {@link CanonicalMap}.
 *
 * <p>Every name key has exactly one owning entity. A key owned by an entity that is
 * hidden, or that is merged into a hidden entity anywhere along its chain, is a hidden
 * name and never resolves live. A key owned by a merged entity resolves to the merge
 * root.</p>
 */
public final class EntityCanonicalMap {

    private final SortedMap<String, String> canonicalNames;
    private final SortedMap<String, String> keyOwner;
    private final SortedMap<String, String> keyDisplay;
    private final MergePointers merges;
    private final SortedSet<String> hidden;
    private final SortedMap<String, SortedSet<String>> removedAliases;
    private final SortedSet<String> correctedIds;

    private final SortedMap<String, String> liveByKey = new TreeMap<>();
    private final SortedMap<String, String> hiddenByKey = new TreeMap<>();
    private final SortedMap<String, String> liveByNormalized = new TreeMap<>();
    private final SortedMap<String, String> hiddenByNormalized = new TreeMap<>();
    private final SortedSet<String> effectivelyHidden = new TreeSet<>();

    EntityCanonicalMap(SortedMap<String, String> canonicalNames,
                       SortedMap<String, String> keyOwner,
                       SortedMap<String, String> keyDisplay,
                       MergePointers merges,
                       SortedSet<String> hidden,
                       SortedMap<String, SortedSet<String>> removedAliases,
                       SortedSet<String> correctedIds) {
        this.canonicalNames = new TreeMap<>(canonicalNames);
        this.keyOwner = new TreeMap<>(keyOwner);
        this.keyDisplay = new TreeMap<>(keyDisplay);
        this.merges = new MergePointers(merges.asMap());
        this.hidden = new TreeSet<>(hidden);
        this.removedAliases = new TreeMap<>();
        removedAliases.forEach((k, v) -> this.removedAliases.put(k, new TreeSet<>(v)));
        this.correctedIds = new TreeSet<>(correctedIds);
        index();
    }

    static EntityCanonicalMap empty() {
        return new EntityCanonicalMap(new TreeMap<>(), new TreeMap<>(), new TreeMap<>(), new MergePointers(),
                new TreeSet<>(), new TreeMap<>(), new TreeSet<>());
    }

    private void index() {
        for (String id : canonicalNames.keySet()) {
            if (merges.chain(id).stream().anyMatch(hidden::contains)) {
                effectivelyHidden.add(id);
            }
        }

        Set<String> ambiguous = new TreeSet<>();
        for (Map.Entry<String, String> entry : keyOwner.entrySet()) {
            String key = entry.getKey();
            String owner = entry.getValue();
            String normalized = NameKeys.normalizedForm(key);
            if (effectivelyHidden.contains(owner)) {
                hiddenByKey.put(key, owner);
                hiddenByNormalized.putIfAbsent(normalized, owner);
                continue;
            }
            String root = merges.root(owner);
            liveByKey.put(key, root);
            String previous = liveByNormalized.putIfAbsent(normalized, root);
            if (previous != null && !previous.equals(root)) {
                ambiguous.add(normalized);
            }
        }
        // Two different entities sharing a normalized form: only exact keys may decide.
        ambiguous.forEach(liveByNormalized::remove);
    }

    /**
     * Resolves a surface name: exact key first, then normalized form. Hidden wins over
     * live at the same tier.
     */
    public NameResolution resolveEntityName(String name) {
        String key = NameKeys.key(name);
        if (key.isEmpty()) {
            return NameResolution.unknown();
        }
        String hiddenOwner = hiddenByKey.get(key);
        if (hiddenOwner != null) {
            return NameResolution.hidden(hiddenOwner, false);
        }
        String liveId = liveByKey.get(key);
        if (liveId != null) {
            return NameResolution.live(liveId, canonicalNames.get(liveId), false);
        }

        String normalized = NameKeys.normalizedForm(key);
        hiddenOwner = hiddenByNormalized.get(normalized);
        if (hiddenOwner != null) {
            return NameResolution.hidden(hiddenOwner, true);
        }
        liveId = liveByNormalized.get(normalized);
        if (liveId != null) {
            return NameResolution.live(liveId, canonicalNames.get(liveId), true);
        }
        return NameResolution.unknown();
    }

    /**
     * The merge root of an entity id (the id itself when not merged).
     */
    public String resolveId(String id) {
        return merges.root(id);
    }

    /**
     * The effective canonical name of an entity, following merges.
     */
    public Optional<String> canonicalName(String id) {
        return Optional.ofNullable(canonicalNames.get(merges.root(id)));
    }

    /**
     * Display forms of every live key that resolves to this entity's merge root,
     * excluding the root's own canonical name.
     */
    public SortedSet<String> aliases(String id) {
        String root = merges.root(id);
        String canonicalKey = NameKeys.key(canonicalNames.get(root));
        SortedSet<String> result = new TreeSet<>();
        liveByKey.forEach((key, owner) -> {
            if (owner.equals(root) && !key.equals(canonicalKey)) {
                result.add(keyDisplay.getOrDefault(key, key));
            }
        });
        return Collections.unmodifiableSortedSet(result);
    }

    public SortedSet<String> hiddenIds() {
        return Collections.unmodifiableSortedSet(effectivelyHidden);
    }

    public boolean isHidden(String id) {
        return effectivelyHidden.contains(id);
    }

    /**
     * Name keys that must never be presented or re-created as live entities.
     */
    public SortedSet<String> hiddenNames() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(hiddenByKey.keySet()));
    }

    /**
     * The merge root of a merged entity, empty when the entity is not merged.
     */
    public Optional<String> mergeTarget(String id) {
        return merges.isMerged(id) ? Optional.of(merges.root(id)) : Optional.empty();
    }

    /**
     * Live name keys mapped to the id of the entity they resolve to.
     */
    public SortedMap<String, String> liveNames() {
        return Collections.unmodifiableSortedMap(liveByKey);
    }

    /**
     * Entities whose alias {@code key} was explicitly removed by a correction.
     */
    public SortedSet<String> removedAliasOwners(String key) {
        SortedSet<String> owners = removedAliases.get(NameKeys.key(key));
        return owners == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(owners);
    }

    public boolean isCorrected(String id) {
        return correctedIds.contains(id);
    }

    public boolean contains(String id) {
        return canonicalNames.containsKey(id);
    }

    /**
     * Ids that list reads present: neither hidden nor merged into another entity.
     */
    public SortedSet<String> visibleIds() {
        SortedSet<String> ids = new TreeSet<>();
        for (String id : canonicalNames.keySet()) {
            if (!effectivelyHidden.contains(id) && !merges.isMerged(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    Map<String, Object> toTree() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("canonical_names", canonicalNames);
        tree.put("key_owner", keyOwner);
        tree.put("key_display", keyDisplay);
        tree.put("merged_into", merges.asMap());
        tree.put("hidden", hidden);
        tree.put("removed_aliases", removedAliases);
        tree.put("corrected", correctedIds);
        return tree;
    }
}
