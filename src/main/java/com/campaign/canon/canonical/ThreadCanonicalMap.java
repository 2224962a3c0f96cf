package com.campaign.canon.canonical;

import com.campaign.canon.core.NameKeys;
import com.campaign.canon.core.model.ThreadStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable thread half of a {@link CanonicalMap}. Merged threads resolve to their
 * merge root and are left out of list reads; previous titles stay resolvable.
 */
public final class ThreadCanonicalMap {

    private final SortedMap<String, String> titles;
    private final SortedMap<String, ThreadStatus> statuses;
    private final SortedMap<String, String> summaries;
    private final SortedMap<String, String> titleOwner;
    private final MergePointers merges;
    private final SortedSet<String> hidden;
    private final SortedSet<String> correctedIds;
    private final SortedSet<String> effectivelyHidden = new TreeSet<>();

    ThreadCanonicalMap(SortedMap<String, String> titles,
                       SortedMap<String, ThreadStatus> statuses,
                       SortedMap<String, String> summaries,
                       SortedMap<String, String> titleOwner,
                       MergePointers merges,
                       SortedSet<String> hidden,
                       SortedSet<String> correctedIds) {
        this.titles = new TreeMap<>(titles);
        this.statuses = new TreeMap<>(statuses);
        this.summaries = new TreeMap<>(summaries);
        this.titleOwner = new TreeMap<>(titleOwner);
        this.merges = new MergePointers(merges.asMap());
        this.hidden = new TreeSet<>(hidden);
        this.correctedIds = new TreeSet<>(correctedIds);
        for (String id : titles.keySet()) {
            if (this.merges.chain(id).stream().anyMatch(this.hidden::contains)) {
                effectivelyHidden.add(id);
            }
        }
    }

    static ThreadCanonicalMap empty() {
        return new ThreadCanonicalMap(new TreeMap<>(), new TreeMap<>(), new TreeMap<>(), new TreeMap<>(),
                new MergePointers(), new TreeSet<>(), new TreeSet<>());
    }

    public ThreadResolution resolveThreadId(String id) {
        if (id == null || !titles.containsKey(id)) {
            return ThreadResolution.unknown();
        }
        String root = merges.root(id);
        return effectivelyHidden.contains(id) ? ThreadResolution.hidden(root) : ThreadResolution.live(root);
    }

    /**
     * Resolves a title by exact key, then by normalized form.
     */
    public ThreadResolution resolveThreadTitle(String title) {
        String key = NameKeys.key(title);
        if (key.isEmpty()) {
            return ThreadResolution.unknown();
        }
        String owner = titleOwner.get(key);
        if (owner == null) {
            String normalized = NameKeys.normalizedForm(key);
            for (Map.Entry<String, String> entry : titleOwner.entrySet()) {
                if (NameKeys.normalizedForm(entry.getKey()).equals(normalized)) {
                    owner = entry.getValue();
                    break;
                }
            }
        }
        return owner == null ? ThreadResolution.unknown() : resolveThreadId(owner);
    }

    public Optional<String> title(String id) {
        return Optional.ofNullable(titles.get(merges.root(id)));
    }

    public Optional<ThreadStatus> status(String id) {
        return Optional.ofNullable(statuses.get(merges.root(id)));
    }

    public Optional<String> summary(String id) {
        return Optional.ofNullable(summaries.get(merges.root(id)));
    }

    public SortedSet<String> hiddenIds() {
        return Collections.unmodifiableSortedSet(effectivelyHidden);
    }

    public Optional<String> mergeTarget(String id) {
        return merges.isMerged(id) ? Optional.of(merges.root(id)) : Optional.empty();
    }

    public boolean isCorrected(String id) {
        return correctedIds.contains(id);
    }

    public boolean contains(String id) {
        return titles.containsKey(id);
    }

    /**
     * Ids that list reads present: neither hidden nor merged.
     */
    public SortedSet<String> visibleIds() {
        SortedSet<String> ids = new TreeSet<>();
        for (String id : titles.keySet()) {
            if (!effectivelyHidden.contains(id) && !merges.isMerged(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    Map<String, Object> toTree() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("titles", titles);
        tree.put("statuses", statuses);
        tree.put("summaries", summaries);
        tree.put("title_owner", titleOwner);
        tree.put("merged_into", merges.asMap());
        tree.put("hidden", hidden);
        tree.put("corrected", correctedIds);
        return tree;
    }
}
