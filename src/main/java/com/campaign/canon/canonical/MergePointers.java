package com.campaign.canon.canonical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merge pointers (source id to target id) with chain following.
 */
final class MergePointers {

    private final TreeMap<String, String> mergedInto;

    MergePointers() {
        this.mergedInto = new TreeMap<>();
    }

    MergePointers(Map<String, String> mergedInto) {
        this.mergedInto = new TreeMap<>(mergedInto);
    }

    void merge(String sourceId, String targetId) {
        mergedInto.put(sourceId, targetId);
    }

    boolean unmerge(String sourceId) {
        return mergedInto.remove(sourceId) != null;
    }

    /**
     * Whether pointing {@code sourceId} at {@code targetId} would close a loop.
     */
    boolean wouldCycle(String sourceId, String targetId) {
        return chain(targetId).contains(sourceId);
    }

    /**
     * Follows pointers to the fixed point. A loop that slipped into stored data stops
     * at the last id before repetition.
     */
    String root(String id) {
        List<String> chain = chain(id);
        return chain.get(chain.size() - 1);
    }

    /**
     * The id followed by every merge target reached from it, in order.
     */
    List<String> chain(String id) {
        Set<String> seen = new LinkedHashSet<>();
        String current = id;
        while (current != null && seen.add(current)) {
            current = mergedInto.get(current);
        }
        return new ArrayList<>(seen);
    }

    String directTarget(String id) {
        return mergedInto.get(id);
    }

    boolean isMerged(String id) {
        return mergedInto.containsKey(id);
    }

    Map<String, String> asMap() {
        return Collections.unmodifiableMap(mergedInto);
    }
}
