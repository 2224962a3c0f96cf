package com.campaign.canon.canonical;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compact view of a canonical map handed to the Extractor: live name keys mapped to
 * their canonical names, and the names that must not be resurrected.
 *
 * @param campaignId      the campaign
 * @param nameToCanonical live name key to canonical name
 * @param hiddenNames     hidden name keys
 * @param fingerprint     fingerprint of the map the snapshot was taken from
 */
public record CanonicalSnapshot(String campaignId,
                                SortedMap<String, String> nameToCanonical,
                                SortedSet<String> hiddenNames,
                                String fingerprint) {

    public CanonicalSnapshot {
        nameToCanonical = Collections.unmodifiableSortedMap(new TreeMap<>(nameToCanonical));
        hiddenNames = Collections.unmodifiableSortedSet(new TreeSet<>(hiddenNames));
    }

    public static CanonicalSnapshot of(CanonicalMap map) {
        EntityCanonicalMap entities = map.entities();
        SortedMap<String, String> names = new TreeMap<>();
        entities.liveNames().forEach((key, id) ->
                entities.canonicalName(id).ifPresent(name -> names.put(key, name)));
        return new CanonicalSnapshot(map.getCampaignId(), names, entities.hiddenNames(), map.fingerprint());
    }
}
