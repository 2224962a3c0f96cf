package com.campaign.canon.canonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derived, read-only view of a campaign's current truth: base records folded with
 * approved corrections. Two maps built from the same ledger snapshot are equal and
 * share a fingerprint.
 */
public final class CanonicalMap {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final String campaignId;
    private final String sessionId;
    private final EntityCanonicalMap entities;
    private final ThreadCanonicalMap threads;
    private final String fingerprint;

    CanonicalMap(String campaignId, String sessionId, EntityCanonicalMap entities, ThreadCanonicalMap threads) {
        this.campaignId = Objects.requireNonNull(campaignId, "campaignId is required");
        this.sessionId = sessionId;
        this.entities = entities;
        this.threads = threads;
        this.fingerprint = computeFingerprint();
    }

    /**
     * A map with no records, for campaigns that have not been processed yet.
     */
    public static CanonicalMap empty(String campaignId) {
        return new CanonicalMap(campaignId, null, EntityCanonicalMap.empty(), ThreadCanonicalMap.empty());
    }

    public String getCampaignId() {
        return campaignId;
    }

    /**
     * Session scope of this map, or null for the campaign-wide map.
     */
    public String getSessionId() {
        return sessionId;
    }

    public EntityCanonicalMap entities() {
        return entities;
    }

    public ThreadCanonicalMap threads() {
        return threads;
    }

    /**
     * Hex SHA-256 over a key-sorted JSON serialization of the map.
     */
    public String fingerprint() {
        return fingerprint;
    }

    private String computeFingerprint() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("campaign_id", campaignId);
        tree.put("session_id", sessionId);
        tree.put("entities", entities.toTree());
        tree.put("threads", threads.toTree());
        try {
            byte[] json = MAPPER.writeValueAsBytes(tree);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical map for " + campaignId, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalMap that = (CanonicalMap) o;
        return fingerprint.equals(that.fingerprint);
    }

    @Override
    public int hashCode() {
        return fingerprint.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalMap{campaignId='" + campaignId + "', sessionId=" + sessionId
                + ", fingerprint=" + fingerprint.substring(0, 12) + "}";
    }
}
