package com.campaign.canon.cache;

import com.campaign.canon.canonical.CanonicalMap;

import java.util.Optional;

/**
 * Cache of built canonical maps, keyed by campaign and optional session scope.
 * Maps are derived state: a miss is always safe, a stale hit never is, so every
 * change to a campaign's ledger or base records must invalidate the campaign.
 */
public interface CanonicalMapCache extends LedgerListener {

    /**
     * Gets a cached map.
     *
     * @param campaignId the campaign
     * @param sessionId  the session scope, or null for the campaign-wide map
     */
    Optional<CanonicalMap> get(String campaignId, String sessionId);

    void put(String campaignId, String sessionId, CanonicalMap map);

    /**
     * Drops every cached map of the campaign, all session scopes included.
     */
    void invalidate(String campaignId);

    void invalidateAll();

    CacheStats getStats();

    @Override
    default void onLedgerChanged(String campaignId) {
        invalidate(campaignId);
    }
}
