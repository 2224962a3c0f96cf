package com.campaign.canon.cache;

import com.campaign.canon.canonical.CanonicalMap;

import java.util.Optional;

/**
 * No-op cache implementation. Used as the default when caching is disabled.
 */
public class NoOpCanonicalMapCache implements CanonicalMapCache {

    @Override
    public Optional<CanonicalMap> get(String campaignId, String sessionId) {
        return Optional.empty();
    }

    @Override
    public void put(String campaignId, String sessionId, CanonicalMap map) {
        // no-op
    }

    @Override
    public void invalidate(String campaignId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
