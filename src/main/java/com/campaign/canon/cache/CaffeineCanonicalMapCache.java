package com.campaign.canon.cache;

import com.campaign.canon.canonical.CanonicalMap;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed canonical map cache. Invalidation is per campaign and covers
 * the campaign-wide map and every session-scoped map.
 */
public class CaffeineCanonicalMapCache implements CanonicalMapCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCanonicalMapCache.class);

    private final Cache<CacheKey, CanonicalMap> cache;

    public CaffeineCanonicalMapCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineCanonicalMapCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<CanonicalMap> get(String campaignId, String sessionId) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(campaignId, sessionId)));
    }

    @Override
    public void put(String campaignId, String sessionId, CanonicalMap map) {
        cache.put(new CacheKey(campaignId, sessionId), map);
    }

    @Override
    public void invalidate(String campaignId) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.campaignId().equals(campaignId));
        log.debug("Invalidated {} canonical maps for campaign {}", before - cache.asMap().size(), campaignId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all canonical maps");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Cache key; a null session id denotes the campaign-wide map.
     */
    record CacheKey(String campaignId, String sessionId) {}
}
