package com.campaign.canon.cache;

/**
 * Configuration for the canonical map cache.
 *
 * @param maxSize    maximum number of cached maps
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,000 maps, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
