package com.campaign.canon.canonical;

import com.campaign.canon.cache.CanonicalMapCache;
import com.campaign.canon.cache.LedgerListener;
import com.campaign.canon.cache.NoOpCanonicalMapCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cached access to canonical maps. The ledger and the resolution stage notify the
 * service through {@link #onLedgerChanged(String)}.
 *
 * <p>Each campaign carries a generation that every change bumps before the cache is
 * cleared. A map whose build overlapped a change is dropped again after it was put,
 * so a map built from a superseded ledger is never served past the change.</p>
 */
public class CanonicalMapService implements LedgerListener {
    private static final Logger log = LoggerFactory.getLogger(CanonicalMapService.class);

    private final CanonicalMapBuilder builder;
    private final CanonicalMapCache cache;
    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    public CanonicalMapService(CanonicalMapBuilder builder) {
        this(builder, new NoOpCanonicalMapCache());
    }

    public CanonicalMapService(CanonicalMapBuilder builder, CanonicalMapCache cache) {
        this.builder = builder;
        this.cache = cache;
    }

    public CanonicalMap get(String campaignId) {
        return get(campaignId, null);
    }

    /**
     * Gets the map for a scope, building and caching it on a miss.
     */
    public CanonicalMap get(String campaignId, String sessionId) {
        Optional<CanonicalMap> cached = cache.get(campaignId, sessionId);
        if (cached.isPresent()) {
            log.trace("Canonical map cache hit: campaignId={} sessionId={}", campaignId, sessionId);
            return cached.get();
        }
        long generation = generation(campaignId).get();
        CanonicalMap map = builder.build(campaignId, sessionId);
        cache.put(campaignId, sessionId, map);
        if (generation(campaignId).get() != generation) {
            // A change landed during the build; the put may have outlived its invalidation.
            cache.invalidate(campaignId);
            log.debug("Canonical map build superseded: campaignId={} sessionId={}", campaignId, sessionId);
        }
        return map;
    }

    public CanonicalSnapshot snapshot(String campaignId) {
        return CanonicalSnapshot.of(get(campaignId));
    }

    public CanonicalSnapshot snapshot(String campaignId, String sessionId) {
        return CanonicalSnapshot.of(get(campaignId, sessionId));
    }

    public void invalidate(String campaignId) {
        generation(campaignId).incrementAndGet();
        cache.invalidate(campaignId);
    }

    @Override
    public void onLedgerChanged(String campaignId) {
        invalidate(campaignId);
    }

    public CanonicalMapCache getCache() {
        return cache;
    }

    private AtomicLong generation(String campaignId) {
        return generations.computeIfAbsent(campaignId, id -> new AtomicLong());
    }
}
