package com.campaign.canon.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link SerializationLock} backed by one {@link ReentrantLock} per key.
 * Re-entrant, so a campaign-locked approval may call code that locks the same campaign.
 */
public class LocalSerializationLock implements SerializationLock {
    private static final Logger log = LoggerFactory.getLogger(LocalSerializationLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalSerializationLock() {
        this(LockConfig.defaults());
    }

    public LocalSerializationLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("Lock acquired: {}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("Lock released: {}", key);
        }
    }
}
