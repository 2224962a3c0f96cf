package com.campaign.canon.lock;

import java.util.function.Supplier;

/**
 * Single-writer lock keyed by a string. Ledger mutation and resolution are
 * serialized per campaign, step transitions per run, run creation per session
 * (see {@link LockKeys}).
 */
public interface SerializationLock {

    /**
     * Acquires the lock for the given key, waiting at most the configured timeout.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    void lock(String key);

    /**
     * Releases the lock for the given key if the current thread holds it.
     */
    void unlock(String key);

    /**
     * Runs the action while holding the lock for the key.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    default void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
