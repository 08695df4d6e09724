/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Tracks the reconciliations which are in progress and guarantees that at most one reconciliation of a given
 * resource runs at any time, even when several controller loop threads take events from the same queue.
 *
 * A lock entry exists only while somebody holds it or waits for it. Entries are reference counted and the counting
 * happens inside {@link ConcurrentHashMap#compute} so that an entry is never removed while another thread is about
 * to use it.
 */
public class ReconciliationLockManager {
    private static final Logger LOGGER = LogManager.getLogger(ReconciliationLockManager.class);

    /*test*/ final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    /**
     * Tries to acquire the lock for the key, waiting at most the given time.
     *
     * @param key   The key for which the lock should be obtained
     * @param time  How many units of time should we wait for the lock
     * @param unit  Unit of the waiting time
     *
     * @return  True if the lock was obtained. False otherwise.
     *
     * @throws InterruptedException Thrown when interrupted while waiting for the lock
     */
    public boolean tryLock(String key, long time, TimeUnit unit) throws InterruptedException {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock lock = existing == null ? new KeyLock() : existing;
            lock.interested++;
            return lock;
        });

        LOGGER.debug("Trying to obtain lock {}", key);

        boolean acquired = false;
        try {
            acquired = keyLock.permit.tryAcquire(time, unit);
            return acquired;
        } finally {
            if (!acquired) {
                release(key, false);
            }
        }
    }

    /**
     * Releases the lock for the key. The entry is removed when nobody else holds or waits for it.
     *
     * @param key   The key of the lock which should be unlocked
     */
    public void unlock(String key) {
        LOGGER.debug("Releasing lock {}", key);
        release(key, true);
    }

    /**
     * @param key   Key of the lock
     *
     * @return  True when the lock is currently held
     */
    public boolean isLocked(String key) {
        KeyLock keyLock = locks.get(key);
        return keyLock != null && keyLock.permit.availablePermits() == 0;
    }

    private void release(String key, boolean held) {
        locks.compute(key, (k, existing) -> {
            if (existing == null) {
                LOGGER.warn("Lock with key {} does not exist and cannot be unlocked", key);
                return null;
            }

            if (held) {
                existing.permit.release();
            }

            existing.interested--;
            if (existing.interested == 0) {
                LOGGER.debug("Lock {} is not in use anymore and will be removed", key);
                return null;
            } else {
                return existing;
            }
        });
    }

    /**
     * Lock of a single key with the number of parties holding or waiting for it. The counter is only modified
     * inside the compute calls of the lock map.
     */
    /*test*/ static class KeyLock {
        private final Semaphore permit = new Semaphore(1);
        /*test*/ int interested = 0;
    }
}
