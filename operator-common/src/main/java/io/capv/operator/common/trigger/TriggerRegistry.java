/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.trigger;

import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Keeps at most one {@link OnlinePoller} running per key. The poller first waits for the awaited state, fires its
 * action exactly once and then waits until the reaction is recorded. Afterwards it removes its key from the registry,
 * so a later call can start a new poller. The registry lives in memory only.
 */
public class TriggerRegistry {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(TriggerRegistry.class);

    /**
     * Default interval between two polls
     */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final ScheduledExecutorService executor;
    private final long intervalMs;

    private final Object lock = new Object();
    private final Map<String, PollerTask> active = new HashMap<>();

    /**
     * Constructs the registry
     *
     * @param executor  Executor running the polls
     * @param interval  Interval between two polls
     */
    public TriggerRegistry(ScheduledExecutorService executor, Duration interval) {
        this.executor = executor;
        this.intervalMs = interval.toMillis();
    }

    /**
     * Starts a poller for the key unless its precondition is already satisfied or a poller for the same key is
     * already running.
     *
     * @param reconciliation    Reconciliation marker used for logging
     * @param key               Deduplication key
     * @param poller            The poller
     *
     * @return  True if a new poller was started
     */
    public boolean startIfAbsent(Reconciliation reconciliation, String key, OnlinePoller poller) {
        if (test(reconciliation, key, poller.precondition())) {
            LOGGER.traceCr(reconciliation, "Precondition for poller {} already satisfied", key);
            return false;
        }

        PollerTask task = new PollerTask(reconciliation, key, poller);

        synchronized (lock) {
            if (active.containsKey(key)) {
                LOGGER.traceCr(reconciliation, "Poller {} is already running", key);
                return false;
            }

            active.put(key, task);
        }

        try {
            executor.schedule(task, intervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            remove(key, task);
            throw e;
        }

        LOGGER.debugCr(reconciliation, "Poller {} started", key);
        return true;
    }

    /*test*/ boolean isActive(String key) {
        synchronized (lock) {
            return active.containsKey(key);
        }
    }

    /*test*/ int size() {
        synchronized (lock) {
            return active.size();
        }
    }

    private void remove(String key, PollerTask task) {
        synchronized (lock) {
            active.remove(key, task);
        }
    }

    private static boolean test(Reconciliation reconciliation, String key, BooleanSupplier predicate) {
        try {
            return predicate.getAsBoolean();
        } catch (RuntimeException e) {
            LOGGER.debugCr(reconciliation, "Poller {} predicate failed, treating it as not met: {}", key, e.getMessage());
            return false;
        }
    }

    private class PollerTask implements Runnable {
        private final Reconciliation reconciliation;
        private final String key;
        private final OnlinePoller poller;
        private boolean fired = false;

        PollerTask(Reconciliation reconciliation, String key, OnlinePoller poller) {
            this.reconciliation = reconciliation;
            this.key = key;
            this.poller = poller;
        }

        @Override
        public void run() {
            if (!fired) {
                if (test(reconciliation, key, poller.awaited())) {
                    LOGGER.infoCr(reconciliation, "Awaited state of poller {} reached", key);

                    try {
                        poller.onMet().run();
                        fired = true;
                    } catch (RuntimeException e) {
                        LOGGER.warnCr(reconciliation, "Poller {} action failed and will be retried", key, e);
                    }
                }
            } else if (test(reconciliation, key, poller.recorded())) {
                LOGGER.debugCr(reconciliation, "Poller {} finished", key);
                remove(key, this);
                return;
            }

            try {
                executor.schedule(this, intervalMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOGGER.debugCr(reconciliation, "Poller {} stopped because the executor is shut down", key);
                remove(key, this);
            }
        }
    }
}
