/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import io.capv.operator.common.metrics.ControllerMetricsHolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Bounded FIFO of resources waiting for reconciliation, one per resource kind. A resource is queued at most once:
 * events arriving while it waits are folded into the entry which is already there.
 */
public class ControllerQueue {
    private static final Logger LOGGER = LogManager.getLogger(ControllerQueue.class);

    private final int capacity;
    private final ControllerMetricsHolder metrics;

    // Both guarded by this
    private final Deque<SimplifiedReconciliation> entries = new ArrayDeque<>();
    private final Set<SimplifiedReconciliation> waiting = new HashSet<>();

    /**
     * @param capacity  Maximum number of waiting resources
     * @param metrics   Metrics of the controller owning this queue
     */
    public ControllerQueue(int capacity, ControllerMetricsHolder metrics) {
        this.capacity = capacity;
        this.metrics = metrics;
    }

    /**
     * Removes the oldest entry, waiting for one when the queue is empty.
     *
     * @return  The next resource to reconcile
     *
     * @throws InterruptedException When the calling thread is interrupted while waiting
     */
    public synchronized SimplifiedReconciliation take() throws InterruptedException {
        while (entries.isEmpty()) {
            wait();
        }

        SimplifiedReconciliation next = entries.pollFirst();
        waiting.remove(next);
        return next;
    }

    /**
     * Adds the resource at the tail unless it is already waiting.
     *
     * @param reconciliation    Resource to reconcile
     *
     * @return  False when the resource was already waiting or the queue is at capacity
     */
    public synchronized boolean enqueue(SimplifiedReconciliation reconciliation) {
        if (waiting.contains(reconciliation)) {
            metrics.alreadyEnqueuedReconciliationsCounter(reconciliation.namespace()).increment();
            LOGGER.debug("{} is already waiting in the queue", reconciliation);
            return false;
        }

        if (entries.size() >= capacity) {
            LOGGER.warn("Queue is at capacity ({}), dropping {}", capacity, reconciliation);
            return false;
        }

        LOGGER.debug("Enqueued {}", reconciliation);
        entries.addLast(reconciliation);
        waiting.add(reconciliation);
        notifyAll();
        return true;
    }

    /* test */ synchronized boolean isWaiting(SimplifiedReconciliation reconciliation) {
        return waiting.contains(reconciliation);
    }

    public synchronized int size() {
        return entries.size();
    }
}
