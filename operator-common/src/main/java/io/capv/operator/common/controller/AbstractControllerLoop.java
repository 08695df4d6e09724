/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.metrics.ControllerMetricsHolder;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Worker thread of a {@link ResourceController}. Several loops consume the same queue; the lock manager keeps two of
 * them from working on the same resource at once. After each pass the resource is either forgotten, scheduled again
 * after the delay it asked for, or (when the pass threw) scheduled again after an exponential back-off.
 */
public abstract class AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractControllerLoop.class);

    private static final long LOCK_TIMEOUT_MS = 1_000L;
    private static final Duration SLOW_RECONCILIATION = Duration.ofMinutes(1);

    private final String name;
    private final ControllerQueue workQueue;
    private final ReconciliationLockManager lockManager;
    private final ScheduledExecutorService scheduler;
    private final RequeueBackOff backOff;
    private final Thread thread;

    private volatile boolean stopping = false;
    private volatile boolean running = false;

    /**
     * @param name          Thread name
     * @param workQueue     Queue shared by the loops of one controller
     * @param lockManager   Per-resource locks shared by the loops of one controller
     * @param scheduler     Runs the delayed requeues and the slow reconciliation warnings
     * @param backOff       Delays applied after failed passes
     */
    public AbstractControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ScheduledExecutorService scheduler, RequeueBackOff backOff) {
        this.name = name;
        this.workQueue = workQueue;
        this.lockManager = lockManager;
        this.scheduler = scheduler;
        this.backOff = backOff;
        this.thread = new Thread(this::consume, name);
    }

    /**
     * Converges one resource. Throwing means the pass failed and is retried with back-off.
     *
     * @param reconciliation    The resource and the logging context
     *
     * @return  Whether and when the resource should be looked at again, null meaning never
     */
    protected abstract ReconcileResult reconcile(Reconciliation reconciliation);

    protected abstract ControllerMetricsHolder metrics();

    public void start() {
        LOGGER.debugOp("{}: starting", name);
        thread.start();
    }

    /**
     * Interrupts the thread and waits for it to finish the current pass
     *
     * @throws InterruptedException When interrupted while waiting
     */
    public void stop() throws InterruptedException {
        LOGGER.infoOp("{}: stopping", name);
        stopping = true;
        thread.interrupt();
        thread.join();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    private void consume() {
        running = true;

        while (!stopping) {
            try {
                reconcileWithLock(workQueue.take());
            } catch (InterruptedException e) {
                LOGGER.debugOp("{}: interrupted while waiting for work", name);
            } catch (RuntimeException e) {
                LOGGER.warnOp("{}: unexpected error", name, e);
            }
        }

        running = false;
        LOGGER.infoOp("{}: stopped", name);
    }

    /* test */ void reconcileWithLock(SimplifiedReconciliation entry) {
        String lock = entry.lockName();
        boolean acquired;

        try {
            acquired = lockManager.tryLock(lock, LOCK_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }

        if (!acquired) {
            LOGGER.warnOp("{}: {} is locked by another loop and goes back to the queue", name, entry);
            metrics().lockedReconciliationsCounter(entry.namespace()).increment();
            workQueue.enqueue(entry);
            return;
        }

        try {
            ReconcileResult result = timed(entry.toReconciliation());
            backOff.reset(lock);

            if (result != null && result.isRequeue()) {
                schedule(entry.withTrigger("requeue"), result.getRequeueAfter());
            }
        } catch (RuntimeException e) {
            Duration delay = backOff.nextDelay(lock);
            LOGGER.warnOp("{}: reconciliation of {} failed, retrying in {}", name, entry, delay, e);
            schedule(entry.withTrigger("backoff"), delay);
        } finally {
            lockManager.unlock(lock);
        }
    }

    private ReconcileResult timed(Reconciliation reconciliation) {
        String namespace = reconciliation.namespace();
        ScheduledFuture<?> slowWarning = scheduler.scheduleAtFixedRate(
                () -> LOGGER.infoCr(reconciliation, "Reconciliation is still in progress"),
                SLOW_RECONCILIATION.toMillis(), SLOW_RECONCILIATION.toMillis(), TimeUnit.MILLISECONDS);
        Timer.Sample sample = Timer.start(metrics().metricsProvider().meterRegistry());
        metrics().reconciliationsCounter(namespace).increment();

        try {
            ReconcileResult result = reconcile(reconciliation);
            metrics().successfulReconciliationsCounter(namespace).increment();
            LOGGER.debugCr(reconciliation, "Reconciled, result {}", result);
            return result;
        } catch (RuntimeException e) {
            metrics().failedReconciliationsCounter(namespace).increment();
            throw e;
        } finally {
            sample.stop(metrics().reconciliationsTimer(namespace));
            slowWarning.cancel(true);
        }
    }

    private void schedule(SimplifiedReconciliation entry, Duration delay) {
        metrics().requeuedReconciliationsCounter(entry.namespace()).increment();

        try {
            scheduler.schedule(() -> workQueue.enqueue(entry), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debugOp("{}: not requeueing {}, the scheduler is shut down", name, entry);
        }
    }
}
