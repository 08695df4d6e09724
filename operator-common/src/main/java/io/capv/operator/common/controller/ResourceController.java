/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import io.capv.operator.common.Annotations;
import io.capv.operator.common.InformerUtils;
import io.capv.operator.common.MetricsProvider;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.http.HealthCheck;
import io.capv.operator.common.metrics.ControllerMetricsHolder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Resource controller is responsible for queueing the reconciliations of one kind of custom resources. It does so by
 * watching the primary resources, by mapping the events of secondary resources to the primary resources which
 * depend on them, by accepting synthetic events and by triggering the periodical reconciliations. The actual
 * processing of the events is done by the controller loop threads.
 *
 * @param <T>   Type of the primary resource
 */
public class ResourceController<T extends HasMetadata> implements HealthCheck {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ResourceController.class);

    private final String kind;
    private final String watchedNamespace;
    private final long fullReconciliationIntervalMs;
    private final SharedIndexInformer<T> informer;
    private final List<SharedIndexInformer<?>> secondaryInformers = new ArrayList<>();
    private final ControllerMetricsHolder metrics;
    private final ControllerQueue workQueue;
    private final List<ControllerLoop> threadPool;
    private final ScheduledExecutorService scheduledExecutor;

    /**
     * Creates the controller
     *
     * @param kind                          Kind of the primary resource
     * @param watchedNamespace              Namespace which is watched or * for all namespaces
     * @param informer                      Informer of the primary resource. It is started by this controller unless
     *                                      another controller sharing it started it already.
     * @param reconciler                    Reconciler which converges the primary resources
     * @param config                        Sizing of the controller
     * @param metricsProvider               Metrics provider
     */
    public ResourceController(String kind, String watchedNamespace, SharedIndexInformer<T> informer, Reconciler reconciler,
                              ControllerConfig config, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.watchedNamespace = watchedNamespace;
        this.informer = informer;
        this.fullReconciliationIntervalMs = config.fullReconciliationIntervalMs();
        this.informer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler(kind, isStarted, throwable));

        this.metrics = new ControllerMetricsHolder(kind, metricsProvider);
        this.workQueue = new ControllerQueue(config.workQueueSize(), metrics);
        this.scheduledExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, kind + "-ScheduledExecutor"));

        ReconciliationLockManager lockManager = new ReconciliationLockManager();
        RequeueBackOff backOff = new RequeueBackOff();

        this.threadPool = new ArrayList<>(config.threadPoolSize());
        for (int i = 0; i < config.threadPoolSize(); i++)  {
            threadPool.add(new ControllerLoop(kind + "-ControllerLoop-" + i, workQueue, lockManager, scheduledExecutor, backOff, reconciler, metrics));
        }
    }

    /**
     * @return  Kind of the resources reconciled by this controller
     */
    public String kind() {
        return kind;
    }

    /**
     * Adds a watch of a secondary resource. Every event of the secondary resource is mapped to the primary resources
     * which should be reconciled. It has to be called before the controller is started.
     *
     * @param type          Type of the secondary resource used in the log messages
     * @param secondary     Informer of the secondary resource. It can be shared with other controllers.
     * @param mapper        Maps a secondary resource to the primary resources which should be reconciled
     *
     * @param <S>   Type of the secondary resource
     */
    public <S extends HasMetadata> void watch(String type, SharedIndexInformer<S> secondary, Function<S, Collection<SimplifiedReconciliation>> mapper) {
        secondary.addEventHandler(new ResourceEventHandler<S>() {
            @Override
            public void onAdd(S resource) {
                enqueueMapped(type, resource, mapper, "ADDED");
            }

            @Override
            public void onUpdate(S oldResource, S newResource) {
                enqueueMapped(type, newResource, mapper, "MODIFIED");
            }

            @Override
            public void onDelete(S resource, boolean deletedFinalStateUnknown) {
                enqueueMapped(type, resource, mapper, "DELETED");
            }
        });
        secondary.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler(type, isStarted, throwable));

        secondaryInformers.add(secondary);
    }

    private <S extends HasMetadata> void enqueueMapped(String type, S resource, Function<S, Collection<SimplifiedReconciliation>> mapper, String action) {
        LOGGER.debugOp("{} {} in namespace {} was {}", type, resource.getMetadata().getName(), resource.getMetadata().getNamespace(), action);

        try {
            for (SimplifiedReconciliation reconciliation : mapper.apply(resource)) {
                enqueue(reconciliation);
            }
        } catch (RuntimeException e) {
            LOGGER.warnOp("Failed to map {} {} to {} resources", type, resource.getMetadata().getName(), kind, e);
        }
    }

    /**
     * Enqueues a reconciliation of the primary resource. Used by the watches, by the periodic reconciliation and as
     * the consumer of the synthetic events.
     *
     * @param reconciliation    Reconciliation which should be enqueued
     */
    public void enqueue(SimplifiedReconciliation reconciliation) {
        workQueue.enqueue(reconciliation);
    }

    private void enqueue(T resource, String action) {
        LOGGER.infoOp("{} {} in namespace {} was {}", kind, resource.getMetadata().getName(), resource.getMetadata().getNamespace(), action);
        workQueue.enqueue(new SimplifiedReconciliation(kind, resource.getMetadata().getNamespace(), resource.getMetadata().getName()));
    }

    /**
     * @return  True when all informers are synced
     */
    protected boolean isSynced() {
        return informer.hasSynced() && secondaryInformers.stream().allMatch(SharedIndexInformer::hasSynced);
    }

    /**
     * Starts the controller: its informers, its loop threads and the periodic reconciliation
     */
    public void start() {
        informer.addEventHandler(new PrimaryEventHandler());

        LOGGER.infoOp("Starting the {} informers", kind);
        startIfNotRunning(informer);
        secondaryInformers.forEach(ResourceController::startIfNotRunning);

        while (!isSynced())   {
            LOGGER.infoOp("Waiting for the {} informers to sync", kind);
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while waiting for informers to sync", e);
                Thread.currentThread().interrupt();
                return;
            }
        }

        // The loops are started only once the informers are synced
        LOGGER.infoOp("Starting {} controller loops", kind);
        threadPool.forEach(AbstractControllerLoop::start);

        scheduledExecutor.scheduleAtFixedRate(this::periodicReconciliation, fullReconciliationIntervalMs, fullReconciliationIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Informers can be shared between controllers. The first controller to start starts them.
     */
    private static void startIfNotRunning(SharedIndexInformer<?> informer) {
        if (!informer.isRunning()) {
            informer.start();
        }
    }

    /**
     * Stops the controller and all its controller loop threads
     */
    public void stop() {
        LOGGER.infoOp("Stopping {} scheduled executor service", kind);
        scheduledExecutor.shutdownNow();

        LOGGER.infoOp("Stopping {} controller loops", kind);
        threadPool.forEach(t -> {
            try {
                t.stop();
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while stopping controller loop", e);
            }
        });

        List<SharedIndexInformer<?>> all = new ArrayList<>(secondaryInformers);
        all.add(informer);
        InformerUtils.stopAll(5_000L, all.toArray(new SharedIndexInformer<?>[0]));
    }

    /*test*/ void periodicReconciliation() {
        LOGGER.infoOp("Triggering periodic reconciliation of {} resources for namespace {}", kind, watchedNamespace);
        metrics.periodicReconciliationsCounter(watchedNamespace).increment();

        for (T resource : informer.getStore().list()) {
            workQueue.enqueue(new SimplifiedReconciliation(kind, resource.getMetadata().getNamespace(), resource.getMetadata().getName(), "timer"));
        }
    }

    /**
     * @return  True when all controller loops are running
     */
    @Override
    public boolean isReady() {
        return !threadPool.isEmpty() && threadPool.stream().allMatch(AbstractControllerLoop::isRunning);
    }

    /**
     * @return  True when all controller loop threads and informers are alive
     */
    @Override
    public boolean isAlive() {
        return threadPool.stream().allMatch(AbstractControllerLoop::isAlive)
                && informer.isRunning()
                && secondaryInformers.stream().allMatch(SharedIndexInformer::isRunning);
    }

    /**
     * Event handler of the primary informer
     */
    private class PrimaryEventHandler implements ResourceEventHandler<T> {
        @Override
        public void onAdd(T resource) {
            metrics.resourceCounter(watchedNamespace).incrementAndGet();

            if (Annotations.isReconciliationPausedWithAnnotation(resource)) {
                metrics.pausedResourceCounter(watchedNamespace).incrementAndGet();
            }

            enqueue(resource, "ADDED");
        }

        @Override
        public void onUpdate(T oldResource, T newResource) {
            boolean wasPaused = Annotations.isReconciliationPausedWithAnnotation(oldResource);
            boolean isPaused = Annotations.isReconciliationPausedWithAnnotation(newResource);

            if (wasPaused && !isPaused) {
                metrics.pausedResourceCounter(watchedNamespace).decrementAndGet();
            } else if (!wasPaused && isPaused) {
                metrics.pausedResourceCounter(watchedNamespace).incrementAndGet();
            }

            enqueue(newResource, "MODIFIED");
        }

        @Override
        public void onDelete(T resource, boolean deletedFinalStateUnknown) {
            metrics.resourceCounter(watchedNamespace).decrementAndGet();

            if (Annotations.isReconciliationPausedWithAnnotation(resource)) {
                metrics.pausedResourceCounter(watchedNamespace).decrementAndGet();
            }

            enqueue(resource, "DELETED");
        }
    }

    /**
     * Controller loop which delegates to the reconciler
     */
    static class ControllerLoop extends AbstractControllerLoop {
        private final Reconciler reconciler;
        private final ControllerMetricsHolder metrics;

        ControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ScheduledExecutorService scheduledExecutor,
                       RequeueBackOff backOff, Reconciler reconciler, ControllerMetricsHolder metrics) {
            super(name, workQueue, lockManager, scheduledExecutor, backOff);
            this.reconciler = reconciler;
            this.metrics = metrics;
        }

        @Override
        protected ReconcileResult reconcile(Reconciliation reconciliation) {
            LOGGER.debugCr(reconciliation, "{} will be reconciled", reconciliation.kind());
            return reconciler.reconcile(reconciliation);
        }

        @Override
        protected ControllerMetricsHolder metrics() {
            return metrics;
        }
    }
}
