/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.metrics;

import io.capv.operator.common.MetricsProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Meters shared by all controllers. Every meter is tagged with the resource kind of the holder and the namespace
 * it was requested for, and is created lazily the first time it is asked for.
 */
public abstract class MetricsHolder {
    public static final String METRICS_PREFIX = "capv.";

    public static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    public static final String METRICS_RECONCILIATIONS_PERIODICAL = METRICS_RECONCILIATIONS + ".periodical";
    public static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    public static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    public static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";
    public static final String METRICS_RECONCILIATIONS_LOCKED = METRICS_RECONCILIATIONS + ".locked";
    public static final String METRICS_RESOURCES = METRICS_PREFIX + "resources";
    public static final String METRICS_RESOURCES_PAUSED = METRICS_RESOURCES + ".paused";

    protected final String kind;
    protected final MetricsProvider metricsProvider;

    private final Map<MetricKey, Object> meters = new ConcurrentHashMap<>();

    /**
     * @param kind              Resource kind the meters are tagged with
     * @param metricsProvider   Provider creating the meters
     */
    public MetricsHolder(String kind, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.metricsProvider = metricsProvider;
    }

    public MetricsProvider metricsProvider() {
        return metricsProvider;
    }

    /**
     * Incremented once per resync of the whole namespace, not once per resource.
     */
    public Counter periodicReconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS_PERIODICAL, "Number of periodical resyncs of all resources");
    }

    public Counter reconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS, "Number of reconciliations of individual resources");
    }

    public Counter failedReconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS_FAILED, "Number of reconciliations which threw an error");
    }

    public Counter successfulReconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS_SUCCESSFUL, "Number of reconciliations which completed without an error");
    }

    public Timer reconciliationsTimer(String namespace) {
        return meter(namespace, METRICS_RECONCILIATIONS_DURATION,
                tags -> metricsProvider.timer(METRICS_RECONCILIATIONS_DURATION, "Duration of a single reconciliation", tags));
    }

    /**
     * Incremented when a reconciliation could not start because another one for the same resource held the lock.
     */
    public Counter lockedReconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS_LOCKED, "Number of reconciliations postponed because the resource was locked");
    }

    public AtomicInteger resourceCounter(String namespace) {
        return gauge(namespace, METRICS_RESOURCES, "Number of resources seen by the controller");
    }

    public AtomicInteger pausedResourceCounter(String namespace) {
        return gauge(namespace, METRICS_RESOURCES_PAUSED, "Number of resources seen by the controller but paused");
    }

    /**
     * @param namespace     Namespace of the resources. The value * stands for all namespaces and is tagged as empty.
     *
     * @return  Tags of a meter of this holder
     */
    protected Tags tags(String namespace) {
        return Tags.of("kind", kind, "namespace", "*".equals(namespace) ? "" : namespace);
    }

    protected Counter counter(String namespace, String metric, String description) {
        return meter(namespace, metric, tags -> metricsProvider.counter(metric, description, tags));
    }

    protected AtomicInteger gauge(String namespace, String metric, String description) {
        return meter(namespace, metric, tags -> metricsProvider.gauge(metric, description, tags));
    }

    @SuppressWarnings("unchecked")
    protected <M> M meter(String namespace, String metric, Function<Tags, M> factory) {
        return (M) meters.computeIfAbsent(new MetricKey(metric, namespace), key -> factory.apply(tags(namespace)));
    }
}
