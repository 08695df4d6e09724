/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.metrics;

import io.capv.operator.common.MetricsProvider;
import io.micrometer.core.instrument.Counter;

/**
 * Adds the work queue meters to the shared controller meters
 */
public class ControllerMetricsHolder extends MetricsHolder {
    public static final String METRICS_RECONCILIATIONS_ALREADY_ENQUEUED = METRICS_RECONCILIATIONS + ".already.enqueued";
    public static final String METRICS_RECONCILIATIONS_REQUEUED = METRICS_RECONCILIATIONS + ".requeued";

    public ControllerMetricsHolder(String kind, MetricsProvider metricsProvider) {
        super(kind, metricsProvider);
    }

    /**
     * A steadily growing value usually means the resync period is shorter than the time the queue needs to drain.
     *
     * @param namespace     Namespace of the resource
     *
     * @return  Counter of events folded into an entry already waiting in the queue
     */
    public Counter alreadyEnqueuedReconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS_ALREADY_ENQUEUED, "Number of events for resources which were already waiting in the queue");
    }

    /**
     * @param namespace     Namespace of the resource
     *
     * @return  Counter of reconciliations scheduled again, either on request or after a failure
     */
    public Counter requeuedReconciliationsCounter(String namespace) {
        return counter(namespace, METRICS_RECONCILIATIONS_REQUEUED, "Number of reconciliations scheduled to run again later");
    }
}
