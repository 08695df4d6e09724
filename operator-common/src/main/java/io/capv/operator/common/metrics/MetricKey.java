/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.metrics;

/**
 * Identifies one meter of a holder: the metric name and the namespace it is tagged with
 *
 * @param metric    Metric name
 * @param namespace Namespace tag
 */
public record MetricKey(String metric, String namespace) {
}
