/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.http;

/**
 * Probes answered by {@link HealthCheckAndMetricsServer}. Both run on the Jetty request thread and must not block.
 */
public interface HealthCheck {
    /**
     * @return  False when the process should be restarted
     */
    boolean isAlive();

    /**
     * @return  True once the caches are synced and the controllers consume their queues
     */
    boolean isReady();
}
