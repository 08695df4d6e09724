/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the meters of the controllers. Tests plug in a provider backed by a simple registry.
 */
public interface MetricsProvider {
    /**
     * @return  Registry the meters are registered in
     */
    MeterRegistry meterRegistry();

    Counter counter(String name, String description, Tags tags);

    /**
     * Timers get histogram buckets suited to operations against vCenter, which range from milliseconds to minutes.
     */
    Timer timer(String name, String description, Tags tags);

    /**
     * @return  Holder of the gauge value. The gauge reads it whenever the registry is scraped.
     */
    AtomicInteger gauge(String name, String description, Tags tags);
}
