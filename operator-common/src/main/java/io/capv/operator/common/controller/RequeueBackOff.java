/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <p>Computes the delays used to re-queue resources whose reconciliation failed. The delays grow exponentially per
 * resource and are capped:</p>
 * <pre>  delay(n) = min(initial * 2 ^ (n - 1), max)</pre>
 * <p>A successful reconciliation resets the failure count of the resource.</p>
 */
public class RequeueBackOff {
    /**
     * Delay after the first failure
     */
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    /**
     * Maximal delay between two attempts
     */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);

    private final long initialDelayMs;
    private final long maxDelayMs;
    /*test*/ final ConcurrentHashMap<String, Integer> failures = new ConcurrentHashMap<>();

    /**
     * Creates the back-off with the default delays of 1 second doubling up to 5 minutes
     */
    public RequeueBackOff() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * @param initialDelay  Delay after the first failure
     * @param maxDelay      Maximal delay
     */
    public RequeueBackOff(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("The initial delay has to be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("The maximal delay cannot be shorter than the initial delay");
        }

        this.initialDelayMs = initialDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    /**
     * Records a failure of the resource and returns the delay before the next attempt
     *
     * @param key   Key of the resource
     *
     * @return  Delay before the next attempt
     */
    public Duration nextDelay(String key) {
        int attempt = failures.merge(key, 1, Integer::sum);

        long delay = initialDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }

        return Duration.ofMillis(Math.min(delay, maxDelayMs));
    }

    /**
     * Forgets the failures of the resource
     *
     * @param key   Key of the resource
     */
    public void reset(String key) {
        failures.remove(key);
    }
}
