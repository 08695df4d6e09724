/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Delivers synthetic reconciliation events which do not come from a watch (for example when a background poller
 * notices that a workload cluster came online). Each resource kind registers the consumer which enqueues its events.
 */
public class GenericEventChannel {
    private static final Logger LOGGER = LogManager.getLogger(GenericEventChannel.class);

    private final Map<String, Consumer<SimplifiedReconciliation>> consumers = new ConcurrentHashMap<>();

    /**
     * Registers the consumer of the events for one resource kind
     *
     * @param kind      Resource kind
     * @param consumer  Consumer which enqueues the events
     */
    public void register(String kind, Consumer<SimplifiedReconciliation> consumer) {
        consumers.put(kind, consumer);
    }

    /**
     * Sends the event to the consumer registered for its kind
     *
     * @param event     Event which should be delivered
     *
     * @return  True if a consumer for the kind was registered
     */
    public boolean send(SimplifiedReconciliation event) {
        Consumer<SimplifiedReconciliation> consumer = consumers.get(event.kind());

        if (consumer != null) {
            LOGGER.debug("Sending {} event for {}", event.trigger(), event);
            consumer.accept(event);
            return true;
        } else {
            LOGGER.warn("No consumer registered for {} events. Event for {} is dropped.", event.kind(), event);
            return false;
        }
    }
}
