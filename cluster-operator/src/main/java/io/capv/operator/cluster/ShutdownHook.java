/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Runs the registered shutdown steps one after another in the reverse order of their registration. Steps registered
 * first (the clients) are therefore stopped after the steps registered later (the controllers using them). A failing
 * step is logged and does not prevent the remaining steps from running.
 */
public class ShutdownHook implements Runnable {
    private static final Logger LOGGER = LogManager.getLogger(ShutdownHook.class);

    private final Deque<Step> steps = new ArrayDeque<>();

    @Override
    public void run() {
        LOGGER.info("Shutdown hook started");

        Step step;
        while ((step = nextStep()) != null) {
            LOGGER.info("Stopping {}", step.name());

            try {
                step.action().run();
            } catch (RuntimeException e) {
                LOGGER.error("Failed to stop {}", step.name(), e);
            }
        }

        LOGGER.info("Shutdown hook completed");
    }

    private synchronized Step nextStep() {
        return steps.pollFirst();
    }

    /**
     * Registers a step which should be run during the shutdown
     *
     * @param name      Name of the step used in the log messages
     * @param action    Action of the step
     */
    public synchronized void register(String name, Runnable action) {
        steps.push(new Step(name, action));
    }

    private record Step(String name, Runnable action) { }
}
