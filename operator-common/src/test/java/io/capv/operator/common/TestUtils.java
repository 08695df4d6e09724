/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.util.function.BooleanSupplier;

/**
 * Helpers shared by the tests of all modules
 */
public final class TestUtils {
    private static final Logger LOGGER = LogManager.getLogger(TestUtils.class);

    private TestUtils() { }

    /**
     * Polls the condition until it holds. Exceptions thrown by the condition count as not holding yet.
     *
     * @param description       What is awaited, used in the log and in the failure
     * @param pollIntervalMs    Pause between two polls
     * @param timeoutMs         Give up after this long
     * @param condition         The condition
     *
     * @return  Milliseconds left before the timeout
     */
    public static long waitFor(String description, long pollIntervalMs, long timeoutMs, BooleanSupplier condition) {
        LOGGER.debug("Waiting up to {} ms for {}", timeoutMs, description);
        long deadline = System.currentTimeMillis() + timeoutMs;

        for (;;) {
            if (holds(description, condition)) {
                return deadline - System.currentTimeMillis();
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                throw new AssertionError("Timed out after " + timeoutMs + " ms waiting for " + description);
            }

            try {
                Thread.sleep(Math.min(pollIntervalMs, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for " + description, e);
            }
        }
    }

    private static boolean holds(String description, BooleanSupplier condition) {
        try {
            return condition.getAsBoolean();
        } catch (RuntimeException e) {
            LOGGER.debug("Condition {} threw {}", description, e.toString());
            return false;
        }
    }

    /**
     * @return  A TCP port nobody listens on right now
     */
    public static int getFreePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
