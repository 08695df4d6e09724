/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class ShutdownHookTest {
    @Test
    public void testStepsRunInReverseOrder() {
        List<String> stopped = new ArrayList<>();
        ShutdownHook hook = new ShutdownHook();
        hook.register("client", () -> stopped.add("client"));
        hook.register("server", () -> stopped.add("server"));
        hook.register("controllers", () -> stopped.add("controllers"));

        hook.run();

        assertThat(stopped, contains("controllers", "server", "client"));
    }

    @Test
    public void testFailingStepDoesNotStopTheOthers() {
        List<String> stopped = new ArrayList<>();
        ShutdownHook hook = new ShutdownHook();
        hook.register("client", () -> stopped.add("client"));
        hook.register("broken", () -> {
            throw new IllegalStateException("Boom");
        });

        hook.run();

        assertThat(stopped, contains("client"));
    }

    @Test
    public void testStepsRunOnlyOnce() {
        List<String> stopped = new ArrayList<>();
        ShutdownHook hook = new ShutdownHook();
        hook.register("client", () -> stopped.add("client"));

        hook.run();
        hook.run();

        assertThat(stopped.size(), is(1));
    }
}
