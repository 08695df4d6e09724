/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconcileResultTest {
    @Test
    public void testDone() {
        assertThat(ReconcileResult.done().isRequeue(), is(false));
        assertThat(ReconcileResult.done().getRequeueAfter(), is(nullValue()));
    }

    @Test
    public void testMergeKeepsShorterRequeue() {
        ReconcileResult tenSeconds = ReconcileResult.requeueAfter(Duration.ofSeconds(10));
        ReconcileResult twoMinutes = ReconcileResult.requeueAfter(Duration.ofMinutes(2));

        assertThat(tenSeconds.merge(twoMinutes), is(tenSeconds));
        assertThat(twoMinutes.merge(tenSeconds), is(tenSeconds));
        assertThat(ReconcileResult.done().merge(twoMinutes), is(twoMinutes));
        assertThat(twoMinutes.merge(ReconcileResult.done()), is(twoMinutes));
        assertThat(ReconcileResult.done().merge(ReconcileResult.done()), is(ReconcileResult.done()));
    }
}
