/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a successful reconciliation. Either the reconciliation is done until the next event or it asks to be
 * run again after a delay. Waiting for external state is always expressed through a requeue and never by blocking
 * the controller loop.
 */
public final class ReconcileResult {
    private static final ReconcileResult DONE = new ReconcileResult(null);

    private final Duration requeueAfter;

    private ReconcileResult(Duration requeueAfter) {
        this.requeueAfter = requeueAfter;
    }

    /**
     * @return  Result indicating that nothing else has to be done until the next event
     */
    public static ReconcileResult done() {
        return DONE;
    }

    /**
     * @param delay     Delay after which the resource should be reconciled again
     *
     * @return  Result requesting another reconciliation after the delay
     */
    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(Objects.requireNonNull(delay));
    }

    /**
     * @return  True if the resource should be reconciled again
     */
    public boolean isRequeue() {
        return requeueAfter != null;
    }

    /**
     * @return  The requeue delay or null when no requeue was requested
     */
    public Duration getRequeueAfter() {
        return requeueAfter;
    }

    /**
     * Combines two results. The shorter requeue wins.
     *
     * @param other     The other result
     *
     * @return  Combined result
     */
    public ReconcileResult merge(ReconcileResult other) {
        if (!other.isRequeue()) {
            return this;
        } else if (!isRequeue()) {
            return other;
        } else {
            return requeueAfter.compareTo(other.requeueAfter) <= 0 ? this : other;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            return Objects.equals(requeueAfter, ((ReconcileResult) o).requeueAfter);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(requeueAfter);
    }

    @Override
    public String toString() {
        return isRequeue() ? "RequeueAfter(" + requeueAfter + ")" : "Done";
    }
}
