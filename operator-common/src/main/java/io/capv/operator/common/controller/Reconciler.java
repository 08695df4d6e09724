/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import io.capv.operator.common.Reconciliation;

/**
 * Converges one resource kind. Implementations read the current state of the resource themselves, run either the
 * deletion or the normal path and persist the outcome before returning.
 */
@FunctionalInterface
public interface Reconciler {
    /**
     * Reconciles the resource identified by the reconciliation. Unchecked exceptions are treated as transient
     * failures and the resource is retried with a back-off.
     *
     * @param reconciliation    Reconciliation identifying the resource
     *
     * @return  Result indicating whether the resource should be reconciled again later
     */
    ReconcileResult reconcile(Reconciliation reconciliation);
}
