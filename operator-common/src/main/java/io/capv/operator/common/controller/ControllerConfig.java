/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

/**
 * Sizing of a resource controller
 *
 * @param workQueueSize                 Capacity of the work queue
 * @param threadPoolSize                Number of controller loop threads
 * @param fullReconciliationIntervalMs  Interval of the periodic reconciliation of all resources
 */
public record ControllerConfig(int workQueueSize, int threadPoolSize, long fullReconciliationIntervalMs) {
}
