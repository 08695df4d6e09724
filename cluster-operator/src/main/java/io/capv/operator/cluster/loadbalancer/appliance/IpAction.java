/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer.appliance;

/**
 * Actions on the IP pools of the appliance
 */
public enum IpAction {
    /**
     * Allocates a free address from the pool
     */
    ALLOCATE,

    /**
     * Returns an address to the pool
     */
    RELEASE
}
