/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * State of a virtual machine as reported by the virtualization backend
 */
public enum VirtualMachineState {
    /**
     * The VM does not exist (anymore)
     */
    NOT_FOUND,

    /**
     * The VM is being cloned, powered on or deleted
     */
    PENDING,

    /**
     * The VM is running and has its network configured
     */
    READY
}
