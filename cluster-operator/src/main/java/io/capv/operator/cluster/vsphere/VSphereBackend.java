/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * Service provider interface of the virtualization drivers. Implementations are registered in
 * {@code META-INF/services/io.capv.operator.cluster.vsphere.VSphereBackend} and selected by their name.
 */
public interface VSphereBackend {
    /**
     * @return  Name used to select the backend in the operator configuration
     */
    String name();

    /**
     * @return  Session provider of this backend
     */
    SessionProvider sessionProvider();

    /**
     * @return  VM driver of this backend
     */
    VirtualMachineService virtualMachineService();
}
