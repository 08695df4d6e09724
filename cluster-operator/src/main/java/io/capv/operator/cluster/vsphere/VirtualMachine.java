/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

import io.capv.api.model.vsphere.NetworkStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Virtual machine as seen by the virtualization backend
 *
 * @param name      Name of the VM
 * @param biosUuid  BIOS UUID or null when the VM was not created yet
 * @param state     State of the VM
 * @param network   Network interfaces in the order of the devices in the clone spec
 */
public record VirtualMachine(String name, String biosUuid, VirtualMachineState state, List<NetworkStatus> network) {
    /**
     * @param name  Name of the VM
     *
     * @return  VM which does not exist
     */
    public static VirtualMachine notFound(String name) {
        return new VirtualMachine(name, null, VirtualMachineState.NOT_FOUND, List.of());
    }

    /**
     * @return  All IP addresses of all interfaces in the interface order
     */
    public List<String> addresses() {
        List<String> addresses = new ArrayList<>();

        if (network != null) {
            for (NetworkStatus status : network) {
                if (status.getIpAddrs() != null) {
                    addresses.addAll(status.getIpAddrs());
                }
            }
        }

        return addresses;
    }
}
