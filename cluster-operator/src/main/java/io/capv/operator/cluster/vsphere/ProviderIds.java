/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * Provider IDs link the Kubernetes nodes with the vSphere VMs
 */
public class ProviderIds {
    /**
     * Prefix of the provider IDs used by the vSphere cloud provider
     */
    public static final String PREFIX = "vsphere://";

    private ProviderIds() { }

    /**
     * @param biosUuid  BIOS UUID of the VM
     *
     * @return  Provider ID or null when the UUID is not known yet
     */
    public static String fromBiosUuid(String biosUuid) {
        if (biosUuid == null || biosUuid.isEmpty()) {
            return null;
        }

        return PREFIX + biosUuid;
    }
}
