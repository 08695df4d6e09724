/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster;

import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.common.APIEndpoint;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.operator.cluster.ClusterResources;
import io.fabric8.kubernetes.api.model.NodeAddress;

/**
 * Finds the control plane endpoint of a cluster
 */
public class ControlPlaneEndpoints {
    private final ClusterResources clusters;

    /**
     * @param clusters  Access to the cluster resources
     */
    public ControlPlaneEndpoints(ClusterResources clusters) {
        this.clusters = clusters;
    }

    /**
     * Resolves the endpoint. The endpoint of the Cluster wins, then the endpoint the VSphereCluster already has. When
     * neither is set, the control plane Machines are scanned in the order of the list and the first one whose
     * VSphereMachine has an address is used.
     *
     * @param cluster           The Cluster
     * @param vsphereCluster    The VSphereCluster
     *
     * @return  The endpoint or null if none can be found yet
     */
    public APIEndpoint resolve(Cluster cluster, VSphereCluster vsphereCluster) {
        APIEndpoint fromCluster = cluster.getSpec() != null ? cluster.getSpec().getControlPlaneEndpoint() : null;
        if (!APIEndpoint.isZero(fromCluster)) {
            return new APIEndpoint(fromCluster.getHost(), fromCluster.getPort());
        }

        APIEndpoint existing = vsphereCluster.getSpec().getControlPlaneEndpoint();
        if (!APIEndpoint.isZero(existing)) {
            return existing;
        }

        for (Machine machine : clusters.controlPlaneMachines(cluster.getMetadata().getNamespace(), cluster.getMetadata().getName())) {
            if (machine.getSpec() == null
                    || machine.getSpec().getBootstrap() == null
                    || machine.getSpec().getBootstrap().getDataSecretName() == null
                    || machine.getSpec().getBootstrap().getDataSecretName().isEmpty()) {
                continue;
            }

            String address = firstAddress(clusters.infrastructureMachine(machine));
            if (address != null) {
                return new APIEndpoint(address, Constants.DEFAULT_API_SERVER_PORT);
            }
        }

        return null;
    }

    private static String firstAddress(VSphereMachine vsphereMachine) {
        if (vsphereMachine == null || vsphereMachine.getStatus() == null || vsphereMachine.getStatus().getAddresses() == null) {
            return null;
        }

        for (NodeAddress address : vsphereMachine.getStatus().getAddresses()) {
            if (address.getAddress() != null && !address.getAddress().isEmpty()) {
                return address.getAddress();
            }
        }

        return null;
    }
}
