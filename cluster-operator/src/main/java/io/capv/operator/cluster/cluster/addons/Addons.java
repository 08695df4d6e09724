/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.CloudProviderConfiguration;
import io.capv.api.model.vsphere.VSphereCluster;
import io.fabric8.kubernetes.api.model.Toleration;
import io.fabric8.kubernetes.api.model.TolerationBuilder;

import java.util.List;

/**
 * Shared bits of the add-ons
 */
class Addons {
    static final String KUBE_SYSTEM = "kube-system";

    private Addons() { }

    /**
     * @param vsphereCluster    The VSphereCluster
     *
     * @return  The cloud provider configuration of the cluster
     *
     * @throws IllegalStateException when the cluster configures no virtual center
     */
    static CloudProviderConfiguration requireVirtualCenters(VSphereCluster vsphereCluster) {
        CloudProviderConfiguration cpc = vsphereCluster.getSpec() != null ? vsphereCluster.getSpec().getCloudProviderConfiguration() : null;

        if (cpc == null || cpc.getVirtualCenter() == null || cpc.getVirtualCenter().isEmpty()) {
            throw new IllegalStateException("No virtual centers defined for VSphereCluster "
                    + vsphereCluster.getMetadata().getNamespace() + "/" + vsphereCluster.getMetadata().getName());
        }

        return cpc;
    }

    /**
     * @param vsphereCluster    The VSphereCluster
     *
     * @return  ID of the cluster used by the cloud provider
     */
    static String clusterId(VSphereCluster vsphereCluster) {
        return vsphereCluster.getMetadata().getNamespace() + "/" + vsphereCluster.getMetadata().getName();
    }

    /**
     * @return  Tolerations letting the add-ons run on the control plane before the nodes are initialized
     */
    static List<Toleration> controlPlaneTolerations() {
        return List.of(
                new TolerationBuilder().withKey("node.cloudprovider.kubernetes.io/uninitialized").withValue("true").withEffect("NoSchedule").build(),
                new TolerationBuilder().withKey("node-role.kubernetes.io/master").withEffect("NoSchedule").build(),
                new TolerationBuilder().withKey("node-role.kubernetes.io/control-plane").withEffect("NoSchedule").build(),
                new TolerationBuilder().withKey("node.kubernetes.io/not-ready").withEffect("NoSchedule").build());
    }
}
