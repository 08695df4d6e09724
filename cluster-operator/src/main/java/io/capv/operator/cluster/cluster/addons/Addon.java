/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.Reconciliation;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Component installed into the workload cluster. Installing an add-on only creates the resources which do not exist
 * yet, so it can be repeated safely.
 */
public interface Addon {
    /**
     * @return  Name of the add-on used in logs and conditions
     */
    String name();

    /**
     * Installs the add-on
     *
     * @param reconciliation    Reconciliation marker
     * @param workload          Client for the workload cluster
     * @param vsphereCluster    The VSphereCluster
     * @param credentials       vCenter credentials of the cluster
     */
    void install(Reconciliation reconciliation, KubernetesClient workload, VSphereCluster vsphereCluster, Credentials credentials);
}
