/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;

/**
 * Installs the add-ons into a workload cluster in a fixed order
 */
public class AddonInstaller {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AddonInstaller.class);

    private final List<Addon> addons;

    /**
     * Creates the installer for the credentials Secret, the cloud controller manager and the CSI driver
     *
     * @param images    Default images of the add-ons
     */
    public AddonInstaller(AddonImages images) {
        this(List.of(new CloudCredentialsAddon(), new CloudProviderAddon(images), new StorageProviderAddon(images)));
    }

    /**
     * @param addons    Add-ons in the order of their installation
     */
    public AddonInstaller(List<Addon> addons) {
        this.addons = List.copyOf(addons);
    }

    /**
     * Installs all add-ons. The first failure stops the installation.
     *
     * @param reconciliation    Reconciliation marker
     * @param workload          Client for the workload cluster
     * @param vsphereCluster    The VSphereCluster
     * @param credentials       vCenter credentials of the cluster
     */
    public void install(Reconciliation reconciliation, KubernetesClient workload, VSphereCluster vsphereCluster, Credentials credentials) {
        for (Addon addon : addons) {
            LOGGER.debugCr(reconciliation, "Installing add-on {}", addon.name());
            addon.install(reconciliation, workload, vsphereCluster, credentials);
        }
    }
}
