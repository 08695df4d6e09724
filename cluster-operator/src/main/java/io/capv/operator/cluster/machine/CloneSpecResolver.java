/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.machine;

import io.capv.api.model.vsphere.CloudProviderConfiguration;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VirtualMachineCloneSpec;
import io.capv.api.model.vsphere.WorkspaceConfig;

/**
 * Fills the clone spec of a VSphereVM. The placement fields fall back from the requested value to the workspace of the
 * cloud provider configuration and then to the vCenter of the cluster. Fields which are already set in the VM are
 * never changed.
 */
public class CloneSpecResolver {
    private final String defaultServer;

    /**
     * @param defaultServer     vCenter used when neither the request nor the cluster configure one. Can be null.
     */
    public CloneSpecResolver(String defaultServer) {
        this.defaultServer = defaultServer;
    }

    /**
     * Copies the requested clone spec into the target
     *
     * @param target        Clone spec of the VSphereVM
     * @param requested     Clone spec requested by the VSphereMachine or the load balancer (can be null)
     * @param cluster       The VSphereCluster or null
     */
    public void resolve(VirtualMachineCloneSpec target, VirtualMachineCloneSpec requested, VSphereCluster cluster) {
        if (requested == null) {
            requested = new VirtualMachineCloneSpec();
        }

        WorkspaceConfig workspace = workspace(cluster);
        String clusterServer = cluster != null && cluster.getSpec() != null ? cluster.getSpec().getServer() : null;

        target.setServer(keep(target.getServer(), requested.getServer(), workspace.getServer(), clusterServer, defaultServer));
        target.setDatacenter(keep(target.getDatacenter(), requested.getDatacenter(), workspace.getDatacenter()));
        target.setDatastore(keep(target.getDatastore(), requested.getDatastore(), workspace.getDatastore()));
        target.setFolder(keep(target.getFolder(), requested.getFolder(), workspace.getFolder()));
        target.setResourcePool(keep(target.getResourcePool(), requested.getResourcePool(), workspace.getResourcePool()));
        target.setTemplate(keep(target.getTemplate(), requested.getTemplate()));
        target.setStoragePolicyName(keep(target.getStoragePolicyName(), requested.getStoragePolicyName()));

        if (target.getNetwork() == null) {
            target.setNetwork(requested.getNetwork());
        }

        if (target.getNumCPUs() == 0) {
            target.setNumCPUs(requested.getNumCPUs());
        }

        if (target.getNumCoresPerSocket() == 0) {
            target.setNumCoresPerSocket(requested.getNumCoresPerSocket());
        }

        if (target.getMemoryMiB() == 0) {
            target.setMemoryMiB(requested.getMemoryMiB());
        }

        if (target.getDiskGiB() == 0) {
            target.setDiskGiB(requested.getDiskGiB());
        }
    }

    private static WorkspaceConfig workspace(VSphereCluster cluster) {
        if (cluster != null && cluster.getSpec() != null) {
            CloudProviderConfiguration cpc = cluster.getSpec().getCloudProviderConfiguration();

            if (cpc != null && cpc.getWorkspace() != null) {
                return cpc.getWorkspace();
            }
        }

        return new WorkspaceConfig();
    }

    private static String keep(String current, String... candidates) {
        if (!isEmpty(current)) {
            return current;
        }

        return firstNonEmpty(candidates);
    }

    /**
     * @param values    Candidate values in the order of their priority
     *
     * @return  The first value which is neither null nor empty or null if there is none
     */
    static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (!isEmpty(value)) {
                return value;
            }
        }

        return null;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
