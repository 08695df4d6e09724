/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.operator.common.Annotations;
import io.capv.operator.common.model.Labels;
import io.capv.operator.common.resource.OwnerReferences;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lookups of the Cluster API resources which the infrastructure resources belong to
 */
public class ClusterResources {
    private final KubernetesClient client;

    /**
     * @param client    Kubernetes client of the management cluster
     */
    public ClusterResources(KubernetesClient client) {
        this.client = client;
    }

    /**
     * The name of the owning Cluster from the owner reference, or from the cluster name label when there is no owner
     * reference.
     *
     * @param resource  Resource
     *
     * @return  Name of the cluster or null
     */
    public static String clusterName(HasMetadata resource) {
        OwnerReference owner = OwnerReferences.findByKind(resource, Cluster.RESOURCE_KIND);

        if (owner != null) {
            return owner.getName();
        }

        return Labels.fromResource(resource).clusterName();
    }

    /**
     * @param resource  Resource owned by a Cluster
     *
     * @return  The Cluster from the owner reference of the resource or null when there is none or it does not exist
     */
    public Cluster ownerCluster(HasMetadata resource) {
        OwnerReference owner = OwnerReferences.findByKind(resource, Cluster.RESOURCE_KIND);

        if (owner == null) {
            return null;
        }

        return cluster(resource.getMetadata().getNamespace(), owner.getName());
    }

    /**
     * @param resource  Resource with the cluster name label
     *
     * @return  The Cluster from the cluster name label or null when there is no label or the Cluster does not exist
     */
    public Cluster labelledCluster(HasMetadata resource) {
        String name = Labels.fromResource(resource).clusterName();

        if (name == null) {
            return null;
        }

        return cluster(resource.getMetadata().getNamespace(), name);
    }

    /**
     * @param namespace     Namespace
     * @param name          Name
     *
     * @return  The Cluster or null
     */
    public Cluster cluster(String namespace, String name) {
        return Crds.clusterOperation(client).inNamespace(namespace).withName(name).get();
    }

    /**
     * @param cluster   Cluster
     *
     * @return  The VSphereCluster referenced as the infrastructure of the Cluster or null
     */
    public VSphereCluster infrastructureCluster(Cluster cluster) {
        ObjectReference ref = cluster.getSpec() != null ? cluster.getSpec().getInfrastructureRef() : null;

        if (ref == null || !VSphereCluster.RESOURCE_KIND.equals(ref.getKind())) {
            return null;
        }

        return Crds.vsphereClusterOperation(client).inNamespace(cluster.getMetadata().getNamespace()).withName(ref.getName()).get();
    }

    /**
     * @param machine   Machine
     *
     * @return  The VSphereMachine referenced as the infrastructure of the Machine or null
     */
    public VSphereMachine infrastructureMachine(Machine machine) {
        ObjectReference ref = machine.getSpec() != null ? machine.getSpec().getInfrastructureRef() : null;

        if (ref == null || !VSphereMachine.RESOURCE_KIND.equals(ref.getKind())) {
            return null;
        }

        return Crds.vsphereMachineOperation(client).inNamespace(machine.getMetadata().getNamespace()).withName(ref.getName()).get();
    }

    /**
     * @param namespace     Namespace
     * @param clusterName   Name of the cluster
     *
     * @return  All Machines of the cluster in the order returned by the API server
     */
    public List<Machine> machines(String namespace, String clusterName) {
        return Crds.machineOperation(client)
                .inNamespace(namespace)
                .withLabel(Constants.CLUSTER_NAME_LABEL, clusterName)
                .list()
                .getItems();
    }

    /**
     * @param namespace     Namespace
     * @param clusterName   Name of the cluster
     *
     * @return  The control plane Machines of the cluster in the order returned by the API server
     */
    public List<Machine> controlPlaneMachines(String namespace, String clusterName) {
        return machines(namespace, clusterName).stream()
                .filter(machine -> Labels.fromResource(machine).isControlPlane())
                .collect(Collectors.toList());
    }

    /**
     * Reconciliation is paused when the Cluster is paused or when the Cluster or the resource carry the pause
     * annotation.
     *
     * @param cluster   Cluster
     * @param resource  Reconciled resource
     *
     * @return  True if the reconciliation of the resource is paused
     */
    public static boolean isPaused(Cluster cluster, HasMetadata resource) {
        return (cluster != null && cluster.getSpec() != null && cluster.getSpec().isPaused())
                || Annotations.isReconciliationPausedWithAnnotation(cluster)
                || Annotations.isReconciliationPausedWithAnnotation(resource);
    }
}
