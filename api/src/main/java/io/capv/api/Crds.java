/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api;

import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.ClusterList;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.cluster.MachineList;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancer;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancerList;
import io.capv.api.model.loadbalancer.NSXTLoadBalancer;
import io.capv.api.model.loadbalancer.NSXTLoadBalancerList;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.capv.api.model.vsphere.VSphereClusterIdentityList;
import io.capv.api.model.vsphere.VSphereClusterList;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereMachineList;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.vsphere.VSphereVMList;
import io.capv.api.model.zone.VSphereDeploymentZone;
import io.capv.api.model.zone.VSphereDeploymentZoneList;
import io.capv.api.model.zone.VSphereFailureDomain;
import io.capv.api.model.zone.VSphereFailureDomainList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

/**
 * Typed client operations for the custom resources used by the operator
 */
@SuppressWarnings({"checkstyle:ClassFanOutComplexity"})
public class Crds {
    private Crds() {
    }

    public static MixedOperation<Cluster, ClusterList, Resource<Cluster>> clusterOperation(KubernetesClient client) {
        return client.resources(Cluster.class, ClusterList.class);
    }

    public static MixedOperation<Machine, MachineList, Resource<Machine>> machineOperation(KubernetesClient client) {
        return client.resources(Machine.class, MachineList.class);
    }

    public static MixedOperation<VSphereCluster, VSphereClusterList, Resource<VSphereCluster>> vsphereClusterOperation(KubernetesClient client) {
        return client.resources(VSphereCluster.class, VSphereClusterList.class);
    }

    /**
     * VSphereClusterIdentities are cluster scoped
     */
    public static MixedOperation<VSphereClusterIdentity, VSphereClusterIdentityList, Resource<VSphereClusterIdentity>> clusterIdentityOperation(KubernetesClient client) {
        return client.resources(VSphereClusterIdentity.class, VSphereClusterIdentityList.class);
    }

    public static MixedOperation<VSphereMachine, VSphereMachineList, Resource<VSphereMachine>> vsphereMachineOperation(KubernetesClient client) {
        return client.resources(VSphereMachine.class, VSphereMachineList.class);
    }

    public static MixedOperation<VSphereVM, VSphereVMList, Resource<VSphereVM>> vsphereVmOperation(KubernetesClient client) {
        return client.resources(VSphereVM.class, VSphereVMList.class);
    }

    public static MixedOperation<HAProxyLoadBalancer, HAProxyLoadBalancerList, Resource<HAProxyLoadBalancer>> haproxyLoadBalancerOperation(KubernetesClient client) {
        return client.resources(HAProxyLoadBalancer.class, HAProxyLoadBalancerList.class);
    }

    public static MixedOperation<NSXTLoadBalancer, NSXTLoadBalancerList, Resource<NSXTLoadBalancer>> nsxtLoadBalancerOperation(KubernetesClient client) {
        return client.resources(NSXTLoadBalancer.class, NSXTLoadBalancerList.class);
    }

    public static MixedOperation<VSphereDeploymentZone, VSphereDeploymentZoneList, Resource<VSphereDeploymentZone>> deploymentZoneOperation(KubernetesClient client) {
        return client.resources(VSphereDeploymentZone.class, VSphereDeploymentZoneList.class);
    }

    public static MixedOperation<VSphereFailureDomain, VSphereFailureDomainList, Resource<VSphereFailureDomain>> failureDomainOperation(KubernetesClient client) {
        return client.resources(VSphereFailureDomain.class, VSphereFailureDomainList.class);
    }
}
