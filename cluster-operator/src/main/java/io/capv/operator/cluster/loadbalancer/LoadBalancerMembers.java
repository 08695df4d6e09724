/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.common.model.Labels;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds the backend members of a load balancer. These are the Machines matching the selector of the load balancer
 * or, without a selector, the control plane Machines of the cluster. Machines whose VSphereMachine has no address yet
 * are left out.
 */
public class LoadBalancerMembers {
    private final KubernetesClient client;
    private final ClusterResources clusters;

    /**
     * @param client    Kubernetes client
     */
    public LoadBalancerMembers(KubernetesClient client) {
        this.client = client;
        this.clusters = new ClusterResources(client);
    }

    /**
     * @param namespace     Namespace of the load balancer
     * @param clusterName   Name of the cluster owning the load balancer
     * @param selector      Selector of the load balancer or null
     *
     * @return  Members sorted by name
     */
    public List<LoadBalancerMember> members(String namespace, String clusterName, LabelSelector selector) {
        List<Machine> machines;

        if (selector != null) {
            machines = Crds.machineOperation(client).inNamespace(namespace).list().getItems().stream()
                    .filter(machine -> Labels.fromResource(machine).matches(selector))
                    .collect(Collectors.toList());
        } else {
            machines = clusters.controlPlaneMachines(namespace, clusterName);
        }

        List<LoadBalancerMember> members = new ArrayList<>(machines.size());

        for (Machine machine : machines) {
            String address = address(clusters.infrastructureMachine(machine));

            if (address != null) {
                members.add(new LoadBalancerMember(machine.getMetadata().getName(), address));
            }
        }

        members.sort(Comparator.comparing(LoadBalancerMember::name));
        return members;
    }

    private static String address(VSphereMachine vsphereMachine) {
        if (vsphereMachine == null
                || vsphereMachine.getStatus() == null
                || vsphereMachine.getStatus().getAddresses() == null) {
            return null;
        }

        return vsphereMachine.getStatus().getAddresses().stream()
                .map(NodeAddress::getAddress)
                .filter(address -> address != null && !address.isEmpty())
                .findFirst()
                .orElse(null);
    }
}
