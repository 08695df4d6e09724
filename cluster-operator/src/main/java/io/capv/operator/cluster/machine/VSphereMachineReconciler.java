/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.machine;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereMachineStatus;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.cluster.vm.VSphereVMReconciler;
import io.capv.operator.cluster.vm.VSphereVMs;
import io.capv.operator.cluster.vsphere.ProviderIds;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.model.Labels;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.OwnerReferences;
import io.capv.operator.common.resource.ResourcePatcher;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reconciles the VSphereMachines. Each VSphereMachine is backed by a VSphereVM of the same name which is created once
 * the cluster infrastructure is ready and the bootstrap data are available. The provider ID, addresses and network
 * status of the machine are taken over from the VM.
 */
public class VSphereMachineReconciler implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(VSphereMachineReconciler.class);

    /**
     * Type of the node addresses reported for the machines
     */
    public static final String INTERNAL_IP = "InternalIP";

    private final KubernetesClient client;
    private final ClusterResources clusters;
    private final VSphereVMs vms;
    private final CloneSpecResolver cloneSpecResolver;
    private final Duration requeueInterval;

    /**
     * Constructs the reconciler
     *
     * @param client                Kubernetes client
     * @param cloneSpecResolver     Resolves the clone spec of the VMs
     * @param requeueInterval       Delay before a waiting machine is checked again
     */
    public VSphereMachineReconciler(KubernetesClient client, CloneSpecResolver cloneSpecResolver, Duration requeueInterval) {
        this.client = client;
        this.clusters = new ClusterResources(client);
        this.vms = new VSphereVMs(client);
        this.cloneSpecResolver = cloneSpecResolver;
        this.requeueInterval = requeueInterval;
    }

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        VSphereMachine vsphereMachine = Crds.vsphereMachineOperation(client).inNamespace(reconciliation.namespace()).withName(reconciliation.name()).get();

        if (vsphereMachine == null) {
            LOGGER.debugCr(reconciliation, "VSphereMachine no longer exists");
            return ReconcileResult.done();
        } else if (vsphereMachine.getSpec() == null) {
            LOGGER.warnCr(reconciliation, "VSphereMachine has no spec and will be ignored");
            return ReconcileResult.done();
        }

        Machine machine = ownerMachine(vsphereMachine);
        if (machine == null) {
            LOGGER.infoCr(reconciliation, "Waiting for the Machine controller to set the owner reference");
            return ReconcileResult.done();
        }

        Cluster cluster = clusters.labelledCluster(machine);
        if (cluster == null && machine.getSpec() != null && machine.getSpec().getClusterName() != null) {
            cluster = clusters.cluster(machine.getMetadata().getNamespace(), machine.getSpec().getClusterName());
        }

        if (cluster == null) {
            LOGGER.infoCr(reconciliation, "Machine {} is not associated with a Cluster", machine.getMetadata().getName());
            return ReconcileResult.done();
        } else if (ClusterResources.isPaused(cluster, vsphereMachine)) {
            LOGGER.infoCr(reconciliation, "Reconciliation is paused");
            return ReconcileResult.done();
        }

        if (vsphereMachine.getStatus() == null) {
            vsphereMachine.setStatus(new VSphereMachineStatus());
        }

        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(reconciliation, Crds.vsphereMachineOperation(client), vsphereMachine);
        Cluster owningCluster = cluster;

        return patcher.reconcile(() -> {
            if (Finalizers.isDeleting(vsphereMachine)) {
                return reconcileDelete(reconciliation, vsphereMachine);
            } else {
                return reconcileNormal(reconciliation, vsphereMachine, machine, owningCluster);
            }
        });
    }

    private Machine ownerMachine(VSphereMachine vsphereMachine) {
        OwnerReference owner = OwnerReferences.findByKind(vsphereMachine, Machine.RESOURCE_KIND);

        if (owner == null) {
            return null;
        }

        return Crds.machineOperation(client).inNamespace(vsphereMachine.getMetadata().getNamespace()).withName(owner.getName()).get();
    }

    private ReconcileResult reconcileNormal(Reconciliation reconciliation, VSphereMachine vsphereMachine, Machine machine, Cluster cluster) {
        VSphereMachineStatus status = vsphereMachine.getStatus();

        MachineProvisioningState state = MachineProvisioningState.beforeVm(vsphereMachine, machine, cluster, isFirstControlPlaneMachine(machine, cluster));
        LOGGER.debugCr(reconciliation, "Machine is in state {}", state);

        if (state == MachineProvisioningState.ERROR) {
            LOGGER.infoCr(reconciliation, "Machine is in a failed state ({}: {}) and will not be reconciled", status.getFailureReason(), status.getFailureMessage());
            return ReconcileResult.done();
        }

        Finalizers.add(vsphereMachine, Constants.MACHINE_FINALIZER);

        if (state != MachineProvisioningState.VM_RECONCILING) {
            Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, state.reason(), Condition.SEVERITY_INFO, null);
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        VSphereCluster vsphereCluster = clusters.infrastructureCluster(cluster);
        VSphereVM vm = vms.createOrUpdate(reconciliation, vsphereMachine.getMetadata().getNamespace(), vsphereMachine.getMetadata().getName(),
            desired -> desiredVm(desired, vsphereMachine, machine, cluster, vsphereCluster));

        if (vm.getStatus() != null && (vm.getStatus().getFailureReason() != null || vm.getStatus().getFailureMessage() != null)) {
            status.setFailureReason(vm.getStatus().getFailureReason());
            status.setFailureMessage(vm.getStatus().getFailureMessage());
        }

        if ((vsphereMachine.getSpec().getProviderID() == null || vsphereMachine.getSpec().getProviderID().isEmpty())
                && vm.getSpec() != null) {
            String providerId = ProviderIds.fromBiosUuid(vm.getSpec().getBiosUUID());

            if (providerId != null) {
                LOGGER.infoCr(reconciliation, "Setting provider ID {}", providerId);
                vsphereMachine.getSpec().setProviderID(providerId);
            }
        }

        if (vm.getStatus() != null) {
            status.setNetwork(vm.getStatus().getNetwork() != null ? new ArrayList<>(vm.getStatus().getNetwork()) : null);
            status.setAddresses(addresses(vm.getStatus().getAddresses()));
        }

        state = MachineProvisioningState.afterVm(vsphereMachine, vm);
        LOGGER.debugCr(reconciliation, "Machine is in state {}", state);

        if (state == MachineProvisioningState.WAITING_FOR_NETWORK && VSphereVMReconciler.isWaitingForStaticIpAllocation(vsphereMachine.getSpec().getNetwork())) {
            status.setReady(false);
            Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.WAITING_FOR_STATIC_IP_ALLOCATION, Condition.SEVERITY_INFO, null);
            return ReconcileResult.requeueAfter(requeueInterval);
        } else if (state != MachineProvisioningState.READY) {
            status.setReady(false);
            Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, state.reason(), Condition.SEVERITY_INFO, null);
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        status.setReady(true);
        Conditions.markTrue(status, ConditionTypes.VM_PROVISIONED);
        return ReconcileResult.done();
    }

    private void desiredVm(VSphereVM vm, VSphereMachine vsphereMachine, Machine machine, Cluster cluster, VSphereCluster vsphereCluster) {
        Labels labels = Labels.fromResource(vm).withClusterName(cluster.getMetadata().getName());
        if (Labels.fromResource(machine).isControlPlane()) {
            labels = labels.withControlPlane();
        }
        vm.getMetadata().setLabels(new HashMap<>(labels.toMap()));

        if (OwnerReferences.controllerOf(vm) == null) {
            OwnerReferences.add(vm, OwnerReferences.of(vsphereMachine, true));
        }

        vm.getSpec().setBootstrapRef(new ObjectReferenceBuilder()
                .withApiVersion("v1")
                .withKind("Secret")
                .withNamespace(machine.getMetadata().getNamespace())
                .withName(machine.getSpec().getBootstrap().getDataSecretName())
                .build());

        cloneSpecResolver.resolve(vm.getSpec(), vsphereMachine.getSpec(), vsphereCluster);
    }

    private boolean isFirstControlPlaneMachine(Machine machine, Cluster cluster) {
        if (!Labels.fromResource(machine).isControlPlane()) {
            return false;
        }

        List<Machine> controlPlane = clusters.controlPlaneMachines(machine.getMetadata().getNamespace(), cluster.getMetadata().getName());
        return controlPlane.stream()
                .min(Comparator.comparing((Machine m) -> creationTime(m), Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(m -> m.getMetadata().getName()))
                .map(first -> Objects.equals(first.getMetadata().getName(), machine.getMetadata().getName()))
                .orElse(true);
    }

    private static Instant creationTime(Machine machine) {
        String timestamp = machine.getMetadata().getCreationTimestamp();
        return timestamp != null ? Instant.parse(timestamp) : null;
    }

    private static List<NodeAddress> addresses(List<String> addresses) {
        if (addresses == null) {
            return null;
        }

        return addresses.stream().map(address -> new NodeAddress(address, INTERNAL_IP)).collect(Collectors.toList());
    }

    private ReconcileResult reconcileDelete(Reconciliation reconciliation, VSphereMachine vsphereMachine) {
        VSphereMachineStatus status = vsphereMachine.getStatus();
        VSphereVM vm = vms.get(vsphereMachine.getMetadata().getNamespace(), vsphereMachine.getMetadata().getName());

        if (vm != null) {
            try {
                vms.delete(reconciliation, vm);
            } catch (KubernetesClientException e) {
                Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.DELETION_FAILED, Condition.SEVERITY_WARNING, "%s", e.getMessage());
                throw e;
            }

            Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.DELETING, Condition.SEVERITY_INFO, null);
            LOGGER.debugCr(reconciliation, "Waiting for VSphereVM {} to be deleted", vm.getMetadata().getName());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        LOGGER.infoCr(reconciliation, "VSphereVM is gone, removing the finalizer");
        Finalizers.remove(vsphereMachine, Constants.MACHINE_FINALIZER);
        return ReconcileResult.done();
    }
}
