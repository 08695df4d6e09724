/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.machine;

import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.operator.common.model.Labels;

/**
 * Provisioning states of a VSphereMachine. The state is not stored anywhere, it is computed from the observed
 * resources on every reconciliation.
 */
public enum MachineProvisioningState {
    ERROR(null),
    WAITING_FOR_CLUSTER_INFRASTRUCTURE(ConditionReasons.WAITING_FOR_CLUSTER_INFRASTRUCTURE),
    WAITING_FOR_CONTROL_PLANE(ConditionReasons.WAITING_FOR_CONTROL_PLANE_AVAILABLE),
    WAITING_FOR_BOOTSTRAP_DATA(ConditionReasons.WAITING_FOR_BOOTSTRAP_DATA),
    VM_RECONCILING(ConditionReasons.CLONING),
    WAITING_FOR_PROVIDER_ID(ConditionReasons.WAITING_FOR_PROVIDER_ID),
    WAITING_FOR_NETWORK(ConditionReasons.WAITING_FOR_NETWORK_ADDRESS),
    READY(null);

    private final String reason;

    MachineProvisioningState(String reason) {
        this.reason = reason;
    }

    /**
     * @return  Reason of the VMProvisioned condition while the machine is in this state
     */
    public String reason() {
        return reason;
    }

    /**
     * Evaluates the states which precede the creation of the VM
     *
     * @param vsphereMachine            The VSphereMachine
     * @param machine                   Its Machine
     * @param cluster                   The Cluster
     * @param firstControlPlaneMachine  Whether the machine is the first control plane member of the cluster
     *
     * @return  {@link #VM_RECONCILING} when the VM can be created, the blocking state otherwise
     */
    public static MachineProvisioningState beforeVm(VSphereMachine vsphereMachine, Machine machine, Cluster cluster, boolean firstControlPlaneMachine) {
        if (vsphereMachine.getStatus() != null
                && (vsphereMachine.getStatus().getFailureReason() != null || vsphereMachine.getStatus().getFailureMessage() != null)) {
            return ERROR;
        } else if (cluster.getStatus() == null || !cluster.getStatus().isInfrastructureReady()) {
            return WAITING_FOR_CLUSTER_INFRASTRUCTURE;
        }

        boolean controlPlaneInitialized = cluster.getStatus().isControlPlaneInitialized();
        if (!controlPlaneInitialized && !(Labels.fromResource(machine).isControlPlane() && firstControlPlaneMachine)) {
            return WAITING_FOR_CONTROL_PLANE;
        } else if (machine.getSpec() == null
                || machine.getSpec().getBootstrap() == null
                || machine.getSpec().getBootstrap().getDataSecretName() == null
                || machine.getSpec().getBootstrap().getDataSecretName().isEmpty()) {
            return WAITING_FOR_BOOTSTRAP_DATA;
        }

        return VM_RECONCILING;
    }

    /**
     * Evaluates the states which follow the creation of the VM
     *
     * @param vsphereMachine    The VSphereMachine with the provider ID already copied from the VM
     * @param vm                The VSphereVM
     *
     * @return  {@link #READY} or the state the machine waits in
     */
    public static MachineProvisioningState afterVm(VSphereMachine vsphereMachine, VSphereVM vm) {
        if (vm.getStatus() == null || !vm.getStatus().isReady()) {
            return VM_RECONCILING;
        } else if (vsphereMachine.getSpec().getProviderID() == null || vsphereMachine.getSpec().getProviderID().isEmpty()) {
            return WAITING_FOR_PROVIDER_ID;
        }

        int desiredDevices = vsphereMachine.getSpec().getNetwork() != null && vsphereMachine.getSpec().getNetwork().getDevices() != null
                ? vsphereMachine.getSpec().getNetwork().getDevices().size()
                : 0;
        int realizedDevices = vm.getStatus().getNetwork() != null ? vm.getStatus().getNetwork().size() : 0;
        boolean hasAddress = vm.getStatus().getAddresses() != null && !vm.getStatus().getAddresses().isEmpty();

        if (realizedDevices != desiredDevices || !hasAddress) {
            return WAITING_FOR_NETWORK;
        }

        return READY;
    }
}
