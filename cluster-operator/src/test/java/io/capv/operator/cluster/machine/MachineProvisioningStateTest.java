/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.machine;

import io.capv.api.model.cluster.Bootstrap;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.ClusterStatus;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.cluster.MachineSpec;
import io.capv.api.model.vsphere.NetworkDeviceSpec;
import io.capv.api.model.vsphere.NetworkSpec;
import io.capv.api.model.vsphere.NetworkStatus;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereMachineSpec;
import io.capv.api.model.vsphere.VSphereMachineStatus;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.vsphere.VSphereVMStatus;
import io.capv.operator.common.model.Labels;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class MachineProvisioningStateTest {
    private static Cluster cluster(boolean infrastructureReady, boolean controlPlaneInitialized) {
        ClusterStatus status = new ClusterStatus();
        status.setInfrastructureReady(infrastructureReady);
        status.setControlPlaneInitialized(controlPlaneInitialized);

        Cluster cluster = new Cluster();
        cluster.setStatus(status);
        return cluster;
    }

    private static Machine machine(boolean controlPlane, String dataSecretName) {
        Labels labels = Labels.forCluster("my-cluster");
        if (controlPlane) {
            labels = labels.withControlPlane();
        }

        MachineSpec spec = new MachineSpec();
        if (dataSecretName != null) {
            Bootstrap bootstrap = new Bootstrap();
            bootstrap.setDataSecretName(dataSecretName);
            spec.setBootstrap(bootstrap);
        }

        Machine machine = new Machine();
        machine.setMetadata(new ObjectMetaBuilder().withName("m").withLabels(labels.toMap()).build());
        machine.setSpec(spec);
        return machine;
    }

    private static VSphereMachine vsphereMachine(String providerId, int devices) {
        VSphereMachineSpec spec = new VSphereMachineSpec();
        spec.setProviderID(providerId);

        if (devices > 0) {
            NetworkSpec network = new NetworkSpec();
            network.setDevices(Collections.nCopies(devices, new NetworkDeviceSpec()));
            spec.setNetwork(network);
        }

        VSphereMachine machine = new VSphereMachine();
        machine.setSpec(spec);
        machine.setStatus(new VSphereMachineStatus());
        return machine;
    }

    private static VSphereVM vm(boolean ready, int devices, List<String> addresses) {
        VSphereVMStatus status = new VSphereVMStatus();
        status.setReady(ready);
        status.setNetwork(Collections.nCopies(devices, new NetworkStatus()));
        status.setAddresses(addresses);

        VSphereVM vm = new VSphereVM();
        vm.setStatus(status);
        return vm;
    }

    @Test
    public void testBeforeVm() {
        VSphereMachine vsphereMachine = vsphereMachine(null, 0);

        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(true, "data"), cluster(false, false), true),
                is(MachineProvisioningState.WAITING_FOR_CLUSTER_INFRASTRUCTURE));
        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(false, "data"), cluster(true, false), false),
                is(MachineProvisioningState.WAITING_FOR_CONTROL_PLANE));
        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(true, "data"), cluster(true, false), false),
                is(MachineProvisioningState.WAITING_FOR_CONTROL_PLANE));
        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(true, null), cluster(true, false), true),
                is(MachineProvisioningState.WAITING_FOR_BOOTSTRAP_DATA));
        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(true, "data"), cluster(true, false), true),
                is(MachineProvisioningState.VM_RECONCILING));
        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(false, "data"), cluster(true, true), false),
                is(MachineProvisioningState.VM_RECONCILING));
    }

    @Test
    public void testFailedMachine() {
        VSphereMachine vsphereMachine = vsphereMachine(null, 0);
        vsphereMachine.getStatus().setFailureReason("CloneFailed");

        assertThat(MachineProvisioningState.beforeVm(vsphereMachine, machine(false, "data"), cluster(true, true), false),
                is(MachineProvisioningState.ERROR));
    }

    @Test
    public void testAfterVm() {
        assertThat(MachineProvisioningState.afterVm(vsphereMachine(null, 1), vm(false, 0, null)),
                is(MachineProvisioningState.VM_RECONCILING));
        assertThat(MachineProvisioningState.afterVm(vsphereMachine(null, 1), vm(true, 1, List.of("10.0.0.10"))),
                is(MachineProvisioningState.WAITING_FOR_PROVIDER_ID));
        assertThat(MachineProvisioningState.afterVm(vsphereMachine("vsphere://uuid", 2), vm(true, 1, List.of("10.0.0.10"))),
                is(MachineProvisioningState.WAITING_FOR_NETWORK));
        assertThat(MachineProvisioningState.afterVm(vsphereMachine("vsphere://uuid", 1), vm(true, 1, List.of())),
                is(MachineProvisioningState.WAITING_FOR_NETWORK));
        assertThat(MachineProvisioningState.afterVm(vsphereMachine("vsphere://uuid", 1), vm(true, 1, List.of("10.0.0.10"))),
                is(MachineProvisioningState.READY));
    }
}
