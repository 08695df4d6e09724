/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vm;

import io.capv.api.Crds;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.NetworkDeviceSpec;
import io.capv.api.model.vsphere.NetworkSpec;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.vsphere.VSphereVMSpec;
import io.capv.operator.cluster.ResourceUtils;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.CredentialsProvider;
import io.capv.operator.cluster.vsphere.FakeVSphere;
import io.capv.operator.cluster.vsphere.VSphereException;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.capv.operator.cluster.ResourceUtils.NAMESPACE;
import static io.capv.operator.cluster.ResourceUtils.SERVER;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class VSphereVMReconcilerTest {
    private static final Duration REQUEUE = Duration.ofSeconds(10);
    private static final String VM_NAME = "my-cluster-cp-0";
    private static final Reconciliation RECONCILIATION = ResourceUtils.reconciliation(VSphereVM.RESOURCE_KIND, VM_NAME);

    KubernetesClient client;

    private ResourceUtils resources;
    private FakeVSphere vsphere;
    private VSphereVMReconciler reconciler;

    @BeforeEach
    public void setUp() {
        resources = new ResourceUtils(client);
        vsphere = new FakeVSphere();
        reconciler = new VSphereVMReconciler(client, new CredentialsProvider(client, new Credentials("admin", "password"), ResourceUtils.OPERATOR_NAMESPACE),
                vsphere, vsphere, REQUEUE);
    }

    private VSphereVM createVm(NetworkSpec network) {
        VSphereVMSpec spec = new VSphereVMSpec();
        spec.setServer(SERVER);
        spec.setDatacenter("DC0");
        spec.setTemplate(ResourceUtils.TEMPLATE);
        spec.setNetwork(network);
        spec.setBootstrapRef(new ObjectReferenceBuilder()
                .withApiVersion("v1")
                .withKind("Secret")
                .withName(VM_NAME + "-bootstrap")
                .build());

        VSphereVM vm = new VSphereVM();
        vm.setMetadata(new ObjectMetaBuilder().withName(VM_NAME).withNamespace(NAMESPACE).build());
        vm.setSpec(spec);

        return Crds.vsphereVmOperation(client).inNamespace(NAMESPACE).resource(vm).create();
    }

    private VSphereVM get() {
        return Crds.vsphereVmOperation(client).inNamespace(NAMESPACE).withName(VM_NAME).get();
    }

    @Test
    public void testVmIsProvisioned() {
        createVm(null);

        // No bootstrap data yet
        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));
        VSphereVM vm = get();
        assertThat(Finalizers.has(vm, Constants.VM_FINALIZER), is(true));
        assertThat(Conditions.get(vm.getStatus(), ConditionTypes.VM_PROVISIONED).getReason(), is(ConditionReasons.WAITING_FOR_BOOTSTRAP_DATA));
        assertThat(vsphere.exists(VM_NAME), is(false));

        // Clone is started
        resources.bootstrapSecret(VM_NAME + "-bootstrap", "#cloud-config");
        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));
        assertThat(vsphere.exists(VM_NAME), is(true));
        assertThat(Conditions.get(get().getStatus(), ConditionTypes.VM_PROVISIONED).getReason(), is(ConditionReasons.CLONING));

        // VM is powered on
        vsphere.powerOn(VM_NAME, "4217c5e1-3f2b-8d4a-1c77-9a1f0e6b2d11", "10.0.0.10");
        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));

        vm = get();
        assertThat(vm.getSpec().getBiosUUID(), is("4217c5e1-3f2b-8d4a-1c77-9a1f0e6b2d11"));
        assertThat(vm.getStatus().isReady(), is(true));
        assertThat(vm.getStatus().getAddresses(), contains("10.0.0.10"));
        assertThat(vm.getStatus().getNetwork().get(0).getNetworkName(), is("VM Network"));
        assertThat(Conditions.isTrue(vm.getStatus(), ConditionTypes.VM_PROVISIONED), is(true));
        assertThat(Conditions.isTrue(vm.getStatus(), ConditionTypes.READY), is(true));
    }

    @Test
    public void testWaitingForStaticIpAllocation() {
        NetworkDeviceSpec device = new NetworkDeviceSpec();
        device.setNetworkName("VM Network");
        NetworkSpec network = new NetworkSpec();
        network.setDevices(List.of(device));

        createVm(network);
        resources.bootstrapSecret(VM_NAME + "-bootstrap", "#cloud-config");

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));
        assertThat(Conditions.get(get().getStatus(), ConditionTypes.VM_PROVISIONED).getReason(), is(ConditionReasons.WAITING_FOR_STATIC_IP_ALLOCATION));
    }

    @Test
    public void testStaticIpAllocation() {
        NetworkDeviceSpec dhcp = new NetworkDeviceSpec();
        dhcp.setDhcp4(true);
        NetworkDeviceSpec assigned = new NetworkDeviceSpec();
        assigned.setIpAddrs(List.of("192.168.1.20/24"));

        NetworkSpec network = new NetworkSpec();
        network.setDevices(List.of(dhcp, assigned));
        assertThat(VSphereVMReconciler.isWaitingForStaticIpAllocation(network), is(false));

        network.setDevices(List.of(dhcp, assigned, new NetworkDeviceSpec()));
        assertThat(VSphereVMReconciler.isWaitingForStaticIpAllocation(network), is(true));

        assertThat(VSphereVMReconciler.isWaitingForStaticIpAllocation(null), is(false));
    }

    @Test
    public void testVmIsDestroyedBeforeTheFinalizerIsRemoved() {
        createVm(null);
        resources.bootstrapSecret(VM_NAME + "-bootstrap", "#cloud-config");
        reconciler.reconcile(RECONCILIATION);
        vsphere.powerOn(VM_NAME, "4217c5e1-3f2b-8d4a-1c77-9a1f0e6b2d11", "10.0.0.10");
        reconciler.reconcile(RECONCILIATION);

        Crds.vsphereVmOperation(client).inNamespace(NAMESPACE).withName(VM_NAME).delete();
        assertThat(Finalizers.isDeleting(get()), is(true));

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));
        assertThat(vsphere.exists(VM_NAME), is(false));
        assertThat(vsphere.destroyedCount(), is(1));
        assertThat(get(), is(nullValue()));
    }

    @Test
    public void testUnreachableVCenter() {
        createVm(null);
        resources.bootstrapSecret(VM_NAME + "-bootstrap", "#cloud-config");
        vsphere.unreachable(SERVER);

        assertThrows(VSphereException.class, () -> reconciler.reconcile(RECONCILIATION));

        // The finalizer is persisted even though the reconciliation failed
        assertThat(Finalizers.has(get(), Constants.VM_FINALIZER), is(true));
        assertThat(vsphere.loginCount(), is(0));
    }

    @Test
    public void testFailedVmIsNotReconciled() {
        createVm(null);
        resources.bootstrapSecret(VM_NAME + "-bootstrap", "#cloud-config");
        reconciler.reconcile(RECONCILIATION);

        VSphereVM vm = get();
        vm.getStatus().setFailureReason("CloneFailed");
        vm.getStatus().setFailureMessage("Template not found");
        Crds.vsphereVmOperation(client).inNamespace(NAMESPACE).resource(vm).updateStatus();
        int logins = vsphere.loginCount();

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));
        assertThat(vsphere.loginCount(), is(logins));
    }

    @Test
    public void testMissingVm() {
        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));
    }
}
