/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.resource;

import io.capv.api.Crds;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereMachineList;
import io.capv.api.model.vsphere.VSphereMachineSpec;
import io.capv.api.model.vsphere.VSphereMachineStatus;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.model.Conditions;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
public class ResourcePatcherTest {
    private static final String NAMESPACE = "my-namespace";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", VSphereMachine.RESOURCE_KIND, NAMESPACE, "my-machine");

    KubernetesClient client;

    private static VSphereMachine machine() {
        VSphereMachineSpec spec = new VSphereMachineSpec();
        spec.setTemplate("ubuntu-2004");
        spec.setNumCPUs(2);

        VSphereMachine machine = new VSphereMachine();
        machine.setMetadata(new ObjectMetaBuilder().withName("my-machine").withNamespace(NAMESPACE).build());
        machine.setSpec(spec);
        return machine;
    }

    private VSphereMachine created() {
        return Crds.vsphereMachineOperation(client).inNamespace(NAMESPACE).resource(machine()).create();
    }

    private VSphereMachine get() {
        return Crds.vsphereMachineOperation(client).inNamespace(NAMESPACE).withName("my-machine").get();
    }

    @Test
    public void testNothingChangedNothingWritten() {
        VSphereMachine machine = created();
        String resourceVersion = machine.getMetadata().getResourceVersion();

        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(RECONCILIATION, Crds.vsphereMachineOperation(client), machine);

        assertThat(patcher.patch(), is(false));
        assertThat(get().getMetadata().getResourceVersion(), is(resourceVersion));
    }

    @Test
    public void testMetadataAndStatusArePersisted() {
        VSphereMachine machine = created();

        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(RECONCILIATION, Crds.vsphereMachineOperation(client), machine);
        Finalizers.add(patcher.resource(), Constants.MACHINE_FINALIZER);
        patcher.resource().setStatus(new VSphereMachineStatus());
        patcher.resource().getStatus().setReady(true);
        Conditions.markTrue(patcher.resource().getStatus(), ConditionTypes.VM_PROVISIONED);

        assertThat(patcher.patch(), is(true));

        VSphereMachine stored = get();
        assertThat(Finalizers.has(stored, Constants.MACHINE_FINALIZER), is(true));
        assertThat(stored.getStatus().isReady(), is(true));
        assertThat(Conditions.isTrue(stored.getStatus(), ConditionTypes.READY), is(true));
        assertThat(Conditions.isTrue(stored.getStatus(), ConditionTypes.VM_PROVISIONED), is(true));

        // Second pass with the same outcome does not write anything
        ResourcePatcher<VSphereMachineStatus, VSphereMachine> second = new ResourcePatcher<>(RECONCILIATION, Crds.vsphereMachineOperation(client), stored);
        Finalizers.add(second.resource(), Constants.MACHINE_FINALIZER);
        second.resource().getStatus().setReady(true);
        Conditions.markTrue(second.resource().getStatus(), ConditionTypes.VM_PROVISIONED);

        assertThat(second.patch(), is(false));
    }

    @Test
    public void testReconcileReturnsBodyResultAndPatches() {
        VSphereMachine machine = created();
        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(RECONCILIATION, Crds.vsphereMachineOperation(client), machine);

        ReconcileResult result = patcher.reconcile(() -> {
            patcher.resource().setStatus(new VSphereMachineStatus());
            Conditions.markFalse(patcher.resource().getStatus(), ConditionTypes.VM_PROVISIONED, ConditionReasons.CLONING, Condition.SEVERITY_INFO, "Cloning");
            return ReconcileResult.requeueAfter(Duration.ofSeconds(10));
        });

        assertThat(result, is(ReconcileResult.requeueAfter(Duration.ofSeconds(10))));
        VSphereMachine stored = get();
        assertThat(Conditions.get(stored.getStatus(), ConditionTypes.READY).getReason(), is(ConditionReasons.CLONING));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testConflictIsPropagated() {
        MixedOperation<VSphereMachine, VSphereMachineList, Resource<VSphereMachine>> op = mock(MixedOperation.class);
        NonNamespaceOperation<VSphereMachine, VSphereMachineList, Resource<VSphereMachine>> nonNamespaced = mock(NonNamespaceOperation.class);
        Resource<VSphereMachine> resource = mock(Resource.class);
        when(op.inNamespace(anyString())).thenReturn(nonNamespaced);
        when(nonNamespaced.resource(any())).thenReturn(resource);
        when(resource.update()).thenThrow(new KubernetesClientException("the object has been modified", 409, null));

        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(RECONCILIATION, op, machine());
        Finalizers.add(patcher.resource(), Constants.MACHINE_FINALIZER);

        KubernetesClientException e = assertThrows(KubernetesClientException.class, patcher::patch);
        assertThat(e.getCode(), is(409));
        verify(resource, never()).updateStatus();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testBodyErrorWinsOverPatchError() {
        MixedOperation<VSphereMachine, VSphereMachineList, Resource<VSphereMachine>> op = mock(MixedOperation.class);
        NonNamespaceOperation<VSphereMachine, VSphereMachineList, Resource<VSphereMachine>> nonNamespaced = mock(NonNamespaceOperation.class);
        Resource<VSphereMachine> resource = mock(Resource.class);
        when(op.inNamespace(anyString())).thenReturn(nonNamespaced);
        when(nonNamespaced.resource(any())).thenReturn(resource);
        when(resource.update()).thenThrow(new KubernetesClientException("the object has been modified", 409, null));

        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(RECONCILIATION, op, machine());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> patcher.reconcile(() -> {
            Finalizers.add(patcher.resource(), Constants.MACHINE_FINALIZER);
            throw new IllegalStateException("vCenter unreachable");
        }));

        assertThat(e.getMessage(), is("vCenter unreachable"));
        assertThat(e.getSuppressed().length, is(1));
        assertThat(((KubernetesClientException) e.getSuppressed()[0]).getCode(), is(409));
    }

    @Test
    public void testDeletingReadyIsPersisted() {
        VSphereMachine machine = machine();
        Finalizers.add(machine, Constants.MACHINE_FINALIZER);
        Crds.vsphereMachineOperation(client).inNamespace(NAMESPACE).resource(machine).create();
        Crds.vsphereMachineOperation(client).inNamespace(NAMESPACE).withName("my-machine").delete();

        VSphereMachine deleting = get();
        assertThat(Finalizers.isDeleting(deleting), is(true));

        ResourcePatcher<VSphereMachineStatus, VSphereMachine> patcher = new ResourcePatcher<>(RECONCILIATION, Crds.vsphereMachineOperation(client), deleting);
        patcher.resource().setStatus(new VSphereMachineStatus());
        Conditions.markTrue(patcher.resource().getStatus(), ConditionTypes.VM_PROVISIONED);
        Conditions.markFalse(patcher.resource().getStatus(), ConditionTypes.READY, ConditionReasons.DELETING, Condition.SEVERITY_INFO, "Waiting for %d Machines", 1);

        assertThat(patcher.patch(), is(true));

        Condition ready = Conditions.get(get().getStatus(), ConditionTypes.READY);
        assertThat(ready.getStatus(), is(Condition.STATUS_FALSE));
        assertThat(ready.getReason(), is(ConditionReasons.DELETING));
        assertThat(ready.getMessage(), is("Waiting for 1 Machines"));
    }
}
