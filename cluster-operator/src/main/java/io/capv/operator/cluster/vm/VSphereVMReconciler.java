/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vm;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.NetworkDeviceSpec;
import io.capv.api.model.vsphere.NetworkSpec;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.vsphere.VSphereVMStatus;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.CredentialsProvider;
import io.capv.operator.cluster.vsphere.Session;
import io.capv.operator.cluster.vsphere.SessionProvider;
import io.capv.operator.cluster.vsphere.VSphereException;
import io.capv.operator.cluster.vsphere.VirtualMachine;
import io.capv.operator.cluster.vsphere.VirtualMachineContext;
import io.capv.operator.cluster.vsphere.VirtualMachineService;
import io.capv.operator.cluster.vsphere.VirtualMachineState;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.ResourcePatcher;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;

/**
 * Converges the VSphereVM resources into virtual machines using the {@link VirtualMachineService}
 */
public class VSphereVMReconciler implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(VSphereVMReconciler.class);

    /**
     * Key of the bootstrap data in the bootstrap Secret
     */
    public static final String BOOTSTRAP_DATA_KEY = "value";

    private final KubernetesClient client;
    private final ClusterResources clusters;
    private final CredentialsProvider credentialsProvider;
    private final SessionProvider sessionProvider;
    private final VirtualMachineService vmService;
    private final Duration requeueInterval;

    /**
     * Constructs the reconciler
     *
     * @param client                Kubernetes client
     * @param credentialsProvider   Resolves the vCenter credentials
     * @param sessionProvider       vCenter sessions
     * @param vmService             VM driver
     * @param requeueInterval       Delay before a pending VM is checked again
     */
    public VSphereVMReconciler(KubernetesClient client, CredentialsProvider credentialsProvider, SessionProvider sessionProvider,
                               VirtualMachineService vmService, Duration requeueInterval) {
        this.client = client;
        this.clusters = new ClusterResources(client);
        this.credentialsProvider = credentialsProvider;
        this.sessionProvider = sessionProvider;
        this.vmService = vmService;
        this.requeueInterval = requeueInterval;
    }

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        VSphereVM vm = Crds.vsphereVmOperation(client).inNamespace(reconciliation.namespace()).withName(reconciliation.name()).get();

        if (vm == null) {
            LOGGER.debugCr(reconciliation, "VSphereVM no longer exists");
            return ReconcileResult.done();
        } else if (vm.getSpec() == null) {
            LOGGER.warnCr(reconciliation, "VSphereVM has no spec and will be ignored");
            return ReconcileResult.done();
        }

        Cluster cluster = clusters.labelledCluster(vm);
        if (ClusterResources.isPaused(cluster, vm)) {
            LOGGER.infoCr(reconciliation, "Reconciliation is paused");
            return ReconcileResult.done();
        }

        VSphereCluster vsphereCluster = cluster != null ? clusters.infrastructureCluster(cluster) : null;

        if (vm.getStatus() == null) {
            vm.setStatus(new VSphereVMStatus());
        }

        ResourcePatcher<VSphereVMStatus, VSphereVM> patcher = new ResourcePatcher<>(reconciliation, Crds.vsphereVmOperation(client), vm);

        return patcher.reconcile(() -> {
            if (Finalizers.isDeleting(vm)) {
                return reconcileDelete(reconciliation, vm, vsphereCluster);
            } else {
                return reconcileNormal(reconciliation, vm, vsphereCluster);
            }
        });
    }

    private ReconcileResult reconcileNormal(Reconciliation reconciliation, VSphereVM vm, VSphereCluster vsphereCluster) {
        VSphereVMStatus status = vm.getStatus();

        if (status.getFailureReason() != null || status.getFailureMessage() != null) {
            LOGGER.infoCr(reconciliation, "VM is in a failed state ({}: {}) and will not be reconciled", status.getFailureReason(), status.getFailureMessage());
            return ReconcileResult.done();
        }

        Finalizers.add(vm, Constants.VM_FINALIZER);

        String bootstrapData = null;
        ObjectReference bootstrapRef = vm.getSpec().getBootstrapRef();
        if (bootstrapRef != null && bootstrapRef.getName() != null) {
            bootstrapData = bootstrapData(vm.getMetadata().getNamespace(), bootstrapRef);

            if (bootstrapData == null) {
                Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.WAITING_FOR_BOOTSTRAP_DATA, Condition.SEVERITY_INFO,
                        "Bootstrap data secret %s not found", bootstrapRef.getName());
                return ReconcileResult.requeueAfter(requeueInterval);
            }
        }

        VirtualMachine result = vmService.reconcileVM(context(reconciliation, vm, vsphereCluster, bootstrapData));

        if (result.state() != VirtualMachineState.READY) {
            if (isWaitingForStaticIpAllocation(vm.getSpec().getNetwork())) {
                Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.WAITING_FOR_STATIC_IP_ALLOCATION, Condition.SEVERITY_INFO, null);
            } else {
                Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.CLONING, Condition.SEVERITY_INFO, null);
            }

            LOGGER.debugCr(reconciliation, "VM is in state {}", result.state());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        vm.getSpec().setBiosUUID(result.biosUuid());
        status.setNetwork(result.network() != null ? new ArrayList<>(result.network()) : null);
        status.setAddresses(result.addresses());
        status.setReady(true);
        Conditions.markTrue(status, ConditionTypes.VM_PROVISIONED);

        LOGGER.debugCr(reconciliation, "VM is ready with addresses {}", status.getAddresses());
        return ReconcileResult.done();
    }

    private ReconcileResult reconcileDelete(Reconciliation reconciliation, VSphereVM vm, VSphereCluster vsphereCluster) {
        if (!Finalizers.has(vm, Constants.VM_FINALIZER)) {
            return ReconcileResult.done();
        }

        Conditions.markFalse(vm.getStatus(), ConditionTypes.VM_PROVISIONED, ConditionReasons.DELETING, Condition.SEVERITY_INFO, null);

        VirtualMachine result;
        try {
            result = vmService.destroyVM(context(reconciliation, vm, vsphereCluster, null));
        } catch (VSphereException e) {
            Conditions.markFalse(vm.getStatus(), ConditionTypes.VM_PROVISIONED, ConditionReasons.DELETION_FAILED, Condition.SEVERITY_WARNING, "%s", e.getMessage());
            throw e;
        }

        if (result.state() != VirtualMachineState.NOT_FOUND) {
            LOGGER.debugCr(reconciliation, "Waiting for the VM to be destroyed, it is in state {}", result.state());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        LOGGER.infoCr(reconciliation, "VM was destroyed");
        Finalizers.remove(vm, Constants.VM_FINALIZER);
        return ReconcileResult.done();
    }

    private VirtualMachineContext context(Reconciliation reconciliation, VSphereVM vm, VSphereCluster vsphereCluster, String bootstrapData) {
        String server = vm.getSpec().getServer();
        if (server == null || server.isEmpty()) {
            throw new VSphereException("VSphereVM " + vm.getMetadata().getName() + " has no vCenter server");
        }

        Credentials credentials = vsphereCluster != null
                ? credentialsProvider.forCluster(vsphereCluster)
                : credentialsProvider.forServer(vm.getMetadata().getNamespace(), server);
        Session session = sessionProvider.getOrCreate(server, vm.getSpec().getDatacenter(), credentials);

        return new VirtualMachineContext(reconciliation, session, vm, bootstrapData);
    }

    private String bootstrapData(String namespace, ObjectReference ref) {
        Secret secret = client.secrets().inNamespace(ref.getNamespace() != null ? ref.getNamespace() : namespace).withName(ref.getName()).get();

        if (secret == null || secret.getData() == null || secret.getData().get(BOOTSTRAP_DATA_KEY) == null) {
            return null;
        }

        return new String(Base64.getDecoder().decode(secret.getData().get(BOOTSTRAP_DATA_KEY)), StandardCharsets.UTF_8);
    }

    /**
     * A VM waits for a static IP allocation when one of its devices has neither DHCP enabled nor addresses assigned.
     *
     * @param network   Network configuration of the VM
     *
     * @return  True if some device still waits for its static IP address
     */
    public static boolean isWaitingForStaticIpAllocation(NetworkSpec network) {
        if (network == null || network.getDevices() == null) {
            return false;
        }

        for (NetworkDeviceSpec device : network.getDevices()) {
            if (!device.isDhcp4() && !device.isDhcp6() && (device.getIpAddrs() == null || device.getIpAddrs().isEmpty())) {
                return true;
            }
        }

        return false;
    }
}
