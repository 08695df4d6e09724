/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.common.APIEndpoint;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.loadbalancer.LoadBalancerStatus;
import io.capv.api.model.vsphere.IdentityReference;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.capv.api.model.vsphere.VSphereClusterStatus;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.cluster.cluster.addons.AddonInstaller;
import io.capv.operator.cluster.loadbalancer.LoadBalancerService;
import io.capv.operator.cluster.loadbalancer.LoadBalancerServices;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.CredentialsProvider;
import io.capv.operator.cluster.vsphere.IdentityException;
import io.capv.operator.cluster.vsphere.SessionProvider;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.GenericEventChannel;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.controller.SimplifiedReconciliation;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.KubernetesResources;
import io.capv.operator.common.resource.OwnerReferences;
import io.capv.operator.common.resource.ResourcePatcher;
import io.capv.operator.common.trigger.OnlinePoller;
import io.capv.operator.common.trigger.TriggerRegistry;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reconciles the VSphereCluster resources. A cluster becomes ready once its credentials are usable, its vCenter is
 * reachable and its load balancer (if any) has an address. Afterwards the control plane endpoint is resolved and the
 * add-ons are installed into the workload cluster once its API server is online.
 */
public class VSphereClusterReconciler implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(VSphereClusterReconciler.class);

    /**
     * Trigger of the reconciliation emitted when the API server of the workload cluster comes online
     */
    public static final String API_SERVER_ONLINE_TRIGGER = "api-server-online";

    private final KubernetesClient client;
    private final ClusterResources clusters;
    private final ControlPlaneEndpoints endpoints;
    private final CredentialsProvider credentialsProvider;
    private final SessionProvider sessionProvider;
    private final LoadBalancerServices loadBalancers;
    private final WorkloadClusterClientProvider workloadClusters;
    private final AddonInstaller addonInstaller;
    private final TriggerRegistry triggers;
    private final GenericEventChannel eventChannel;
    private final Duration requeueInterval;

    /**
     * Constructs the reconciler
     *
     * @param client                Kubernetes client of the management cluster
     * @param credentialsProvider   Resolves the vCenter credentials
     * @param sessionProvider       vCenter sessions
     * @param loadBalancers         Load balancer services by kind
     * @param workloadClusters      Clients of the workload clusters
     * @param addonInstaller        Installs the add-ons into the workload clusters
     * @param triggers              Registry of the API server pollers
     * @param eventChannel          Channel used to request reconciliations
     * @param requeueInterval       Delay before a waiting cluster is checked again
     */
    @SuppressWarnings({"checkstyle:ParameterNumber"})
    public VSphereClusterReconciler(KubernetesClient client, CredentialsProvider credentialsProvider, SessionProvider sessionProvider,
                                    LoadBalancerServices loadBalancers, WorkloadClusterClientProvider workloadClusters,
                                    AddonInstaller addonInstaller, TriggerRegistry triggers, GenericEventChannel eventChannel,
                                    Duration requeueInterval) {
        this.client = client;
        this.clusters = new ClusterResources(client);
        this.endpoints = new ControlPlaneEndpoints(clusters);
        this.credentialsProvider = credentialsProvider;
        this.sessionProvider = sessionProvider;
        this.loadBalancers = loadBalancers;
        this.workloadClusters = workloadClusters;
        this.addonInstaller = addonInstaller;
        this.triggers = triggers;
        this.eventChannel = eventChannel;
        this.requeueInterval = requeueInterval;
    }

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        VSphereCluster vsphereCluster = Crds.vsphereClusterOperation(client).inNamespace(reconciliation.namespace()).withName(reconciliation.name()).get();

        if (vsphereCluster == null) {
            LOGGER.debugCr(reconciliation, "VSphereCluster no longer exists");
            return ReconcileResult.done();
        } else if (vsphereCluster.getSpec() == null) {
            LOGGER.warnCr(reconciliation, "VSphereCluster has no spec and will be ignored");
            return ReconcileResult.done();
        }

        Cluster cluster = clusters.ownerCluster(vsphereCluster);
        if (cluster == null && !Finalizers.isDeleting(vsphereCluster)) {
            LOGGER.infoCr(reconciliation, "Waiting for the owner Cluster to be set");
            return ReconcileResult.done();
        } else if (ClusterResources.isPaused(cluster, vsphereCluster)) {
            LOGGER.infoCr(reconciliation, "Reconciliation is paused");
            return ReconcileResult.done();
        }

        if (vsphereCluster.getStatus() == null) {
            vsphereCluster.setStatus(new VSphereClusterStatus());
        }

        ResourcePatcher<VSphereClusterStatus, VSphereCluster> patcher = new ResourcePatcher<>(reconciliation, Crds.vsphereClusterOperation(client), vsphereCluster);

        return patcher.reconcile(() -> {
            if (Finalizers.isDeleting(vsphereCluster)) {
                return reconcileDelete(reconciliation, vsphereCluster, cluster);
            } else {
                return reconcileNormal(reconciliation, vsphereCluster, cluster);
            }
        });
    }

    private ReconcileResult reconcileNormal(Reconciliation reconciliation, VSphereCluster vsphereCluster, Cluster cluster) {
        VSphereClusterStatus status = vsphereCluster.getStatus();
        Finalizers.add(vsphereCluster, Constants.CLUSTER_FINALIZER);

        ReconcileResult identityResult = reconcileIdentity(reconciliation, vsphereCluster);
        if (identityResult != null) {
            return identityResult;
        }

        Credentials credentials = credentialsProvider.forCluster(vsphereCluster);
        reconcileVCenter(reconciliation, vsphereCluster, credentials);

        ReconcileResult loadBalancerResult = reconcileLoadBalancer(reconciliation, vsphereCluster, cluster);
        if (loadBalancerResult != null) {
            return loadBalancerResult;
        }

        status.setReady(true);

        ReconcileResult endpointResult = reconcileControlPlaneEndpoint(reconciliation, vsphereCluster, cluster);

        startApiServerPoller(reconciliation, vsphereCluster, cluster);

        if (endpointResult != null) {
            return endpointResult;
        }

        return reconcileAddons(reconciliation, vsphereCluster, cluster, credentials);
    }

    /**
     * Verifies the identity of the cluster. An identity Secret is claimed for this cluster, a VSphereClusterIdentity
     * has to be ready and allow the namespace of the cluster.
     *
     * @return  Result when the reconciliation cannot continue or null
     */
    private ReconcileResult reconcileIdentity(Reconciliation reconciliation, VSphereCluster vsphereCluster) {
        VSphereClusterStatus status = vsphereCluster.getStatus();

        IdentityReference ref = vsphereCluster.getSpec().getIdentityRef();

        if (ref == null) {
            Conditions.markTrue(status, ConditionTypes.CREDENTIALS_AVAILABLE);
            return null;
        } else if (!CredentialsProvider.SECRET_KIND.equals(ref.getKind())) {
            try {
                credentialsProvider.forCluster(vsphereCluster);
            } catch (IdentityException e) {
                LOGGER.infoCr(reconciliation, "Identity {} {} cannot be used: {}", ref.getKind(), ref.getName(), e.getMessage());
                Conditions.markFalse(status, ConditionTypes.CREDENTIALS_AVAILABLE, e.reason(), Condition.SEVERITY_ERROR, "%s", e.getMessage());
                return ReconcileResult.requeueAfter(requeueInterval);
            }

            Conditions.markTrue(status, ConditionTypes.CREDENTIALS_AVAILABLE);
            return null;
        }

        Secret secret = credentialsProvider.identitySecret(vsphereCluster);
        if (secret == null) {
            Conditions.markFalse(status, ConditionTypes.CREDENTIALS_AVAILABLE, ConditionReasons.SECRET_NOT_FOUND, Condition.SEVERITY_ERROR,
                    "Secret %s not found", vsphereCluster.getSpec().getIdentityRef().getName());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        OwnerReference owner = OwnerReferences.findByKind(secret, VSphereCluster.RESOURCE_KIND);
        if (owner == null) {
            owner = OwnerReferences.findByKind(secret, VSphereClusterIdentity.RESOURCE_KIND);
        }

        if (owner != null && !Objects.equals(owner.getUid(), vsphereCluster.getMetadata().getUid())) {
            Conditions.markFalse(status, ConditionTypes.CREDENTIALS_AVAILABLE, ConditionReasons.SECRET_ALREADY_IN_USE, Condition.SEVERITY_ERROR,
                    "Secret %s is already used by %s %s", secret.getMetadata().getName(), owner.getKind(), owner.getName());
            return ReconcileResult.done();
        }

        if (OwnerReferences.add(secret, OwnerReferences.of(vsphereCluster, false))) {
            LOGGER.debugCr(reconciliation, "Claiming identity Secret {}", secret.getMetadata().getName());
            client.secrets().inNamespace(secret.getMetadata().getNamespace()).resource(secret).update();
        }

        Conditions.markTrue(status, ConditionTypes.CREDENTIALS_AVAILABLE);
        return null;
    }

    private void reconcileVCenter(Reconciliation reconciliation, VSphereCluster vsphereCluster, Credentials credentials) {
        String datacenter = null;
        if (vsphereCluster.getSpec().getCloudProviderConfiguration() != null
                && vsphereCluster.getSpec().getCloudProviderConfiguration().getWorkspace() != null) {
            datacenter = vsphereCluster.getSpec().getCloudProviderConfiguration().getWorkspace().getDatacenter();
        }

        try {
            sessionProvider.getOrCreate(vsphereCluster.getSpec().getServer(), datacenter, credentials);
        } catch (RuntimeException e) {
            LOGGER.warnCr(reconciliation, "vCenter {} is not available: {}", vsphereCluster.getSpec().getServer(), e.getMessage());
            Conditions.markFalse(vsphereCluster.getStatus(), ConditionTypes.VCENTER_AVAILABLE, ConditionReasons.VCENTER_UNREACHABLE,
                    Condition.SEVERITY_ERROR, "%s", e.getMessage());
            throw e;
        }

        Conditions.markTrue(vsphereCluster.getStatus(), ConditionTypes.VCENTER_AVAILABLE);
    }

    /**
     * Adopts the referenced load balancer and takes the control plane endpoint from its address.
     *
     * @return  Result when the cluster has to wait for the load balancer or null
     */
    private ReconcileResult reconcileLoadBalancer(Reconciliation reconciliation, VSphereCluster vsphereCluster, Cluster cluster) {
        ObjectReference ref = vsphereCluster.getSpec().getLoadBalancerRef();

        if (ref == null
                || !APIEndpoint.isZero(vsphereCluster.getSpec().getControlPlaneEndpoint())
                || (cluster.getSpec() != null && !APIEndpoint.isZero(cluster.getSpec().getControlPlaneEndpoint()))) {
            return null;
        }

        LoadBalancerService<?> service = loadBalancers.forKind(ref.getKind());
        if (service == null) {
            Conditions.markFalse(vsphereCluster.getStatus(), ConditionTypes.LOAD_BALANCER_AVAILABLE, ConditionReasons.LOAD_BALANCER_NOT_FOUND,
                    Condition.SEVERITY_ERROR, "Load balancer kind %s is not supported", ref.getKind());
            return ReconcileResult.done();
        }

        return reconcileLoadBalancer(reconciliation, vsphereCluster, ref, service);
    }

    private <T extends CustomResource<?, LoadBalancerStatus>> ReconcileResult reconcileLoadBalancer(Reconciliation reconciliation, VSphereCluster vsphereCluster,
                                                                                                      ObjectReference ref, LoadBalancerService<T> service) {
        VSphereClusterStatus status = vsphereCluster.getStatus();
        String namespace = vsphereCluster.getMetadata().getNamespace();
        T loadBalancer = service.operation().inNamespace(namespace).withName(ref.getName()).get();

        if (loadBalancer == null) {
            Conditions.markFalse(status, ConditionTypes.LOAD_BALANCER_AVAILABLE, ConditionReasons.LOAD_BALANCER_NOT_FOUND, Condition.SEVERITY_WARNING,
                    "%s %s not found", ref.getKind(), ref.getName());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        if (OwnerReferences.controllerOf(loadBalancer) == null
                && OwnerReferences.add(loadBalancer, OwnerReferences.of(vsphereCluster, true))) {
            LOGGER.infoCr(reconciliation, "Adopting {} {}", ref.getKind(), ref.getName());
            loadBalancer = service.operation().inNamespace(namespace).resource(loadBalancer).update();
        }

        LoadBalancerStatus lbStatus = service.getStatus(loadBalancer);
        if (lbStatus == null || !lbStatus.isReady() || lbStatus.getAddress() == null || lbStatus.getAddress().isEmpty()) {
            Conditions.markFalse(status, ConditionTypes.LOAD_BALANCER_AVAILABLE, ConditionReasons.WAITING_FOR_LOAD_BALANCER, Condition.SEVERITY_INFO, null);
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        vsphereCluster.getSpec().setControlPlaneEndpoint(new APIEndpoint(lbStatus.getAddress(), service.port(loadBalancer)));
        Conditions.markTrue(status, ConditionTypes.LOAD_BALANCER_AVAILABLE);
        LOGGER.infoCr(reconciliation, "Control plane endpoint set to the load balancer address {}", lbStatus.getAddress());
        return null;
    }

    private ReconcileResult reconcileControlPlaneEndpoint(Reconciliation reconciliation, VSphereCluster vsphereCluster, Cluster cluster) {
        APIEndpoint endpoint = endpoints.resolve(cluster, vsphereCluster);

        if (endpoint == null) {
            Conditions.markFalse(vsphereCluster.getStatus(), ConditionTypes.CONTROL_PLANE_ENDPOINT_RESOLVED, ConditionReasons.WAITING_FOR_CONTROL_PLANE_MACHINES,
                    Condition.SEVERITY_INFO, null);
            LOGGER.debugCr(reconciliation, "No control plane endpoint available yet");
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        if (!endpoint.equals(vsphereCluster.getSpec().getControlPlaneEndpoint())) {
            LOGGER.infoCr(reconciliation, "Control plane endpoint is {}:{}", endpoint.getHost(), endpoint.getPort());
            vsphereCluster.getSpec().setControlPlaneEndpoint(endpoint);
        }

        Conditions.markTrue(vsphereCluster.getStatus(), ConditionTypes.CONTROL_PLANE_ENDPOINT_RESOLVED);
        return null;
    }

    private void startApiServerPoller(Reconciliation reconciliation, VSphereCluster vsphereCluster, Cluster cluster) {
        String namespace = cluster.getMetadata().getNamespace();
        String name = cluster.getMetadata().getName();

        triggers.startIfAbsent(reconciliation, cluster.getMetadata().getUid(), new OnlinePoller(
                () -> isControlPlaneInitialized(cluster),
                () -> workloadClusters.isOnline(cluster),
                () -> eventChannel.send(new SimplifiedReconciliation(VSphereCluster.RESOURCE_KIND,
                        vsphereCluster.getMetadata().getNamespace(), vsphereCluster.getMetadata().getName(), API_SERVER_ONLINE_TRIGGER)),
                () -> {
                    Cluster current = clusters.cluster(namespace, name);
                    return current == null || isControlPlaneInitialized(current);
                }));
    }

    private ReconcileResult reconcileAddons(Reconciliation reconciliation, VSphereCluster vsphereCluster, Cluster cluster, Credentials credentials) {
        VSphereClusterStatus status = vsphereCluster.getStatus();

        if (!isControlPlaneInitialized(cluster)) {
            Conditions.markFalse(status, ConditionTypes.ADDONS_INSTALLED, ConditionReasons.WAITING_FOR_API_SERVER, Condition.SEVERITY_INFO, null);
            return ReconcileResult.done();
        }

        KubernetesClient workload = workloadClusters.get(cluster);
        if (workload == null || !workloadClusters.isOnline(cluster)) {
            Conditions.markFalse(status, ConditionTypes.ADDONS_INSTALLED, ConditionReasons.WAITING_FOR_API_SERVER, Condition.SEVERITY_INFO, null);
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        try {
            addonInstaller.install(reconciliation, workload, vsphereCluster, credentials);
        } catch (RuntimeException e) {
            Conditions.markFalse(status, ConditionTypes.ADDONS_INSTALLED, ConditionReasons.ADDON_INSTALLATION_FAILED, Condition.SEVERITY_WARNING,
                    "%s", e.getMessage());
            throw e;
        }

        Conditions.markTrue(status, ConditionTypes.ADDONS_INSTALLED);
        return ReconcileResult.done();
    }

    private ReconcileResult reconcileDelete(Reconciliation reconciliation, VSphereCluster vsphereCluster, Cluster cluster) {
        if (!Finalizers.has(vsphereCluster, Constants.CLUSTER_FINALIZER)) {
            return ReconcileResult.done();
        }

        String namespace = vsphereCluster.getMetadata().getNamespace();
        String clusterName = cluster != null ? cluster.getMetadata().getName() : ClusterResources.clusterName(vsphereCluster);

        List<HasMetadata> remaining = new ArrayList<>();
        if (clusterName != null) {
            List<VSphereMachine> machines = Crds.vsphereMachineOperation(client).inNamespace(namespace)
                    .withLabel(Constants.CLUSTER_NAME_LABEL, clusterName).list().getItems();
            remaining.addAll(machines);

            for (LoadBalancerService<?> service : loadBalancers.all()) {
                remaining.addAll(deleteLoadBalancers(reconciliation, service, namespace, clusterName));
            }
        }

        if (!remaining.isEmpty()) {
            LOGGER.infoCr(reconciliation, "Waiting for {} dependent resources to be deleted", remaining.size());
            Conditions.markFalse(vsphereCluster.getStatus(), ConditionTypes.READY, ConditionReasons.DELETING, Condition.SEVERITY_INFO,
                    "Waiting for %d dependent resources", remaining.size());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        Secret secret = credentialsProvider.identitySecret(vsphereCluster);
        if (secret != null && OwnerReferences.remove(secret, vsphereCluster.getMetadata().getUid())) {
            LOGGER.debugCr(reconciliation, "Releasing identity Secret {}", secret.getMetadata().getName());
            client.secrets().inNamespace(namespace).resource(secret).update();
        }

        if (clusterName != null) {
            workloadClusters.remove(namespace, clusterName);
        }

        LOGGER.infoCr(reconciliation, "Cluster infrastructure deleted, removing the finalizer");
        Finalizers.remove(vsphereCluster, Constants.CLUSTER_FINALIZER);
        return ReconcileResult.done();
    }

    private <T extends CustomResource<?, LoadBalancerStatus>> List<T> deleteLoadBalancers(Reconciliation reconciliation, LoadBalancerService<T> service,
                                                                                            String namespace, String clusterName) {
        List<T> found = service.operation().inNamespace(namespace).withLabel(Constants.CLUSTER_NAME_LABEL, clusterName).list().getItems();

        for (T loadBalancer : found) {
            if (!Finalizers.isDeleting(loadBalancer)) {
                LOGGER.infoCr(reconciliation, "Deleting {} {}", service.kind(), loadBalancer.getMetadata().getName());

                try {
                    service.operation().inNamespace(namespace).withName(loadBalancer.getMetadata().getName()).delete();
                } catch (KubernetesClientException e) {
                    if (!KubernetesResources.isNotFound(e)) {
                        throw e;
                    }
                }
            }
        }

        return found;
    }

    private static boolean isControlPlaneInitialized(Cluster cluster) {
        return cluster.getStatus() != null && cluster.getStatus().isControlPlaneInitialized();
    }
}
