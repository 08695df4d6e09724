/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancer;
import io.capv.api.model.loadbalancer.NSXTLoadBalancer;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.zone.VSphereDeploymentZone;
import io.capv.operator.cluster.cluster.VSphereClusterReconciler;
import io.capv.operator.cluster.cluster.WorkloadClusterClientProvider;
import io.capv.operator.cluster.cluster.addons.AddonInstaller;
import io.capv.operator.cluster.identity.VSphereClusterIdentityReconciler;
import io.capv.operator.cluster.loadbalancer.HAProxyLoadBalancerReconciler;
import io.capv.operator.cluster.loadbalancer.HAProxyLoadBalancerService;
import io.capv.operator.cluster.loadbalancer.LoadBalancerServices;
import io.capv.operator.cluster.loadbalancer.NSXTLoadBalancerReconciler;
import io.capv.operator.cluster.loadbalancer.NSXTLoadBalancerService;
import io.capv.operator.cluster.loadbalancer.appliance.DataplaneApplianceClient;
import io.capv.operator.cluster.machine.CloneSpecResolver;
import io.capv.operator.cluster.machine.VSphereMachineReconciler;
import io.capv.operator.cluster.servicediscovery.ServiceDiscoveryReconciler;
import io.capv.operator.cluster.vm.VSphereVMReconciler;
import io.capv.operator.cluster.vsphere.CredentialsProvider;
import io.capv.operator.cluster.vsphere.VSphereBackend;
import io.capv.operator.cluster.zone.VSphereDeploymentZoneReconciler;
import io.capv.operator.common.MetricsProvider;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.config.ConfigParameter;
import io.capv.operator.common.controller.ControllerConfig;
import io.capv.operator.common.controller.GenericEventChannel;
import io.capv.operator.common.controller.ResourceController;
import io.capv.operator.common.controller.SimplifiedReconciliation;
import io.capv.operator.common.http.HealthCheck;
import io.capv.operator.common.model.Labels;
import io.capv.operator.common.resource.OwnerReferences;
import io.capv.operator.common.trigger.TriggerRegistry;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

/**
 * Creates the controllers of all resource kinds, connects their informers and starts and stops them together
 */
@SuppressWarnings({"checkstyle:ClassDataAbstractionCoupling", "checkstyle:ClassFanOutComplexity"})
public class ClusterOperator implements HealthCheck {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ClusterOperator.class);

    private final ClusterOperatorConfig config;
    private final KubernetesClient client;
    private final String namespace;
    private final ClusterResources clusters;
    private final ScheduledExecutorService pollerExecutor;
    private final WorkloadClusterClientProvider workloadClusters;
    private final List<ResourceController<?>> controllers = new ArrayList<>();
    private final Map<String, SharedIndexInformer<?>> informers = new LinkedHashMap<>();

    /**
     * Constructs the operator and all its controllers
     *
     * @param config            Operator configuration
     * @param client            Kubernetes client of the management cluster
     * @param backend           vSphere backend
     * @param workloadClusters  Clients of the workload clusters
     * @param metricsProvider   Metrics provider
     */
    public ClusterOperator(ClusterOperatorConfig config, KubernetesClient client, VSphereBackend backend,
                           WorkloadClusterClientProvider workloadClusters, MetricsProvider metricsProvider) {
        this.config = config;
        this.client = client;
        this.namespace = config.getWatchedNamespace();
        this.clusters = new ClusterResources(client);
        this.workloadClusters = workloadClusters;
        this.pollerExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "api-server-poller"));

        ControllerConfig controllerConfig = config.controllerConfig();
        GenericEventChannel eventChannel = new GenericEventChannel();
        TriggerRegistry triggers = new TriggerRegistry(pollerExecutor, config.getApiServerPollInterval());
        CredentialsProvider credentialsProvider = new CredentialsProvider(client, config.getDefaultCredentials(), config.getOperatorNamespace());
        CloneSpecResolver cloneSpecResolver = new CloneSpecResolver(config.getDefaultServer());

        HAProxyLoadBalancerService haproxy = new HAProxyLoadBalancerService(client, cloneSpecResolver);
        LoadBalancerServices loadBalancers = new LoadBalancerServices().register(haproxy);
        NSXTLoadBalancerService nsxt = null;
        if (config.getApplianceUrl() != null) {
            nsxt = new NSXTLoadBalancerService(client, new DataplaneApplianceClient(config.getApplianceUrl(),
                    config.getApplianceUsername(), config.getAppliancePassword(), config.getApplianceTimeout()));
            loadBalancers.register(nsxt);
        } else {
            LOGGER.infoOp("No appliance URL configured, NSXTLoadBalancer resources will not be reconciled");
        }

        // VSphereVM
        ResourceController<VSphereVM> vmController = new ResourceController<>(VSphereVM.RESOURCE_KIND, namespace,
                informer(VSphereVM.RESOURCE_KIND, Crds.vsphereVmOperation(client)),
                new VSphereVMReconciler(client, credentialsProvider, backend.sessionProvider(), backend.virtualMachineService(), config.getRequeueInterval()),
                controllerConfig, metricsProvider);
        controllers.add(vmController);

        // VSphereMachine
        ResourceController<VSphereMachine> machineController = new ResourceController<>(VSphereMachine.RESOURCE_KIND, namespace,
                informer(VSphereMachine.RESOURCE_KIND, Crds.vsphereMachineOperation(client)),
                new VSphereMachineReconciler(client, cloneSpecResolver, config.getRequeueInterval()),
                controllerConfig, metricsProvider);
        machineController.watch(Machine.RESOURCE_KIND, informer(Machine.RESOURCE_KIND, Crds.machineOperation(client)),
                machine -> infrastructureRef(VSphereMachine.RESOURCE_KIND, machine, machine.getSpec() != null ? machine.getSpec().getInfrastructureRef() : null));
        machineController.watch(VSphereVM.RESOURCE_KIND, informer(VSphereVM.RESOURCE_KIND, Crds.vsphereVmOperation(client)),
                vm -> ownedBy(VSphereMachine.RESOURCE_KIND, vm));
        controllers.add(machineController);

        // VSphereCluster
        SharedIndexInformer<VSphereCluster> clusterInformer = informer(VSphereCluster.RESOURCE_KIND, Crds.vsphereClusterOperation(client));
        ResourceController<VSphereCluster> clusterController = new ResourceController<>(VSphereCluster.RESOURCE_KIND, namespace,
                clusterInformer,
                new VSphereClusterReconciler(client, credentialsProvider, backend.sessionProvider(), loadBalancers, workloadClusters,
                        new AddonInstaller(config.addonImages()), triggers, eventChannel, config.getRequeueInterval()),
                controllerConfig, metricsProvider);
        clusterController.watch(Cluster.RESOURCE_KIND, informer(Cluster.RESOURCE_KIND, Crds.clusterOperation(client)),
                cluster -> infrastructureRef(VSphereCluster.RESOURCE_KIND, cluster, cluster.getSpec() != null ? cluster.getSpec().getInfrastructureRef() : null));
        clusterController.watch(VSphereClusterIdentity.RESOURCE_KIND, clusterIdentityInformer(),
                identity -> usingIdentity(identity, clusterInformer));
        clusterController.watch(VSphereMachine.RESOURCE_KIND, informer(VSphereMachine.RESOURCE_KIND, Crds.vsphereMachineOperation(client)),
                this::infrastructureClusterOf);
        clusterController.watch(HAProxyLoadBalancer.RESOURCE_KIND, informer(HAProxyLoadBalancer.RESOURCE_KIND, Crds.haproxyLoadBalancerOperation(client)),
                lb -> ownedBy(VSphereCluster.RESOURCE_KIND, lb));
        if (nsxt != null) {
            clusterController.watch(NSXTLoadBalancer.RESOURCE_KIND, informer(NSXTLoadBalancer.RESOURCE_KIND, Crds.nsxtLoadBalancerOperation(client)),
                    lb -> ownedBy(VSphereCluster.RESOURCE_KIND, lb));
        }
        eventChannel.register(VSphereCluster.RESOURCE_KIND, clusterController::enqueue);
        controllers.add(clusterController);

        // Load balancers
        SharedIndexInformer<HAProxyLoadBalancer> haproxyInformer = informer(HAProxyLoadBalancer.RESOURCE_KIND, Crds.haproxyLoadBalancerOperation(client));
        ResourceController<HAProxyLoadBalancer> haproxyController = new ResourceController<>(HAProxyLoadBalancer.RESOURCE_KIND, namespace,
                haproxyInformer,
                new HAProxyLoadBalancerReconciler(client, haproxy, config.getRequeueInterval()),
                controllerConfig, metricsProvider);
        haproxyController.watch(VSphereVM.RESOURCE_KIND, informer(VSphereVM.RESOURCE_KIND, Crds.vsphereVmOperation(client)),
                vm -> ownedBy(HAProxyLoadBalancer.RESOURCE_KIND, vm));
        haproxyController.watch(Machine.RESOURCE_KIND, informer(Machine.RESOURCE_KIND, Crds.machineOperation(client)),
                machine -> sameCluster(HAProxyLoadBalancer.RESOURCE_KIND, machine, haproxyInformer));
        controllers.add(haproxyController);

        if (nsxt != null) {
            SharedIndexInformer<NSXTLoadBalancer> nsxtInformer = informer(NSXTLoadBalancer.RESOURCE_KIND, Crds.nsxtLoadBalancerOperation(client));
            ResourceController<NSXTLoadBalancer> nsxtController = new ResourceController<>(NSXTLoadBalancer.RESOURCE_KIND, namespace,
                    nsxtInformer,
                    new NSXTLoadBalancerReconciler(client, nsxt, config.getRequeueInterval()),
                    controllerConfig, metricsProvider);
            nsxtController.watch(Machine.RESOURCE_KIND, informer(Machine.RESOURCE_KIND, Crds.machineOperation(client)),
                    machine -> sameCluster(NSXTLoadBalancer.RESOURCE_KIND, machine, nsxtInformer));
            controllers.add(nsxtController);
        }

        // Service discovery
        SharedIndexInformer<VSphereCluster> discoveryInformer = informer(VSphereCluster.RESOURCE_KIND, Crds.vsphereClusterOperation(client));
        ResourceController<VSphereCluster> discoveryController = new ResourceController<>(ServiceDiscoveryReconciler.KIND, namespace,
                discoveryInformer,
                new ServiceDiscoveryReconciler(client, workloadClusters, config.getServiceDiscoveryRequeueInterval()),
                controllerConfig, metricsProvider);
        discoveryController.watch("Service", client.services().inNamespace(ServiceDiscoveryReconciler.VIP_SERVICE_NAMESPACE)
                        .withName(ServiceDiscoveryReconciler.VIP_SERVICE_NAME).runnableInformer(0),
                service -> all(ServiceDiscoveryReconciler.KIND, discoveryInformer));
        discoveryController.watch("ConfigMap", client.configMaps().inNamespace(ServiceDiscoveryReconciler.CLUSTER_INFO_NAMESPACE)
                        .withName(ServiceDiscoveryReconciler.CLUSTER_INFO_NAME).runnableInformer(0),
                configMap -> all(ServiceDiscoveryReconciler.KIND, discoveryInformer));
        controllers.add(discoveryController);

        // VSphereDeploymentZone
        ResourceController<VSphereDeploymentZone> zoneController = new ResourceController<>(VSphereDeploymentZone.RESOURCE_KIND, namespace,
                informer(VSphereDeploymentZone.RESOURCE_KIND, Crds.deploymentZoneOperation(client)),
                new VSphereDeploymentZoneReconciler(client, credentialsProvider, backend.sessionProvider(), config.getRequeueInterval()),
                controllerConfig, metricsProvider);
        zoneController.watch(Machine.RESOURCE_KIND, informer(Machine.RESOURCE_KIND, Crds.machineOperation(client)),
                machine -> machine.getSpec() != null && machine.getSpec().getFailureDomain() != null
                        ? List.of(new SimplifiedReconciliation(VSphereDeploymentZone.RESOURCE_KIND, machine.getMetadata().getNamespace(), machine.getSpec().getFailureDomain()))
                        : List.of());
        controllers.add(zoneController);

        // VSphereClusterIdentity
        ResourceController<VSphereClusterIdentity> identityController = new ResourceController<>(VSphereClusterIdentity.RESOURCE_KIND, namespace,
                clusterIdentityInformer(),
                new VSphereClusterIdentityReconciler(client, config.getOperatorNamespace(), config.getRequeueInterval()),
                controllerConfig, metricsProvider);
        controllers.add(identityController);
    }

    /**
     * Returns the informer of the kind. Controllers watching the same kind share one informer and its watch.
     */
    @SuppressWarnings("unchecked")
    private <T extends HasMetadata, L extends KubernetesResourceList<T>> SharedIndexInformer<T> informer(String kind, MixedOperation<T, L, Resource<T>> operation) {
        return (SharedIndexInformer<T>) informers.computeIfAbsent(kind, k -> {
            if (ConfigParameter.ANY_NAMESPACE.equals(namespace)) {
                return operation.inAnyNamespace().runnableInformer(0);
            } else {
                return operation.inNamespace(namespace).runnableInformer(0);
            }
        });
    }

    /**
     * VSphereClusterIdentities are cluster scoped and are watched regardless of the watched namespace
     */
    @SuppressWarnings("unchecked")
    private SharedIndexInformer<VSphereClusterIdentity> clusterIdentityInformer() {
        return (SharedIndexInformer<VSphereClusterIdentity>) informers.computeIfAbsent(VSphereClusterIdentity.RESOURCE_KIND,
                k -> Crds.clusterIdentityOperation(client).runnableInformer(0));
    }

    /*test*/ Set<String> informerKinds() {
        return informers.keySet();
    }

    private static Collection<SimplifiedReconciliation> infrastructureRef(String kind, HasMetadata resource, ObjectReference ref) {
        if (ref == null || !kind.equals(ref.getKind()) || ref.getName() == null) {
            return List.of();
        }

        return List.of(new SimplifiedReconciliation(kind, resource.getMetadata().getNamespace(), ref.getName()));
    }

    private static Collection<SimplifiedReconciliation> ownedBy(String kind, HasMetadata resource) {
        OwnerReference owner = OwnerReferences.controllerOf(resource);

        if (owner == null || !kind.equals(owner.getKind())) {
            return List.of();
        }

        return List.of(new SimplifiedReconciliation(kind, resource.getMetadata().getNamespace(), owner.getName()));
    }

    private static Collection<SimplifiedReconciliation> usingIdentity(VSphereClusterIdentity identity, SharedIndexInformer<VSphereCluster> informer) {
        String name = identity.getMetadata().getName();

        return informer.getStore().list().stream()
                .filter(cluster -> cluster.getSpec() != null && cluster.getSpec().getIdentityRef() != null)
                .filter(cluster -> VSphereClusterIdentity.RESOURCE_KIND.equals(cluster.getSpec().getIdentityRef().getKind())
                        && name.equals(cluster.getSpec().getIdentityRef().getName()))
                .map(cluster -> new SimplifiedReconciliation(VSphereCluster.RESOURCE_KIND, cluster.getMetadata().getNamespace(), cluster.getMetadata().getName()))
                .collect(Collectors.toList());
    }

    private Collection<SimplifiedReconciliation> infrastructureClusterOf(VSphereMachine machine) {
        Cluster cluster = clusters.labelledCluster(machine);
        VSphereCluster vsphereCluster = cluster != null ? clusters.infrastructureCluster(cluster) : null;

        if (vsphereCluster == null) {
            return List.of();
        }

        return List.of(new SimplifiedReconciliation(VSphereCluster.RESOURCE_KIND, vsphereCluster.getMetadata().getNamespace(), vsphereCluster.getMetadata().getName()));
    }

    private static <T extends HasMetadata> Collection<SimplifiedReconciliation> sameCluster(String kind, HasMetadata resource, SharedIndexInformer<T> informer) {
        String clusterName = Labels.fromResource(resource).clusterName();

        if (clusterName == null) {
            return List.of();
        }

        return informer.getStore().list().stream()
                .filter(lb -> resource.getMetadata().getNamespace().equals(lb.getMetadata().getNamespace()))
                .filter(lb -> clusterName.equals(Labels.fromResource(lb).clusterName()))
                .map(lb -> new SimplifiedReconciliation(kind, lb.getMetadata().getNamespace(), lb.getMetadata().getName()))
                .collect(Collectors.toList());
    }

    private static <T extends HasMetadata> Collection<SimplifiedReconciliation> all(String kind, SharedIndexInformer<T> informer) {
        return informer.getStore().list().stream()
                .map(resource -> new SimplifiedReconciliation(kind, resource.getMetadata().getNamespace(), resource.getMetadata().getName()))
                .collect(Collectors.toList());
    }

    /**
     * @return  Kinds handled by the controllers
     */
    public Set<String> kinds() {
        return controllers.stream().map(ResourceController::kind).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Starts all controllers
     */
    public void start() {
        LOGGER.infoOp("Starting {} controllers watching namespace {}", controllers.size(), namespace);

        for (ResourceController<?> controller : controllers) {
            controller.start();
        }
    }

    /**
     * Stops all controllers, the API server pollers and the clients of the workload clusters
     */
    public void stop() {
        for (ResourceController<?> controller : controllers) {
            controller.stop();
        }

        pollerExecutor.shutdownNow();
        workloadClusters.close();
    }

    @Override
    public boolean isAlive() {
        return controllers.stream().allMatch(ResourceController::isAlive);
    }

    @Override
    public boolean isReady() {
        return controllers.stream().allMatch(ResourceController::isReady);
    }
}
