/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.servicediscovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterStatus;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.cluster.cluster.WorkloadClusterClientProvider;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.KubernetesResources;
import io.capv.operator.common.resource.ResourcePatcher;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.EndpointAddress;
import io.fabric8.kubernetes.api.model.EndpointAddressBuilder;
import io.fabric8.kubernetes.api.model.EndpointSubset;
import io.fabric8.kubernetes.api.model.EndpointSubsetBuilder;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.EndpointsBuilder;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.LoadBalancerIngress;
import io.fabric8.kubernetes.api.model.NamedCluster;
import io.fabric8.kubernetes.api.model.NamedContext;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Publishes the address of the supervisor API server inside the workload clusters. The address is exposed as the
 * headless Service {@code default/supervisor} and its Endpoints, so workloads can reach the supervisor by name.
 */
public class ServiceDiscoveryReconciler implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ServiceDiscoveryReconciler.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})(\\.\\d{1,3}){3}$");

    /**
     * Kind used for the controller of this reconciler
     */
    public static final String KIND = "VSphereClusterServiceDiscovery";

    /* test */ static final String SUPERVISOR_NAMESPACE = "default";
    /* test */ static final String SUPERVISOR_NAME = "supervisor";
    /* test */ static final int SUPERVISOR_PORT = 6443;
    /* test */ static final String SUPERVISOR_PORT_NAME = "https";

    /**
     * Namespace of the load balancer Service of the supervisor API server
     */
    public static final String VIP_SERVICE_NAMESPACE = "kube-system";

    /**
     * Name of the load balancer Service of the supervisor API server
     */
    public static final String VIP_SERVICE_NAME = "kube-apiserver-lb-svc";

    /**
     * Namespace of the cluster-info ConfigMap
     */
    public static final String CLUSTER_INFO_NAMESPACE = "kube-public";

    /**
     * Name of the cluster-info ConfigMap
     */
    public static final String CLUSTER_INFO_NAME = "cluster-info";

    /* test */ static final String CLUSTER_INFO_KUBECONFIG_KEY = "kubeconfig";

    private final KubernetesClient client;
    private final ClusterResources clusters;
    private final WorkloadClusterClientProvider workloadClusters;
    private final Duration requeueInterval;

    /**
     * @param client            Kubernetes client of the management cluster
     * @param workloadClusters  Clients of the workload clusters
     * @param requeueInterval   Interval between two checks of the same cluster
     */
    public ServiceDiscoveryReconciler(KubernetesClient client, WorkloadClusterClientProvider workloadClusters, Duration requeueInterval) {
        this.client = client;
        this.clusters = new ClusterResources(client);
        this.workloadClusters = workloadClusters;
        this.requeueInterval = requeueInterval;
    }

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        VSphereCluster vsphereCluster = Crds.vsphereClusterOperation(client).inNamespace(reconciliation.namespace()).withName(reconciliation.name()).get();

        if (vsphereCluster == null || Finalizers.isDeleting(vsphereCluster)) {
            LOGGER.debugCr(reconciliation, "VSphereCluster no longer exists or is being deleted");
            return ReconcileResult.done();
        }

        Cluster cluster = clusters.ownerCluster(vsphereCluster);
        if (cluster == null) {
            LOGGER.debugCr(reconciliation, "Waiting for the owner Cluster to be set");
            return ReconcileResult.done();
        } else if (ClusterResources.isPaused(cluster, vsphereCluster)) {
            LOGGER.infoCr(reconciliation, "Reconciliation is paused");
            return ReconcileResult.done();
        }

        KubernetesClient workload;
        try {
            workload = workloadClusters.isOnline(cluster) ? workloadClusters.get(cluster) : null;
        } catch (KubernetesClientException e) {
            LOGGER.debugCr(reconciliation, "Workload cluster is not reachable: {}", e.getMessage());
            workload = null;
        }

        if (workload == null) {
            LOGGER.debugCr(reconciliation, "Workload cluster is not available yet");
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        if (vsphereCluster.getStatus() == null) {
            vsphereCluster.setStatus(new VSphereClusterStatus());
        }

        KubernetesClient workloadClient = workload;
        ResourcePatcher<VSphereClusterStatus, VSphereCluster> patcher = new ResourcePatcher<>(reconciliation, Crds.vsphereClusterOperation(client), vsphereCluster);

        return patcher.reconcile(() -> reconcileServiceDiscovery(reconciliation, vsphereCluster.getStatus(), workloadClient));
    }

    private ReconcileResult reconcileServiceDiscovery(Reconciliation reconciliation, VSphereClusterStatus status, KubernetesClient workload) {
        KubernetesResources.createIfAbsent(reconciliation, workload, headlessService());

        String address = supervisorAddress(reconciliation);
        if (address == null) {
            Conditions.markFalse(status, ConditionTypes.SERVICE_DISCOVERY_READY, ConditionReasons.SUPERVISOR_HEADLESS_SERVICE_SETUP_FAILED,
                    Condition.SEVERITY_WARNING, "Unable to discover the supervisor API server address");
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        reconcileEndpoints(reconciliation, workload, address);
        Conditions.markTrue(status, ConditionTypes.SERVICE_DISCOVERY_READY);

        return ReconcileResult.requeueAfter(requeueInterval);
    }

    /**
     * The virtual IP of the load balancer Service wins over the floating IP from the cluster-info ConfigMap.
     *
     * @return  Address of the supervisor or null when it cannot be discovered
     */
    /* test */ String supervisorAddress(Reconciliation reconciliation) {
        String vip = virtualIp();
        if (vip != null) {
            LOGGER.debugCr(reconciliation, "Using the supervisor virtual IP {}", vip);
            return vip;
        }

        String fip = floatingIp(reconciliation);
        if (fip != null) {
            LOGGER.debugCr(reconciliation, "Using the supervisor floating IP {}", fip);
        }

        return fip;
    }

    private String virtualIp() {
        Service service = client.services().inNamespace(VIP_SERVICE_NAMESPACE).withName(VIP_SERVICE_NAME).get();

        if (service == null
                || service.getStatus() == null
                || service.getStatus().getLoadBalancer() == null
                || service.getStatus().getLoadBalancer().getIngress() == null
                || service.getStatus().getLoadBalancer().getIngress().isEmpty()) {
            return null;
        }

        LoadBalancerIngress ingress = service.getStatus().getLoadBalancer().getIngress().get(0);
        if (ingress.getIp() != null && !ingress.getIp().isEmpty()) {
            return ingress.getIp();
        } else if (ingress.getHostname() != null && !ingress.getHostname().isEmpty()) {
            return ingress.getHostname();
        }

        return null;
    }

    private String floatingIp(Reconciliation reconciliation) {
        ConfigMap clusterInfo = client.configMaps().inNamespace(CLUSTER_INFO_NAMESPACE).withName(CLUSTER_INFO_NAME).get();

        if (clusterInfo == null || clusterInfo.getData() == null || clusterInfo.getData().get(CLUSTER_INFO_KUBECONFIG_KEY) == null) {
            return null;
        }

        try {
            return serverHost(clusterInfo.getData().get(CLUSTER_INFO_KUBECONFIG_KEY));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.warnCr(reconciliation, "Failed to parse the kubeconfig in ConfigMap {}/{}: {}", CLUSTER_INFO_NAMESPACE, CLUSTER_INFO_NAME, e.getMessage());
            return null;
        }
    }

    /**
     * Picks the default cluster of a kubeconfig and returns the host of its server. The default cluster is the unnamed
     * one when it exists, otherwise the cluster of the current context.
     *
     * @param kubeconfig    Kubeconfig as YAML
     *
     * @return  Host of the server or null
     *
     * @throws JsonProcessingException when the kubeconfig is not valid YAML
     */
    /* test */ static String serverHost(String kubeconfig) throws JsonProcessingException {
        io.fabric8.kubernetes.api.model.Config config = YAML_MAPPER.readValue(kubeconfig, io.fabric8.kubernetes.api.model.Config.class);

        if (config == null || config.getClusters() == null) {
            return null;
        }

        NamedCluster selected = null;
        for (NamedCluster cluster : config.getClusters()) {
            if (cluster.getName() == null || cluster.getName().isEmpty()) {
                selected = cluster;
                break;
            }
        }

        if (selected == null && config.getCurrentContext() != null && config.getContexts() != null) {
            String clusterName = null;
            for (NamedContext context : config.getContexts()) {
                if (config.getCurrentContext().equals(context.getName()) && context.getContext() != null) {
                    clusterName = context.getContext().getCluster();
                }
            }

            for (NamedCluster cluster : config.getClusters()) {
                if (Objects.equals(clusterName, cluster.getName())) {
                    selected = cluster;
                }
            }
        }

        if (selected == null || selected.getCluster() == null || selected.getCluster().getServer() == null) {
            return null;
        }

        return URI.create(selected.getCluster().getServer()).getHost();
    }

    private void reconcileEndpoints(Reconciliation reconciliation, KubernetesClient workload, String address) {
        Endpoints desired = endpoints(address);
        Endpoints current = workload.endpoints().inNamespace(SUPERVISOR_NAMESPACE).withName(SUPERVISOR_NAME).get();

        if (current == null) {
            workload.endpoints().inNamespace(SUPERVISOR_NAMESPACE).resource(desired).create();
            LOGGER.infoCr(reconciliation, "Endpoints {}/{} created with address {}", SUPERVISOR_NAMESPACE, SUPERVISOR_NAME, address);
        } else if (!Objects.equals(summary(current), summary(desired))) {
            current.setSubsets(desired.getSubsets());
            workload.endpoints().inNamespace(SUPERVISOR_NAMESPACE).resource(current).update();
            LOGGER.infoCr(reconciliation, "Endpoints {}/{} updated with address {}", SUPERVISOR_NAMESPACE, SUPERVISOR_NAME, address);
        } else {
            LOGGER.debugCr(reconciliation, "Endpoints {}/{} unchanged", SUPERVISOR_NAMESPACE, SUPERVISOR_NAME);
        }
    }

    /**
     * Addresses and ports of the Endpoints. Fields defaulted by the API server are left out.
     */
    /* test */ static List<String> summary(Endpoints endpoints) {
        List<String> result = new ArrayList<>();

        if (endpoints.getSubsets() != null) {
            for (EndpointSubset subset : endpoints.getSubsets()) {
                if (subset.getAddresses() != null) {
                    subset.getAddresses().forEach(address -> result.add("address " + address.getIp() + " " + address.getHostname()));
                }

                if (subset.getPorts() != null) {
                    subset.getPorts().forEach(port -> result.add("port " + port.getName() + " " + port.getPort() + " " + port.getProtocol()));
                }
            }
        }

        return result;
    }

    /* test */ static Service headlessService() {
        return new ServiceBuilder()
                .withNewMetadata()
                    .withName(SUPERVISOR_NAME)
                    .withNamespace(SUPERVISOR_NAMESPACE)
                .endMetadata()
                .withNewSpec()
                    .withClusterIP("None")
                    .addNewPort()
                        .withName(SUPERVISOR_PORT_NAME)
                        .withProtocol("TCP")
                        .withPort(SUPERVISOR_PORT)
                        .withTargetPort(new IntOrString(SUPERVISOR_PORT))
                    .endPort()
                .endSpec()
                .build();
    }

    /* test */ static Endpoints endpoints(String address) {
        EndpointAddress endpointAddress = IPV4.matcher(address).matches() || address.contains(":")
                ? new EndpointAddressBuilder().withIp(address).build()
                : new EndpointAddressBuilder().withHostname(address).build();

        EndpointSubset subset = new EndpointSubsetBuilder()
                .withAddresses(List.of(endpointAddress))
                .addNewPort()
                    .withName(SUPERVISOR_PORT_NAME)
                    .withProtocol("TCP")
                    .withPort(SUPERVISOR_PORT)
                .endPort()
                .build();

        return new EndpointsBuilder()
                .withNewMetadata()
                    .withName(SUPERVISOR_NAME)
                    .withNamespace(SUPERVISOR_NAMESPACE)
                .endMetadata()
                .withSubsets(subset)
                .build();
    }
}
