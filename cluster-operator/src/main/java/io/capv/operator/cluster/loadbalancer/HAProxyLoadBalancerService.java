/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.capv.api.Crds;
import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.common.Constants;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancer;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancerList;
import io.capv.api.model.loadbalancer.LoadBalancerStatus;
import io.capv.api.model.loadbalancer.SSHUser;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.cluster.machine.CloneSpecResolver;
import io.capv.operator.cluster.vm.VSphereVMReconciler;
import io.capv.operator.cluster.vm.VSphereVMs;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.model.Labels;
import io.capv.operator.common.resource.OwnerReferences;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * HAProxy load balancers run in a dedicated VM. The HAProxy configuration is passed to the VM as cloud-init user data
 * through a bootstrap Secret and the VM itself is a VSphereVM resource owned by the load balancer.
 */
public class HAProxyLoadBalancerService implements LoadBalancerService<HAProxyLoadBalancer> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(HAProxyLoadBalancerService.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE));

    /**
     * Path of the HAProxy configuration inside the VM
     */
    public static final String HAPROXY_CONFIG_PATH = "/etc/haproxy/haproxy.cfg";

    private final KubernetesClient client;
    private final ClusterResources clusters;
    private final VSphereVMs vms;
    private final CloneSpecResolver cloneSpecResolver;

    /**
     * Constructs the service
     *
     * @param client                Kubernetes client
     * @param cloneSpecResolver     Resolves the clone spec of the load balancer VMs
     */
    public HAProxyLoadBalancerService(KubernetesClient client, CloneSpecResolver cloneSpecResolver) {
        this.client = client;
        this.clusters = new ClusterResources(client);
        this.vms = new VSphereVMs(client);
        this.cloneSpecResolver = cloneSpecResolver;
    }

    /**
     * @param loadBalancerName  Name of the load balancer
     *
     * @return  Name of the VSphereVM backing the load balancer
     */
    public static String vmName(String loadBalancerName) {
        return loadBalancerName + "-lb";
    }

    /**
     * @param loadBalancerName  Name of the load balancer
     *
     * @return  Name of the Secret with the bootstrap data of the load balancer VM
     */
    public static String bootstrapSecretName(String loadBalancerName) {
        return loadBalancerName + "-bootstrap";
    }

    @Override
    public String kind() {
        return HAProxyLoadBalancer.RESOURCE_KIND;
    }

    @Override
    public MixedOperation<HAProxyLoadBalancer, HAProxyLoadBalancerList, Resource<HAProxyLoadBalancer>> operation() {
        return Crds.haproxyLoadBalancerOperation(client);
    }

    @Override
    public LoadBalancerStatus reconcile(Reconciliation reconciliation, HAProxyLoadBalancer loadBalancer, List<LoadBalancerMember> members) {
        String namespace = loadBalancer.getMetadata().getNamespace();
        String name = loadBalancer.getMetadata().getName();
        String clusterName = ClusterResources.clusterName(loadBalancer);

        String haproxyConfig = new HAProxyConfigurationBuilder()
                .withHealthEndpoint()
                .withApiServer(port(loadBalancer), members)
                .build();

        reconcileBootstrapSecret(reconciliation, loadBalancer, clusterName, userData(haproxyConfig, loadBalancer.getSpec().getUser()));

        Cluster cluster = clusters.ownerCluster(loadBalancer);
        VSphereCluster vsphereCluster = cluster != null ? clusters.infrastructureCluster(cluster) : null;

        VSphereVM vm = vms.createOrUpdate(reconciliation, namespace, vmName(name), desired -> {
            Labels labels = Labels.fromResource(desired);
            if (clusterName != null) {
                labels = labels.withClusterName(clusterName);
            }
            desired.getMetadata().setLabels(new HashMap<>(labels.toMap()));

            if (OwnerReferences.controllerOf(desired) == null) {
                OwnerReferences.add(desired, OwnerReferences.of(loadBalancer, true));
            }

            desired.getSpec().setBootstrapRef(new ObjectReferenceBuilder()
                    .withApiVersion("v1")
                    .withKind("Secret")
                    .withNamespace(namespace)
                    .withName(bootstrapSecretName(name))
                    .build());

            cloneSpecResolver.resolve(desired.getSpec(), loadBalancer.getSpec().getVirtualMachineConfiguration(), vsphereCluster);
        });

        LoadBalancerStatus status = new LoadBalancerStatus();

        if (vm.getStatus() != null
                && vm.getStatus().isReady()
                && vm.getStatus().getAddresses() != null
                && !vm.getStatus().getAddresses().isEmpty()) {
            status.setReady(true);
            status.setAddress(vm.getStatus().getAddresses().get(0));
        } else {
            LOGGER.debugCr(reconciliation, "Load balancer VM {} is not ready yet", vm.getMetadata().getName());
            status.setReady(false);
        }

        return status;
    }

    private void reconcileBootstrapSecret(Reconciliation reconciliation, HAProxyLoadBalancer loadBalancer, String clusterName, String userData) {
        String namespace = loadBalancer.getMetadata().getNamespace();
        String secretName = bootstrapSecretName(loadBalancer.getMetadata().getName());
        String encoded = Base64.getEncoder().encodeToString(userData.getBytes(StandardCharsets.UTF_8));

        Secret current = client.secrets().inNamespace(namespace).withName(secretName).get();

        if (current == null) {
            LOGGER.infoCr(reconciliation, "Creating bootstrap Secret {}", secretName);

            Secret secret = new SecretBuilder()
                    .withNewMetadata()
                        .withName(secretName)
                        .withNamespace(namespace)
                        .withLabels(clusterName != null ? Labels.forCluster(clusterName).toMap() : Map.of())
                        .withOwnerReferences(OwnerReferences.of(loadBalancer, true))
                    .endMetadata()
                    .withType("Opaque")
                    .addToData(VSphereVMReconciler.BOOTSTRAP_DATA_KEY, encoded)
                    .build();

            client.secrets().inNamespace(namespace).resource(secret).create();
        } else if (current.getData() == null || !Objects.equals(current.getData().get(VSphereVMReconciler.BOOTSTRAP_DATA_KEY), encoded)) {
            LOGGER.infoCr(reconciliation, "Updating bootstrap Secret {}", secretName);

            Map<String, String> data = current.getData() != null ? new HashMap<>(current.getData()) : new HashMap<>();
            data.put(VSphereVMReconciler.BOOTSTRAP_DATA_KEY, encoded);
            current.setData(data);

            client.secrets().inNamespace(namespace).resource(current).update();
        } else {
            LOGGER.debugCr(reconciliation, "Bootstrap Secret {} is up to date", secretName);
        }
    }

    /**
     * Renders the cloud-init user data of the load balancer VM
     *
     * @param haproxyConfig     HAProxy configuration
     * @param user              SSH user or null
     *
     * @return  The cloud-config document
     */
    /* test */ static String userData(String haproxyConfig, SSHUser user) {
        Map<String, Object> cloudConfig = new LinkedHashMap<>();

        Map<String, Object> configFile = new LinkedHashMap<>();
        configFile.put("path", HAPROXY_CONFIG_PATH);
        configFile.put("owner", "haproxy:haproxy");
        configFile.put("permissions", "0640");
        configFile.put("content", haproxyConfig);
        cloudConfig.put("write_files", List.of(configFile));

        cloudConfig.put("runcmd", List.of("systemctl restart haproxy"));

        if (user != null && user.getName() != null) {
            Map<String, Object> sshUser = new LinkedHashMap<>();
            sshUser.put("name", user.getName());
            sshUser.put("sudo", "ALL=(ALL) NOPASSWD:ALL");
            if (user.getAuthorizedKeys() != null && !user.getAuthorizedKeys().isEmpty()) {
                sshUser.put("ssh_authorized_keys", user.getAuthorizedKeys());
            }
            cloudConfig.put("users", List.of(sshUser));
        }

        try {
            return "#cloud-config\n" + YAML_MAPPER.writeValueAsString(cloudConfig);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render the load balancer user data", e);
        }
    }

    @Override
    public boolean delete(Reconciliation reconciliation, HAProxyLoadBalancer loadBalancer) {
        String namespace = loadBalancer.getMetadata().getNamespace();
        VSphereVM vm = vms.get(namespace, vmName(loadBalancer.getMetadata().getName()));

        if (vm != null) {
            vms.delete(reconciliation, vm);
            return false;
        }

        client.secrets().inNamespace(namespace).withName(bootstrapSecretName(loadBalancer.getMetadata().getName())).delete();
        return true;
    }

    @Override
    public int port(HAProxyLoadBalancer loadBalancer) {
        return Constants.DEFAULT_API_SERVER_PORT;
    }
}
