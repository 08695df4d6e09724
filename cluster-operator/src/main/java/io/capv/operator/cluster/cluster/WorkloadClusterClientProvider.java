/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster;

import io.capv.api.model.cluster.Cluster;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Provides clients for the workload clusters. The clients are created from the kubeconfig Secret of the cluster and
 * cached until the kubeconfig changes.
 */
public class WorkloadClusterClientProvider implements AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(WorkloadClusterClientProvider.class);

    /**
     * Key of the kubeconfig in the kubeconfig Secret
     */
    public static final String KUBECONFIG_KEY = "value";

    private final KubernetesClient client;
    private final Function<String, KubernetesClient> clientFactory;
    private final Map<String, CachedClient> clients = new ConcurrentHashMap<>();

    private record CachedClient(String kubeconfig, KubernetesClient client) { }

    /**
     * @param client            Client for the management cluster
     * @param clientFactory     Creates a client from a kubeconfig
     */
    public WorkloadClusterClientProvider(KubernetesClient client, Function<String, KubernetesClient> clientFactory) {
        this.client = client;
        this.clientFactory = clientFactory;
    }

    /**
     * @param clusterName   Name of the cluster
     *
     * @return  Name of the Secret with the kubeconfig of the cluster
     */
    public static String kubeconfigSecretName(String clusterName) {
        return clusterName + "-kubeconfig";
    }

    /**
     * @param cluster   The cluster
     *
     * @return  Client for the workload cluster or null when its kubeconfig is not available yet
     */
    public KubernetesClient get(Cluster cluster) {
        String namespace = cluster.getMetadata().getNamespace();
        String name = cluster.getMetadata().getName();
        Secret secret = client.secrets().inNamespace(namespace).withName(kubeconfigSecretName(name)).get();

        if (secret == null || secret.getData() == null || secret.getData().get(KUBECONFIG_KEY) == null) {
            LOGGER.debug("Kubeconfig of cluster {}/{} is not available", namespace, name);
            return null;
        }

        String kubeconfig = new String(Base64.getDecoder().decode(secret.getData().get(KUBECONFIG_KEY)), StandardCharsets.UTF_8);

        CachedClient cached = clients.compute(namespace + "/" + name, (key, current) -> {
            if (current != null && Objects.equals(current.kubeconfig(), kubeconfig)) {
                return current;
            }

            if (current != null) {
                LOGGER.debug("Kubeconfig of cluster {} changed, replacing its client", key);
                current.client().close();
            }

            return new CachedClient(kubeconfig, clientFactory.apply(kubeconfig));
        });

        return cached.client();
    }

    /**
     * Checks whether the API server of the workload cluster answers
     *
     * @param cluster   The cluster
     *
     * @return  True if the nodes of the workload cluster can be listed
     */
    public boolean isOnline(Cluster cluster) {
        KubernetesClient workload = get(cluster);

        if (workload == null) {
            return false;
        }

        try {
            workload.nodes().list();
            return true;
        } catch (KubernetesClientException e) {
            LOGGER.debug("API server of cluster {}/{} is not reachable: {}", cluster.getMetadata().getNamespace(), cluster.getMetadata().getName(), e.getMessage());
            return false;
        }
    }

    /**
     * Closes and forgets the client of a cluster
     *
     * @param namespace     Namespace of the cluster
     * @param name          Name of the cluster
     */
    public void remove(String namespace, String name) {
        CachedClient cached = clients.remove(namespace + "/" + name);

        if (cached != null) {
            cached.client().close();
        }
    }

    @Override
    public void close() {
        clients.values().forEach(cached -> cached.client().close());
        clients.clear();
    }
}
