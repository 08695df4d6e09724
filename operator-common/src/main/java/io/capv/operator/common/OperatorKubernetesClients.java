/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Creates the clients of the management cluster and of the workload clusters. All of them carry the same user
 * agent so that their requests can be found in the API server audit logs.
 */
public class OperatorKubernetesClients {
    private final String userAgent;

    /**
     * @param component     Component name
     * @param version       Component version, null when not running from a packaged jar
     */
    public OperatorKubernetesClients(String component, String version) {
        this.userAgent = component + "/" + (version != null ? version : "dev");
    }

    /**
     * @return  Client of the cluster the operator runs in, configured from the service account or the local kubeconfig
     */
    public KubernetesClient managementCluster() {
        return create(Config.autoConfigure(null));
    }

    /**
     * @param kubeconfig    Content of a kubeconfig file
     *
     * @return  Client of the cluster described by the kubeconfig (current context)
     */
    public KubernetesClient fromKubeconfig(String kubeconfig) {
        return create(Config.fromKubeconfig(kubeconfig));
    }

    /* test */ String userAgent() {
        return userAgent;
    }

    private KubernetesClient create(Config config) {
        config.setUserAgent(userAgent);
        return new KubernetesClientBuilder().withConfig(config).build();
    }
}
