/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.CloudProviderConfiguration;
import io.capv.api.model.vsphere.GlobalConfig;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.resource.KubernetesResources;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.Map;
import java.util.TreeMap;

/**
 * Secret with the vCenter credentials read by the cloud controller manager. It carries the username and password for
 * each virtual center of the cluster.
 */
public class CloudCredentialsAddon implements Addon {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(CloudCredentialsAddon.class);

    @Override
    public String name() {
        return "cloud-credentials";
    }

    @Override
    public void install(Reconciliation reconciliation, KubernetesClient workload, VSphereCluster vsphereCluster, Credentials credentials) {
        if (KubernetesResources.createIfAbsent(reconciliation, workload, secret(vsphereCluster, credentials))) {
            LOGGER.infoCr(reconciliation, "Created the cloud provider credentials Secret");
        }
    }

    /**
     * @param vsphereCluster    The VSphereCluster
     * @param credentials       vCenter credentials
     *
     * @return  The credentials Secret
     */
    /* test */ static Secret secret(VSphereCluster vsphereCluster, Credentials credentials) {
        CloudProviderConfiguration cpc = Addons.requireVirtualCenters(vsphereCluster);
        GlobalConfig global = cpc.getGlobal();

        Map<String, String> data = new TreeMap<>();
        for (String server : cpc.getVirtualCenter().keySet()) {
            data.put(server + ".username", credentials.username());
            data.put(server + ".password", credentials.password());
        }

        return new SecretBuilder()
                .withNewMetadata()
                    .withName(global != null && global.getSecretName() != null && !global.getSecretName().isEmpty()
                            ? global.getSecretName() : CloudConfigBuilder.DEFAULT_SECRET_NAME)
                    .withNamespace(global != null && global.getSecretNamespace() != null && !global.getSecretNamespace().isEmpty()
                            ? global.getSecretNamespace() : CloudConfigBuilder.DEFAULT_SECRET_NAMESPACE)
                .endMetadata()
                .withType("Opaque")
                .withStringData(data)
                .build();
    }
}
