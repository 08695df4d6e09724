/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster;

import io.capv.api.model.cluster.Cluster;
import io.capv.operator.cluster.ResourceUtils;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.capv.operator.cluster.ResourceUtils.CLUSTER_NAME;
import static io.capv.operator.cluster.ResourceUtils.NAMESPACE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@EnableKubernetesMockClient(crud = true)
public class WorkloadClusterClientProviderTest {
    KubernetesClient client;

    private Cluster cluster;
    private List<String> createdFor;
    private WorkloadClusterClientProvider provider;

    @BeforeEach
    public void setUp() {
        cluster = new ResourceUtils(client).cluster(true, true);
        createdFor = new ArrayList<>();
        provider = new WorkloadClusterClientProvider(client, kubeconfig -> {
            createdFor.add(kubeconfig);
            return mock(KubernetesClient.class);
        });
    }

    private void kubeconfigSecret(String kubeconfig) {
        Secret secret = new SecretBuilder()
                .withNewMetadata()
                    .withName(WorkloadClusterClientProvider.kubeconfigSecretName(CLUSTER_NAME))
                    .withNamespace(NAMESPACE)
                .endMetadata()
                .addToData(WorkloadClusterClientProvider.KUBECONFIG_KEY, ResourceUtils.base64(kubeconfig))
                .build();

        client.secrets().inNamespace(NAMESPACE).resource(secret).createOr(existing -> existing.update());
    }

    @Test
    public void testMissingKubeconfig() {
        assertThat(provider.get(cluster), is(nullValue()));
        assertThat(provider.isOnline(cluster), is(false));
        assertThat(createdFor.isEmpty(), is(true));
    }

    @Test
    public void testClientIsCachedUntilTheKubeconfigChanges() {
        kubeconfigSecret("kubeconfig-1");

        KubernetesClient first = provider.get(cluster);
        assertThat(provider.get(cluster), is(sameInstance(first)));
        assertThat(createdFor, is(List.of("kubeconfig-1")));

        kubeconfigSecret("kubeconfig-2");

        KubernetesClient second = provider.get(cluster);
        assertThat(second, is(not(sameInstance(first))));
        assertThat(createdFor, is(List.of("kubeconfig-1", "kubeconfig-2")));
        verify(first).close();
        verify(second, never()).close();
    }

    @Test
    public void testRemoveClosesTheClient() {
        kubeconfigSecret("kubeconfig-1");
        KubernetesClient workload = provider.get(cluster);

        provider.remove(NAMESPACE, CLUSTER_NAME);
        verify(workload).close();

        provider.get(cluster);
        assertThat(createdFor.size(), is(2));
    }

    @Test
    public void testOnlineWorkloadCluster() {
        kubeconfigSecret("kubeconfig-1");
        WorkloadClusterClientProvider online = new WorkloadClusterClientProvider(client, kubeconfig -> client);

        assertThat(online.isOnline(cluster), is(true));
    }
}
