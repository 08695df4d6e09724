/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.resource;

import io.capv.operator.common.Reconciliation;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

@EnableKubernetesMockClient(crud = true)
public class KubernetesResourcesTest {
    KubernetesClient client;

    @Test
    public void testCreateIfAbsentKeepsExisting() {
        ConfigMap original = new ConfigMapBuilder()
                .withNewMetadata()
                    .withName("vsphere-cloud-config")
                    .withNamespace("kube-system")
                .endMetadata()
                .addToData("vsphere.conf", "original")
                .build();
        ConfigMap changed = new ConfigMapBuilder(original).addToData("vsphere.conf", "changed").build();

        assertThat(KubernetesResources.createIfAbsent(Reconciliation.DUMMY_RECONCILIATION, client, original), is(true));
        assertThat(KubernetesResources.createIfAbsent(Reconciliation.DUMMY_RECONCILIATION, client, changed), is(false));

        ConfigMap stored = client.configMaps().inNamespace("kube-system").withName("vsphere-cloud-config").get();
        assertThat(stored.getData().get("vsphere.conf"), is("original"));
    }
}
