/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import io.fabric8.kubernetes.client.KubernetesClient;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class OperatorKubernetesClientsTest {
    private static final String KUBECONFIG = """
            apiVersion: v1
            kind: Config
            clusters:
            - name: workload
              cluster:
                server: https://10.0.0.1:6443
                insecure-skip-tls-verify: true
            users:
            - name: admin
              user:
                token: abc
            contexts:
            - name: admin@workload
              context:
                cluster: workload
                user: admin
            current-context: admin@workload
            """;

    @Test
    public void testUserAgent() {
        assertThat(new OperatorKubernetesClients("capv-operator", "0.1.0").userAgent(), is("capv-operator/0.1.0"));
        assertThat(new OperatorKubernetesClients("capv-operator", null).userAgent(), is("capv-operator/dev"));
    }

    @Test
    public void testWorkloadClientFromKubeconfig() {
        try (KubernetesClient client = new OperatorKubernetesClients("capv-operator", "0.1.0").fromKubeconfig(KUBECONFIG)) {
            assertThat(client.getConfiguration().getMasterUrl(), containsString("10.0.0.1:6443"));
            assertThat(client.getConfiguration().getUserAgent(), is("capv-operator/0.1.0"));
        }
    }
}
