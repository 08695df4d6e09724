/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancer;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.capv.api.model.vsphere.VSphereMachine;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.zone.VSphereDeploymentZone;
import io.capv.operator.cluster.cluster.WorkloadClusterClientProvider;
import io.capv.operator.cluster.servicediscovery.ServiceDiscoveryReconciler;
import io.capv.operator.cluster.vsphere.FakeVSphere;
import io.capv.operator.common.MicrometerMetricsProvider;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.mockito.Mockito.mock;

@EnableKubernetesMockClient(crud = true)
public class ClusterOperatorTest {
    KubernetesClient client;

    @Test
    public void testOneInformerPerKind() {
        ClusterOperator operator = new ClusterOperator(ClusterOperatorConfig.buildFromMap(Map.of("CAPV_NAMESPACE", "capv-system")), client,
                new FakeVSphere(), mock(WorkloadClusterClientProvider.class), new MicrometerMetricsProvider(new SimpleMeterRegistry()));

        assertThat(operator.kinds(), containsInAnyOrder(VSphereVM.RESOURCE_KIND, VSphereMachine.RESOURCE_KIND, VSphereCluster.RESOURCE_KIND,
                HAProxyLoadBalancer.RESOURCE_KIND, ServiceDiscoveryReconciler.KIND, VSphereDeploymentZone.RESOURCE_KIND,
                VSphereClusterIdentity.RESOURCE_KIND));

        // Machines and VSphereVMs are watched by several controllers through a single informer each
        assertThat(operator.informerKinds(), containsInAnyOrder(VSphereVM.RESOURCE_KIND, VSphereMachine.RESOURCE_KIND, Machine.RESOURCE_KIND,
                VSphereCluster.RESOURCE_KIND, Cluster.RESOURCE_KIND, HAProxyLoadBalancer.RESOURCE_KIND, VSphereDeploymentZone.RESOURCE_KIND,
                VSphereClusterIdentity.RESOURCE_KIND));
    }
}
