/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.servicediscovery;

import io.capv.api.Crds;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterSpec;
import io.capv.operator.cluster.ResourceUtils;
import io.capv.operator.cluster.cluster.WorkloadClusterClientProvider;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.model.Conditions;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.EndpointAddress;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.LoadBalancerIngressBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServiceStatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;

import static io.capv.operator.cluster.ResourceUtils.CLUSTER_NAME;
import static io.capv.operator.cluster.ResourceUtils.NAMESPACE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
public class ServiceDiscoveryReconcilerTest {
    private static final Duration REQUEUE = Duration.ofMinutes(2);
    private static final Reconciliation RECONCILIATION = ResourceUtils.reconciliation(ServiceDiscoveryReconciler.KIND, CLUSTER_NAME);

    private static final String KUBECONFIG = """
            apiVersion: v1
            kind: Config
            clusters:
            - name: ""
              cluster:
                server: https://192.168.1.100:6443
            - name: other
              cluster:
                server: https://192.168.1.200:6443
            contexts:
            - name: other
              context:
                cluster: other
            current-context: other
            """;

    // The workload cluster shares the mock API server with the management cluster
    KubernetesClient client;

    private ResourceUtils resources;
    private WorkloadClusterClientProvider workloadClusters;
    private ServiceDiscoveryReconciler reconciler;

    @BeforeEach
    public void setUp() {
        resources = new ResourceUtils(client);
        workloadClusters = mock(WorkloadClusterClientProvider.class);
        reconciler = new ServiceDiscoveryReconciler(client, workloadClusters, REQUEUE);
    }

    private void virtualIpService(String ip, String hostname) {
        Service service = client.services().inNamespace(ServiceDiscoveryReconciler.VIP_SERVICE_NAMESPACE).withName(ServiceDiscoveryReconciler.VIP_SERVICE_NAME).get();

        if (service == null) {
            service = client.services().inNamespace(ServiceDiscoveryReconciler.VIP_SERVICE_NAMESPACE).resource(new ServiceBuilder()
                    .withNewMetadata()
                        .withName(ServiceDiscoveryReconciler.VIP_SERVICE_NAME)
                        .withNamespace(ServiceDiscoveryReconciler.VIP_SERVICE_NAMESPACE)
                    .endMetadata()
                    .withNewSpec()
                        .withType("LoadBalancer")
                    .endSpec()
                    .build()).create();
        }

        service.setStatus(new ServiceStatusBuilder()
                .withNewLoadBalancer()
                    .withIngress(new LoadBalancerIngressBuilder().withIp(ip).withHostname(hostname).build())
                .endLoadBalancer()
                .build());
        client.services().inNamespace(ServiceDiscoveryReconciler.VIP_SERVICE_NAMESPACE).resource(service).updateStatus();
    }

    private void clusterInfo(String kubeconfig) {
        client.configMaps().inNamespace(ServiceDiscoveryReconciler.CLUSTER_INFO_NAMESPACE).resource(new ConfigMapBuilder()
                .withNewMetadata()
                    .withName(ServiceDiscoveryReconciler.CLUSTER_INFO_NAME)
                    .withNamespace(ServiceDiscoveryReconciler.CLUSTER_INFO_NAMESPACE)
                .endMetadata()
                .addToData(ServiceDiscoveryReconciler.CLUSTER_INFO_KUBECONFIG_KEY, kubeconfig)
                .build()).create();
    }

    private void workloadOnline() {
        when(workloadClusters.isOnline(any())).thenReturn(true);
        when(workloadClusters.get(any())).thenReturn(client);
    }

    private Endpoints supervisorEndpoints() {
        return client.endpoints().inNamespace(ServiceDiscoveryReconciler.SUPERVISOR_NAMESPACE).withName(ServiceDiscoveryReconciler.SUPERVISOR_NAME).get();
    }

    private VSphereCluster vsphereCluster() {
        return Crds.vsphereClusterOperation(client).inNamespace(NAMESPACE).withName(CLUSTER_NAME).get();
    }

    @Test
    public void testVirtualIpWinsOverFloatingIp() {
        virtualIpService("10.0.0.100", null);
        clusterInfo(KUBECONFIG);

        assertThat(reconciler.supervisorAddress(RECONCILIATION), is("10.0.0.100"));
    }

    @Test
    public void testFloatingIp() {
        clusterInfo(KUBECONFIG);

        assertThat(reconciler.supervisorAddress(RECONCILIATION), is("192.168.1.100"));
    }

    @Test
    public void testInvalidClusterInfo() {
        clusterInfo("clusters: [ not valid");

        assertThat(reconciler.supervisorAddress(RECONCILIATION), is(nullValue()));
    }

    @Test
    public void testServerHostOfCurrentContext() throws Exception {
        String kubeconfig = """
                clusters:
                - name: supervisor
                  cluster:
                    server: https://supervisor.example.com:6443
                contexts:
                - name: admin
                  context:
                    cluster: supervisor
                current-context: admin
                """;

        assertThat(ServiceDiscoveryReconciler.serverHost(kubeconfig), is("supervisor.example.com"));
        assertThat(ServiceDiscoveryReconciler.serverHost(KUBECONFIG), is("192.168.1.100"));
        assertThat(ServiceDiscoveryReconciler.serverHost("clusters: []"), is(nullValue()));
    }

    @Test
    public void testEndpointAddresses() {
        EndpointAddress ip = ServiceDiscoveryReconciler.endpoints("10.0.0.100").getSubsets().get(0).getAddresses().get(0);
        assertThat(ip.getIp(), is("10.0.0.100"));
        assertThat(ip.getHostname(), is(nullValue()));

        EndpointAddress ipv6 = ServiceDiscoveryReconciler.endpoints("fd00::1").getSubsets().get(0).getAddresses().get(0);
        assertThat(ipv6.getIp(), is("fd00::1"));

        EndpointAddress hostname = ServiceDiscoveryReconciler.endpoints("supervisor.example.com").getSubsets().get(0).getAddresses().get(0);
        assertThat(hostname.getIp(), is(nullValue()));
        assertThat(hostname.getHostname(), is("supervisor.example.com"));
    }

    @Test
    public void testSummaryIgnoresDefaultedFields() {
        Endpoints current = ServiceDiscoveryReconciler.endpoints("10.0.0.100");
        current.getSubsets().get(0).setNotReadyAddresses(new ArrayList<>());

        assertThat(ServiceDiscoveryReconciler.summary(current), is(ServiceDiscoveryReconciler.summary(ServiceDiscoveryReconciler.endpoints("10.0.0.100"))));
        assertThat(ServiceDiscoveryReconciler.summary(current).equals(ServiceDiscoveryReconciler.summary(ServiceDiscoveryReconciler.endpoints("10.0.0.101"))),
                is(false));
    }

    @Test
    public void testHeadlessService() {
        Service service = ServiceDiscoveryReconciler.headlessService();

        assertThat(service.getSpec().getClusterIP(), is("None"));
        assertThat(service.getSpec().getSelector() == null || service.getSpec().getSelector().isEmpty(), is(true));
        assertThat(service.getSpec().getPorts().get(0).getPort(), is(6443));
        assertThat(service.getSpec().getPorts().get(0).getTargetPort().getIntVal(), is(6443));
    }

    @Test
    public void testReconcile() {
        resources.vsphereCluster(resources.cluster(true, true), new VSphereClusterSpec());
        workloadOnline();
        virtualIpService("10.0.0.100", null);

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));

        assertThat(client.services().inNamespace(ServiceDiscoveryReconciler.SUPERVISOR_NAMESPACE).withName(ServiceDiscoveryReconciler.SUPERVISOR_NAME).get(),
                is(notNullValue()));
        assertThat(supervisorEndpoints().getSubsets().get(0).getAddresses().get(0).getIp(), is("10.0.0.100"));
        assertThat(Conditions.isTrue(vsphereCluster().getStatus(), ConditionTypes.SERVICE_DISCOVERY_READY), is(true));

        String resourceVersion = supervisorEndpoints().getMetadata().getResourceVersion();

        // Unchanged address does not touch the Endpoints
        reconciler.reconcile(RECONCILIATION);
        assertThat(supervisorEndpoints().getMetadata().getResourceVersion(), is(resourceVersion));

        virtualIpService(null, "supervisor.example.com");
        reconciler.reconcile(RECONCILIATION);

        EndpointAddress address = supervisorEndpoints().getSubsets().get(0).getAddresses().get(0);
        assertThat(address.getIp(), is(nullValue()));
        assertThat(address.getHostname(), is("supervisor.example.com"));
    }

    @Test
    public void testNoSupervisorAddress() {
        resources.vsphereCluster(resources.cluster(true, true), new VSphereClusterSpec());
        workloadOnline();

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));

        assertThat(client.services().inNamespace(ServiceDiscoveryReconciler.SUPERVISOR_NAMESPACE).withName(ServiceDiscoveryReconciler.SUPERVISOR_NAME).get(),
                is(notNullValue()));
        assertThat(supervisorEndpoints(), is(nullValue()));
        assertThat(Conditions.get(vsphereCluster().getStatus(), ConditionTypes.SERVICE_DISCOVERY_READY).getReason(),
                is(ConditionReasons.SUPERVISOR_HEADLESS_SERVICE_SETUP_FAILED));
    }

    @Test
    public void testWorkloadClusterNotReachable() {
        resources.vsphereCluster(resources.cluster(true, false), new VSphereClusterSpec());
        when(workloadClusters.isOnline(any())).thenReturn(false);

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));
        assertThat(vsphereCluster().getStatus(), is(nullValue()));
    }

    @Test
    public void testClusterWithoutOwner() {
        resources.vsphereCluster(null, new VSphereClusterSpec());

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));
    }
}
