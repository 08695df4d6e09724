/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

import io.capv.api.Crds;
import io.capv.api.model.cluster.Machine;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.zone.FailureDomain;
import io.capv.api.model.zone.FailureDomainType;
import io.capv.api.model.zone.PlacementConstraint;
import io.capv.api.model.zone.Topology;
import io.capv.api.model.zone.VSphereDeploymentZone;
import io.capv.api.model.zone.VSphereDeploymentZoneSpec;
import io.capv.api.model.zone.VSphereFailureDomain;
import io.capv.api.model.zone.VSphereFailureDomainSpec;
import io.capv.operator.cluster.ResourceUtils;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.CredentialsProvider;
import io.capv.operator.cluster.vsphere.FakeVSphere;
import io.capv.operator.cluster.vsphere.Session;
import io.capv.operator.cluster.vsphere.VSphereException;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.OwnerReferences;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.capv.operator.cluster.ResourceUtils.NAMESPACE;
import static io.capv.operator.cluster.ResourceUtils.SERVER;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class VSphereDeploymentZoneReconcilerTest {
    private static final Duration REQUEUE = Duration.ofSeconds(10);
    private static final String ZONE = "zone-a";
    private static final String FAILURE_DOMAIN = "fd-a";
    private static final String RESOURCE_POOL = "/DC0/host/DC0_C0/Resources/DC0_C0_RP1";

    KubernetesClient client;

    private ResourceUtils resources;
    private FakeVSphere vsphere;
    private VSphereDeploymentZoneReconciler reconciler;

    @BeforeEach
    public void setUp() {
        resources = new ResourceUtils(client);
        vsphere = new FakeVSphere()
                .withDatacenter("DC0")
                .withComputeCluster("DC0_C0")
                .withDatastore("LocalDS_0")
                .withNetwork("VM Network")
                .withResourcePool(RESOURCE_POOL, "DC0_C0")
                .withResourcePool("/DC0/host/DC0_C1/Resources/DC0_C1_RP1", "DC0_C1")
                .withFolder("/DC0/vm")
                .withTag(Session.DATACENTER, "DC0", "us-west", "k8s-region")
                .withTag(Session.COMPUTE_CLUSTER, "DC0_C0", "us-west-1a", "k8s-zone");

        reconciler = new VSphereDeploymentZoneReconciler(client, new CredentialsProvider(client, new Credentials("user", "pass"), ResourceUtils.OPERATOR_NAMESPACE), vsphere, REQUEUE);
    }

    private static Reconciliation reconciliation(String name) {
        return ResourceUtils.reconciliation(VSphereDeploymentZone.RESOURCE_KIND, name);
    }

    private static FailureDomain domain(String name, FailureDomainType type, String category) {
        FailureDomain domain = new FailureDomain();
        domain.setName(name);
        domain.setType(type);
        domain.setTagCategory(category);
        return domain;
    }

    private void failureDomain() {
        Topology topology = new Topology();
        topology.setDatacenter("DC0");
        topology.setComputeCluster("DC0_C0");
        topology.setDatastore("LocalDS_0");
        topology.setNetworks(List.of("VM Network"));

        VSphereFailureDomainSpec spec = new VSphereFailureDomainSpec();
        spec.setRegion(domain("us-west", FailureDomainType.Datacenter, "k8s-region"));
        spec.setZone(domain("us-west-1a", FailureDomainType.ComputeCluster, "k8s-zone"));
        spec.setTopology(topology);

        VSphereFailureDomain failureDomain = new VSphereFailureDomain();
        failureDomain.setMetadata(new ObjectMetaBuilder().withName(FAILURE_DOMAIN).withNamespace(NAMESPACE).build());
        failureDomain.setSpec(spec);

        Crds.failureDomainOperation(client).inNamespace(NAMESPACE).resource(failureDomain).create();
    }

    private void zone(String name, String resourcePool) {
        PlacementConstraint constraint = new PlacementConstraint();
        constraint.setResourcePool(resourcePool);
        constraint.setFolder("/DC0/vm");

        VSphereDeploymentZoneSpec spec = new VSphereDeploymentZoneSpec();
        spec.setServer(SERVER);
        spec.setFailureDomain(FAILURE_DOMAIN);
        spec.setControlPlane(true);
        spec.setPlacementConstraint(constraint);

        VSphereDeploymentZone zone = new VSphereDeploymentZone();
        zone.setMetadata(new ObjectMetaBuilder().withName(name).withNamespace(NAMESPACE).build());
        zone.setSpec(spec);

        Crds.deploymentZoneOperation(client).inNamespace(NAMESPACE).resource(zone).create();
    }

    private VSphereDeploymentZone getZone(String name) {
        return Crds.deploymentZoneOperation(client).inNamespace(NAMESPACE).withName(name).get();
    }

    private VSphereFailureDomain getFailureDomain() {
        return Crds.failureDomainOperation(client).inNamespace(NAMESPACE).withName(FAILURE_DOMAIN).get();
    }

    private void machineInZone(String name, String zone) {
        Machine machine = resources.machine(name, false, null, null);
        machine.getSpec().setFailureDomain(zone);
        Crds.machineOperation(client).inNamespace(NAMESPACE).resource(machine).update();
    }

    @Test
    public void testValidZone() {
        failureDomain();
        zone(ZONE, RESOURCE_POOL);

        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.done()));

        VSphereDeploymentZone zone = getZone(ZONE);
        assertThat(zone.getStatus().getReady(), is(true));
        assertThat(Finalizers.has(zone, Constants.DEPLOYMENT_ZONE_FINALIZER), is(true));
        assertThat(Conditions.isTrue(zone.getStatus(), ConditionTypes.VCENTER_AVAILABLE), is(true));
        assertThat(Conditions.isTrue(zone.getStatus(), ConditionTypes.PLACEMENT_CONSTRAINT_MET), is(true));
        assertThat(Conditions.isTrue(zone.getStatus(), ConditionTypes.FAILURE_DOMAIN_VALIDATED), is(true));

        assertThat(OwnerReferences.has(getFailureDomain(), zone), is(true));
    }

    @Test
    public void testMissingFailureDomain() {
        zone(ZONE, RESOURCE_POOL);

        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.requeueAfter(REQUEUE)));

        VSphereDeploymentZone zone = getZone(ZONE);
        assertThat(zone.getStatus().getReady(), is(false));
        assertThat(Conditions.get(zone.getStatus(), ConditionTypes.FAILURE_DOMAIN_VALIDATED).getReason(), is(ConditionReasons.FAILURE_DOMAIN_NOT_FOUND));
        assertThat(vsphere.loginCount(), is(0));
    }

    @Test
    public void testResourcePoolOfAnotherComputeCluster() {
        failureDomain();
        zone(ZONE, "/DC0/host/DC0_C1/Resources/DC0_C1_RP1");

        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.requeueAfter(REQUEUE)));

        VSphereDeploymentZone zone = getZone(ZONE);
        assertThat(zone.getStatus().getReady(), is(false));
        assertThat(Conditions.get(zone.getStatus(), ConditionTypes.PLACEMENT_CONSTRAINT_MET).getReason(),
                is(ConditionReasons.RESOURCE_POOL_OWNED_BY_OTHER_CLUSTER));
        assertThat(Conditions.isTrue(zone.getStatus(), ConditionTypes.FAILURE_DOMAIN_VALIDATED), is(true));
    }

    @Test
    public void testUnreachableVCenter() {
        failureDomain();
        zone(ZONE, RESOURCE_POOL);
        vsphere.unreachable(SERVER);

        assertThrows(VSphereException.class, () -> reconciler.reconcile(reconciliation(ZONE)));

        VSphereDeploymentZone zone = getZone(ZONE);
        assertThat(zone.getStatus().getReady(), is(false));
        assertThat(Conditions.get(zone.getStatus(), ConditionTypes.VCENTER_AVAILABLE).getReason(), is(ConditionReasons.VCENTER_UNREACHABLE));
    }

    @Test
    public void testDeleteWaitsForMachines() {
        failureDomain();
        zone(ZONE, RESOURCE_POOL);
        reconciler.reconcile(reconciliation(ZONE));
        machineInZone("worker-0", ZONE);
        machineInZone("worker-1", "other-zone");

        Crds.deploymentZoneOperation(client).inNamespace(NAMESPACE).withName(ZONE).delete();

        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.requeueAfter(REQUEUE)));
        assertThat(Finalizers.has(getZone(ZONE), Constants.DEPLOYMENT_ZONE_FINALIZER), is(true));
        assertThat(Conditions.get(getZone(ZONE).getStatus(), ConditionTypes.READY).getReason(), is(ConditionReasons.DELETING));

        Crds.machineOperation(client).inNamespace(NAMESPACE).withName("worker-0").delete();

        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.done()));
        assertThat(getZone(ZONE), is(nullValue()));
        assertThat(getFailureDomain(), is(nullValue()));
    }

    @Test
    public void testSharedFailureDomainIsKept() {
        failureDomain();
        zone(ZONE, RESOURCE_POOL);
        zone("zone-b", RESOURCE_POOL);
        reconciler.reconcile(reconciliation(ZONE));
        reconciler.reconcile(reconciliation("zone-b"));

        assertThat(getFailureDomain().getMetadata().getOwnerReferences().size(), is(2));

        Crds.deploymentZoneOperation(client).inNamespace(NAMESPACE).withName(ZONE).delete();
        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.done()));

        VSphereFailureDomain failureDomain = getFailureDomain();
        assertThat(failureDomain, is(notNullValue()));
        assertThat(failureDomain.getMetadata().getOwnerReferences().size(), is(1));
        assertThat(failureDomain.getMetadata().getOwnerReferences().get(0).getName(), is("zone-b"));
    }

    @Test
    public void testMissingZone() {
        assertThat(reconciler.reconcile(reconciliation(ZONE)), is(ReconcileResult.done()));
    }
}
