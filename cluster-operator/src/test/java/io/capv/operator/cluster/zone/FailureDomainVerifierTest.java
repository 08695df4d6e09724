/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.zone.FailureDomain;
import io.capv.api.model.zone.FailureDomainHosts;
import io.capv.api.model.zone.FailureDomainType;
import io.capv.api.model.zone.Topology;
import io.capv.api.model.zone.VSphereFailureDomainSpec;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.FakeVSphere;
import io.capv.operator.cluster.vsphere.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class FailureDomainVerifierTest {
    private final FailureDomainVerifier verifier = new FailureDomainVerifier();
    private FakeVSphere vsphere;

    @BeforeEach
    public void setUp() {
        vsphere = new FakeVSphere()
                .withDatacenter("DC0")
                .withComputeCluster("DC0_C0")
                .withDatastore("LocalDS_0")
                .withNetwork("VM Network")
                .withHostGroup("DC0_C0", "hg-a", "DC0_C0_H0", "DC0_C0_H1")
                .withVmGroup("DC0_C0", "vmg-a")
                .withTag(Session.DATACENTER, "DC0", "us-west", "k8s-region")
                .withTag(Session.COMPUTE_CLUSTER, "DC0_C0", "us-west-1a", "k8s-zone");
    }

    private Session session() {
        return vsphere.getOrCreate("vcenter.example.com", "DC0", new Credentials("user", "pass"));
    }

    private static FailureDomain domain(String name, FailureDomainType type, String category) {
        FailureDomain domain = new FailureDomain();
        domain.setName(name);
        domain.setType(type);
        domain.setTagCategory(category);
        return domain;
    }

    private static VSphereFailureDomainSpec spec(FailureDomain zone) {
        Topology topology = new Topology();
        topology.setDatacenter("DC0");
        topology.setComputeCluster("DC0_C0");
        topology.setDatastore("LocalDS_0");
        topology.setNetworks(List.of("VM Network"));

        VSphereFailureDomainSpec spec = new VSphereFailureDomainSpec();
        spec.setRegion(domain("us-west", FailureDomainType.Datacenter, "k8s-region"));
        spec.setZone(zone);
        spec.setTopology(topology);
        return spec;
    }

    @Test
    public void testTaggedComputeCluster() {
        Verification result = verifier.verify(session(), spec(domain("us-west-1a", FailureDomainType.ComputeCluster, "k8s-zone")));

        assertThat(result.isPassed(), is(true));
    }

    @Test
    public void testMissingZoneTag() {
        Verification result = verifier.verify(session(), spec(domain("us-west-1b", FailureDomainType.ComputeCluster, "k8s-zone")));

        assertThat(result.reason(), is(ConditionReasons.TAG_NOT_ATTACHED));
    }

    @Test
    public void testTagInAnotherCategory() {
        Verification result = verifier.verify(session(), spec(domain("us-west-1a", FailureDomainType.ComputeCluster, "other-category")));

        assertThat(result.reason(), is(ConditionReasons.TAG_CATEGORY_MISMATCH));
    }

    @Test
    public void testMissingDatastore() {
        VSphereFailureDomainSpec spec = spec(domain("us-west-1a", FailureDomainType.ComputeCluster, "k8s-zone"));
        spec.getTopology().setDatastore("unknown");

        assertThat(verifier.verify(session(), spec).reason(), is(ConditionReasons.TOPOLOGY_NOT_FOUND));
    }

    @Test
    public void testMissingNetwork() {
        VSphereFailureDomainSpec spec = spec(domain("us-west-1a", FailureDomainType.ComputeCluster, "k8s-zone"));
        spec.getTopology().setNetworks(List.of("VM Network", "unknown"));

        assertThat(verifier.verify(session(), spec).reason(), is(ConditionReasons.TOPOLOGY_NOT_FOUND));
    }

    @Test
    public void testHostGroupNeedsEveryHostTagged() {
        VSphereFailureDomainSpec spec = spec(domain("us-west-1c", FailureDomainType.HostGroup, "k8s-zone"));
        FailureDomainHosts hosts = new FailureDomainHosts();
        hosts.setHostGroupName("hg-a");
        hosts.setVmGroupName("vmg-a");
        spec.getTopology().setHosts(hosts);

        vsphere.withTag(Session.HOST, "DC0_C0_H0", "us-west-1c", "k8s-zone");
        assertThat(verifier.verify(session(), spec).reason(), is(ConditionReasons.HOST_GROUP_NOT_TAGGED));

        vsphere.withTag(Session.HOST, "DC0_C0_H1", "us-west-1c", "k8s-zone");
        assertThat(verifier.verify(session(), spec).isPassed(), is(true));
    }

    @Test
    public void testMissingHostGroup() {
        VSphereFailureDomainSpec spec = spec(domain("us-west-1c", FailureDomainType.HostGroup, "k8s-zone"));
        FailureDomainHosts hosts = new FailureDomainHosts();
        hosts.setHostGroupName("unknown");
        hosts.setVmGroupName("vmg-a");
        spec.getTopology().setHosts(hosts);

        assertThat(verifier.verify(session(), spec).reason(), is(ConditionReasons.TOPOLOGY_NOT_FOUND));
    }

    @Test
    public void testMissingZone() {
        assertThat(verifier.verify(session(), spec(null)).reason(), is(ConditionReasons.TOPOLOGY_NOT_FOUND));
    }
}
