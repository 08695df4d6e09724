/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.zone.PlacementConstraint;
import io.capv.api.model.zone.Topology;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.FakeVSphere;
import io.capv.operator.cluster.vsphere.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class PlacementVerifierTest {
    private final PlacementVerifier verifier = new PlacementVerifier();
    private Session session;

    @BeforeEach
    public void setUp() {
        session = new FakeVSphere()
                .withResourcePool("/DC0/host/DC0_C0/Resources/DC0_C0_RP1", "DC0_C0")
                .withResourcePool("/DC0/host/DC0_C1/Resources/DC0_C1_RP1", "DC0_C1")
                .withFolder("/DC0/vm")
                .getOrCreate("vcenter.example.com", "DC0", new Credentials("user", "pass"));
    }

    private static PlacementConstraint constraint(String resourcePool, String folder) {
        PlacementConstraint constraint = new PlacementConstraint();
        constraint.setResourcePool(resourcePool);
        constraint.setFolder(folder);
        return constraint;
    }

    private static Topology topology(String computeCluster) {
        Topology topology = new Topology();
        topology.setDatacenter("DC0");
        topology.setComputeCluster(computeCluster);
        return topology;
    }

    @Test
    public void testResourcePoolInTheComputeCluster() {
        Verification result = verifier.verify(session, constraint("/DC0/host/DC0_C0/Resources/DC0_C0_RP1", "/DC0/vm"), topology("DC0_C0"));

        assertThat(result.isPassed(), is(true));
    }

    @Test
    public void testResourcePoolOfAnotherComputeCluster() {
        Verification result = verifier.verify(session, constraint("/DC0/host/DC0_C1/Resources/DC0_C1_RP1", "/DC0/vm"), topology("DC0_C0"));

        assertThat(result.isPassed(), is(false));
        assertThat(result.reason(), is(ConditionReasons.RESOURCE_POOL_OWNED_BY_OTHER_CLUSTER));
        assertThat(result.message(), containsString("DC0_C1"));
    }

    @Test
    public void testMissingResourcePool() {
        Verification result = verifier.verify(session, constraint("/DC0/host/DC0_C0/Resources/unknown", null), topology("DC0_C0"));

        assertThat(result.reason(), is(ConditionReasons.RESOURCE_POOL_NOT_FOUND));
    }

    @Test
    public void testMissingFolder() {
        Verification result = verifier.verify(session, constraint(null, "/DC0/vm/unknown"), topology("DC0_C0"));

        assertThat(result.reason(), is(ConditionReasons.FOLDER_NOT_FOUND));
    }

    @Test
    public void testTopologyWithoutComputeClusterAcceptsAnyPool() {
        Verification result = verifier.verify(session, constraint("/DC0/host/DC0_C1/Resources/DC0_C1_RP1", null), topology(null));

        assertThat(result.isPassed(), is(true));
    }

    @Test
    public void testNoConstraint() {
        assertThat(verifier.verify(session, null, topology("DC0_C0")).isPassed(), is(true));
    }
}
