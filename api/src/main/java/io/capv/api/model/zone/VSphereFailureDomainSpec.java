/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.zone;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Desired state of a VSphereFailureDomain
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"region", "zone", "topology"})
public class VSphereFailureDomainSpec {
    private FailureDomain region;
    private FailureDomain zone;
    private Topology topology;

    public FailureDomain getRegion() {
        return region;
    }

    public void setRegion(FailureDomain region) {
        this.region = region;
    }

    public FailureDomain getZone() {
        return zone;
    }

    public void setZone(FailureDomain zone) {
        this.zone = zone;
    }

    public Topology getTopology() {
        return topology;
    }

    public void setTopology(Topology topology) {
        this.topology = topology;
    }
}
