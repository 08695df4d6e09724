/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.cluster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.common.Status;

/**
 * Observed state of a Cluster API Machine
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"phase", "bootstrapReady", "infrastructureReady", "conditions"})
public class MachineStatus extends Status {
    private String phase;
    private boolean bootstrapReady;
    private boolean infrastructureReady;

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public boolean isBootstrapReady() {
        return bootstrapReady;
    }

    public void setBootstrapReady(boolean bootstrapReady) {
        this.bootstrapReady = bootstrapReady;
    }

    public boolean isInfrastructureReady() {
        return infrastructureReady;
    }

    public void setInfrastructureReady(boolean infrastructureReady) {
        this.infrastructureReady = infrastructureReady;
    }
}
