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
 * Observed state of a Cluster API Cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"phase", "infrastructureReady", "controlPlaneInitialized", "conditions"})
public class ClusterStatus extends Status {
    private String phase;
    private boolean infrastructureReady;
    private boolean controlPlaneInitialized;

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public boolean isInfrastructureReady() {
        return infrastructureReady;
    }

    public void setInfrastructureReady(boolean infrastructureReady) {
        this.infrastructureReady = infrastructureReady;
    }

    public boolean isControlPlaneInitialized() {
        return controlPlaneInitialized;
    }

    public void setControlPlaneInitialized(boolean controlPlaneInitialized) {
        this.controlPlaneInitialized = controlPlaneInitialized;
    }
}
