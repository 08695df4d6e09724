/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.cluster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.common.APIEndpoint;
import io.fabric8.kubernetes.api.model.ObjectReference;

/**
 * Desired state of a Cluster API Cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"paused", "controlPlaneEndpoint", "infrastructureRef"})
public class ClusterSpec {
    private boolean paused;
    private APIEndpoint controlPlaneEndpoint;
    private ObjectReference infrastructureRef;

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public APIEndpoint getControlPlaneEndpoint() {
        return controlPlaneEndpoint;
    }

    public void setControlPlaneEndpoint(APIEndpoint controlPlaneEndpoint) {
        this.controlPlaneEndpoint = controlPlaneEndpoint;
    }

    public ObjectReference getInfrastructureRef() {
        return infrastructureRef;
    }

    public void setInfrastructureRef(ObjectReference infrastructureRef) {
        this.infrastructureRef = infrastructureRef;
    }
}
