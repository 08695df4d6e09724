/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.zone;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Desired state of a VSphereDeploymentZone
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"server", "failureDomain", "controlPlane", "placementConstraint"})
public class VSphereDeploymentZoneSpec {
    private String server;
    private String failureDomain;
    private Boolean controlPlane;
    private PlacementConstraint placementConstraint;

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public String getFailureDomain() {
        return failureDomain;
    }

    public void setFailureDomain(String failureDomain) {
        this.failureDomain = failureDomain;
    }

    public Boolean getControlPlane() {
        return controlPlane;
    }

    public void setControlPlane(Boolean controlPlane) {
        this.controlPlane = controlPlane;
    }

    public PlacementConstraint getPlacementConstraint() {
        return placementConstraint;
    }

    public void setPlacementConstraint(PlacementConstraint placementConstraint) {
        this.placementConstraint = placementConstraint;
    }
}
