/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.common.APIEndpoint;
import io.fabric8.kubernetes.api.model.ObjectReference;

/**
 * Desired state of a VSphereCluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"server", "thumbprint", "identityRef", "controlPlaneEndpoint", "cloudProviderConfiguration", "loadBalancerRef"})
public class VSphereClusterSpec {
    private String server;
    private String thumbprint;
    private IdentityReference identityRef;
    private APIEndpoint controlPlaneEndpoint;
    private CloudProviderConfiguration cloudProviderConfiguration;
    private ObjectReference loadBalancerRef;

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public String getThumbprint() {
        return thumbprint;
    }

    public void setThumbprint(String thumbprint) {
        this.thumbprint = thumbprint;
    }

    public IdentityReference getIdentityRef() {
        return identityRef;
    }

    public void setIdentityRef(IdentityReference identityRef) {
        this.identityRef = identityRef;
    }

    public APIEndpoint getControlPlaneEndpoint() {
        return controlPlaneEndpoint;
    }

    public void setControlPlaneEndpoint(APIEndpoint controlPlaneEndpoint) {
        this.controlPlaneEndpoint = controlPlaneEndpoint;
    }

    public CloudProviderConfiguration getCloudProviderConfiguration() {
        return cloudProviderConfiguration;
    }

    public void setCloudProviderConfiguration(CloudProviderConfiguration cloudProviderConfiguration) {
        this.cloudProviderConfiguration = cloudProviderConfiguration;
    }

    public ObjectReference getLoadBalancerRef() {
        return loadBalancerRef;
    }

    public void setLoadBalancerRef(ObjectReference loadBalancerRef) {
        this.loadBalancerRef = loadBalancerRef;
    }
}
