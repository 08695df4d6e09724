/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Configuration of the cloud provider and of the storage driver installed into the workload cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"global", "virtualCenter", "workspace", "network", "providerConfig"})
public class CloudProviderConfiguration {
    private GlobalConfig global;
    private Map<String, VirtualCenterConfig> virtualCenter;
    private WorkspaceConfig workspace;
    private NetworkConfig network;
    private ProviderConfig providerConfig;

    public GlobalConfig getGlobal() {
        return global;
    }

    public void setGlobal(GlobalConfig global) {
        this.global = global;
    }

    public Map<String, VirtualCenterConfig> getVirtualCenter() {
        return virtualCenter;
    }

    public void setVirtualCenter(Map<String, VirtualCenterConfig> virtualCenter) {
        this.virtualCenter = virtualCenter;
    }

    public WorkspaceConfig getWorkspace() {
        return workspace;
    }

    public void setWorkspace(WorkspaceConfig workspace) {
        this.workspace = workspace;
    }

    public NetworkConfig getNetwork() {
        return network;
    }

    public void setNetwork(NetworkConfig network) {
        this.network = network;
    }

    public ProviderConfig getProviderConfig() {
        return providerConfig;
    }

    public void setProviderConfig(ProviderConfig providerConfig) {
        this.providerConfig = providerConfig;
    }
}
