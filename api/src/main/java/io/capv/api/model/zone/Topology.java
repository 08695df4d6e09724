/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.zone;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * vSphere objects a failure domain consists of
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"datacenter", "computeCluster", "hosts", "datastore", "networks"})
public class Topology {
    private String datacenter;
    private String computeCluster;
    private FailureDomainHosts hosts;
    private String datastore;
    private List<String> networks;

    public String getDatacenter() {
        return datacenter;
    }

    public void setDatacenter(String datacenter) {
        this.datacenter = datacenter;
    }

    public String getComputeCluster() {
        return computeCluster;
    }

    public void setComputeCluster(String computeCluster) {
        this.computeCluster = computeCluster;
    }

    public FailureDomainHosts getHosts() {
        return hosts;
    }

    public void setHosts(FailureDomainHosts hosts) {
        this.hosts = hosts;
    }

    public String getDatastore() {
        return datastore;
    }

    public void setDatastore(String datastore) {
        this.datastore = datastore;
    }

    public List<String> getNetworks() {
        return networks;
    }

    public void setNetworks(List<String> networks) {
        this.networks = networks;
    }
}
