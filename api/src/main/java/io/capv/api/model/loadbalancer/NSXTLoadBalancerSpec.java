/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.loadbalancer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.LabelSelector;

/**
 * Desired state of a NSXTLoadBalancer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"ipPoolName", "loadBalancerServiceId", "port", "selector"})
public class NSXTLoadBalancerSpec {
    private String ipPoolName;
    private String loadBalancerServiceId;
    private int port;
    private LabelSelector selector;

    public String getIpPoolName() {
        return ipPoolName;
    }

    public void setIpPoolName(String ipPoolName) {
        this.ipPoolName = ipPoolName;
    }

    public String getLoadBalancerServiceId() {
        return loadBalancerServiceId;
    }

    public void setLoadBalancerServiceId(String loadBalancerServiceId) {
        this.loadBalancerServiceId = loadBalancerServiceId;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public LabelSelector getSelector() {
        return selector;
    }

    public void setSelector(LabelSelector selector) {
        this.selector = selector;
    }
}
