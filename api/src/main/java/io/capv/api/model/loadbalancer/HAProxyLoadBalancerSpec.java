/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.loadbalancer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.vsphere.VirtualMachineCloneSpec;
import io.fabric8.kubernetes.api.model.LabelSelector;

/**
 * Desired state of a HAProxyLoadBalancer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"virtualMachineConfiguration", "selector", "user"})
public class HAProxyLoadBalancerSpec {
    private VirtualMachineCloneSpec virtualMachineConfiguration;
    private LabelSelector selector;
    private SSHUser user;

    public VirtualMachineCloneSpec getVirtualMachineConfiguration() {
        return virtualMachineConfiguration;
    }

    public void setVirtualMachineConfiguration(VirtualMachineCloneSpec virtualMachineConfiguration) {
        this.virtualMachineConfiguration = virtualMachineConfiguration;
    }

    public LabelSelector getSelector() {
        return selector;
    }

    public void setSelector(LabelSelector selector) {
        this.selector = selector;
    }

    public SSHUser getUser() {
        return user;
    }

    public void setUser(SSHUser user) {
        this.user = user;
    }
}
