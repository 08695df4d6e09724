/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Desired state of a VSphereMachine
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"providerID", "failureDomain"})
public class VSphereMachineSpec extends VirtualMachineCloneSpec {
    private String providerID;
    private String failureDomain;

    public String getProviderID() {
        return providerID;
    }

    public void setProviderID(String providerID) {
        this.providerID = providerID;
    }

    public String getFailureDomain() {
        return failureDomain;
    }

    public void setFailureDomain(String failureDomain) {
        this.failureDomain = failureDomain;
    }
}
