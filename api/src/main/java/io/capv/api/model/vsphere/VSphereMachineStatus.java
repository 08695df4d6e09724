/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.common.Status;
import io.fabric8.kubernetes.api.model.NodeAddress;

import java.util.List;

/**
 * Observed state of a VSphereMachine
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"ready", "addresses", "network", "failureReason", "failureMessage"})
public class VSphereMachineStatus extends Status {
    private boolean ready;
    private List<NodeAddress> addresses;
    private List<NetworkStatus> network;
    private String failureReason;
    private String failureMessage;

    public boolean isReady() {
        return ready;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public List<NodeAddress> getAddresses() {
        return addresses;
    }

    public void setAddresses(List<NodeAddress> addresses) {
        this.addresses = addresses;
    }

    public List<NetworkStatus> getNetwork() {
        return network;
    }

    public void setNetwork(List<NetworkStatus> network) {
        this.network = network;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public void setFailureMessage(String failureMessage) {
        this.failureMessage = failureMessage;
    }
}
