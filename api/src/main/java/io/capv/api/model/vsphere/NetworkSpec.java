/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Network configuration of a virtual machine
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"devices", "preferredAPIServerCidr"})
public class NetworkSpec {
    private List<NetworkDeviceSpec> devices;
    private String preferredAPIServerCidr;

    public List<NetworkDeviceSpec> getDevices() {
        return devices;
    }

    public void setDevices(List<NetworkDeviceSpec> devices) {
        this.devices = devices;
    }

    public String getPreferredAPIServerCidr() {
        return preferredAPIServerCidr;
    }

    public void setPreferredAPIServerCidr(String preferredAPIServerCidr) {
        this.preferredAPIServerCidr = preferredAPIServerCidr;
    }
}
