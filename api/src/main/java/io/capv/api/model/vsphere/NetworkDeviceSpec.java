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
 * Network device of a virtual machine
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"networkName", "deviceName", "dhcp4", "dhcp6", "gateway4", "gateway6", "ipAddrs", "macAddr", "nameservers", "searchDomains"})
public class NetworkDeviceSpec {
    private String networkName;
    private String deviceName;
    private boolean dhcp4;
    private boolean dhcp6;
    private String gateway4;
    private String gateway6;
    private List<String> ipAddrs;
    private String macAddr;
    private List<String> nameservers;
    private List<String> searchDomains;

    public String getNetworkName() {
        return networkName;
    }

    public void setNetworkName(String networkName) {
        this.networkName = networkName;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }

    public boolean isDhcp4() {
        return dhcp4;
    }

    public void setDhcp4(boolean dhcp4) {
        this.dhcp4 = dhcp4;
    }

    public boolean isDhcp6() {
        return dhcp6;
    }

    public void setDhcp6(boolean dhcp6) {
        this.dhcp6 = dhcp6;
    }

    public String getGateway4() {
        return gateway4;
    }

    public void setGateway4(String gateway4) {
        this.gateway4 = gateway4;
    }

    public String getGateway6() {
        return gateway6;
    }

    public void setGateway6(String gateway6) {
        this.gateway6 = gateway6;
    }

    public List<String> getIpAddrs() {
        return ipAddrs;
    }

    public void setIpAddrs(List<String> ipAddrs) {
        this.ipAddrs = ipAddrs;
    }

    public String getMacAddr() {
        return macAddr;
    }

    public void setMacAddr(String macAddr) {
        this.macAddr = macAddr;
    }

    public List<String> getNameservers() {
        return nameservers;
    }

    public void setNameservers(List<String> nameservers) {
        this.nameservers = nameservers;
    }

    public List<String> getSearchDomains() {
        return searchDomains;
    }

    public void setSearchDomains(List<String> searchDomains) {
        this.searchDomains = searchDomains;
    }
}
