/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Information used to clone a virtual machine from a template
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"template", "server", "datacenter", "datastore", "folder", "resourcePool", "storagePolicyName", "network", "numCPUs", "numCoresPerSocket", "memoryMiB", "diskGiB"})
public class VirtualMachineCloneSpec {
    private String template;
    private String server;
    private String datacenter;
    private String datastore;
    private String folder;
    private String resourcePool;
    private String storagePolicyName;
    private NetworkSpec network;
    private int numCPUs;
    private int numCoresPerSocket;
    private long memoryMiB;
    private int diskGiB;

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public String getDatacenter() {
        return datacenter;
    }

    public void setDatacenter(String datacenter) {
        this.datacenter = datacenter;
    }

    public String getDatastore() {
        return datastore;
    }

    public void setDatastore(String datastore) {
        this.datastore = datastore;
    }

    public String getFolder() {
        return folder;
    }

    public void setFolder(String folder) {
        this.folder = folder;
    }

    public String getResourcePool() {
        return resourcePool;
    }

    public void setResourcePool(String resourcePool) {
        this.resourcePool = resourcePool;
    }

    public String getStoragePolicyName() {
        return storagePolicyName;
    }

    public void setStoragePolicyName(String storagePolicyName) {
        this.storagePolicyName = storagePolicyName;
    }

    public NetworkSpec getNetwork() {
        return network;
    }

    public void setNetwork(NetworkSpec network) {
        this.network = network;
    }

    public int getNumCPUs() {
        return numCPUs;
    }

    public void setNumCPUs(int numCPUs) {
        this.numCPUs = numCPUs;
    }

    public int getNumCoresPerSocket() {
        return numCoresPerSocket;
    }

    public void setNumCoresPerSocket(int numCoresPerSocket) {
        this.numCoresPerSocket = numCoresPerSocket;
    }

    public long getMemoryMiB() {
        return memoryMiB;
    }

    public void setMemoryMiB(long memoryMiB) {
        this.memoryMiB = memoryMiB;
    }

    public int getDiskGiB() {
        return diskGiB;
    }

    public void setDiskGiB(int diskGiB) {
        this.diskGiB = diskGiB;
    }
}
