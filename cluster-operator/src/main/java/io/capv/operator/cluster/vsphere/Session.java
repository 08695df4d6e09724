/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

import java.util.List;

/**
 * Logged-in connection to one vCenter, scoped to one datacenter. The lookups of the inventory objects return null or
 * false for missing objects and throw {@link VSphereException} when the vCenter cannot be queried.
 */
public interface Session {
    /**
     * Object type of the datacenters used for tag lookups
     */
    String DATACENTER = "Datacenter";

    /**
     * Object type of the compute clusters used for tag lookups
     */
    String COMPUTE_CLUSTER = "ClusterComputeResource";

    /**
     * Object type of the ESXi hosts used for tag lookups
     */
    String HOST = "HostSystem";

    /**
     * @return  Address of the vCenter
     */
    String server();

    /**
     * @return  Datacenter of the session or null for the default one
     */
    String datacenter();

    /**
     * @param resourcePool  Path or name of the resource pool
     *
     * @return  Name of the compute cluster owning the resource pool or null when the pool does not exist
     */
    String resourcePoolOwner(String resourcePool);

    boolean folderExists(String folder);

    boolean datacenterExists(String datacenter);

    boolean computeClusterExists(String computeCluster);

    boolean datastoreExists(String datastore);

    boolean networkExists(String network);

    /**
     * @param computeCluster    Compute cluster
     * @param hostGroup         Host group inside the compute cluster
     *
     * @return  Names of the hosts in the group or null when the group does not exist
     */
    List<String> hostsInGroup(String computeCluster, String hostGroup);

    boolean vmGroupExists(String computeCluster, String vmGroup);

    /**
     * @param objectType    One of {@link #DATACENTER}, {@link #COMPUTE_CLUSTER} or {@link #HOST}
     * @param objectName    Name of the object
     *
     * @return  Tags attached to the object
     */
    List<Tag> attachedTags(String objectType, String objectName);
}
