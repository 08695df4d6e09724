/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.common;

/**
 * API groups, versions, well-known labels, annotations and finalizers
 */
public class Constants {
    private Constants() {
    }

    public static final String V1BETA1 = "v1beta1";

    /**
     * Group of the upstream Cluster API resources (Cluster, Machine)
     */
    public static final String CLUSTER_API_GROUP = "cluster.x-k8s.io";
    public static final String CLUSTER_API_VERSION = CLUSTER_API_GROUP + "/" + V1BETA1;

    /**
     * Group of the vSphere infrastructure resources
     */
    public static final String INFRASTRUCTURE_GROUP = "infrastructure.cluster.x-k8s.io";
    public static final String INFRASTRUCTURE_API_VERSION = INFRASTRUCTURE_GROUP + "/" + V1BETA1;

    /**
     * Label linking resources to the Cluster they belong to
     */
    public static final String CLUSTER_NAME_LABEL = CLUSTER_API_GROUP + "/cluster-name";

    /**
     * Label marking control plane Machines
     */
    public static final String CONTROL_PLANE_LABEL = CLUSTER_API_GROUP + "/control-plane";

    /**
     * Annotation pausing the reconciliation of a resource
     */
    public static final String PAUSED_ANNOTATION = CLUSTER_API_GROUP + "/paused";

    public static final String CLUSTER_FINALIZER = "vspherecluster." + INFRASTRUCTURE_GROUP;
    public static final String MACHINE_FINALIZER = "vspheremachine." + INFRASTRUCTURE_GROUP;
    public static final String VM_FINALIZER = "vspherevm." + INFRASTRUCTURE_GROUP;
    public static final String HAPROXY_LOAD_BALANCER_FINALIZER = "haproxyloadbalancer." + INFRASTRUCTURE_GROUP;
    public static final String NSXT_LOAD_BALANCER_FINALIZER = "nsxtloadbalancer." + INFRASTRUCTURE_GROUP;
    public static final String DEPLOYMENT_ZONE_FINALIZER = "vspheredeploymentzone." + INFRASTRUCTURE_GROUP;
    public static final String CLUSTER_IDENTITY_FINALIZER = "vsphereclusteridentity." + INFRASTRUCTURE_GROUP;

    /**
     * Finalizer protecting the Secret claimed by a VSphereClusterIdentity
     */
    public static final String IDENTITY_SECRET_FINALIZER = "vspherecluster/" + INFRASTRUCTURE_GROUP;

    /**
     * Default port of the Kubernetes API server
     */
    public static final int DEFAULT_API_SERVER_PORT = 6443;
}
