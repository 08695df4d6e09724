/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.common;

/**
 * Types of the conditions used by the operator
 */
public class ConditionTypes {
    private ConditionTypes() {
    }

    /**
     * Summary condition computed from all other conditions
     */
    public static final String READY = "Ready";

    // VSphereCluster
    public static final String CREDENTIALS_AVAILABLE = "CredentialsAvailable";
    public static final String VCENTER_AVAILABLE = "VCenterAvailable";
    public static final String LOAD_BALANCER_AVAILABLE = "LoadBalancerAvailable";
    public static final String CONTROL_PLANE_ENDPOINT_RESOLVED = "ControlPlaneEndpointResolved";
    public static final String ADDONS_INSTALLED = "AddonsInstalled";
    public static final String SERVICE_DISCOVERY_READY = "ServiceDiscoveryReady";

    // VSphereMachine and VSphereVM
    public static final String VM_PROVISIONED = "VMProvisioned";

    // VSphereDeploymentZone
    public static final String PLACEMENT_CONSTRAINT_MET = "PlacementConstraintMet";
    public static final String FAILURE_DOMAIN_VALIDATED = "FailureDomainValidated";
}
