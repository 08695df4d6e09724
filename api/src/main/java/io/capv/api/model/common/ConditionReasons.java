/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.common;

/**
 * Reasons used for conditions with status False
 */
public class ConditionReasons {
    private ConditionReasons() {
    }

    // Credentials
    public static final String SECRET_NOT_FOUND = "SecretNotFound";
    public static final String SECRET_ALREADY_IN_USE = "SecretAlreadyInUse";
    public static final String SECRET_OWNER_REFERENCE_FAILED = "SecretOwnerReferenceFailed";
    public static final String IDENTITY_NOT_FOUND = "IdentityNotFound";
    public static final String IDENTITY_NOT_READY = "IdentityNotReady";
    public static final String NAMESPACE_NOT_ALLOWED = "NamespaceNotAllowed";
    public static final String UNSUPPORTED_IDENTITY_KIND = "UnsupportedIdentityKind";

    // vCenter
    public static final String VCENTER_UNREACHABLE = "VCenterUnreachable";

    // Load balancers
    public static final String LOAD_BALANCER_NOT_FOUND = "LoadBalancerNotFound";
    public static final String WAITING_FOR_LOAD_BALANCER = "WaitingForLoadBalancer";
    public static final String LOAD_BALANCER_PROVISIONING_FAILED = "LoadBalancerProvisioningFailed";
    public static final String WAITING_FOR_BACKEND_MEMBERS = "WaitingForBackendMembers";

    // Control plane endpoint and add-ons
    public static final String WAITING_FOR_CONTROL_PLANE_MACHINES = "WaitingForControlPlaneMachines";
    public static final String WAITING_FOR_API_SERVER = "WaitingForAPIServer";
    public static final String ADDON_INSTALLATION_FAILED = "AddonInstallationFailed";

    // Service discovery
    public static final String SUPERVISOR_HEADLESS_SERVICE_SETUP_FAILED = "SupervisorHeadlessServiceSetupFailed";

    // Machines and VMs
    public static final String WAITING_FOR_CLUSTER_INFRASTRUCTURE = "WaitingForClusterInfrastructure";
    public static final String WAITING_FOR_CONTROL_PLANE_AVAILABLE = "WaitingForControlPlaneAvailable";
    public static final String WAITING_FOR_BOOTSTRAP_DATA = "WaitingForBootstrapData";
    public static final String CLONING = "Cloning";
    public static final String WAITING_FOR_PROVIDER_ID = "WaitingForProviderID";
    public static final String WAITING_FOR_NETWORK_ADDRESS = "WaitingForNetworkAddress";
    public static final String WAITING_FOR_STATIC_IP_ALLOCATION = "WaitingForStaticIPAllocation";
    public static final String DELETING = "Deleting";
    public static final String DELETION_FAILED = "DeletionFailed";

    // Deployment zones
    public static final String RESOURCE_POOL_NOT_FOUND = "ResourcePoolNotFound";
    public static final String RESOURCE_POOL_OWNED_BY_OTHER_CLUSTER = "ResourcePoolOwnedByOtherCluster";
    public static final String FOLDER_NOT_FOUND = "FolderNotFound";
    public static final String FAILURE_DOMAIN_NOT_FOUND = "FailureDomainNotFound";
    public static final String TOPOLOGY_NOT_FOUND = "TopologyNotFound";
    public static final String TAG_NOT_ATTACHED = "TagNotAttached";
    public static final String TAG_CATEGORY_MISMATCH = "TagCategoryMismatch";
    public static final String HOST_GROUP_NOT_TAGGED = "HostGroupNotTagged";
}
