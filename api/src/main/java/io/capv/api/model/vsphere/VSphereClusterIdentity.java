/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.common.Constants;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Cluster scoped vCenter identity. The credentials live in a Secret in the operator namespace and can be used by the
 * VSphereClusters in the namespaces selected by the identity.
 */
@Group(Constants.INFRASTRUCTURE_GROUP)
@Version(Constants.V1BETA1)
@Kind(VSphereClusterIdentity.RESOURCE_KIND)
@Plural(VSphereClusterIdentity.RESOURCE_PLURAL)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
public class VSphereClusterIdentity extends CustomResource<VSphereClusterIdentitySpec, VSphereClusterIdentityStatus> {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "VSphereClusterIdentity";
    public static final String RESOURCE_PLURAL = "vsphereclusteridentities";
}
