/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Desired state of a VSphereClusterIdentity
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"secretName", "allowedNamespaces"})
public class VSphereClusterIdentitySpec {
    private String secretName;
    private AllowedNamespaces allowedNamespaces;

    /**
     * @return  Name of the Secret with the credentials in the operator namespace
     */
    public String getSecretName() {
        return secretName;
    }

    public void setSecretName(String secretName) {
        this.secretName = secretName;
    }

    /**
     * @return  Namespaces which may use the identity. When not set, no namespace may use it.
     */
    public AllowedNamespaces getAllowedNamespaces() {
        return allowedNamespaces;
    }

    public void setAllowedNamespaces(AllowedNamespaces allowedNamespaces) {
        this.allowedNamespaces = allowedNamespaces;
    }
}
