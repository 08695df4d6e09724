/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * The identity referenced by a VSphereCluster cannot be used. The reason is used for the CredentialsAvailable
 * condition.
 */
public class IdentityException extends VSphereException {
    private static final long serialVersionUID = 1L;

    private final String reason;

    /**
     * @param reason    Condition reason
     * @param message   Error message
     */
    public IdentityException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
