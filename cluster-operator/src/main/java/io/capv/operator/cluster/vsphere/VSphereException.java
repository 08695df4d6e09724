/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * Failure of a call to the vCenter. Such failures are usually transient and the reconciliation is retried with a
 * back-off.
 */
public class VSphereException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * @param message   Error message
     */
    public VSphereException(String message) {
        super(message);
    }

    /**
     * @param message   Error message
     * @param cause     Cause
     */
    public VSphereException(String message, Throwable cause) {
        super(message, cause);
    }
}
