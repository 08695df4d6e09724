/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer.appliance;

/**
 * Failure of a call to the load balancer appliance
 */
public class ApplianceException extends RuntimeException {
    private final int statusCode;

    /**
     * @param message       Error message
     * @param statusCode    HTTP status code returned by the appliance or -1 when there was no response
     */
    public ApplianceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * @param message   Error message
     * @param cause     Cause
     */
    public ApplianceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return  HTTP status code returned by the appliance or -1 when there was no response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
