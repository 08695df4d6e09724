/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * User name and password used to log into a vCenter. The password is never printed.
 *
 * @param username  User name
 * @param password  Password
 */
public record Credentials(String username, String password) {
    /**
     * @return  True when both the user name and the password are set
     */
    public boolean isComplete() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "Credentials(username=" + username + ", password=********)";
    }
}
