/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * Creates and caches the vCenter sessions
 */
public interface SessionProvider {
    /**
     * Returns a cached session for the server, datacenter and user or logs in with a new one. A cached session whose
     * login expired is replaced.
     *
     * @param server        Address of the vCenter
     * @param datacenter    Datacenter or null for the default one
     * @param credentials   Credentials
     *
     * @return  Session
     *
     * @throws VSphereException when the vCenter cannot be reached or the login fails
     */
    Session getOrCreate(String server, String datacenter, Credentials credentials);
}
