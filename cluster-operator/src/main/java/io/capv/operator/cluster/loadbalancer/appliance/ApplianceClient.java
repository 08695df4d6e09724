/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer.appliance;

/**
 * Client for the control API of the load balancer appliance. Configuration changes are made in transactions: the
 * configuration read in a transaction is changed, posted back with the version it was based on and committed.
 */
public interface ApplianceClient {
    /**
     * @return  ID of a new transaction
     */
    String startTransaction();

    /**
     * @param transactionId     Transaction
     *
     * @return  Configuration as seen in the transaction
     */
    ApplianceConfiguration getConfiguration(String transactionId);

    /**
     * Replaces the configuration within the transaction
     *
     * @param transactionId     Transaction
     * @param configuration     New configuration
     * @param expectedVersion   Version the new configuration is based on
     */
    void postConfiguration(String transactionId, ApplianceConfiguration configuration, long expectedVersion);

    /**
     * @param transactionId     Transaction to commit
     */
    void commit(String transactionId);

    /**
     * Allocates an address from a pool or releases it back
     *
     * @param pool      Name of the IP pool
     * @param ip        Address to release, ignored when allocating
     * @param action    Allocate or release
     *
     * @return  The allocated address when allocating, the released one otherwise
     */
    String allocateOrReleaseIp(String pool, String ip, IpAction action);
}
