/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer.appliance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Configuration of the load balancer appliance. The configuration is shared by all load balancers and every change is
 * checked against the version it was based on.
 *
 * @param version           Version of the configuration
 * @param virtualServers    Virtual servers
 * @param pools             Server pools
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplianceConfiguration(long version, List<VirtualServer> virtualServers, List<Pool> pools) {
    /**
     * Creates the configuration, treating missing lists as empty
     */
    public ApplianceConfiguration {
        virtualServers = virtualServers != null ? List.copyOf(virtualServers) : List.of();
        pools = pools != null ? List.copyOf(pools) : List.of();
    }

    /**
     * @param name  Name of the virtual server
     *
     * @return  The virtual server or null
     */
    public VirtualServer virtualServer(String name) {
        return virtualServers.stream().filter(vs -> name.equals(vs.name())).findFirst().orElse(null);
    }

    /**
     * @param name  Name of the pool
     *
     * @return  The pool or null
     */
    public Pool pool(String name) {
        return pools.stream().filter(pool -> name.equals(pool.name())).findFirst().orElse(null);
    }

    /**
     * Virtual server listening on the virtual IP of a load balancer
     *
     * @param name                      Name
     * @param loadBalancerServiceId     Load balancer service the virtual server is attached to
     * @param ipAddress                 Virtual IP
     * @param port                      Port
     * @param poolName                  Pool serving the traffic
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VirtualServer(String name, String loadBalancerServiceId, String ipAddress, int port, String poolName) {
    }

    /**
     * Pool of backend servers
     *
     * @param name                  Name
     * @param algorithm             Balancing algorithm
     * @param minActiveMembers      Minimum of active members for the pool to be up
     * @param members               Members
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pool(String name, String algorithm, int minActiveMembers, List<PoolMember> members) {
        /**
         * Creates the pool, treating missing members as empty
         */
        public Pool {
            members = members != null ? List.copyOf(members) : List.of();
        }
    }

    /**
     * Backend server
     *
     * @param name          Name
     * @param ipAddress     Address
     * @param port          Port
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PoolMember(String name, String ipAddress, int port) {
    }
}
