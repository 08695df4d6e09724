/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

/**
 * Backend member of a load balancer
 *
 * @param name      Name of the Machine
 * @param address   Address of the Machine
 */
public record LoadBalancerMember(String name, String address) {
}
