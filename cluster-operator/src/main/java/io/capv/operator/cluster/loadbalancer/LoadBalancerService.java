/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.model.common.Constants;
import io.capv.api.model.loadbalancer.LoadBalancerStatus;
import io.capv.operator.common.Reconciliation;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.List;

/**
 * Drives one kind of load balancer. The implementations converge the backend of the load balancer and report whether
 * it is ready and under which address it can be reached.
 *
 * @param <T>   Type of the load balancer custom resource
 */
public interface LoadBalancerService<T extends CustomResource<?, LoadBalancerStatus>> {
    /**
     * @return  Kind of the load balancer resources handled by this service
     */
    String kind();

    /**
     * @return  Operation for the load balancer resources
     */
    MixedOperation<T, ? extends KubernetesResourceList<T>, Resource<T>> operation();

    /**
     * Converges the backend of the load balancer
     *
     * @param reconciliation    Reconciliation marker
     * @param loadBalancer      Load balancer resource
     * @param members           Desired backend members
     *
     * @return  The status of the backend
     */
    LoadBalancerStatus reconcile(Reconciliation reconciliation, T loadBalancer, List<LoadBalancerMember> members);

    /**
     * Tears down the backend of the load balancer
     *
     * @param reconciliation    Reconciliation marker
     * @param loadBalancer      Load balancer resource
     *
     * @return  True when nothing is left in the backend
     */
    boolean delete(Reconciliation reconciliation, T loadBalancer);

    /**
     * Reads the last known status of the load balancer
     *
     * @param loadBalancer  Load balancer resource
     *
     * @return  The status or null if the load balancer was not reconciled yet
     */
    default LoadBalancerStatus getStatus(T loadBalancer) {
        return loadBalancer.getStatus();
    }

    /**
     * @param loadBalancer  Load balancer resource
     *
     * @return  Port on which the load balancer serves the API server
     */
    default int port(T loadBalancer) {
        return Constants.DEFAULT_API_SERVER_PORT;
    }
}
