/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.model.common.Constants;
import io.capv.api.model.loadbalancer.HAProxyLoadBalancer;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.time.Duration;

/**
 * Reconciles the HAProxyLoadBalancer resources
 */
public class HAProxyLoadBalancerReconciler extends AbstractLoadBalancerReconciler<HAProxyLoadBalancer> {
    /**
     * @param client            Kubernetes client
     * @param service           HAProxy load balancer service
     * @param requeueInterval   Delay before a load balancer which is not ready is checked again
     */
    public HAProxyLoadBalancerReconciler(KubernetesClient client, HAProxyLoadBalancerService service, Duration requeueInterval) {
        super(client, service, requeueInterval);
    }

    @Override
    protected String finalizer() {
        return Constants.HAPROXY_LOAD_BALANCER_FINALIZER;
    }

    @Override
    protected LabelSelector selector(HAProxyLoadBalancer loadBalancer) {
        return loadBalancer.getSpec().getSelector();
    }
}
