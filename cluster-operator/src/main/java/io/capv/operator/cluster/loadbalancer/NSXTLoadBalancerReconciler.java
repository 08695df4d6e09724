/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.model.common.Constants;
import io.capv.api.model.loadbalancer.NSXTLoadBalancer;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.time.Duration;

/**
 * Reconciles the NSXTLoadBalancer resources
 */
public class NSXTLoadBalancerReconciler extends AbstractLoadBalancerReconciler<NSXTLoadBalancer> {
    /**
     * @param client            Kubernetes client
     * @param service           Appliance load balancer service
     * @param requeueInterval   Delay before a load balancer which is not ready is checked again
     */
    public NSXTLoadBalancerReconciler(KubernetesClient client, NSXTLoadBalancerService service, Duration requeueInterval) {
        super(client, service, requeueInterval);
    }

    @Override
    protected String finalizer() {
        return Constants.NSXT_LOAD_BALANCER_FINALIZER;
    }

    @Override
    protected LabelSelector selector(NSXTLoadBalancer loadBalancer) {
        return loadBalancer.getSpec().getSelector();
    }
}
