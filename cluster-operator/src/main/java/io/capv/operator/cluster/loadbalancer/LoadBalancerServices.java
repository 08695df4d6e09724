/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.model.loadbalancer.LoadBalancerStatus;
import io.fabric8.kubernetes.client.CustomResource;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Load balancer services indexed by the kind of the load balancer resource they handle
 */
public class LoadBalancerServices {
    private final Map<String, LoadBalancerService<?>> services = new LinkedHashMap<>();

    /**
     * Registers a service
     *
     * @param service   The service
     *
     * @return  This instance
     */
    public LoadBalancerServices register(LoadBalancerService<?> service) {
        services.put(service.kind(), service);
        return this;
    }

    /**
     * @param kind  Kind of the load balancer resource
     *
     * @return  The service or null if no service handles this kind
     */
    @SuppressWarnings("unchecked")
    public <T extends CustomResource<?, LoadBalancerStatus>> LoadBalancerService<T> forKind(String kind) {
        return (LoadBalancerService<T>) services.get(kind);
    }

    /**
     * @return  All registered services
     */
    public Collection<LoadBalancerService<?>> all() {
        return Collections.unmodifiableCollection(services.values());
    }
}
