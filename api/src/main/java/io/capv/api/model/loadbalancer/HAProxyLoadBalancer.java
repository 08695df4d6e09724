/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.loadbalancer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.capv.api.model.common.Constants;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Load balancer backed by a HAProxy virtual machine
 */
@Group(Constants.INFRASTRUCTURE_GROUP)
@Version(Constants.V1BETA1)
@Kind(HAProxyLoadBalancer.RESOURCE_KIND)
@Plural(HAProxyLoadBalancer.RESOURCE_PLURAL)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
public class HAProxyLoadBalancer extends CustomResource<HAProxyLoadBalancerSpec, LoadBalancerStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "HAProxyLoadBalancer";
    public static final String RESOURCE_PLURAL = "haproxyloadbalancers";
}
