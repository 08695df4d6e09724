/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.zone;

/**
 * Kind of vSphere object a region or zone tag is attached to
 */
public enum FailureDomainType {
    Datacenter,
    ComputeCluster,
    HostGroup
}
