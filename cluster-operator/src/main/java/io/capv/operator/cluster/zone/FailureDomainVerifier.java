/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.zone.FailureDomain;
import io.capv.api.model.zone.FailureDomainHosts;
import io.capv.api.model.zone.Topology;
import io.capv.api.model.zone.VSphereFailureDomainSpec;
import io.capv.operator.cluster.vsphere.Session;
import io.capv.operator.cluster.vsphere.Tag;

import java.util.List;
import java.util.Objects;

/**
 * Checks that the topology of a failure domain exists in vCenter and that the region and zone tags are attached to
 * the objects selected by the type of the region or zone.
 */
public class FailureDomainVerifier {
    /**
     * @param session   vCenter session
     * @param spec      Spec of the failure domain
     *
     * @return  Result of the check
     */
    public Verification verify(Session session, VSphereFailureDomainSpec spec) {
        Topology topology = spec.getTopology();
        if (topology == null) {
            return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Failure domain has no topology");
        }

        Verification result = verifyTopology(session, topology);
        if (!result.isPassed()) {
            return result;
        }

        result = verifyTags(session, "region", spec.getRegion(), topology);
        if (!result.isPassed()) {
            return result;
        }

        return verifyTags(session, "zone", spec.getZone(), topology);
    }

    private Verification verifyTopology(Session session, Topology topology) {
        if (topology.getDatacenter() == null || !session.datacenterExists(topology.getDatacenter())) {
            return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Datacenter %s not found", topology.getDatacenter());
        }

        String computeCluster = topology.getComputeCluster();
        if (computeCluster != null && !session.computeClusterExists(computeCluster)) {
            return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Compute cluster %s not found", computeCluster);
        }

        FailureDomainHosts hosts = topology.getHosts();
        if (hosts != null) {
            if (computeCluster == null) {
                return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Host groups require a compute cluster");
            } else if (hosts.getVmGroupName() != null && !session.vmGroupExists(computeCluster, hosts.getVmGroupName())) {
                return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "VM group %s not found", hosts.getVmGroupName());
            } else if (hosts.getHostGroupName() != null && session.hostsInGroup(computeCluster, hosts.getHostGroupName()) == null) {
                return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Host group %s not found", hosts.getHostGroupName());
            }
        }

        if (topology.getDatastore() != null && !session.datastoreExists(topology.getDatastore())) {
            return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Datastore %s not found", topology.getDatastore());
        }

        if (topology.getNetworks() != null) {
            for (String network : topology.getNetworks()) {
                if (!session.networkExists(network)) {
                    return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "Network %s not found", network);
                }
            }
        }

        return Verification.passed();
    }

    private Verification verifyTags(Session session, String level, FailureDomain domain, Topology topology) {
        if (domain == null || domain.getType() == null) {
            return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "The %s of the failure domain is not defined", level);
        }

        switch (domain.getType()) {
            case Datacenter:
                return verifyTag(session, Session.DATACENTER, topology.getDatacenter(), level, domain, ConditionReasons.TAG_NOT_ATTACHED);
            case ComputeCluster:
                return verifyTag(session, Session.COMPUTE_CLUSTER, topology.getComputeCluster(), level, domain, ConditionReasons.TAG_NOT_ATTACHED);
            case HostGroup:
                FailureDomainHosts hosts = topology.getHosts();
                if (hosts == null || hosts.getHostGroupName() == null) {
                    return Verification.failed(ConditionReasons.TOPOLOGY_NOT_FOUND, "The %s is a host group but the topology has none", level);
                }

                List<String> members = session.hostsInGroup(topology.getComputeCluster(), hosts.getHostGroupName());
                for (String host : members) {
                    Verification result = verifyTag(session, Session.HOST, host, level, domain, ConditionReasons.HOST_GROUP_NOT_TAGGED);
                    if (!result.isPassed()) {
                        return result;
                    }
                }

                return Verification.passed();
            default:
                throw new IllegalStateException("Unknown failure domain type " + domain.getType());
        }
    }

    private Verification verifyTag(Session session, String objectType, String objectName, String level, FailureDomain domain, String missingReason) {
        List<Tag> tags = session.attachedTags(objectType, objectName);

        Tag match = null;
        if (tags != null) {
            for (Tag tag : tags) {
                if (Objects.equals(tag.name(), domain.getName())) {
                    match = tag;
                    break;
                }
            }
        }

        if (match == null) {
            return Verification.failed(missingReason, "Tag %s of the %s is not attached to %s %s", domain.getName(), level, objectType, objectName);
        } else if (domain.getTagCategory() != null && !domain.getTagCategory().equals(match.category())) {
            return Verification.failed(ConditionReasons.TAG_CATEGORY_MISMATCH, "Tag %s of the %s belongs to category %s instead of %s",
                    domain.getName(), level, match.category(), domain.getTagCategory());
        }

        return Verification.passed();
    }
}
