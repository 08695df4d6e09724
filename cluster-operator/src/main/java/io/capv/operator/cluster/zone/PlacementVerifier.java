/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.zone.PlacementConstraint;
import io.capv.api.model.zone.Topology;
import io.capv.operator.cluster.vsphere.Session;

/**
 * Checks that the placement constraint of a deployment zone points to objects inside the compute cluster of its
 * failure domain
 */
public class PlacementVerifier {
    /**
     * @param session       vCenter session
     * @param constraint    Placement constraint of the zone (can be null)
     * @param topology      Topology of the failure domain (can be null)
     *
     * @return  Result of the check
     */
    public Verification verify(Session session, PlacementConstraint constraint, Topology topology) {
        if (constraint == null) {
            return Verification.passed();
        }

        String resourcePool = constraint.getResourcePool();
        if (resourcePool != null && !resourcePool.isEmpty()) {
            String owner = session.resourcePoolOwner(resourcePool);

            if (owner == null) {
                return Verification.failed(ConditionReasons.RESOURCE_POOL_NOT_FOUND, "Resource pool %s not found", resourcePool);
            }

            String computeCluster = topology != null ? topology.getComputeCluster() : null;
            if (computeCluster != null && !computeCluster.isEmpty() && !computeCluster.equals(owner)) {
                return Verification.failed(ConditionReasons.RESOURCE_POOL_OWNED_BY_OTHER_CLUSTER,
                        "Resource pool %s belongs to compute cluster %s instead of %s", resourcePool, owner, computeCluster);
            }
        }

        String folder = constraint.getFolder();
        if (folder != null && !folder.isEmpty() && !session.folderExists(folder)) {
            return Verification.failed(ConditionReasons.FOLDER_NOT_FOUND, "Folder %s not found", folder);
        }

        return Verification.passed();
    }
}
