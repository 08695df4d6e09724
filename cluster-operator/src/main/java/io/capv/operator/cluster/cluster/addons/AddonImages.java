/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.CloudConfig;
import io.capv.api.model.vsphere.StorageConfig;

/**
 * Container images of the add-ons installed into the workload clusters
 *
 * @param cloudController       Cloud controller manager
 * @param csiController         CSI controller
 * @param csiNodeDriver         CSI node driver
 * @param csiAttacher           CSI attacher sidecar
 * @param csiProvisioner        CSI provisioner sidecar
 * @param csiMetadataSyncer     CSI metadata syncer
 * @param csiLivenessProbe      CSI liveness probe sidecar
 * @param csiRegistrar          CSI node driver registrar sidecar
 */
public record AddonImages(String cloudController, String csiController, String csiNodeDriver, String csiAttacher,
                          String csiProvisioner, String csiMetadataSyncer, String csiLivenessProbe, String csiRegistrar) {
    /**
     * Applies the images configured in the VSphereCluster on top of these images
     *
     * @param cloud     Cloud provider configuration of the cluster or null
     * @param storage   Storage configuration of the cluster or null
     *
     * @return  New instance with the overrides applied
     */
    public AddonImages withOverrides(CloudConfig cloud, StorageConfig storage) {
        return new AddonImages(
                override(cloudController, cloud != null ? cloud.getControllerImage() : null),
                override(csiController, storage != null ? storage.getControllerImage() : null),
                override(csiNodeDriver, storage != null ? storage.getNodeDriverImage() : null),
                override(csiAttacher, storage != null ? storage.getAttacherImage() : null),
                override(csiProvisioner, storage != null ? storage.getProvisionerImage() : null),
                override(csiMetadataSyncer, storage != null ? storage.getMetadataSyncerImage() : null),
                override(csiLivenessProbe, storage != null ? storage.getLivenessProbeImage() : null),
                override(csiRegistrar, storage != null ? storage.getRegistrarImage() : null));
    }

    private static String override(String defaultImage, String image) {
        return image != null && !image.isEmpty() ? image : defaultImage;
    }
}
