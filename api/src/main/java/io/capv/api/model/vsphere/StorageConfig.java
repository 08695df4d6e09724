/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Storage driver settings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"controllerImage", "nodeDriverImage", "attacherImage", "provisionerImage", "metadataSyncerImage", "livenessProbeImage", "registrarImage"})
public class StorageConfig {
    private String controllerImage;
    private String nodeDriverImage;
    private String attacherImage;
    private String provisionerImage;
    private String metadataSyncerImage;
    private String livenessProbeImage;
    private String registrarImage;

    public String getControllerImage() {
        return controllerImage;
    }

    public void setControllerImage(String controllerImage) {
        this.controllerImage = controllerImage;
    }

    public String getNodeDriverImage() {
        return nodeDriverImage;
    }

    public void setNodeDriverImage(String nodeDriverImage) {
        this.nodeDriverImage = nodeDriverImage;
    }

    public String getAttacherImage() {
        return attacherImage;
    }

    public void setAttacherImage(String attacherImage) {
        this.attacherImage = attacherImage;
    }

    public String getProvisionerImage() {
        return provisionerImage;
    }

    public void setProvisionerImage(String provisionerImage) {
        this.provisionerImage = provisionerImage;
    }

    public String getMetadataSyncerImage() {
        return metadataSyncerImage;
    }

    public void setMetadataSyncerImage(String metadataSyncerImage) {
        this.metadataSyncerImage = metadataSyncerImage;
    }

    public String getLivenessProbeImage() {
        return livenessProbeImage;
    }

    public void setLivenessProbeImage(String livenessProbeImage) {
        this.livenessProbeImage = livenessProbeImage;
    }

    public String getRegistrarImage() {
        return registrarImage;
    }

    public void setRegistrarImage(String registrarImage) {
        this.registrarImage = registrarImage;
    }
}
