/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Cloud controller manager settings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"controllerImage", "extraArgs"})
public class CloudConfig {
    private String controllerImage;
    private Map<String, String> extraArgs;

    public String getControllerImage() {
        return controllerImage;
    }

    public void setControllerImage(String controllerImage) {
        this.controllerImage = controllerImage;
    }

    public Map<String, String> getExtraArgs() {
        return extraArgs;
    }

    public void setExtraArgs(Map<String, String> extraArgs) {
        this.extraArgs = extraArgs;
    }
}
