/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.ObjectReference;

/**
 * Desired state of a VSphereVM
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"biosUUID", "bootstrapRef"})
public class VSphereVMSpec extends VirtualMachineCloneSpec {
    private String biosUUID;
    private ObjectReference bootstrapRef;

    public String getBiosUUID() {
        return biosUUID;
    }

    public void setBiosUUID(String biosUUID) {
        this.biosUUID = biosUUID;
    }

    public ObjectReference getBootstrapRef() {
        return bootstrapRef;
    }

    public void setBootstrapRef(ObjectReference bootstrapRef) {
        this.bootstrapRef = bootstrapRef;
    }
}
