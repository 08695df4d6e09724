/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.cluster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.ObjectReference;

/**
 * Bootstrap configuration of a Machine. The data secret name is set by the bootstrap provider once the bootstrap
 * data are available.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Bootstrap {
    private ObjectReference configRef;
    private String dataSecretName;

    public Bootstrap() {
    }

    public Bootstrap(String dataSecretName) {
        this.dataSecretName = dataSecretName;
    }

    public ObjectReference getConfigRef() {
        return configRef;
    }

    public void setConfigRef(ObjectReference configRef) {
        this.configRef = configRef;
    }

    public String getDataSecretName() {
        return dataSecretName;
    }

    public void setDataSecretName(String dataSecretName) {
        this.dataSecretName = dataSecretName;
    }
}
