/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.zone;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Region or zone of a failure domain together with the tag describing it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "type", "tagCategory", "autoConfigure"})
public class FailureDomain {
    private String name;
    private FailureDomainType type;
    private String tagCategory;
    private Boolean autoConfigure;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public FailureDomainType getType() {
        return type;
    }

    public void setType(FailureDomainType type) {
        this.type = type;
    }

    public String getTagCategory() {
        return tagCategory;
    }

    public void setTagCategory(String tagCategory) {
        this.tagCategory = tagCategory;
    }

    public Boolean getAutoConfigure() {
        return autoConfigure;
    }

    public void setAutoConfigure(Boolean autoConfigure) {
        this.autoConfigure = autoConfigure;
    }
}
