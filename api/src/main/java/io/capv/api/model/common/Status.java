/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for the status sections of the custom resources managed by the operator
 */
public abstract class Status {
    private List<Condition> conditions;

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }

    /**
     * Returns the conditions list and creates it when it does not exist yet. Used by the code which modifies the
     * conditions in place.
     *
     * @return  Mutable list of conditions
     */
    public List<Condition> conditions() {
        if (conditions == null) {
            conditions = new ArrayList<>();
        }

        return conditions;
    }
}
