/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.capv.operator.common.ReconciliationLogger;
import io.fabric8.zjsonpatch.JsonDiff;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * JSON patch between two status sections. A condition whose only change is its transition time is not a change.
 */
public class StatusDiff {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(StatusDiff.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private static final Pattern TRANSITION_TIME = Pattern.compile("/conditions/\\d+/lastTransitionTime");

    private final List<JsonNode> operations = new ArrayList<>();

    /**
     * @param current   Status as last read from the API server, may be null
     * @param desired   Status computed by the reconciliation, may be null
     */
    public StatusDiff(Object current, Object desired) {
        for (JsonNode operation : JsonDiff.asJson(asObject(current), asObject(desired))) {
            if (TRANSITION_TIME.matcher(operation.path("path").asText()).matches()) {
                continue;
            }
            LOGGER.debugOp("Status change {}", operation);
            operations.add(operation);
        }
    }

    private static JsonNode asObject(Object status) {
        if (status == null) {
            return MAPPER.createObjectNode();
        }
        JsonNode tree = MAPPER.valueToTree(status);
        return tree.isObject() ? tree : MAPPER.createObjectNode();
    }

    /**
     * @return  The JSON patch operations which remain after dropping the transition time changes
     */
    public List<JsonNode> operations() {
        return List.copyOf(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
