/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import io.capv.api.model.common.Constants;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.util.Map;

/**
 * Utility methods for handling annotations
 */
public class Annotations {
    private Annotations() {
    }

    /**
     * Checks whether the reconciliation of the resource is paused with the pause annotation. Any value of the
     * annotation pauses the reconciliation.
     *
     * @param resource  Resource which should be checked
     *
     * @return  True if the reconciliation is paused. False otherwise.
     */
    public static boolean isReconciliationPausedWithAnnotation(HasMetadata resource) {
        return resource != null && isReconciliationPausedWithAnnotation(resource.getMetadata());
    }

    /**
     * @param metadata  Metadata which should be checked
     *
     * @return  True if the metadata carry the pause annotation
     */
    public static boolean isReconciliationPausedWithAnnotation(ObjectMeta metadata) {
        if (metadata == null) {
            return false;
        }

        Map<String, String> annotations = metadata.getAnnotations();
        return annotations != null && annotations.containsKey(Constants.PAUSED_ANNOTATION);
    }
}
