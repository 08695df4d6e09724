/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.resource;

import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Helper methods for plain Kubernetes resources
 */
public class KubernetesResources {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(KubernetesResources.class);

    /**
     * HTTP code used by the API server for missing resources
     */
    public static final int NOT_FOUND = 404;

    /**
     * HTTP code used by the API server for existing resources and stale resource versions
     */
    public static final int CONFLICT = 409;

    private KubernetesResources() { }

    /**
     * Creates the resource unless it already exists. Existing resources are left as they are. Any other error is
     * propagated.
     *
     * @param reconciliation    Reconciliation marker
     * @param client            Kubernetes client
     * @param resource          Resource to create
     *
     * @return  True if the resource was created, false if it existed already
     */
    public static boolean createIfAbsent(Reconciliation reconciliation, KubernetesClient client, HasMetadata resource) {
        try {
            client.resource(resource).create();
            LOGGER.debugCr(reconciliation, "{} {}/{} created", resource.getKind(), resource.getMetadata().getNamespace(), resource.getMetadata().getName());
            return true;
        } catch (KubernetesClientException e) {
            if (isConflict(e)) {
                LOGGER.debugCr(reconciliation, "{} {}/{} already exists", resource.getKind(), resource.getMetadata().getNamespace(), resource.getMetadata().getName());
                return false;
            }

            throw e;
        }
    }

    /**
     * @param e     Client exception
     *
     * @return  True if the exception signals a missing resource
     */
    public static boolean isNotFound(KubernetesClientException e) {
        return e.getCode() == NOT_FOUND;
    }

    /**
     * @param e     Client exception
     *
     * @return  True if the exception signals an existing resource or a conflicting update
     */
    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == CONFLICT;
    }
}
