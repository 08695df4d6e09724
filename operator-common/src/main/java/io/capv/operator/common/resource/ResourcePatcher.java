/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.resource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.capv.api.model.common.Status;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.model.StatusDiff;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Persists the changes a reconciliation made to a custom resource. The patcher takes a snapshot of the resource when
 * it is created. When the reconciliation finishes, the Ready condition is recomputed (an explicit
 * Deleting state is kept while the resource is being deleted) and the metadata, spec and status
 * are written only if they differ from the snapshot. Conflicts are propagated to the caller.
 *
 * @param <S>   Type of the status section
 * @param <T>   Type of the custom resource
 */
public class ResourcePatcher<S extends Status, T extends CustomResource<?, S>> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ResourcePatcher.class);
    private static final ObjectMapper SNAPSHOT_MAPPER = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final Reconciliation reconciliation;
    private final MixedOperation<T, ? extends KubernetesResourceList<T>, Resource<T>> operation;
    private final T resource;
    private final JsonNode metadataSnapshot;
    private final JsonNode specSnapshot;
    private final JsonNode statusSnapshot;

    /**
     * Constructs the patcher and takes the snapshot
     *
     * @param reconciliation    Reconciliation marker
     * @param operation         Client operation for the custom resource type
     * @param resource          The resource as read from the API server
     */
    public ResourcePatcher(Reconciliation reconciliation, MixedOperation<T, ? extends KubernetesResourceList<T>, Resource<T>> operation, T resource) {
        this.reconciliation = reconciliation;
        this.operation = operation;
        this.resource = resource;
        this.metadataSnapshot = SNAPSHOT_MAPPER.valueToTree(resource.getMetadata());
        this.specSnapshot = SNAPSHOT_MAPPER.valueToTree(resource.getSpec());
        this.statusSnapshot = SNAPSHOT_MAPPER.valueToTree(resource.getStatus());
    }

    /**
     * @return  The resource which the reconciliation modifies
     */
    public T resource() {
        return resource;
    }

    /**
     * Runs the reconciliation body and patches the resource afterwards. If the body fails, a failure of the patch is
     * logged and attached to the original error as a suppressed exception.
     *
     * @param body  Reconciliation body
     *
     * @return  Result of the reconciliation body
     */
    public ReconcileResult reconcile(Supplier<ReconcileResult> body) {
        ReconcileResult result;

        try {
            result = body.get();
        } catch (RuntimeException e) {
            try {
                patch();
            } catch (RuntimeException patchError) {
                LOGGER.warnCr(reconciliation, "Failed to patch the resource after a failed reconciliation", patchError);
                e.addSuppressed(patchError);
            }

            throw e;
        }

        patch();
        return result;
    }

    /**
     * Writes the changes. Metadata and spec are written with an update when they changed, the status with a status
     * update when it differs from the snapshot.
     *
     * @return  True if anything was written
     */
    public boolean patch() {
        Conditions.setSummary(resource.getStatus(), Finalizers.isDeleting(resource));

        boolean written = false;
        T current = resource;

        if (!Objects.equals(SNAPSHOT_MAPPER.valueToTree(resource.getMetadata()), metadataSnapshot)
                || !Objects.equals(SNAPSHOT_MAPPER.valueToTree(resource.getSpec()), specSnapshot)) {
            LOGGER.debugCr(reconciliation, "Updating metadata and spec");

            try {
                T updated = resource(resource).update();
                written = true;

                if (updated != null) {
                    current = updated;
                    resource.getMetadata().setResourceVersion(updated.getMetadata().getResourceVersion());
                }
            } catch (KubernetesClientException e) {
                if (KubernetesResources.isNotFound(e)) {
                    LOGGER.debugCr(reconciliation, "Resource no longer exists");
                    return false;
                }

                throw e;
            }
        }

        if (Finalizers.isDeleting(resource)
                && (resource.getMetadata().getFinalizers() == null || resource.getMetadata().getFinalizers().isEmpty())) {
            LOGGER.debugCr(reconciliation, "Resource is being deleted without finalizers, status is not written");
            return written;
        }

        if (!new StatusDiff(statusSnapshot, resource.getStatus()).isEmpty()) {
            LOGGER.debugCr(reconciliation, "Updating status");

            if (current != resource) {
                current.setStatus(resource.getStatus());
            }

            try {
                T updated = resource(current).updateStatus();

                if (updated != null) {
                    resource.getMetadata().setResourceVersion(updated.getMetadata().getResourceVersion());
                }

                written = true;
            } catch (KubernetesClientException e) {
                if (KubernetesResources.isNotFound(e)) {
                    LOGGER.debugCr(reconciliation, "Resource no longer exists");
                    return written;
                }

                throw e;
            }
        }

        return written;
    }

    private Resource<T> resource(T item) {
        String namespace = item.getMetadata().getNamespace();

        if (namespace == null) {
            // Cluster scoped
            return operation.resource(item);
        } else {
            return operation.inNamespace(namespace).resource(item);
        }
    }
}
