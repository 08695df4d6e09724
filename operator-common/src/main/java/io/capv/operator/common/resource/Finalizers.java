/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent helpers for the finalizers of a resource. They modify the in-memory resource only, the change is persisted
 * by the {@link ResourcePatcher}.
 */
public class Finalizers {
    private Finalizers() { }

    /**
     * @param resource      Resource
     * @param finalizer     Finalizer name
     *
     * @return  True if the resource has the finalizer
     */
    public static boolean has(HasMetadata resource, String finalizer) {
        List<String> finalizers = resource.getMetadata().getFinalizers();
        return finalizers != null && finalizers.contains(finalizer);
    }

    /**
     * @param resource      Resource
     * @param finalizer     Finalizer name
     *
     * @return  True if the finalizer was added, false if it was already present
     */
    public static boolean add(HasMetadata resource, String finalizer) {
        if (has(resource, finalizer)) {
            return false;
        }

        List<String> finalizers = resource.getMetadata().getFinalizers() != null
                ? new ArrayList<>(resource.getMetadata().getFinalizers())
                : new ArrayList<>(1);
        finalizers.add(finalizer);
        resource.getMetadata().setFinalizers(finalizers);

        return true;
    }

    /**
     * @param resource      Resource
     * @param finalizer     Finalizer name
     *
     * @return  True if the finalizer was removed, false if it was not present
     */
    public static boolean remove(HasMetadata resource, String finalizer) {
        if (!has(resource, finalizer)) {
            return false;
        }

        List<String> finalizers = new ArrayList<>(resource.getMetadata().getFinalizers());
        finalizers.remove(finalizer);
        resource.getMetadata().setFinalizers(finalizers);

        return true;
    }

    /**
     * @param resource  Resource
     *
     * @return  True if the resource is marked for deletion
     */
    public static boolean isDeleting(HasMetadata resource) {
        return resource.getMetadata().getDeletionTimestamp() != null;
    }
}
