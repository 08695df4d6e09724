/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Helpers for reading and modifying owner references. Owner references are matched by the owner UID.
 */
public class OwnerReferences {
    private OwnerReferences() { }

    /**
     * Builds an owner reference pointing to the owner resource
     *
     * @param owner         Owning resource
     * @param controller    Whether the owner is the controller of the owned resource
     *
     * @return  Owner reference
     */
    public static OwnerReference of(HasMetadata owner, boolean controller) {
        return new OwnerReferenceBuilder()
                .withApiVersion(owner.getApiVersion())
                .withKind(owner.getKind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withController(controller ? true : null)
                .withBlockOwnerDeletion(controller ? true : null)
                .build();
    }

    /**
     * @param resource  Owned resource
     * @param owner     Owner
     *
     * @return  True if the resource has an owner reference to the owner
     */
    public static boolean has(HasMetadata resource, HasMetadata owner) {
        return find(resource, owner.getMetadata().getUid()) != null;
    }

    /**
     * @param resource  Owned resource
     * @param uid       Owner UID
     *
     * @return  The owner reference with the given UID or null
     */
    public static OwnerReference find(HasMetadata resource, String uid) {
        List<OwnerReference> refs = resource.getMetadata().getOwnerReferences();

        if (refs == null) {
            return null;
        }

        return refs.stream().filter(ref -> Objects.equals(ref.getUid(), uid)).findFirst().orElse(null);
    }

    /**
     * @param resource  Owned resource
     * @param kind      Kind of the owner
     *
     * @return  The first owner reference of the given kind or null
     */
    public static OwnerReference findByKind(HasMetadata resource, String kind) {
        List<OwnerReference> refs = resource.getMetadata().getOwnerReferences();

        if (refs == null) {
            return null;
        }

        return refs.stream().filter(ref -> Objects.equals(ref.getKind(), kind)).findFirst().orElse(null);
    }

    /**
     * @param resource  Owned resource
     *
     * @return  The controller owner reference or null
     */
    public static OwnerReference controllerOf(HasMetadata resource) {
        List<OwnerReference> refs = resource.getMetadata().getOwnerReferences();

        if (refs == null) {
            return null;
        }

        return refs.stream().filter(ref -> Boolean.TRUE.equals(ref.getController())).findFirst().orElse(null);
    }

    /**
     * Adds the owner reference unless an owner reference with the same UID exists
     *
     * @param resource  Owned resource
     * @param reference Owner reference
     *
     * @return  True if the reference was added
     */
    public static boolean add(HasMetadata resource, OwnerReference reference) {
        if (find(resource, reference.getUid()) != null) {
            return false;
        }

        List<OwnerReference> refs = resource.getMetadata().getOwnerReferences() != null
                ? new ArrayList<>(resource.getMetadata().getOwnerReferences())
                : new ArrayList<>(1);
        refs.add(reference);
        resource.getMetadata().setOwnerReferences(refs);

        return true;
    }

    /**
     * @param resource  Owned resource
     * @param uid       UID of the owner whose reference should be removed
     *
     * @return  True if a reference was removed
     */
    public static boolean remove(HasMetadata resource, String uid) {
        if (find(resource, uid) == null) {
            return false;
        }

        List<OwnerReference> refs = new ArrayList<>(resource.getMetadata().getOwnerReferences());
        refs.removeIf(ref -> Objects.equals(ref.getUid(), uid));
        resource.getMetadata().setOwnerReferences(refs);

        return true;
    }
}
