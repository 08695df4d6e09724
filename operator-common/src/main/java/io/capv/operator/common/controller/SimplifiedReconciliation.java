/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import io.capv.operator.common.Reconciliation;

import java.util.Objects;

/**
 * Work queue entry. It identifies the resource by kind, namespace and name and remembers what queued it. The
 * trigger does not take part in equality, so a resource sits in the queue at most once no matter how many events
 * arrive for it. Cluster scoped resources have an empty namespace.
 */
public final class SimplifiedReconciliation {
    private static final String DEFAULT_TRIGGER = "watch";

    private final String kind;
    private final String namespace;
    private final String name;
    private final String trigger;

    public SimplifiedReconciliation(String kind, String namespace, String name) {
        this(kind, namespace, name, DEFAULT_TRIGGER);
    }

    public SimplifiedReconciliation(String kind, String namespace, String name, String trigger) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.namespace = namespace != null ? namespace : "";
        this.name = Objects.requireNonNull(name, "name");
        this.trigger = trigger;
    }

    /**
     * @param trigger   Trigger of the copy
     *
     * @return  Entry for the same resource queued by another trigger
     */
    public SimplifiedReconciliation withTrigger(String trigger) {
        return new SimplifiedReconciliation(kind, namespace, name, trigger);
    }

    /**
     * @return  A new reconciliation (with a new sequence number) for this entry
     */
    public Reconciliation toReconciliation() {
        return new Reconciliation(trigger, kind, namespace, name);
    }

    /**
     * @return  Key shared by the lock manager and the back-off for this resource
     */
    public String lockName() {
        return String.join("::", kind, namespace, name);
    }

    public String kind() {
        return kind;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    public String trigger() {
        return trigger;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimplifiedReconciliation)) {
            return false;
        }
        SimplifiedReconciliation other = (SimplifiedReconciliation) o;
        return kind.equals(other.kind) && namespace.equals(other.namespace) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, namespace, name);
    }

    @Override
    public String toString() {
        return kind + "(" + namespace + "/" + name + ") via " + trigger;
    }
}
