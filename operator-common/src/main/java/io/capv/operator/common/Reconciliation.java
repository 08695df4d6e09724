/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One pass of a controller over a single resource. The sequence number and the trigger end up in every log line
 * written through {@link ReconciliationLogger}, so that the lines of concurrent passes can be told apart.
 */
public final class Reconciliation {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    /**
     * Placeholder used where no real resource is being reconciled (mostly tests)
     */
    public static final Reconciliation DUMMY_RECONCILIATION = new Reconciliation("test", "kind", "namespace", "name");

    private final long sequence = SEQUENCE.incrementAndGet();
    private final String trigger;
    private final String kind;
    private final String namespace;
    private final String name;
    private final Marker marker;

    /**
     * @param trigger       Event which caused this pass (watch, timer, requeue, ...)
     * @param kind          Resource kind
     * @param namespace     Resource namespace
     * @param name          Resource name
     */
    public Reconciliation(String trigger, String kind, String namespace, String name) {
        this.trigger = trigger;
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.marker = MarkerManager.getMarker(kind + "/" + namespace + "/" + name);
    }

    public String trigger() {
        return trigger;
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

    /**
     * @return  Log4j marker identifying the reconciled resource
     */
    public Marker getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return kind + "(" + namespace + "/" + name + ") #" + sequence + " [" + trigger + "]";
    }
}
