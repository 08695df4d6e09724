/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.model;

import io.capv.api.model.common.Constants;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * An immutable set of labels
 */
public class Labels {
    /**
     * Label used to mark the objects the operator created inside the workload clusters
     */
    public static final String KUBERNETES_MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";

    /**
     * Value of the managed-by label
     */
    public static final String MANAGED_BY = "cluster-api-provider-vsphere";

    /**
     * Empty set of labels
     */
    public static final Labels EMPTY = new Labels(emptyMap());

    private final Map<String, String> labels;

    private Labels(Map<String, String> labels) {
        this.labels = unmodifiableMap(new HashMap<>(labels));
    }

    /**
     * @param labels The map of labels.
     * @return A labels instance from Map.
     */
    public static Labels fromMap(Map<String, String> labels) {
        if (labels != null) {
            return new Labels(labels);
        }

        return EMPTY;
    }

    /**
     * @param resource The resource to get the labels of.
     * @return A new instance with the labels of the given {@code resource}.
     */
    public static Labels fromResource(HasMetadata resource) {
        return fromMap(resource.getMetadata().getLabels());
    }

    /**
     * @param cluster The cluster.
     * @return A singleton instance with the given {@code cluster} for the {@code cluster.x-k8s.io/cluster-name} key.
     */
    public static Labels forCluster(String cluster) {
        return EMPTY.withClusterName(cluster);
    }

    private Labels with(String label, String value) {
        Map<String, String> newLabels = new HashMap<>(labels.size() + 1);
        newLabels.putAll(labels);
        newLabels.put(label, value);
        return new Labels(newLabels);
    }

    /**
     * @param cluster   Name of the cluster
     *
     * @return A new instance with the cluster name label
     */
    public Labels withClusterName(String cluster) {
        return with(Constants.CLUSTER_NAME_LABEL, cluster);
    }

    /**
     * @return A new instance with the control plane label
     */
    public Labels withControlPlane() {
        return with(Constants.CONTROL_PLANE_LABEL, "");
    }

    /**
     * @return A new instance with the managed-by label
     */
    public Labels withManagedBy() {
        return with(KUBERNETES_MANAGED_BY_LABEL, MANAGED_BY);
    }

    /**
     * @param additionalLabels The labels to add.
     * @return A new instances with the given {@code additionalLabels} added to the labels in this instance.
     */
    public Labels withAdditionalLabels(Map<String, String> additionalLabels) {
        if (additionalLabels == null || additionalLabels.isEmpty()) {
            return this;
        } else {
            Map<String, String> newLabels = new HashMap<>(labels.size() + additionalLabels.size());
            newLabels.putAll(labels);
            newLabels.putAll(additionalLabels);

            return new Labels(newLabels);
        }
    }

    /**
     * @return the value of the cluster name label or null
     */
    public String clusterName() {
        return labels.get(Constants.CLUSTER_NAME_LABEL);
    }

    /**
     * @return true when the control plane label is present
     */
    public boolean isControlPlane() {
        return labels.containsKey(Constants.CONTROL_PLANE_LABEL);
    }

    /**
     * Checks the labels against a label selector. A null selector matches nothing and an empty one matches everything.
     *
     * @param selector  Label selector
     *
     * @return  True if the labels match the selector
     */
    public boolean matches(LabelSelector selector) {
        if (selector == null) {
            return false;
        }

        if (selector.getMatchLabels() != null) {
            for (Map.Entry<String, String> entry : selector.getMatchLabels().entrySet()) {
                if (!Objects.equals(labels.get(entry.getKey()), entry.getValue())) {
                    return false;
                }
            }
        }

        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                if (!matches(requirement)) {
                    return false;
                }
            }
        }

        return true;
    }

    private boolean matches(LabelSelectorRequirement requirement) {
        String value = labels.get(requirement.getKey());
        List<String> values = requirement.getValues() != null ? requirement.getValues() : List.of();

        switch (requirement.getOperator()) {
            case "In":
                return value != null && values.contains(value);
            case "NotIn":
                return value == null || !values.contains(value);
            case "Exists":
                return labels.containsKey(requirement.getKey());
            case "DoesNotExist":
                return !labels.containsKey(requirement.getKey());
            default:
                throw new IllegalArgumentException("Unsupported label selector operator " + requirement.getOperator());
        }
    }

    /**
     * @return an unmodifiable map of the labels.
     */
    public Map<String, String> toMap() {
        return labels;
    }

    /**
     * @return A string which can be used as the Kubernetes label selector (e.g. key1=value1,key2=value2).
     */
    public String toSelectorString() {
        return labels.entrySet().stream().map(entry -> entry.getKey() + "=" + entry.getValue()).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Labels labels1 = (Labels) o;
        return Objects.equals(labels, labels1.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels);
    }

    @Override
    public String toString() {
        return "Labels" + labels;
    }
}
