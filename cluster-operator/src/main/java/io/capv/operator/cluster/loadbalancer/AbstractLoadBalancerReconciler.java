/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.model.cluster.Cluster;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.loadbalancer.LoadBalancerStatus;
import io.capv.operator.cluster.ClusterResources;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.ResourcePatcher;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.time.Duration;
import java.util.List;

/**
 * Reconciles the load balancer resources of one kind. The backend is driven by the {@link LoadBalancerService} of the
 * kind while this class takes care of the finalizer, the backend members and the status.
 *
 * @param <T>   Type of the load balancer custom resource
 */
public abstract class AbstractLoadBalancerReconciler<T extends CustomResource<?, LoadBalancerStatus>> implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractLoadBalancerReconciler.class);

    private final ClusterResources clusters;
    private final LoadBalancerMembers members;
    private final LoadBalancerService<T> service;
    private final Duration requeueInterval;

    protected AbstractLoadBalancerReconciler(KubernetesClient client, LoadBalancerService<T> service, Duration requeueInterval) {
        this.clusters = new ClusterResources(client);
        this.members = new LoadBalancerMembers(client);
        this.service = service;
        this.requeueInterval = requeueInterval;
    }

    /**
     * @return  Finalizer protecting the backend of the load balancers
     */
    protected abstract String finalizer();

    /**
     * @param loadBalancer  Load balancer
     *
     * @return  Selector of the backend Machines or null to use the control plane Machines of the cluster
     */
    protected abstract LabelSelector selector(T loadBalancer);

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        T loadBalancer = service.operation().inNamespace(reconciliation.namespace()).withName(reconciliation.name()).get();

        if (loadBalancer == null) {
            LOGGER.debugCr(reconciliation, "{} no longer exists", service.kind());
            return ReconcileResult.done();
        } else if (loadBalancer.getSpec() == null) {
            LOGGER.warnCr(reconciliation, "{} has no spec and will be ignored", service.kind());
            return ReconcileResult.done();
        }

        Cluster cluster = clusters.ownerCluster(loadBalancer);
        if (cluster == null && !Finalizers.isDeleting(loadBalancer)) {
            LOGGER.infoCr(reconciliation, "Waiting for the owner Cluster to be set");
            return ReconcileResult.done();
        } else if (ClusterResources.isPaused(cluster, loadBalancer)) {
            LOGGER.infoCr(reconciliation, "Reconciliation is paused");
            return ReconcileResult.done();
        }

        if (loadBalancer.getStatus() == null) {
            loadBalancer.setStatus(new LoadBalancerStatus());
        }

        ResourcePatcher<LoadBalancerStatus, T> patcher = new ResourcePatcher<>(reconciliation, service.operation(), loadBalancer);

        return patcher.reconcile(() -> {
            if (Finalizers.isDeleting(loadBalancer)) {
                return reconcileDelete(reconciliation, loadBalancer);
            } else {
                return reconcileNormal(reconciliation, loadBalancer, cluster);
            }
        });
    }

    private ReconcileResult reconcileNormal(Reconciliation reconciliation, T loadBalancer, Cluster cluster) {
        Finalizers.add(loadBalancer, finalizer());

        LoadBalancerStatus status = loadBalancer.getStatus();
        List<LoadBalancerMember> backend = members.members(loadBalancer.getMetadata().getNamespace(), cluster.getMetadata().getName(), selector(loadBalancer));
        LOGGER.debugCr(reconciliation, "Load balancer has {} backend members", backend.size());

        LoadBalancerStatus result;
        try {
            result = service.reconcile(reconciliation, loadBalancer, backend);
        } catch (RuntimeException e) {
            Conditions.markFalse(status, ConditionTypes.LOAD_BALANCER_AVAILABLE, ConditionReasons.LOAD_BALANCER_PROVISIONING_FAILED,
                    Condition.SEVERITY_WARNING, "%s", e.getMessage());
            throw e;
        }

        status.setReady(result.isReady());
        if (result.getAddress() != null) {
            status.setAddress(result.getAddress());
        }

        if (!result.isReady() || status.getAddress() == null || status.getAddress().isEmpty()) {
            Conditions.markFalse(status, ConditionTypes.LOAD_BALANCER_AVAILABLE, ConditionReasons.WAITING_FOR_LOAD_BALANCER, Condition.SEVERITY_INFO, null);
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        Conditions.markTrue(status, ConditionTypes.LOAD_BALANCER_AVAILABLE);

        if (backend.isEmpty()) {
            LOGGER.infoCr(reconciliation, "Load balancer is ready at {} but has no backend members yet", status.getAddress());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        return ReconcileResult.done();
    }

    private ReconcileResult reconcileDelete(Reconciliation reconciliation, T loadBalancer) {
        if (!Finalizers.has(loadBalancer, finalizer())) {
            return ReconcileResult.done();
        }

        if (service.delete(reconciliation, loadBalancer)) {
            LOGGER.infoCr(reconciliation, "Load balancer backend is gone, removing the finalizer");
            Finalizers.remove(loadBalancer, finalizer());
            return ReconcileResult.done();
        }

        loadBalancer.getStatus().setReady(false);
        Conditions.markFalse(loadBalancer.getStatus(), ConditionTypes.LOAD_BALANCER_AVAILABLE, ConditionReasons.DELETING, Condition.SEVERITY_INFO, null);
        return ReconcileResult.requeueAfter(requeueInterval);
    }
}
