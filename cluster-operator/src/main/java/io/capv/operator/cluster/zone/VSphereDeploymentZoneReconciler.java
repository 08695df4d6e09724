/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

import io.capv.api.Crds;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.zone.VSphereDeploymentZone;
import io.capv.api.model.zone.VSphereDeploymentZoneStatus;
import io.capv.api.model.zone.VSphereFailureDomain;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.cluster.vsphere.CredentialsProvider;
import io.capv.operator.cluster.vsphere.Session;
import io.capv.operator.cluster.vsphere.SessionProvider;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.KubernetesResources;
import io.capv.operator.common.resource.OwnerReferences;
import io.capv.operator.common.resource.ResourcePatcher;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validates the VSphereDeploymentZone resources against vCenter. A zone is ready when vCenter is reachable, its
 * placement constraint is met and its failure domain is valid. The failure domain is owned by the zones using it and
 * deleted together with the last of them.
 */
public class VSphereDeploymentZoneReconciler implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(VSphereDeploymentZoneReconciler.class);

    private final KubernetesClient client;
    private final CredentialsProvider credentialsProvider;
    private final SessionProvider sessionProvider;
    private final PlacementVerifier placementVerifier;
    private final FailureDomainVerifier failureDomainVerifier;
    private final Duration requeueInterval;

    /**
     * Constructs the reconciler
     *
     * @param client                Kubernetes client
     * @param credentialsProvider   Resolves the vCenter credentials
     * @param sessionProvider       vCenter sessions
     * @param requeueInterval       Delay before a zone is checked again
     */
    public VSphereDeploymentZoneReconciler(KubernetesClient client, CredentialsProvider credentialsProvider, SessionProvider sessionProvider,
                                           Duration requeueInterval) {
        this.client = client;
        this.credentialsProvider = credentialsProvider;
        this.sessionProvider = sessionProvider;
        this.placementVerifier = new PlacementVerifier();
        this.failureDomainVerifier = new FailureDomainVerifier();
        this.requeueInterval = requeueInterval;
    }

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        VSphereDeploymentZone zone = Crds.deploymentZoneOperation(client).inNamespace(reconciliation.namespace()).withName(reconciliation.name()).get();

        if (zone == null) {
            LOGGER.debugCr(reconciliation, "VSphereDeploymentZone no longer exists");
            return ReconcileResult.done();
        } else if (zone.getSpec() == null) {
            LOGGER.warnCr(reconciliation, "VSphereDeploymentZone has no spec and will be ignored");
            return ReconcileResult.done();
        }

        if (zone.getStatus() == null) {
            zone.setStatus(new VSphereDeploymentZoneStatus());
        }

        ResourcePatcher<VSphereDeploymentZoneStatus, VSphereDeploymentZone> patcher = new ResourcePatcher<>(reconciliation, Crds.deploymentZoneOperation(client), zone);

        return patcher.reconcile(() -> {
            if (Finalizers.isDeleting(zone)) {
                return reconcileDelete(reconciliation, zone);
            } else {
                return reconcileNormal(reconciliation, zone);
            }
        });
    }

    private ReconcileResult reconcileNormal(Reconciliation reconciliation, VSphereDeploymentZone zone) {
        VSphereDeploymentZoneStatus status = zone.getStatus();
        String namespace = zone.getMetadata().getNamespace();

        Finalizers.add(zone, Constants.DEPLOYMENT_ZONE_FINALIZER);

        VSphereFailureDomain failureDomain = failureDomain(namespace, zone.getSpec().getFailureDomain());
        if (failureDomain == null || failureDomain.getSpec() == null) {
            status.setReady(false);
            Conditions.markFalse(status, ConditionTypes.FAILURE_DOMAIN_VALIDATED, ConditionReasons.FAILURE_DOMAIN_NOT_FOUND, Condition.SEVERITY_ERROR,
                    "Failure domain %s not found", zone.getSpec().getFailureDomain());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        if (OwnerReferences.add(failureDomain, OwnerReferences.of(zone, false))) {
            LOGGER.debugCr(reconciliation, "Adding owner reference to VSphereFailureDomain {}", failureDomain.getMetadata().getName());
            Crds.failureDomainOperation(client).inNamespace(namespace).resource(failureDomain).update();
        }

        String datacenter = failureDomain.getSpec().getTopology() != null ? failureDomain.getSpec().getTopology().getDatacenter() : null;
        Session session;
        try {
            Credentials credentials = credentialsProvider.forServer(namespace, zone.getSpec().getServer());
            session = sessionProvider.getOrCreate(zone.getSpec().getServer(), datacenter, credentials);
        } catch (RuntimeException e) {
            status.setReady(false);
            Conditions.markFalse(status, ConditionTypes.VCENTER_AVAILABLE, ConditionReasons.VCENTER_UNREACHABLE, Condition.SEVERITY_ERROR, "%s", e.getMessage());
            throw e;
        }

        Conditions.markTrue(status, ConditionTypes.VCENTER_AVAILABLE);

        Verification placement = placementVerifier.verify(session, zone.getSpec().getPlacementConstraint(), failureDomain.getSpec().getTopology());
        record(status, ConditionTypes.PLACEMENT_CONSTRAINT_MET, placement);

        Verification domain = failureDomainVerifier.verify(session, failureDomain.getSpec());
        record(status, ConditionTypes.FAILURE_DOMAIN_VALIDATED, domain);

        boolean ready = placement.isPassed() && domain.isPassed();
        status.setReady(ready);

        if (!ready) {
            LOGGER.infoCr(reconciliation, "Deployment zone is not valid: {}", !placement.isPassed() ? placement.message() : domain.message());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        return ReconcileResult.done();
    }

    private static void record(VSphereDeploymentZoneStatus status, String type, Verification verification) {
        if (verification.isPassed()) {
            Conditions.markTrue(status, type);
        } else {
            Conditions.markFalse(status, type, verification.reason(), Condition.SEVERITY_ERROR, "%s", verification.message());
        }
    }

    private ReconcileResult reconcileDelete(Reconciliation reconciliation, VSphereDeploymentZone zone) {
        if (!Finalizers.has(zone, Constants.DEPLOYMENT_ZONE_FINALIZER)) {
            return ReconcileResult.done();
        }

        String namespace = zone.getMetadata().getNamespace();
        List<String> inUse = machinesInZone(namespace, zone.getMetadata().getName());

        if (!inUse.isEmpty()) {
            LOGGER.infoCr(reconciliation, "Deployment zone is still used by Machines {}", inUse);
            Conditions.markFalse(zone.getStatus(), ConditionTypes.READY, ConditionReasons.DELETING, Condition.SEVERITY_INFO,
                    "Deployment zone is used by %d Machines", inUse.size());
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        VSphereFailureDomain failureDomain = failureDomain(namespace, zone.getSpec().getFailureDomain());
        if (failureDomain != null) {
            OwnerReferences.remove(failureDomain, zone.getMetadata().getUid());

            try {
                if (failureDomain.getMetadata().getOwnerReferences() == null || failureDomain.getMetadata().getOwnerReferences().isEmpty()) {
                    LOGGER.infoCr(reconciliation, "Deleting VSphereFailureDomain {} which is no longer used", failureDomain.getMetadata().getName());
                    Crds.failureDomainOperation(client).inNamespace(namespace).withName(failureDomain.getMetadata().getName()).delete();
                } else {
                    Crds.failureDomainOperation(client).inNamespace(namespace).resource(failureDomain).update();
                }
            } catch (KubernetesClientException e) {
                if (!KubernetesResources.isNotFound(e)) {
                    throw e;
                }
            }
        }

        LOGGER.infoCr(reconciliation, "Deployment zone released, removing the finalizer");
        Finalizers.remove(zone, Constants.DEPLOYMENT_ZONE_FINALIZER);
        return ReconcileResult.done();
    }

    private List<String> machinesInZone(String namespace, String zoneName) {
        return Crds.machineOperation(client).inNamespace(namespace).list().getItems().stream()
                .filter(machine -> !Finalizers.isDeleting(machine))
                .filter(machine -> machine.getSpec() != null && zoneName.equals(machine.getSpec().getFailureDomain()))
                .map(machine -> machine.getMetadata().getName())
                .collect(Collectors.toList());
    }

    private VSphereFailureDomain failureDomain(String namespace, String name) {
        if (name == null) {
            return null;
        }

        return Crds.failureDomainOperation(client).inNamespace(namespace).withName(name).get();
    }
}
