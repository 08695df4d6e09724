/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.identity;

import io.capv.api.Crds;
import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.capv.api.model.vsphere.VSphereClusterIdentityStatus;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.controller.Reconciler;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.KubernetesResources;
import io.capv.operator.common.resource.OwnerReferences;
import io.capv.operator.common.resource.ResourcePatcher;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.time.Duration;
import java.util.List;

/**
 * Claims the Secret of a VSphereClusterIdentity. The Secret lives in the operator namespace and can be owned by only
 * one identity or cluster. An identity is ready once it owns its Secret. Deleting the identity deletes the Secret.
 */
public class VSphereClusterIdentityReconciler implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(VSphereClusterIdentityReconciler.class);

    private final KubernetesClient client;
    private final String operatorNamespace;
    private final Duration requeueInterval;

    /**
     * Constructs the reconciler
     *
     * @param client                Kubernetes client
     * @param operatorNamespace     Namespace holding the identity Secrets
     * @param requeueInterval       Delay before an identity without a usable Secret is checked again
     */
    public VSphereClusterIdentityReconciler(KubernetesClient client, String operatorNamespace, Duration requeueInterval) {
        this.client = client;
        this.operatorNamespace = operatorNamespace;
        this.requeueInterval = requeueInterval;
    }

    @Override
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        VSphereClusterIdentity identity = Crds.clusterIdentityOperation(client).withName(reconciliation.name()).get();

        if (identity == null) {
            LOGGER.debugCr(reconciliation, "VSphereClusterIdentity no longer exists");
            return ReconcileResult.done();
        } else if (identity.getSpec() == null || identity.getSpec().getSecretName() == null) {
            LOGGER.warnCr(reconciliation, "VSphereClusterIdentity has no Secret and will be ignored");
            return ReconcileResult.done();
        }

        if (identity.getStatus() == null) {
            identity.setStatus(new VSphereClusterIdentityStatus());
        }

        ResourcePatcher<VSphereClusterIdentityStatus, VSphereClusterIdentity> patcher = new ResourcePatcher<>(reconciliation, Crds.clusterIdentityOperation(client), identity);

        return patcher.reconcile(() -> {
            if (Finalizers.isDeleting(identity)) {
                return reconcileDelete(reconciliation, identity);
            } else {
                return reconcileNormal(reconciliation, identity);
            }
        });
    }

    private ReconcileResult reconcileNormal(Reconciliation reconciliation, VSphereClusterIdentity identity) {
        VSphereClusterIdentityStatus status = identity.getStatus();
        String secretName = identity.getSpec().getSecretName();

        Finalizers.add(identity, Constants.CLUSTER_IDENTITY_FINALIZER);

        Secret secret = client.secrets().inNamespace(operatorNamespace).withName(secretName).get();
        if (secret == null) {
            status.setReady(false);
            Conditions.markFalse(status, ConditionTypes.CREDENTIALS_AVAILABLE, ConditionReasons.SECRET_NOT_FOUND, Condition.SEVERITY_WARNING,
                    "Secret %s/%s not found", operatorNamespace, secretName);
            return ReconcileResult.requeueAfter(requeueInterval);
        }

        if (!OwnerReferences.has(secret, identity)) {
            List<OwnerReference> owners = secret.getMetadata().getOwnerReferences();

            if (owners != null && !owners.isEmpty()) {
                LOGGER.warnCr(reconciliation, "Secret {} is already owned by {} {}", secretName, owners.get(0).getKind(), owners.get(0).getName());
                status.setReady(false);
                Conditions.markFalse(status, ConditionTypes.CREDENTIALS_AVAILABLE, ConditionReasons.SECRET_ALREADY_IN_USE, Condition.SEVERITY_ERROR,
                        "Secret %s is already used by %s %s", secretName, owners.get(0).getKind(), owners.get(0).getName());
                return ReconcileResult.requeueAfter(requeueInterval);
            }

            OwnerReferences.add(secret, OwnerReferences.of(identity, false));
            Finalizers.add(secret, Constants.IDENTITY_SECRET_FINALIZER);

            try {
                LOGGER.debugCr(reconciliation, "Claiming Secret {}", secretName);
                client.secrets().inNamespace(operatorNamespace).resource(secret).update();
            } catch (KubernetesClientException e) {
                status.setReady(false);
                Conditions.markFalse(status, ConditionTypes.CREDENTIALS_AVAILABLE, ConditionReasons.SECRET_OWNER_REFERENCE_FAILED, Condition.SEVERITY_WARNING,
                        "%s", e.getMessage());
                throw e;
            }
        }

        status.setReady(true);
        Conditions.markTrue(status, ConditionTypes.CREDENTIALS_AVAILABLE);
        return ReconcileResult.done();
    }

    private ReconcileResult reconcileDelete(Reconciliation reconciliation, VSphereClusterIdentity identity) {
        if (!Finalizers.has(identity, Constants.CLUSTER_IDENTITY_FINALIZER)) {
            return ReconcileResult.done();
        }

        String secretName = identity.getSpec().getSecretName();
        Secret secret = client.secrets().inNamespace(operatorNamespace).withName(secretName).get();

        if (secret != null && OwnerReferences.has(secret, identity)) {
            LOGGER.infoCr(reconciliation, "Deleting Secret {}/{}", operatorNamespace, secretName);

            try {
                if (Finalizers.remove(secret, Constants.IDENTITY_SECRET_FINALIZER)) {
                    client.secrets().inNamespace(operatorNamespace).resource(secret).update();
                }

                client.secrets().inNamespace(operatorNamespace).withName(secretName).delete();
            } catch (KubernetesClientException e) {
                if (!KubernetesResources.isNotFound(e)) {
                    throw e;
                }
            }
        }

        Finalizers.remove(identity, Constants.CLUSTER_IDENTITY_FINALIZER);
        return ReconcileResult.done();
    }
}
