/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.identity;

import io.capv.api.Crds;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Constants;
import io.capv.api.model.vsphere.AllowedNamespaces;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.capv.operator.cluster.ResourceUtils;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.controller.ReconcileResult;
import io.capv.operator.common.model.Conditions;
import io.capv.operator.common.resource.Finalizers;
import io.capv.operator.common.resource.OwnerReferences;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.capv.operator.cluster.ResourceUtils.OPERATOR_NAMESPACE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

@EnableKubernetesMockClient(crud = true)
public class VSphereClusterIdentityReconcilerTest {
    private static final Duration REQUEUE = Duration.ofSeconds(10);
    private static final String IDENTITY_NAME = "global";
    private static final String SECRET_NAME = "global-identity";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", VSphereClusterIdentity.RESOURCE_KIND, "", IDENTITY_NAME);

    KubernetesClient client;

    private ResourceUtils resources;
    private VSphereClusterIdentityReconciler reconciler;

    @BeforeEach
    public void setUp() {
        resources = new ResourceUtils(client);
        reconciler = new VSphereClusterIdentityReconciler(client, OPERATOR_NAMESPACE, REQUEUE);
    }

    private VSphereClusterIdentity get() {
        return Crds.clusterIdentityOperation(client).withName(IDENTITY_NAME).get();
    }

    private Secret secret() {
        return client.secrets().inNamespace(OPERATOR_NAMESPACE).withName(SECRET_NAME).get();
    }

    @Test
    public void testMissingIdentityIsIgnored() {
        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));
    }

    @Test
    public void testSecretIsClaimed() {
        resources.operatorSecret(SECRET_NAME, "global-user", "global-password");
        resources.clusterIdentity(IDENTITY_NAME, SECRET_NAME, new AllowedNamespaces(), false);

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));

        VSphereClusterIdentity identity = get();
        assertThat(Finalizers.has(identity, Constants.CLUSTER_IDENTITY_FINALIZER), is(true));
        assertThat(identity.getStatus().isReady(), is(true));
        assertThat(Conditions.isTrue(identity.getStatus(), ConditionTypes.CREDENTIALS_AVAILABLE), is(true));
        assertThat(Conditions.isTrue(identity.getStatus(), ConditionTypes.READY), is(true));

        Secret secret = secret();
        assertThat(OwnerReferences.has(secret, identity), is(true));
        assertThat(secret.getMetadata().getFinalizers(), hasItem(Constants.IDENTITY_SECRET_FINALIZER));
    }

    @Test
    public void testMissingSecret() {
        resources.clusterIdentity(IDENTITY_NAME, SECRET_NAME, new AllowedNamespaces(), false);

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));

        VSphereClusterIdentity identity = get();
        assertThat(identity.getStatus().isReady(), is(false));
        assertThat(Conditions.get(identity.getStatus(), ConditionTypes.CREDENTIALS_AVAILABLE).getReason(), is(ConditionReasons.SECRET_NOT_FOUND));
        assertThat(Conditions.isTrue(identity.getStatus(), ConditionTypes.READY), is(false));
    }

    @Test
    public void testSecretOwnedByAnotherResource() {
        resources.operatorSecret(SECRET_NAME, "global-user", "global-password");
        Secret secret = secret();
        OwnerReferences.add(secret, new OwnerReferenceBuilder()
                .withApiVersion(Constants.INFRASTRUCTURE_API_VERSION)
                .withKind(VSphereCluster.RESOURCE_KIND)
                .withName("other-cluster")
                .withUid("other-uid")
                .build());
        client.secrets().inNamespace(OPERATOR_NAMESPACE).resource(secret).update();

        resources.clusterIdentity(IDENTITY_NAME, SECRET_NAME, new AllowedNamespaces(), true);

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.requeueAfter(REQUEUE)));

        VSphereClusterIdentity identity = get();
        assertThat(identity.getStatus().isReady(), is(false));
        assertThat(Conditions.get(identity.getStatus(), ConditionTypes.CREDENTIALS_AVAILABLE).getReason(), is(ConditionReasons.SECRET_ALREADY_IN_USE));
        assertThat(OwnerReferences.has(secret(), identity), is(false));
        assertThat(OwnerReferences.findByKind(secret(), VSphereCluster.RESOURCE_KIND).getName(), is("other-cluster"));
    }

    @Test
    public void testDeleteRemovesSecret() {
        resources.operatorSecret(SECRET_NAME, "global-user", "global-password");
        resources.clusterIdentity(IDENTITY_NAME, SECRET_NAME, new AllowedNamespaces(), false);
        reconciler.reconcile(RECONCILIATION);
        assertThat(secret(), is(notNullValue()));

        Crds.clusterIdentityOperation(client).withName(IDENTITY_NAME).delete();
        assertThat(get().getMetadata().getDeletionTimestamp(), is(notNullValue()));

        assertThat(reconciler.reconcile(RECONCILIATION), is(ReconcileResult.done()));

        assertThat(secret(), is(nullValue()));
        VSphereClusterIdentity identity = get();
        if (identity != null) {
            assertThat(identity.getMetadata().getFinalizers(), not(hasItem(Constants.CLUSTER_IDENTITY_FINALIZER)));
        }
    }

    @Test
    public void testDeleteKeepsSecretOwnedByAnotherResource() {
        resources.operatorSecret(SECRET_NAME, "global-user", "global-password");
        Secret secret = secret();
        OwnerReferences.add(secret, new OwnerReferenceBuilder()
                .withApiVersion(Constants.INFRASTRUCTURE_API_VERSION)
                .withKind(VSphereCluster.RESOURCE_KIND)
                .withName("other-cluster")
                .withUid("other-uid")
                .build());
        client.secrets().inNamespace(OPERATOR_NAMESPACE).resource(secret).update();

        resources.clusterIdentity(IDENTITY_NAME, SECRET_NAME, new AllowedNamespaces(), false);
        reconciler.reconcile(RECONCILIATION);
        Crds.clusterIdentityOperation(client).withName(IDENTITY_NAME).delete();

        reconciler.reconcile(RECONCILIATION);

        assertThat(secret(), is(notNullValue()));
    }
}
