/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

import io.capv.api.Crds;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.vsphere.AllowedNamespaces;
import io.capv.api.model.vsphere.IdentityReference;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterIdentity;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the vCenter credentials. A VSphereCluster can reference a Secret in its own namespace or a
 * VSphereClusterIdentity whose Secret lives in the operator namespace. Everything else uses the credentials from the
 * operator configuration.
 */
public class CredentialsProvider {
    /**
     * Kind of the identity references pointing to Secrets
     */
    public static final String SECRET_KIND = "Secret";

    /**
     * Kind of the identity references pointing to VSphereClusterIdentities
     */
    public static final String CLUSTER_IDENTITY_KIND = VSphereClusterIdentity.RESOURCE_KIND;

    /**
     * Key of the user name in the identity Secret
     */
    public static final String USERNAME_KEY = "username";

    /**
     * Key of the password in the identity Secret
     */
    public static final String PASSWORD_KEY = "password";

    private final KubernetesClient client;
    private final Credentials defaults;
    private final String operatorNamespace;

    /**
     * @param client                Kubernetes client of the management cluster
     * @param defaults              Credentials from the operator configuration
     * @param operatorNamespace     Namespace holding the Secrets of the VSphereClusterIdentities
     */
    public CredentialsProvider(KubernetesClient client, Credentials defaults, String operatorNamespace) {
        this.client = client;
        this.defaults = defaults;
        this.operatorNamespace = operatorNamespace;
    }

    /**
     * @return  Namespace holding the Secrets of the VSphereClusterIdentities
     */
    public String operatorNamespace() {
        return operatorNamespace;
    }

    /**
     * @return  Credentials from the operator configuration
     */
    public Credentials defaults() {
        return defaults;
    }

    /**
     * @param cluster   VSphereCluster
     *
     * @return  True if the cluster references an identity Secret
     */
    public static boolean hasIdentitySecret(VSphereCluster cluster) {
        IdentityReference ref = cluster.getSpec() != null ? cluster.getSpec().getIdentityRef() : null;
        return ref != null && SECRET_KIND.equals(ref.getKind()) && ref.getName() != null;
    }

    /**
     * @param cluster   VSphereCluster
     *
     * @return  The identity Secret of the cluster or null when the cluster has none or the Secret does not exist
     */
    public Secret identitySecret(VSphereCluster cluster) {
        if (!hasIdentitySecret(cluster)) {
            return null;
        }

        return client.secrets()
                .inNamespace(cluster.getMetadata().getNamespace())
                .withName(cluster.getSpec().getIdentityRef().getName())
                .get();
    }

    /**
     * @param cluster   VSphereCluster
     *
     * @return  Credentials from the identity of the cluster or the default credentials when it has no identity
     *
     * @throws IdentityException when the identity cannot be used
     */
    public Credentials forCluster(VSphereCluster cluster) {
        IdentityReference ref = cluster.getSpec() != null ? cluster.getSpec().getIdentityRef() : null;

        if (ref == null) {
            return defaults;
        } else if (CLUSTER_IDENTITY_KIND.equals(ref.getKind())) {
            return fromClusterIdentity(cluster.getMetadata().getNamespace(), ref.getName());
        } else if (!SECRET_KIND.equals(ref.getKind())) {
            throw new IdentityException(ConditionReasons.UNSUPPORTED_IDENTITY_KIND, "Identity of kind " + ref.getKind() + " is not supported");
        }

        Secret secret = identitySecret(cluster);
        if (secret == null) {
            throw new IdentityException(ConditionReasons.SECRET_NOT_FOUND,
                    "Identity Secret " + cluster.getMetadata().getNamespace() + "/" + ref.getName() + " not found");
        }

        return fromSecret(secret);
    }

    private Credentials fromClusterIdentity(String namespace, String name) {
        VSphereClusterIdentity identity = Crds.clusterIdentityOperation(client).withName(name).get();

        if (identity == null || identity.getSpec() == null) {
            throw new IdentityException(ConditionReasons.IDENTITY_NOT_FOUND, "VSphereClusterIdentity " + name + " not found");
        } else if (identity.getStatus() == null || !identity.getStatus().isReady()) {
            throw new IdentityException(ConditionReasons.IDENTITY_NOT_READY, "VSphereClusterIdentity " + name + " is not ready");
        } else if (!isNamespaceAllowed(identity, namespace)) {
            throw new IdentityException(ConditionReasons.NAMESPACE_NOT_ALLOWED,
                    "VSphereClusterIdentity " + name + " cannot be used in namespace " + namespace);
        }

        Secret secret = client.secrets().inNamespace(operatorNamespace).withName(identity.getSpec().getSecretName()).get();
        if (secret == null) {
            throw new IdentityException(ConditionReasons.SECRET_NOT_FOUND,
                    "Secret " + operatorNamespace + "/" + identity.getSpec().getSecretName() + " of VSphereClusterIdentity " + name + " not found");
        }

        return fromSecret(secret);
    }

    /**
     * Checks whether the namespace is selected by the allowed namespaces of the identity. An identity without allowed
     * namespaces cannot be used anywhere, an empty selector allows all namespaces.
     *
     * @param identity      VSphereClusterIdentity
     * @param namespace     Namespace of the VSphereCluster
     *
     * @return  True if the identity can be used in the namespace
     */
    public boolean isNamespaceAllowed(VSphereClusterIdentity identity, String namespace) {
        AllowedNamespaces allowed = identity.getSpec().getAllowedNamespaces();

        if (allowed == null) {
            return false;
        }

        LabelSelector selector = allowed.getSelector();
        if (selector == null
                || (isEmpty(selector.getMatchLabels()) && (selector.getMatchExpressions() == null || selector.getMatchExpressions().isEmpty()))) {
            return true;
        }

        return client.namespaces().withLabelSelector(selector).list().getItems().stream()
                .anyMatch(ns -> namespace.equals(ns.getMetadata().getName()));
    }

    private static boolean isEmpty(Map<String, String> map) {
        return map == null || map.isEmpty();
    }

    /**
     * Credentials for resources which are not bound to one cluster. The identity of the first VSphereCluster in the
     * namespace using the same vCenter wins.
     *
     * @param namespace     Namespace
     * @param server        Address of the vCenter
     *
     * @return  Credentials
     */
    public Credentials forServer(String namespace, String server) {
        for (VSphereCluster cluster : Crds.vsphereClusterOperation(client).inNamespace(namespace).list().getItems()) {
            if (cluster.getSpec() != null
                    && Objects.equals(server, cluster.getSpec().getServer())
                    && cluster.getSpec().getIdentityRef() != null) {
                return forCluster(cluster);
            }
        }

        return defaults;
    }

    /**
     * @param secret    Identity Secret
     *
     * @return  Credentials stored in the Secret
     */
    public static Credentials fromSecret(Secret secret) {
        return new Credentials(value(secret, USERNAME_KEY), value(secret, PASSWORD_KEY));
    }

    private static String value(Secret secret, String key) {
        Map<String, String> data = secret.getData();

        if (data != null && data.get(key) != null) {
            return new String(Base64.getDecoder().decode(data.get(key)), StandardCharsets.UTF_8);
        }

        Map<String, String> stringData = secret.getStringData();
        return stringData != null ? stringData.get(key) : null;
    }
}
