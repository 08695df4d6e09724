/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.CloudConfig;
import io.capv.api.model.vsphere.CloudProviderConfiguration;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.resource.KubernetesResources;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.DaemonSetBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.PolicyRule;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.capv.operator.cluster.cluster.addons.Addons.KUBE_SYSTEM;

/**
 * The vSphere cloud controller manager
 */
public class CloudProviderAddon implements Addon {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(CloudProviderAddon.class);

    /* test */ static final String SERVICE_ACCOUNT_NAME = "cloud-controller-manager";
    /* test */ static final String CONFIG_MAP_NAME = "vsphere-cloud-config";
    /* test */ static final String CONFIG_FILE = "vsphere.conf";
    /* test */ static final String DAEMON_SET_NAME = "vsphere-cloud-controller-manager";
    /* test */ static final String CLUSTER_ROLE_NAME = "system:cloud-controller-manager";
    private static final String APP_LABEL = "k8s-app";
    private static final String CONFIG_VOLUME = "vsphere-config-volume";

    private final AddonImages images;

    /**
     * @param images    Default images of the add-ons
     */
    public CloudProviderAddon(AddonImages images) {
        this.images = images;
    }

    @Override
    public String name() {
        return "cloud-provider";
    }

    @Override
    public void install(Reconciliation reconciliation, KubernetesClient workload, VSphereCluster vsphereCluster, Credentials credentials) {
        CloudProviderConfiguration cpc = Addons.requireVirtualCenters(vsphereCluster);
        CloudConfig cloud = cpc.getProviderConfig() != null ? cpc.getProviderConfig().getCloud() : null;

        if (cloud == null) {
            LOGGER.debugCr(reconciliation, "Cloud provider is not configured, skipping the cloud controller manager");
            return;
        }

        String image = images.withOverrides(cloud, null).cloudController();

        for (HasMetadata resource : resources(vsphereCluster, cpc, image, args(cloud))) {
            KubernetesResources.createIfAbsent(reconciliation, workload, resource);
        }

        LOGGER.infoCr(reconciliation, "Cloud controller manager is installed");
    }

    /* test */ static List<HasMetadata> resources(VSphereCluster vsphereCluster, CloudProviderConfiguration cpc, String image, List<String> args) {
        String cloudConfig = new CloudConfigBuilder()
                .withGlobal(cpc.getGlobal(), Addons.clusterId(vsphereCluster))
                .withVirtualCenters(cpc.getVirtualCenter(), null)
                .withWorkspace(cpc.getWorkspace())
                .withNetwork(cpc.getNetwork())
                .build();

        return List.of(
                serviceAccount(),
                configMap(cloudConfig),
                daemonSet(image, args),
                service(),
                clusterRole(),
                clusterRoleBinding(),
                roleBinding());
    }

    /**
     * Arguments of the cloud controller manager. The extra arguments of the cluster are added as --key=value.
     *
     * @param cloud     Cloud provider configuration
     *
     * @return  Command line arguments
     */
    /* test */ static List<String> args(CloudConfig cloud) {
        Map<String, String> args = new LinkedHashMap<>();
        args.put("v", "2");
        args.put("cloud-provider", "vsphere");
        args.put("cloud-config", "/etc/cloud/" + CONFIG_FILE);

        if (cloud.getExtraArgs() != null) {
            args.putAll(cloud.getExtraArgs());
        }

        List<String> result = new ArrayList<>(args.size());
        args.forEach((key, value) -> result.add("--" + key + "=" + value));
        return result;
    }

    private static ServiceAccount serviceAccount() {
        return new ServiceAccountBuilder()
                .withNewMetadata()
                    .withName(SERVICE_ACCOUNT_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .build();
    }

    private static ConfigMap configMap(String cloudConfig) {
        return new ConfigMapBuilder()
                .withNewMetadata()
                    .withName(CONFIG_MAP_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .addToData(CONFIG_FILE, cloudConfig)
                .build();
    }

    private static DaemonSet daemonSet(String image, List<String> args) {
        return new DaemonSetBuilder()
                .withNewMetadata()
                    .withName(DAEMON_SET_NAME)
                    .withNamespace(KUBE_SYSTEM)
                    .addToLabels(APP_LABEL, DAEMON_SET_NAME)
                .endMetadata()
                .withNewSpec()
                    .withNewSelector()
                        .addToMatchLabels(APP_LABEL, DAEMON_SET_NAME)
                    .endSelector()
                    .withNewUpdateStrategy()
                        .withType("RollingUpdate")
                    .endUpdateStrategy()
                    .withNewTemplate()
                        .withNewMetadata()
                            .addToLabels(APP_LABEL, DAEMON_SET_NAME)
                        .endMetadata()
                        .withNewSpec()
                            .addToNodeSelector("node-role.kubernetes.io/control-plane", "")
                            .withNewSecurityContext()
                                .withRunAsUser(0L)
                            .endSecurityContext()
                            .withTolerations(Addons.controlPlaneTolerations())
                            .withServiceAccountName(SERVICE_ACCOUNT_NAME)
                            .addNewContainer()
                                .withName(DAEMON_SET_NAME)
                                .withImage(image)
                                .withArgs(args)
                                .addNewVolumeMount()
                                    .withName(CONFIG_VOLUME)
                                    .withMountPath("/etc/cloud")
                                    .withReadOnly(true)
                                .endVolumeMount()
                                .withNewResources()
                                    .addToRequests("cpu", new Quantity("200m"))
                                .endResources()
                            .endContainer()
                            .withHostNetwork(true)
                            .addNewVolume()
                                .withName(CONFIG_VOLUME)
                                .withNewConfigMap()
                                    .withName(CONFIG_MAP_NAME)
                                .endConfigMap()
                            .endVolume()
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .build();
    }

    private static Service service() {
        return new ServiceBuilder()
                .withNewMetadata()
                    .withName(SERVICE_ACCOUNT_NAME)
                    .withNamespace(KUBE_SYSTEM)
                    .addToLabels("component", SERVICE_ACCOUNT_NAME)
                .endMetadata()
                .withNewSpec()
                    .withType("NodePort")
                    .addNewPort()
                        .withProtocol("TCP")
                        .withPort(443)
                        .withTargetPort(new IntOrString(43001))
                    .endPort()
                    .addToSelector("component", SERVICE_ACCOUNT_NAME)
                .endSpec()
                .build();
    }

    private static ClusterRole clusterRole() {
        return new ClusterRoleBuilder()
                .withNewMetadata()
                    .withName(CLUSTER_ROLE_NAME)
                .endMetadata()
                .withRules(
                        rule("events", "create", "patch", "update"),
                        rule("nodes", "*"),
                        rule("nodes/status", "patch"),
                        rule("services", "list", "patch", "update", "watch"),
                        rule("serviceaccounts", "create", "get", "list", "watch", "update"),
                        rule("persistentvolumes", "get", "list", "watch", "update"),
                        rule("endpoints", "create", "get", "list", "watch", "update"),
                        rule("secrets", "get", "list", "watch"),
                        new PolicyRuleBuilder()
                                .withApiGroups("coordination.k8s.io")
                                .withResources("leases")
                                .withVerbs("get", "watch", "list", "delete", "update", "create")
                                .build())
                .build();
    }

    private static PolicyRule rule(String resource, String... verbs) {
        return new PolicyRuleBuilder()
                .withApiGroups("")
                .withResources(resource)
                .withVerbs(verbs)
                .build();
    }

    private static ClusterRoleBinding clusterRoleBinding() {
        return new ClusterRoleBindingBuilder()
                .withNewMetadata()
                    .withName(CLUSTER_ROLE_NAME)
                .endMetadata()
                .withNewRoleRef()
                    .withApiGroup("rbac.authorization.k8s.io")
                    .withKind("ClusterRole")
                    .withName(CLUSTER_ROLE_NAME)
                .endRoleRef()
                .addNewSubject()
                    .withKind("ServiceAccount")
                    .withName(SERVICE_ACCOUNT_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endSubject()
                .addNewSubject()
                    .withKind("User")
                    .withName(SERVICE_ACCOUNT_NAME)
                .endSubject()
                .build();
    }

    private static RoleBinding roleBinding() {
        return new RoleBindingBuilder()
                .withNewMetadata()
                    .withName("servicecatalog.k8s.io:apiserver-authentication-reader")
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .withNewRoleRef()
                    .withApiGroup("rbac.authorization.k8s.io")
                    .withKind("Role")
                    .withName("extension-apiserver-authentication-reader")
                .endRoleRef()
                .addNewSubject()
                    .withKind("ServiceAccount")
                    .withName(SERVICE_ACCOUNT_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endSubject()
                .addNewSubject()
                    .withKind("User")
                    .withName(SERVICE_ACCOUNT_NAME)
                .endSubject()
                .build();
    }
}
