/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.CloudProviderConfiguration;
import io.capv.api.model.vsphere.StorageConfig;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.capv.operator.common.resource.KubernetesResources;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.DaemonSetBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.PolicyRule;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.storage.CSIDriver;
import io.fabric8.kubernetes.api.model.storage.CSIDriverBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.ArrayList;
import java.util.List;

import static io.capv.operator.cluster.cluster.addons.Addons.KUBE_SYSTEM;

/**
 * The vSphere CSI driver. The controller Deployment is not created when the cluster still runs the legacy controller
 * StatefulSet.
 */
public class StorageProviderAddon implements Addon {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(StorageProviderAddon.class);

    /* test */ static final String CONTROLLER_NAME = "vsphere-csi-controller";
    /* test */ static final String NODE_NAME = "vsphere-csi-node";
    /* test */ static final String DRIVER_NAME = "csi.vsphere.vmware.com";
    /* test */ static final String CONFIG_SECRET_NAME = "csi-vsphere-config";
    /* test */ static final String CONFIG_FILE = "csi-vsphere.conf";
    private static final String CLUSTER_ROLE_NAME = "vsphere-csi-controller-role";
    private static final String CONFIG_VOLUME = "vsphere-config-volume";
    private static final String SOCKET_DIR = "socket-dir";
    private static final String PLUGIN_DIR = "plugin-dir";

    private final AddonImages images;

    /**
     * @param images    Default images of the add-ons
     */
    public StorageProviderAddon(AddonImages images) {
        this.images = images;
    }

    @Override
    public String name() {
        return "storage-provider";
    }

    @Override
    public void install(Reconciliation reconciliation, KubernetesClient workload, VSphereCluster vsphereCluster, Credentials credentials) {
        CloudProviderConfiguration cpc = Addons.requireVirtualCenters(vsphereCluster);
        StorageConfig storage = cpc.getProviderConfig() != null ? cpc.getProviderConfig().getStorage() : null;

        if (storage == null) {
            LOGGER.debugCr(reconciliation, "Storage is not configured, skipping the CSI driver");
            return;
        }

        AddonImages resolved = images.withOverrides(null, storage);
        boolean legacyController = workload.apps().statefulSets().inNamespace(KUBE_SYSTEM).withName(CONTROLLER_NAME).get() != null;

        for (HasMetadata resource : resources(vsphereCluster, cpc, credentials, resolved, legacyController)) {
            KubernetesResources.createIfAbsent(reconciliation, workload, resource);
        }

        LOGGER.infoCr(reconciliation, "CSI driver is installed");
    }

    /* test */ static List<HasMetadata> resources(VSphereCluster vsphereCluster, CloudProviderConfiguration cpc, Credentials credentials,
                                                 AddonImages images, boolean legacyController) {
        List<HasMetadata> resources = new ArrayList<>();
        resources.add(serviceAccount());
        resources.add(clusterRole());
        resources.add(clusterRoleBinding());
        resources.add(configSecret(vsphereCluster, cpc, credentials));
        resources.add(csiDriver());
        resources.add(nodeDaemonSet(images));

        if (!legacyController) {
            resources.add(controllerDeployment(images));
        }

        return resources;
    }

    private static ServiceAccount serviceAccount() {
        return new ServiceAccountBuilder()
                .withNewMetadata()
                    .withName(CONTROLLER_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .build();
    }

    private static ClusterRole clusterRole() {
        return new ClusterRoleBuilder()
                .withNewMetadata()
                    .withName(CLUSTER_ROLE_NAME)
                .endMetadata()
                .withRules(
                        rule("storage.k8s.io", List.of("csidrivers"), "create", "delete"),
                        rule("", List.of("nodes", "pods", "secrets"), "get", "list", "watch"),
                        rule("", List.of("persistentvolumes"), "get", "list", "watch", "update", "create", "delete", "patch"),
                        rule("storage.k8s.io", List.of("volumeattachments"), "get", "list", "watch", "update", "patch"),
                        rule("", List.of("persistentvolumeclaims"), "get", "list", "watch", "update"),
                        rule("storage.k8s.io", List.of("storageclasses", "csinodes"), "get", "list", "watch"),
                        rule("", List.of("events"), "list", "watch", "create", "update", "patch"),
                        rule("coordination.k8s.io", List.of("leases"), "get", "watch", "list", "delete", "update", "create"),
                        rule("snapshot.storage.k8s.io", List.of("volumesnapshots", "volumesnapshotcontents"), "get", "list"))
                .build();
    }

    private static PolicyRule rule(String apiGroup, List<String> resources, String... verbs) {
        return new PolicyRuleBuilder()
                .withApiGroups(apiGroup)
                .withResources(resources)
                .withVerbs(verbs)
                .build();
    }

    private static ClusterRoleBinding clusterRoleBinding() {
        return new ClusterRoleBindingBuilder()
                .withNewMetadata()
                    .withName("vsphere-csi-controller-binding")
                .endMetadata()
                .withNewRoleRef()
                    .withApiGroup("rbac.authorization.k8s.io")
                    .withKind("ClusterRole")
                    .withName(CLUSTER_ROLE_NAME)
                .endRoleRef()
                .addNewSubject()
                    .withKind("ServiceAccount")
                    .withName(CONTROLLER_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endSubject()
                .build();
    }

    /* test */ static Secret configSecret(VSphereCluster vsphereCluster, CloudProviderConfiguration cpc, Credentials credentials) {
        String config = new CloudConfigBuilder()
                .withGlobal(cpc.getGlobal(), Addons.clusterId(vsphereCluster))
                .withVirtualCenters(cpc.getVirtualCenter(), credentials)
                .withNetwork(cpc.getNetwork())
                .build();

        return new SecretBuilder()
                .withNewMetadata()
                    .withName(CONFIG_SECRET_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .withType("Opaque")
                .addToStringData(CONFIG_FILE, config)
                .build();
    }

    private static CSIDriver csiDriver() {
        return new CSIDriverBuilder()
                .withNewMetadata()
                    .withName(DRIVER_NAME)
                .endMetadata()
                .withNewSpec()
                    .withAttachRequired(true)
                    .withPodInfoOnMount(false)
                .endSpec()
                .build();
    }

    private static DaemonSet nodeDaemonSet(AddonImages images) {
        return new DaemonSetBuilder()
                .withNewMetadata()
                    .withName(NODE_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .withNewSpec()
                    .withNewSelector()
                        .addToMatchLabels("app", NODE_NAME)
                    .endSelector()
                    .withNewUpdateStrategy()
                        .withType("RollingUpdate")
                    .endUpdateStrategy()
                    .withNewTemplate()
                        .withNewMetadata()
                            .addToLabels("app", NODE_NAME)
                            .addToLabels("role", "vsphere-csi")
                        .endMetadata()
                        .withNewSpec()
                            .withDnsPolicy("Default")
                            .withContainers(
                                    new ContainerBuilder()
                                            .withName("node-driver-registrar")
                                            .withImage(images.csiRegistrar())
                                            .withArgs("--v=5", "--csi-address=$(ADDRESS)", "--kubelet-registration-path=$(DRIVER_REG_SOCK_PATH)")
                                            .withEnv(env("ADDRESS", "/csi/csi.sock"),
                                                    env("DRIVER_REG_SOCK_PATH", "/var/lib/kubelet/plugins_registry/" + DRIVER_NAME + "/csi.sock"))
                                            .withVolumeMounts(mount(PLUGIN_DIR, "/csi"), mount("registration-dir", "/registration"))
                                            .build(),
                                    driverContainer(NODE_NAME, images.csiNodeDriver(), "node", true),
                                    livenessProbe(images.csiLivenessProbe(), PLUGIN_DIR, "/csi"))
                            .withVolumes(
                                    secretVolume(),
                                    hostPathVolume("registration-dir", "/var/lib/kubelet/plugins_registry"),
                                    hostPathVolume(PLUGIN_DIR, "/var/lib/kubelet/plugins_registry/" + DRIVER_NAME),
                                    hostPathVolume("pods-mount-dir", "/var/lib/kubelet"),
                                    hostPathVolume("device-dir", "/dev"))
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .build();
    }

    private static Deployment controllerDeployment(AddonImages images) {
        return new DeploymentBuilder()
                .withNewMetadata()
                    .withName(CONTROLLER_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .withNewSpec()
                    .withReplicas(1)
                    .withNewStrategy()
                        .withType("RollingUpdate")
                    .endStrategy()
                    .withNewSelector()
                        .addToMatchLabels("app", CONTROLLER_NAME)
                    .endSelector()
                    .withNewTemplate()
                        .withNewMetadata()
                            .addToLabels("app", CONTROLLER_NAME)
                            .addToLabels("role", "vsphere-csi")
                        .endMetadata()
                        .withNewSpec()
                            .withServiceAccountName(CONTROLLER_NAME)
                            .addToNodeSelector("node-role.kubernetes.io/control-plane", "")
                            .withTolerations(Addons.controlPlaneTolerations())
                            .withDnsPolicy("Default")
                            .withContainers(
                                    new ContainerBuilder()
                                            .withName("csi-attacher")
                                            .withImage(images.csiAttacher())
                                            .withArgs("--v=4", "--timeout=60s", "--csi-address=$(ADDRESS)")
                                            .withEnv(env("ADDRESS", "/csi/csi.sock"))
                                            .withVolumeMounts(mount(SOCKET_DIR, "/csi"))
                                            .build(),
                                    driverContainer(CONTROLLER_NAME, images.csiController(), "controller", false),
                                    livenessProbe(images.csiLivenessProbe(), SOCKET_DIR, "/var/lib/csi/sockets/pluginproxy/"),
                                    new ContainerBuilder()
                                            .withName("vsphere-syncer")
                                            .withImage(images.csiMetadataSyncer())
                                            .withArgs("--v=4")
                                            .withEnv(env("X_CSI_FULL_SYNC_INTERVAL_MINUTES", "30"),
                                                    env("VSPHERE_CSI_CONFIG", "/etc/cloud/" + CONFIG_FILE))
                                            .withVolumeMounts(readOnlyMount(CONFIG_VOLUME, "/etc/cloud"))
                                            .build(),
                                    new ContainerBuilder()
                                            .withName("csi-provisioner")
                                            .withImage(images.csiProvisioner())
                                            .withArgs("--v=4", "--timeout=60s", "--csi-address=$(ADDRESS)", "--feature-gates=Topology=true", "--strict-topology")
                                            .withEnv(env("ADDRESS", "/csi/csi.sock"))
                                            .withVolumeMounts(mount(SOCKET_DIR, "/csi"))
                                            .build())
                            .withVolumes(
                                    secretVolume(),
                                    hostPathVolume(SOCKET_DIR, "/var/lib/csi/sockets/pluginproxy/" + DRIVER_NAME))
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .build();
    }

    private static Container driverContainer(String name, String image, String mode, boolean node) {
        List<EnvVar> env = new ArrayList<>(List.of(
                env("CSI_ENDPOINT", node ? "unix:///csi/csi.sock" : "unix:///var/lib/csi/sockets/pluginproxy/csi.sock"),
                env("X_CSI_MODE", mode),
                env("VSPHERE_CSI_CONFIG", "/etc/cloud/" + CONFIG_FILE),
                env("LOGGER_LEVEL", "PRODUCTION"),
                env("X_CSI_LOG_LEVEL", "INFO")));

        if (node) {
            env.add(new EnvVarBuilder()
                    .withName("NODE_NAME")
                    .withNewValueFrom()
                        .withNewFieldRef()
                            .withFieldPath("spec.nodeName")
                        .endFieldRef()
                    .endValueFrom()
                    .build());
        }

        List<VolumeMount> mounts = new ArrayList<>();
        mounts.add(readOnlyMount(CONFIG_VOLUME, "/etc/cloud"));
        if (node) {
            mounts.add(mount(PLUGIN_DIR, "/csi"));
            mounts.add(new VolumeMountBuilder().withName("pods-mount-dir").withMountPath("/var/lib/kubelet").withMountPropagation("Bidirectional").build());
            mounts.add(mount("device-dir", "/dev"));
        } else {
            mounts.add(mount(SOCKET_DIR, "/var/lib/csi/sockets/pluginproxy/"));
        }

        ContainerBuilder builder = new ContainerBuilder()
                .withName(name)
                .withImage(image)
                .withEnv(env)
                .withVolumeMounts(mounts)
                .addNewPort()
                    .withName("healthz")
                    .withContainerPort(9808)
                    .withProtocol("TCP")
                .endPort()
                .withNewLivenessProbe()
                    .withNewHttpGet()
                        .withPath("/healthz")
                        .withPort(new IntOrString("healthz"))
                    .endHttpGet()
                    .withInitialDelaySeconds(10)
                    .withTimeoutSeconds(3)
                    .withPeriodSeconds(5)
                    .withFailureThreshold(3)
                .endLivenessProbe();

        if (node) {
            builder.withNewSecurityContext()
                        .withPrivileged(true)
                        .withNewCapabilities()
                            .withAdd("SYS_ADMIN")
                        .endCapabilities()
                        .withAllowPrivilegeEscalation(true)
                    .endSecurityContext();
        }

        return builder.build();
    }

    private static Container livenessProbe(String image, String volume, String mountPath) {
        return new ContainerBuilder()
                .withName("liveness-probe")
                .withImage(image)
                .withArgs("--csi-address=$(ADDRESS)")
                .withEnv(env("ADDRESS", mountPath.endsWith("/") ? mountPath + "csi.sock" : mountPath + "/csi.sock"))
                .withVolumeMounts(mount(volume, mountPath))
                .build();
    }

    private static EnvVar env(String name, String value) {
        return new EnvVarBuilder().withName(name).withValue(value).build();
    }

    private static VolumeMount mount(String name, String path) {
        return new VolumeMountBuilder().withName(name).withMountPath(path).build();
    }

    private static VolumeMount readOnlyMount(String name, String path) {
        return new VolumeMountBuilder().withName(name).withMountPath(path).withReadOnly(true).build();
    }

    private static Volume secretVolume() {
        return new VolumeBuilder()
                .withName(CONFIG_VOLUME)
                .withNewSecret()
                    .withSecretName(CONFIG_SECRET_NAME)
                .endSecret()
                .build();
    }

    private static Volume hostPathVolume(String name, String path) {
        return new VolumeBuilder()
                .withName(name)
                .withNewHostPath()
                    .withPath(path)
                .endHostPath()
                .build();
    }
}
