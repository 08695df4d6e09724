/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.CloudConfig;
import io.capv.api.model.vsphere.CloudProviderConfiguration;
import io.capv.api.model.vsphere.ProviderConfig;
import io.capv.api.model.vsphere.StorageConfig;
import io.capv.api.model.vsphere.VSphereCluster;
import io.capv.api.model.vsphere.VSphereClusterSpec;
import io.capv.api.model.vsphere.VirtualCenterConfig;
import io.capv.api.model.vsphere.WorkspaceConfig;
import io.capv.operator.cluster.ClusterOperatorConfig;
import io.capv.operator.cluster.ResourceUtils;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.Reconciliation;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class AddonInstallerTest {
    private static final Reconciliation RECONCILIATION = ResourceUtils.reconciliation(VSphereCluster.RESOURCE_KIND, ResourceUtils.CLUSTER_NAME);
    private static final Credentials CREDENTIALS = new Credentials("admin", "password");
    private static final String KUBE_SYSTEM = "kube-system";

    KubernetesClient client;

    private AddonInstaller installer;

    @BeforeEach
    public void setUp() {
        installer = new AddonInstaller(ClusterOperatorConfig.buildFromMap(Map.of()).addonImages());
    }

    private static VSphereCluster vsphereCluster(CloudConfig cloud, StorageConfig storage) {
        WorkspaceConfig workspace = new WorkspaceConfig();
        workspace.setServer(ResourceUtils.SERVER);
        workspace.setDatacenter("DC0");

        VirtualCenterConfig vc = new VirtualCenterConfig();
        vc.setDatacenters("DC0");

        ProviderConfig providerConfig = new ProviderConfig();
        providerConfig.setCloud(cloud);
        providerConfig.setStorage(storage);

        CloudProviderConfiguration cpc = new CloudProviderConfiguration();
        cpc.setVirtualCenter(Map.of(ResourceUtils.SERVER, vc));
        cpc.setWorkspace(workspace);
        cpc.setProviderConfig(providerConfig);

        VSphereClusterSpec spec = new VSphereClusterSpec();
        spec.setServer(ResourceUtils.SERVER);
        spec.setCloudProviderConfiguration(cpc);

        VSphereCluster cluster = new VSphereCluster();
        cluster.setMetadata(new ObjectMetaBuilder().withName(ResourceUtils.CLUSTER_NAME).withNamespace(ResourceUtils.NAMESPACE).build());
        cluster.setSpec(spec);
        return cluster;
    }

    private static CloudConfig cloud() {
        CloudConfig cloud = new CloudConfig();
        cloud.setExtraArgs(Map.of("v", "4"));
        return cloud;
    }

    @Test
    public void testInstallAll() {
        StorageConfig storage = new StorageConfig();
        storage.setControllerImage("registry.example.com/csi-driver:v2");

        installer.install(RECONCILIATION, client, vsphereCluster(cloud(), storage), CREDENTIALS);

        Secret credentials = client.secrets().inNamespace(KUBE_SYSTEM).withName(CloudConfigBuilder.DEFAULT_SECRET_NAME).get();
        assertThat(credentials, is(notNullValue()));

        ConfigMap cloudConfig = client.configMaps().inNamespace(KUBE_SYSTEM).withName(CloudProviderAddon.CONFIG_MAP_NAME).get();
        assertThat(cloudConfig.getData().get(CloudProviderAddon.CONFIG_FILE), containsString("[VirtualCenter \"" + ResourceUtils.SERVER + "\"]"));
        assertThat(cloudConfig.getData().get(CloudProviderAddon.CONFIG_FILE), containsString("cluster-id = \"capv-test/my-cluster\""));

        DaemonSet ccm = client.apps().daemonSets().inNamespace(KUBE_SYSTEM).withName(CloudProviderAddon.DAEMON_SET_NAME).get();
        assertThat(ccm.getSpec().getTemplate().getSpec().getContainers().get(0).getArgs(), hasItem("--v=4"));

        assertThat(client.apps().daemonSets().inNamespace(KUBE_SYSTEM).withName(StorageProviderAddon.NODE_NAME).get(), is(notNullValue()));
        assertThat(client.apps().deployments().inNamespace(KUBE_SYSTEM).withName(StorageProviderAddon.CONTROLLER_NAME).get()
                .getSpec().getTemplate().getSpec().getContainers().stream().anyMatch(c -> "registry.example.com/csi-driver:v2".equals(c.getImage())), is(true));
        assertThat(client.storage().v1().csiDrivers().withName(StorageProviderAddon.DRIVER_NAME).get(), is(notNullValue()));
        assertThat(client.secrets().inNamespace(KUBE_SYSTEM).withName(StorageProviderAddon.CONFIG_SECRET_NAME).get(), is(notNullValue()));

        // Installing again does not fail on the existing resources
        installer.install(RECONCILIATION, client, vsphereCluster(cloud(), storage), CREDENTIALS);
    }

    @Test
    public void testSectionsWithoutConfigurationAreSkipped() {
        installer.install(RECONCILIATION, client, vsphereCluster(null, null), CREDENTIALS);

        assertThat(client.secrets().inNamespace(KUBE_SYSTEM).withName(CloudConfigBuilder.DEFAULT_SECRET_NAME).get(), is(notNullValue()));
        assertThat(client.apps().daemonSets().inNamespace(KUBE_SYSTEM).withName(CloudProviderAddon.DAEMON_SET_NAME).get(), is(nullValue()));
        assertThat(client.apps().daemonSets().inNamespace(KUBE_SYSTEM).withName(StorageProviderAddon.NODE_NAME).get(), is(nullValue()));
    }

    @Test
    public void testLegacyCsiController() {
        client.apps().statefulSets().inNamespace(KUBE_SYSTEM).resource(new StatefulSetBuilder()
                .withNewMetadata()
                    .withName(StorageProviderAddon.CONTROLLER_NAME)
                    .withNamespace(KUBE_SYSTEM)
                .endMetadata()
                .build()).create();

        installer.install(RECONCILIATION, client, vsphereCluster(null, new StorageConfig()), CREDENTIALS);

        assertThat(client.apps().daemonSets().inNamespace(KUBE_SYSTEM).withName(StorageProviderAddon.NODE_NAME).get(), is(notNullValue()));
        assertThat(client.apps().deployments().inNamespace(KUBE_SYSTEM).withName(StorageProviderAddon.CONTROLLER_NAME).get(), is(nullValue()));
    }

    @Test
    public void testMissingVirtualCenters() {
        VSphereCluster cluster = vsphereCluster(cloud(), null);
        cluster.getSpec().getCloudProviderConfiguration().setVirtualCenter(null);

        assertThrows(IllegalStateException.class, () -> installer.install(RECONCILIATION, client, cluster, CREDENTIALS));
    }

    @Test
    public void testCredentialsSecret() {
        Secret secret = CloudCredentialsAddon.secret(vsphereCluster(null, null), CREDENTIALS);

        assertThat(secret.getMetadata().getNamespace(), is(KUBE_SYSTEM));
        assertThat(secret.getStringData().get(ResourceUtils.SERVER + ".username"), is("admin"));
        assertThat(secret.getStringData().get(ResourceUtils.SERVER + ".password"), is("password"));
    }

    @Test
    public void testCsiConfigContainsTheCredentials() {
        VSphereCluster cluster = vsphereCluster(null, new StorageConfig());
        Secret secret = StorageProviderAddon.configSecret(cluster, cluster.getSpec().getCloudProviderConfiguration(), CREDENTIALS);

        assertThat(secret.getStringData().get(StorageProviderAddon.CONFIG_FILE), containsString("user = \"admin\""));
    }

    @Test
    public void testCloudControllerArgs() {
        assertThat(CloudProviderAddon.args(new CloudConfig()), is(List.of("--v=2", "--cloud-provider=vsphere", "--cloud-config=/etc/cloud/vsphere.conf")));
        assertThat(CloudProviderAddon.args(cloud()), is(List.of("--v=4", "--cloud-provider=vsphere", "--cloud-config=/etc/cloud/vsphere.conf")));
    }
}
