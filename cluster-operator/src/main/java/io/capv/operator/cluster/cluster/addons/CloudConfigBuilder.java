/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.cluster.addons;

import io.capv.api.model.vsphere.GlobalConfig;
import io.capv.api.model.vsphere.NetworkConfig;
import io.capv.api.model.vsphere.VirtualCenterConfig;
import io.capv.api.model.vsphere.WorkspaceConfig;
import io.capv.operator.cluster.vsphere.Credentials;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generates the INI cloud configuration read by the cloud controller manager and by the CSI driver. All values are
 * quoted. Sections without any value are left out.
 */
public class CloudConfigBuilder {
    /**
     * Default name of the Secret with the vCenter credentials in the workload cluster
     */
    public static final String DEFAULT_SECRET_NAME = "cloud-provider-vsphere-credentials";

    /**
     * Default namespace of the Secret with the vCenter credentials in the workload cluster
     */
    public static final String DEFAULT_SECRET_NAMESPACE = "kube-system";

    private final StringWriter stringWriter = new StringWriter();
    private final PrintWriter writer = new PrintWriter(stringWriter);

    /**
     * Renders the Global section
     *
     * @param global        Global configuration or null
     * @param clusterId     ID of the cluster
     *
     * @return  Returns the builder instance
     */
    public CloudConfigBuilder withGlobal(GlobalConfig global, String clusterId) {
        writer.println("[Global]");
        printValue("secret-name", global != null && !isEmpty(global.getSecretName()) ? global.getSecretName() : DEFAULT_SECRET_NAME);
        printValue("secret-namespace", global != null && !isEmpty(global.getSecretNamespace()) ? global.getSecretNamespace() : DEFAULT_SECRET_NAMESPACE);

        if (global != null) {
            if (global.isInsecure()) {
                printValue("insecure-flag", "1");
            }
            printValue("port", global.getPort());
            printValue("datacenters", global.getDatacenters());
        }

        printValue("cluster-id", clusterId);
        writer.println();
        return this;
    }

    /**
     * Renders one section per virtual center, ordered by the server name
     *
     * @param virtualCenters    Virtual centers by server
     * @param credentials       Credentials rendered into each section or null to leave them out
     *
     * @return  Returns the builder instance
     */
    public CloudConfigBuilder withVirtualCenters(Map<String, VirtualCenterConfig> virtualCenters, Credentials credentials) {
        for (Map.Entry<String, VirtualCenterConfig> vc : new TreeMap<>(virtualCenters).entrySet()) {
            writer.println("[VirtualCenter " + quote(vc.getKey()) + "]");

            if (vc.getValue() != null) {
                printValue("datacenters", vc.getValue().getDatacenters());
                printValue("port", vc.getValue().getPort());
            }

            if (credentials != null) {
                printValue("user", credentials.username());
                printValue("password", credentials.password());
            }

            writer.println();
        }

        return this;
    }

    /**
     * @param workspace     Workspace configuration or null
     *
     * @return  Returns the builder instance
     */
    public CloudConfigBuilder withWorkspace(WorkspaceConfig workspace) {
        if (workspace != null) {
            writer.println("[Workspace]");
            printValue("server", workspace.getServer());
            printValue("datacenter", workspace.getDatacenter());
            printValue("folder", workspace.getFolder());
            printValue("default-datastore", workspace.getDatastore());
            printValue("resourcepool-path", workspace.getResourcePool());
            writer.println();
        }

        return this;
    }

    /**
     * @param network   Network configuration or null
     *
     * @return  Returns the builder instance
     */
    public CloudConfigBuilder withNetwork(NetworkConfig network) {
        if (network != null && !isEmpty(network.getName())) {
            writer.println("[Network]");
            printValue("public-network", network.getName());
            writer.println();
        }

        return this;
    }

    private void printValue(String key, String value) {
        if (!isEmpty(value)) {
            writer.println(key + " = " + quote(value));
        }
    }

    /* test */ static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * @return  The generated configuration
     */
    public String build() {
        writer.flush();
        return stringWriter.toString();
    }
}
