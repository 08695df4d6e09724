/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import io.capv.operator.cluster.cluster.addons.AddonImages;
import io.capv.operator.cluster.vsphere.Credentials;
import io.capv.operator.common.config.ConfigParameter;
import io.capv.operator.common.controller.ControllerConfig;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.capv.operator.common.config.ConfigParameterParser.DURATION;
import static io.capv.operator.common.config.ConfigParameterParser.HTTP_URI;
import static io.capv.operator.common.config.ConfigParameterParser.INTEGER;
import static io.capv.operator.common.config.ConfigParameterParser.LONG;
import static io.capv.operator.common.config.ConfigParameterParser.NAMESPACE;
import static io.capv.operator.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.capv.operator.common.config.ConfigParameterParser.POSITIVE_DURATION;
import static io.capv.operator.common.config.ConfigParameterParser.STRING;
import static io.capv.operator.common.config.ConfigParameterParser.strictlyPositive;

/**
 * Cluster Operator configuration
 */
public class ClusterOperatorConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * Namespace watched by the operator or * for all namespaces
     */
    public static final ConfigParameter<String> WATCHED_NAMESPACE = ConfigParameter.optional("CAPV_NAMESPACE", NAMESPACE, ConfigParameter.ANY_NAMESPACE, CONFIG_VALUES);
    /**
     * Namespace the operator runs in. The Secrets of the VSphereClusterIdentities are read from it.
     */
    public static final ConfigParameter<String> OPERATOR_NAMESPACE = ConfigParameter.optional("CAPV_OPERATOR_NAMESPACE", NAMESPACE, "capv-system", CONFIG_VALUES);
    /**
     * How many milliseconds between two periodic reconciliations of all resources
     */
    public static final ConfigParameter<Long> FULL_RECONCILIATION_INTERVAL_MS = ConfigParameter.optional("CAPV_FULL_RECONCILIATION_INTERVAL_MS", strictlyPositive(LONG), "600000", CONFIG_VALUES);
    /**
     * Size of the work queue of each controller
     */
    public static final ConfigParameter<Integer> WORK_QUEUE_SIZE = ConfigParameter.optional("CAPV_WORK_QUEUE_SIZE", strictlyPositive(INTEGER), "1024", CONFIG_VALUES);
    /**
     * Number of controller loop threads of each controller
     */
    public static final ConfigParameter<Integer> CONTROLLER_THREAD_POOL_SIZE = ConfigParameter.optional("CAPV_CONTROLLER_THREAD_POOL_SIZE", strictlyPositive(INTEGER), "10", CONFIG_VALUES);
    /**
     * Delay before a resource waiting for another resource is reconciled again
     */
    public static final ConfigParameter<Duration> REQUEUE_INTERVAL = ConfigParameter.optional("CAPV_REQUEUE_INTERVAL_MS", POSITIVE_DURATION, "10000", CONFIG_VALUES);
    /**
     * Delay before the service discovery is retried when the workload cluster is not reachable
     */
    public static final ConfigParameter<Duration> SERVICE_DISCOVERY_REQUEUE_INTERVAL = ConfigParameter.optional("CAPV_SERVICE_DISCOVERY_REQUEUE_MS", POSITIVE_DURATION, "120000", CONFIG_VALUES);
    /**
     * Interval of the polls waiting for the workload API servers to come online
     */
    public static final ConfigParameter<Duration> API_SERVER_POLL_INTERVAL = ConfigParameter.optional("CAPV_API_SERVER_POLL_INTERVAL_MS", POSITIVE_DURATION, "1000", CONFIG_VALUES);
    /**
     * Default vCenter user name
     */
    public static final ConfigParameter<String> VSPHERE_USERNAME = ConfigParameter.optional("CAPV_VSPHERE_USERNAME", STRING, null, CONFIG_VALUES);
    /**
     * Default vCenter password
     */
    public static final ConfigParameter<String> VSPHERE_PASSWORD = ConfigParameter.optional("CAPV_VSPHERE_PASSWORD", STRING, null, CONFIG_VALUES);
    /**
     * vCenter used when neither the machine nor the cluster configure one
     */
    public static final ConfigParameter<String> DEFAULT_SERVER = ConfigParameter.optional("CAPV_DEFAULT_SERVER", STRING, null, CONFIG_VALUES);
    /**
     * Name of the virtualization backend. Can be omitted when there is only one on the class path.
     */
    public static final ConfigParameter<String> VSPHERE_BACKEND = ConfigParameter.optional("CAPV_VSPHERE_BACKEND", STRING, null, CONFIG_VALUES);
    /**
     * Port of the health check and metrics server
     */
    public static final ConfigParameter<Integer> HEALTH_PORT = ConfigParameter.optional("CAPV_HEALTH_PORT", strictlyPositive(INTEGER), "8081", CONFIG_VALUES);
    /**
     * URL of the load balancer appliance. NSX-T load balancers are not reconciled without it.
     */
    public static final ConfigParameter<URI> APPLIANCE_URL = ConfigParameter.optional("CAPV_APPLIANCE_URL", HTTP_URI, null, CONFIG_VALUES);
    public static final ConfigParameter<String> APPLIANCE_USERNAME = ConfigParameter.optional("CAPV_APPLIANCE_USERNAME", STRING, null, CONFIG_VALUES);
    public static final ConfigParameter<String> APPLIANCE_PASSWORD = ConfigParameter.optional("CAPV_APPLIANCE_PASSWORD", STRING, null, CONFIG_VALUES);
    /**
     * Timeout of the requests to the load balancer appliance
     */
    public static final ConfigParameter<Duration> APPLIANCE_TIMEOUT = ConfigParameter.optional("CAPV_APPLIANCE_TIMEOUT_MS", DURATION, "10000", CONFIG_VALUES);

    // Add-on images used when the VSphereCluster does not configure its own
    public static final ConfigParameter<String> CLOUD_CONTROLLER_IMAGE = ConfigParameter.optional("CAPV_CPI_IMAGE", NON_EMPTY_STRING, "gcr.io/cloud-provider-vsphere/cpi/release/manager:v1.18.1", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_CONTROLLER_IMAGE = ConfigParameter.optional("CAPV_CSI_CONTROLLER_IMAGE", NON_EMPTY_STRING, "gcr.io/cloud-provider-vsphere/csi/release/driver:v1.0.2", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_NODE_DRIVER_IMAGE = ConfigParameter.optional("CAPV_CSI_NODE_DRIVER_IMAGE", NON_EMPTY_STRING, "gcr.io/cloud-provider-vsphere/csi/release/driver:v1.0.2", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_ATTACHER_IMAGE = ConfigParameter.optional("CAPV_CSI_ATTACHER_IMAGE", NON_EMPTY_STRING, "quay.io/k8scsi/csi-attacher:v1.1.1", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_PROVISIONER_IMAGE = ConfigParameter.optional("CAPV_CSI_PROVISIONER_IMAGE", NON_EMPTY_STRING, "quay.io/k8scsi/csi-provisioner:v1.2.1", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_METADATA_SYNCER_IMAGE = ConfigParameter.optional("CAPV_CSI_SYNCER_IMAGE", NON_EMPTY_STRING, "gcr.io/cloud-provider-vsphere/csi/release/syncer:v1.0.2", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_LIVENESS_PROBE_IMAGE = ConfigParameter.optional("CAPV_CSI_LIVENESS_PROBE_IMAGE", NON_EMPTY_STRING, "quay.io/k8scsi/livenessprobe:v1.1.0", CONFIG_VALUES);
    public static final ConfigParameter<String> CSI_REGISTRAR_IMAGE = ConfigParameter.optional("CAPV_CSI_REGISTRAR_IMAGE", NON_EMPTY_STRING, "quay.io/k8scsi/csi-node-driver-registrar:v1.1.0", CONFIG_VALUES);

    private final Map<String, Object> map;

    private ClusterOperatorConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Creates the configuration from a map with environment variables. Unknown keys are ignored.
     *
     * @param map   Map with the environment variables
     *
     * @return  Cluster Operator configuration
     */
    public static ClusterOperatorConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(ClusterOperatorConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new ClusterOperatorConfig(generatedMap);
    }

    /**
     * @return Set of configuration key/names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     *
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     *
     * @return  Configuration value w.r.t to the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    /**
     * @return  Namespace watched by the operator
     */
    public String getWatchedNamespace() {
        return get(WATCHED_NAMESPACE);
    }

    /**
     * @return  Namespace holding the Secrets of the VSphereClusterIdentities
     */
    public String getOperatorNamespace() {
        return get(OPERATOR_NAMESPACE);
    }

    /**
     * @return  Sizing of the controllers
     */
    public ControllerConfig controllerConfig() {
        return new ControllerConfig(get(WORK_QUEUE_SIZE), get(CONTROLLER_THREAD_POOL_SIZE), get(FULL_RECONCILIATION_INTERVAL_MS));
    }

    public Duration getRequeueInterval() {
        return get(REQUEUE_INTERVAL);
    }

    public Duration getServiceDiscoveryRequeueInterval() {
        return get(SERVICE_DISCOVERY_REQUEUE_INTERVAL);
    }

    public Duration getApiServerPollInterval() {
        return get(API_SERVER_POLL_INTERVAL);
    }

    /**
     * @return  Credentials used when a cluster does not reference its own identity
     */
    public Credentials getDefaultCredentials() {
        return new Credentials(get(VSPHERE_USERNAME), get(VSPHERE_PASSWORD));
    }

    public String getDefaultServer() {
        return get(DEFAULT_SERVER);
    }

    public String getVSphereBackend() {
        return get(VSPHERE_BACKEND);
    }

    public int getHealthPort() {
        return get(HEALTH_PORT);
    }

    /**
     * @return  URL of the load balancer appliance or null when none is configured
     */
    public URI getApplianceUrl() {
        return get(APPLIANCE_URL);
    }

    public String getApplianceUsername() {
        return get(APPLIANCE_USERNAME);
    }

    public String getAppliancePassword() {
        return get(APPLIANCE_PASSWORD);
    }

    public Duration getApplianceTimeout() {
        return get(APPLIANCE_TIMEOUT);
    }

    /**
     * @return  Default images of the add-ons
     */
    public AddonImages addonImages() {
        return new AddonImages(get(CLOUD_CONTROLLER_IMAGE), get(CSI_CONTROLLER_IMAGE), get(CSI_NODE_DRIVER_IMAGE),
                get(CSI_ATTACHER_IMAGE), get(CSI_PROVISIONER_IMAGE), get(CSI_METADATA_SYNCER_IMAGE),
                get(CSI_LIVENESS_PROBE_IMAGE), get(CSI_REGISTRAR_IMAGE));
    }

    @Override
    public String toString() {
        return "ClusterOperatorConfig(" +
                "\n\twatchedNamespace=" + getWatchedNamespace() +
                "\n\toperatorNamespace=" + getOperatorNamespace() +
                "\n\tfullReconciliationIntervalMs=" + get(FULL_RECONCILIATION_INTERVAL_MS) +
                "\n\tworkQueueSize=" + get(WORK_QUEUE_SIZE) +
                "\n\tcontrollerThreadPoolSize=" + get(CONTROLLER_THREAD_POOL_SIZE) +
                "\n\trequeueInterval=" + getRequeueInterval() +
                "\n\tserviceDiscoveryRequeueInterval=" + getServiceDiscoveryRequeueInterval() +
                "\n\tapiServerPollInterval=" + getApiServerPollInterval() +
                "\n\tdefaultCredentials=" + getDefaultCredentials() +
                "\n\tdefaultServer=" + getDefaultServer() +
                "\n\tvSphereBackend=" + getVSphereBackend() +
                "\n\thealthPort=" + getHealthPort() +
                "\n\tapplianceUrl=" + getApplianceUrl() +
                "\n\tapplianceUsername=" + getApplianceUsername() +
                "\n\tapplianceTimeout=" + getApplianceTimeout() +
                "\n\tcloudControllerImage=" + get(CLOUD_CONTROLLER_IMAGE) +
                "\n\tcsiControllerImage=" + get(CSI_CONTROLLER_IMAGE) +
                "\n\tcsiNodeDriverImage=" + get(CSI_NODE_DRIVER_IMAGE) +
                "\n\tcsiAttacherImage=" + get(CSI_ATTACHER_IMAGE) +
                "\n\tcsiProvisionerImage=" + get(CSI_PROVISIONER_IMAGE) +
                "\n\tcsiMetadataSyncerImage=" + get(CSI_METADATA_SYNCER_IMAGE) +
                "\n\tcsiLivenessProbeImage=" + get(CSI_LIVENESS_PROBE_IMAGE) +
                "\n\tcsiRegistrarImage=" + get(CSI_REGISTRAR_IMAGE) +
                ")";
    }
}
