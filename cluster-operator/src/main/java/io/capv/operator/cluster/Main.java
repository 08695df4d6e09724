/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster;

import io.capv.operator.cluster.cluster.WorkloadClusterClientProvider;
import io.capv.operator.cluster.vsphere.VSphereBackend;
import io.capv.operator.cluster.vsphere.VSphereBackends;
import io.capv.operator.common.MetricsProvider;
import io.capv.operator.common.MicrometerMetricsProvider;
import io.capv.operator.common.OperatorKubernetesClients;
import io.capv.operator.common.http.HealthCheckAndMetricsServer;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The main class of the vSphere cluster operator
 */
@SuppressWarnings("checkstyle:classdataabstractioncoupling")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    private static final String COMPONENT_NAME = "capv-cluster-operator";

    /**
     * Starts the health check and metrics server and the controllers
     *
     * @param args  Startup arguments
     */
    public static void main(String[] args) {
        String version = Main.class.getPackage().getImplementationVersion();
        LOGGER.info("ClusterOperator {} is starting", version);

        ClusterOperatorConfig config = ClusterOperatorConfig.buildFromMap(System.getenv());
        LOGGER.info("ClusterOperator configuration is {}", config);

        VSphereBackend backend = new VSphereBackends().find(config.getVSphereBackend());

        OperatorKubernetesClients clients = new OperatorKubernetesClients(COMPONENT_NAME, version);
        KubernetesClient client = clients.managementCluster();
        WorkloadClusterClientProvider workloadClusters = new WorkloadClusterClientProvider(client, clients::fromKubeconfig);

        MetricsProvider metricsProvider = createMetricsProvider();
        ClusterOperator operator = new ClusterOperator(config, client, backend, workloadClusters, metricsProvider);
        HealthCheckAndMetricsServer healthServer = new HealthCheckAndMetricsServer(config.getHealthPort(), operator, metricsProvider);

        ShutdownHook shutdownHook = new ShutdownHook();
        shutdownHook.register("Kubernetes client", client::close);
        shutdownHook.register("health check and metrics server", healthServer::stop);
        shutdownHook.register("controllers", operator::stop);

        LOGGER.info("Registering shutdown hook");
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook, "shutdown-hook"));

        healthServer.start();
        operator.start();
        LOGGER.info("ClusterOperator is running");
    }

    /**
     * Creates the MetricsProvider instance based on a PrometheusMeterRegistry and binds the JVM metrics to it
     *
     * @return  MetricsProvider instance
     */
    private static MetricsProvider createMetricsProvider()  {
        MeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        return new MicrometerMetricsProvider(registry);
    }
}
