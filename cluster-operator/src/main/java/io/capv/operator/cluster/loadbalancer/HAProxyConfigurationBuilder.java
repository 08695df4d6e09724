/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

/**
 * Generates the haproxy.cfg file of the HAProxy load balancer VMs. The API server traffic is passed through in TCP
 * mode to the backend members and a monitoring endpoint answers the health checks. The file is generated with a
 * PrintWriter using the builder pattern.
 */
public class HAProxyConfigurationBuilder {
    /**
     * Port of the health endpoint of the load balancer
     */
    public static final int HEALTH_PORT = 8081;

    private final StringWriter stringWriter = new StringWriter();
    private final PrintWriter writer = new PrintWriter(stringWriter);

    /**
     * Creates the builder and renders the global settings
     */
    public HAProxyConfigurationBuilder() {
        printHeader();
        configureGlobal();
        configureDefaults();
    }

    private void printHeader() {
        writer.println("##############################");
        writer.println("# Managed by cluster-api-provider-vsphere");
        writer.println("##############################");
        writer.println();
    }

    private void configureGlobal() {
        writer.println("global");
        writer.println("    log                      stdout format raw local0 info");
        writer.println("    chroot                   /var/lib/haproxy");
        writer.println("    stats                    timeout 30s");
        writer.println("    user                     haproxy");
        writer.println("    group                    haproxy");
        writer.println("    maxconn                  4000");
        writer.println();
    }

    private void configureDefaults() {
        writer.println("defaults");
        writer.println("    mode                     http");
        writer.println("    log                      global");
        writer.println("    option                   tcplog");
        writer.println("    option                   dontlognull");
        writer.println("    option                   redispatch");
        writer.println("    retries                  5");
        writer.println("    timeout connect          30s");
        writer.println("    timeout client           1m");
        writer.println("    timeout server           1m");
        writer.println("    timeout tunnel           1h");
        writer.println("    timeout check            30s");
        writer.println("    maxconn                  4000");
        writer.println();
    }

    /**
     * Adds the health check frontend
     *
     * @return  Returns the builder instance
     */
    public HAProxyConfigurationBuilder withHealthEndpoint() {
        writer.println("frontend healthz");
        writer.println("  bind *:" + HEALTH_PORT);
        writer.println("  mode http");
        writer.println("  monitor-uri /healthz");
        writer.println();
        return this;
    }

    /**
     * Adds the API server frontend and backend
     *
     * @param port      Port of the API server on the load balancer and on the members
     * @param members   Backend members
     *
     * @return  Returns the builder instance
     */
    public HAProxyConfigurationBuilder withApiServer(int port, List<LoadBalancerMember> members) {
        writer.println("frontend kube_api_frontend");
        writer.println("  bind *:" + port + " name lb");
        writer.println("  mode tcp");
        writer.println("  option tcplog");
        writer.println("  default_backend kube_api_backend");
        writer.println();

        writer.println("backend kube_api_backend");
        writer.println("  mode tcp");
        writer.println("  balance leastconn");
        writer.println("  default-server inter 10s downinter 10s rise 5 fall 3 slowstart 120s maxconn 1000 maxqueue 256 weight 100");
        writer.println("  option httpchk GET /healthz");
        writer.println("  http-check expect status 200");

        for (LoadBalancerMember member : members) {
            writer.println("  server " + member.name() + " " + member.address() + ":" + port + " check check-ssl verify none");
        }

        writer.println();
        return this;
    }

    /**
     * @return  The generated configuration
     */
    public String build() {
        writer.flush();
        return stringWriter.toString();
    }
}
