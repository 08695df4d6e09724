/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.http;

import io.capv.operator.common.MetricsProvider;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.util.Callback;

import java.nio.charset.StandardCharsets;

/**
 * Embedded Jetty serving the probes on /healthy and /ready and the Prometheus scrape on /metrics
 */
public class HealthCheckAndMetricsServer {
    private static final Logger LOGGER = LogManager.getLogger(HealthCheckAndMetricsServer.class);

    public static final int DEFAULT_PORT = 8081;

    private static final String JSON = "application/json; charset=UTF-8";
    private static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=UTF-8";

    private final Server server;
    private final HealthCheck health;
    private final PrometheusMeterRegistry prometheus;

    /**
     * @param port              Listening port
     * @param health            Probes of the operator
     * @param metricsProvider   Metrics. The scrape endpoint answers 501 unless they are backed by a Prometheus registry.
     */
    public HealthCheckAndMetricsServer(int port, HealthCheck health, MetricsProvider metricsProvider) {
        this.health = health;
        this.prometheus = metricsProvider != null && metricsProvider.meterRegistry() instanceof PrometheusMeterRegistry registry ? registry : null;
        this.server = new Server(port);
        this.server.setHandler(new Router());
    }

    public void start() {
        try {
            server.start();
            LOGGER.info("Health and metrics server listening on port {}", server.getURI().getPort());
        } catch (Exception e) {
            throw new RuntimeException("Failed to start the health and metrics server", e);
        }
    }

    public void stop() {
        try {
            server.stop();
        } catch (Exception e) {
            throw new RuntimeException("Failed to stop the health and metrics server", e);
        }
    }

    private class Router extends Handler.Abstract {
        @Override
        public boolean handle(Request request, Response response, Callback callback) {
            String path = Request.getPathInContext(request);

            switch (path) {
                case "/healthy" -> probe(response, callback, health.isAlive());
                case "/ready" -> probe(response, callback, health.isReady());
                case "/metrics" -> scrape(response, callback);
                default -> {
                    return false;
                }
            }

            LOGGER.debug("{} {} -> {}", request.getMethod(), path, response.getStatus());
            return true;
        }

        private void probe(Response response, Callback callback, boolean passed) {
            response.getHeaders().put(HttpHeader.CONTENT_TYPE, JSON);
            response.setStatus(passed ? HttpStatus.OK_200 : HttpStatus.INTERNAL_SERVER_ERROR_500);
            String body = passed ? "{\"status\": \"ok\"}" : "{\"status\": \"not-ok\"}";
            response.write(true, StandardCharsets.UTF_8.encode(body), callback);
        }

        private void scrape(Response response, Callback callback) {
            if (prometheus == null) {
                response.setStatus(HttpStatus.NOT_IMPLEMENTED_501);
                response.write(true, StandardCharsets.UTF_8.encode("Prometheus metrics are not enabled"), callback);
            } else {
                response.getHeaders().put(HttpHeader.CONTENT_TYPE, PROMETHEUS_TEXT);
                response.setStatus(HttpStatus.OK_200);
                response.write(true, StandardCharsets.UTF_8.encode(prometheus.scrape()), callback);
            }
        }
    }
}
