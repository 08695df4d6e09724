/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer.appliance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * HTTP client for the dataplane API of the load balancer appliance. All calls use basic authentication and JSON
 * bodies.
 */
public class DataplaneApplianceClient implements ApplianceClient {
    private static final Logger LOGGER = LogManager.getLogger(DataplaneApplianceClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String API_PREFIX = "api/v1/";

    private final HttpClient httpClient;
    private final URI baseUri;
    private final String authorization;
    private final Duration timeout;

    /**
     * Constructs the client
     *
     * @param baseUri   Base URI of the appliance
     * @param username  Username
     * @param password  Password
     * @param timeout   Timeout of the connection and of each request
     */
    public DataplaneApplianceClient(URI baseUri, String username, String password, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUri, username, password, timeout);
    }

    /* test */ DataplaneApplianceClient(HttpClient httpClient, URI baseUri, String username, String password, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUri = baseUri.toString().endsWith("/") ? baseUri : URI.create(baseUri + "/");
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.timeout = timeout;
    }

    @Override
    public String startTransaction() {
        JsonNode response = send("POST", "transactions", null);
        return response.path("id").asText();
    }

    @Override
    public ApplianceConfiguration getConfiguration(String transactionId) {
        JsonNode response = send("GET", "transactions/" + encode(transactionId) + "/configuration", null);

        try {
            return MAPPER.treeToValue(response, ApplianceConfiguration.class);
        } catch (JsonProcessingException e) {
            throw new ApplianceException("Failed to parse the appliance configuration", e);
        }
    }

    @Override
    public void postConfiguration(String transactionId, ApplianceConfiguration configuration, long expectedVersion) {
        send("PUT", "transactions/" + encode(transactionId) + "/configuration?version=" + expectedVersion, configuration);
    }

    @Override
    public void commit(String transactionId) {
        send("POST", "transactions/" + encode(transactionId) + "/commit", null);
    }

    @Override
    public String allocateOrReleaseIp(String pool, String ip, IpAction action) {
        if (action == IpAction.ALLOCATE) {
            JsonNode response = send("POST", "ip-pools/" + encode(pool) + "/allocations", null);
            String allocated = response.path("ip").asText(null);

            if (allocated == null || allocated.isEmpty()) {
                throw new ApplianceException("IP pool " + pool + " returned no address", -1);
            }

            LOGGER.debug("Allocated address {} from IP pool {}", allocated, pool);
            return allocated;
        } else {
            send("DELETE", "ip-pools/" + encode(pool) + "/allocations/" + encode(ip), null);
            LOGGER.debug("Released address {} to IP pool {}", ip, pool);
            return ip;
        }
    }

    private JsonNode send(String method, String path, Object body) {
        HttpRequest.BodyPublisher publisher;

        try {
            publisher = body != null
                    ? HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body))
                    : HttpRequest.BodyPublishers.noBody();
        } catch (JsonProcessingException e) {
            throw new ApplianceException("Failed to serialize the request to " + path, e);
        }

        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(API_PREFIX + path))
                .timeout(timeout)
                .header("Authorization", authorization)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApplianceException(method + " " + path + " was interrupted", e);
        } catch (IOException e) {
            throw new ApplianceException(method + " " + path + " failed", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new ApplianceException(method + " " + path + " failed with status code " + response.statusCode()
                    + ": " + response.body(), response.statusCode());
        }

        if (response.body() == null || response.body().isEmpty()) {
            return MAPPER.createObjectNode();
        }

        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ApplianceException("Failed to parse the response of " + method + " " + path, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
