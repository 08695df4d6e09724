/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Host and port of a Kubernetes API server
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class APIEndpoint {
    private String host;
    private int port;

    public APIEndpoint() {
    }

    public APIEndpoint(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    /**
     * @return  True when neither the host nor the port are set
     */
    @JsonIgnore
    public boolean isZero() {
        return (host == null || host.isEmpty()) && port == 0;
    }

    /**
     * @param endpoint  Endpoint which should be checked. Can be null.
     *
     * @return  True when the endpoint is null or zero
     */
    public static boolean isZero(APIEndpoint endpoint) {
        return endpoint == null || endpoint.isZero();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            APIEndpoint that = (APIEndpoint) o;
            return port == that.port && Objects.equals(host, that.host);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
