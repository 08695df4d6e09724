/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer.appliance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DataplaneApplianceClientTest {
    private HttpClient httpClient;
    private HttpResponse<String> response;
    private DataplaneApplianceClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        when(httpClient.<String>send(any(), any())).thenReturn(response);

        client = new DataplaneApplianceClient(httpClient, URI.create("https://appliance.example.com:5556"), "admin", "secret", Duration.ofSeconds(5));
    }

    private void respond(int statusCode, String body) {
        when(response.statusCode()).thenReturn(statusCode);
        when(response.body()).thenReturn(body);
    }

    @SuppressWarnings("unchecked")
    private HttpRequest lastRequest() throws Exception {
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any(HttpResponse.BodyHandler.class));
        return request.getValue();
    }

    @Test
    public void testStartTransaction() throws Exception {
        respond(201, "{\"id\":\"tx-42\",\"status\":\"in_progress\"}");

        assertThat(client.startTransaction(), is("tx-42"));

        HttpRequest request = lastRequest();
        assertThat(request.method(), is("POST"));
        assertThat(request.uri(), is(URI.create("https://appliance.example.com:5556/api/v1/transactions")));
        assertThat(request.headers().firstValue("Authorization").orElse(null),
                is("Basic " + Base64.getEncoder().encodeToString("admin:secret".getBytes(StandardCharsets.UTF_8))));
        assertThat(request.timeout().orElse(null), is(Duration.ofSeconds(5)));
    }

    @Test
    public void testGetConfiguration() throws Exception {
        respond(200, "{\"version\":12,\"virtualServers\":[{\"name\":\"ns-lb-6443\",\"ipAddress\":\"10.0.0.100\",\"port\":6443,\"poolName\":\"ns-lb-pool\",\"extra\":true}],"
                + "\"pools\":[{\"name\":\"ns-lb-pool\",\"algorithm\":\"ROUND_ROBIN\",\"minActiveMembers\":1,\"members\":[{\"name\":\"cp-0\",\"ipAddress\":\"10.0.0.10\",\"port\":6443}]}]}");

        ApplianceConfiguration configuration = client.getConfiguration("tx-42");

        assertThat(configuration.version(), is(12L));
        assertThat(configuration.virtualServer("ns-lb-6443").ipAddress(), is("10.0.0.100"));
        assertThat(configuration.pool("ns-lb-pool").members(), is(List.of(new ApplianceConfiguration.PoolMember("cp-0", "10.0.0.10", 6443))));
        assertThat(lastRequest().uri().getPath(), is("/api/v1/transactions/tx-42/configuration"));
    }

    @Test
    public void testPostConfigurationSendsTheVersion() throws Exception {
        respond(202, "");

        client.postConfiguration("tx-42", new ApplianceConfiguration(12, null, null), 12);

        HttpRequest request = lastRequest();
        assertThat(request.method(), is("PUT"));
        assertThat(request.uri().getQuery(), is("version=12"));
    }

    @Test
    public void testAllocateAndRelease() throws Exception {
        respond(201, "{\"ip\":\"10.0.0.100\"}");
        assertThat(client.allocateOrReleaseIp("vip-pool", null, IpAction.ALLOCATE), is("10.0.0.100"));
        assertThat(lastRequest().uri().getPath(), is("/api/v1/ip-pools/vip-pool/allocations"));
    }

    @Test
    public void testRelease() throws Exception {
        respond(204, null);
        assertThat(client.allocateOrReleaseIp("vip-pool", "10.0.0.100", IpAction.RELEASE), is("10.0.0.100"));

        HttpRequest request = lastRequest();
        assertThat(request.method(), is("DELETE"));
        assertThat(request.uri().getPath(), is("/api/v1/ip-pools/vip-pool/allocations/10.0.0.100"));
    }

    @Test
    public void testEmptyPool() {
        respond(201, "{}");
        assertThrows(ApplianceException.class, () -> client.allocateOrReleaseIp("vip-pool", null, IpAction.ALLOCATE));
    }

    @Test
    public void testErrorStatusCode() {
        respond(409, "{\"message\":\"version mismatch\"}");

        ApplianceException e = assertThrows(ApplianceException.class, client::startTransaction);
        assertThat(e.getStatusCode(), is(409));
    }
}
