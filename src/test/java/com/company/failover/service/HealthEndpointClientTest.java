package com.company.failover.service;

import com.company.failover.domain.enums.ProbeErrorType;
import com.company.failover.domain.enums.SubsystemStatus;
import com.company.failover.util.EndpointCheckResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import javax.net.ssl.SSLHandshakeException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("Health endpoint client")
class HealthEndpointClientTest {

    private static final String URL = "https://eu-west.example.com/health";

    private MockRestServiceServer server;
    private HealthEndpointClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HealthEndpointClient(restTemplate);
    }

    @Test
    @DisplayName("Should report OK for a 2xx response and send the probe user agent")
    void shouldReportOkOn2xx() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.USER_AGENT, HealthEndpointClient.USER_AGENT))
                .andRespond(withSuccess());

        EndpointCheckResult result = client.check(URL);

        assertThat(result.isOk()).isTrue();
        assertThat(result.getError()).isNull();
        server.verify();
    }

    @Test
    @DisplayName("Should classify non-2xx responses as HTTP errors")
    void shouldClassifyHttpErrors() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        EndpointCheckResult result = client.check(URL);

        assertThat(result.getStatus()).isEqualTo(SubsystemStatus.ERROR);
        assertThat(result.getError()).isEqualTo("HTTP 503");
        assertThat(result.getErrorType()).isEqualTo(ProbeErrorType.HTTP);
    }

    @Test
    @DisplayName("Should classify a read timeout as TIMEOUT")
    void shouldClassifyTimeout() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        EndpointCheckResult result = client.check(URL);

        assertThat(result.getStatus()).isEqualTo(SubsystemStatus.TIMEOUT);
        assertThat(result.getError()).isEqualTo("Request timeout");
        assertThat(result.getErrorType()).isEqualTo(ProbeErrorType.TIMEOUT);
    }

    @Test
    @DisplayName("Should classify refused connections")
    void shouldClassifyConnectionRefused() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new ConnectException("Connection refused");
        });

        EndpointCheckResult result = client.check(URL);

        assertThat(result.getStatus()).isEqualTo(SubsystemStatus.ERROR);
        assertThat(result.getErrorType()).isEqualTo(ProbeErrorType.CONNECTION);
        assertThat(result.getErrorType().code()).isEqualTo("connection");
    }

    @Test
    @DisplayName("Should classify DNS failures")
    void shouldClassifyDnsFailure() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new UnknownHostException("eu-west.example.com");
        });

        EndpointCheckResult result = client.check(URL);

        assertThat(result.getError()).isEqualTo("DNS resolution failed");
        assertThat(result.getErrorType()).isEqualTo(ProbeErrorType.DNS);
    }

    @Test
    @DisplayName("Should classify TLS failures")
    void shouldClassifySslFailure() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new SSLHandshakeException("PKIX path building failed");
        });

        EndpointCheckResult result = client.check(URL);

        assertThat(result.getError()).isEqualTo("SSL certificate error");
        assertThat(result.getErrorType()).isEqualTo(ProbeErrorType.SSL);
    }

    @Test
    @DisplayName("Should fall back to UNKNOWN with the original message")
    void shouldFallBackToUnknown() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new java.io.IOException("stream closed");
        });

        EndpointCheckResult result = client.check(URL);

        assertThat(result.getErrorType()).isEqualTo(ProbeErrorType.UNKNOWN);
        assertThat(result.getError()).contains("stream closed");
    }
}
