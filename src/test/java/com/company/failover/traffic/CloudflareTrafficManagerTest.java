package com.company.failover.traffic;

import com.company.failover.domain.Region;
import com.company.failover.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Cloudflare traffic manager")
class CloudflareTrafficManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private CloudflareApiClient apiClient;

    private MockEnvironment environment;
    private CloudflareTrafficManager trafficManager;

    private final Region euWest = region("eu-west", "https://eu-west.example.com");
    private final Region usEast = region("us-east", "https://us-east.example.com");

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        trafficManager = new CloudflareTrafficManager(apiClient, environment);
        ReflectionTestUtils.setField(trafficManager, "poolName", "cloudify");
        ReflectionTestUtils.setField(trafficManager, "hostname", "app.example.com");
        ReflectionTestUtils.setField(trafficManager, "failoverTtl", 60);
    }

    private static Region region(String name, String endpoint) {
        return Region.builder().id(name + "-id").name(name).endpoint(endpoint).build();
    }

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    private void stubPool(String originsJson) throws Exception {
        when(apiClient.poolsConfigured()).thenReturn(true);
        when(apiClient.listPools()).thenReturn(json("[{\"id\":\"p1\",\"name\":\"cloudify-main\"}]"));
        when(apiClient.getPool("p1")).thenReturn(json("{\"id\":\"p1\",\"origins\":" + originsJson + "}"));
    }

    @Nested
    @DisplayName("Load balancer pool")
    class Pool {

        @Test
        @DisplayName("Should disable the source origin and enable the target origin")
        void shouldReweightOrigins() throws Exception {
            stubPool("[{\"name\":\"eu-west\",\"enabled\":true,\"weight\":1},"
                    + "{\"name\":\"us-east\",\"enabled\":false,\"weight\":0},"
                    + "{\"name\":\"ap-south\",\"enabled\":true,\"weight\":0.5}]");

            trafficManager.redirectTraffic(euWest, usEast);

            ArgumentCaptor<ArrayNode> origins = ArgumentCaptor.forClass(ArrayNode.class);
            verify(apiClient).updatePoolOrigins(eq("p1"), origins.capture());
            assertThat(origins.getValue().get(0).path("enabled").asBoolean()).isFalse();
            assertThat(origins.getValue().get(0).path("weight").asDouble()).isZero();
            assertThat(origins.getValue().get(1).path("enabled").asBoolean()).isTrue();
            assertThat(origins.getValue().get(1).path("weight").asDouble()).isEqualTo(1.0);
            assertThat(origins.getValue().get(2).path("weight").asDouble()).isEqualTo(0.5);
            verify(apiClient, never()).updateDnsRecord(anyString(), anyString(), anyInt());
        }

        @Test
        @DisplayName("Should report propagation once the target origin is enabled with weight")
        void shouldReportPoolPropagation() throws Exception {
            stubPool("[{\"name\":\"us-east\",\"enabled\":true,\"weight\":1}]");

            PropagationStatus status = trafficManager.getPropagationStatus(usEast);

            assertThat(status.isPropagated()).isTrue();
            assertThat(status.getActiveRegion()).isEqualTo("us-east");
        }

        @Test
        @DisplayName("Should report pending when the target origin is missing")
        void shouldReportMissingOrigin() throws Exception {
            stubPool("[{\"name\":\"eu-west\",\"enabled\":true,\"weight\":1}]");

            PropagationStatus status = trafficManager.getPropagationStatus(usEast);

            assertThat(status.isPropagated()).isFalse();
            assertThat(status.getDetail()).isEqualTo("origin missing from pool");
        }
    }

    @Nested
    @DisplayName("DNS record")
    class DnsRecord {

        @BeforeEach
        void noPools() {
            when(apiClient.poolsConfigured()).thenReturn(false);
        }

        @Test
        @DisplayName("Should point the hostname record at the target host with the failover TTL")
        void shouldUpdateRecord() throws Exception {
            when(apiClient.listDnsRecords()).thenReturn(json(
                    "[{\"id\":\"a1\",\"name\":\"app.example.com\",\"type\":\"A\"},"
                            + "{\"id\":\"r1\",\"name\":\"app.example.com\",\"type\":\"CNAME\"}]"));

            trafficManager.redirectTraffic(euWest, usEast);

            verify(apiClient).updateDnsRecord("r1", "us-east.example.com", 60);
        }

        @Test
        @DisplayName("Should prefer a configured region host over the endpoint host")
        void shouldUseConfiguredHost() throws Exception {
            environment.setProperty("failover.traffic.region-hosts.us-east", "lb-us-east.example.net");
            when(apiClient.listDnsRecords()).thenReturn(json(
                    "[{\"id\":\"r1\",\"name\":\"app.example.com\",\"type\":\"CNAME\"}]"));

            trafficManager.redirectTraffic(euWest, usEast);

            verify(apiClient).updateDnsRecord("r1", "lb-us-east.example.net", 60);
        }

        @Test
        @DisplayName("Should fail when the hostname record does not exist")
        void shouldFailWithoutRecord() throws Exception {
            when(apiClient.listDnsRecords()).thenReturn(json("[]"));

            assertThatThrownBy(() -> trafficManager.redirectTraffic(euWest, usEast))
                    .isInstanceOf(ExternalServiceException.class)
                    .hasMessageContaining("app.example.com");
            verify(apiClient, never()).updateDnsRecord(anyString(), anyString(), anyInt());
        }

        @Test
        @DisplayName("Should report propagation when the record content matches the target host")
        void shouldReportRecordPropagation() throws Exception {
            when(apiClient.listDnsRecords()).thenReturn(json(
                    "[{\"id\":\"r1\",\"name\":\"app.example.com\",\"type\":\"CNAME\",\"content\":\"us-east.example.com\"}]"));

            assertThat(trafficManager.getPropagationStatus(usEast).isPropagated()).isTrue();
            assertThat(trafficManager.getPropagationStatus(euWest).isPropagated()).isFalse();
        }

        @Test
        @DisplayName("Should report pending instead of throwing when the lookup fails")
        void shouldSwallowLookupErrors() {
            when(apiClient.listDnsRecords()).thenThrow(new ExternalServiceException("Cloudflare GET failed"));

            PropagationStatus status = trafficManager.getPropagationStatus(usEast);

            assertThat(status.isPropagated()).isFalse();
            assertThat(status.getDetail()).isEqualTo("Cloudflare GET failed");
        }
    }

    @Test
    @DisplayName("Should refuse a region with no configured host and no usable endpoint")
    void shouldRejectUnknownHost() {
        Region broken = region("mars", "not a uri");

        assertThatThrownBy(() -> trafficManager.hostFor(broken))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("mars");
        verify(apiClient, never()).updatePoolOrigins(anyString(), any());
    }
}
