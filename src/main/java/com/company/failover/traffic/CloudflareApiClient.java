package com.company.failover.traffic;

import com.company.failover.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Thin client over the Cloudflare v4 REST API: load balancer pools and DNS records.
 * Every call unwraps the {@code result} node and fails on {@code success=false}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "failover.traffic.provider", havingValue = "cloudflare")
public class CloudflareApiClient {

    static final String RESILIENCE_NAME = "trafficControlPlane";

    @Qualifier("controlPlaneRestTemplate")
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${failover.traffic.cloudflare.api-base:https://api.cloudflare.com/client/v4}")
    private String apiBase;

    @Value("${failover.traffic.cloudflare.api-token:}")
    private String apiToken;

    @Value("${failover.traffic.cloudflare.account-id:}")
    private String accountId;

    @Value("${failover.traffic.cloudflare.zone-id:}")
    private String zoneId;

    @PostConstruct
    void validate() {
        if (apiToken == null || apiToken.isBlank() || zoneId == null || zoneId.isBlank()) {
            throw new IllegalStateException(
                    "failover.traffic.cloudflare.api-token and zone-id are required when provider=cloudflare");
        }
        if (accountId == null || accountId.isBlank()) {
            log.warn("failover.traffic.cloudflare.account-id not set, load balancer pools will not be used");
        }
    }

    public boolean poolsConfigured() {
        return accountId != null && !accountId.isBlank();
    }

    @Retry(name = RESILIENCE_NAME)
    @CircuitBreaker(name = RESILIENCE_NAME)
    public JsonNode listPools() {
        return call(HttpMethod.GET, apiBase + "/accounts/" + accountId + "/load_balancers/pools", null);
    }

    @Retry(name = RESILIENCE_NAME)
    @CircuitBreaker(name = RESILIENCE_NAME)
    public JsonNode getPool(String poolId) {
        return call(HttpMethod.GET, apiBase + "/accounts/" + accountId + "/load_balancers/pools/" + poolId, null);
    }

    @Retry(name = RESILIENCE_NAME)
    @CircuitBreaker(name = RESILIENCE_NAME)
    public JsonNode updatePoolOrigins(String poolId, ArrayNode origins) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("origins", origins);
        return call(HttpMethod.PATCH, apiBase + "/accounts/" + accountId + "/load_balancers/pools/" + poolId, body);
    }

    @Retry(name = RESILIENCE_NAME)
    @CircuitBreaker(name = RESILIENCE_NAME)
    public JsonNode listDnsRecords() {
        return call(HttpMethod.GET, apiBase + "/zones/" + zoneId + "/dns_records", null);
    }

    @Retry(name = RESILIENCE_NAME)
    @CircuitBreaker(name = RESILIENCE_NAME)
    public JsonNode updateDnsRecord(String recordId, String content, int ttl) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("content", content);
        body.put("ttl", ttl);
        return call(HttpMethod.PATCH, apiBase + "/zones/" + zoneId + "/dns_records/" + recordId, body);
    }

    private JsonNode call(HttpMethod method, String url, JsonNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException(
                    "Cloudflare " + method.name() + " " + stripBase(url) + " failed: " + e.getMessage(), e);
        }

        JsonNode payload = response.getBody();
        if (payload == null || !payload.path("success").asBoolean(false)) {
            String errors = payload != null ? payload.path("errors").toString() : "empty response";
            throw new ExternalServiceException(
                    "Cloudflare " + method.name() + " " + stripBase(url) + " rejected: " + errors);
        }

        return payload.path("result");
    }

    private String stripBase(String url) {
        return url.startsWith(apiBase) ? url.substring(apiBase.length()) : url;
    }
}
