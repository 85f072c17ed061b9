package com.company.failover.traffic;

import com.company.failover.domain.Region;
import com.company.failover.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Optional;

/**
 * Cutover through Cloudflare. When a load balancer pool named after the platform
 * exists, the source origin is disabled and the target enabled. Otherwise the
 * main hostname record is pointed at the target host with a short TTL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "failover.traffic.provider", havingValue = "cloudflare")
public class CloudflareTrafficManager implements TrafficManager {

    private final CloudflareApiClient apiClient;
    private final Environment environment;

    @Value("${failover.traffic.cloudflare.pool-name:cloudify}")
    private String poolName;

    @Value("${failover.traffic.cloudflare.hostname:}")
    private String hostname;

    @Value("${failover.traffic.cloudflare.failover-ttl:60}")
    private int failoverTtl;

    @Override
    public void redirectTraffic(Region from, Region to) {
        Optional<JsonNode> pool = findPool();

        if (pool.isPresent()) {
            String poolId = pool.get().path("id").asText();
            JsonNode current = apiClient.getPool(poolId);
            ArrayNode origins = reweightOrigins(current.path("origins"), from.getName(), to.getName());

            apiClient.updatePoolOrigins(poolId, origins);
            log.info("Cloudflare pool {} updated: origin {} disabled, origin {} enabled",
                    poolId, from.getName(), to.getName());
            return;
        }

        JsonNode record = findMainRecord()
                .orElseThrow(() -> new ExternalServiceException("DNS record not found: " + hostname));
        String targetHost = hostFor(to);

        apiClient.updateDnsRecord(record.path("id").asText(), targetHost, failoverTtl);
        log.info("Cloudflare record {} now points to {} (ttl {})", hostname, targetHost, failoverTtl);
    }

    @Override
    public PropagationStatus getPropagationStatus(Region target) {
        try {
            Optional<JsonNode> pool = findPool();

            if (pool.isPresent()) {
                JsonNode current = apiClient.getPool(pool.get().path("id").asText());
                for (JsonNode origin : current.path("origins")) {
                    if (target.getName().equals(origin.path("name").asText())) {
                        boolean active = origin.path("enabled").asBoolean(false)
                                && origin.path("weight").asDouble(0) > 0;
                        return new PropagationStatus(active, target.getName(),
                                active ? "pool origin enabled" : "pool origin not yet enabled");
                    }
                }
                return PropagationStatus.pending(target.getName(), "origin missing from pool");
            }

            Optional<JsonNode> record = findMainRecord();
            if (record.isEmpty()) {
                return PropagationStatus.pending(target.getName(), "DNS record not found");
            }
            String content = record.get().path("content").asText();
            boolean propagated = content.equals(hostFor(target));
            return new PropagationStatus(propagated, target.getName(), "record content " + content);

        } catch (RuntimeException e) {
            log.debug("Propagation lookup for {} failed: {}", target.getName(), e.getMessage());
            return PropagationStatus.pending(target.getName(), e.getMessage());
        }
    }

    /**
     * Configured host for the region, falling back to the host part of its endpoint
     */
    String hostFor(Region region) {
        String configured = environment.getProperty("failover.traffic.region-hosts." + region.getName());
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            String host = URI.create(region.getEndpoint()).getHost();
            if (host != null) {
                return host;
            }
        } catch (IllegalArgumentException e) {
            log.debug("Endpoint {} of region {} is not a URI", region.getEndpoint(), region.getName());
        }
        throw new ExternalServiceException("No traffic host known for region " + region.getName());
    }

    private Optional<JsonNode> findPool() {
        if (!apiClient.poolsConfigured()) {
            return Optional.empty();
        }
        for (JsonNode pool : apiClient.listPools()) {
            if (pool.path("name").asText().contains(poolName)) {
                return Optional.of(pool);
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> findMainRecord() {
        for (JsonNode record : apiClient.listDnsRecords()) {
            if (hostname.equals(record.path("name").asText())
                    && "CNAME".equals(record.path("type").asText())) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    private static ArrayNode reweightOrigins(JsonNode origins, String fromName, String toName) {
        if (!origins.isArray()) {
            throw new ExternalServiceException("Load balancer pool has no origins");
        }
        ArrayNode updated = ((ArrayNode) origins).deepCopy();
        for (JsonNode node : updated) {
            ObjectNode origin = (ObjectNode) node;
            String name = origin.path("name").asText();
            if (name.equals(fromName)) {
                origin.put("enabled", false);
                origin.put("weight", 0);
            } else if (name.equals(toName)) {
                origin.put("enabled", true);
                origin.put("weight", 1);
            }
        }
        return updated;
    }
}
