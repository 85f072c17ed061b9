package com.company.failover.service;

import com.company.failover.domain.Region;
import com.company.failover.domain.RegionHealthCheck;
import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.ProbeErrorType;
import com.company.failover.domain.enums.RegionStatus;
import com.company.failover.domain.enums.SubsystemStatus;
import com.company.failover.dto.response.HealthCheckResult;
import com.company.failover.dto.response.RegionHealth;
import com.company.failover.dto.response.RegionHealthStats;
import com.company.failover.exception.RegionNotFoundException;
import com.company.failover.repository.RegionHealthCheckRepository;
import com.company.failover.repository.RegionRepository;
import com.company.failover.util.EndpointCheckResult;
import com.company.failover.util.FailoverDecision;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Probes regions, records health checks and maintains the probe-derived
 * health signal. Also answers the "should this region fail over" and
 * "where to" questions for the orchestrator.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthMonitorService {

    static final List<String> SUB_CHECK_PATHS = List.of("/health", "/health/db", "/health/storage", "/health/redis");

    private static final Comparator<Region> TARGET_ORDER = Comparator
            .comparing((Region r) -> r.getPriority() != null ? r.getPriority() : Integer.MAX_VALUE)
            .thenComparing(r -> r.getActiveDeployments() != null ? r.getActiveDeployments() : 0)
            .thenComparing(Region::getName);

    private static final int CONSECUTIVE_FAILURE_WINDOW = 20;

    private final RegionRepository regionRepository;
    private final RegionHealthCheckRepository healthCheckRepository;
    private final HealthEndpointClient endpointClient;
    private final RegionStatusEvaluator statusEvaluator;
    private final MeterRegistry meterRegistry;

    @Qualifier("regionProbeExecutor")
    private final Executor regionProbeExecutor;

    @Qualifier("endpointCheckExecutor")
    private final Executor endpointCheckExecutor;

    @Value("${failover.health.region-timeout-ms:15000}")
    private long regionTimeoutMs;

    @Value("${failover.health.concurrency:5}")
    private int concurrency;

    @CacheEvict(value = {"regionHealth", "regionDetails"}, allEntries = true)
    public HealthCheckResult checkRegionHealth(String regionId) {
        Region region = regionRepository.findById(regionId)
                .orElseThrow(() -> new RegionNotFoundException(regionId));
        return checkRegionHealth(region);
    }

    /**
     * Run the four sub-checks for a region, persist the cycle and recompute the
     * region health signal. Probe failures end up in the result, not as exceptions.
     */
    public HealthCheckResult checkRegionHealth(Region region) {
        long start = System.currentTimeMillis();
        String baseUrl = stripTrailingSlash(region.getEndpoint());

        List<CompletableFuture<EndpointCheckResult>> futures = new ArrayList<>();
        SubsystemStatus[] subStatuses = new SubsystemStatus[SUB_CHECK_PATHS.size()];
        HealthCheckStatus status;
        String error = null;
        String errorType = null;

        try {
            for (String path : SUB_CHECK_PATHS) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> endpointClient.check(baseUrl + path), endpointCheckExecutor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(regionTimeoutMs, TimeUnit.MILLISECONDS);

            int failed = 0;
            for (int i = 0; i < futures.size(); i++) {
                EndpointCheckResult subResult = futures.get(i).join();
                subStatuses[i] = subResult.getStatus();
                if (!subResult.isOk()) {
                    failed++;
                    if (error == null) {
                        error = subResult.getError();
                        errorType = subResult.getErrorType().code();
                    }
                }
            }
            status = statusEvaluator.aggregate(failed);

        } catch (TimeoutException e) {
            status = HealthCheckStatus.TIMEOUT;
            error = "Region health check timed out after " + regionTimeoutMs + "ms";
            errorType = ProbeErrorType.TIMEOUT.code();
            fillUnfinished(futures, subStatuses);

        } catch (ExecutionException | RejectedExecutionException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            status = HealthCheckStatus.TIMEOUT;
            error = cause.getMessage() != null ? cause.getMessage() : "Unknown error";
            errorType = ProbeErrorType.CONNECTION.code();
            fillUnfinished(futures, subStatuses);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = HealthCheckStatus.TIMEOUT;
            error = "Health check interrupted";
            errorType = ProbeErrorType.CONNECTION.code();
            fillUnfinished(futures, subStatuses);
        }

        long latencyMs = System.currentTimeMillis() - start;
        Instant checkedAt = Instant.now();

        healthCheckRepository.save(RegionHealthCheck.builder()
                .regionId(region.getId())
                .status(status)
                .latencyMs(latencyMs)
                .apiStatus(subStatuses[0])
                .databaseStatus(subStatuses[1])
                .storageStatus(subStatuses[2])
                .cacheStatus(subStatuses[3])
                .error(error)
                .errorType(errorType)
                .createdAt(checkedAt)
                .build());

        RegionStatus healthStatus = statusEvaluator.deriveStatus(
                healthCheckRepository.findRecent(region.getId(), RegionStatusEvaluator.STATUS_WINDOW));
        regionRepository.updateHealthSignal(region.getId(), healthStatus, checkedAt);

        region.setHealthStatus(healthStatus);
        region.setLastHealthCheck(checkedAt);

        meterRegistry.counter("region.health.checks",
                "region", region.getName(),
                "status", status.name()
        ).increment();
        meterRegistry.timer("region.health.latency", "region", region.getName())
                .record(Duration.ofMillis(latencyMs));

        if (status != HealthCheckStatus.HEALTHY) {
            log.warn("Region {} check {}: {} ({}), region status now {}",
                    region.getName(), status, error, errorType, region.getStatus());
        } else {
            log.debug("Region {} healthy in {}ms", region.getName(), latencyMs);
        }

        return HealthCheckResult.builder()
                .regionId(region.getId())
                .status(status)
                .latencyMs(latencyMs)
                .api(subStatuses[0])
                .database(subStatuses[1])
                .storage(subStatuses[2])
                .cache(subStatuses[3])
                .error(error)
                .errorType(errorType)
                .regionStatus(region.getStatus())
                .checkedAt(checkedAt)
                .build();
    }

    /**
     * Probe every region not in maintenance, {@code concurrency} regions at a time.
     * A failure for one region is reported as status "error" and does not stop the batch.
     */
    @CacheEvict(value = {"regionHealth", "regionDetails"}, allEntries = true)
    public List<RegionHealth> runAllHealthChecks() {
        List<Region> regions = regionRepository.findProbeable();
        List<RegionHealth> results = new ArrayList<>(regions.size());
        int batchSize = Math.max(1, concurrency);

        for (int i = 0; i < regions.size(); i += batchSize) {
            List<Region> batch = regions.subList(i, Math.min(i + batchSize, regions.size()));

            List<CompletableFuture<RegionHealth>> futures = batch.stream()
                    .map(region -> submitProbe(region)
                            .exceptionally(e -> probeError(region, e)))
                    .collect(Collectors.toList());

            futures.forEach(future -> results.add(future.join()));
        }

        long unhealthy = results.stream().filter(r -> !"healthy".equals(r.getStatus())).count();
        log.info("Health probe cycle complete: {} regions, {} not healthy", results.size(), unhealthy);

        return results;
    }

    private CompletableFuture<RegionHealth> submitProbe(Region region) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                HealthCheckResult result = checkRegionHealth(region);
                return RegionHealth.builder()
                        .regionId(region.getId())
                        .regionName(region.getName())
                        .status(result.getStatus().name().toLowerCase())
                        .latencyMs(result.getLatencyMs())
                        .lastCheck(result.getCheckedAt())
                        .consecutiveFailures(result.getStatus().isHealthy() ? 0 : 1)
                        .primary(region.isPrimary())
                        .build();
            }, regionProbeExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private RegionHealth probeError(Region region, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("Health check failed for region {}", region.getName(), cause);
        meterRegistry.counter("region.health.errors", "region", region.getName()).increment();

        return RegionHealth.builder()
                .regionId(region.getId())
                .regionName(region.getName())
                .status(RegionHealth.STATUS_ERROR)
                .latencyMs(-1)
                .lastCheck(Instant.now())
                .consecutiveFailures(1)
                .primary(region.isPrimary())
                .build();
    }

    /**
     * Only a primary region with a sustained outage qualifies. Regions held in
     * maintenance are never failed over from this path.
     */
    public FailoverDecision shouldTriggerFailover(String regionId) {
        Optional<Region> regionOpt = regionRepository.findById(regionId);
        if (regionOpt.isEmpty()) {
            return FailoverDecision.no();
        }

        Region region = regionOpt.get();
        if (!region.isPrimary() || region.isInMaintenance()) {
            return FailoverDecision.no();
        }

        List<RegionHealthCheck> recent = healthCheckRepository.findRecent(
                regionId, RegionStatusEvaluator.FAILOVER_THRESHOLD);

        if (statusEvaluator.isSustainedOutage(recent)) {
            return new FailoverDecision(true,
                    RegionStatusEvaluator.FAILOVER_THRESHOLD + " consecutive health check failures");
        }
        return FailoverDecision.no();
    }

    /**
     * Healthy region with the lowest (priority, activeDeployments), ties broken by name
     */
    public Optional<String> getBestFailoverTarget(String excludeRegionId) {
        return regionRepository.findAll().stream()
                .filter(region -> !region.getId().equals(excludeRegionId))
                .filter(region -> region.getStatus() == RegionStatus.HEALTHY)
                .min(TARGET_ORDER)
                .map(Region::getId);
    }

    @Cacheable(value = "regionHealth", key = "'all'")
    public List<RegionHealth> getAllRegionHealth() {
        List<RegionHealth> results = new ArrayList<>();

        for (Region region : regionRepository.findAll()) {
            List<RegionHealthCheck> recent = healthCheckRepository.findRecent(
                    region.getId(), CONSECUTIVE_FAILURE_WINDOW);

            results.add(RegionHealth.builder()
                    .regionId(region.getId())
                    .regionName(region.getName())
                    .status(region.getStatus().name().toLowerCase())
                    .latencyMs(recent.isEmpty() ? 0L : recent.get(0).getLatencyMs())
                    .lastCheck(region.getLastHealthCheck() != null
                            ? region.getLastHealthCheck() : region.getCreatedAt())
                    .consecutiveFailures(statusEvaluator.consecutiveFailures(recent))
                    .primary(region.isPrimary())
                    .build());
        }

        return results;
    }

    public RegionHealthStats getRegionHealthStats(String regionId) {
        List<RegionHealthCheck> lastHour = healthCheckRepository.findSince(
                regionId, Instant.now().minus(Duration.ofHours(1)));

        if (lastHour.isEmpty()) {
            return new RegionHealthStats(100, 0L, 0, 0);
        }

        int healthy = (int) lastHour.stream().filter(c -> c.getStatus().isHealthy()).count();
        double avgLatency = lastHour.stream().mapToLong(RegionHealthCheck::getLatencyMs).average().orElse(0);

        return RegionHealthStats.builder()
                .uptimePercent((int) Math.round(healthy * 100.0 / lastHour.size()))
                .avgLatencyMs(Math.round(avgLatency))
                .checksLastHour(lastHour.size())
                .healthyChecks(healthy)
                .build();
    }

    public int cleanupOldHealthChecks(int retentionDays) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        int deleted = healthCheckRepository.deleteOlderThan(cutoff);
        log.info("Deleted {} health checks older than {} days", deleted, retentionDays);
        return deleted;
    }

    private static void fillUnfinished(List<CompletableFuture<EndpointCheckResult>> futures,
                                       SubsystemStatus[] subStatuses) {
        for (int i = 0; i < subStatuses.length; i++) {
            CompletableFuture<EndpointCheckResult> future = i < futures.size() ? futures.get(i) : null;
            if (future != null && future.isDone() && !future.isCompletedExceptionally()) {
                subStatuses[i] = future.join().getStatus();
            } else {
                if (future != null) {
                    future.cancel(true);
                }
                subStatuses[i] = SubsystemStatus.TIMEOUT;
            }
        }
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
