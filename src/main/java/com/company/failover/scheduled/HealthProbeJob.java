package com.company.failover.scheduled;

import com.company.failover.domain.Region;
import com.company.failover.dto.response.FailoverResult;
import com.company.failover.dto.response.RegionHealth;
import com.company.failover.exception.FailoverConflictException;
import com.company.failover.repository.RegionRepository;
import com.company.failover.service.FailoverOrchestrator;
import com.company.failover.service.HealthMonitorService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Periodic probe of every region, followed by the automatic failover check
 * for the current primary.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "failover.health.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class HealthProbeJob {

    private final HealthMonitorService healthMonitorService;
    private final FailoverOrchestrator orchestrator;
    private final RegionRepository regionRepository;
    private final MeterRegistry meterRegistry;

    @Value("${failover.auto.enabled:true}")
    private boolean autoFailoverEnabled;

    @Scheduled(fixedDelayString = "${failover.health.interval-ms:30000}",
            initialDelayString = "${failover.health.initial-delay-ms:10000}")
    public void probeRegions() {
        try {
            List<RegionHealth> results = healthMonitorService.runAllHealthChecks();
            meterRegistry.counter("health.probe.cycles").increment();
            log.debug("Probe cycle finished for {} regions", results.size());
        } catch (Exception e) {
            log.error("Health probe cycle failed", e);
            meterRegistry.counter("health.probe.cycle.failures").increment();
            return;
        }

        if (autoFailoverEnabled) {
            evaluatePrimary();
        }
    }

    private void evaluatePrimary() {
        Optional<Region> primary;
        try {
            primary = regionRepository.findPrimary();
        } catch (Exception e) {
            log.error("Could not load primary region for failover evaluation", e);
            return;
        }

        if (primary.isEmpty()) {
            log.warn("No primary region configured, skipping automatic failover check");
            return;
        }

        Region region = primary.get();
        try {
            Optional<FailoverResult> result = orchestrator.checkAndTriggerFailover(region.getId());
            result.ifPresent(r -> log.warn("Automatic failover {} moved traffic from {} to {}",
                    r.getEventId(), region.getName(), r.getToRegionId()));
        } catch (FailoverConflictException e) {
            log.info("Automatic failover of {} skipped: {}", region.getName(), e.getMessage());
        } catch (Exception e) {
            log.error("Automatic failover of region {} failed", region.getName(), e);
            meterRegistry.counter("failover.auto.failures").increment();
        }
    }
}
