package com.company.failover.scheduled;

import com.company.failover.service.HealthMonitorService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "failover.health.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class HealthCheckRetentionJob {

    private final HealthMonitorService healthMonitorService;
    private final MeterRegistry meterRegistry;

    @Value("${failover.health.retention.days:7}")
    private int retentionDays;

    /**
     * Prune health checks daily at 3:30 AM
     */
    @Scheduled(cron = "${failover.health.retention.cron:0 30 3 * * *}")
    public void pruneHealthChecks() {
        log.info("Starting health check retention job ({} days)", retentionDays);

        try {
            int deleted = healthMonitorService.cleanupOldHealthChecks(retentionDays);
            meterRegistry.counter("health.retention.deleted").increment(deleted);
        } catch (Exception e) {
            log.error("Failed to prune old health checks", e);
            meterRegistry.counter("health.retention.failures").increment();
        }
    }
}
