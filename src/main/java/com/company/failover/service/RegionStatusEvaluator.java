package com.company.failover.service;

import com.company.failover.domain.RegionHealthCheck;
import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.RegionStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Status rules shared by the prober. Stateless.
 */
@Component
public class RegionStatusEvaluator {

    public static final int STATUS_WINDOW = 5;
    public static final int UNHEALTHY_THRESHOLD = 3;
    public static final int DEGRADED_THRESHOLD = 1;
    public static final int FAILOVER_THRESHOLD = 3;

    /**
     * Region health signal from its most recent checks, newest first.
     * Only the first {@link #STATUS_WINDOW} entries are considered.
     */
    public RegionStatus deriveStatus(List<RegionHealthCheck> recentChecks) {
        long failures = recentChecks.stream()
                .limit(STATUS_WINDOW)
                .filter(check -> !check.getStatus().isHealthy())
                .count();

        if (failures >= UNHEALTHY_THRESHOLD) {
            return RegionStatus.UNHEALTHY;
        }
        if (failures >= DEGRADED_THRESHOLD) {
            return RegionStatus.DEGRADED;
        }
        return RegionStatus.HEALTHY;
    }

    /**
     * Probe cycle status from the number of failed sub-checks
     */
    public HealthCheckStatus aggregate(int failedSubChecks) {
        if (failedSubChecks == 0) {
            return HealthCheckStatus.HEALTHY;
        }
        if (failedSubChecks == 1) {
            return HealthCheckStatus.DEGRADED;
        }
        return HealthCheckStatus.UNHEALTHY;
    }

    /**
     * True when the newest {@link #FAILOVER_THRESHOLD} checks exist and all are failures
     */
    public boolean isSustainedOutage(List<RegionHealthCheck> recentChecks) {
        if (recentChecks.size() < FAILOVER_THRESHOLD) {
            return false;
        }
        return recentChecks.stream()
                .limit(FAILOVER_THRESHOLD)
                .allMatch(check -> check.getStatus().isFailure());
    }

    /**
     * Length of the run of non-healthy checks at the head of the history
     */
    public int consecutiveFailures(List<RegionHealthCheck> recentChecks) {
        int count = 0;
        for (RegionHealthCheck check : recentChecks) {
            if (check.getStatus() == HealthCheckStatus.HEALTHY) {
                break;
            }
            count++;
        }
        return count;
    }
}
