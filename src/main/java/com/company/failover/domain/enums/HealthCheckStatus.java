package com.company.failover.domain.enums;

public enum HealthCheckStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    TIMEOUT;

    /**
     * Statuses that count towards a health-triggered failover
     */
    public boolean isFailure() {
        return this == UNHEALTHY || this == TIMEOUT;
    }

    public boolean isHealthy() {
        return this == HEALTHY;
    }

    public static HealthCheckStatus fromString(String status) {
        if (status == null) {
            return TIMEOUT;
        }
        try {
            return HealthCheckStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return TIMEOUT;
        }
    }
}
