package com.company.failover.domain.enums;

public enum RegionStatus {
    HEALTHY("Region is serving traffic normally"),
    DEGRADED("Region has intermittent or partial failures"),
    UNHEALTHY("Region has sustained failures"),
    MAINTENANCE("Region is excluded from probing and automatic failover");

    private final String description;

    RegionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static RegionStatus fromString(String status) {
        if (status == null) {
            return null;
        }
        return RegionStatus.valueOf(status.toUpperCase());
    }
}
