package com.company.failover.domain;

import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.SubsystemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One probe cycle for one region. Append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionHealthCheck {
    private Long id;
    private String regionId;
    private HealthCheckStatus status;
    private Long latencyMs;
    private SubsystemStatus apiStatus;
    private SubsystemStatus databaseStatus;
    private SubsystemStatus storageStatus;
    private SubsystemStatus cacheStatus;
    private String error;
    private String errorType;
    private Instant createdAt;
}
