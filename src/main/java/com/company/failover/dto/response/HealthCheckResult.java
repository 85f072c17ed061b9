package com.company.failover.dto.response;

import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.RegionStatus;
import com.company.failover.domain.enums.SubsystemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One probe cycle for one region, plus the region status derived after it was recorded
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckResult {
    private String regionId;
    private HealthCheckStatus status;
    private long latencyMs;
    private SubsystemStatus api;
    private SubsystemStatus database;
    private SubsystemStatus storage;
    private SubsystemStatus cache;
    private String error;
    private String errorType;
    private RegionStatus regionStatus;
    private Instant checkedAt;
}
