package com.company.failover.domain;

import com.company.failover.domain.enums.RegionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Deployable region. Status is split into the probe-derived health signal and
 * the orchestration-owned override; {@link #getStatus()} combines them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Region implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private String displayName;
    private String endpoint;

    // Written by the prober only
    private RegionStatus healthStatus;
    private Instant lastHealthCheck;

    // Written by the orchestrator only (UNHEALTHY, DEGRADED or MAINTENANCE)
    private RegionStatus operationalStatus;
    private Instant operationalStatusAt;

    private boolean primary;
    private Integer priority;
    private Integer activeDeployments;
    private Integer maxDeployments;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Effective status. MAINTENANCE always wins; an UNHEALTHY/DEGRADED override
     * holds until a probe cycle completes after it was applied.
     */
    public RegionStatus getStatus() {
        if (operationalStatus == RegionStatus.MAINTENANCE) {
            return RegionStatus.MAINTENANCE;
        }
        if (operationalStatus != null && !overrideSupersededByProbe()) {
            return operationalStatus;
        }
        return healthStatus != null ? healthStatus : RegionStatus.HEALTHY;
    }

    @JsonIgnore
    public boolean isInMaintenance() {
        return operationalStatus == RegionStatus.MAINTENANCE;
    }

    private boolean overrideSupersededByProbe() {
        return lastHealthCheck != null
                && operationalStatusAt != null
                && lastHealthCheck.isAfter(operationalStatusAt);
    }
}
