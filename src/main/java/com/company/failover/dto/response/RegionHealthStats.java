package com.company.failover.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Health summary over the last hour of checks
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionHealthStats implements Serializable {
    private static final long serialVersionUID = 1L;

    private int uptimePercent;
    private long avgLatencyMs;
    private int checksLastHour;
    private int healthyChecks;
}
