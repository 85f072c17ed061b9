package com.company.failover.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionHealth implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String STATUS_ERROR = "error";

    private String regionId;
    private String regionName;
    private String status;    // lowercase region status, or "error" when the probe itself failed
    private long latencyMs;
    private Instant lastCheck;
    private int consecutiveFailures;
    private boolean primary;
}
