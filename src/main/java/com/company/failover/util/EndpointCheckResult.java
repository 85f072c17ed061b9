package com.company.failover.util;

import com.company.failover.domain.enums.ProbeErrorType;
import com.company.failover.domain.enums.SubsystemStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a single GET against one health endpoint
 */
@Data
@AllArgsConstructor
public class EndpointCheckResult {
    private SubsystemStatus status;
    private long latencyMs;
    private String error;
    private ProbeErrorType errorType;

    public static EndpointCheckResult ok(long latencyMs) {
        return new EndpointCheckResult(SubsystemStatus.OK, latencyMs, null, null);
    }

    public static EndpointCheckResult failed(SubsystemStatus status, long latencyMs,
                                             String error, ProbeErrorType errorType) {
        return new EndpointCheckResult(status, latencyMs, error, errorType);
    }

    public boolean isOk() {
        return status == SubsystemStatus.OK;
    }
}
