package com.company.failover.dto.response;

import com.company.failover.domain.enums.FailoverReason;
import com.company.failover.domain.enums.FailoverStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverResult {
    private String eventId;
    private String fromRegionId;
    private String toRegionId;
    private FailoverReason reason;
    private FailoverStatus status;
    private long durationMs;
    private int projectsAffected;
    private int deploymentsAffected;
    private boolean propagationConfirmed;
    private String propagationWarning;
}
