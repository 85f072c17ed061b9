package com.company.failover.domain;

import com.company.failover.domain.enums.FailoverReason;
import com.company.failover.domain.enums.FailoverStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverEvent {
    private String id;
    private String fromRegionId;
    private String toRegionId;
    private FailoverReason reason;
    private String triggeredBy;
    private FailoverStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Integer projectsAffected;
    private Integer deploymentsAffected;
    private String error;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
