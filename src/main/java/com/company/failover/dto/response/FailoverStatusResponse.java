package com.company.failover.dto.response;

import com.company.failover.domain.enums.FailoverStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverStatusResponse {
    private boolean inProgress;
    private CurrentFailover currentEvent;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrentFailover {
        private String id;
        private String fromRegion;
        private String toRegion;
        private FailoverStatus status;
        private Instant startedAt;
        private int progress;
    }

    public static FailoverStatusResponse idle() {
        return new FailoverStatusResponse(false, null);
    }
}
