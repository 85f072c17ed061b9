package com.company.failover.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MaintenanceScheduleResult {
    private boolean scheduled;
    private String eventId;
    private String targetRegionId;

    public static MaintenanceScheduleResult notScheduled() {
        return new MaintenanceScheduleResult(false, null, null);
    }
}
