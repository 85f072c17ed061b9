package com.company.failover.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to evacuate a region ahead of planned maintenance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceRequest {
    @NotBlank(message = "Region ID is required")
    private String regionId;

    @NotNull(message = "Scheduled time is required")
    private Instant scheduledTime;

    @NotNull(message = "Estimated duration (minutes) is required")
    @Min(1)
    @Max(10080)
    private Integer estimatedDurationMinutes;
}
