package com.company.failover.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualFailoverRequest {
    @NotBlank(message = "Source region ID is required")
    private String fromRegionId;

    @NotBlank(message = "Target region ID is required")
    private String toRegionId;
}
