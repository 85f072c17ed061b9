package com.company.failover.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRegionRequest {
    @NotBlank(message = "Region name is required")
    @Pattern(regexp = "[a-z0-9-]{2,64}", message = "Region name must be lowercase letters, digits and dashes")
    private String name;

    @NotBlank(message = "Display name is required")
    private String displayName;

    @NotBlank(message = "Endpoint is required")
    @Pattern(regexp = "https?://.+", message = "Endpoint must be an http(s) URL")
    private String endpoint;

    @Min(0)
    private Integer priority;

    @Min(1)
    private Integer maxDeployments;

    private boolean primary;
}
