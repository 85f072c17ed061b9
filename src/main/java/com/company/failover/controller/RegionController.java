package com.company.failover.controller;

import com.company.failover.domain.Region;
import com.company.failover.dto.request.CreateRegionRequest;
import com.company.failover.dto.response.HealthCheckResult;
import com.company.failover.dto.response.RegionDetailResponse;
import com.company.failover.dto.response.RegionHealth;
import com.company.failover.security.OperatorContext;
import com.company.failover.service.FailoverOrchestrator;
import com.company.failover.service.HealthMonitorService;
import com.company.failover.service.RegionAdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/regions")
@Tag(name = "Regions", description = "Region health and administration")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class RegionController {

    private final HealthMonitorService healthMonitorService;
    private final RegionAdminService regionAdminService;
    private final FailoverOrchestrator orchestrator;
    private final OperatorContext operatorContext;

    @GetMapping
    @Operation(summary = "Health summary of every region")
    @PreAuthorize("hasAnyRole('ADMIN', 'OPERATOR')")
    public ResponseEntity<List<RegionHealth>> getAllRegions() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(15, TimeUnit.SECONDS).cachePrivate())
                .body(healthMonitorService.getAllRegionHealth());
    }

    @GetMapping("/{regionId}")
    @Operation(summary = "Region with last-hour stats, recent checks and failovers")
    @PreAuthorize("hasAnyRole('ADMIN', 'OPERATOR')")
    public ResponseEntity<RegionDetailResponse> getRegion(@PathVariable String regionId) {
        return ResponseEntity.ok(regionAdminService.getRegionDetails(regionId));
    }

    @PostMapping
    @Operation(summary = "Register a region", description = "Runs an initial health check")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Region> createRegion(@Valid @RequestBody CreateRegionRequest request) {
        Region region = regionAdminService.createRegion(request, operatorContext.getCurrentOperatorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(region);
    }

    @PostMapping("/{regionId}/health-check")
    @Operation(summary = "Probe a region now")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<HealthCheckResult> checkHealth(@PathVariable String regionId) {
        return ResponseEntity.ok(healthMonitorService.checkRegionHealth(regionId));
    }

    @PostMapping("/{regionId}/maintenance/end")
    @Operation(summary = "Take a region out of maintenance")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Region> endMaintenance(@PathVariable String regionId) {
        log.info("End of maintenance for region {} requested by {}", regionId, operatorContext.getCurrentOperatorId());
        return ResponseEntity.ok(orchestrator.endMaintenance(regionId));
    }
}
