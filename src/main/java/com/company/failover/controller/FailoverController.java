package com.company.failover.controller;

import com.company.failover.domain.FailoverEvent;
import com.company.failover.domain.Region;
import com.company.failover.domain.enums.FailoverReason;
import com.company.failover.domain.enums.RegionStatus;
import com.company.failover.dto.request.MaintenanceRequest;
import com.company.failover.dto.request.ManualFailoverRequest;
import com.company.failover.dto.response.FailoverResult;
import com.company.failover.dto.response.FailoverStatusResponse;
import com.company.failover.dto.response.MaintenanceScheduleResult;
import com.company.failover.exception.FailoverConflictException;
import com.company.failover.exception.FailoverValidationException;
import com.company.failover.repository.RegionRepository;
import com.company.failover.security.OperatorContext;
import com.company.failover.service.FailoverOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/failover")
@Tag(name = "Failover", description = "Trigger, inspect and roll back region failovers")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class FailoverController {

    private final FailoverOrchestrator orchestrator;
    private final RegionRepository regionRepository;
    private final OperatorContext operatorContext;
    private final MeterRegistry meterRegistry;

    @GetMapping("/status")
    @Operation(summary = "Current failover, if one is pending or in progress")
    @PreAuthorize("hasAnyRole('ADMIN', 'OPERATOR')")
    public ResponseEntity<FailoverStatusResponse> getStatus() {
        return ResponseEntity.ok(orchestrator.getFailoverStatus());
    }

    @GetMapping("/history")
    @Operation(summary = "Recent failover events, newest first")
    @PreAuthorize("hasAnyRole('ADMIN', 'OPERATOR')")
    public ResponseEntity<List<FailoverEvent>> getHistory(
            @Parameter(description = "Number of events, clamped to 1..200 (default 50)")
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(orchestrator.getFailoverHistory(limit));
    }

    /**
     * Manual failover. Unlike the automatic path the operator picks the target,
     * which must currently be healthy.
     */
    @PostMapping
    @Operation(
            summary = "Manually fail over between two regions",
            description = "Runs the full protocol synchronously; 409 if another failover is active"
    )
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<FailoverResult> executeFailover(@Valid @RequestBody ManualFailoverRequest request) {
        String operator = operatorContext.getCurrentOperatorId();

        Region target = regionRepository.findById(request.getToRegionId())
                .orElseThrow(() -> new FailoverValidationException(
                        "Invalid region IDs: target region " + request.getToRegionId() + " not found"));
        if (target.getStatus() != RegionStatus.HEALTHY) {
            throw new FailoverValidationException(
                    "Target region " + target.getName() + " is not healthy (" + target.getStatus() + ")");
        }

        log.info("Manual failover {} -> {} requested by {}",
                request.getFromRegionId(), request.getToRegionId(), operator);
        meterRegistry.counter("api.failover.manual.requests").increment();

        FailoverResult result = orchestrator.executeFailover(
                request.getFromRegionId(), request.getToRegionId(), FailoverReason.MANUAL, operator);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/check/{regionId}")
    @Operation(
            summary = "Evaluate a region and fail over if it has a sustained outage",
            description = "204 when the region does not qualify or no healthy target exists"
    )
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<FailoverResult> checkAndTrigger(@PathVariable String regionId) {
        return orchestrator.checkAndTriggerFailover(regionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{eventId}/rollback")
    @Operation(summary = "Reverse a completed failover")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<FailoverResult> rollback(@PathVariable String eventId) {
        log.info("Rollback of failover {} requested by {}", eventId, operatorContext.getCurrentOperatorId());
        return ResponseEntity.ok(orchestrator.rollbackFailover(eventId));
    }

    @PostMapping("/{eventId}/cancel")
    @Operation(summary = "Cancel a pending failover")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String eventId) {
        if (!orchestrator.cancelFailover(eventId)) {
            throw new FailoverConflictException("Failover event " + eventId + " is not pending");
        }
        log.info("Failover {} cancelled by {}", eventId, operatorContext.getCurrentOperatorId());
        return ResponseEntity.ok(Map.of("eventId", eventId, "cancelled", true));
    }

    @PostMapping("/{eventId}/start")
    @Operation(summary = "Run a pending (scheduled) failover now")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<FailoverResult> start(@PathVariable String eventId) {
        log.info("Start of scheduled failover {} requested by {}", eventId, operatorContext.getCurrentOperatorId());
        return ResponseEntity.ok(orchestrator.startScheduledFailover(eventId));
    }

    @PostMapping("/maintenance")
    @Operation(
            summary = "Schedule a maintenance evacuation",
            description = "Puts the region in maintenance and records a pending failover to the best healthy target"
    )
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<MaintenanceScheduleResult> scheduleMaintenance(
            @Valid @RequestBody MaintenanceRequest request) {
        MaintenanceScheduleResult result = orchestrator.scheduleMaintenanceFailover(
                request.getRegionId(),
                request.getScheduledTime(),
                request.getEstimatedDurationMinutes(),
                operatorContext.getCurrentOperatorId());
        return ResponseEntity.ok(result);
    }
}
