package com.company.failover.service;

import com.company.failover.domain.AffectedResources;
import com.company.failover.domain.FailoverEvent;
import com.company.failover.domain.Region;
import com.company.failover.domain.enums.FailoverReason;
import com.company.failover.domain.enums.FailoverStatus;
import com.company.failover.domain.enums.RegionStatus;
import com.company.failover.dto.response.FailoverResult;
import com.company.failover.dto.response.FailoverStatusResponse;
import com.company.failover.dto.response.MaintenanceScheduleResult;
import com.company.failover.event.FailoverCompletedEvent;
import com.company.failover.event.FailoverFailedEvent;
import com.company.failover.event.RegionStateChangedEvent;
import com.company.failover.exception.ExternalServiceException;
import com.company.failover.exception.FailoverConflictException;
import com.company.failover.exception.FailoverEventNotFoundException;
import com.company.failover.exception.FailoverValidationException;
import com.company.failover.exception.RegionNotFoundException;
import com.company.failover.repository.AffectedResourceRepository;
import com.company.failover.repository.FailoverEventRepository;
import com.company.failover.repository.RegionRepository;
import com.company.failover.traffic.PropagationStatus;
import com.company.failover.traffic.TrafficManager;
import com.company.failover.util.FailoverDecision;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs region cutovers. At most one event may be PENDING or IN_PROGRESS at a
 * time; the event store enforces this at insert. Protocol steps run strictly
 * in order and each step's effect is committed before the next begins.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FailoverOrchestrator {

    public static final String SYSTEM_ACTOR = "system";

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 200;

    private final RegionRepository regionRepository;
    private final FailoverEventRepository eventRepository;
    private final AffectedResourceRepository affectedResourceRepository;
    private final HealthMonitorService healthMonitorService;
    private final TrafficManager trafficManager;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    @Value("${failover.propagation.poll-interval-ms:2000}")
    private long propagationPollIntervalMs;

    @Value("${failover.propagation.timeout-ms:30000}")
    private long propagationTimeoutMs;

    /**
     * Cut traffic over from one region to another.
     *
     * @throws FailoverValidationException if a region is unknown or both ids are the same
     * @throws FailoverConflictException if another failover is pending or in progress
     * @throws ExternalServiceException if the traffic control plane call fails
     */
    public FailoverResult executeFailover(String fromRegionId, String toRegionId,
                                          FailoverReason reason, String triggeredBy) {
        return traced(reason, fromRegionId, toRegionId, () -> {
            long startMs = System.currentTimeMillis();

            // 1. validate
            Region from = requireRegion(fromRegionId, "source");
            Region to = requireRegion(toRegionId, "target");
            if (from.getId().equals(to.getId())) {
                throw new FailoverValidationException("Source and target region must differ: " + fromRegionId);
            }

            // 2. claim the single active slot
            FailoverEvent event = claim(from.getId(), to.getId(), reason, triggeredBy,
                    FailoverStatus.IN_PROGRESS, new HashMap<>());
            Span.current().setAttribute("failover.event_id", event.getId());

            log.info("Failover {} started: {} -> {} (reason={}, triggeredBy={})",
                    event.getId(), from.getName(), to.getName(), reason, triggeredBy);

            return runProtocol(event, from, to, startMs);
        });
    }

    /**
     * Automatic path: fail over a primary region with a sustained outage to the best healthy target
     */
    public Optional<FailoverResult> checkAndTriggerFailover(String regionId) {
        FailoverDecision decision = healthMonitorService.shouldTriggerFailover(regionId);
        if (!decision.isShouldFailover()) {
            return Optional.empty();
        }

        Optional<String> target = healthMonitorService.getBestFailoverTarget(regionId);
        if (target.isEmpty()) {
            log.error("No healthy failover target available for region {}", regionId);
            meterRegistry.counter("failover.no_target", "region", regionId).increment();
            return Optional.empty();
        }

        log.warn("Triggering automatic failover of region {} to {}: {}", regionId, target.get(), decision.getReason());
        return Optional.of(executeFailover(regionId, target.get(), FailoverReason.HEALTH_CHECK_FAILED, SYSTEM_ACTOR));
    }

    /**
     * Reverse a completed failover
     */
    public FailoverResult rollbackFailover(String eventId) {
        FailoverEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new FailoverEventNotFoundException(eventId));

        if (event.getStatus() != FailoverStatus.COMPLETED) {
            throw new FailoverConflictException(
                    "Can only rollback completed failovers, event " + eventId + " is " + event.getStatus());
        }

        log.info("Rolling back failover {}: {} -> {}", eventId, event.getToRegionId(), event.getFromRegionId());
        return executeFailover(event.getToRegionId(), event.getFromRegionId(), FailoverReason.ROLLBACK, SYSTEM_ACTOR);
    }

    public FailoverStatusResponse getFailoverStatus() {
        Optional<FailoverEvent> active = eventRepository.findActive();
        if (active.isEmpty()) {
            return FailoverStatusResponse.idle();
        }

        FailoverEvent event = active.get();
        return FailoverStatusResponse.builder()
                .inProgress(true)
                .currentEvent(FailoverStatusResponse.CurrentFailover.builder()
                        .id(event.getId())
                        .fromRegion(regionName(event.getFromRegionId()))
                        .toRegion(regionName(event.getToRegionId()))
                        .status(event.getStatus())
                        .startedAt(event.getStartedAt())
                        .progress(event.getStatus() == FailoverStatus.IN_PROGRESS ? 50 : 0)
                        .build())
                .build();
    }

    public MaintenanceScheduleResult scheduleMaintenanceFailover(String regionId, Instant scheduledTime,
                                                                 int estimatedDurationMinutes) {
        return scheduleMaintenanceFailover(regionId, scheduledTime, estimatedDurationMinutes, SYSTEM_ACTOR);
    }

    /**
     * Record a PENDING maintenance cutover and put the region in maintenance.
     * Without a healthy target nothing is changed.
     */
    @Transactional
    public MaintenanceScheduleResult scheduleMaintenanceFailover(String regionId, Instant scheduledTime,
                                                                 int estimatedDurationMinutes, String triggeredBy) {
        Region region = regionRepository.findById(regionId)
                .orElseThrow(() -> new RegionNotFoundException(regionId));

        Optional<String> target = healthMonitorService.getBestFailoverTarget(regionId);
        if (target.isEmpty()) {
            log.warn("Maintenance failover for region {} not scheduled: no healthy target", region.getName());
            return MaintenanceScheduleResult.notScheduled();
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("scheduledTime", scheduledTime.toString());
        metadata.put("estimatedDuration", estimatedDurationMinutes);

        FailoverEvent event = claim(region.getId(), target.get(), FailoverReason.SCHEDULED_MAINTENANCE,
                triggeredBy, FailoverStatus.PENDING, metadata);
        regionRepository.applyOperationalStatus(region.getId(), RegionStatus.MAINTENANCE);

        eventPublisher.publishEvent(new RegionStateChangedEvent(region.getId(), "maintenance scheduled"));
        log.info("Maintenance failover {} scheduled for {} at {} ({} min), target {}",
                event.getId(), region.getName(), scheduledTime, estimatedDurationMinutes, target.get());

        return new MaintenanceScheduleResult(true, event.getId(), target.get());
    }

    /**
     * Run a PENDING event now
     *
     * @throws FailoverConflictException if the event is no longer pending
     */
    public FailoverResult startScheduledFailover(String eventId) {
        FailoverEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new FailoverEventNotFoundException(eventId));

        return traced(event.getReason(), event.getFromRegionId(), event.getToRegionId(), () -> {
            long startMs = System.currentTimeMillis();
            Span.current().setAttribute("failover.event_id", eventId);

            Region from = requireRegion(event.getFromRegionId(), "source");
            Region to = requireRegion(event.getToRegionId(), "target");

            if (!eventRepository.markInProgress(eventId)) {
                throw new FailoverConflictException(
                        "Failover event " + eventId + " is not pending (status " + event.getStatus() + ")");
            }
            event.setStatus(FailoverStatus.IN_PROGRESS);

            log.info("Scheduled failover {} started: {} -> {}", eventId, from.getName(), to.getName());
            return runProtocol(event, from, to, startMs);
        });
    }

    /**
     * Cancel a PENDING event. Returns false for unknown or non-pending events.
     * A region put into maintenance by the event stays there until maintenance is ended.
     */
    public boolean cancelFailover(String eventId) {
        boolean cancelled = eventRepository.markCancelled(eventId);

        if (cancelled) {
            log.info("Failover {} cancelled", eventId);
            eventRepository.findById(eventId).ifPresent(event ->
                    eventPublisher.publishEvent(new RegionStateChangedEvent(event.getFromRegionId(), "failover cancelled")));
        } else {
            log.debug("Failover {} not cancelled: unknown or not pending", eventId);
        }
        return cancelled;
    }

    public List<FailoverEvent> getFailoverHistory(Integer limit) {
        int effective = limit == null ? DEFAULT_HISTORY_LIMIT : Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return eventRepository.findRecent(effective);
    }

    /**
     * Lift a MAINTENANCE override so the region is probed and eligible again
     */
    public Region endMaintenance(String regionId) {
        Region region = regionRepository.findById(regionId)
                .orElseThrow(() -> new RegionNotFoundException(regionId));

        if (!region.isInMaintenance()) {
            return region;
        }

        Optional<FailoverEvent> pending = eventRepository.findActive()
                .filter(e -> e.getStatus() == FailoverStatus.PENDING)
                .filter(e -> e.getReason() == FailoverReason.SCHEDULED_MAINTENANCE)
                .filter(e -> regionId.equals(e.getFromRegionId()));
        if (pending.isPresent()) {
            throw new FailoverConflictException(
                    "Region " + region.getName() + " has a pending maintenance failover: " + pending.get().getId(),
                    pending.get().getId());
        }

        regionRepository.clearOperationalStatus(regionId);
        eventPublisher.publishEvent(new RegionStateChangedEvent(regionId, "maintenance ended"));
        log.info("Maintenance ended for region {}", region.getName());

        return regionRepository.findById(regionId).orElse(region);
    }

    // Steps 3-8. Any exception goes through the failure handler and is re-thrown.
    private FailoverResult runProtocol(FailoverEvent event, Region from, Region to, long startMs) {
        try {
            // 3. take the source out of rotation
            RegionStatus sourceStatus = event.getReason() == FailoverReason.SCHEDULED_MAINTENANCE
                    ? RegionStatus.MAINTENANCE
                    : RegionStatus.UNHEALTHY;
            regionRepository.demote(from.getId(), sourceStatus);

            // 4. count what is being moved
            AffectedResources affected = affectedResourceRepository.countForRegion(from.getId());
            eventRepository.updateAffectedResources(event.getId(), affected.getProjects(), affected.getDeployments());

            // 5. move traffic
            redirect(from, to);

            // 6. promote the target
            regionRepository.promote(to.getId());

            // 7. wait for the control plane to report the new route
            boolean confirmed = waitForPropagation(to);
            Map<String, Object> metadata = new HashMap<>(event.getMetadata());
            String warning = null;
            if (!confirmed) {
                warning = "Traffic propagation to " + to.getName() + " not confirmed within " + propagationTimeoutMs + "ms";
                metadata.put("propagationWarning", warning);
                log.warn("Failover {}: {}", event.getId(), warning);
            }

            // 8. complete
            long durationMs = System.currentTimeMillis() - startMs;
            if (!eventRepository.markCompleted(event.getId(), durationMs, metadata)) {
                throw new FailoverConflictException(
                        "Failover event " + event.getId() + " changed state during execution", event.getId());
            }

            event.setStatus(FailoverStatus.COMPLETED);
            event.setCompletedAt(Instant.now());
            event.setDurationMs(durationMs);
            event.setProjectsAffected(affected.getProjects());
            event.setDeploymentsAffected(affected.getDeployments());
            event.setMetadata(metadata);
            eventPublisher.publishEvent(new FailoverCompletedEvent(event, from.getName(), to.getName()));

            log.info("Failover {} completed: {} -> {} in {}ms ({} projects, {} deployments)",
                    event.getId(), from.getName(), to.getName(), durationMs,
                    affected.getProjects(), affected.getDeployments());

            return FailoverResult.builder()
                    .eventId(event.getId())
                    .fromRegionId(from.getId())
                    .toRegionId(to.getId())
                    .reason(event.getReason())
                    .status(FailoverStatus.COMPLETED)
                    .durationMs(durationMs)
                    .projectsAffected(affected.getProjects())
                    .deploymentsAffected(affected.getDeployments())
                    .propagationConfirmed(confirmed)
                    .propagationWarning(warning)
                    .build();

        } catch (RuntimeException e) {
            recordFailure(event, from, to, startMs, e);
            throw e;
        }
    }

    private void redirect(Region from, Region to) {
        try {
            trafficManager.redirectTraffic(from, to);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalServiceException("Traffic redirect " + from.getName() + " -> " + to.getName()
                    + " failed: " + e.getMessage(), e);
        }
    }

    private boolean waitForPropagation(Region target) {
        long deadline = System.currentTimeMillis() + propagationTimeoutMs;

        while (System.currentTimeMillis() < deadline) {
            try {
                PropagationStatus status = trafficManager.getPropagationStatus(target);
                if (status.isPropagated()) {
                    return true;
                }
                log.debug("Propagation to {} pending: {}", target.getName(), status.getDetail());
            } catch (RuntimeException e) {
                log.debug("Propagation check for {} failed: {}", target.getName(), e.getMessage());
            }

            try {
                Thread.sleep(propagationPollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    private void recordFailure(FailoverEvent event, Region from, Region to, long startMs, RuntimeException error) {
        long durationMs = System.currentTimeMillis() - startMs;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        try {
            if (eventRepository.markFailed(event.getId(), message, durationMs)) {
                regionRepository.applyOperationalStatus(from.getId(), RegionStatus.DEGRADED);
            } else {
                log.warn("Failover {} was no longer active when it failed; leaving {} unchanged",
                        event.getId(), from.getName());
            }
        } catch (DataAccessException persistenceError) {
            log.error("Could not record failure of failover {}", event.getId(), persistenceError);
            error.addSuppressed(persistenceError);
        }

        event.setStatus(FailoverStatus.FAILED);
        event.setError(message);
        event.setDurationMs(durationMs);
        event.setCompletedAt(Instant.now());
        eventPublisher.publishEvent(new FailoverFailedEvent(event, from.getName(), to.getName(), message));

        log.error("Failover {} from {} to {} failed after {}ms", event.getId(), from.getName(), to.getName(),
                durationMs, error);
    }

    private FailoverEvent claim(String fromRegionId, String toRegionId, FailoverReason reason, String triggeredBy,
                                FailoverStatus status, Map<String, Object> metadata) {
        Optional<FailoverEvent> active = eventRepository.findActive();
        if (active.isPresent()) {
            throw FailoverConflictException.alreadyRunning(active.get().getId());
        }

        FailoverEvent event = FailoverEvent.builder()
                .id(UUID.randomUUID().toString())
                .fromRegionId(fromRegionId)
                .toRegionId(toRegionId)
                .reason(reason)
                .triggeredBy(triggeredBy)
                .status(status)
                .startedAt(Instant.now())
                .metadata(metadata)
                .build();

        try {
            return eventRepository.insert(event);
        } catch (DuplicateKeyException e) {
            String activeId = activeEventIdAfterDuplicate();
            String message = activeId != null
                    ? "Failover already in progress: " + activeId
                    : "Failover already in progress";
            throw new FailoverConflictException(message, activeId, e);
        }
    }

    /**
     * The failed insert poisons an enclosing transaction on PostgreSQL, so the winner is only
     * looked up when no transaction is active.
     */
    private String activeEventIdAfterDuplicate() {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return null;
        }
        try {
            return eventRepository.findActive().map(FailoverEvent::getId).orElse(null);
        } catch (DataAccessException lookupError) {
            log.warn("Could not look up the active failover after a duplicate claim: {}", lookupError.getMessage());
            return null;
        }
    }

    private FailoverResult traced(FailoverReason reason, String fromRegionId, String toRegionId,
                                  Supplier<FailoverResult> body) {
        Span span = tracer.spanBuilder("failover.execute")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        long startMs = System.currentTimeMillis();
        String outcome = "completed";

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("failover.reason", reason.name());
            span.setAttribute("failover.from_region", fromRegionId);
            span.setAttribute("failover.to_region", toRegionId);

            return body.get();

        } catch (FailoverValidationException | RegionNotFoundException e) {
            outcome = "rejected";
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } catch (FailoverConflictException e) {
            outcome = "conflict";
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "failed";
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failover failed");
            throw e;
        } finally {
            meterRegistry.counter("failover.executions",
                    "reason", reason.name(),
                    "outcome", outcome
            ).increment();
            meterRegistry.timer("failover.duration", "reason", reason.name())
                    .record(Duration.ofMillis(System.currentTimeMillis() - startMs));
            span.end();
        }
    }

    private Region requireRegion(String regionId, String role) {
        if (regionId == null || regionId.isBlank()) {
            throw new FailoverValidationException("Invalid region IDs: " + role + " region is required");
        }
        return regionRepository.findById(regionId)
                .orElseThrow(() -> new FailoverValidationException(
                        "Invalid region IDs: " + role + " region " + regionId + " not found"));
    }

    private String regionName(String regionId) {
        return regionRepository.findById(regionId).map(Region::getName).orElse(regionId);
    }
}
