package com.company.failover.scheduled;

import com.company.failover.domain.FailoverEvent;
import com.company.failover.domain.enums.FailoverStatus;
import com.company.failover.dto.response.FailoverResult;
import com.company.failover.exception.FailoverConflictException;
import com.company.failover.repository.FailoverEventRepository;
import com.company.failover.service.FailoverOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * In-process runner for scheduled maintenance failovers. Off by default; an
 * operator or external scheduler normally calls the start endpoint instead.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "failover.maintenance.scheduler.enabled",
        havingValue = "true"
)
public class MaintenanceFailoverJob {

    private final FailoverEventRepository eventRepository;
    private final FailoverOrchestrator orchestrator;

    @Scheduled(cron = "${failover.maintenance.scheduler.cron:0 * * * * *}")
    public void startDueMaintenance() {
        Optional<FailoverEvent> active;
        try {
            active = eventRepository.findActive();
        } catch (Exception e) {
            log.error("Could not load active failover event", e);
            return;
        }

        if (active.isEmpty() || active.get().getStatus() != FailoverStatus.PENDING) {
            return;
        }

        FailoverEvent event = active.get();
        Instant scheduledTime = scheduledTime(event);
        if (scheduledTime == null) {
            log.warn("Pending failover {} has no usable scheduledTime, leaving it for an operator", event.getId());
            return;
        }
        if (scheduledTime.isAfter(Instant.now())) {
            log.debug("Pending failover {} due at {}", event.getId(), scheduledTime);
            return;
        }

        log.info("Starting scheduled failover {} (due {})", event.getId(), scheduledTime);
        try {
            FailoverResult result = orchestrator.startScheduledFailover(event.getId());
            log.info("Scheduled failover {} finished with status {}", event.getId(), result.getStatus());
        } catch (FailoverConflictException e) {
            log.info("Scheduled failover {} not started: {}", event.getId(), e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled failover {} failed", event.getId(), e);
        }
    }

    private static Instant scheduledTime(FailoverEvent event) {
        Object value = event.getMetadata() != null ? event.getMetadata().get("scheduledTime") : null;
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
