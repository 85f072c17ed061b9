package com.company.failover.service;

import com.company.failover.domain.ActivityRecord;
import com.company.failover.domain.FailoverEvent;
import com.company.failover.event.FailoverCompletedEvent;
import com.company.failover.event.FailoverFailedEvent;
import com.company.failover.repository.ActivityRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Writes failover outcomes to the activity feed. Best effort: a failed write is
 * logged and counted and never reaches the failover caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FailoverAuditListener {

    static final String ACTIVITY_TYPE = "failover";

    private final ActivityRepository activityRepository;
    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void onFailoverCompleted(FailoverCompletedEvent completed) {
        FailoverEvent event = completed.getEvent();
        String description = "Failover from " + completed.getFromRegionName()
                + " to " + completed.getToRegionName() + " completed";

        record(event, "failover.completed", description, metadata(event,
                completed.getFromRegionName(), completed.getToRegionName()));
    }

    @EventListener
    @Async
    public void onFailoverFailed(FailoverFailedEvent failed) {
        FailoverEvent event = failed.getEvent();
        String description = "Failover from " + failed.getFromRegionName()
                + " to " + failed.getToRegionName() + " failed";

        Map<String, Object> metadata = metadata(event, failed.getFromRegionName(), failed.getToRegionName());
        metadata.put("error", failed.getError());

        record(event, "failover.failed", description, metadata);
    }

    private void record(FailoverEvent event, String action, String description, Map<String, Object> metadata) {
        try {
            activityRepository.save(ActivityRecord.builder()
                    .actor(event.getTriggeredBy())
                    .type(ACTIVITY_TYPE)
                    .action(action)
                    .description(description)
                    .metadata(metadata)
                    .build());

            meterRegistry.counter("failover.audit.recorded", "action", action).increment();

        } catch (DataAccessException | IllegalArgumentException e) {
            log.warn("Failed to record {} activity for failover {}: {}", action, event.getId(), e.getMessage());
            meterRegistry.counter("failover.audit.failures", "action", action).increment();
        }
    }

    private static Map<String, Object> metadata(FailoverEvent event, String fromRegion, String toRegion) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("eventId", event.getId());
        metadata.put("fromRegion", fromRegion);
        metadata.put("toRegion", toRegion);
        metadata.put("reason", event.getReason().name());
        if (event.getDurationMs() != null) {
            metadata.put("duration", event.getDurationMs());
        }
        return metadata;
    }
}
