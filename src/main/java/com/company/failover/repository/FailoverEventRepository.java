package com.company.failover.repository;

import com.company.failover.domain.FailoverEvent;
import com.company.failover.domain.enums.FailoverReason;
import com.company.failover.domain.enums.FailoverStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Failover events. The active_slot column carries the "one non-terminal event"
 * invariant: it is 1 for PENDING/IN_PROGRESS rows and NULL otherwise, and is
 * unique. Every status change is a compare-and-set on the current status.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class FailoverEventRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_BASE = """
        SELECT id, from_region_id, to_region_id, reason, triggered_by, status,
               started_at, completed_at, duration_ms,
               projects_affected, deployments_affected, error, metadata
        FROM failover_events
        """;

    /**
     * Insert a new event. A non-terminal event claims the active slot, so a
     * second concurrent claim fails here.
     *
     * @throws DuplicateKeyException if another non-terminal event exists
     */
    public FailoverEvent insert(FailoverEvent event) throws DuplicateKeyException {
        if (event.getStartedAt() == null) {
            event.setStartedAt(Instant.now());
        }

        String sql = """
            INSERT INTO failover_events (
                id, from_region_id, to_region_id, reason, triggered_by, status, active_slot,
                started_at, completed_at, duration_ms,
                projects_affected, deployments_affected, error, metadata
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                event.getId(),
                event.getFromRegionId(),
                event.getToRegionId(),
                event.getReason().name(),
                event.getTriggeredBy(),
                event.getStatus().name(),
                event.getStatus().isTerminal() ? null : 1,
                Timestamp.from(event.getStartedAt()),
                toTimestamp(event.getCompletedAt()),
                event.getDurationMs(),
                event.getProjectsAffected(),
                event.getDeploymentsAffected(),
                event.getError(),
                writeMetadata(event.getMetadata())
        );

        return event;
    }

    public Optional<FailoverEvent> findById(String eventId) {
        List<FailoverEvent> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE id = ?", new FailoverEventRowMapper(), eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * The event currently holding the active slot, if any
     */
    public Optional<FailoverEvent> findActive() {
        List<FailoverEvent> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE active_slot = 1", new FailoverEventRowMapper());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<FailoverEvent> findRecent(int limit) {
        String sql = SELECT_BASE + " ORDER BY started_at DESC, id DESC LIMIT ?";
        return jdbcTemplate.query(sql, new FailoverEventRowMapper(), limit);
    }

    public List<FailoverEvent> findRecentForRegion(String regionId, int limit) {
        String sql = SELECT_BASE + """
             WHERE from_region_id = ? OR to_region_id = ?
             ORDER BY started_at DESC, id DESC
             LIMIT ?
            """;
        return jdbcTemplate.query(sql, new FailoverEventRowMapper(), regionId, regionId, limit);
    }

    public void updateAffectedResources(String eventId, int projectsAffected, int deploymentsAffected) {
        jdbcTemplate.update("""
            UPDATE failover_events
            SET projects_affected = ?, deployments_affected = ?
            WHERE id = ?
            """, projectsAffected, deploymentsAffected, eventId);
    }

    /**
     * PENDING -> IN_PROGRESS. The slot stays claimed.
     *
     * @return true if this call performed the transition
     */
    public boolean markInProgress(String eventId) {
        int updated = jdbcTemplate.update("""
            UPDATE failover_events
            SET status = 'IN_PROGRESS'
            WHERE id = ? AND status = 'PENDING'
            """, eventId);
        return updated == 1;
    }

    public boolean markCompleted(String eventId, long durationMs, Map<String, Object> metadata) {
        int updated = jdbcTemplate.update("""
            UPDATE failover_events
            SET status = 'COMPLETED', active_slot = NULL, completed_at = ?, duration_ms = ?, metadata = ?
            WHERE id = ? AND status = 'IN_PROGRESS'
            """, Timestamp.from(Instant.now()), durationMs, writeMetadata(metadata), eventId);
        return updated == 1;
    }

    public boolean markFailed(String eventId, String error, long durationMs) {
        int updated = jdbcTemplate.update("""
            UPDATE failover_events
            SET status = 'FAILED', active_slot = NULL, completed_at = ?, duration_ms = ?, error = ?
            WHERE id = ? AND status IN ('PENDING', 'IN_PROGRESS')
            """, Timestamp.from(Instant.now()), durationMs, truncate(error, 2048), eventId);
        return updated == 1;
    }

    public boolean markCancelled(String eventId) {
        int updated = jdbcTemplate.update("""
            UPDATE failover_events
            SET status = 'CANCELLED', active_slot = NULL, completed_at = ?
            WHERE id = ? AND status = 'PENDING'
            """, Timestamp.from(Instant.now()), eventId);
        return updated == 1;
    }

    public long countActive() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM failover_events WHERE status IN ('PENDING', 'IN_PROGRESS')",
                Long.class);
        return count != null ? count : 0L;
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failover metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable failover metadata, ignoring: {}", e.getMessage());
            return new HashMap<>();
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private class FailoverEventRowMapper implements RowMapper<FailoverEvent> {
        @Override
        public FailoverEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp completedAt = rs.getTimestamp("completed_at");
            return FailoverEvent.builder()
                    .id(rs.getString("id"))
                    .fromRegionId(rs.getString("from_region_id"))
                    .toRegionId(rs.getString("to_region_id"))
                    .reason(FailoverReason.fromString(rs.getString("reason")))
                    .triggeredBy(rs.getString("triggered_by"))
                    .status(FailoverStatus.fromString(rs.getString("status")))
                    .startedAt(rs.getTimestamp("started_at").toInstant())
                    .completedAt(completedAt != null ? completedAt.toInstant() : null)
                    .durationMs(rs.getObject("duration_ms", Long.class))
                    .projectsAffected(rs.getObject("projects_affected", Integer.class))
                    .deploymentsAffected(rs.getObject("deployments_affected", Integer.class))
                    .error(rs.getString("error"))
                    .metadata(readMetadata(rs.getString("metadata")))
                    .build();
        }
    }
}
