package com.company.failover.repository;

import com.company.failover.domain.ActivityRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

/**
 * Activity feed rows written by the failover audit listener
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ActivityRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ActivityRecord save(ActivityRecord activity) {
        if (activity.getCreatedAt() == null) {
            activity.setCreatedAt(Instant.now());
        }

        String sql = """
            INSERT INTO activities (actor, type, action, description, metadata, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                activity.getActor(),
                activity.getType(),
                activity.getAction(),
                activity.getDescription(),
                writeMetadata(activity.getMetadata()),
                Timestamp.from(activity.getCreatedAt())
        );

        return activity;
    }

    public List<ActivityRecord> findRecentByType(String type, int limit) {
        String sql = """
            SELECT id, actor, type, action, description, metadata, created_at
            FROM activities
            WHERE type = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, new ActivityRowMapper(), type, limit);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Activity metadata is not serializable", e);
        }
    }

    private class ActivityRowMapper implements RowMapper<ActivityRecord> {
        @Override
        public ActivityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> metadata = new HashMap<>();
            String json = rs.getString("metadata");
            if (json != null) {
                try {
                    metadata = objectMapper.readValue(json, METADATA_TYPE);
                } catch (JsonProcessingException e) {
                    log.warn("Unreadable activity metadata for id {}", rs.getLong("id"));
                }
            }

            return ActivityRecord.builder()
                    .id(rs.getLong("id"))
                    .actor(rs.getString("actor"))
                    .type(rs.getString("type"))
                    .action(rs.getString("action"))
                    .description(rs.getString("description"))
                    .metadata(metadata)
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
