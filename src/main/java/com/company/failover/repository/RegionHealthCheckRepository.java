package com.company.failover.repository;

import com.company.failover.domain.RegionHealthCheck;
import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.SubsystemStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Append-only health check history. Rows are never updated.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RegionHealthCheckRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, region_id, status, latency_ms,
               api_status, database_status, storage_status, cache_status,
               error, error_type, created_at
        FROM region_health_checks
        """;

    public RegionHealthCheck save(RegionHealthCheck check) {
        if (check.getCreatedAt() == null) {
            check.setCreatedAt(Instant.now());
        }

        String sql = """
            INSERT INTO region_health_checks (
                region_id, status, latency_ms,
                api_status, database_status, storage_status, cache_status,
                error, error_type, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                check.getRegionId(),
                check.getStatus().name(),
                check.getLatencyMs() != null ? check.getLatencyMs() : 0L,
                check.getApiStatus().name(),
                check.getDatabaseStatus().name(),
                check.getStorageStatus().name(),
                check.getCacheStatus().name(),
                truncate(check.getError(), 1024),
                check.getErrorType(),
                Timestamp.from(check.getCreatedAt())
        );

        return check;
    }

    /**
     * Most recent checks first. Rows written in the same instant are ordered by id.
     */
    public List<RegionHealthCheck> findRecent(String regionId, int limit) {
        String sql = SELECT_BASE + """
             WHERE region_id = ?
             ORDER BY created_at DESC, id DESC
             LIMIT ?
            """;
        return jdbcTemplate.query(sql, new RegionHealthCheckRowMapper(), regionId, limit);
    }

    public List<RegionHealthCheck> findSince(String regionId, Instant since) {
        String sql = SELECT_BASE + """
             WHERE region_id = ?
             AND created_at >= ?
             ORDER BY created_at DESC, id DESC
            """;
        return jdbcTemplate.query(sql, new RegionHealthCheckRowMapper(), regionId, Timestamp.from(since));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM region_health_checks WHERE created_at < ?",
                Timestamp.from(cutoff));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static class RegionHealthCheckRowMapper implements RowMapper<RegionHealthCheck> {
        @Override
        public RegionHealthCheck mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RegionHealthCheck.builder()
                    .id(rs.getLong("id"))
                    .regionId(rs.getString("region_id"))
                    .status(HealthCheckStatus.fromString(rs.getString("status")))
                    .latencyMs(rs.getLong("latency_ms"))
                    .apiStatus(SubsystemStatus.fromString(rs.getString("api_status")))
                    .databaseStatus(SubsystemStatus.fromString(rs.getString("database_status")))
                    .storageStatus(SubsystemStatus.fromString(rs.getString("storage_status")))
                    .cacheStatus(SubsystemStatus.fromString(rs.getString("cache_status")))
                    .error(rs.getString("error"))
                    .errorType(rs.getString("error_type"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
