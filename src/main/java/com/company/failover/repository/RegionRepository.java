package com.company.failover.repository;

import com.company.failover.domain.Region;
import com.company.failover.domain.enums.RegionStatus;
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
import java.util.Optional;

/**
 * Region rows. Health columns and operational columns have separate writers:
 * the prober calls {@link #updateHealthSignal}, the orchestrator the override methods.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RegionRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, name, display_name, endpoint,
               health_status, last_health_check,
               operational_status, operational_status_at,
               is_primary, priority, active_deployments, max_deployments,
               created_at, updated_at
        FROM regions
        """;

    public Optional<Region> findById(String regionId) {
        String sql = SELECT_BASE + " WHERE id = ?";

        List<Region> results = jdbcTemplate.query(sql, new RegionRowMapper(), regionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Region> findByName(String name) {
        String sql = SELECT_BASE + " WHERE name = ?";

        List<Region> results = jdbcTemplate.query(sql, new RegionRowMapper(), name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Region> findAll() {
        String sql = SELECT_BASE + " ORDER BY is_primary DESC, priority ASC, name ASC";
        return jdbcTemplate.query(sql, new RegionRowMapper());
    }

    /**
     * Regions the prober should visit: everything not held in maintenance
     */
    public List<Region> findProbeable() {
        String sql = SELECT_BASE + """
             WHERE operational_status IS NULL OR operational_status <> 'MAINTENANCE'
             ORDER BY priority ASC, name ASC
            """;
        return jdbcTemplate.query(sql, new RegionRowMapper());
    }

    public Optional<Region> findPrimary() {
        String sql = SELECT_BASE + " WHERE is_primary = TRUE ORDER BY priority ASC";

        List<Region> results = jdbcTemplate.query(sql, new RegionRowMapper());
        if (results.size() > 1) {
            log.warn("Found {} primary regions, expected at most one", results.size());
        }
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Region create(Region region) {
        Instant now = Instant.now();
        region.setCreatedAt(now);
        region.setUpdatedAt(now);
        if (region.getHealthStatus() == null) {
            region.setHealthStatus(RegionStatus.HEALTHY);
        }

        String sql = """
            INSERT INTO regions (
                id, name, display_name, endpoint,
                health_status, last_health_check,
                operational_status, operational_status_at,
                is_primary, priority, active_deployments, max_deployments,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                region.getId(),
                region.getName(),
                region.getDisplayName(),
                region.getEndpoint(),
                region.getHealthStatus().name(),
                toTimestamp(region.getLastHealthCheck()),
                region.getOperationalStatus() != null ? region.getOperationalStatus().name() : null,
                toTimestamp(region.getOperationalStatusAt()),
                region.isPrimary(),
                region.getPriority() != null ? region.getPriority() : 100,
                region.getActiveDeployments() != null ? region.getActiveDeployments() : 0,
                region.getMaxDeployments(),
                Timestamp.from(region.getCreatedAt()),
                Timestamp.from(region.getUpdatedAt())
        );

        return region;
    }

    /**
     * Prober-owned columns
     */
    public void updateHealthSignal(String regionId, RegionStatus healthStatus, Instant checkedAt) {
        String sql = """
            UPDATE regions
            SET health_status = ?, last_health_check = ?, updated_at = ?
            WHERE id = ?
            """;

        jdbcTemplate.update(sql,
                healthStatus.name(),
                Timestamp.from(checkedAt),
                Timestamp.from(Instant.now()),
                regionId);
    }

    /**
     * Orchestrator-owned override, applied without touching primary designation
     */
    public void applyOperationalStatus(String regionId, RegionStatus status) {
        String sql = """
            UPDATE regions
            SET operational_status = ?, operational_status_at = ?, updated_at = ?
            WHERE id = ?
            """;

        Instant now = Instant.now();
        jdbcTemplate.update(sql, status.name(), Timestamp.from(now), Timestamp.from(now), regionId);
    }

    /**
     * Source side of a cutover: override status and drop primary in one statement
     */
    public void demote(String regionId, RegionStatus status) {
        String sql = """
            UPDATE regions
            SET operational_status = ?, operational_status_at = ?, is_primary = FALSE, updated_at = ?
            WHERE id = ?
            """;

        Instant now = Instant.now();
        jdbcTemplate.update(sql, status.name(), Timestamp.from(now), Timestamp.from(now), regionId);
    }

    /**
     * Target side of a cutover. A stale UNHEALTHY/DEGRADED override is dropped;
     * MAINTENANCE is kept.
     */
    public void promote(String regionId) {
        String sql = """
            UPDATE regions
            SET is_primary = TRUE,
                operational_status = CASE WHEN operational_status = 'MAINTENANCE' THEN operational_status ELSE NULL END,
                operational_status_at = CASE WHEN operational_status = 'MAINTENANCE' THEN operational_status_at ELSE NULL END,
                updated_at = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql, Timestamp.from(Instant.now()), regionId);
    }

    public int clearOperationalStatus(String regionId) {
        String sql = """
            UPDATE regions
            SET operational_status = NULL, operational_status_at = NULL, updated_at = ?
            WHERE id = ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(Instant.now()), regionId);
    }

    public long countPrimary() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM regions WHERE is_primary = TRUE", Long.class);
        return count != null ? count : 0L;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class RegionRowMapper implements RowMapper<Region> {
        @Override
        public Region mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Region.builder()
                    .id(rs.getString("id"))
                    .name(rs.getString("name"))
                    .displayName(rs.getString("display_name"))
                    .endpoint(rs.getString("endpoint"))
                    .healthStatus(RegionStatus.fromString(rs.getString("health_status")))
                    .lastHealthCheck(toInstant(rs.getTimestamp("last_health_check")))
                    .operationalStatus(RegionStatus.fromString(rs.getString("operational_status")))
                    .operationalStatusAt(toInstant(rs.getTimestamp("operational_status_at")))
                    .primary(rs.getBoolean("is_primary"))
                    .priority(rs.getInt("priority"))
                    .activeDeployments(rs.getInt("active_deployments"))
                    .maxDeployments(rs.getObject("max_deployments", Integer.class))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp timestamp) {
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
