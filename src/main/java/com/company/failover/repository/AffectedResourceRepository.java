package com.company.failover.repository;

import com.company.failover.domain.AffectedResources;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read-only view over the platform's deployments table
 */
@Repository
@RequiredArgsConstructor
public class AffectedResourceRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Live deployments served by a region and the distinct projects they belong to
     */
    public AffectedResources countForRegion(String regionId) {
        String sql = """
            SELECT COUNT(DISTINCT project_id) AS projects, COUNT(*) AS deployments
            FROM deployments
            WHERE region_id = ?
            AND status = 'READY'
            AND is_active = TRUE
            """;

        return jdbcTemplate.queryForObject(sql,
                (rs, rowNum) -> new AffectedResources(rs.getInt("projects"), rs.getInt("deployments")),
                regionId);
    }
}
