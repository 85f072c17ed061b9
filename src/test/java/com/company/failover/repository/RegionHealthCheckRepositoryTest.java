package com.company.failover.repository;

import com.company.failover.domain.RegionHealthCheck;
import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.SubsystemStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.company.failover.repository.EmbeddedSchemaSupport.region;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Region health check repository (H2)")
class RegionHealthCheckRepositoryTest {

    private EmbeddedDatabase database;
    private RegionHealthCheckRepository repository;
    private final Instant now = Instant.now();

    @BeforeEach
    void setUp() {
        database = EmbeddedSchemaSupport.newDatabase();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(database);
        repository = new RegionHealthCheckRepository(jdbcTemplate);

        RegionRepository regions = new RegionRepository(jdbcTemplate);
        regions.create(region("eu", "eu-west", 1, true));
        regions.create(region("us", "us-east", 2, false));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private RegionHealthCheck save(String regionId, HealthCheckStatus status, Instant at) {
        SubsystemStatus sub = status == HealthCheckStatus.HEALTHY ? SubsystemStatus.OK : SubsystemStatus.ERROR;
        return repository.save(RegionHealthCheck.builder()
                .regionId(regionId)
                .status(status)
                .latencyMs(40L)
                .apiStatus(sub)
                .databaseStatus(sub)
                .storageStatus(SubsystemStatus.OK)
                .cacheStatus(SubsystemStatus.OK)
                .error(status == HealthCheckStatus.HEALTHY ? null : "HTTP 500")
                .errorType(status == HealthCheckStatus.HEALTHY ? null : "http")
                .createdAt(at)
                .build());
    }

    @Test
    @DisplayName("Recent checks should be newest first, per region and limited")
    void findRecentShouldOrderAndLimit() {
        save("eu", HealthCheckStatus.HEALTHY, now.minusSeconds(90));
        save("eu", HealthCheckStatus.DEGRADED, now.minusSeconds(60));
        save("eu", HealthCheckStatus.UNHEALTHY, now.minusSeconds(30));
        save("us", HealthCheckStatus.TIMEOUT, now.minusSeconds(10));

        List<RegionHealthCheck> recent = repository.findRecent("eu", 2);

        assertThat(recent).extracting(RegionHealthCheck::getStatus)
                .containsExactly(HealthCheckStatus.UNHEALTHY, HealthCheckStatus.DEGRADED);
        assertThat(recent.get(0).getError()).isEqualTo("HTTP 500");
        assertThat(recent.get(0).getErrorType()).isEqualTo("http");
        assertThat(recent.get(0).getApiStatus()).isEqualTo(SubsystemStatus.ERROR);
    }

    @Test
    @DisplayName("Checks written in the same instant should keep insertion order")
    void sameInstantShouldOrderById() {
        save("eu", HealthCheckStatus.HEALTHY, now);
        save("eu", HealthCheckStatus.TIMEOUT, now);

        assertThat(repository.findRecent("eu", 1)).extracting(RegionHealthCheck::getStatus)
                .containsExactly(HealthCheckStatus.TIMEOUT);
    }

    @Test
    @DisplayName("Window queries and retention should use created_at")
    void windowAndRetention() {
        save("eu", HealthCheckStatus.HEALTHY, now.minus(Duration.ofDays(10)));
        save("eu", HealthCheckStatus.HEALTHY, now.minus(Duration.ofHours(3)));
        save("eu", HealthCheckStatus.DEGRADED, now.minus(Duration.ofMinutes(5)));

        assertThat(repository.findSince("eu", now.minus(Duration.ofHours(1)))).hasSize(1);

        int deleted = repository.deleteOlderThan(now.minus(Duration.ofDays(7)));

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findRecent("eu", 10)).hasSize(2);
    }
}
