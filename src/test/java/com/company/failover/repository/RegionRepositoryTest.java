package com.company.failover.repository;

import com.company.failover.domain.Region;
import com.company.failover.domain.enums.RegionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static com.company.failover.repository.EmbeddedSchemaSupport.region;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Region repository (H2)")
class RegionRepositoryTest {

    private EmbeddedDatabase database;
    private RegionRepository repository;

    @BeforeEach
    void setUp() {
        database = EmbeddedSchemaSupport.newDatabase();
        repository = new RegionRepository(new JdbcTemplate(database));

        repository.create(region("eu", "eu-west", 1, true));
        repository.create(region("us", "us-east", 2, false));
        repository.create(region("ap", "ap-south", 2, false));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Should list the primary first, then by priority and name")
    void findAllShouldOrderRegions() {
        assertThat(repository.findAll()).extracting(Region::getName)
                .containsExactly("eu-west", "ap-south", "us-east");
    }

    @Test
    @DisplayName("Should reject a second region with the same name")
    void duplicateNameShouldBeRejected() {
        assertThatThrownBy(() -> repository.create(region("eu2", "eu-west", 5, false)))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("Should look regions up by name and find the primary")
    void lookups() {
        assertThat(repository.findByName("us-east")).map(Region::getId).contains("us");
        assertThat(repository.findByName("nope")).isEmpty();
        assertThat(repository.findPrimary()).map(Region::getId).contains("eu");
        assertThat(repository.countPrimary()).isEqualTo(1);
    }

    @Test
    @DisplayName("Health signal updates should not touch the override")
    void healthSignalShouldNotTouchOverride() {
        repository.applyOperationalStatus("us", RegionStatus.DEGRADED);
        Instant checkedAt = Instant.now().minus(1, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.MILLIS);

        repository.updateHealthSignal("us", RegionStatus.UNHEALTHY, checkedAt);

        Region region = repository.findById("us").orElseThrow();
        assertThat(region.getHealthStatus()).isEqualTo(RegionStatus.UNHEALTHY);
        assertThat(region.getLastHealthCheck()).isEqualTo(checkedAt);
        assertThat(region.getOperationalStatus()).isEqualTo(RegionStatus.DEGRADED);
        assertThat(region.getStatus()).isEqualTo(RegionStatus.DEGRADED);
    }

    @Nested
    @DisplayName("Cutover updates")
    class Cutover {

        @Test
        @DisplayName("Demote should set the override and drop primary together")
        void demoteShouldDropPrimary() {
            repository.demote("eu", RegionStatus.UNHEALTHY);

            Region region = repository.findById("eu").orElseThrow();
            assertThat(region.isPrimary()).isFalse();
            assertThat(region.getOperationalStatus()).isEqualTo(RegionStatus.UNHEALTHY);
            assertThat(region.getOperationalStatusAt()).isNotNull();
            assertThat(region.getStatus()).isEqualTo(RegionStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("Promote should clear a stale UNHEALTHY override")
        void promoteShouldClearStaleOverride() {
            repository.demote("eu", RegionStatus.UNHEALTHY);

            repository.promote("eu");

            Region region = repository.findById("eu").orElseThrow();
            assertThat(region.isPrimary()).isTrue();
            assertThat(region.getOperationalStatus()).isNull();
            assertThat(region.getOperationalStatusAt()).isNull();
        }

        @Test
        @DisplayName("Promote should keep MAINTENANCE")
        void promoteShouldKeepMaintenance() {
            repository.applyOperationalStatus("us", RegionStatus.MAINTENANCE);

            repository.promote("us");

            Region region = repository.findById("us").orElseThrow();
            assertThat(region.isPrimary()).isTrue();
            assertThat(region.isInMaintenance()).isTrue();
        }
    }

    @Test
    @DisplayName("Regions in maintenance should not be probed until maintenance is cleared")
    void maintenanceShouldBeExcludedFromProbing() {
        repository.applyOperationalStatus("ap", RegionStatus.MAINTENANCE);
        repository.applyOperationalStatus("us", RegionStatus.DEGRADED);

        assertThat(repository.findProbeable()).extracting(Region::getId).containsExactly("eu", "us");

        assertThat(repository.clearOperationalStatus("ap")).isEqualTo(1);
        assertThat(repository.findProbeable()).extracting(Region::getId).containsExactly("eu", "ap", "us");
    }
}
