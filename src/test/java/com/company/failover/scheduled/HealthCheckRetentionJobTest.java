package com.company.failover.scheduled;

import com.company.failover.service.HealthMonitorService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Health check retention job")
class HealthCheckRetentionJobTest {

    @Mock
    private HealthMonitorService healthMonitorService;

    private SimpleMeterRegistry meterRegistry;
    private HealthCheckRetentionJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new HealthCheckRetentionJob(healthMonitorService, meterRegistry);
        ReflectionTestUtils.setField(job, "retentionDays", 7);
    }

    @Test
    @DisplayName("Should count deleted checks")
    void shouldCountDeleted() {
        when(healthMonitorService.cleanupOldHealthChecks(7)).thenReturn(42);

        job.pruneHealthChecks();

        assertThat(meterRegistry.counter("health.retention.deleted").count()).isEqualTo(42.0);
    }

    @Test
    @DisplayName("Should count a failed run instead of throwing")
    void shouldCountFailure() {
        when(healthMonitorService.cleanupOldHealthChecks(7))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        job.pruneHealthChecks();

        assertThat(meterRegistry.counter("health.retention.failures").count()).isEqualTo(1.0);
    }
}
