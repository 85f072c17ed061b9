package com.company.failover.service;

import com.company.failover.domain.RegionHealthCheck;
import com.company.failover.domain.enums.HealthCheckStatus;
import com.company.failover.domain.enums.RegionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Region status rules")
class RegionStatusEvaluatorTest {

    private final RegionStatusEvaluator evaluator = new RegionStatusEvaluator();

    private static List<RegionHealthCheck> checks(HealthCheckStatus... statuses) {
        return Arrays.stream(statuses)
                .map(status -> RegionHealthCheck.builder().status(status).latencyMs(10L).build())
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("deriveStatus")
    class DeriveStatus {

        @Test
        @DisplayName("Should be HEALTHY with no history")
        void shouldBeHealthyWithoutHistory() {
            assertThat(evaluator.deriveStatus(List.of())).isEqualTo(RegionStatus.HEALTHY);
        }

        @Test
        @DisplayName("Should be DEGRADED with one failure in the window")
        void shouldBeDegradedWithOneFailure() {
            assertThat(evaluator.deriveStatus(checks(
                    HealthCheckStatus.HEALTHY, HealthCheckStatus.DEGRADED, HealthCheckStatus.HEALTHY)))
                    .isEqualTo(RegionStatus.DEGRADED);
        }

        @Test
        @DisplayName("Should be UNHEALTHY with three non-healthy checks among the last five")
        void shouldBeUnhealthyWithThreeFailures() {
            assertThat(evaluator.deriveStatus(checks(
                    HealthCheckStatus.TIMEOUT, HealthCheckStatus.HEALTHY, HealthCheckStatus.DEGRADED,
                    HealthCheckStatus.HEALTHY, HealthCheckStatus.UNHEALTHY)))
                    .isEqualTo(RegionStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("Should ignore checks beyond the window")
        void shouldIgnoreOlderChecks() {
            assertThat(evaluator.deriveStatus(checks(
                    HealthCheckStatus.HEALTHY, HealthCheckStatus.HEALTHY, HealthCheckStatus.HEALTHY,
                    HealthCheckStatus.HEALTHY, HealthCheckStatus.HEALTHY,
                    HealthCheckStatus.UNHEALTHY, HealthCheckStatus.UNHEALTHY, HealthCheckStatus.UNHEALTHY)))
                    .isEqualTo(RegionStatus.HEALTHY);
        }
    }

    @ParameterizedTest(name = "{0} failed sub-checks -> {1}")
    @CsvSource({"0, HEALTHY", "1, DEGRADED", "2, UNHEALTHY", "4, UNHEALTHY"})
    @DisplayName("aggregate should map failed sub-check counts")
    void aggregateShouldMapFailedCount(int failed, HealthCheckStatus expected) {
        assertThat(evaluator.aggregate(failed)).isEqualTo(expected);
    }

    @Nested
    @DisplayName("isSustainedOutage")
    class SustainedOutage {

        @Test
        @DisplayName("Should require three failures")
        void shouldRequireThreeChecks() {
            assertThat(evaluator.isSustainedOutage(checks(
                    HealthCheckStatus.UNHEALTHY, HealthCheckStatus.TIMEOUT))).isFalse();
        }

        @Test
        @DisplayName("Should accept UNHEALTHY and TIMEOUT as failures")
        void shouldAcceptUnhealthyAndTimeout() {
            assertThat(evaluator.isSustainedOutage(checks(
                    HealthCheckStatus.UNHEALTHY, HealthCheckStatus.TIMEOUT, HealthCheckStatus.UNHEALTHY)))
                    .isTrue();
        }

        @Test
        @DisplayName("DEGRADED should not count towards failover")
        void degradedShouldNotCount() {
            assertThat(evaluator.isSustainedOutage(checks(
                    HealthCheckStatus.UNHEALTHY, HealthCheckStatus.DEGRADED, HealthCheckStatus.UNHEALTHY)))
                    .isFalse();
        }
    }

    @Test
    @DisplayName("consecutiveFailures should count the leading non-healthy run")
    void consecutiveFailuresShouldStopAtFirstHealthy() {
        assertThat(evaluator.consecutiveFailures(checks(
                HealthCheckStatus.DEGRADED, HealthCheckStatus.TIMEOUT, HealthCheckStatus.HEALTHY,
                HealthCheckStatus.UNHEALTHY))).isEqualTo(2);
        assertThat(evaluator.consecutiveFailures(List.of())).isZero();
    }
}
