package com.company.failover.domain.enums;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of reasons a failover can be requested for.
 * Unknown values are rejected rather than mapped to a default.
 */
public enum FailoverReason {
    HEALTH_CHECK_FAILED,
    SCHEDULED_MAINTENANCE,
    ROLLBACK,
    MANUAL;

    public static FailoverReason fromString(String reason) {
        if (reason == null) {
            throw new IllegalArgumentException("Failover reason is required");
        }
        String normalized = reason.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown failover reason: " + reason));
    }
}
