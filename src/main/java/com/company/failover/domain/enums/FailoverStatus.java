package com.company.failover.domain.enums;

public enum FailoverStatus {
    PENDING("Scheduled, waiting to start"),
    IN_PROGRESS("Cutover is running"),
    COMPLETED("Cutover finished"),
    FAILED("Cutover aborted with an error"),
    CANCELLED("Scheduled cutover was cancelled");

    private final String description;

    FailoverStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static FailoverStatus fromString(String status) {
        return FailoverStatus.valueOf(status.toUpperCase());
    }
}
