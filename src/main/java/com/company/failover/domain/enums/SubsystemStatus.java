package com.company.failover.domain.enums;

public enum SubsystemStatus {
    OK,
    ERROR,
    TIMEOUT;

    public static SubsystemStatus fromString(String status) {
        if (status == null) {
            return ERROR;
        }
        try {
            return SubsystemStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ERROR;
        }
    }
}
