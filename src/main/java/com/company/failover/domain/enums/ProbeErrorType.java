package com.company.failover.domain.enums;

/**
 * Classification of a failed sub-check, stored lowercase in error_type
 */
public enum ProbeErrorType {
    HTTP,
    TIMEOUT,
    CONNECTION,
    DNS,
    SSL,
    UNKNOWN;

    public String code() {
        return name().toLowerCase();
    }
}
