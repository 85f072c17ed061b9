package com.company.failover.exception;

import lombok.Getter;

/**
 * Raised when another failover is already pending or in progress, or when an
 * event is not in a state that allows the requested transition.
 */
@Getter
public class FailoverConflictException extends RuntimeException {

    private final String activeEventId;

    public FailoverConflictException(String message) {
        this(message, null, null);
    }

    public FailoverConflictException(String message, String activeEventId) {
        this(message, activeEventId, null);
    }

    public FailoverConflictException(String message, String activeEventId, Throwable cause) {
        super(message, cause);
        this.activeEventId = activeEventId;
    }

    public static FailoverConflictException alreadyRunning(String activeEventId) {
        return new FailoverConflictException(
                "Failover already in progress: " + activeEventId, activeEventId);
    }
}
