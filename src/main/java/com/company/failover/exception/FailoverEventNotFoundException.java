package com.company.failover.exception;

public class FailoverEventNotFoundException extends RuntimeException {
    public FailoverEventNotFoundException(String eventId) {
        super("Failover event not found: " + eventId);
    }
}
