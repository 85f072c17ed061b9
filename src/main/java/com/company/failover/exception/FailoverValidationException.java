package com.company.failover.exception;

/**
 * Bad or missing input to a failover operation (unknown region, same source and target, unhealthy target)
 */
public class FailoverValidationException extends RuntimeException {
    public FailoverValidationException(String message) {
        super(message);
    }
}
