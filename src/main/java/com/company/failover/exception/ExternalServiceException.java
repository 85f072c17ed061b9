package com.company.failover.exception;

/**
 * Traffic control plane call failed. Retryable from the caller's point of view.
 */
public class ExternalServiceException extends RuntimeException {
    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
