package com.quantlab.orchestrator.exception;

/**
 * Timeout, I/O error or retryable HTTP status from the compute service.
 * Callers decide whether and when to retry.
 */
public class TransientGatewayException extends GatewayException {

    public TransientGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientGatewayException(String message) {
        super(message, null);
    }
}
