package com.quantlab.orchestrator.exception;

/**
 * Base class for failures talking to the external compute service.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
