package com.quantlab.orchestrator.exception;

import lombok.Getter;

/**
 * The compute service refused the request (malformed config, unknown handle).
 * Never retried.
 */
@Getter
public class RemoteRejectedException extends GatewayException {

    private final Integer statusCode;

    public RemoteRejectedException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public RemoteRejectedException(String message) {
        this(message, null, null);
    }
}
