package com.quantlab.orchestrator.exception;

/**
 * The job store could not complete an operation. Nothing was applied; retry the whole request.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
