package com.quantlab.orchestrator.service;

import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Per-job polling bookkeeping kept by the worker that owns the job. Not thread-safe.
 */
@Getter
public class PollingState {

    private int consecutiveFailures;
    private LocalDateTime lastAttemptAt;

    public int recordFailure() {
        return ++consecutiveFailures;
    }

    public void resetFailures() {
        consecutiveFailures = 0;
    }

    public void markAttempt(LocalDateTime at) {
        this.lastAttemptAt = at;
    }
}
