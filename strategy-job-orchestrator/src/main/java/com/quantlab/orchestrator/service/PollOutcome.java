package com.quantlab.orchestrator.service;

/**
 * Result of one {@link JobPoller#pollOnce} call.
 */
public enum PollOutcome {
    /** Polled too recently; nothing done. */
    SKIPPED,
    /** Job still running; progress stored. */
    PROGRESS,
    /** Transient error below the failure threshold. */
    TRANSIENT_FAILURE,
    /** This call moved the job to a terminal status. */
    FINISHED,
    /** Job is gone or no longer RUNNING; removed from polling. */
    DROPPED
}
