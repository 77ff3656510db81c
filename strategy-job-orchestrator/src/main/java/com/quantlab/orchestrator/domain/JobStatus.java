package com.quantlab.orchestrator.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status enum for remote job lifecycle.
 * PENDING and RUNNING are the only non-terminal states; every allowed move is listed in
 * {@link #canTransitionTo(JobStatus)}.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, RUNNING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * PENDING may stay PENDING (retry bookkeeping) and RUNNING may stay RUNNING (progress patch).
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PENDING || next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next == RUNNING || next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
