package com.quantlab.orchestrator.exception;

import lombok.Getter;

/**
 * Thrown when a strategy already has a PENDING or RUNNING job.
 * The caller may retry once the active job has finished.
 */
@Getter
public class ConflictingJobException extends RuntimeException {

    private final Long strategyId;
    private final Long activeJobId;

    public ConflictingJobException(Long strategyId, Long activeJobId) {
        super("Strategy " + strategyId + " already has an active job"
                + (activeJobId != null ? " (job " + activeJobId + ")" : ""));
        this.strategyId = strategyId;
        this.activeJobId = activeJobId;
    }
}
