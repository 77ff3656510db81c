package com.quantlab.orchestrator.exception;

import com.quantlab.orchestrator.domain.JobStatus;
import lombok.Getter;

@Getter
public class InvalidJobStateException extends RuntimeException {

    private final Long jobId;
    private final JobStatus status;

    public InvalidJobStateException(Long jobId, JobStatus status, String action) {
        super("Cannot " + action + " job " + jobId + " in status " + status);
        this.jobId = jobId;
        this.status = status;
    }
}
