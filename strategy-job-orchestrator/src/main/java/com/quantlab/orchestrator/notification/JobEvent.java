package com.quantlab.orchestrator.notification;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Job state change pushed to subscribers. Serialized with snake_case field names.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobEvent {

    JobEventType type;
    Long jobId;
    Long strategyId;
    JobKind kind;
    JobStatus status;
    double progress;
    LocalDateTime timestamp;
    String error;

    public static JobEvent of(JobEventType type, Job job, LocalDateTime timestamp) {
        return JobEvent.builder()
                .type(type)
                .jobId(job.getId())
                .strategyId(job.getStrategyId())
                .kind(job.getKind())
                .status(job.getStatus())
                .progress(job.getProgress() != null ? job.getProgress() : 0.0)
                .timestamp(timestamp)
                .error(job.getErrorMessage())
                .build();
    }
}
