package com.quantlab.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Response DTO describing a job. Config and metrics are passed through as raw JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobResponse {

    private Long jobId;
    private Long strategyId;
    private Long ownerId;
    private JobKind kind;
    private JobStatus status;
    private Double progress;
    private String externalHandle;
    private String errorMessage;
    private Integer retryCount;

    @JsonRawValue
    private String config;

    @JsonRawValue
    private String metrics;

    private String logs;
    private Long durationSeconds;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static JobResponse from(Job job) {
        return JobResponse.builder()
                .jobId(job.getId())
                .strategyId(job.getStrategyId())
                .ownerId(job.getOwnerId())
                .kind(job.getKind())
                .status(job.getStatus())
                .progress(job.getProgress())
                .externalHandle(job.getExternalHandle())
                .errorMessage(job.getErrorMessage())
                .retryCount(job.getRetryCount())
                .config(job.getConfigJson())
                .metrics(job.getMetricsJson())
                .logs(job.getLogs())
                .durationSeconds(job.getDurationSeconds())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
