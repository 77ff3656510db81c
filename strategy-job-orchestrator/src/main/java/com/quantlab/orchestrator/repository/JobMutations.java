package com.quantlab.orchestrator.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobPatch;
import com.quantlab.orchestrator.domain.JobStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-place changes applied to a locked {@link Job} by a job store.
 */
public final class JobMutations {

    static final int MAX_ERROR_LENGTH = 1000;

    private static final TypeReference<LinkedHashMap<String, Object>> METRICS_TYPE = new TypeReference<>() {
    };

    private JobMutations() {
    }

    /**
     * Apply a status change and its patch. The caller has already verified the expected status.
     */
    public static void transition(Job job, JobStatus next, JobPatch patch, LocalDateTime now, ObjectMapper objectMapper) {
        if (patch.getErrorMessage() != null && next != JobStatus.FAILED) {
            throw new IllegalArgumentException("Error message may only be set on transition into FAILED");
        }

        if (patch.getExternalHandle() != null) {
            job.setExternalHandle(patch.getExternalHandle());
        }
        if (patch.getStartedAt() != null) {
            job.setStartedAt(patch.getStartedAt());
        }
        if (patch.getLastPolledAt() != null) {
            job.setLastPolledAt(patch.getLastPolledAt());
        }
        if (patch.getProgress() != null) {
            job.setProgress(clampProgress(patch.getProgress()));
        }
        if (patch.getRetryCount() != null) {
            job.setRetryCount(patch.getRetryCount());
        }
        if (patch.getErrorMessage() != null) {
            job.setErrorMessage(truncate(patch.getErrorMessage()));
        }
        if (patch.getLogDelta() != null && !patch.getLogDelta().isEmpty()) {
            appendLog(job, patch.getLogDelta());
        }
        if (patch.getMetricsDelta() != null && !patch.getMetricsDelta().isEmpty()) {
            job.setMetricsJson(mergeMetrics(job.getMetricsJson(), patch.getMetricsDelta(), objectMapper));
        }

        job.setStatus(next);
        if (next.isTerminal()) {
            job.setActiveStrategyId(null);
            job.setCompletedAt(now);
            if (job.getStartedAt() != null) {
                job.setDurationSeconds(Duration.between(job.getStartedAt(), now).getSeconds());
            }
        }
        job.setUpdatedAt(now);
    }

    public static void appendLog(Job job, String text) {
        String current = job.getLogs();
        if (current == null || current.isEmpty()) {
            job.setLogs(text);
        } else if (current.endsWith("\n")) {
            job.setLogs(current + text);
        } else {
            job.setLogs(current + "\n" + text);
        }
    }

    public static double clampProgress(double progress) {
        if (Double.isNaN(progress)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, progress));
    }

    public static String truncate(String errorMessage) {
        if (errorMessage.length() > MAX_ERROR_LENGTH) {
            return errorMessage.substring(0, MAX_ERROR_LENGTH - 3) + "...";
        }
        return errorMessage;
    }

    static String mergeMetrics(String metricsJson, Map<String, Object> delta, ObjectMapper objectMapper) {
        try {
            Map<String, Object> merged = metricsJson == null || metricsJson.isBlank()
                    ? new LinkedHashMap<>()
                    : objectMapper.readValue(metricsJson, METRICS_TYPE);
            merged.putAll(delta);
            return objectMapper.writeValueAsString(merged);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to merge job metrics", e);
        }
    }
}
