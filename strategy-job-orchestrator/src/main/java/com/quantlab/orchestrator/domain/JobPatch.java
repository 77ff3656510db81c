package com.quantlab.orchestrator.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Field changes applied together with a status compare-and-swap.
 * Null fields are left untouched; {@code logDelta} is appended and {@code metricsDelta} merged.
 */
@Value
@Builder
public class JobPatch {

    public static final JobPatch EMPTY = JobPatch.builder().build();

    String externalHandle;
    LocalDateTime startedAt;
    LocalDateTime lastPolledAt;
    Double progress;
    String errorMessage;
    Integer retryCount;
    String logDelta;
    Map<String, Object> metricsDelta;
}
