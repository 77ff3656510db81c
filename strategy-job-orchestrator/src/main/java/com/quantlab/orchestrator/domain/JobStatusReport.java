package com.quantlab.orchestrator.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Normalized view of one status poll against the external compute service.
 * Never persisted on its own.
 */
@Value
@Builder
public class JobStatusReport {

    String remoteStatus;
    double progress;
    String logDelta;
    @Builder.Default
    Map<String, Object> metricsDelta = Collections.emptyMap();
    boolean terminal;
    String error;

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    /**
     * Remote side stopped the job without reporting an error.
     */
    public boolean isRemoteCancellation() {
        return terminal && !hasError()
                && ("stopped".equalsIgnoreCase(remoteStatus) || "cancelled".equalsIgnoreCase(remoteStatus));
    }
}
