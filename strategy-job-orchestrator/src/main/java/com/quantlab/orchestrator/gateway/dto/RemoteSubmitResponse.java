package com.quantlab.orchestrator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body returned by the compute service when a job is accepted.
 * Older endpoints name the handle {@code session_id}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteSubmitResponse {

    @JsonProperty("handle")
    private String handle;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("message")
    private String message;

    public String resolveHandle() {
        if (handle != null && !handle.isBlank()) {
            return handle;
        }
        return sessionId != null && !sessionId.isBlank() ? sessionId : null;
    }
}
