package com.quantlab.orchestrator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body returned by the compute service status endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteStatusResponse {

    @JsonProperty("remote_status")
    private String remoteStatus;

    @JsonProperty("progress")
    private Double progress;

    @JsonProperty("logs_delta")
    private String logsDelta;

    @JsonProperty("metrics_delta")
    private Map<String, Object> metricsDelta;

    @JsonProperty("terminal")
    private Boolean terminal;

    @JsonProperty("error")
    private String error;
}
