package com.quantlab.orchestrator.controller.dto;

import com.quantlab.orchestrator.domain.JobKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for submitting a job for a strategy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobSubmissionRequest {

    @NotNull(message = "Job kind is required")
    private JobKind kind;

    @NotNull(message = "Owner ID is required")
    @Positive(message = "Owner ID must be positive")
    private Long ownerId;

    @NotNull(message = "Config is required")
    private Map<String, Object> config;
}
