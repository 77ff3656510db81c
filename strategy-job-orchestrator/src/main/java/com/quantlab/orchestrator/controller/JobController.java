package com.quantlab.orchestrator.controller;

import com.quantlab.orchestrator.controller.dto.JobResponse;
import com.quantlab.orchestrator.controller.dto.JobSubmissionRequest;
import com.quantlab.orchestrator.service.JobOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for strategy job operations.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobOrchestrator jobOrchestrator;

    /**
     * Submit a job for a strategy.
     *
     * @param strategyId the strategy ID
     * @param request    the job submission request
     * @return the job, RUNNING if dispatched or PENDING if queued for a free slot
     */
    @PostMapping("/strategies/{strategyId}/jobs")
    public ResponseEntity<JobResponse> submitJob(@PathVariable Long strategyId,
                                                 @Valid @RequestBody JobSubmissionRequest request) {

        log.info("POST /strategies/{}/jobs - Kind: {}, Owner: {}", strategyId, request.getKind(), request.getOwnerId());

        JobResponse response = JobResponse.from(jobOrchestrator.submitJob(
                strategyId, request.getOwnerId(), request.getKind(), request.getConfig()));

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/strategies/{strategyId}/jobs")
    public ResponseEntity<List<JobResponse>> listJobs(@PathVariable Long strategyId) {
        log.debug("GET /strategies/{}/jobs", strategyId);
        return ResponseEntity.ok(jobOrchestrator.listJobs(strategyId).stream().map(JobResponse::from).toList());
    }

    /**
     * Cancel every active job of a strategy and stop it.
     */
    @DeleteMapping("/strategies/{strategyId}/jobs/active")
    public ResponseEntity<Map<String, Object>> retireStrategy(@PathVariable Long strategyId) {
        log.info("DELETE /strategies/{}/jobs/active - Retiring strategy", strategyId);
        int cancelled = jobOrchestrator.retireStrategy(strategyId);
        return ResponseEntity.ok(Map.of("strategyId", strategyId, "cancelledJobs", cancelled));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobResponse> getJob(@PathVariable Long jobId) {
        log.debug("GET /jobs/{}", jobId);
        return ResponseEntity.ok(JobResponse.from(jobOrchestrator.getJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<JobResponse> cancelJob(@PathVariable Long jobId) {
        log.info("POST /jobs/{}/cancel", jobId);
        return ResponseEntity.ok(JobResponse.from(jobOrchestrator.cancelJob(jobId)));
    }
}
