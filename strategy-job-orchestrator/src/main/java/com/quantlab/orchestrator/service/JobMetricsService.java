package com.quantlab.orchestrator.service;

import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.infrastructure.ActiveJobIndex;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking job orchestration metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class JobMetricsService {

    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter jobsCancelledCounter;
    private final Counter submitRetriedCounter;
    private final Counter conflictsCounter;
    private final Timer durationTimer;

    public JobMetricsService(MeterRegistry meterRegistry, ActiveJobIndex activeJobIndex) {
        this.jobsSubmittedCounter = Counter.builder("orchestrator.jobs.submitted")
                .description("Total number of jobs accepted for dispatch")
                .register(meterRegistry);

        this.jobsCompletedCounter = Counter.builder("orchestrator.jobs.completed")
                .description("Total number of jobs completed successfully")
                .register(meterRegistry);

        this.jobsFailedCounter = Counter.builder("orchestrator.jobs.failed")
                .description("Total number of jobs that ended in FAILED")
                .register(meterRegistry);

        this.jobsCancelledCounter = Counter.builder("orchestrator.jobs.cancelled")
                .description("Total number of jobs cancelled")
                .register(meterRegistry);

        this.submitRetriedCounter = Counter.builder("orchestrator.jobs.submit.retried")
                .description("Total number of submit retries after transient gateway errors")
                .register(meterRegistry);

        this.conflictsCounter = Counter.builder("orchestrator.jobs.conflicts")
                .description("Total number of submissions rejected because the strategy had an active job")
                .register(meterRegistry);

        this.durationTimer = Timer.builder("orchestrator.jobs.duration")
                .description("Remote execution time of finished jobs")
                .register(meterRegistry);

        Gauge.builder("orchestrator.jobs.active", activeJobIndex, ActiveJobIndex::size)
                .description("Jobs currently being polled")
                .register(meterRegistry);

        log.info("JobMetricsService initialized with Micrometer metrics");
    }

    public void recordJobSubmitted() {
        jobsSubmittedCounter.increment();
    }

    public void recordConflict() {
        conflictsCounter.increment();
    }

    public void recordSubmitRetried() {
        submitRetriedCounter.increment();
    }

    /**
     * Record a job that reached a terminal status.
     */
    public void recordJobFinished(Job job) {
        switch (job.getStatus()) {
            case COMPLETED -> jobsCompletedCounter.increment();
            case FAILED -> jobsFailedCounter.increment();
            case CANCELLED -> jobsCancelledCounter.increment();
            default -> {
                log.warn("Ignoring finish metric for job {} in status {}", job.getId(), job.getStatus());
                return;
            }
        }
        if (job.getDurationSeconds() != null) {
            durationTimer.record(job.getDurationSeconds(), TimeUnit.SECONDS);
        }
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Submitted=%d, Completed=%d, Failed=%d, Cancelled=%d, Retried=%d, Conflicts=%d",
                (long) jobsSubmittedCounter.count(),
                (long) jobsCompletedCounter.count(),
                (long) jobsFailedCounter.count(),
                (long) jobsCancelledCounter.count(),
                (long) submitRetriedCounter.count(),
                (long) conflictsCounter.count());
    }
}
