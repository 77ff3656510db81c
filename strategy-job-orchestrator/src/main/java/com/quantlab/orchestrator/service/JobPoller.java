package com.quantlab.orchestrator.service;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobPatch;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.domain.JobStatusReport;
import com.quantlab.orchestrator.exception.RemoteRejectedException;
import com.quantlab.orchestrator.exception.TransientGatewayException;
import com.quantlab.orchestrator.gateway.ComputeGateway;
import com.quantlab.orchestrator.infrastructure.ActiveJobIndex;
import com.quantlab.orchestrator.notification.JobEventPublisher;
import com.quantlab.orchestrator.repository.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Polls the compute service for one RUNNING job and records the result.
 *
 * <p>Order per call: absolute timeout check, rate limit, remote poll. Transient errors count
 * towards a per-job streak that a successful poll resets; the job fails once the streak exceeds
 * {@code max-consecutive-poll-failures}. Terminal transitions go through a status compare-and-swap,
 * so a job already finished elsewhere is dropped without side effects.
 */
@Service
@Slf4j
public class JobPoller {

    private final JobStore jobStore;
    private final ComputeGateway computeGateway;
    private final JobEventPublisher eventPublisher;
    private final JobDispatcher jobDispatcher;
    private final ActiveJobIndex activeJobIndex;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration absoluteJobTimeout;
    private final int maxConsecutiveFailures;

    public JobPoller(JobStore jobStore,
                     ComputeGateway computeGateway,
                     JobEventPublisher eventPublisher,
                     JobDispatcher jobDispatcher,
                     ActiveJobIndex activeJobIndex,
                     Clock clock,
                     OrchestratorProperties properties) {
        this.jobStore = jobStore;
        this.computeGateway = computeGateway;
        this.eventPublisher = eventPublisher;
        this.jobDispatcher = jobDispatcher;
        this.activeJobIndex = activeJobIndex;
        this.clock = clock;
        this.pollInterval = properties.getPoller().getPollInterval();
        this.absoluteJobTimeout = properties.getPoller().getAbsoluteJobTimeout();
        this.maxConsecutiveFailures = properties.getPoller().getMaxConsecutivePollFailures();
    }

    public PollOutcome pollOnce(Long jobId, PollingState state) {
        Optional<Job> found = jobStore.get(jobId);
        if (found.isEmpty()) {
            log.warn("Job {} disappeared from the store, dropping it from polling", jobId);
            activeJobIndex.remove(jobId);
            return PollOutcome.DROPPED;
        }

        Job job = found.get();
        if (job.getStatus() != JobStatus.RUNNING) {
            log.info("Job {} is {} and no longer polled", jobId, job.getStatus());
            activeJobIndex.remove(jobId);
            return PollOutcome.DROPPED;
        }

        LocalDateTime now = LocalDateTime.now(clock);

        if (job.getStartedAt() != null
                && Duration.between(job.getStartedAt(), now).compareTo(absoluteJobTimeout) > 0) {
            log.warn("Job {} exceeded absolute timeout of {}", jobId, absoluteJobTimeout);
            return fail(job, "Job timed out: exceeded absolute timeout of " + absoluteJobTimeout, now);
        }

        if (isRateLimited(job, state, now)) {
            return PollOutcome.SKIPPED;
        }
        state.markAttempt(now);

        JobStatusReport report;
        try {
            report = computeGateway.poll(job.getKind(), job.getExternalHandle());
        } catch (TransientGatewayException e) {
            int streak = state.recordFailure();
            if (streak > maxConsecutiveFailures) {
                log.error("Job {} status polling failed {} times in a row", jobId, streak);
                return fail(job, "Status polling timeout after " + streak
                        + " consecutive failures: " + e.getMessage(), now);
            }
            log.warn("Status poll of job {} failed ({}/{}): {}", jobId, streak, maxConsecutiveFailures, e.getMessage());
            return PollOutcome.TRANSIENT_FAILURE;
        } catch (RemoteRejectedException e) {
            log.error("Compute service rejected status request for job {}: {}", jobId, e.getMessage());
            return fail(job, "Remote service rejected status request: " + e.getMessage(), now);
        }

        state.resetFailures();

        if (report.isTerminal()) {
            return finish(job, report, now);
        }

        JobPatch patch = JobPatch.builder()
                .progress(report.getProgress())
                .lastPolledAt(now)
                .logDelta(report.getLogDelta())
                .metricsDelta(report.getMetricsDelta())
                .build();

        if (!jobStore.compareAndSwapStatus(jobId, JobStatus.RUNNING, JobStatus.RUNNING, patch)) {
            log.info("Job {} left RUNNING while polling, dropping it", jobId);
            activeJobIndex.remove(jobId);
            return PollOutcome.DROPPED;
        }

        jobStore.get(jobId).ifPresent(eventPublisher::publishProgress);
        return PollOutcome.PROGRESS;
    }

    private boolean isRateLimited(Job job, PollingState state, LocalDateTime now) {
        LocalDateTime last = latest(job.getLastPolledAt(), state.getLastAttemptAt());
        return last != null && now.isBefore(last.plus(pollInterval));
    }

    private PollOutcome finish(Job job, JobStatusReport report, LocalDateTime now) {
        JobPatch.JobPatchBuilder patch = JobPatch.builder()
                .lastPolledAt(now)
                .logDelta(report.getLogDelta())
                .metricsDelta(report.getMetricsDelta());

        JobStatus next;
        if (report.hasError()) {
            next = JobStatus.FAILED;
            patch.progress(report.getProgress()).errorMessage(report.getError());
        } else if (report.isRemoteCancellation()) {
            next = JobStatus.CANCELLED;
            patch.progress(report.getProgress());
        } else {
            next = JobStatus.COMPLETED;
            patch.progress(100.0);
        }

        return transitionToTerminal(job, next, patch.build());
    }

    private PollOutcome fail(Job job, String message, LocalDateTime now) {
        JobPatch patch = JobPatch.builder()
                .lastPolledAt(now)
                .errorMessage(message)
                .build();
        return transitionToTerminal(job, JobStatus.FAILED, patch);
    }

    private PollOutcome transitionToTerminal(Job job, JobStatus next, JobPatch patch) {
        if (!jobStore.compareAndSwapStatus(job.getId(), JobStatus.RUNNING, next, patch)) {
            log.info("Job {} already left RUNNING, skipping {} transition", job.getId(), next);
            activeJobIndex.remove(job.getId());
            return PollOutcome.DROPPED;
        }

        jobDispatcher.onJobFinished(job.getId());
        return PollOutcome.FINISHED;
    }

    private static LocalDateTime latest(LocalDateTime a, LocalDateTime b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
