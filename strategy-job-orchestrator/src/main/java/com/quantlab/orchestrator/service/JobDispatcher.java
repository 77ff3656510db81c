package com.quantlab.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobPatch;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.domain.StrategyStatus;
import com.quantlab.orchestrator.exception.GatewayException;
import com.quantlab.orchestrator.exception.InvalidJobStateException;
import com.quantlab.orchestrator.exception.RemoteRejectedException;
import com.quantlab.orchestrator.exception.StorageUnavailableException;
import com.quantlab.orchestrator.exception.TransientGatewayException;
import com.quantlab.orchestrator.gateway.ComputeGateway;
import com.quantlab.orchestrator.infrastructure.ActiveJobIndex;
import com.quantlab.orchestrator.notification.JobEventPublisher;
import com.quantlab.orchestrator.repository.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates jobs, submits them to the compute service and owns every side effect of a job
 * reaching a terminal status.
 *
 * <p>Submission retries transient gateway errors with exponential backoff, at most
 * {@code max-retries} times after the first attempt. A job is dispatched by one caller at a time;
 * a job cancelled while its submit was in flight gets its remote counterpart cancelled.
 */
@Service
@Slf4j
public class JobDispatcher {

    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final JobStore jobStore;
    private final ComputeGateway computeGateway;
    private final ConcurrencyGuard concurrencyGuard;
    private final ActiveJobIndex activeJobIndex;
    private final JobEventPublisher eventPublisher;
    private final JobMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor dispatchExecutor;
    private final OrchestratorProperties.Dispatch settings;

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public JobDispatcher(JobStore jobStore,
                         ComputeGateway computeGateway,
                         ConcurrencyGuard concurrencyGuard,
                         ActiveJobIndex activeJobIndex,
                         JobEventPublisher eventPublisher,
                         JobMetricsService metricsService,
                         ObjectMapper objectMapper,
                         Clock clock,
                         @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                         OrchestratorProperties properties) {
        this.jobStore = jobStore;
        this.computeGateway = computeGateway;
        this.concurrencyGuard = concurrencyGuard;
        this.activeJobIndex = activeJobIndex;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.settings = properties.getDispatch();
    }

    /**
     * Create a PENDING job and, if a global slot is free, submit it right away.
     * Without a free slot the job stays PENDING and is picked up by {@link #dispatchBacklog()}.
     *
     * @return the job after the dispatch attempt: RUNNING, PENDING or FAILED
     * @throws com.quantlab.orchestrator.exception.ConflictingJobException if the strategy has an active job
     * @throws RemoteRejectedException if the compute service refused the submission
     */
    public Job submit(Long strategyId, Long ownerId, JobKind kind, Map<String, Object> config) {
        Job job = Job.builder()
                .strategyId(strategyId)
                .ownerId(ownerId)
                .kind(kind)
                .configJson(toJson(config))
                .maxRetries(settings.getMaxRetries())
                .build();

        Job created = concurrencyGuard.tryAcquire(job);
        Long jobId = created.getId();
        metricsService.recordJobSubmitted();

        MDC.put("jobId", String.valueOf(jobId));
        try {
            log.info("Created {} job for strategy {}", kind, strategyId);

            if (!inFlight.add(jobId)) {
                log.info("Job {} was claimed by the backlog dispatcher", jobId);
                return jobStore.require(jobId);
            }
            try {
                if (!concurrencyGuard.tryAcquireSlot(jobId)) {
                    log.info("All slots in use, job stays PENDING until one frees up");
                    return created;
                }
                return dispatchClaimed(jobId, true);
            } finally {
                inFlight.remove(jobId);
            }
        } finally {
            MDC.remove("jobId");
        }
    }

    /**
     * Hand PENDING jobs to the dispatch executor, oldest first, while global slots are free.
     * PENDING jobs whose strategy no longer exists are cancelled instead.
     *
     * @return number of jobs scheduled for dispatch
     */
    public int dispatchBacklog() {
        if (!concurrencyGuard.hasFreeSlot()) {
            return 0;
        }

        List<Job> pending = jobStore.listPendingOldestFirst(settings.getBacklogBatchSize());
        int scheduled = 0;

        for (Job job : pending) {
            Long jobId = job.getId();
            if (!inFlight.add(jobId)) {
                continue;
            }

            boolean handedOff = false;
            try {
                if (!jobStore.strategyExists(job.getStrategyId())) {
                    cancelOrphan(job);
                    continue;
                }

                if (!concurrencyGuard.tryAcquireSlot(jobId)) {
                    break;
                }

                try {
                    dispatchExecutor.execute(() -> dispatchInBackground(jobId));
                } catch (RejectedExecutionException e) {
                    log.warn("Dispatch executor rejected job {}, it stays PENDING", jobId);
                    concurrencyGuard.release(jobId);
                    break;
                }
                handedOff = true;
                scheduled++;
            } finally {
                if (!handedOff) {
                    inFlight.remove(jobId);
                }
            }
        }

        if (scheduled > 0) {
            log.info("Scheduled {} backlog job(s) for dispatch", scheduled);
        }
        return scheduled;
    }

    /**
     * Cancel a PENDING or RUNNING job. A RUNNING job's remote counterpart is asked to stop first,
     * best effort; the local transition happens regardless of the remote outcome.
     *
     * @param reason text appended to the job log
     * @return the cancelled job
     * @throws InvalidJobStateException if the job is already terminal
     */
    public Job cancel(Long jobId, String reason) {
        boolean remoteCancelRequested = false;

        for (int attempt = 0; attempt < MAX_CANCEL_ATTEMPTS; attempt++) {
            Job job = jobStore.require(jobId);
            if (job.isTerminal()) {
                throw new InvalidJobStateException(jobId, job.getStatus(), "cancel");
            }

            if (!remoteCancelRequested && job.getStatus() == JobStatus.RUNNING && job.getExternalHandle() != null) {
                cancelRemoteQuietly(job.getKind(), job.getExternalHandle());
                remoteCancelRequested = true;
            }

            JobPatch patch = JobPatch.builder().logDelta(reason).build();
            if (jobStore.compareAndSwapStatus(jobId, job.getStatus(), JobStatus.CANCELLED, patch)) {
                log.info("Job {} cancelled: {}", jobId, reason);
                return onJobFinished(jobId);
            }

            log.debug("Job {} changed status while cancelling, re-reading", jobId);
        }

        Job latest = jobStore.require(jobId);
        throw new InvalidJobStateException(jobId, latest.getStatus(), "cancel");
    }

    /**
     * Apply the side effects of a committed terminal transition. Only the caller that won the
     * transition invokes this, so each effect happens once per job.
     *
     * @return the terminal job
     */
    public Job onJobFinished(Long jobId) {
        Job job = jobStore.require(jobId);

        activeJobIndex.remove(jobId);
        concurrencyGuard.release(jobId);
        eventPublisher.publishTerminal(job);
        metricsService.recordJobFinished(job);

        StrategyStatus strategyStatus = job.getStatus() == JobStatus.FAILED
                ? StrategyStatus.ERROR
                : StrategyStatus.STOPPED;
        updateStrategyQuietly(job.getStrategyId(), strategyStatus, false);

        log.info("Job {} finished with status {}", jobId, job.getStatus());

        try {
            dispatchBacklog();
        } catch (StorageUnavailableException e) {
            log.warn("Could not read backlog after job {} finished: {}", jobId, e.getMessage());
        }
        return job;
    }

    /**
     * Re-register RUNNING jobs after a restart: they take their slot back and are polled again.
     *
     * @return number of RUNNING jobs restored
     */
    public int restoreRunningJobs() {
        int restored = 0;
        int pending = 0;

        for (Job job : jobStore.listNonTerminal()) {
            if (job.getStatus() == JobStatus.RUNNING) {
                concurrencyGuard.restoreSlot(job.getId());
                activeJobIndex.add(job.getId());
                restored++;
            } else {
                pending++;
            }
        }

        log.info("Restored {} RUNNING job(s); {} PENDING job(s) wait for dispatch", restored, pending);
        return restored;
    }

    private void dispatchInBackground(Long jobId) {
        MDC.put("jobId", String.valueOf(jobId));
        try {
            dispatchClaimed(jobId, false);
        } catch (RuntimeException e) {
            log.error("Background dispatch of job {} failed: {}", jobId, e.getMessage(), e);
        } finally {
            inFlight.remove(jobId);
            MDC.remove("jobId");
        }
    }

    /**
     * Dispatch a job that holds both the in-flight claim and a global slot. The caller owns the
     * claim and removes it. A synchronous caller gets a remote rejection rethrown.
     */
    private Job dispatchClaimed(Long jobId, boolean synchronous) {
        try {
            return doDispatch(jobId, synchronous);
        } catch (RuntimeException e) {
            if (!activeJobIndex.contains(jobId)) {
                concurrencyGuard.release(jobId);
            }
            throw e;
        }
    }

    private Job doDispatch(Long jobId, boolean synchronous) {
        Job job = jobStore.require(jobId);
        if (job.getStatus() != JobStatus.PENDING) {
            log.info("Job {} is {} and no longer needs dispatch", jobId, job.getStatus());
            if (job.getStatus() != JobStatus.RUNNING) {
                concurrencyGuard.release(jobId);
            }
            return job;
        }

        Map<String, Object> config = fromJson(job.getConfigJson());
        int retries = job.getRetryCount() != null ? job.getRetryCount() : 0;
        int maxRetries = job.getMaxRetries() != null ? job.getMaxRetries() : settings.getMaxRetries();

        while (true) {
            try {
                String handle = computeGateway.submit(job.getKind(), config);
                return markRunning(job, handle);

            } catch (RemoteRejectedException e) {
                log.warn("Compute service rejected job {}: {}", jobId, e.getMessage());
                Job failed = failPending(jobId, "Remote service rejected job: " + e.getMessage());
                if (synchronous) {
                    throw e;
                }
                return failed;

            } catch (TransientGatewayException e) {
                if (retries >= maxRetries) {
                    log.error("Job {} failed after {} submit retries", jobId, retries);
                    return failPending(jobId, "Submission failed after " + retries + " retries: " + e.getMessage());
                }

                retries++;
                log.warn("Submit of job {} failed (attempt {}/{}): {}. Retrying...",
                        jobId, retries, maxRetries + 1, e.getMessage());

                JobPatch patch = JobPatch.builder()
                        .retryCount(retries)
                        .logDelta("Submit attempt " + retries + " failed: " + e.getMessage())
                        .build();
                if (!jobStore.compareAndSwapStatus(jobId, JobStatus.PENDING, JobStatus.PENDING, patch)) {
                    log.info("Job {} left PENDING during submit retries", jobId);
                    return jobStore.require(jobId);
                }
                metricsService.recordSubmitRetried();

                if (!sleepBackoff(retries)) {
                    concurrencyGuard.release(jobId);
                    return jobStore.require(jobId);
                }
            }
        }
    }

    private Job markRunning(Job job, String handle) {
        Long jobId = job.getId();
        JobPatch patch = JobPatch.builder()
                .externalHandle(handle)
                .startedAt(LocalDateTime.now(clock))
                .logDelta("Submitted to compute service with handle " + handle)
                .build();

        if (!jobStore.compareAndSwapStatus(jobId, JobStatus.PENDING, JobStatus.RUNNING, patch)) {
            log.warn("Job {} left PENDING while its submit was in flight; cancelling remote handle {}",
                    jobId, handle);
            cancelRemoteQuietly(job.getKind(), handle);
            Job current = jobStore.require(jobId);
            if (current.getStatus() != JobStatus.RUNNING) {
                concurrencyGuard.release(jobId);
            }
            return current;
        }

        activeJobIndex.add(jobId);
        updateStrategyQuietly(job.getStrategyId(), StrategyStatus.ACTIVE, true);

        Job running = jobStore.require(jobId);
        eventPublisher.publishProgress(running);
        log.info("Job {} is RUNNING with handle {}", jobId, handle);
        return running;
    }

    private Job failPending(Long jobId, String message) {
        JobPatch patch = JobPatch.builder().errorMessage(message).build();
        if (jobStore.compareAndSwapStatus(jobId, JobStatus.PENDING, JobStatus.FAILED, patch)) {
            return onJobFinished(jobId);
        }
        log.info("Job {} left PENDING before it could be marked FAILED", jobId);
        return jobStore.require(jobId);
    }

    private void cancelOrphan(Job job) {
        JobPatch patch = JobPatch.builder()
                .logDelta("Cancelled: strategy " + job.getStrategyId() + " no longer exists")
                .build();
        if (jobStore.compareAndSwapStatus(job.getId(), JobStatus.PENDING, JobStatus.CANCELLED, patch)) {
            log.warn("Cancelled PENDING job {} of missing strategy {}", job.getId(), job.getStrategyId());
            onJobFinished(job.getId());
        }
    }

    private void cancelRemoteQuietly(JobKind kind, String handle) {
        try {
            computeGateway.cancel(kind, handle);
        } catch (GatewayException e) {
            log.warn("Remote cancel of handle {} failed: {}", handle, e.getMessage());
        }
    }

    private void updateStrategyQuietly(Long strategyId, StrategyStatus status, boolean markRun) {
        try {
            jobStore.updateStrategyStatus(strategyId, status, markRun);
        } catch (StorageUnavailableException e) {
            log.warn("Could not set strategy {} to {}: {}", strategyId, status, e.getMessage());
        }
    }

    /**
     * Sleep before retry {@code retry}: base * 2^(retry-1), capped.
     *
     * @return false if interrupted
     */
    private boolean sleepBackoff(int retry) {
        Duration delay = backoffDelay(retry);
        if (delay.isZero()) {
            return true;
        }
        try {
            log.info("Backing off {}ms before submit retry {}", delay.toMillis(), retry);
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off, job stays PENDING");
            return false;
        }
    }

    Duration backoffDelay(int retry) {
        Duration base = settings.getBackoffBase();
        Duration max = settings.getBackoffMax();
        Duration delay = base.multipliedBy(1L << Math.min(Math.max(retry - 1, 0), 20));
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private String toJson(Map<String, Object> config) {
        try {
            return objectMapper.writeValueAsString(config != null ? config : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job config is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job config is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
