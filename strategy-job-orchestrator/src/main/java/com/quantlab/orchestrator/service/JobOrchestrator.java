package com.quantlab.orchestrator.service;

import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.notification.JobEvent;
import com.quantlab.orchestrator.notification.Subscription;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Service interface for strategy job operations.
 */
public interface JobOrchestrator {

    /**
     * Submit a job for a strategy. The job is dispatched right away when a slot is free,
     * otherwise it stays PENDING until one is.
     *
     * @param strategyId the strategy the job runs for
     * @param ownerId    the user submitting the job
     * @param kind       training, backtest or labeling
     * @param config     opaque configuration sent verbatim to the compute service
     * @return the job after the first dispatch attempt
     * @throws com.quantlab.orchestrator.exception.ConflictingJobException    if the strategy has an active job
     * @throws com.quantlab.orchestrator.exception.RemoteRejectedException    if the compute service refused it
     * @throws com.quantlab.orchestrator.exception.StrategyNotFoundException if the strategy is unknown
     */
    Job submitJob(Long strategyId, Long ownerId, JobKind kind, Map<String, Object> config);

    /**
     * @throws com.quantlab.orchestrator.exception.JobNotFoundException if absent
     */
    Job getJob(Long id);

    /**
     * Cancel a PENDING or RUNNING job.
     *
     * @throws com.quantlab.orchestrator.exception.InvalidJobStateException if the job is terminal
     */
    Job cancelJob(Long id);

    /**
     * Job history of a strategy, newest first.
     */
    List<Job> listJobs(Long strategyId);

    /**
     * Receive progress and terminal events of a strategy's jobs until the subscription is cancelled.
     */
    Subscription subscribe(Long strategyId, Consumer<JobEvent> handler);

    /**
     * Cancel every active job of a strategy and mark it STOPPED.
     *
     * @return number of jobs cancelled
     */
    int retireStrategy(Long strategyId);
}
