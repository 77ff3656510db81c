package com.quantlab.orchestrator.service;

import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.StrategyStatus;
import com.quantlab.orchestrator.exception.ConflictingJobException;
import com.quantlab.orchestrator.exception.InvalidJobStateException;
import com.quantlab.orchestrator.exception.StrategyNotFoundException;
import com.quantlab.orchestrator.notification.JobEvent;
import com.quantlab.orchestrator.notification.Subscription;
import com.quantlab.orchestrator.notification.SubscriptionRegistry;
import com.quantlab.orchestrator.repository.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Implementation of JobOrchestrator delegating lifecycle work to the dispatcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobOrchestratorImpl implements JobOrchestrator {

    static final String CANCELLED_BY_REQUEST = "Cancelled by request";
    static final String STRATEGY_RETIRED = "Strategy retired";

    private final JobStore jobStore;
    private final JobDispatcher jobDispatcher;
    private final SubscriptionRegistry subscriptionRegistry;
    private final JobMetricsService metricsService;

    @Override
    public Job submitJob(Long strategyId, Long ownerId, JobKind kind, Map<String, Object> config) {
        if (strategyId == null || ownerId == null || kind == null) {
            throw new IllegalArgumentException("Strategy ID, owner ID and kind are required");
        }

        log.info("Received {} job submission for strategy {} from owner {}", kind, strategyId, ownerId);

        try {
            return jobDispatcher.submit(strategyId, ownerId, kind, config);
        } catch (ConflictingJobException e) {
            metricsService.recordConflict();
            log.info("Rejected submission: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public Job getJob(Long id) {
        return jobStore.require(id);
    }

    @Override
    public Job cancelJob(Long id) {
        log.info("Cancel requested for job {}", id);
        return jobDispatcher.cancel(id, CANCELLED_BY_REQUEST);
    }

    @Override
    public List<Job> listJobs(Long strategyId) {
        return jobStore.listByStrategy(strategyId);
    }

    @Override
    public Subscription subscribe(Long strategyId, Consumer<JobEvent> handler) {
        return subscriptionRegistry.subscribe(strategyId, handler);
    }

    @Override
    public int retireStrategy(Long strategyId) {
        if (!jobStore.strategyExists(strategyId)) {
            throw new StrategyNotFoundException(strategyId);
        }

        int cancelled = 0;

        for (Job job : jobStore.listActiveByStrategy(strategyId)) {
            try {
                jobDispatcher.cancel(job.getId(), STRATEGY_RETIRED);
                cancelled++;
            } catch (InvalidJobStateException e) {
                log.info("Job {} finished before it could be cancelled", job.getId());
            }
        }

        jobStore.updateStrategyStatus(strategyId, StrategyStatus.STOPPED, false);
        log.info("Retired strategy {}, cancelled {} job(s)", strategyId, cancelled);
        return cancelled;
    }
}
