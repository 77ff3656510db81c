package com.quantlab.orchestrator.repository;

import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobPatch;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.domain.StrategyStatus;

import java.util.List;
import java.util.Optional;

/**
 * Typed access to persisted jobs and strategies.
 * Every method runs in a single transaction; on storage failure it throws
 * {@link com.quantlab.orchestrator.exception.StorageUnavailableException} and nothing is applied.
 */
public interface JobStore {

    /**
     * Insert a PENDING job only if its strategy has no PENDING or RUNNING job.
     *
     * @param job the job to insert; status, timestamps and counters are initialized here
     * @return the persisted job with its ID
     * @throws com.quantlab.orchestrator.exception.ConflictingJobException    if an active job exists
     * @throws com.quantlab.orchestrator.exception.StrategyNotFoundException if the strategy is unknown
     */
    Job createIfNoActiveJob(Job job);

    /**
     * Find a job by ID.
     *
     * @param id the job ID
     * @return Optional containing the job if found
     */
    Optional<Job> get(Long id);

    /**
     * Find a job by ID or fail.
     *
     * @param id the job ID
     * @return the job
     * @throws com.quantlab.orchestrator.exception.JobNotFoundException if absent
     */
    Job require(Long id);

    /**
     * Atomically move a job from {@code expected} to {@code next} and apply {@code patch}.
     * This is the only way a job's status changes.
     *
     * @param id       the job ID
     * @param expected status the job must currently have
     * @param next     status to move to
     * @param patch    field changes applied in the same transaction
     * @return true if the swap happened, false if the persisted status differed
     * @throws IllegalStateException if {@code expected -> next} is not a legal transition
     */
    boolean compareAndSwapStatus(Long id, JobStatus expected, JobStatus next, JobPatch patch);

    /**
     * Append text to the job's log. Ignored once the job is terminal.
     *
     * @param id   the job ID
     * @param text the text to append
     */
    void appendLog(Long id, String text);

    /**
     * Find PENDING and RUNNING jobs of a strategy.
     *
     * @param strategyId the strategy ID
     * @return active jobs (at most one while the invariant holds)
     */
    List<Job> listActiveByStrategy(Long strategyId);

    /**
     * Find every PENDING and RUNNING job. Used to rebuild in-memory state on startup.
     *
     * @return all non-terminal jobs
     */
    List<Job> listNonTerminal();

    /**
     * Find PENDING jobs waiting for dispatch, oldest first.
     *
     * @param limit maximum number of jobs returned
     * @return pending jobs
     */
    List<Job> listPendingOldestFirst(int limit);

    /**
     * Find the job history of a strategy, newest first.
     *
     * @param strategyId the strategy ID
     * @return jobs of the strategy
     */
    List<Job> listByStrategy(Long strategyId);

    /**
     * Check whether a strategy row exists.
     *
     * @param strategyId the strategy ID
     * @return true if the strategy exists
     */
    boolean strategyExists(Long strategyId);

    /**
     * Record a job lifecycle effect on the owning strategy. Missing strategies are ignored.
     *
     * @param strategyId the strategy ID
     * @param status     new strategy status
     * @param markRun    whether to stamp {@code lastRunAt}
     */
    void updateStrategyStatus(Long strategyId, StrategyStatus status, boolean markRun);
}
