package com.quantlab.orchestrator.repository;

import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job entity.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Find and lock a job by ID for update (pessimistic write lock).
     * Serializes status transitions of the same job.
     *
     * @param id the job ID
     * @return Optional containing the locked job if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") Long id);

    /**
     * Find jobs of a strategy in any of the given statuses.
     *
     * @param strategyId the strategy ID
     * @param statuses   accepted statuses
     * @return matching jobs
     */
    List<Job> findByStrategyIdAndStatusIn(Long strategyId, Collection<JobStatus> statuses);

    /**
     * Find all jobs in any of the given statuses.
     *
     * @param statuses accepted statuses
     * @return matching jobs
     */
    List<Job> findByStatusIn(Collection<JobStatus> statuses);

    /**
     * Find jobs with a given status, oldest first.
     *
     * @param status   the job status
     * @param pageable page bounds
     * @return matching jobs ordered by creation time
     */
    List<Job> findByStatusOrderByCreatedAtAscIdAsc(JobStatus status, Pageable pageable);

    /**
     * Find the job history of a strategy, newest first.
     *
     * @param strategyId the strategy ID
     * @return jobs of the strategy
     */
    List<Job> findByStrategyIdOrderByCreatedAtDescIdDesc(Long strategyId);
}
