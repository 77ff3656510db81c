package com.quantlab.orchestrator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobPatch;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.domain.Strategy;
import com.quantlab.orchestrator.domain.StrategyStatus;
import com.quantlab.orchestrator.exception.ConflictingJobException;
import com.quantlab.orchestrator.exception.JobNotFoundException;
import com.quantlab.orchestrator.exception.StorageUnavailableException;
import com.quantlab.orchestrator.exception.StrategyNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JPA implementation of {@link JobStore}.
 * Status changes lock the job row with a pessimistic write lock, so two pollers (or a poller and a
 * cancel request) can never both win a transition of the same job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaJobStore implements JobStore {

    private final JobRepository jobRepository;
    private final StrategyRepository strategyRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Job createIfNoActiveJob(Job job) {
        Long strategyId = job.getStrategyId();
        try {
            // Lock the strategy first: concurrent creators for the same strategy queue up here
            strategyRepository.findByIdForUpdate(strategyId)
                    .orElseThrow(() -> new StrategyNotFoundException(strategyId));

            List<Job> active = jobRepository.findByStrategyIdAndStatusIn(strategyId, JobStatus.ACTIVE);
            if (!active.isEmpty()) {
                log.info("Strategy {} already has active job {}", strategyId, active.get(0).getId());
                throw new ConflictingJobException(strategyId, active.get(0).getId());
            }

            LocalDateTime now = now();
            job.setStatus(JobStatus.PENDING);
            job.setActiveStrategyId(strategyId);
            job.setProgress(0.0);
            job.setRetryCount(0);
            job.setCreatedAt(now);
            job.setUpdatedAt(now);

            Job saved = jobRepository.saveAndFlush(job);
            log.info("Created job {} ({}) for strategy {}", saved.getId(), saved.getKind(), strategyId);
            return saved;

        } catch (DataIntegrityViolationException e) {
            log.warn("Active job constraint rejected insert for strategy {}", strategyId);
            throw new ConflictingJobException(strategyId, null);
        } catch (DataAccessException e) {
            throw storageUnavailable("job creation", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> get(Long id) {
        try {
            return jobRepository.findById(id);
        } catch (DataAccessException e) {
            throw storageUnavailable("job lookup", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Job require(Long id) {
        return get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public boolean compareAndSwapStatus(Long id, JobStatus expected, JobStatus next, JobPatch patch) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + expected + " -> " + next);
        }

        try {
            Job job = jobRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new JobNotFoundException(id));

            if (job.getStatus() != expected) {
                log.debug("CAS {} -> {} lost for job {}: status is {}", expected, next, id, job.getStatus());
                return false;
            }

            JobMutations.transition(job, next, patch != null ? patch : JobPatch.EMPTY, now(), objectMapper);
            jobRepository.saveAndFlush(job);

            if (expected != next) {
                log.info("Job {} status changed {} -> {}", id, expected, next);
            }
            return true;

        } catch (DataAccessException e) {
            throw storageUnavailable("status transition", e);
        }
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void appendLog(Long id, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }

        try {
            Job job = jobRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new JobNotFoundException(id));

            if (job.isTerminal()) {
                log.debug("Ignoring log append for terminal job {}", id);
                return;
            }

            JobMutations.appendLog(job, text);
            job.setUpdatedAt(now());
            jobRepository.save(job);
        } catch (DataAccessException e) {
            throw storageUnavailable("log append", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listActiveByStrategy(Long strategyId) {
        try {
            return jobRepository.findByStrategyIdAndStatusIn(strategyId, JobStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw storageUnavailable("active job lookup", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listNonTerminal() {
        try {
            return jobRepository.findByStatusIn(JobStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw storageUnavailable("non-terminal job lookup", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listPendingOldestFirst(int limit) {
        try {
            return jobRepository.findByStatusOrderByCreatedAtAscIdAsc(JobStatus.PENDING, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw storageUnavailable("pending job lookup", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listByStrategy(Long strategyId) {
        try {
            return jobRepository.findByStrategyIdOrderByCreatedAtDescIdDesc(strategyId);
        } catch (DataAccessException e) {
            throw storageUnavailable("job history lookup", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean strategyExists(Long strategyId) {
        try {
            return strategyRepository.existsById(strategyId);
        } catch (DataAccessException e) {
            throw storageUnavailable("strategy lookup", e);
        }
    }

    @Override
    @Transactional
    public void updateStrategyStatus(Long strategyId, StrategyStatus status, boolean markRun) {
        try {
            Optional<Strategy> found = strategyRepository.findByIdForUpdate(strategyId);
            if (found.isEmpty()) {
                log.warn("Strategy {} not found while setting status {}", strategyId, status);
                return;
            }

            Strategy strategy = found.get();
            LocalDateTime now = now();
            strategy.setStatus(status);
            if (markRun) {
                strategy.setLastRunAt(now);
            }
            strategy.setUpdatedAt(now);
            strategyRepository.save(strategy);

            log.info("Strategy {} status changed to {}", strategyId, status);
        } catch (DataAccessException e) {
            throw storageUnavailable("strategy status update", e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private StorageUnavailableException storageUnavailable(String operation, DataAccessException e) {
        log.error("Job store unavailable during {}: {}", operation, e.getMessage(), e);
        return new StorageUnavailableException("Job store unavailable during " + operation, e);
    }
}
