package com.quantlab.orchestrator.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobPatch;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.domain.Strategy;
import com.quantlab.orchestrator.domain.StrategyStatus;
import com.quantlab.orchestrator.exception.ConflictingJobException;
import com.quantlab.orchestrator.exception.JobNotFoundException;
import com.quantlab.orchestrator.exception.StrategyNotFoundException;
import com.quantlab.orchestrator.repository.JobMutations;
import com.quantlab.orchestrator.repository.JobStore;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link JobStore} held in memory, applying the same mutation rules as the JPA store.
 * Every method is atomic; callers get copies, never the stored instances.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<Long, Job> jobs = new LinkedHashMap<>();
    private final Map<Long, Strategy> strategies = new LinkedHashMap<>();
    private final AtomicLong jobIds = new AtomicLong();
    private final AtomicLong strategyIds = new AtomicLong();
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private Runnable afterNextCreate;

    public InMemoryJobStore(Clock clock, ObjectMapper objectMapper) {
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public synchronized Long addStrategy(String name, Long ownerId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Long id = strategyIds.incrementAndGet();
        strategies.put(id, Strategy.builder()
                .id(id)
                .name(name)
                .ownerId(ownerId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        return id;
    }

    public synchronized void removeStrategy(Long strategyId) {
        strategies.remove(strategyId);
    }

    public synchronized StrategyStatus strategyStatus(Long strategyId) {
        Strategy strategy = strategies.get(strategyId);
        return strategy != null ? strategy.getStatus() : null;
    }

    public synchronized Strategy strategy(Long strategyId) {
        return strategies.get(strategyId);
    }

    /**
     * Run {@code hook} once, right after the next job insert and outside the store lock.
     */
    public synchronized InMemoryJobStore afterNextCreate(Runnable hook) {
        this.afterNextCreate = hook;
        return this;
    }

    @Override
    public Job createIfNoActiveJob(Job job) {
        Job created = insert(job);
        Runnable hook;
        synchronized (this) {
            hook = afterNextCreate;
            afterNextCreate = null;
        }
        if (hook != null) {
            hook.run();
        }
        return created;
    }

    private synchronized Job insert(Job job) {
        Long strategyId = job.getStrategyId();
        if (!strategies.containsKey(strategyId)) {
            throw new StrategyNotFoundException(strategyId);
        }

        jobs.values().stream()
                .filter(j -> strategyId.equals(j.getActiveStrategyId()))
                .findFirst()
                .ifPresent(active -> {
                    throw new ConflictingJobException(strategyId, active.getId());
                });

        LocalDateTime now = LocalDateTime.now(clock);
        Job stored = copy(job);
        stored.setId(jobIds.incrementAndGet());
        stored.setStatus(JobStatus.PENDING);
        stored.setActiveStrategyId(strategyId);
        stored.setProgress(0.0);
        stored.setRetryCount(0);
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        jobs.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Optional<Job> get(Long id) {
        return Optional.ofNullable(jobs.get(id)).map(InMemoryJobStore::copy);
    }

    @Override
    public synchronized Job require(Long id) {
        return get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public synchronized boolean compareAndSwapStatus(Long id, JobStatus expected, JobStatus next, JobPatch patch) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + expected + " -> " + next);
        }
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        if (job.getStatus() != expected) {
            return false;
        }
        JobMutations.transition(job, next, patch != null ? patch : JobPatch.EMPTY, LocalDateTime.now(clock), objectMapper);
        return true;
    }

    @Override
    public synchronized void appendLog(Long id, String text) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        if (!job.isTerminal()) {
            JobMutations.appendLog(job, text);
        }
    }

    @Override
    public synchronized List<Job> listActiveByStrategy(Long strategyId) {
        return jobs.values().stream()
                .filter(j -> strategyId.equals(j.getStrategyId()) && !j.isTerminal())
                .map(InMemoryJobStore::copy)
                .toList();
    }

    @Override
    public synchronized List<Job> listNonTerminal() {
        return jobs.values().stream().filter(j -> !j.isTerminal()).map(InMemoryJobStore::copy).toList();
    }

    @Override
    public synchronized List<Job> listPendingOldestFirst(int limit) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PENDING)
                .sorted(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId))
                .limit(limit)
                .map(InMemoryJobStore::copy)
                .toList();
    }

    @Override
    public synchronized List<Job> listByStrategy(Long strategyId) {
        return jobs.values().stream()
                .filter(j -> strategyId.equals(j.getStrategyId()))
                .sorted(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId).reversed())
                .map(InMemoryJobStore::copy)
                .toList();
    }

    @Override
    public synchronized boolean strategyExists(Long strategyId) {
        return strategies.containsKey(strategyId);
    }

    @Override
    public synchronized void updateStrategyStatus(Long strategyId, StrategyStatus status, boolean markRun) {
        Strategy strategy = strategies.get(strategyId);
        if (strategy == null) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        strategy.setStatus(status);
        if (markRun) {
            strategy.setLastRunAt(now);
        }
        strategy.setUpdatedAt(now);
    }

    private static Job copy(Job job) {
        return Job.builder()
                .id(job.getId())
                .version(job.getVersion())
                .kind(job.getKind())
                .status(job.getStatus())
                .progress(job.getProgress())
                .configJson(job.getConfigJson())
                .metricsJson(job.getMetricsJson())
                .logs(job.getLogs())
                .errorMessage(job.getErrorMessage())
                .externalHandle(job.getExternalHandle())
                .strategyId(job.getStrategyId())
                .activeStrategyId(job.getActiveStrategyId())
                .ownerId(job.getOwnerId())
                .retryCount(job.getRetryCount())
                .maxRetries(job.getMaxRetries())
                .durationSeconds(job.getDurationSeconds())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .lastPolledAt(job.getLastPolledAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
