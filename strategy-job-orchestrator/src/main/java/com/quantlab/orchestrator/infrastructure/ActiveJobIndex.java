package com.quantlab.orchestrator.infrastructure;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory set of RUNNING jobs being polled, partitioned across polling workers.
 * Each job belongs to exactly one worker. Rebuilt from the job store on startup; never persisted.
 */
@Component
@Slf4j
public class ActiveJobIndex {

    private final int workerCount;
    private final Map<Long, Integer> ownerByJob = new HashMap<>();
    private final List<Set<Long>> jobsByWorker = new ArrayList<>();

    public ActiveJobIndex(OrchestratorProperties properties) {
        this(properties.getPoller().getWorkerCount());
    }

    public ActiveJobIndex(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
        for (int i = 0; i < this.workerCount; i++) {
            jobsByWorker.add(new LinkedHashSet<>());
        }
    }

    /**
     * Assign a job to the least loaded worker. Adding a job twice keeps its first owner.
     *
     * @return index of the owning worker
     */
    public synchronized int add(Long jobId) {
        Integer owner = ownerByJob.get(jobId);
        if (owner != null) {
            return owner;
        }

        int selected = 0;
        for (int i = 1; i < workerCount; i++) {
            if (jobsByWorker.get(i).size() < jobsByWorker.get(selected).size()) {
                selected = i;
            }
        }

        jobsByWorker.get(selected).add(jobId);
        ownerByJob.put(jobId, selected);
        log.debug("Job {} assigned to polling worker {}", jobId, selected + 1);
        return selected;
    }

    public synchronized boolean remove(Long jobId) {
        Integer owner = ownerByJob.remove(jobId);
        if (owner == null) {
            return false;
        }
        jobsByWorker.get(owner).remove(jobId);
        return true;
    }

    /**
     * Snapshot of the jobs owned by a worker.
     */
    public synchronized List<Long> ownedBy(int workerIndex) {
        return new ArrayList<>(jobsByWorker.get(workerIndex));
    }

    public synchronized boolean contains(Long jobId) {
        return ownerByJob.containsKey(jobId);
    }

    public synchronized int size() {
        return ownerByJob.size();
    }

    public int getWorkerCount() {
        return workerCount;
    }
}
