package com.quantlab.orchestrator.service;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.repository.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Enforces one active job per strategy and a global cap on jobs being dispatched or polled.
 *
 * <p>The per-strategy permit lives in the job store: {@link #tryAcquire(Job)} is a conditional
 * insert, and the terminal status transition frees it, so it survives restarts. The global slots
 * are held in memory per job ID and rebuilt from RUNNING jobs on startup; jobs that find no free
 * slot stay PENDING until one is released.
 */
@Component
@Slf4j
public class ConcurrencyGuard {

    private final JobStore jobStore;
    private final int maxActiveJobs;

    private final Set<Long> slotHolders = new HashSet<>();

    public ConcurrencyGuard(JobStore jobStore, OrchestratorProperties properties) {
        this(jobStore, properties.getPoller().getMaxActiveJobs());
    }

    public ConcurrencyGuard(JobStore jobStore, int maxActiveJobs) {
        this.jobStore = jobStore;
        this.maxActiveJobs = Math.max(1, maxActiveJobs);
    }

    /**
     * Insert a PENDING job if its strategy has no active job.
     *
     * @throws com.quantlab.orchestrator.exception.ConflictingJobException if one exists
     */
    public Job tryAcquire(Job job) {
        return jobStore.createIfNoActiveJob(job);
    }

    /**
     * Take a global slot for a job. Taking a slot the job already holds succeeds.
     */
    public synchronized boolean tryAcquireSlot(Long jobId) {
        if (slotHolders.contains(jobId)) {
            return true;
        }
        if (slotHolders.size() >= maxActiveJobs) {
            log.debug("No free slot for job {} ({} of {} in use)", jobId, slotHolders.size(), maxActiveJobs);
            return false;
        }
        slotHolders.add(jobId);
        return true;
    }

    /**
     * Re-register a job found RUNNING at startup, even above the cap.
     */
    public synchronized void restoreSlot(Long jobId) {
        slotHolders.add(jobId);
    }

    /**
     * Free the slot held by a job. Releasing twice is a no-op.
     */
    public synchronized boolean release(Long jobId) {
        boolean released = slotHolders.remove(jobId);
        if (released) {
            log.debug("Released slot of job {} ({} of {} in use)", jobId, slotHolders.size(), maxActiveJobs);
        }
        return released;
    }

    public synchronized boolean hasFreeSlot() {
        return slotHolders.size() < maxActiveJobs;
    }

    public synchronized int slotsInUse() {
        return slotHolders.size();
    }
}
