package com.quantlab.orchestrator.infrastructure;

import com.quantlab.orchestrator.exception.StorageUnavailableException;
import com.quantlab.orchestrator.service.JobPoller;
import com.quantlab.orchestrator.service.PollingState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Background worker that polls the jobs assigned to it in the {@link ActiveJobIndex}.
 * Each worker runs in its own thread; a job is only ever polled by its owning worker,
 * so polls of one job never overlap.
 */
@RequiredArgsConstructor
@Slf4j
public class PollingWorker implements Runnable {

    private final int workerIndex;
    private final String workerName;
    private final ActiveJobIndex activeJobIndex;
    private final JobPoller jobPoller;
    private final Duration tick;

    // Only touched by the worker thread
    private final Map<Long, PollingState> states = new HashMap<>();

    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started", workerName);

        while (running) {
            try {
                pollOwnedJobs();
            } catch (Exception e) {
                log.error("{} encountered error while polling: {}", workerName, e.getMessage(), e);
            }

            try {
                Thread.sleep(tick.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted", workerName);
                break;
            }
        }

        log.info("{} stopped", workerName);
    }

    /**
     * Poll every job this worker owns once.
     */
    void pollOwnedJobs() {
        List<Long> owned = activeJobIndex.ownedBy(workerIndex);
        states.keySet().retainAll(owned);

        for (Long jobId : owned) {
            if (!running) {
                return;
            }

            MDC.put("jobId", String.valueOf(jobId));
            MDC.put("worker", workerName);

            try {
                jobPoller.pollOnce(jobId, states.computeIfAbsent(jobId, id -> new PollingState()));
            } catch (StorageUnavailableException e) {
                log.warn("Store unavailable, will retry on next tick: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to poll job: {}", e.getMessage(), e);
            } finally {
                MDC.remove("jobId");
                MDC.remove("worker");
            }
        }
    }

    int trackedJobCount() {
        return states.size();
    }

    /**
     * Gracefully stop the worker.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }
}
