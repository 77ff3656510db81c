package com.quantlab.orchestrator.infrastructure;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.exception.StorageUnavailableException;
import com.quantlab.orchestrator.service.JobDispatcher;
import com.quantlab.orchestrator.service.JobPoller;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages lifecycle of polling workers.
 * Restores RUNNING jobs and starts workers once the application is ready, drains the PENDING
 * backlog on a schedule and shuts workers down gracefully.
 */
@Component
@Slf4j
public class PollingWorkerManager {

    private final ExecutorService pollingExecutorService;
    private final ActiveJobIndex activeJobIndex;
    private final JobPoller jobPoller;
    private final JobDispatcher jobDispatcher;
    private final OrchestratorProperties.Poller settings;

    private final List<PollingWorker> workers = new ArrayList<>();
    private volatile boolean started;

    public PollingWorkerManager(@Qualifier("pollingExecutorService") ExecutorService pollingExecutorService,
                                ActiveJobIndex activeJobIndex,
                                JobPoller jobPoller,
                                JobDispatcher jobDispatcher,
                                OrchestratorProperties properties) {
        this.pollingExecutorService = pollingExecutorService;
        this.activeJobIndex = activeJobIndex;
        this.jobPoller = jobPoller;
        this.jobDispatcher = jobDispatcher;
        this.settings = properties.getPoller();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        if (!settings.isEnabled()) {
            log.info("Polling workers are disabled");
            return;
        }

        jobDispatcher.restoreRunningJobs();

        int workerCount = activeJobIndex.getWorkerCount();
        log.info("Starting {} polling workers", workerCount);

        for (int i = 0; i < workerCount; i++) {
            String workerName = "PollingWorker-" + (i + 1);
            PollingWorker worker = new PollingWorker(i, workerName, activeJobIndex, jobPoller, settings.getTick());

            workers.add(worker);
            pollingExecutorService.submit(worker);

            log.info("Started {}", workerName);
        }

        started = true;
        drainBacklog();
        log.info("All {} workers started successfully", workerCount);
    }

    @Scheduled(fixedDelayString = "${orchestrator.poller.backlog-interval-ms:5000}",
            initialDelayString = "${orchestrator.poller.backlog-interval-ms:5000}")
    public void drainBacklog() {
        if (!started) {
            return;
        }
        try {
            jobDispatcher.dispatchBacklog();
        } catch (StorageUnavailableException e) {
            log.warn("Backlog dispatch skipped: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stopWorkers() {
        log.info("Stopping all workers...");
        started = false;

        workers.forEach(PollingWorker::stop);

        pollingExecutorService.shutdown();

        try {
            if (!pollingExecutorService.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate gracefully, forcing shutdown");
                pollingExecutorService.shutdownNow();
            } else {
                log.info("All workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for workers to stop", e);
            pollingExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
