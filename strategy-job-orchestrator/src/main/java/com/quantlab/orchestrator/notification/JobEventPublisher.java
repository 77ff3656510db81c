package com.quantlab.orchestrator.notification;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.Job;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns job state changes into events on every {@link JobEventChannel}.
 *
 * <p>Progress events are throttled per job: one is sent only when progress moved by at least
 * {@code min-progress-delta} or {@code min-interval} passed since the last one. Terminal events
 * are never throttled; callers invoke {@link #publishTerminal(Job)} only after the terminal
 * transition was committed, and only the caller that won that transition does so.
 *
 * <p>Channels are invoked on {@code eventExecutor}, so a slow subscriber never holds up the caller.
 * With a single delivery thread, events reach each channel in publish order. Publishing never throws.
 */
@Service
@Slf4j
public class JobEventPublisher {

    private final List<JobEventChannel> channels;
    private final Clock clock;
    private final double minProgressDelta;
    private final Duration minInterval;
    private final Executor eventExecutor;

    private final Map<Long, LastProgress> lastProgressByJob = new ConcurrentHashMap<>();

    public JobEventPublisher(List<JobEventChannel> channels,
                             Clock clock,
                             OrchestratorProperties properties,
                             @Qualifier("eventExecutor") Executor eventExecutor) {
        this.channels = List.copyOf(channels);
        this.eventExecutor = eventExecutor;
        this.clock = clock;
        this.minProgressDelta = properties.getNotifications().getMinProgressDelta();
        this.minInterval = properties.getNotifications().getMinInterval();
        log.info("Job event publisher using channels: {}", this.channels.stream().map(JobEventChannel::name).toList());
    }

    /**
     * Publish a progress update unless it is throttled.
     *
     * @return true if the event was handed to the channels
     */
    public boolean publishProgress(Job job) {
        Instant now = clock.instant();
        double progress = job.getProgress() != null ? job.getProgress() : 0.0;
        boolean[] accepted = new boolean[1];

        lastProgressByJob.compute(job.getId(), (id, last) -> {
            if (last == null
                    || Math.abs(progress - last.getProgress()) >= minProgressDelta
                    || !now.isBefore(last.getAt().plus(minInterval))) {
                accepted[0] = true;
                return new LastProgress(progress, now);
            }
            return last;
        });

        if (!accepted[0]) {
            log.trace("Throttled progress event for job {} at {}%", job.getId(), progress);
            return false;
        }

        fanOut(JobEvent.of(JobEventType.PROGRESS_UPDATE, job, LocalDateTime.now(clock)));
        return true;
    }

    public void publishTerminal(Job job) {
        lastProgressByJob.remove(job.getId());
        fanOut(JobEvent.of(JobEventType.TERMINAL, job, LocalDateTime.now(clock)));
        log.info("Published terminal event for job {} ({})", job.getId(), job.getStatus());
    }

    private void fanOut(JobEvent event) {
        try {
            eventExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.error("Dropped {} event for job {}: event executor rejected it", event.getType(), event.getJobId());
        }
    }

    private void deliver(JobEvent event) {
        for (JobEventChannel channel : channels) {
            try {
                channel.send(event);
            } catch (RuntimeException e) {
                log.warn("Channel {} failed to deliver {} event for job {}: {}",
                        channel.name(), event.getType(), event.getJobId(), e.getMessage());
            }
        }
    }

    @Value
    private static class LastProgress {
        double progress;
        Instant at;
    }
}
