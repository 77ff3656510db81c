package com.quantlab.orchestrator.notification;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.support.MutableClock;
import com.quantlab.orchestrator.support.RecordingEventChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for progress throttling and terminal delivery.
 */
class JobEventPublisherTest {

    private MutableClock clock;
    private RecordingEventChannel channel;
    private JobEventPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-05T09:00:00Z");
        channel = new RecordingEventChannel();

        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getNotifications().setMinProgressDelta(5.0);
        properties.getNotifications().setMinInterval(Duration.ofSeconds(10));
        publisher = new JobEventPublisher(List.of(channel), clock, properties, Runnable::run);
    }

    @Test
    void testPublishProgress_FirstEventAlwaysSent() {
        assertTrue(publisher.publishProgress(job(1L, JobStatus.RUNNING, 0.0)));
        assertEquals(1, channel.events().size());
    }

    @Test
    void testPublishProgress_ThrottlesSmallChanges() {
        // Arrange
        publisher.publishProgress(job(1L, JobStatus.RUNNING, 10.0));

        // Act
        boolean smallStep = publisher.publishProgress(job(1L, JobStatus.RUNNING, 12.0));
        boolean largeStep = publisher.publishProgress(job(1L, JobStatus.RUNNING, 15.0));

        // Assert
        assertFalse(smallStep);
        assertTrue(largeStep);
        assertEquals(2, channel.events().size());
    }

    @Test
    void testPublishProgress_SentAfterMinInterval() {
        publisher.publishProgress(job(1L, JobStatus.RUNNING, 10.0));
        clock.advance(Duration.ofSeconds(10));

        assertTrue(publisher.publishProgress(job(1L, JobStatus.RUNNING, 11.0)));
    }

    @Test
    void testPublishProgress_ThrottledPerJob() {
        publisher.publishProgress(job(1L, JobStatus.RUNNING, 10.0));

        assertTrue(publisher.publishProgress(job(2L, JobStatus.RUNNING, 10.0)));
    }

    @Test
    void testPublishTerminal_NeverThrottledAndCarriesError() {
        // Arrange
        publisher.publishProgress(job(1L, JobStatus.RUNNING, 50.0));
        Job failed = job(1L, JobStatus.FAILED, 50.0);
        failed.setErrorMessage("Remote job failed");

        // Act
        publisher.publishTerminal(failed);

        // Assert
        List<JobEvent> terminal = channel.eventsOfType(JobEventType.TERMINAL);
        assertEquals(1, terminal.size());
        assertEquals(JobStatus.FAILED, terminal.get(0).getStatus());
        assertEquals("Remote job failed", terminal.get(0).getError());
        assertEquals(7L, terminal.get(0).getStrategyId());
    }

    @Test
    void testFanOut_ChannelFailureDoesNotPropagate() {
        // Arrange
        JobEventChannel broken = new JobEventChannel() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void send(JobEvent event) {
                throw new IllegalStateException("connection refused");
            }
        };
        OrchestratorProperties properties = new OrchestratorProperties();
        JobEventPublisher fanOut = new JobEventPublisher(List.of(broken, channel), clock, properties, Runnable::run);

        // Act & Assert
        assertDoesNotThrow(() -> fanOut.publishTerminal(job(1L, JobStatus.COMPLETED, 100.0)));
        assertEquals(1, channel.events().size());
    }

    @Test
    void testPublish_SlowChannelDoesNotBlockCaller() throws InterruptedException {
        // Arrange - a channel that blocks until released, delivered on its own thread
        CountDownLatch release = new CountDownLatch(1);
        JobEventChannel slow = new JobEventChannel() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public void send(JobEvent event) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        ExecutorService eventExecutor = Executors.newSingleThreadExecutor();
        JobEventPublisher async = new JobEventPublisher(List.of(slow, channel), clock,
                new OrchestratorProperties(), eventExecutor);

        // Act
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            async.publishProgress(job(1L, JobStatus.RUNNING, 10.0));
            async.publishTerminal(job(1L, JobStatus.COMPLETED, 100.0));
        });
        release.countDown();
        eventExecutor.shutdown();
        assertTrue(eventExecutor.awaitTermination(5, TimeUnit.SECONDS));

        // Assert - delivered later, in publish order
        assertEquals(2, channel.events().size());
        assertEquals(JobEventType.PROGRESS_UPDATE, channel.events().get(0).getType());
        assertEquals(JobEventType.TERMINAL, channel.events().get(1).getType());
    }

    private Job job(Long id, JobStatus status, double progress) {
        return Job.builder()
                .id(id)
                .strategyId(7L)
                .kind(JobKind.BACKTEST)
                .status(status)
                .progress(progress)
                .configJson("{}")
                .build();
    }
}
