package com.quantlab.orchestrator.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.quantlab.orchestrator.domain.Job;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobStatus;
import com.quantlab.orchestrator.domain.JobStatusReport;
import com.quantlab.orchestrator.domain.StrategyStatus;
import com.quantlab.orchestrator.exception.RemoteRejectedException;
import com.quantlab.orchestrator.exception.TransientGatewayException;
import com.quantlab.orchestrator.notification.JobEventType;
import com.quantlab.orchestrator.support.FakeComputeGateway;
import com.quantlab.orchestrator.support.OrchestratorFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for one-poll-at-a-time status tracking of RUNNING jobs.
 */
class JobPollerTest {

    private static final String HANDLE = "handle-1";

    private OrchestratorFixture fixture;
    private Long strategyId;
    private Long jobId;
    private PollingState state;

    @BeforeEach
    void setUp() {
        fixture = new OrchestratorFixture();
        strategyId = fixture.store.addStrategy("momentum", 1L);
        jobId = fixture.dispatcher.submit(strategyId, 1L, JobKind.TRAIN, Map.of()).getId();
        state = new PollingState();
        fixture.channel.clear();
    }

    @Test
    void testPollOnce_StoresProgressAndPublishes() {
        // Arrange
        fixture.gateway.onPoll(HANDLE, JobStatusReport.builder()
                .remoteStatus("running")
                .progress(35.0)
                .logDelta("epoch 1 done")
                .metricsDelta(Map.of("loss", 0.8))
                .build());

        // Act
        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        // Assert
        Job job = fixture.store.require(jobId);
        assertEquals(PollOutcome.PROGRESS, outcome);
        assertEquals(35.0, job.getProgress());
        assertEquals("epoch 1 done", job.getLogs().substring(job.getLogs().lastIndexOf('\n') + 1));
        assertTrue(job.getMetricsJson().contains("\"loss\":0.8"));
        assertNotNull(job.getLastPolledAt());
        assertEquals(1, fixture.channel.eventsOfType(JobEventType.PROGRESS_UPDATE).size());
    }

    @Test
    void testPollOnce_RateLimitedWithinPollInterval() {
        fixture.poller.pollOnce(jobId, state);

        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        assertEquals(PollOutcome.SKIPPED, outcome);
        assertEquals(1, fixture.gateway.pollCalls());
    }

    @Test
    void testPollOnce_CompletedMergesMetricsAndFinishes() throws Exception {
        // Arrange
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.completed(Map.of("sharpe", 1.4)));

        // Act
        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        // Assert
        Job job = fixture.store.require(jobId);
        assertEquals(PollOutcome.FINISHED, outcome);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(100.0, job.getProgress());
        assertNotNull(job.getCompletedAt());
        Map<String, Object> metrics = fixture.objectMapper.readValue(job.getMetricsJson(), new TypeReference<>() {
        });
        assertEquals(1.4, metrics.get("sharpe"));
        assertFalse(fixture.activeJobIndex.contains(jobId));
        assertEquals(0, fixture.concurrencyGuard.slotsInUse());
        assertEquals(StrategyStatus.STOPPED, fixture.store.strategyStatus(strategyId));
        assertEquals(1.0, fixture.counter("orchestrator.jobs.completed"));
    }

    @Test
    void testPollOnce_RemoteFailureRecordsError() {
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.failed("CUDA out of memory"));

        fixture.poller.pollOnce(jobId, state);

        Job job = fixture.store.require(jobId);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("CUDA out of memory", job.getErrorMessage());
        assertEquals(StrategyStatus.ERROR, fixture.store.strategyStatus(strategyId));
    }

    @Test
    void testPollOnce_RemoteStopIsCancellation() {
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.stopped());

        fixture.poller.pollOnce(jobId, state);

        Job job = fixture.store.require(jobId);
        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertNull(job.getErrorMessage());
    }

    @Test
    void testPollOnce_RejectedStatusRequestFailsJob() {
        fixture.gateway.onPollThrow(HANDLE, new RemoteRejectedException("Compute service rejected status (404): unknown handle"));

        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        assertEquals(PollOutcome.FINISHED, outcome);
        assertTrue(fixture.store.require(jobId).getErrorMessage()
                .startsWith("Remote service rejected status request: "));
    }

    @Test
    void testPollOnce_SuccessResetsFailureStreak() {
        // Arrange - five failures, one success, five failures
        for (int i = 0; i < 5; i++) {
            fixture.gateway.onPollThrow(HANDLE, new TransientGatewayException("Compute service status timed out"));
        }
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.running(20.0));
        for (int i = 0; i < 5; i++) {
            fixture.gateway.onPollThrow(HANDLE, new TransientGatewayException("Compute service status timed out"));
        }
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.running(30.0));

        // Act
        for (int i = 0; i < 11; i++) {
            fixture.poller.pollOnce(jobId, state);
            fixture.nextPollWindow();
        }

        // Assert
        assertEquals(JobStatus.RUNNING, fixture.store.require(jobId).getStatus());
        assertEquals(5, state.getConsecutiveFailures());
    }

    @Test
    void testPollOnce_AbsoluteTimeoutFailsWithoutPolling() {
        // Arrange
        fixture.clock.advance(Duration.ofHours(13));

        // Act
        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        // Assert
        Job job = fixture.store.require(jobId);
        assertEquals(PollOutcome.FINISHED, outcome);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(job.getErrorMessage().startsWith("Job timed out: exceeded absolute timeout"));
        assertEquals(0, fixture.gateway.pollCalls());
        assertEquals(1, fixture.channel.eventsOfType(JobEventType.TERMINAL).size());
    }

    @Test
    void testPollOnce_TerminalJobPolledAgainIsDropped() {
        // Arrange
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.completed(Map.of()));
        fixture.poller.pollOnce(jobId, state);
        fixture.nextPollWindow();
        Job finished = fixture.store.require(jobId);

        // Act
        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        // Assert
        assertEquals(PollOutcome.DROPPED, outcome);
        assertEquals(1, fixture.gateway.pollCalls());
        assertEquals(finished, fixture.store.require(jobId));
        assertEquals(1, fixture.channel.eventsOfType(JobEventType.TERMINAL).size());
    }

    @Test
    void testPollOnce_CancelledJobIsDroppedWithoutSecondTerminalEvent() {
        // Arrange
        fixture.gateway.onPoll(HANDLE, FakeComputeGateway.completed(Map.of()));
        fixture.dispatcher.cancel(jobId, "Cancelled by request");

        // Act
        PollOutcome outcome = fixture.poller.pollOnce(jobId, state);

        // Assert
        assertEquals(PollOutcome.DROPPED, outcome);
        assertEquals(JobStatus.CANCELLED, fixture.store.require(jobId).getStatus());
        assertEquals(1, fixture.channel.eventsOfType(JobEventType.TERMINAL).size());
    }

    @Test
    void testPollOnce_BlockingSubscriberDoesNotDelayPoll() throws InterruptedException {
        // Arrange - events go to a single delivery thread held up by a stuck subscriber
        ExecutorService eventExecutor = Executors.newSingleThreadExecutor();
        OrchestratorFixture async = new OrchestratorFixture(OrchestratorFixture.defaultProperties(), eventExecutor);
        Long otherStrategy = async.store.addStrategy("mean-reversion", 2L);
        CountDownLatch release = new CountDownLatch(1);
        async.subscriptions.subscribe(otherStrategy, e -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        Long otherJob = async.dispatcher.submit(otherStrategy, 2L, JobKind.BACKTEST, Map.of()).getId();
        async.gateway.onPoll(HANDLE, FakeComputeGateway.completed(Map.of("sharpe", 1.4)));

        // Act
        PollOutcome outcome = assertTimeoutPreemptively(Duration.ofSeconds(1),
                () -> async.poller.pollOnce(otherJob, new PollingState()));
        release.countDown();
        eventExecutor.shutdown();
        assertTrue(eventExecutor.awaitTermination(5, TimeUnit.SECONDS));

        // Assert
        assertEquals(PollOutcome.FINISHED, outcome);
        assertEquals(JobStatus.COMPLETED, async.store.require(otherJob).getStatus());
        assertEquals(1, async.channel.eventsOfType(JobEventType.TERMINAL).size());
    }
}
