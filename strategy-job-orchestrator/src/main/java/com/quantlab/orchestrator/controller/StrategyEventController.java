package com.quantlab.orchestrator.controller;

import com.quantlab.orchestrator.notification.JobEvent;
import com.quantlab.orchestrator.notification.JobEventType;
import com.quantlab.orchestrator.notification.Subscription;
import com.quantlab.orchestrator.service.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Streams a strategy's job events as Server-Sent Events.
 * Event names are {@code progress} and {@code terminal}; the stream stays open until the client leaves.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class StrategyEventController {

    private final JobOrchestrator jobOrchestrator;

    @GetMapping(path = "/strategies/{strategyId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable Long strategyId) {
        SseEmitter emitter = new SseEmitter(0L);

        Subscription subscription = jobOrchestrator.subscribe(strategyId, event -> forward(emitter, event));

        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> subscription.cancel());

        log.info("Opened event stream for strategy {}", strategyId);
        return emitter;
    }

    private void forward(SseEmitter emitter, JobEvent event) {
        String name = event.getType() == JobEventType.TERMINAL ? "terminal" : "progress";
        try {
            emitter.send(SseEmitter.event().name(name).id(String.valueOf(event.getJobId())).data(event));
        } catch (IOException e) {
            log.debug("Event stream of strategy {} closed: {}", event.getStrategyId(), e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
