package com.quantlab.orchestrator.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process channel: delivers events to handlers subscribed per strategy.
 * SSE connections and tests subscribe here.
 */
@Component
@Slf4j
public class SubscriptionRegistry implements JobEventChannel {

    private final Map<Long, List<Consumer<JobEvent>>> handlersByStrategy = new ConcurrentHashMap<>();

    public Subscription subscribe(Long strategyId, Consumer<JobEvent> handler) {
        if (strategyId == null || handler == null) {
            throw new IllegalArgumentException("Strategy ID and handler are required");
        }

        handlersByStrategy.compute(strategyId, (id, handlers) -> {
            List<Consumer<JobEvent>> target = handlers != null ? handlers : new CopyOnWriteArrayList<>();
            target.add(handler);
            return target;
        });
        log.debug("Subscribed handler to strategy {}", strategyId);

        return () -> unsubscribe(strategyId, handler);
    }

    public int subscriberCount(Long strategyId) {
        List<Consumer<JobEvent>> handlers = handlersByStrategy.get(strategyId);
        return handlers != null ? handlers.size() : 0;
    }

    @Override
    public String name() {
        return "in-process";
    }

    @Override
    public void send(JobEvent event) {
        List<Consumer<JobEvent>> handlers = handlersByStrategy.get(event.getStrategyId());
        if (handlers == null || handlers.isEmpty()) {
            return;
        }

        for (Consumer<JobEvent> handler : handlers) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                // One broken subscriber must not starve the others
                log.warn("Subscriber of strategy {} failed on {} event for job {}: {}",
                        event.getStrategyId(), event.getType(), event.getJobId(), e.getMessage());
            }
        }
    }

    private void unsubscribe(Long strategyId, Consumer<JobEvent> handler) {
        handlersByStrategy.computeIfPresent(strategyId, (id, handlers) -> {
            handlers.remove(handler);
            return handlers.isEmpty() ? null : handlers;
        });
        log.debug("Unsubscribed handler from strategy {}", strategyId);
    }
}
