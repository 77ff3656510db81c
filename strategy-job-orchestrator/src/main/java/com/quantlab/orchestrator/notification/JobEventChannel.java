package com.quantlab.orchestrator.notification;

/**
 * Transport that delivers job events to clients.
 * Implementations may throw; the publisher isolates failures per channel.
 */
public interface JobEventChannel {

    String name();

    void send(JobEvent event);
}
