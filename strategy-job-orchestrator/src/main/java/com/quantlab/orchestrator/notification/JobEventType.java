package com.quantlab.orchestrator.notification;

/**
 * Kind of job event. A job emits any number of progress updates and exactly one terminal event.
 */
public enum JobEventType {
    PROGRESS_UPDATE,
    TERMINAL
}
