package com.quantlab.orchestrator.notification;

/**
 * Handle returned by a subscribe call. Cancelling twice is harmless.
 */
public interface Subscription {

    void cancel();
}
