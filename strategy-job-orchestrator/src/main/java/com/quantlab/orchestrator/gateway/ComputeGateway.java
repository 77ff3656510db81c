package com.quantlab.orchestrator.gateway;

import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobStatusReport;

import java.util.Map;

/**
 * Client for the external compute service that runs training, backtest and labeling work.
 * Every call is bounded by a timeout. Failures are reported as
 * {@link com.quantlab.orchestrator.exception.TransientGatewayException} (retryable, no side effects)
 * or {@link com.quantlab.orchestrator.exception.RemoteRejectedException} (permanent).
 */
public interface ComputeGateway {

    /**
     * Submit a job.
     *
     * @param kind   the kind of work, selects the remote endpoint
     * @param config configuration sent verbatim
     * @return the handle assigned by the remote service
     */
    String submit(JobKind kind, Map<String, Object> config);

    /**
     * Fetch the current status of a submitted job.
     * Polling a finished job returns the same terminal report every time.
     *
     * @param kind   the kind of work
     * @param handle the remote handle
     * @return the normalized status report
     */
    JobStatusReport poll(JobKind kind, String handle);

    /**
     * Ask the remote service to stop a job.
     *
     * @param kind   the kind of work
     * @param handle the remote handle
     */
    void cancel(JobKind kind, String handle);
}
