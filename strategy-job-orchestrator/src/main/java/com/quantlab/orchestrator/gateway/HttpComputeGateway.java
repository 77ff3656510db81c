package com.quantlab.orchestrator.gateway;

import com.quantlab.orchestrator.config.OrchestratorProperties;
import com.quantlab.orchestrator.domain.JobKind;
import com.quantlab.orchestrator.domain.JobStatusReport;
import com.quantlab.orchestrator.exception.RemoteRejectedException;
import com.quantlab.orchestrator.exception.TransientGatewayException;
import com.quantlab.orchestrator.gateway.dto.RemoteStatusResponse;
import com.quantlab.orchestrator.gateway.dto.RemoteSubmitResponse;
import com.quantlab.orchestrator.repository.JobMutations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * {@link ComputeGateway} over HTTP/JSON.
 *
 * <p>Classification: connect/read timeouts, I/O errors, 5xx, 429 and unreadable bodies are
 * transient; other 4xx responses are rejections.
 */
@Component
@Slf4j
public class HttpComputeGateway implements ComputeGateway {

    private static final Set<String> TERMINAL_REMOTE_STATUSES = Set.of("completed", "failed", "stopped", "cancelled", "error");
    private static final Set<String> FAILED_REMOTE_STATUSES = Set.of("failed", "error");

    private final RestTemplate restTemplate;
    private final OrchestratorProperties.Gateway settings;

    public HttpComputeGateway(@Qualifier("computeRestTemplate") RestTemplate restTemplate,
                              OrchestratorProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getGateway();
    }

    @Override
    public String submit(JobKind kind, Map<String, Object> config) {
        String path = settings.getSubmitPaths().get(kind);
        if (path == null) {
            throw new RemoteRejectedException("No submit endpoint configured for job kind " + kind);
        }

        log.info("Submitting {} job to compute service: POST {}", kind, path);
        RemoteSubmitResponse response = execute("submit", () ->
                restTemplate.postForObject(path, config != null ? config : Collections.emptyMap(),
                        RemoteSubmitResponse.class));

        String handle = response != null ? response.resolveHandle() : null;
        if (handle == null) {
            throw new RemoteRejectedException("Compute service accepted " + kind + " job but returned no handle");
        }

        log.info("Compute service accepted {} job with handle {}", kind, handle);
        return handle;
    }

    @Override
    public JobStatusReport poll(JobKind kind, String handle) {
        RemoteStatusResponse response = execute("status", () ->
                restTemplate.getForObject(settings.getStatusPath() + "?handle={handle}",
                        RemoteStatusResponse.class, handle));

        if (response == null) {
            throw new TransientGatewayException("Empty status response for handle " + handle);
        }

        JobStatusReport report = normalize(response);
        log.debug("Handle {} reported {} ({}%), terminal={}", handle, report.getRemoteStatus(),
                report.getProgress(), report.isTerminal());
        return report;
    }

    @Override
    public void cancel(JobKind kind, String handle) {
        log.info("Cancelling {} job with handle {}", kind, handle);
        execute("cancel", () -> restTemplate.postForObject(settings.getCancelPath(),
                Map.of("handle", handle), Void.class));
    }

    static JobStatusReport normalize(RemoteStatusResponse response) {
        String remoteStatus = response.getRemoteStatus() != null
                ? response.getRemoteStatus().trim().toLowerCase()
                : "unknown";
        boolean terminal = Boolean.TRUE.equals(response.getTerminal())
                || TERMINAL_REMOTE_STATUSES.contains(remoteStatus);

        String error = response.getError();
        if (terminal && (error == null || error.isBlank()) && FAILED_REMOTE_STATUSES.contains(remoteStatus)) {
            error = "Remote job failed";
        }

        return JobStatusReport.builder()
                .remoteStatus(remoteStatus)
                .progress(response.getProgress() != null ? JobMutations.clampProgress(response.getProgress()) : 0.0)
                .logDelta(response.getLogsDelta())
                .metricsDelta(response.getMetricsDelta() != null ? response.getMetricsDelta() : Collections.emptyMap())
                .terminal(terminal)
                .error(error != null && !error.isBlank() ? error : null)
                .build();
    }

    private <T> T execute(String operation, RemoteCall<T> call) {
        try {
            return call.execute();
        } catch (HttpStatusCodeException e) {
            HttpStatusCode status = e.getStatusCode();
            if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("Compute service {} returned {}", operation, status.value());
                throw new TransientGatewayException("Compute service " + operation + " returned " + status.value(), e);
            }
            log.warn("Compute service rejected {}: {} {}", operation, status.value(), e.getResponseBodyAsString());
            throw new RemoteRejectedException("Compute service rejected " + operation + " (" + status.value() + "): "
                    + describe(e), status.value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Compute service {} timed out or was unreachable: {}", operation, e.getMessage());
            throw new TransientGatewayException("Compute service " + operation + " timed out or was unreachable: "
                    + e.getMessage(), e);
        } catch (RestClientException e) {
            // Unreadable or unexpected body
            log.warn("Compute service {} failed: {}", operation, e.getMessage());
            throw new TransientGatewayException("Compute service " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static String describe(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        return body.isBlank() ? e.getStatusText() : body;
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T execute();
    }
}
