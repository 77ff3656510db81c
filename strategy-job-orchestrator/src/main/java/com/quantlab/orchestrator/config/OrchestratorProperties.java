package com.quantlab.orchestrator.config;

import com.quantlab.orchestrator.domain.JobKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Settings under the {@code orchestrator} prefix.
 */
@Data
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private Gateway gateway = new Gateway();
    private Dispatch dispatch = new Dispatch();
    private Poller poller = new Poller();
    private Notifications notifications = new Notifications();

    @Data
    public static class Gateway {

        private String baseUrl = "http://localhost:8080";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);
        private String statusPath = "/api/TradeMaster/status";
        private String cancelPath = "/api/TradeMaster/cancel";
        private Map<JobKind, String> submitPaths = defaultSubmitPaths();

        private static Map<JobKind, String> defaultSubmitPaths() {
            Map<JobKind, String> paths = new EnumMap<>(JobKind.class);
            paths.put(JobKind.TRAIN, "/api/TradeMaster/train");
            paths.put(JobKind.BACKTEST, "/api/TradeMaster/test");
            paths.put(JobKind.LABEL, "/api/TradeMaster/start_market_dynamics_labeling");
            return paths;
        }
    }

    @Data
    public static class Dispatch {

        /** Submit retries after the first attempt. */
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(30);
        private int backlogBatchSize = 50;
    }

    @Data
    public static class Poller {

        private boolean enabled = true;
        private int workerCount = 3;
        private Duration tick = Duration.ofSeconds(1);
        private Duration pollInterval = Duration.ofSeconds(5);
        private int maxConsecutivePollFailures = 5;
        private Duration absoluteJobTimeout = Duration.ofHours(12);
        private int maxActiveJobs = 20;
        private long backlogIntervalMs = 5000;
    }

    @Data
    public static class Notifications {

        private double minProgressDelta = 1.0;
        private Duration minInterval = Duration.ofSeconds(5);
        private Redis redis = new Redis();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Redis {

        private boolean enabled = false;
        private String topic = "job-events";
    }
}
