package com.quantlab.orchestrator.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity representing one unit of work executed on the external compute service.
 * Training, backtest and labeling runs share this table and are told apart by {@link JobKind}.
 *
 * <p>{@code activeStrategyId} mirrors {@code strategyId} while the job is PENDING or RUNNING and is
 * cleared on the terminal transition. Its unique constraint keeps at most one active job per
 * strategy even if two inserts slip past the application check.
 */
@Entity
@Table(name = "jobs", uniqueConstraints = {
        @UniqueConstraint(name = "uk_jobs_active_strategy", columnNames = "active_strategy_id")
}, indexes = {
        @Index(name = "idx_jobs_status", columnList = "status"),
        @Index(name = "idx_jobs_strategy", columnList = "strategy_id"),
        @Index(name = "idx_jobs_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    @Column(name = "version")
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private JobKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "progress", nullable = false)
    @Builder.Default
    private Double progress = 0.0;

    @Column(name = "config_json", nullable = false, columnDefinition = "TEXT")
    private String configJson;

    @Column(name = "metrics_json", columnDefinition = "TEXT")
    private String metricsJson;

    @Column(name = "logs", columnDefinition = "TEXT")
    private String logs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "external_handle", length = 255)
    private String externalHandle;

    @Column(name = "strategy_id", nullable = false)
    private Long strategyId;

    @Column(name = "active_strategy_id")
    private Long activeStrategyId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = 3;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "last_polled_at")
    private LocalDateTime lastPolledAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
