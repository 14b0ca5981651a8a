package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * History entry for one callback attempt of a run.
 */
@Entity
@Table(name = "run_attempt_logs", indexes = {
        @Index(name = "idx_attempt_log_run_id", columnList = "run_id"),
        @Index(name = "idx_attempt_log_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunAttemptLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    /**
     * Run status this attempt moved the run to; null if the outcome was discarded
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "resulting_status", length = 30)
    private RunStatus resultingStatus;

    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "success", nullable = false)
    private Boolean success;

    @Column(name = "http_status_code")
    private Integer httpStatusCode;

    @Column(name = "error_type", length = 200)
    private String errorType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Truncated stack trace when no response was received
     */
    @Column(name = "error_stack_trace", columnDefinition = "TEXT")
    private String errorStackTrace;

    /**
     * Response body, truncated
     */
    @Column(name = "response_body", columnDefinition = "TEXT")
    private String responseBody;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        calculateDuration();
    }

    public void calculateDuration() {
        if (durationMs == null && startedAt != null && completedAt != null) {
            this.durationMs = completedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }
}
