package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.CallbackMethod;
import com.example.cronscheduler.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One occurrence of a job.
 * <p>
 * The callback definition and retry budget are copied from the job at claim time,
 * so the run can finish even if its job is edited or deleted while in flight.
 * There is deliberately no foreign key to {@code jobs}.
 */
@Entity
@Table(name = "job_runs", indexes = {
        @Index(name = "idx_run_job_status", columnList = "job_id, status"),
        @Index(name = "idx_run_status_next_attempt", columnList = "status, next_attempt_at"),
        @Index(name = "idx_run_status_lease", columnList = "status, lease_expires_at"),
        @Index(name = "idx_run_completed_at", columnList = "completed_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_run_job_occurrence", columnNames = {"job_id", "scheduled_for"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "job_name", nullable = false, length = 100, updatable = false)
    private String jobName;

    /**
     * The occurrence this run fires for
     */
    @Column(name = "scheduled_for", nullable = false, updatable = false)
    private Instant scheduledFor;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private RunStatus status;

    /**
     * Number of attempts started so far
     */
    @Column(name = "attempt", nullable = false)
    @Builder.Default
    private Integer attempt = 0;

    // === Snapshot of the job definition ===

    @Column(name = "callback_url", nullable = false, length = 2048)
    private String callbackUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "callback_method", nullable = false, length = 10)
    private CallbackMethod callbackMethod;

    @Column(name = "payload_template", columnDefinition = "TEXT")
    private String payloadTemplate;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "callback_headers")
    @Builder.Default
    private Map<String, String> callbackHeaders = new HashMap<>();

    @Column(name = "max_retries", nullable = false)
    private Integer maxRetries;

    @Column(name = "retry_backoff_ms", nullable = false)
    private Long retryBackoffMs;

    // === Lease ===

    @Column(name = "lease_owner", length = 100)
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    // === Outcome ===

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_http_status")
    private Integer lastHttpStatus;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = this.createdAt;
        if (this.attempt == null) {
            this.attempt = 0;
        }
        if (this.callbackHeaders == null) {
            this.callbackHeaders = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Attempts this run may make. A zero retry budget still gets its single attempt.
     */
    public int getEffectiveMaxAttempts() {
        return Math.max(1, maxRetries != null ? maxRetries : 0);
    }

    public boolean hasAttemptsLeft() {
        return attempt < getEffectiveMaxAttempts();
    }
}
