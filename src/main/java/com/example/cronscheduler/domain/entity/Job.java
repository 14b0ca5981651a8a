package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.CallbackMethod;
import com.example.cronscheduler.domain.enums.ScheduleKind;
import com.example.cronscheduler.schedule.JobSchedule;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A job definition: when it fires and which HTTP callback it performs.
 * <p>
 * Supports:
 * - Recurring (five-field cron in a time zone) or one-shot schedules, mutually exclusive
 * - Callback target with method, header set and payload template
 * - Per-job retry budget and backoff base
 * - Optimistic versioning used by the scheduler's claim compare-and-swap
 * <p>
 * The scheduler only ever advances {@code nextRunAt}/{@code lastRunAt}; everything
 * else is owned by the definition API.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_job_enabled_next_run", columnList = "enabled, next_run_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_job_name", columnNames = "name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Unique, human-chosen identity used by the API
     */
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    // === Schedule (exactly one of cron / runAt) ===

    @Column(name = "cron_expression", length = 120)
    private String cronExpression;

    /**
     * Zone the cron expression is evaluated in
     */
    @Column(name = "time_zone", nullable = false, length = 64)
    @Builder.Default
    private String timeZone = "UTC";

    /**
     * Fixed instant for one-shot jobs
     */
    @Column(name = "run_at")
    private Instant runAt;

    // === Callback target ===

    @Column(name = "callback_url", nullable = false, length = 2048)
    private String callbackUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "callback_method", nullable = false, length = 10)
    @Builder.Default
    private CallbackMethod callbackMethod = CallbackMethod.POST;

    /**
     * Request body template; placeholders are substituted per attempt
     */
    @Column(name = "payload_template", columnDefinition = "TEXT")
    private String payloadTemplate;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "callback_headers")
    @Builder.Default
    private Map<String, String> callbackHeaders = new HashMap<>();

    // === Retry configuration ===

    @Column(name = "max_retries", nullable = false)
    private Integer maxRetries;

    @Column(name = "retry_backoff_ms", nullable = false)
    private Long retryBackoffMs;

    // === Scheduling state ===

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private Boolean enabled = Boolean.TRUE;

    /**
     * Next due occurrence; null when the schedule has no future occurrence
     */
    @Column(name = "next_run_at")
    private Instant nextRunAt;

    /**
     * Scheduled-for time of the most recently claimed occurrence
     */
    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.enabled == null) {
            this.enabled = Boolean.TRUE;
        }
        if (this.callbackHeaders == null) {
            this.callbackHeaders = new HashMap<>();
        }
        if (this.timeZone == null) {
            this.timeZone = "UTC";
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    public JobSchedule schedule() {
        return JobSchedule.of(cronExpression, runAt, timeZone);
    }

    public ScheduleKind getScheduleKind() {
        return cronExpression != null ? ScheduleKind.CRON : ScheduleKind.ONE_SHOT;
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }
}
