package com.example.cronscheduler.config;

import com.example.cronscheduler.service.retry.BackoffPolicyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the cron scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cron-scheduler")
public class CronSchedulerProperties {

    /**
     * Identity of this instance in leases and logs. Defaults to host-pid.
     */
    private String instanceId;

    /**
     * Scheduler tick in milliseconds
     */
    @Min(100)
    private long pollIntervalMs = 1000;

    /**
     * Maximum due jobs (and claimable runs) handled per tick
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * How long a claimed or executing run belongs to its owner before it can be reclaimed
     */
    @Min(1000)
    private long leaseDurationMs = 120_000;

    /**
     * Upper bound of one outbound callback
     */
    @Min(100)
    private long callbackTimeoutMs = 30_000;

    /**
     * Slack on top of the callback timeout for database writes and queue handling
     */
    @Min(0)
    private long processingOverheadMs = 15_000;

    /**
     * Retry budget used when a job definition does not give one
     */
    @Min(0)
    private int defaultMaxRetries = 3;

    /**
     * Backoff base used when a job definition does not give one
     */
    @Min(0)
    private long defaultRetryBackoffMs = 1000;

    /**
     * Inclusive HTTP status range counted as a successful callback
     */
    @Min(100)
    @Max(599)
    private int successStatusMin = 200;

    @Min(100)
    @Max(599)
    private int successStatusMax = 299;

    /**
     * Longest response body kept in attempt history
     */
    @Min(0)
    private int maxResponseBodyLength = 2000;

    @Min(1000)
    private long leaseSweepIntervalMs = 30_000;

    @Min(1)
    private int historyRetentionDays = 30;

    @Valid
    @NotNull
    private Retry retry = new Retry();

    @Valid
    @NotNull
    private Worker worker = new Worker();

    @AssertTrue(message = "lease-duration-ms must exceed callback-timeout-ms plus processing-overhead-ms")
    public boolean isLeaseLongerThanCallback() {
        return leaseDurationMs > callbackTimeoutMs + processingOverheadMs;
    }

    @AssertTrue(message = "worker.visibility-timeout-ms must exceed callback-timeout-ms")
    public boolean isVisibilityLongerThanCallback() {
        return worker.getVisibilityTimeoutMs() > callbackTimeoutMs;
    }

    @AssertTrue(message = "success-status-min must not be greater than success-status-max")
    public boolean isSuccessRangeOrdered() {
        return successStatusMin <= successStatusMax;
    }

    public boolean isSuccessStatus(int statusCode) {
        return statusCode >= successStatusMin && statusCode <= successStatusMax;
    }

    @Data
    public static class Retry {

        /**
         * Backoff curve between attempts
         */
        @NotNull
        private BackoffPolicyType policy = BackoffPolicyType.EXPONENTIAL;

        /**
         * Ceiling for any single backoff delay
         */
        @Min(0)
        private long maxBackoffMs = 3_600_000;
    }

    @Data
    public static class Worker {

        @Min(50)
        private long pollIntervalMs = 500;

        /**
         * Messages received per poll
         */
        @Min(1)
        private int batchSize = 10;

        /**
         * Callbacks in flight at once on this instance
         */
        @Min(1)
        private int concurrency = 8;

        /**
         * How long a received message stays hidden before it is redelivered
         */
        @Min(1000)
        private long visibilityTimeoutMs = 60_000;
    }
}
