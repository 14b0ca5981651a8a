package com.example.cronscheduler.config;

import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.domain.repository.JobRepository;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.queue.DispatchQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring scheduler and worker health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Runs by status, enabled jobs and dispatch queue depth
 * - Claims and lost claim races
 * - Attempt outcomes, retries and terminal failures
 * - Lease recoveries
 * - Callback latency
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String PREFIX = "cron_scheduler_";

    private final MeterRegistry meterRegistry;
    private final JobRunRepository runRepository;
    private final JobRepository jobRepository;
    private final DispatchQueue dispatchQueue;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : RunStatus.values()) {
            var key = statusKey(status);
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder(PREFIX + "runs", gaugeValues.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of runs by status")
                    .register(meterRegistry);
        }

        gaugeValues.put("jobs_enabled", new AtomicLong(0));
        Gauge.builder(PREFIX + "jobs_enabled", gaugeValues.get("jobs_enabled"), AtomicLong::get)
                .description("Number of enabled jobs")
                .register(meterRegistry);

        gaugeValues.put("queue_depth", new AtomicLong(0));
        Gauge.builder(PREFIX + "queue_depth", gaugeValues.get("queue_depth"), AtomicLong::get)
                .description("Number of dispatch tasks waiting or in flight")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauges from the store
     */
    @Scheduled(fixedDelayString = "${cron-scheduler.metrics-update-interval-ms:30000}")
    public void updateMetrics() {
        try {
            for (var status : RunStatus.values()) {
                gaugeValues.get(statusKey(status)).set(runRepository.countByStatus(status));
            }
            gaugeValues.get("jobs_enabled").set(jobRepository.countByEnabledTrue());
            gaugeValues.get("queue_depth").set(dispatchQueue.depth());
        } catch (DataAccessException e) {
            log.warn("Could not refresh scheduler gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startCallbackTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCallback(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder(PREFIX + "callback_time")
                .tag("success", String.valueOf(success))
                .description("Outbound callback duration")
                .register(meterRegistry));
    }

    /**
     * A scheduler won a claim; {@code source} is due_job, pending or retry
     */
    public void recordClaim(String source) {
        meterRegistry.counter(PREFIX + "claims", "source", source).increment();
    }

    public void recordLostRace(String stage) {
        meterRegistry.counter(PREFIX + "claims_lost", "stage", stage).increment();
    }

    public void recordAttempt(RunStatus outcome) {
        meterRegistry.counter(PREFIX + "attempts", "outcome", outcome.getCode()).increment();
    }

    public void recordRetry(int attemptNumber) {
        meterRegistry.counter(PREFIX + "retries", "attempt", String.valueOf(attemptNumber)).increment();
    }

    public void recordTerminalFailure(String errorType) {
        meterRegistry.counter(PREFIX + "terminal_failures",
                "error_type", errorType != null ? errorType : "unknown").increment();
    }

    public void recordLeaseRecovery(RunStatus outcome) {
        meterRegistry.counter(PREFIX + "lease_recoveries", "outcome", outcome.getCode()).increment();
    }

    /**
     * Dispatch tasks dropped by a worker because they were stale or redelivered
     */
    public void recordDroppedTask(String reason) {
        meterRegistry.counter(PREFIX + "dropped_tasks", "reason", reason).increment();
    }

    public void recordInfrastructureError(String component) {
        meterRegistry.counter(PREFIX + "infrastructure_errors", "component", component).increment();
    }

    private static String statusKey(RunStatus status) {
        return "status_" + status.name().toLowerCase(Locale.ROOT);
    }
}
