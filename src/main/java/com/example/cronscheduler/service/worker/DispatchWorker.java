package com.example.cronscheduler.service.worker;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.queue.DispatchDelivery;
import com.example.cronscheduler.queue.DispatchQueue;
import com.example.cronscheduler.support.InstanceIdentity;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes dispatch tasks and runs them on the callback executor.
 * <p>
 * Flow:
 * 1. Receive up to one batch of visible tasks (hidden for the visibility timeout)
 * 2. Execute each on the callback executor
 * 3. Acknowledge a task once its attempt has been handled, dropped ones included
 * <p>
 * A task whose handling throws is not acknowledged and is redelivered later.
 */
@Slf4j
@Service
public class DispatchWorker {

    private final DispatchQueue dispatchQueue;
    private final RunExecutionService runExecutionService;
    private final CronSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final InstanceIdentity instanceIdentity;
    private final ExecutorService callbackExecutor;
    private final Retry queueRetry;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public DispatchWorker(DispatchQueue dispatchQueue, RunExecutionService runExecutionService,
                          CronSchedulerProperties properties, MetricsConfig metricsConfig,
                          InstanceIdentity instanceIdentity,
                          @Qualifier("callbackExecutor") ExecutorService callbackExecutor,
                          RetryRegistry retryRegistry) {
        this.dispatchQueue = dispatchQueue;
        this.runExecutionService = runExecutionService;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.instanceIdentity = instanceIdentity;
        this.callbackExecutor = callbackExecutor;
        this.queueRetry = retryRegistry.retry("dispatchQueue");
    }

    @Scheduled(fixedDelayString = "${cron-scheduler.worker.poll-interval-ms:500}")
    public void poll() {
        pollOnce();
    }

    /**
     * Receive and handle one batch.
     *
     * @return outcome counts of the handled tasks; tasks left for redelivery are not counted
     */
    public Map<ExecutionOutcome, Integer> pollOnce() {
        var outcomes = new EnumMap<ExecutionOutcome, Integer>(ExecutionOutcome.class);
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous worker poll still running, skipping");
            return outcomes;
        }

        try {
            var worker = properties.getWorker();
            var maxMessages = Math.min(worker.getBatchSize(), worker.getConcurrency());
            var visibilityTimeout = Duration.ofMillis(worker.getVisibilityTimeoutMs());

            List<DispatchDelivery> deliveries = queueRetry.executeSupplier(
                    () -> dispatchQueue.receive(instanceIdentity.getId(), maxMessages, visibilityTimeout));

            if (deliveries.isEmpty()) {
                return outcomes;
            }

            log.debug("Received {} dispatch tasks", deliveries.size());

            var futures = new ArrayList<CompletableFuture<ExecutionOutcome>>(deliveries.size());
            for (var delivery : deliveries) {
                futures.add(CompletableFuture.supplyAsync(() -> process(delivery), callbackExecutor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .orTimeout(worker.getVisibilityTimeoutMs(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        log.error("Error waiting for dispatch tasks to finish: {}", ex.getMessage());
                        return null;
                    })
                    .join();

            for (var future : futures) {
                var outcome = future.getNow(null);
                if (outcome != null) {
                    outcomes.merge(outcome, 1, Integer::sum);
                }
            }
            return outcomes;
        } catch (RuntimeException e) {
            log.error("Dispatch queue unavailable, will retry next poll: {}", e.getMessage(), e);
            metricsConfig.recordInfrastructureError("dispatch_queue");
            return outcomes;
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Handle one delivery; null means it was left for redelivery
     */
    private ExecutionOutcome process(DispatchDelivery delivery) {
        var task = delivery.getTask();
        try {
            var outcome = runExecutionService.execute(task);
            if (!queueRetry.executeSupplier(() -> dispatchQueue.acknowledge(delivery))) {
                log.debug("Dispatch task for run {} was redelivered before acknowledgement", task.getRunId());
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Error handling dispatch task for run {} attempt {}, leaving it for redelivery: {}",
                    task.getRunId(), task.getAttempt(), e.getMessage(), e);
            metricsConfig.recordInfrastructureError("worker");
            return null;
        }
    }
}
