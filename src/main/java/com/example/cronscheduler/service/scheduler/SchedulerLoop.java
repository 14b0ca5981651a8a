package com.example.cronscheduler.service.scheduler;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.Job;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.repository.JobRepository;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.exception.InvalidScheduleException;
import com.example.cronscheduler.queue.DispatchQueue;
import com.example.cronscheduler.queue.DispatchTask;
import com.example.cronscheduler.support.InstanceIdentity;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discovers due work and hands each occurrence to exactly one dispatch.
 * <p>
 * Every instance runs this loop; there is no leader. Exclusivity comes from the
 * conditional writes in {@link JobClaimService}.
 * <p>
 * Flow per tick:
 * 1. Enabled jobs with next_run_at due and no active run: claim the occurrence, enqueue attempt 1
 * 2. PENDING runs and RETRY_SCHEDULED runs whose backoff elapsed: claim, enqueue the next attempt
 * <p>
 * An enqueue failure is not retried here: the CLAIMED run's lease runs out and lease
 * recovery makes it claimable again.
 */
@Slf4j
@Service
public class SchedulerLoop {

    private final JobRepository jobRepository;
    private final JobRunRepository runRepository;
    private final JobClaimService claimService;
    private final DispatchQueue dispatchQueue;
    private final CronSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;
    private final Retry storeRetry;
    private final Retry queueRetry;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public SchedulerLoop(JobRepository jobRepository, JobRunRepository runRepository, JobClaimService claimService,
                         DispatchQueue dispatchQueue, CronSchedulerProperties properties, MetricsConfig metricsConfig,
                         InstanceIdentity instanceIdentity, Clock clock, RetryRegistry retryRegistry) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.claimService = claimService;
        this.dispatchQueue = dispatchQueue;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.instanceIdentity = instanceIdentity;
        this.clock = clock;
        this.storeRetry = retryRegistry.retry("jobStore");
        this.queueRetry = retryRegistry.retry("dispatchQueue");
    }

    @Scheduled(fixedDelayString = "${cron-scheduler.poll-interval-ms:1000}")
    public void tick() {
        runOnce();
    }

    public TickResult runOnce() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous scheduler tick still running, skipping");
            return TickResult.skippedTick();
        }

        var result = TickResult.builder();
        try {
            var now = clock.instant();
            var owner = instanceIdentity.getId();
            var page = PageRequest.of(0, properties.getBatchSize());

            List<Job> dueJobs = storeRetry.executeSupplier(() -> jobRepository.findDueJobs(now, page));
            result.dueJobs(dueJobs.size());

            var claimed = 0;
            var lost = 0;
            var enqueueFailures = 0;
            for (var job : dueJobs) {
                // Each claim takes its own time: leases run from the claim, not from the start of the tick
                var run = claimDueJob(job, owner, clock.instant());
                if (run == null) {
                    lost++;
                    continue;
                }
                claimed++;
                if (!enqueue(run, 1)) {
                    enqueueFailures++;
                }
            }

            List<JobRun> claimable = storeRetry.executeSupplier(() -> runRepository.findClaimableRuns(now, page));
            var reclaimed = 0;
            for (var run : claimable) {
                if (!claimService.claimRun(run, owner, clock.instant())) {
                    lost++;
                    continue;
                }
                reclaimed++;
                if (!enqueue(run, run.getAttempt() + 1)) {
                    enqueueFailures++;
                }
            }

            if (claimed + reclaimed > 0) {
                log.info("Scheduler tick: {} due jobs, {} occurrences claimed, {} runs re-dispatched, {} lost races",
                        dueJobs.size(), claimed, reclaimed, lost);
            } else {
                log.debug("Scheduler tick: nothing to dispatch ({} due, {} lost races)", dueJobs.size(), lost);
            }

            return result.claimedOccurrences(claimed)
                    .claimedRuns(reclaimed)
                    .lostRaces(lost)
                    .enqueueFailures(enqueueFailures)
                    .build();
        } catch (RuntimeException e) {
            log.error("Job store unavailable, scheduler tick aborted: {}", e.getMessage(), e);
            metricsConfig.recordInfrastructureError("job_store");
            return result.storeUnavailable(true).build();
        } finally {
            isRunning.set(false);
        }
    }

    private JobRun claimDueJob(Job job, String owner, Instant now) {
        try {
            return claimService.claimOccurrence(job, owner, now).orElse(null);
        } catch (InvalidScheduleException e) {
            log.error("Job {} has an unusable schedule and is skipped: {}", job.getName(), e.getMessage());
            return null;
        }
    }

    private boolean enqueue(JobRun run, int attempt) {
        var task = DispatchTask.builder()
                .jobId(run.getJobId())
                .runId(run.getId())
                .attempt(attempt)
                .build();
        try {
            queueRetry.executeRunnable(() -> dispatchQueue.enqueue(task));
            return true;
        } catch (RuntimeException e) {
            log.error("Could not enqueue run {} attempt {}; it will be recovered when its lease expires: {}",
                    run.getId(), attempt, e.getMessage());
            metricsConfig.recordInfrastructureError("dispatch_queue");
            return false;
        }
    }
}
