package com.example.cronscheduler.service.scheduler;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.Job;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.domain.repository.JobRepository;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.schedule.DueTimeCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;

/**
 * Claims due occurrences and reclaimable runs on behalf of a scheduler instance.
 * <p>
 * Claiming a due occurrence is one transaction:
 * 1. Conditional update of the job (version unchanged, still enabled, no active run)
 *    that advances next_run_at to the following occurrence
 * 2. Insert of the CLAIMED run with this instance's lease
 * <p>
 * The unique (job_id, scheduled_for) key on runs backs up the conditional update.
 * Losing at either step is a normal outcome and yields an empty result.
 */
@Slf4j
@Service
public class JobClaimService {

    private final JobRepository jobRepository;
    private final JobRunRepository runRepository;
    private final DueTimeCalculator dueTimeCalculator;
    private final CronSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final TransactionTemplate transactionTemplate;

    public JobClaimService(JobRepository jobRepository, JobRunRepository runRepository,
                           DueTimeCalculator dueTimeCalculator, CronSchedulerProperties properties,
                           MetricsConfig metricsConfig, PlatformTransactionManager transactionManager) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.dueTimeCalculator = dueTimeCalculator;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Try to claim the occurrence {@code job.nextRunAt} for {@code ownerId}.
     *
     * @return the new CLAIMED run, or empty if another instance won or the job changed
     */
    public Optional<JobRun> claimOccurrence(Job job, String ownerId, Instant now) {
        var scheduledFor = job.getNextRunAt();
        // Missed occurrences collapse into this one: the next is computed from now at the earliest
        var after = scheduledFor.isAfter(now) ? scheduledFor : now;
        var nextRunAt = dueTimeCalculator.nextOccurrence(job, after).orElse(null);

        try {
            var run = transactionTemplate.execute(status -> {
                var updated = jobRepository.claimOccurrence(job.getId(), job.getVersion(), scheduledFor, nextRunAt, now);
                if (updated == 0) {
                    return null;
                }
                return runRepository.saveAndFlush(newClaimedRun(job, scheduledFor, ownerId, now));
            });

            if (run == null) {
                log.debug("Lost claim on job {} occurrence {} (job changed or claimed elsewhere)", job.getName(), scheduledFor);
                metricsConfig.recordLostRace("job");
                return Optional.empty();
            }

            log.info("Claimed job {} occurrence {} as run {} (next run at {})",
                    job.getName(), scheduledFor, run.getId(), nextRunAt);
            metricsConfig.recordClaim("due_job");
            return Optional.of(run);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Lost claim race on job {} occurrence {}: {}", job.getName(), scheduledFor, e.getMessage());
            metricsConfig.recordLostRace("job");
            return Optional.empty();
        }
    }

    /**
     * Try to claim a PENDING run (recovered lease) or a RETRY_SCHEDULED run that is due.
     *
     * @return true if this instance now owns the run
     */
    public boolean claimRun(JobRun run, String ownerId, Instant now) {
        if (run.getStatus() != RunStatus.PENDING && run.getStatus() != RunStatus.RETRY_SCHEDULED) {
            throw new IllegalArgumentException("Run " + run.getId() + " is not claimable in status " + run.getStatus());
        }
        var leaseUntil = now.plusMillis(properties.getLeaseDurationMs());
        try {
            var updated = runRepository.claimRun(run.getId(), run.getVersion(), run.getStatus(), ownerId, leaseUntil, now);
            if (updated == 0) {
                log.debug("Lost claim on run {} ({})", run.getId(), run.getStatus());
                metricsConfig.recordLostRace("run");
                return false;
            }
        } catch (ConcurrencyFailureException e) {
            log.debug("Lost claim race on run {}: {}", run.getId(), e.getMessage());
            metricsConfig.recordLostRace("run");
            return false;
        }

        log.info("Claimed {} run {} of job {} for attempt {}",
                run.getStatus().getDisplayName().toLowerCase(), run.getId(), run.getJobName(), run.getAttempt() + 1);
        metricsConfig.recordClaim(run.getStatus() == RunStatus.PENDING ? "pending" : "retry");
        return true;
    }

    private JobRun newClaimedRun(Job job, Instant scheduledFor, String ownerId, Instant now) {
        return JobRun.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .scheduledFor(scheduledFor)
                .status(RunStatus.CLAIMED)
                .attempt(0)
                .callbackUrl(job.getCallbackUrl())
                .callbackMethod(job.getCallbackMethod())
                .payloadTemplate(job.getPayloadTemplate())
                .callbackHeaders(job.getCallbackHeaders() != null ? new HashMap<>(job.getCallbackHeaders()) : new HashMap<>())
                .maxRetries(job.getMaxRetries())
                .retryBackoffMs(job.getRetryBackoffMs())
                .leaseOwner(ownerId)
                .leaseExpiresAt(now.plusMillis(properties.getLeaseDurationMs()))
                .createdAt(now)
                .build();
    }
}
