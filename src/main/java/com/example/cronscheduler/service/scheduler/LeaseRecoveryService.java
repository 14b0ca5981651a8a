package com.example.cronscheduler.service.scheduler;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.service.alert.SlackAlertService;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Takes back runs whose owner stopped renewing its lease (crash, partition, stuck callback).
 * <p>
 * A run with attempts left goes back to PENDING and the scheduler loop claims it again;
 * one whose last attempt was already started is failed terminally, so a crash never
 * grants an extra attempt. Recovery gives at-least-once execution.
 */
@Slf4j
@Service
public class LeaseRecoveryService {

    static final String LEASE_EXPIRED_ERROR = "LEASE_EXPIRED: owner %s did not finish attempt %d in time";

    private final JobRunRepository runRepository;
    private final CronSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    public LeaseRecoveryService(JobRunRepository runRepository, CronSchedulerProperties properties,
                                MetricsConfig metricsConfig, SlackAlertService slackAlertService, Clock clock) {
        this.runRepository = runRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.slackAlertService = slackAlertService;
        this.clock = clock;
    }

    /**
     * Periodic sweep. ShedLock keeps it to one instance at a time; the per-run
     * conditional update keeps it correct even without the lock.
     */
    @Scheduled(fixedDelayString = "${cron-scheduler.lease-sweep-interval-ms:30000}")
    @SchedulerLock(name = "leaseRecoverySweep", lockAtLeastFor = "5s", lockAtMostFor = "5m")
    public void sweep() {
        try {
            recoverExpiredLeases();
        } catch (DataAccessException e) {
            log.error("Lease recovery sweep failed, will retry next interval: {}", e.getMessage(), e);
            metricsConfig.recordInfrastructureError("lease_recovery");
        }
    }

    /**
     * @return number of runs recovered
     */
    public int recoverExpiredLeases() {
        var now = clock.instant();
        var expired = runRepository.findExpiredLeases(now, PageRequest.of(0, properties.getBatchSize()));

        if (expired.isEmpty()) {
            log.debug("No expired leases found");
            return 0;
        }

        log.warn("Found {} runs with expired leases", expired.size());

        var recovered = 0;
        for (var run : expired) {
            if (recover(run, now)) {
                recovered++;
            }
        }

        log.info("Recovered {} of {} runs with expired leases", recovered, expired.size());
        return recovered;
    }

    private boolean recover(JobRun run, Instant now) {
        // EXECUTING with attempt n means attempt n started; CLAIMED means it had not
        var target = run.hasAttemptsLeft() ? RunStatus.PENDING : RunStatus.FAILED_TERMINAL;
        if (!run.getStatus().canTransitionTo(target)) {
            log.warn("Run {} in status {} cannot move to {}; skipping lease recovery", run.getId(), run.getStatus(), target);
            return false;
        }
        var error = String.format(LEASE_EXPIRED_ERROR, run.getLeaseOwner(), run.getAttempt());

        var updated = runRepository.recoverExpiredLease(run.getId(), run.getVersion(), target,
                error, target.isTerminal() ? now : null, now);
        if (updated == 0) {
            log.debug("Run {} changed before its lease could be recovered", run.getId());
            return false;
        }

        metricsConfig.recordLeaseRecovery(target);
        if (target == RunStatus.FAILED_TERMINAL) {
            log.error("Run {} of job {} failed terminally: lease of {} expired during final attempt {}",
                    run.getId(), run.getJobName(), run.getLeaseOwner(), run.getAttempt());
            metricsConfig.recordTerminalFailure("LEASE_EXPIRED");
            slackAlertService.sendRunFailedAlert(run, error);
        } else {
            log.warn("Run {} of job {} reset to pending: lease of {} expired at {} (status {}, attempt {})",
                    run.getId(), run.getJobName(), run.getLeaseOwner(), run.getLeaseExpiresAt(),
                    run.getStatus(), run.getAttempt());
        }
        return true;
    }
}
