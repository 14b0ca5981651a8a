package com.example.cronscheduler.service.scheduler;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.repository.DispatchMessageRepository;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.domain.repository.RunAttemptLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Deletes run history past the retention window: finished runs, their attempt logs,
 * and queue messages that no longer point at an active run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryRetentionService {

    private final JobRunRepository runRepository;
    private final RunAttemptLogRepository attemptLogRepository;
    private final DispatchMessageRepository messageRepository;
    private final CronSchedulerProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${cron-scheduler.history-purge-cron:0 30 3 * * *}")
    @SchedulerLock(name = "historyRetentionPurge", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    public void scheduledPurge() {
        try {
            purge();
        } catch (DataAccessException e) {
            log.error("History purge failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return total rows deleted
     */
    public int purge() {
        var cutoff = clock.instant().minus(Duration.ofDays(properties.getHistoryRetentionDays()));

        var runs = runRepository.deleteFinishedBefore(cutoff);
        var logs = attemptLogRepository.deleteOrphanedBefore(cutoff);
        var messages = messageRepository.deleteOrphanedBefore(cutoff);

        log.info("Purged history older than {}: {} runs, {} attempt logs, {} queue messages", cutoff, runs, logs, messages);
        return runs + logs + messages;
    }
}
