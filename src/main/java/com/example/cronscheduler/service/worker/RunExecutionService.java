package com.example.cronscheduler.service.worker;

import com.example.cronscheduler.client.CallbackClient;
import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.RunAttemptLog;
import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.domain.repository.RunAttemptLogRepository;
import com.example.cronscheduler.exception.CallbackException;
import com.example.cronscheduler.queue.DispatchTask;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.retry.BackoffPolicy;
import com.example.cronscheduler.support.InstanceIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Executes one attempt of a run.
 * <p>
 * Handles:
 * - The claimed to executing transition (drops stale and redelivered tasks)
 * - The callback itself, outside any transaction
 * - Classification into success, scheduled retry or terminal failure
 * - The outcome write, guarded by lease owner and attempt number
 * - Attempt logging, metrics and the terminal failure alert
 * <p>
 * Errors of the callback are recorded on the run and never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunExecutionService {

    private final JobRunRepository runRepository;
    private final RunAttemptLogRepository attemptLogRepository;
    private final CallbackClient callbackClient;
    private final CallbackRequestFactory requestFactory;
    private final BackoffPolicy backoffPolicy;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final CronSchedulerProperties properties;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;

    public ExecutionOutcome execute(DispatchTask task) {
        var runId = task.getRunId();
        var attempt = task.getAttempt();
        var owner = instanceIdentity.getId();
        var now = clock.instant();

        var begun = runRepository.beginAttempt(runId, attempt, attempt - 1, owner,
                now.plusMillis(properties.getLeaseDurationMs()), now);
        if (begun == 0) {
            log.debug("Dropping dispatch task for run {} attempt {}: run is not claimed for that attempt", runId, attempt);
            metricsConfig.recordDroppedTask("stale");
            return ExecutionOutcome.DROPPED;
        }

        var run = runRepository.findById(runId).orElse(null);
        if (run == null) {
            log.warn("Run {} disappeared after starting attempt {}", runId, attempt);
            metricsConfig.recordDroppedTask("missing");
            return ExecutionOutcome.DROPPED;
        }

        log.info("Starting attempt {}/{} of run {} (job: {}, scheduled for: {})",
                attempt, run.getEffectiveMaxAttempts(), runId, run.getJobName(), run.getScheduledFor());

        var startedAt = clock.instant();
        var result = performCallback(run, attempt);
        var completedAt = clock.instant();

        var status = decideStatus(run, attempt, result);
        var nextAttemptAt = status == RunStatus.RETRY_SCHEDULED
                ? completedAt.plusMillis(backoffPolicy.delayMs(attempt, run.getRetryBackoffMs()))
                : null;

        var updated = runRepository.completeAttempt(runId, attempt, owner, status, nextAttemptAt,
                result.describeError(), result.getHttpStatusCode(),
                status.isTerminal() ? completedAt : null, completedAt);

        if (updated == 0) {
            log.warn("Lease on run {} was lost during attempt {}; outcome {} discarded", runId, attempt, status);
            metricsConfig.recordLostRace("outcome");
            writeAttemptLog(run, attempt, null, result, startedAt, completedAt);
            return ExecutionOutcome.LOST_LEASE;
        }

        writeAttemptLog(run, attempt, status, result, startedAt, completedAt);
        metricsConfig.recordAttempt(status);

        return switch (status) {
            case SUCCEEDED -> {
                log.info("Run {} of job {} succeeded on attempt {} (HTTP {})",
                        runId, run.getJobName(), attempt, result.getHttpStatusCode());
                yield ExecutionOutcome.SUCCEEDED;
            }
            case RETRY_SCHEDULED -> {
                log.warn("Attempt {} of run {} failed ({}), retry scheduled at {}",
                        attempt, runId, result.describeError(), nextAttemptAt);
                metricsConfig.recordRetry(attempt);
                yield ExecutionOutcome.RETRY_SCHEDULED;
            }
            default -> {
                log.error("Run {} of job {} failed terminally after {} attempt(s): {}",
                        runId, run.getJobName(), attempt, result.describeError());
                metricsConfig.recordTerminalFailure(result.getErrorType());
                run.setAttempt(attempt);
                slackAlertService.sendRunFailedAlert(run, result.describeError());
                yield ExecutionOutcome.FAILED_TERMINAL;
            }
        };
    }

    private CallbackResult performCallback(JobRun run, int attempt) {
        var sample = metricsConfig.startCallbackTimer();
        CallbackResult result;
        try {
            var response = callbackClient.execute(requestFactory.create(run, attempt));
            var body = truncate(response.getBody(), properties.getMaxResponseBodyLength());
            result = properties.isSuccessStatus(response.getStatusCode())
                    ? CallbackResult.success(response.getStatusCode(), body)
                    : CallbackResult.httpFailure(response.getStatusCode(), body);
        } catch (CallbackException e) {
            result = CallbackResult.failure(e.getErrorType(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error during callback of run {}: {}", run.getId(), e.getMessage(), e);
            result = CallbackResult.failure(e.getClass().getSimpleName(), e);
        }
        metricsConfig.recordCallback(sample, result.isSuccess());
        return result;
    }

    private RunStatus decideStatus(JobRun run, int attempt, CallbackResult result) {
        if (result.isSuccess()) {
            return RunStatus.SUCCEEDED;
        }
        return attempt < run.getEffectiveMaxAttempts() ? RunStatus.RETRY_SCHEDULED : RunStatus.FAILED_TERMINAL;
    }

    private void writeAttemptLog(JobRun run, int attempt, RunStatus status, CallbackResult result,
                                 Instant startedAt, Instant completedAt) {
        var entry = RunAttemptLog.builder()
                .runId(run.getId())
                .jobId(run.getJobId())
                .attemptNumber(attempt)
                .resultingStatus(status)
                .executorInstance(instanceIdentity.getId())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .success(result.isSuccess())
                .httpStatusCode(result.getHttpStatusCode())
                .errorType(result.getErrorType())
                .errorMessage(status == null
                        ? "Outcome discarded, lease lost. " + nullToEmpty(result.getErrorMessage())
                        : result.getErrorMessage())
                .errorStackTrace(result.getStackTrace())
                .responseBody(result.getResponseBody())
                .build();
        try {
            attemptLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Could not write attempt log for run {} attempt {}: {}", run.getId(), attempt, e.getMessage());
        }
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    private static String nullToEmpty(String text) {
        return text != null ? text : "";
    }
}
