package com.example.cronscheduler.service.worker;

import com.example.cronscheduler.client.CallbackClient;
import com.example.cronscheduler.client.CallbackRequest;
import com.example.cronscheduler.client.CallbackResponse;
import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.RunAttemptLog;
import com.example.cronscheduler.domain.enums.CallbackMethod;
import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.domain.repository.RunAttemptLogRepository;
import com.example.cronscheduler.exception.CallbackException;
import com.example.cronscheduler.queue.DispatchTask;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.retry.ExponentialBackoffPolicy;
import com.example.cronscheduler.support.InstanceIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RunExecutionService Tests")
class RunExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:30Z");
    private static final String OWNER = "worker-1";

    @Mock
    private JobRunRepository runRepository;

    @Mock
    private RunAttemptLogRepository attemptLogRepository;

    @Mock
    private CallbackClient callbackClient;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<RunAttemptLog> logCaptor;

    @Captor
    private ArgumentCaptor<CallbackRequest> requestCaptor;

    private CronSchedulerProperties properties;
    private RunExecutionService service;
    private UUID runId;
    private JobRun run;

    @BeforeEach
    void setUp() {
        properties = new CronSchedulerProperties();
        service = new RunExecutionService(runRepository, attemptLogRepository, callbackClient,
                new CallbackRequestFactory(), new ExponentialBackoffPolicy(3_600_000), slackAlertService,
                metricsConfig, properties, new InstanceIdentity(OWNER), Clock.fixed(NOW, ZoneOffset.UTC));

        runId = UUID.randomUUID();
        run = JobRun.builder()
                .id(runId)
                .jobId(UUID.randomUUID())
                .jobName("sync-ledger")
                .scheduledFor(Instant.parse("2024-06-01T12:00:00Z"))
                .status(RunStatus.EXECUTING)
                .attempt(1)
                .callbackUrl("https://hooks.example.com/sync")
                .callbackMethod(CallbackMethod.POST)
                .payloadTemplate("{\"run\":\"{{runId}}\"}")
                .maxRetries(3)
                .retryBackoffMs(1000L)
                .leaseOwner(OWNER)
                .build();
    }

    private DispatchTask task(int attempt) {
        return DispatchTask.builder().jobId(run.getJobId()).runId(runId).attempt(attempt).build();
    }

    private void givenAttemptBegins(int attempt) {
        run.setAttempt(attempt);
        when(runRepository.beginAttempt(runId, attempt, attempt - 1, OWNER,
                NOW.plusMillis(properties.getLeaseDurationMs()), NOW)).thenReturn(1);
        when(runRepository.findById(runId)).thenReturn(Optional.of(run));
    }

    private void givenOutcomeWritten(int attempt, RunStatus status, int updated) {
        when(runRepository.completeAttempt(eq(runId), eq(attempt), eq(OWNER), eq(status), any(), any(), any(), any(), eq(NOW)))
                .thenReturn(updated);
    }

    @Nested
    @DisplayName("Successful callback")
    class SuccessTests {

        @Test
        @DisplayName("Should mark run succeeded and log the attempt")
        void shouldMarkRunSucceeded() {
            // Given
            givenAttemptBegins(1);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(200, "ok"));
            givenOutcomeWritten(1, RunStatus.SUCCEEDED, 1);

            // When
            var outcome = service.execute(task(1));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.SUCCEEDED);
            verify(runRepository).completeAttempt(runId, 1, OWNER, RunStatus.SUCCEEDED, null, null, 200, NOW, NOW);
            verify(attemptLogRepository).save(logCaptor.capture());
            var entry = logCaptor.getValue();
            assertThat(entry.getAttemptNumber()).isEqualTo(1);
            assertThat(entry.getResultingStatus()).isEqualTo(RunStatus.SUCCEEDED);
            assertThat(entry.getSuccess()).isTrue();
            assertThat(entry.getHttpStatusCode()).isEqualTo(200);
            assertThat(entry.getExecutorInstance()).isEqualTo(OWNER);
            assertThat(entry.getErrorStackTrace()).isNull();
            verify(metricsConfig).recordAttempt(RunStatus.SUCCEEDED);
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should send the rendered payload and idempotency headers")
        void shouldSendRenderedRequest() {
            // Given
            givenAttemptBegins(2);
            when(callbackClient.execute(requestCaptor.capture())).thenReturn(new CallbackResponse(204, ""));
            givenOutcomeWritten(2, RunStatus.SUCCEEDED, 1);

            // When
            service.execute(task(2));

            // Then
            var request = requestCaptor.getValue();
            assertThat(request.getUrl()).isEqualTo("https://hooks.example.com/sync");
            assertThat(request.getBody()).isEqualTo("{\"run\":\"" + runId + "\"}");
            assertThat(request.getHeaders())
                    .containsEntry(CallbackRequestFactory.HEADER_RUN_ID, runId.toString())
                    .containsEntry(CallbackRequestFactory.HEADER_ATTEMPT, "2");
        }

        @Test
        @DisplayName("Should still succeed when the attempt log cannot be written")
        void shouldSucceedWhenLogWriteFails() {
            // Given
            givenAttemptBegins(1);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(200, "ok"));
            givenOutcomeWritten(1, RunStatus.SUCCEEDED, 1);
            when(attemptLogRepository.save(any())).thenThrow(new DataAccessResourceFailureException("disk full"));

            // When
            var outcome = service.execute(task(1));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.SUCCEEDED);
        }
    }

    @Nested
    @DisplayName("Failed callback")
    class FailureTests {

        @Test
        @DisplayName("Should schedule a retry after the backoff when attempts remain")
        void shouldScheduleRetry() {
            // Given
            givenAttemptBegins(1);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(503, "busy"));
            givenOutcomeWritten(1, RunStatus.RETRY_SCHEDULED, 1);

            // When
            var outcome = service.execute(task(1));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.RETRY_SCHEDULED);
            verify(runRepository).completeAttempt(runId, 1, OWNER, RunStatus.RETRY_SCHEDULED,
                    NOW.plusMillis(1000), "HTTP_503: Callback returned HTTP 503", 503, null, NOW);
            verify(metricsConfig).recordRetry(1);
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Backoff should double with the attempt number")
        void backoffShouldDouble() {
            // Given
            givenAttemptBegins(2);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(500, ""));
            givenOutcomeWritten(2, RunStatus.RETRY_SCHEDULED, 1);

            // When
            service.execute(task(2));

            // Then
            verify(runRepository).completeAttempt(eq(runId), eq(2), eq(OWNER), eq(RunStatus.RETRY_SCHEDULED),
                    eq(NOW.plusMillis(2000)), anyString(), eq(500), isNull(), eq(NOW));
        }

        @Test
        @DisplayName("Should fail terminally and alert on the last attempt")
        void shouldFailTerminallyOnLastAttempt() {
            // Given
            givenAttemptBegins(3);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(500, "boom"));
            givenOutcomeWritten(3, RunStatus.FAILED_TERMINAL, 1);

            // When
            var outcome = service.execute(task(3));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.FAILED_TERMINAL);
            verify(runRepository).completeAttempt(runId, 3, OWNER, RunStatus.FAILED_TERMINAL,
                    null, "HTTP_500: Callback returned HTTP 500", 500, NOW, NOW);
            verify(metricsConfig).recordTerminalFailure("HTTP_500");
            verify(slackAlertService).sendRunFailedAlert(run, "HTTP_500: Callback returned HTTP 500");
        }

        @Test
        @DisplayName("Zero retry budget should get exactly one attempt")
        void zeroBudgetShouldGetOneAttempt() {
            // Given
            run.setMaxRetries(0);
            givenAttemptBegins(1);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(404, "missing"));
            givenOutcomeWritten(1, RunStatus.FAILED_TERMINAL, 1);

            // When
            var outcome = service.execute(task(1));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.FAILED_TERMINAL);
        }

        @Test
        @DisplayName("Timeout should count as a failed attempt")
        void timeoutShouldCountAsFailedAttempt() {
            // Given
            givenAttemptBegins(1);
            when(callbackClient.execute(any())).thenThrow(new CallbackException(run.getCallbackUrl(),
                    CallbackException.TIMEOUT, "no response within 30000 ms", null));
            givenOutcomeWritten(1, RunStatus.RETRY_SCHEDULED, 1);

            // When
            var outcome = service.execute(task(1));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.RETRY_SCHEDULED);
            verify(attemptLogRepository).save(logCaptor.capture());
            assertThat(logCaptor.getValue().getErrorType()).isEqualTo("TIMEOUT");
            assertThat(logCaptor.getValue().getHttpStatusCode()).isNull();
            verify(runRepository).completeAttempt(eq(runId), eq(1), eq(OWNER), eq(RunStatus.RETRY_SCHEDULED),
                    any(), startsWith("TIMEOUT: "), isNull(), isNull(), eq(NOW));
        }

        @Test
        @DisplayName("Unexpected client error should be recorded, not thrown")
        void unexpectedErrorShouldBeRecorded() {
            // Given
            givenAttemptBegins(1);
            when(callbackClient.execute(any())).thenThrow(new IllegalStateException("pool closed"));
            givenOutcomeWritten(1, RunStatus.RETRY_SCHEDULED, 1);

            // When
            var outcome = service.execute(task(1));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.RETRY_SCHEDULED);
            verify(attemptLogRepository).save(logCaptor.capture());
            assertThat(logCaptor.getValue().getErrorType()).isEqualTo("IllegalStateException");
            assertThat(logCaptor.getValue().getErrorStackTrace())
                    .startsWith("java.lang.IllegalStateException: pool closed")
                    .contains("\tat ");
        }
    }

    @Nested
    @DisplayName("Stale and lost work")
    class StaleWorkTests {

        @Test
        @DisplayName("Should drop a task whose run is not claimed for that attempt")
        void shouldDropStaleTask() {
            // Given
            when(runRepository.beginAttempt(eq(runId), eq(2), eq(1), eq(OWNER), any(), eq(NOW))).thenReturn(0);

            // When
            var outcome = service.execute(task(2));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.DROPPED);
            verifyNoInteractions(callbackClient, attemptLogRepository);
            verify(metricsConfig).recordDroppedTask("stale");
        }

        @Test
        @DisplayName("Should discard the outcome when the lease was lost meanwhile")
        void shouldDiscardOutcomeWhenLeaseLost() {
            // Given
            givenAttemptBegins(3);
            when(callbackClient.execute(any())).thenReturn(new CallbackResponse(500, ""));
            givenOutcomeWritten(3, RunStatus.FAILED_TERMINAL, 0);

            // When
            var outcome = service.execute(task(3));

            // Then
            assertThat(outcome).isEqualTo(ExecutionOutcome.LOST_LEASE);
            verify(attemptLogRepository).save(logCaptor.capture());
            assertThat(logCaptor.getValue().getResultingStatus()).isNull();
            assertThat(logCaptor.getValue().getErrorMessage()).startsWith("Outcome discarded");
            verify(metricsConfig).recordLostRace("outcome");
            verify(metricsConfig, never()).recordAttempt(any());
            verifyNoInteractions(slackAlertService);
        }
    }
}
