package com.example.cronscheduler.service.alert;

import com.example.cronscheduler.config.SlackProperties;
import com.example.cronscheduler.domain.entity.JobRun;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Sends operator alerts to Slack when a job occurrence fails terminally.
 * <p>
 * A terminal failure never disables the job; the alert is the only place it surfaces
 * outside the run history.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Clock clock;
    private final Slack slack;

    @Value("${spring.application.name:cron-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties, Clock clock) {
        this(slackProperties, clock, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Clock clock, Slack slack) {
        this.slackProperties = slackProperties;
        this.clock = clock;
        this.slack = slack;
    }

    /**
     * Alert that a run exhausted its attempts.
     * Runs asynchronously to not block the worker.
     */
    @Async
    public void sendRunFailedAlert(JobRun run, String lastError) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Run {} of job {} failed terminally but no alert was sent.",
                    run.getId(), run.getJobName());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildRunFailedPayload(run, lastError));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for run {} of job {}", run.getId(), run.getJobName());
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for run {}: {}", run.getId(), e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    Payload buildRunFailedPayload(JobRun run, String lastError) {
        var runId = run.getId().toString();
        var error = lastError != null ? lastError : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Job occurrence failed after all retries*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(run.getJobName() + " @ " + DATE_FORMATTER.format(run.getScheduledFor()))
                                .titleLink(buildRunLink(runId))
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Run ID")
                                                .value(runId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Attempts")
                                                .value(run.getAttempt() + " / " + run.getEffectiveMaxAttempts())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Callback")
                                                .value(run.getCallbackMethod() + " " + run.getCallbackUrl())
                                                .valueShortEnough(false)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(error, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | The job stays enabled for its next occurrences")
                                .ts(String.valueOf(clock.instant().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String buildRunLink(String runId) {
        if (slackProperties.getDashboardBaseUrl() == null) {
            return null;
        }
        return slackProperties.getDashboardBaseUrl() + "/api/v1/runs/" + runId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
