package com.example.cronscheduler.service.worker;

import com.example.cronscheduler.client.CallbackRequest;
import com.example.cronscheduler.domain.entity.JobRun;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders the outbound request for one attempt of a run.
 * <p>
 * Template placeholders: {@code {{jobName}}}, {@code {{runId}}}, {@code {{scheduledFor}}}
 * (ISO-8601 UTC) and {@code {{attempt}}}. Unknown placeholders are left as they are.
 * The run id and attempt headers let targets deduplicate redelivered attempts.
 */
@Component
public class CallbackRequestFactory {

    public static final String HEADER_JOB = "X-Cron-Job";
    public static final String HEADER_RUN_ID = "X-Cron-Run-Id";
    public static final String HEADER_ATTEMPT = "X-Cron-Attempt";
    public static final String HEADER_SCHEDULED_FOR = "X-Cron-Scheduled-For";

    public CallbackRequest create(JobRun run, int attempt) {
        var values = Map.of(
                "jobName", run.getJobName(),
                "runId", run.getId().toString(),
                "scheduledFor", run.getScheduledFor().toString(),
                "attempt", String.valueOf(attempt));

        var builder = CallbackRequest.builder()
                .method(run.getCallbackMethod())
                .url(run.getCallbackUrl())
                .body(render(run.getPayloadTemplate(), values));

        if (run.getCallbackHeaders() != null) {
            run.getCallbackHeaders().forEach(builder::header);
        }
        return builder
                .header(HEADER_JOB, run.getJobName())
                .header(HEADER_RUN_ID, run.getId().toString())
                .header(HEADER_ATTEMPT, String.valueOf(attempt))
                .header(HEADER_SCHEDULED_FOR, run.getScheduledFor().toString())
                .build();
    }

    static String render(String template, Map<String, String> values) {
        if (template == null || template.indexOf("{{") < 0) {
            return template;
        }
        var rendered = template;
        for (var entry : values.entrySet()) {
            rendered = rendered.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return rendered;
    }
}
