package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.CallbackMethod;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request DTO for creating or replacing a job definition.
 * <p>
 * Exactly one of {@code cronExpression} and {@code runAt} must be set; that rule and the
 * cron syntax are checked by the service, not by annotations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDefinitionRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @Pattern(regexp = "^[A-Za-z0-9][A-Za-z0-9._-]*$",
            message = "Name may contain letters, digits, '.', '_' and '-' and must start with a letter or digit")
    private String name;

    @Size(max = 500)
    private String description;

    /**
     * Five-field cron expression for recurring jobs
     */
    private String cronExpression;

    /**
     * Zone the cron expression is evaluated in (default UTC)
     */
    private String timeZone;

    /**
     * Fixed instant for one-shot jobs
     */
    private Instant runAt;

    @NotBlank(message = "Callback URL is required")
    @Size(max = 2048)
    private String callbackUrl;

    /**
     * Default POST
     */
    private CallbackMethod callbackMethod;

    /**
     * Body template; supports {{jobName}}, {{runId}}, {{scheduledFor}} and {{attempt}}
     */
    private String payloadTemplate;

    private Map<String, String> callbackHeaders;

    /**
     * Attempts per occurrence (default from configuration)
     */
    @Min(value = 0, message = "maxRetries must be >= 0")
    private Integer maxRetries;

    /**
     * Backoff base in milliseconds (default from configuration)
     */
    @Min(value = 0, message = "retryBackoffMs must be >= 0")
    private Long retryBackoffMs;

    /**
     * Default true
     */
    private Boolean enabled;
}
