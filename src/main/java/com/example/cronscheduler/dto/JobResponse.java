package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.CallbackMethod;
import com.example.cronscheduler.domain.enums.ScheduleKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for a job definition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {
    private UUID id;
    private String name;
    private String description;
    private ScheduleKind scheduleKind;
    private String cronExpression;
    private String timeZone;
    private Instant runAt;
    private String callbackUrl;
    private CallbackMethod callbackMethod;
    private String payloadTemplate;
    private Map<String, String> callbackHeaders;
    private Integer maxRetries;
    private Long retryBackoffMs;
    private boolean enabled;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;
}
