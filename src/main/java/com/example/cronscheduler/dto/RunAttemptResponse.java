package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for one callback attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunAttemptResponse {
    private Integer attemptNumber;
    private RunStatus resultingStatus;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Boolean success;
    private Integer httpStatusCode;
    private String errorType;
    private String errorMessage;
    private String responseBody;
}
