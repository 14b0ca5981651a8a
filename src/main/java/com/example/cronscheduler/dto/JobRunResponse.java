package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for one occurrence of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResponse {
    private UUID id;
    private UUID jobId;
    private String jobName;
    private Instant scheduledFor;
    private RunStatus status;
    private Integer attempt;
    private Integer maxRetries;
    private String leaseOwner;
    private Instant leaseExpiresAt;
    private Instant nextAttemptAt;
    private String lastError;
    private Integer lastHttpStatus;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    /**
     * Only filled when the single run is requested
     */
    private List<RunAttemptResponse> attempts;
}
