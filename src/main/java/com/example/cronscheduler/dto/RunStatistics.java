package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStatistics {
    private Map<String, Long> statusDistribution;
    private Map<String, Long> errorDistribution;
    private long activeRuns;
    private long enabledJobs;
    private long queueDepth;
    private Instant generatedAt;
}
