package com.example.cronscheduler.queue;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Instruction to run attempt {@code attempt} of run {@code runId}
 */
@Value
@Builder
public class DispatchTask {
    UUID jobId;
    UUID runId;
    int attempt;
}
