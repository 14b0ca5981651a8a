package com.example.cronscheduler.service.scheduler;

import lombok.Builder;
import lombok.Value;

/**
 * What one scheduler tick did
 */
@Value
@Builder
public class TickResult {
    int dueJobs;
    int claimedOccurrences;
    int claimedRuns;
    int lostRaces;
    int enqueueFailures;
    boolean skipped;
    boolean storeUnavailable;

    public static TickResult skippedTick() {
        return TickResult.builder().skipped(true).build();
    }

    public int getDispatched() {
        return claimedOccurrences + claimedRuns - enqueueFailures;
    }
}
