package com.example.cronscheduler.service.worker;

/**
 * What handling one dispatch task amounted to
 */
public enum ExecutionOutcome {
    SUCCEEDED,
    RETRY_SCHEDULED,
    FAILED_TERMINAL,
    /**
     * Stale or redelivered task; the run was not in the expected state
     */
    DROPPED,
    /**
     * The callback ran but the lease was taken away before the outcome could be written
     */
    LOST_LEASE
}
