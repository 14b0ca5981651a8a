package com.example.cronscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Lifecycle of one job occurrence (a run).
 * <p>
 * The allowed moves are an explicit transition table so every write path
 * can be checked against it:
 * <pre>
 * PENDING         -> CLAIMED
 * CLAIMED         -> EXECUTING | PENDING | FAILED_TERMINAL
 * EXECUTING       -> SUCCEEDED | RETRY_SCHEDULED | FAILED_TERMINAL | PENDING
 * RETRY_SCHEDULED -> CLAIMED
 * </pre>
 * The moves back to PENDING (and to FAILED_TERMINAL from CLAIMED) are lease recovery.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    /**
     * Waiting to be claimed by a scheduler instance.
     * Reached only through lease recovery.
     */
    PENDING("pending", "Pending"),

    /**
     * Owned by a scheduler instance under a lease, dispatch task enqueued.
     */
    CLAIMED("claimed", "Claimed"),

    /**
     * A worker is performing the callback under a refreshed lease.
     */
    EXECUTING("executing", "Executing"),

    /**
     * Callback succeeded. Terminal.
     */
    SUCCEEDED("succeeded", "Succeeded"),

    /**
     * Callback failed, another attempt is due at next_attempt_at.
     */
    RETRY_SCHEDULED("retry_scheduled", "Retry Scheduled"),

    /**
     * Attempts exhausted. Terminal.
     */
    FAILED_TERMINAL("failed_terminal", "Failed (terminal)");

    /**
     * States that block a new occurrence of the same job from being claimed.
     */
    public static final List<RunStatus> ACTIVE = List.of(PENDING, CLAIMED, EXECUTING, RETRY_SCHEDULED);

    /**
     * States that hold a lease which the recovery sweep may expire.
     */
    public static final List<RunStatus> LEASED = List.of(CLAIMED, EXECUTING);

    private final String code;
    private final String displayName;

    /**
     * Find RunStatus by its code value
     */
    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * Successor states allowed from this state
     */
    public Set<RunStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(CLAIMED);
            case CLAIMED -> EnumSet.of(EXECUTING, PENDING, FAILED_TERMINAL);
            case EXECUTING -> EnumSet.of(SUCCEEDED, RETRY_SCHEDULED, FAILED_TERMINAL, PENDING);
            case RETRY_SCHEDULED -> EnumSet.of(CLAIMED);
            case SUCCEEDED, FAILED_TERMINAL -> EnumSet.noneOf(RunStatus.class);
        };
    }

    public boolean canTransitionTo(RunStatus target) {
        return allowedTransitions().contains(target);
    }
}
