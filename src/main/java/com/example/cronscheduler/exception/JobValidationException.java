package com.example.cronscheduler.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception for a job definition that breaks a definition rule
 * (callback target, schedule timing)
 */
@Getter
public class JobValidationException extends RuntimeException {

    private final List<String> violations;

    public JobValidationException(List<String> violations) {
        super("Invalid job definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public JobValidationException(String violation) {
        this(List.of(violation));
    }
}
