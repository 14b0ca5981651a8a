package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job name that is already taken
 */
@Getter
public class DuplicateJobException extends RuntimeException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super(String.format("Job with name '%s' already exists", jobName));
        this.jobName = jobName;
    }
}
