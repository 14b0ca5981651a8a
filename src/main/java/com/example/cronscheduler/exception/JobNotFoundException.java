package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job not found: " + jobName);
        this.jobName = jobName;
    }
}
