package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a callback that produced no HTTP response: timeout, refused
 * connection, DNS failure, malformed target URL.
 * <p>
 * A response with a non-success status is not an exception; it is returned to the
 * caller for classification.
 */
@Getter
public class CallbackException extends RuntimeException {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String TRANSPORT = "TRANSPORT_ERROR";
    public static final String INVALID_TARGET = "INVALID_TARGET";

    private final String url;
    private final String errorType;

    public CallbackException(String url, String errorType, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", url, errorType, message), cause);
        this.url = url;
        this.errorType = errorType;
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(errorType);
    }
}
