package com.example.cronscheduler.service.worker;

import lombok.Builder;
import lombok.Data;

/**
 * Classified result of one callback attempt.
 * <p>
 * Contains everything needed to move the run forward and write the attempt log.
 */
@Data
@Builder
public class CallbackResult {

    private static final int MAX_STACK_TRACE_LENGTH = 4000;

    private boolean success;

    /**
     * HTTP status if a response was received
     */
    private Integer httpStatusCode;

    private String responseBody;

    /**
     * Error classification for history and metrics (HTTP_503, TIMEOUT, ...)
     */
    private String errorType;

    private String errorMessage;

    private String stackTrace;

    public static CallbackResult success(int statusCode, String responseBody) {
        return CallbackResult.builder()
                .success(true)
                .httpStatusCode(statusCode)
                .responseBody(responseBody)
                .build();
    }

    /**
     * A response outside the success range
     */
    public static CallbackResult httpFailure(int statusCode, String responseBody) {
        return CallbackResult.builder()
                .success(false)
                .httpStatusCode(statusCode)
                .responseBody(responseBody)
                .errorType("HTTP_" + statusCode)
                .errorMessage("Callback returned HTTP " + statusCode)
                .build();
    }

    /**
     * No response at all
     */
    public static CallbackResult failure(String errorType, Exception e) {
        return CallbackResult.builder()
                .success(false)
                .errorType(errorType)
                .errorMessage(e.getMessage())
                .stackTrace(truncateStackTrace(e))
                .build();
    }

    /**
     * Error text stored on the run
     */
    public String describeError() {
        if (success) {
            return null;
        }
        return errorType + ": " + errorMessage;
    }

    /**
     * Truncate stack trace to keep the log row bounded
     */
    private static String truncateStackTrace(Exception e) {
        if (e == null) return null;

        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > MAX_STACK_TRACE_LENGTH) {
            result = result.substring(0, MAX_STACK_TRACE_LENGTH) + "...";
        }
        return result;
    }
}
