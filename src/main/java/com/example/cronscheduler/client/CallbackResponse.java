package com.example.cronscheduler.client;

import lombok.Value;

/**
 * Status and body of a callback response, whatever the status
 */
@Value
public class CallbackResponse {
    int statusCode;
    String body;
}
