package com.example.cronscheduler.client;

import com.example.cronscheduler.domain.enums.CallbackMethod;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One fully rendered outbound callback
 */
@Value
@Builder
public class CallbackRequest {
    CallbackMethod method;
    String url;
    @Singular
    Map<String, String> headers;
    String body;
}
