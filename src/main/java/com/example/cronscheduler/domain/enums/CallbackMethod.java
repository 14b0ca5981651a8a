package com.example.cronscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;

/**
 * HTTP methods a job callback may use.
 */
@Getter
@RequiredArgsConstructor
public enum CallbackMethod {

    GET(HttpMethod.GET, false),
    POST(HttpMethod.POST, true),
    PUT(HttpMethod.PUT, true),
    PATCH(HttpMethod.PATCH, true),
    DELETE(HttpMethod.DELETE, false);

    private final HttpMethod httpMethod;

    /**
     * Whether the rendered payload is sent as the request body
     */
    private final boolean bodyAllowed;
}
