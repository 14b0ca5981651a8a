package com.example.cronscheduler.client;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.exception.CallbackException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Performs job callbacks over HTTP.
 * <p>
 * Exactly one request per call: no retry and no circuit breaker here, because each
 * call is one recorded attempt of a run and retries are driven by the run state machine.
 * The whole exchange, body included, is bounded by the callback timeout. Only the first
 * {@code max-response-body-length} bytes of the body are kept; the rest is read and discarded,
 * so a large body never turns a received status into a transport error.
 */
@Slf4j
@Component
public class CallbackClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final int maxBodyBytes;

    public CallbackClient(@Qualifier("callbackWebClient") WebClient webClient, CronSchedulerProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofMillis(properties.getCallbackTimeoutMs());
        this.maxBodyBytes = properties.getMaxResponseBodyLength();
    }

    /**
     * Send the request and return whatever the target answered.
     *
     * @throws CallbackException if no response was received in time
     */
    public CallbackResponse execute(CallbackRequest request) {
        var uri = toUri(request.getUrl());
        log.debug("Calling {} {}", request.getMethod(), uri);

        var spec = webClient.method(request.getMethod().getHttpMethod())
                .uri(uri)
                .headers(headers -> request.getHeaders().forEach(headers::set));

        WebClient.RequestHeadersSpec<?> exchange = spec;
        if (request.getBody() != null && request.getMethod().isBodyAllowed()) {
            if (request.getHeaders().keySet().stream().noneMatch(HttpHeaders.CONTENT_TYPE::equalsIgnoreCase)) {
                spec.contentType(MediaType.APPLICATION_JSON);
            }
            exchange = spec.bodyValue(request.getBody());
        }

        try {
            return exchange
                    .exchangeToMono(response -> readBody(response)
                            .map(body -> new CallbackResponse(response.statusCode().value(), body)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw translate(request.getUrl(), e);
        }
    }

    private Mono<String> readBody(ClientResponse response) {
        var charset = response.headers().contentType()
                .map(MediaType::getCharset)
                .orElse(StandardCharsets.UTF_8);
        return response.bodyToFlux(DataBuffer.class)
                .collect(ByteArrayOutputStream::new, (out, buffer) -> {
                    try {
                        var keep = Math.min(buffer.readableByteCount(), maxBodyBytes - out.size());
                        if (keep > 0) {
                            var bytes = new byte[keep];
                            buffer.read(bytes);
                            out.write(bytes, 0, keep);
                        }
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .map(out -> out.toString(charset));
    }

    private URI toUri(String url) {
        try {
            var uri = URI.create(url);
            if (!uri.isAbsolute()) {
                throw new CallbackException(url, CallbackException.INVALID_TARGET, "callback URL is not absolute", null);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new CallbackException(url, CallbackException.INVALID_TARGET, e.getMessage(), e);
        }
    }

    private CallbackException translate(String url, RuntimeException e) {
        var cause = Exceptions.unwrap(e);
        if (isTimeout(cause)) {
            return new CallbackException(url, CallbackException.TIMEOUT,
                    "no response within " + timeout.toMillis() + " ms", cause);
        }
        var message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new CallbackException(url, CallbackException.TRANSPORT, message, cause);
    }

    private static boolean isTimeout(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof ReadTimeoutException
                    || current instanceof WriteTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
