package com.example.cronscheduler.client;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.enums.CallbackMethod;
import com.example.cronscheduler.exception.CallbackException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CallbackClient Tests")
class CallbackClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private CronSchedulerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CronSchedulerProperties();
        properties.setCallbackTimeoutMs(200);
    }

    private CallbackClient clientAnswering(ExchangeFunction exchange) {
        var webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return exchange.exchange(request);
                })
                .build();
        return new CallbackClient(webClient, properties);
    }

    private static CallbackRequest.CallbackRequestBuilder post(String url) {
        return CallbackRequest.builder()
                .method(CallbackMethod.POST)
                .url(url)
                .body("{\"hello\":\"world\"}");
    }

    @Nested
    @DisplayName("Responses")
    class ResponseTests {

        @Test
        @DisplayName("Should return status and body of a successful response")
        void shouldReturnSuccessfulResponse() {
            var client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.OK).body("done").build()));

            var response = client.execute(post("https://hooks.example.com/a").build());

            assertThat(response.getStatusCode()).isEqualTo(200);
            assertThat(response.getBody()).isEqualTo("done");
        }

        @Test
        @DisplayName("Should return error statuses instead of throwing")
        void shouldReturnErrorStatuses() {
            var client = clientAnswering(request ->
                    Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).body("later").build()));

            var response = client.execute(post("https://hooks.example.com/a").build());

            assertThat(response.getStatusCode()).isEqualTo(503);
            assertThat(response.getBody()).isEqualTo("later");
        }

        @Test
        @DisplayName("Empty body should be returned as empty text")
        void emptyBodyShouldBeEmptyText() {
            var client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build()));

            var response = client.execute(post("https://hooks.example.com/a").build());

            assertThat(response.getStatusCode()).isEqualTo(204);
            assertThat(response.getBody()).isEmpty();
        }

        @Test
        @DisplayName("Body larger than the codec buffer should keep the status and a truncated body")
        void largeBodyShouldKeepStatus() {
            var client = clientAnswering(request ->
                    Mono.just(ClientResponse.create(HttpStatus.OK).body("x".repeat(300 * 1024)).build()));

            var response = client.execute(post("https://hooks.example.com/a").build());

            assertThat(response.getStatusCode()).isEqualTo(200);
            assertThat(response.getBody()).hasSize(properties.getMaxResponseBodyLength());
        }

        @Test
        @DisplayName("Body of a failed call should be truncated too")
        void largeErrorBodyShouldBeTruncated() {
            properties.setMaxResponseBodyLength(10);
            var client = clientAnswering(request ->
                    Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).body("0123456789abcdef").build()));

            var response = client.execute(post("https://hooks.example.com/a").build());

            assertThat(response.getStatusCode()).isEqualTo(502);
            assertThat(response.getBody()).isEqualTo("0123456789");
        }
    }

    @Nested
    @DisplayName("Requests")
    class RequestTests {

        @Test
        @DisplayName("Should send method, URL and headers, defaulting the content type to JSON")
        void shouldSendRequest() {
            var client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

            client.execute(post("https://hooks.example.com/a?x=1")
                    .header("X-Cron-Run-Id", "abc")
                    .build());

            var sent = lastRequest.get();
            assertThat(sent.method()).isEqualTo(HttpMethod.POST);
            assertThat(sent.url()).isEqualTo(URI.create("https://hooks.example.com/a?x=1"));
            assertThat(sent.headers().getFirst("X-Cron-Run-Id")).isEqualTo("abc");
            assertThat(sent.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        }

        @Test
        @DisplayName("Should keep a content type set on the job, whatever its case")
        void shouldKeepJobContentType() {
            var client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

            client.execute(post("https://hooks.example.com/a")
                    .header("content-type", "text/plain")
                    .build());

            assertThat(lastRequest.get().headers().getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("text/plain");
        }

        @Test
        @DisplayName("GET should not carry a body or content type")
        void getShouldNotCarryBody() {
            var client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

            client.execute(CallbackRequest.builder()
                    .method(CallbackMethod.GET)
                    .url("https://hooks.example.com/ping")
                    .body("ignored")
                    .build());

            assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
            assertThat(lastRequest.get().headers().getContentType()).isNull();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("No response within the timeout should be a TIMEOUT error")
        void noResponseShouldTimeOut() {
            var client = clientAnswering(request -> Mono.never());

            assertThatThrownBy(() -> client.execute(post("https://slow.example.com").build()))
                    .isInstanceOfSatisfying(CallbackException.class, e -> {
                        assertThat(e.isTimeout()).isTrue();
                        assertThat(e.getErrorType()).isEqualTo(CallbackException.TIMEOUT);
                        assertThat(e.getMessage()).contains("200 ms");
                    });
        }

        @Test
        @DisplayName("Connection failure should be a transport error")
        void connectionFailureShouldBeTransportError() {
            var client = clientAnswering(request -> Mono.error(new ConnectException("Connection refused")));

            assertThatThrownBy(() -> client.execute(post("https://down.example.com").build()))
                    .isInstanceOfSatisfying(CallbackException.class, e -> {
                        assertThat(e.getErrorType()).isEqualTo(CallbackException.TRANSPORT);
                        assertThat(e.getMessage()).contains("Connection refused");
                    });
        }

        @Test
        @DisplayName("Relative URL should be rejected without a request")
        void relativeUrlShouldBeRejected() {
            var client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

            assertThatThrownBy(() -> client.execute(post("/relative/path").build()))
                    .isInstanceOfSatisfying(CallbackException.class,
                            e -> assertThat(e.getErrorType()).isEqualTo(CallbackException.INVALID_TARGET));
            assertThat(lastRequest.get()).isNull();
        }
    }
}
