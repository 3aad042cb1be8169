package com.example.callaudit_backend.engine;

import com.example.callaudit_backend.config.RemoteAnalyzerProperties;
import com.example.callaudit_backend.engine.Interfaces.RemoteAnalyzer;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.exception.RateLimitedException;
import com.example.callaudit_backend.exception.RemoteTimeoutException;
import com.example.callaudit_backend.util.DetectorKeys;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpRemoteAnalyzerTest {

    private static final RemoteAnalyzer.Request REQUEST =
            new RemoteAnalyzer.Request("agent _ 555.mp3", new byte[]{1, 2, 3}, null);

    private static HttpRemoteAnalyzer analyzer(ExchangeFunction exchangeFunction) {
        return analyzer(exchangeFunction, new RemoteAnalyzerProperties());
    }

    private static HttpRemoteAnalyzer analyzer(ExchangeFunction exchangeFunction, RemoteAnalyzerProperties props) {
        WebClient client = WebClient.builder().exchangeFunction(exchangeFunction).build();
        return new HttpRemoteAnalyzer(client, props);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void mapsVerdictConfidenceAndTranscript() {
        AtomicReference<String> path = new AtomicReference<>();
        HttpRemoteAnalyzer analyzer = analyzer(request -> {
            path.set(request.url().getPath());
            return json(HttpStatus.OK, "{\"result\":\"yes\",\"confidence\":0.87,\"transcript\":\"hello there\"}");
        });

        RemoteAnalyzer.Result result = analyzer.analyze(REQUEST);

        assertThat(path.get()).isEqualTo("/v1/rebuttal/analyze");
        assertThat(result.semanticResult()).isEqualTo(DetectorKeys.YES);
        assertThat(result.confidence()).isEqualTo(0.87);
        assertThat(result.transcript()).isEqualTo("hello there");
    }

    @Test
    void treatsAnythingButAffirmativeAsNo() {
        HttpRemoteAnalyzer analyzer = analyzer(request -> json(HttpStatus.OK, "{\"semantic_result\":\"maybe\"}"));

        RemoteAnalyzer.Result result = analyzer.analyze(REQUEST);

        assertThat(result.semanticResult()).isEqualTo(DetectorKeys.NO);
        assertThat(result.confidence()).isNull();
        assertThat(result.transcript()).isEmpty();
    }

    @Test
    void tooManyRequestsBecomesRateLimited() {
        HttpRemoteAnalyzer analyzer = analyzer(request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, "7")
                .body("slow down")
                .build()));

        assertThatThrownBy(() -> analyzer.analyze(REQUEST))
                .isInstanceOf(RateLimitedException.class)
                .satisfies(e -> assertThat(((RateLimitedException) e).getRetryAfter()).isEqualTo(Duration.ofSeconds(7)));
    }

    @Test
    void serverErrorIsTransientAndClientErrorIsNot() {
        HttpRemoteAnalyzer failing = analyzer(request -> json(HttpStatus.BAD_GATEWAY, "{\"error\":\"upstream\"}"));
        HttpRemoteAnalyzer rejecting = analyzer(request -> json(HttpStatus.BAD_REQUEST, "{\"error\":\"bad\"}"));

        assertThatThrownBy(() -> failing.analyze(REQUEST))
                .isInstanceOf(DetectorException.class)
                .satisfies(e -> assertThat(((DetectorException) e).isTransient()).isTrue());
        assertThatThrownBy(() -> rejecting.analyze(REQUEST))
                .isInstanceOf(DetectorException.class)
                .satisfies(e -> assertThat(((DetectorException) e).isTransient()).isFalse());
    }

    @Test
    void connectionResetIsTransient() {
        HttpRemoteAnalyzer analyzer = analyzer(request -> Mono.error(new WebClientRequestException(
                new IOException("Connection reset by peer"), HttpMethod.POST, URI.create("/v1/analyze"), new HttpHeaders())));

        assertThatThrownBy(() -> analyzer.analyze(REQUEST))
                .isInstanceOf(DetectorException.class)
                .satisfies(e -> assertThat(((DetectorException) e).isTransient()).isTrue());
    }

    @Test
    void slowResponseTimesOut() {
        RemoteAnalyzerProperties props = new RemoteAnalyzerProperties();
        props.setTimeoutSeconds(1);
        HttpRemoteAnalyzer analyzer = analyzer(request -> Mono.<ClientResponse>never(), props);

        assertThatThrownBy(() -> analyzer.analyze(REQUEST)).isInstanceOf(RemoteTimeoutException.class);
    }

    @Test
    void responseWithoutVerdictIsRejected() {
        HttpRemoteAnalyzer analyzer = analyzer(request -> json(HttpStatus.OK, "{\"transcript\":\"only text\"}"));

        assertThatThrownBy(() -> analyzer.analyze(REQUEST))
                .isInstanceOf(DetectorException.class)
                .hasMessageContaining("missing result");
    }
}
