package com.example.callaudit_backend.engine;

import com.example.callaudit_backend.config.RemoteAnalyzerProperties;
import com.example.callaudit_backend.engine.Interfaces.RemoteAnalyzer;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.exception.RateLimitedException;
import com.example.callaudit_backend.exception.RemoteTimeoutException;
import com.example.callaudit_backend.util.DetectorKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Sends a recording to the transcription/semantic-analysis service and maps its verdict.
 *
 * <p>Only performs a single attempt. Retries, API slot accounting and the per-call hard timeout
 * belong to {@link com.example.callaudit_backend.service.RemoteDetectorInvoker}.
 */
@Service
public class HttpRemoteAnalyzer implements RemoteAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpRemoteAnalyzer.class);
    private static final int MAX_LOGGED_BODY = 500;

    private final WebClient client;
    private final RemoteAnalyzerProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public HttpRemoteAnalyzer(@Qualifier("analyzerWebClient") WebClient client, RemoteAnalyzerProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result analyze(Request request) {
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new ByteArrayResource(request.audio()) {
            @Override
            public String getFilename() {
                return request.fileName();
            }
        });
        String lang = request.langHint() != null && !request.langHint().isBlank() ? request.langHint() : props.getLanguage();
        if (lang != null && !lang.isBlank()) form.add("language", lang.toLowerCase(Locale.ROOT));

        Duration timeout = Duration.ofSeconds(props.getTimeoutSeconds());
        Mono<String> mono = client.post()
                .uri(props.getPath())
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(), resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new RateLimitedException("remote analyzer throttled: " + truncate(body),
                                        retryAfter(resp.headers().asHttpHeaders()))))
                .onStatus(HttpStatusCode::is5xxServerError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new DetectorException("remote analyzer error %s: %s".formatted(resp.statusCode(), truncate(body)), true)))
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new DetectorException("remote analyzer rejected request %s: %s".formatted(resp.statusCode(), truncate(body)), false)))
                .bodyToMono(String.class)
                .timeout(timeout);

        String body;
        try {
            body = mono.block();
        } catch (RuntimeException e) {
            throw translate(Exceptions.unwrap(e), timeout, request);
        }
        if (body == null || body.isBlank()) {
            throw new DetectorException("empty response from remote analyzer", true);
        }
        return parse(body);
    }

    Result parse(String body) {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DetectorException("malformed analyzer response: " + truncate(body), false, e);
        }
        String verdict = firstText(root, "result", "semantic_result", "rebuttal");
        if (verdict == null) {
            throw new DetectorException("analyzer response missing result: " + truncate(body), false);
        }
        Double confidence = root.hasNonNull("confidence") ? root.get("confidence").asDouble() : null;
        String transcript = firstText(root, "transcript", "text");
        return new Result(normalizeVerdict(verdict), confidence, transcript == null ? "" : transcript);
    }

    private RuntimeException translate(Throwable failure, Duration timeout, Request request) {
        if (failure instanceof RateLimitedException || failure instanceof DetectorException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof TimeoutException) {
            return new RemoteTimeoutException(timeout);
        }
        if (failure instanceof WebClientRequestException || failure instanceof PrematureCloseException) {
            LOGGER.warn("Remote analyzer connection failure file={} type={} message={}",
                    request.fileName(), failure.getClass().getSimpleName(), failure.getMessage());
            return new DetectorException("remote analyzer unreachable: " + failure.getMessage(), true, failure);
        }
        return new DetectorException("remote analyzer call failed: " + failure, false, failure);
    }

    private static String normalizeVerdict(String verdict) {
        String v = verdict.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "yes", "true", "1" -> DetectorKeys.YES;
            default -> DetectorKeys.NO;
        };
    }

    private static Duration retryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            LOGGER.debug("Ignoring non-numeric Retry-After header value={}", value);
            return null;
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.hasNonNull(field)) {
                String text = node.get(field).asText();
                if (!text.isBlank()) return text;
            }
        }
        return null;
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
