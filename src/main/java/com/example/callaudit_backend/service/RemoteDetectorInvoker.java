package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import com.example.callaudit_backend.engine.Interfaces.RemoteAnalyzer;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.exception.RateLimitedException;
import com.example.callaudit_backend.exception.RemoteTimeoutException;
import com.example.callaudit_backend.exception.ResourceExhaustedException;
import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.service.pool.ApiPermit;
import com.example.callaudit_backend.service.pool.WorkerAllocation;
import com.example.callaudit_backend.service.pool.WorkerPoolManager;
import com.example.callaudit_backend.service.sizing.AdaptiveBatchSizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls the remote detector for one file under the job's allocation.
 *
 * <p>Every attempt holds one external-API slot for as long as the call runs and is bounded by a
 * hard timeout. Rate limits, timeouts, API slot waits and transient analyzer errors are retried
 * with exponential backoff up to the configured attempt count; the last failure is then thrown.
 * Rate limits are reported to the {@link AdaptiveBatchSizer}.
 */
@Service
public class RemoteDetectorInvoker {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteDetectorInvoker.class);

    private final RemoteAnalyzer analyzer;
    private final WorkerPoolManager pool;
    private final AdaptiveBatchSizer sizer;
    private final BatchEngineProperties properties;

    public RemoteDetectorInvoker(RemoteAnalyzer analyzer, WorkerPoolManager pool, AdaptiveBatchSizer sizer, BatchEngineProperties properties) {
        this.analyzer = analyzer;
        this.pool = pool;
        this.sizer = sizer;
        this.properties = properties;
    }

    /**
     * @return the rebuttal outcome, including transcript metadata
     * @throws RateLimitedException when every attempt was throttled
     * @throws RemoteTimeoutException when the last attempt timed out
     * @throws ResourceExhaustedException when no API slot freed up for the last attempt
     * @throws DetectorException for non-transient failures or transient ones past the last attempt
     */
    public DetectorOutcome invoke(WorkerAllocation allocation, RemoteAnalyzer.Request request) {
        Duration timeout = properties.getRemoteTimeout();
        int maxAttempts = Math.max(1, properties.getRemoteMaxAttempts());
        AtomicInteger attempts = new AtomicInteger();

        Mono<RemoteAnalyzer.Result> call = Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return Mono.fromCallable(() -> attempt(allocation, request))
                            .subscribeOn(Schedulers.boundedElastic())
                            .timeout(timeout)
                            .onErrorMap(TimeoutException.class, e -> new RemoteTimeoutException(timeout));
                })
                .retryWhen(Retry.backoff(maxAttempts - 1, properties.getRemoteBackoff())
                        .maxBackoff(properties.getRemoteMaxBackoff())
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> {
                            Throwable failure = signal.failure();
                            if (failure instanceof RateLimitedException) {
                                sizer.recordThrottle(allocation.userId());
                            }
                            LOGGER.warn("REMOTE RETRY attempt={} file={} type={} message={}",
                                    signal.totalRetries() + 2, request.fileName(),
                                    failure == null ? "unknown" : failure.getClass().getSimpleName(),
                                    failure == null ? "" : failure.getMessage());
                        })
                        .onRetryExhaustedThrow((backoff, signal) -> signal.failure()));

        RemoteAnalyzer.Result result;
        try {
            result = call.block();
        } catch (RuntimeException e) {
            Throwable failure = Exceptions.unwrap(e);
            if (failure instanceof RateLimitedException) {
                sizer.recordThrottle(allocation.userId());
            }
            LOGGER.warn("REMOTE FAILED file={} attempts={} type={} message={}",
                    request.fileName(), attempts.get(), failure.getClass().getSimpleName(), failure.getMessage());
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DetectorException("remote detector failed: " + failure.getMessage(), false, failure);
        }
        if (result == null) {
            throw new DetectorException("remote detector returned no result", false);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("transcript", result.transcript() == null ? "" : result.transcript());
        metadata.put("attempts", attempts.get());
        return DetectorOutcome.of(result.semanticResult(), result.confidence(), metadata);
    }

    private RemoteAnalyzer.Result attempt(WorkerAllocation allocation, RemoteAnalyzer.Request request) {
        try (ApiPermit permit = pool.acquireApiSlot(allocation)) {
            return analyzer.analyze(request);
        }
    }

    private boolean isRetryable(Throwable failure) {
        if (failure instanceof RateLimitedException || failure instanceof ResourceExhaustedException) {
            return true;
        }
        return failure instanceof DetectorException detector && detector.isTransient();
    }
}
