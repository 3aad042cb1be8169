package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import com.example.callaudit_backend.config.BatchSizerProperties;
import com.example.callaudit_backend.engine.Interfaces.RemoteAnalyzer;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.exception.RateLimitedException;
import com.example.callaudit_backend.exception.RemoteTimeoutException;
import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.service.pool.WorkerAllocation;
import com.example.callaudit_backend.service.pool.WorkerPoolManager;
import com.example.callaudit_backend.service.sizing.AdaptiveBatchSizer;
import com.example.callaudit_backend.service.sizing.LatencyEstimate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteDetectorInvokerTest {
    private static final RemoteAnalyzer.Request REQUEST = new RemoteAnalyzer.Request("call.mp3", new byte[16], null);

    private BatchEngineProperties properties;
    private AdaptiveBatchSizer sizer;
    private WorkerPoolManager pool;

    @BeforeEach
    void setup() {
        properties = new BatchEngineProperties();
        properties.setRemoteBackoff(Duration.ofMillis(1));
        properties.setRemoteMaxBackoff(Duration.ofMillis(5));
        properties.setRemoteTimeout(Duration.ofSeconds(5));
        sizer = new AdaptiveBatchSizer(new BatchSizerProperties(), Clock.systemUTC());
        pool = new WorkerPoolManager(10, 10, Duration.ofSeconds(5), Duration.ofSeconds(5), Clock.systemUTC());
    }

    private RemoteDetectorInvoker invoker(RemoteAnalyzer analyzer) {
        return new RemoteDetectorInvoker(analyzer, pool, sizer, properties);
    }

    @Test
    void returnsVerdictWithTranscript() {
        WorkerAllocation allocation = pool.acquire("alice", 2);

        DetectorOutcome outcome = invoker(request -> new RemoteAnalyzer.Result("Yes", 0.8, "we can offer")).invoke(allocation, REQUEST);

        assertThat(outcome.value()).isEqualTo("Yes");
        assertThat(outcome.confidence()).isEqualTo(0.8);
        assertThat(outcome.metadata()).containsEntry("transcript", "we can offer").containsEntry("attempts", 1);
        assertThat(pool.stats().usedApiSlots()).isZero();
    }

    @Test
    void retriesRateLimitAndSignalsSizer() {
        WorkerAllocation allocation = pool.acquire("alice", 2);
        AtomicInteger calls = new AtomicInteger();

        DetectorOutcome outcome = invoker(request -> {
            if (calls.incrementAndGet() < 3) {
                throw new RateLimitedException("429", null);
            }
            return new RemoteAnalyzer.Result("No", null, "");
        }).invoke(allocation, REQUEST);

        assertThat(outcome.value()).isEqualTo("No");
        assertThat(outcome.metadata()).containsEntry("attempts", 3);
        assertThat(sizer.estimate("alice")).get().extracting(LatencyEstimate::throttled).isEqualTo(true);
    }

    @Test
    void rateLimitOnEveryAttemptIsRethrown() {
        WorkerAllocation allocation = pool.acquire("alice", 2);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> invoker(request -> {
            calls.incrementAndGet();
            throw new RateLimitedException("429", Duration.ofSeconds(1));
        }).invoke(allocation, REQUEST)).isInstanceOf(RateLimitedException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void timesOutEachAttemptAndGivesUpAfterMaxAttempts() {
        properties.setRemoteTimeout(Duration.ofMillis(100));
        WorkerAllocation allocation = pool.acquire("alice", 10);
        AtomicInteger calls = new AtomicInteger();

        long t0 = System.nanoTime();
        assertThatThrownBy(() -> invoker(request -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new RemoteAnalyzer.Result("Yes", null, "");
        }).invoke(allocation, REQUEST)).isInstanceOf(RemoteTimeoutException.class);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(calls.get()).isEqualTo(3);
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    void transientErrorIsRetriedButPermanentIsNot() {
        WorkerAllocation allocation = pool.acquire("alice", 2);
        AtomicInteger transientCalls = new AtomicInteger();
        AtomicInteger permanentCalls = new AtomicInteger();

        DetectorOutcome recovered = invoker(request -> {
            if (transientCalls.incrementAndGet() == 1) {
                throw new DetectorException("502", true);
            }
            return new RemoteAnalyzer.Result("Yes", null, "ok");
        }).invoke(allocation, REQUEST);

        assertThat(recovered.value()).isEqualTo("Yes");
        assertThat(transientCalls.get()).isEqualTo(2);

        assertThatThrownBy(() -> invoker(request -> {
            permanentCalls.incrementAndGet();
            throw new DetectorException("400", false);
        }).invoke(allocation, REQUEST))
                .isInstanceOf(DetectorException.class)
                .hasMessage("400");
        assertThat(permanentCalls.get()).isEqualTo(1);
    }

    @Test
    void concurrentCallsStayWithinAllocationApiSlots() throws Exception {
        pool = new WorkerPoolManager(10, 2, Duration.ofSeconds(5), Duration.ofSeconds(5), Clock.systemUTC());
        WorkerAllocation allocation = pool.acquire("alice", 10);
        assertThat(allocation.apiSlots()).isEqualTo(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        RemoteDetectorInvoker invoker = invoker(request -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return new RemoteAnalyzer.Result("Yes", null, "");
        });

        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<DetectorOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> invoker.invoke(allocation, REQUEST)));
            }
            for (Future<DetectorOutcome> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).value()).isEqualTo("Yes");
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(pool.stats().peakApiSlots()).isLessThanOrEqualTo(2);
    }
}
