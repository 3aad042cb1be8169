package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import com.example.callaudit_backend.config.BatchSizerProperties;
import com.example.callaudit_backend.config.QuotaProperties;
import com.example.callaudit_backend.engine.Interfaces.LocalDetector;
import com.example.callaudit_backend.engine.Interfaces.RemoteAnalyzer;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.model.AuditJob;
import com.example.callaudit_backend.model.CallMetadata;
import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.model.FileTask;
import com.example.callaudit_backend.service.pool.WorkerAllocation;
import com.example.callaudit_backend.service.pool.WorkerPoolManager;
import com.example.callaudit_backend.service.quota.InMemoryQuotaStore;
import com.example.callaudit_backend.service.quota.QuotaEnforcer;
import com.example.callaudit_backend.service.sizing.AdaptiveBatchSizer;
import com.example.callaudit_backend.util.DetectorKeys;
import com.example.callaudit_backend.util.FailureReason;
import com.example.callaudit_backend.util.FileTaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class FileTaskProcessorTest {

    @TempDir
    Path dir;

    private ExecutorService detectorExecutor;
    private BatchEngineProperties properties;
    private InMemoryQuotaStore quotaStore;
    private AdaptiveBatchSizer sizer;
    private WorkerPoolManager pool;
    private AtomicInteger remoteCalls;
    private AudioFileDiscovery discovery;

    @BeforeEach
    void setup() {
        detectorExecutor = Executors.newFixedThreadPool(4);
        properties = new BatchEngineProperties();
        properties.setRemoteBackoff(Duration.ofMillis(1));
        properties.setRemoteMaxBackoff(Duration.ofMillis(2));
        quotaStore = new InMemoryQuotaStore(100);
        sizer = new AdaptiveBatchSizer(new BatchSizerProperties(), Clock.systemUTC());
        pool = new WorkerPoolManager(4, 2, Duration.ofSeconds(1), Duration.ofSeconds(1), Clock.systemUTC());
        remoteCalls = new AtomicInteger();
        discovery = new AudioFileDiscovery(properties);
    }

    @AfterEach
    void teardown() {
        detectorExecutor.shutdownNow();
    }

    private FileTaskProcessor processor(RemoteAnalyzer analyzer, LocalDetector... locals) {
        RemoteAnalyzer counting = request -> {
            remoteCalls.incrementAndGet();
            return analyzer.analyze(request);
        };
        return new FileTaskProcessor(
                List.of(locals),
                new RemoteDetectorInvoker(counting, pool, sizer, properties),
                new QuotaEnforcer(quotaStore, new QuotaProperties(), Clock.systemUTC()),
                sizer,
                discovery,
                properties,
                detectorExecutor);
    }

    private FileTask task(String name, int bytes) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, new byte[bytes]);
        return new FileTask(0, file, CallMetadata.UNKNOWN);
    }

    private AuditJob job(FileTask task) {
        return new AuditJob(UUID.randomUUID(), "alice", Instant.now(), List.of(task));
    }

    private static LocalDetector[] defaultLocals() {
        return new LocalDetector[]{
                StubLocalDetector.answering(DetectorKeys.RELEASING, DetectorKeys.NO),
                StubLocalDetector.answering(DetectorKeys.LATE_HELLO, DetectorKeys.YES)};
    }

    @Test
    void mergesAllThreeOutcomes() throws IOException {
        FileTask task = task("call.mp3", 2048);
        WorkerAllocation allocation = pool.acquire("alice", 2);

        processor(request -> new RemoteAnalyzer.Result("Yes", 0.9, "hi"), defaultLocals()).process(job(task), allocation, task);

        assertThat(task.status()).isEqualTo(FileTaskStatus.SUCCEEDED);
        assertThat(task.state().value(DetectorKeys.RELEASING)).isEqualTo("No");
        assertThat(task.state().value(DetectorKeys.LATE_HELLO)).isEqualTo("Yes");
        assertThat(task.state().value(DetectorKeys.REBUTTAL)).isEqualTo("Yes");
        assertThat(task.isFlagged()).isTrue();
        assertThat(sizer.estimate("alice")).get().extracting(e -> e.observations()).isEqualTo(1L);
        assertThat(quotaStore.getDailyUsage("alice", LocalDate.now(ZoneOffset.UTC))).isEqualTo(1);
    }

    @Test
    void localDetectorFailureOnlyAffectsItsField() throws IOException {
        FileTask task = task("call.mp3", 2048);
        WorkerAllocation allocation = pool.acquire("alice", 2);
        LocalDetector broken = new StubLocalDetector(DetectorKeys.RELEASING, file -> {
            throw new DetectorException("ffmpeg exploded", false);
        });

        processor(request -> new RemoteAnalyzer.Result("No", null, ""), broken,
                StubLocalDetector.answering(DetectorKeys.LATE_HELLO, DetectorKeys.NO)).process(job(task), allocation, task);

        assertThat(task.status()).isEqualTo(FileTaskStatus.SUCCEEDED);
        DetectorOutcome releasing = task.state().outcomes().get(DetectorKeys.RELEASING);
        assertThat(releasing.value()).isEqualTo(DetectorKeys.ERROR);
        assertThat(releasing.error()).isEqualTo("ffmpeg exploded");
        assertThat(task.state().value(DetectorKeys.REBUTTAL)).isEqualTo("No");
    }

    @Test
    void hangingLocalDetectorTimesOutAsError() throws IOException {
        properties.setLocalTimeout(Duration.ofMillis(100));
        FileTask task = task("call.mp3", 2048);
        WorkerAllocation allocation = pool.acquire("alice", 2);
        LocalDetector hanging = new StubLocalDetector(DetectorKeys.LATE_HELLO, file -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return DetectorOutcome.of(DetectorKeys.NO, null, Map.of());
        });

        processor(request -> new RemoteAnalyzer.Result("Yes", null, ""),
                StubLocalDetector.answering(DetectorKeys.RELEASING, DetectorKeys.NO), hanging).process(job(task), allocation, task);

        assertThat(task.status()).isEqualTo(FileTaskStatus.SUCCEEDED);
        assertThat(task.state().value(DetectorKeys.LATE_HELLO)).isEqualTo(DetectorKeys.ERROR);
        assertThat(task.state().outcomes().get(DetectorKeys.LATE_HELLO).error()).contains("timed out");
    }

    @Test
    void quotaExhaustedSkipsRemoteCall() throws IOException {
        quotaStore.setLimit("alice", 0);
        FileTask task = task("call.mp3", 2048);
        WorkerAllocation allocation = pool.acquire("alice", 2);

        processor(request -> new RemoteAnalyzer.Result("Yes", null, ""), defaultLocals()).process(job(task), allocation, task);

        assertThat(task.status()).isEqualTo(FileTaskStatus.FAILED);
        assertThat(task.state().failure().reason()).isEqualTo(FailureReason.QUOTA_EXCEEDED);
        assertThat(remoteCalls.get()).isZero();
    }

    @Test
    void invalidAudioFailsWithoutConsumingQuota() throws IOException {
        FileTask task = task("call.mp3", 10);
        WorkerAllocation allocation = pool.acquire("alice", 2);

        processor(request -> new RemoteAnalyzer.Result("Yes", null, ""), defaultLocals()).process(job(task), allocation, task);

        assertThat(task.state().failure().reason()).isEqualTo(FailureReason.INVALID_AUDIO);
        assertThat(quotaStore.getDailyUsage("alice", LocalDate.now(ZoneOffset.UTC))).isZero();
        assertThat(remoteCalls.get()).isZero();
    }

    @Test
    void remoteFailureKeepsLocalOutcomes() throws IOException {
        properties.setRemoteTimeout(Duration.ofMillis(50));
        pool = new WorkerPoolManager(4, 4, Duration.ofSeconds(1), Duration.ofSeconds(1), Clock.systemUTC());
        FileTask task = task("call.mp3", 2048);
        WorkerAllocation allocation = pool.acquire("alice", 4);

        processor(request -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new RemoteAnalyzer.Result("Yes", null, "");
        }, defaultLocals()).process(job(task), allocation, task);

        assertThat(task.status()).isEqualTo(FileTaskStatus.FAILED);
        assertThat(task.state().failure().reason()).isEqualTo(FailureReason.REMOTE_TIMEOUT);
        assertThat(task.state().value(DetectorKeys.RELEASING)).isEqualTo("No");
        assertThat(task.state().value(DetectorKeys.REBUTTAL)).isEqualTo(DetectorKeys.ERROR);
        assertThat(remoteCalls.get()).isEqualTo(3);
    }

    @Test
    void alreadyClaimedTaskIsLeftAlone() throws IOException {
        FileTask task = task("call.mp3", 2048);
        task.abort("cancelled");
        WorkerAllocation allocation = pool.acquire("alice", 2);

        processor(request -> new RemoteAnalyzer.Result("Yes", null, ""), defaultLocals()).process(job(task), allocation, task);

        assertThat(task.state().failure().reason()).isEqualTo(FailureReason.ABORTED);
        assertThat(remoteCalls.get()).isZero();
    }

    @Test
    void unreadableAudioDoesNotConsumeQuota() {
        FileTask task = new FileTask(0, dir.resolve("vanished.mp3"), CallMetadata.UNKNOWN);
        discovery = Mockito.mock(AudioFileDiscovery.class);
        when(discovery.validate(any(Path.class))).thenReturn(Optional.empty());
        WorkerAllocation allocation = pool.acquire("alice", 2);

        processor(request -> new RemoteAnalyzer.Result("Yes", null, ""), defaultLocals()).process(job(task), allocation, task);

        assertThat(task.status()).isEqualTo(FileTaskStatus.FAILED);
        assertThat(task.state().failure().reason()).isEqualTo(FailureReason.INVALID_AUDIO);
        assertThat(quotaStore.getDailyUsage("alice", LocalDate.now(ZoneOffset.UTC))).isZero();
        assertThat(remoteCalls.get()).isZero();
    }
}
