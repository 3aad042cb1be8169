package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import com.example.callaudit_backend.engine.Interfaces.LocalDetector;
import com.example.callaudit_backend.engine.Interfaces.RemoteAnalyzer;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.exception.QuotaExceededException;
import com.example.callaudit_backend.exception.RateLimitedException;
import com.example.callaudit_backend.exception.RemoteTimeoutException;
import com.example.callaudit_backend.exception.ResourceExhaustedException;
import com.example.callaudit_backend.model.AuditJob;
import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.model.FileFailure;
import com.example.callaudit_backend.model.FileTask;
import com.example.callaudit_backend.service.pool.WorkerAllocation;
import com.example.callaudit_backend.service.quota.QuotaEnforcer;
import com.example.callaudit_backend.service.sizing.AdaptiveBatchSizer;
import com.example.callaudit_backend.util.DetectorKeys;
import com.example.callaudit_backend.util.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Processes one file: quota admission, then the local detectors and the remote detector side by
 * side, then the merged outcome.
 *
 * <p>Local detector failures become an {@code Error} value for their field only. A remote failure
 * that survives its retries fails the file with the specific cause. Nothing thrown here escapes to
 * the job loop; the task always ends terminal.
 */
@Service
public class FileTaskProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileTaskProcessor.class);

    private final List<LocalDetector> localDetectors;
    private final RemoteDetectorInvoker remoteInvoker;
    private final QuotaEnforcer quotaEnforcer;
    private final AdaptiveBatchSizer sizer;
    private final AudioFileDiscovery discovery;
    private final BatchEngineProperties properties;
    private final Executor detectorExecutor;

    public FileTaskProcessor(List<LocalDetector> localDetectors,
                             RemoteDetectorInvoker remoteInvoker,
                             QuotaEnforcer quotaEnforcer,
                             AdaptiveBatchSizer sizer,
                             AudioFileDiscovery discovery,
                             BatchEngineProperties properties,
                             @Qualifier("detectorTaskExecutor") Executor detectorExecutor) {
        this.localDetectors = List.copyOf(localDetectors);
        this.remoteInvoker = remoteInvoker;
        this.quotaEnforcer = quotaEnforcer;
        this.sizer = sizer;
        this.discovery = discovery;
        this.properties = properties;
        this.detectorExecutor = detectorExecutor;
    }

    public void process(AuditJob job, WorkerAllocation allocation, FileTask task) {
        if (!task.markInFlight()) {
            LOGGER.debug("FILE SKIP file={} status={}", task.getFile(), task.status());
            return;
        }
        long t0 = System.nanoTime();
        try {
            Optional<String> invalid = discovery.validate(task.getFile());
            if (invalid.isPresent()) {
                fail(task, FailureReason.INVALID_AUDIO, invalid.get(), Map.of(), t0);
                return;
            }
            byte[] audio = Files.readAllBytes(task.getFile());
            try {
                quotaEnforcer.consume(job.getUserId());
            } catch (QuotaExceededException e) {
                fail(task, FailureReason.QUOTA_EXCEEDED, e.getMessage(), Map.of(), t0);
                return;
            }

            Map<String, CompletableFuture<DetectorOutcome>> local = new LinkedHashMap<>();
            for (LocalDetector detector : localDetectors) {
                local.put(detector.key(), CompletableFuture.supplyAsync(() -> runLocal(detector, task), detectorExecutor));
            }

            DetectorOutcome remote = null;
            FileFailure remoteFailure = null;
            try {
                remote = remoteInvoker.invoke(allocation,
                        new RemoteAnalyzer.Request(task.getFile().getFileName().toString(), audio, null));
            } catch (RuntimeException e) {
                remoteFailure = classifyRemote(e);
            }

            Map<String, DetectorOutcome> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, CompletableFuture<DetectorOutcome>> entry : local.entrySet()) {
                outcomes.put(entry.getKey(), await(entry.getKey(), entry.getValue(), task));
            }
            long elapsedMs = elapsedMs(t0);
            sizer.recordObservation(job.getUserId(), elapsedMs / 1000.0);

            if (remoteFailure != null) {
                outcomes.put(DetectorKeys.REBUTTAL, DetectorOutcome.error(remoteFailure.message()));
                task.markFailed(remoteFailure, outcomes, elapsedMs);
                LOGGER.warn("FILE FAILED file={} reason={} message={} in={}ms", task.getFile(), remoteFailure.reason(), remoteFailure.message(), elapsedMs);
                return;
            }
            outcomes.put(DetectorKeys.REBUTTAL, remote);
            if (task.markSucceeded(outcomes, elapsedMs)) {
                LOGGER.info("FILE DONE file={} releasing={} lateHello={} rebuttal={} in={}ms",
                        task.getFile().getFileName(), valueOf(outcomes, DetectorKeys.RELEASING),
                        valueOf(outcomes, DetectorKeys.LATE_HELLO), remote.value(), elapsedMs);
            }
        } catch (IOException e) {
            fail(task, FailureReason.INVALID_AUDIO, "cannot read audio: " + e.getMessage(), Map.of(), t0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(task, FailureReason.ABORTED, "interrupted while processing", Map.of(), t0);
        } catch (RuntimeException e) {
            LOGGER.error("FILE ERROR file={} type={}", task.getFile(), e.getClass().getSimpleName(), e);
            fail(task, FailureReason.INTERNAL_ERROR, e.toString(), Map.of(), t0);
        }
    }

    private DetectorOutcome runLocal(LocalDetector detector, FileTask task) {
        try {
            return detector.detect(task.getFile());
        } catch (Exception e) {
            LOGGER.warn("DETECTOR ERROR detector={} file={} message={}", detector.key(), task.getFile(), e.getMessage());
            return DetectorOutcome.error(e.getMessage());
        }
    }

    private DetectorOutcome await(String key, CompletableFuture<DetectorOutcome> future, FileTask task) throws InterruptedException {
        try {
            return future.get(properties.getLocalTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("DETECTOR TIMEOUT detector={} file={} after={}ms", key, task.getFile(), properties.getLocalTimeout().toMillis());
            return DetectorOutcome.error("timed out after " + properties.getLocalTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return DetectorOutcome.error(cause.getMessage());
        }
    }

    private FileFailure classifyRemote(RuntimeException e) {
        if (e instanceof RateLimitedException) {
            return new FileFailure(FailureReason.RATE_LIMITED, e.getMessage());
        }
        if (e instanceof RemoteTimeoutException) {
            return new FileFailure(FailureReason.REMOTE_TIMEOUT, e.getMessage());
        }
        if (e instanceof ResourceExhaustedException) {
            return new FileFailure(FailureReason.NO_CAPACITY, e.getMessage());
        }
        if (e instanceof DetectorException) {
            return new FileFailure(FailureReason.REMOTE_ERROR, e.getMessage());
        }
        LOGGER.error("Unexpected remote detector failure type={}", e.getClass().getSimpleName(), e);
        return new FileFailure(FailureReason.INTERNAL_ERROR, e.toString());
    }

    private void fail(FileTask task, FailureReason reason, String message, Map<String, DetectorOutcome> outcomes, long t0) {
        long elapsedMs = elapsedMs(t0);
        if (task.markFailed(new FileFailure(reason, message), outcomes, elapsedMs)) {
            LOGGER.info("FILE FAILED file={} reason={} message={} in={}ms", task.getFile(), reason, message, elapsedMs);
        }
    }

    private static String valueOf(Map<String, DetectorOutcome> outcomes, String key) {
        DetectorOutcome outcome = outcomes.get(key);
        return outcome == null ? null : outcome.value();
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
