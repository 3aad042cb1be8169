package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import com.example.callaudit_backend.config.WorkerPoolProperties;
import com.example.callaudit_backend.dto.JobReport;
import com.example.callaudit_backend.exception.ResourceExhaustedException;
import com.example.callaudit_backend.model.AuditJob;
import com.example.callaudit_backend.model.FileFailure;
import com.example.callaudit_backend.model.FileTask;
import com.example.callaudit_backend.service.pool.WorkerAllocation;
import com.example.callaudit_backend.service.pool.WorkerPoolManager;
import com.example.callaudit_backend.service.sizing.AdaptiveBatchSizer;
import com.example.callaudit_backend.util.CallFileNameParser;
import com.example.callaudit_backend.util.FailureReason;
import com.example.callaudit_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted audit jobs.
 *
 * <p>Per job: lease worker slots (retrying with backoff), then repeatedly ask the sizer for a chunk
 * size, dispatch that many queued files in parallel and wait for the chunk to settle. Whatever
 * ends the loop, remaining files are failed as aborted before the allocation is released, so the
 * final report always accounts for every submitted file.
 */
@Service
public class BatchEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchEngine.class);

    private final WorkerPoolManager pool;
    private final AdaptiveBatchSizer sizer;
    private final FileTaskProcessor processor;
    private final AudioFileDiscovery discovery;
    private final JobRegistry registry;
    private final JobArchiveService archive;
    private final List<ProgressListener> listeners;
    private final BatchEngineProperties properties;
    private final WorkerPoolProperties poolProperties;
    private final Executor jobExecutor;
    private final Executor fileExecutor;
    private final Clock clock;

    public BatchEngine(WorkerPoolManager pool,
                       AdaptiveBatchSizer sizer,
                       FileTaskProcessor processor,
                       AudioFileDiscovery discovery,
                       JobRegistry registry,
                       JobArchiveService archive,
                       List<ProgressListener> listeners,
                       BatchEngineProperties properties,
                       WorkerPoolProperties poolProperties,
                       @Qualifier("jobTaskExecutor") Executor jobExecutor,
                       @Qualifier("fileTaskExecutor") Executor fileExecutor,
                       Clock clock) {
        this.pool = pool;
        this.sizer = sizer;
        this.processor = processor;
        this.discovery = discovery;
        this.registry = registry;
        this.archive = archive;
        this.listeners = List.copyOf(listeners);
        this.properties = properties;
        this.poolProperties = poolProperties;
        this.jobExecutor = jobExecutor;
        this.fileExecutor = fileExecutor;
        this.clock = clock;
    }

    /**
     * Scans {@code folder} for recordings and submits them as one job.
     *
     * @throws IllegalArgumentException if the folder does not exist or holds no recordings
     */
    public UUID submitFolder(String userId, Path folder) {
        List<Path> files = discovery.discover(folder);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("no audio files found in " + folder);
        }
        return submit(userId, files);
    }

    /**
     * Registers a job and starts it in the background.
     *
     * @return the job id, immediately
     * @throws ResourceExhaustedException if the job executor cannot take more jobs
     */
    public UUID submit(String userId, List<Path> files) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("at least one file is required");
        }
        List<FileTask> tasks = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            tasks.add(new FileTask(i, file, CallFileNameParser.parse(file)));
        }
        AuditJob job = new AuditJob(UUID.randomUUID(), userId, clock.instant(), tasks);
        registry.register(job);
        LOGGER.info("JOB SUBMIT jobId={} user={} files={}", job.getId(), userId, tasks.size());
        try {
            jobExecutor.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            job.setReason("engine busy: job queue full");
            job.abortRemaining("job rejected: engine busy");
            job.finish(clock.instant());
            archiveQuietly(job);
            throw new ResourceExhaustedException("job executor", Duration.ZERO, e);
        }
        return job.getId();
    }

    /**
     * Stops dispatching new chunks. In-flight files finish; the rest are failed as aborted.
     *
     * @return {@code false} if the job is unknown or already finished
     */
    public boolean cancel(UUID jobId) {
        return registry.find(jobId)
                .map(job -> {
                    boolean cancelled = job.requestCancel();
                    if (cancelled) {
                        LOGGER.info("JOB CANCEL REQUESTED jobId={} user={}", jobId, job.getUserId());
                    }
                    return cancelled;
                })
                .orElse(false);
    }

    public Optional<JobReport> report(UUID jobId) {
        Optional<AuditJob> live = registry.find(jobId);
        if (live.isPresent()) {
            return live.map(JobReport::from);
        }
        return archive.find(jobId);
    }

    void run(AuditJob job) {
        MDC.put("jobId", job.getId().toString());
        MDC.put("userId", job.getUserId());
        long t0 = System.nanoTime();
        job.markRunning(clock.instant());
        sizer.openSession(job.getUserId());
        WorkerAllocation allocation = null;
        boolean noCapacity = false;
        String abortReason = "job aborted";
        LOGGER.info("JOB START jobId={} user={} files={}", job.getId(), job.getUserId(), job.getTasks().size());
        try {
            allocation = acquireWithBackoff(job);
            if (allocation == null) {
                if (job.isCancelRequested()) {
                    abortReason = "job cancelled";
                } else {
                    noCapacity = true;
                    abortReason = "no worker capacity after " + properties.getAllocationAttempts() + " attempts";
                    job.setReason(abortReason);
                }
                return;
            }
            dispatch(job, allocation);
            if (job.isCancelRequested()) {
                abortReason = "job cancelled";
            }
        } catch (RuntimeException e) {
            LOGGER.error("JOB ABORT jobId={} user={} type={} message={}", job.getId(), job.getUserId(), e.getClass().getSimpleName(), e.getMessage(), e);
            job.setReason("aborted: " + e.getMessage());
            abortReason = "job aborted: " + e.getMessage();
        } finally {
            int aborted = noCapacity
                    ? failAll(job, FailureReason.NO_CAPACITY, abortReason)
                    : job.abortRemaining(abortReason);
            if (job.isCancelRequested() && job.getReason() == null) {
                job.setReason("cancelled");
            }
            pool.release(allocation);
            sizer.closeSession(job.getUserId());
            if (aborted > 0) {
                notifyProgress(job);
            }
            finish(job, t0);
            MDC.remove("jobId");
            MDC.remove("userId");
        }
    }

    private WorkerAllocation acquireWithBackoff(AuditJob job) {
        if (job.isCancelRequested()) {
            return null;
        }
        int requested = Math.max(1, Math.min(poolProperties.getPerJobCeiling(), job.getTasks().size()));
        int attempts = Math.max(1, properties.getAllocationAttempts());
        return Mono.fromCallable(() -> pool.acquire(job.getUserId(), requested))
                .retryWhen(Retry.backoff(attempts - 1, properties.getAllocationBackoff())
                        .scheduler(Schedulers.boundedElastic())
                        .filter(failure -> failure instanceof ResourceExhaustedException && !job.isCancelRequested())
                        .doBeforeRetry(signal -> LOGGER.warn("JOB ALLOCATION RETRY jobId={} attempt={}/{} message={}",
                                job.getId(), signal.totalRetries() + 2, attempts, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((backoff, signal) -> signal.failure()))
                .onErrorResume(ResourceExhaustedException.class, e -> {
                    LOGGER.warn("JOB ALLOCATION EXHAUSTED jobId={} attempts={} cancelled={} message={}",
                            job.getId(), attempts, job.isCancelRequested(), e.getMessage());
                    return Mono.empty();
                })
                .block();
    }

    private void dispatch(AuditJob job, WorkerAllocation allocation) {
        Deque<FileTask> queue = new ArrayDeque<>(job.getTasks());
        while (!queue.isEmpty()) {
            if (job.isCancelRequested()) {
                LOGGER.info("JOB CANCEL jobId={} undispatched={}", job.getId(), queue.size());
                return;
            }
            int chunk = sizer.recommendChunkSize(job.getUserId(), allocation.slots());
            List<CompletableFuture<Void>> inFlight = new ArrayList<>(chunk);
            try {
                for (int i = 0; i < chunk && !queue.isEmpty(); i++) {
                    FileTask task = queue.poll();
                    inFlight.add(CompletableFuture.runAsync(() -> processAndReport(job, allocation, task), fileExecutor));
                }
            } finally {
                CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
            }
            LOGGER.debug("JOB CHUNK jobId={} size={} remaining={}", job.getId(), inFlight.size(), queue.size());
        }
    }

    private void processAndReport(AuditJob job, WorkerAllocation allocation, FileTask task) {
        try {
            processor.process(job, allocation, task);
        } finally {
            notifyProgress(job);
        }
    }

    private void notifyProgress(AuditJob job) {
        AuditJob.Progress progress = job.progress();
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(job.getId(), progress.succeeded(), progress.failed(), progress.total());
            } catch (RuntimeException e) {
                LOGGER.warn("Progress listener {} failed jobId={}: {}", listener.getClass().getSimpleName(), job.getId(), e.toString());
            }
        }
    }

    private static int failAll(AuditJob job, FailureReason reason, String message) {
        int failed = 0;
        for (FileTask task : job.getTasks()) {
            if (task.markInFlight() && task.markFailed(new FileFailure(reason, message), Map.of(), 0L)) {
                failed++;
            }
        }
        return failed;
    }

    private void finish(AuditJob job, long t0) {
        JobStatus status = job.finish(clock.instant());
        AuditJob.Progress progress = job.progress();
        if (!progress.isSettled()) {
            LOGGER.warn("JOB EARLY STOP jobId={} succeeded={} failed={} submitted={}", job.getId(), progress.succeeded(), progress.failed(), progress.total());
        }
        LOGGER.info("JOB {} jobId={} user={} succeeded={} failed={} flagged={} total={} in={}ms",
                status, job.getId(), job.getUserId(), progress.succeeded(), progress.failed(), progress.flagged(),
                progress.total(), (System.nanoTime() - t0) / 1_000_000);
        archiveQuietly(job);
    }

    private void archiveQuietly(AuditJob job) {
        try {
            archive.archive(job);
            job.setArchived(true);
        } catch (RuntimeException e) {
            LOGGER.error("JOB ARCHIVE FAILED jobId={} message={}; keeping report in memory", job.getId(), e.getMessage(), e);
        }
    }
}
