package com.example.callaudit_backend.model;

import com.example.callaudit_backend.util.FileTaskStatus;
import com.example.callaudit_backend.util.JobStatus;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A user's batch while it lives in the engine. Owned by the thread running it; readers only
 * look at snapshots through {@link #progress()} and the tasks' own states.
 */
public class AuditJob {

    private final UUID id;
    private final String userId;
    private final Instant createdAt;
    private final List<FileTask> tasks;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String reason;
    private volatile boolean archived;

    public AuditJob(UUID id, String userId, Instant createdAt, List<FileTask> tasks) {
        this.id = id;
        this.userId = userId;
        this.createdAt = createdAt;
        this.tasks = List.copyOf(tasks);
    }

    public UUID getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<FileTask> getTasks() {
        return tasks;
    }

    public JobStatus getStatus() {
        return status;
    }

    @Nullable
    public Instant getStartedAt() {
        return startedAt;
    }

    @Nullable
    public Instant getFinishedAt() {
        return finishedAt;
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    public void setReason(@Nullable String reason) {
        this.reason = reason;
    }

    public boolean isArchived() {
        return archived;
    }

    public void setArchived(boolean archived) {
        this.archived = archived;
    }

    public void markRunning(Instant at) {
        this.startedAt = at;
        this.status = JobStatus.RUNNING;
    }

    /**
     * Derives the final status from the task states and stamps the finish time.
     */
    public JobStatus finish(Instant at) {
        Progress progress = progress();
        JobStatus finalStatus;
        if (progress.total() > 0 && progress.succeeded() == progress.total()) {
            finalStatus = JobStatus.COMPLETED;
        } else if (progress.succeeded() == 0) {
            finalStatus = JobStatus.FAILED;
        } else {
            finalStatus = JobStatus.PARTIALLY_FAILED;
        }
        this.finishedAt = at;
        this.status = finalStatus;
        return finalStatus;
    }

    /**
     * @return {@code true} if this call moved the job into the cancelled state
     */
    public boolean requestCancel() {
        return !status.isTerminal() && cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Fails every task that is not terminal yet.
     *
     * @return number of tasks this call aborted
     */
    public int abortRemaining(String reason) {
        int aborted = 0;
        for (FileTask task : tasks) {
            if (!task.isTerminal() && task.abort(reason)) {
                aborted++;
            }
        }
        return aborted;
    }

    public Progress progress() {
        int succeeded = 0;
        int failed = 0;
        int flagged = 0;
        for (FileTask task : tasks) {
            FileTaskStatus s = task.status();
            if (s == FileTaskStatus.SUCCEEDED) {
                succeeded++;
                if (task.isFlagged()) {
                    flagged++;
                }
            } else if (s == FileTaskStatus.FAILED) {
                failed++;
            }
        }
        return new Progress(succeeded, failed, flagged, tasks.size());
    }

    /**
     * @param succeeded files in {@code SUCCEEDED}
     * @param failed files in {@code FAILED}
     * @param flagged succeeded files with a compliance flag
     * @param total files submitted
     */
    public record Progress(int succeeded, int failed, int flagged, int total) {
        public boolean isSettled() {
            return succeeded + failed == total;
        }
    }
}
