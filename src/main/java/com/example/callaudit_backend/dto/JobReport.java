package com.example.callaudit_backend.dto;

import com.example.callaudit_backend.model.AuditJob;
import com.example.callaudit_backend.util.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Job status with counters and the per-file breakdown.
 */
public record JobReport(
        UUID jobId,
        String userId,
        JobStatus status,
        int submitted,
        int succeeded,
        int failed,
        int flagged,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        String reason,
        List<FileReport> files
) {

    public static JobReport from(AuditJob job) {
        AuditJob.Progress progress = job.progress();
        return new JobReport(
                job.getId(),
                job.getUserId(),
                job.getStatus(),
                progress.total(),
                progress.succeeded(),
                progress.failed(),
                progress.flagged(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getFinishedAt(),
                job.getReason(),
                job.getTasks().stream().map(FileReport::from).toList()
        );
    }
}
