package com.example.callaudit_backend.dto;

import com.example.callaudit_backend.util.JobStatus;

import java.time.Instant;
import java.util.UUID;

public record JobSummary(UUID jobId, JobStatus status, int submitted, int succeeded, int failed, int flagged,
                         Instant createdAt, Instant finishedAt) {
}
