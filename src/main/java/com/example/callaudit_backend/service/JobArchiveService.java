package com.example.callaudit_backend.service;

import com.example.callaudit_backend.dto.JobReport;
import com.example.callaudit_backend.dto.JobSummary;
import com.example.callaudit_backend.model.AuditJob;
import com.example.callaudit_backend.model.AuditJobRecord;
import com.example.callaudit_backend.repository.AuditJobRecordRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists finished jobs with their full report so results outlive the in-memory registry.
 */
@Service
public class JobArchiveService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobArchiveService.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int MAX_REASON = 512;

    private final AuditJobRecordRepository repository;
    private final ObjectMapper mapper;

    public JobArchiveService(AuditJobRecordRepository repository, ObjectMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Transactional
    public AuditJobRecord archive(AuditJob job) {
        JobReport report = JobReport.from(job);
        AuditJobRecord record = new AuditJobRecord(job.getId(), job.getUserId(), job.getCreatedAt());
        record.setStatus(report.status());
        record.setSubmitted(report.submitted());
        record.setSucceeded(report.succeeded());
        record.setFailed(report.failed());
        record.setFlagged(report.flagged());
        record.setReason(abbreviate(job.getReason()));
        record.setFinishedAt(job.getFinishedAt());
        try {
            record.setReport(mapper.convertValue(report, MAP_TYPE));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Serialize job report failed jobId=" + job.getId(), e);
        }
        AuditJobRecord saved = repository.save(record);
        LOGGER.info("JobArchive saved jobId={} status={} succeeded={} failed={}", job.getId(), report.status(), report.succeeded(), report.failed());
        return saved;
    }

    private static String abbreviate(String reason) {
        return reason == null || reason.length() <= MAX_REASON ? reason : reason.substring(0, MAX_REASON - 3) + "...";
    }

    @Transactional(readOnly = true)
    public Optional<JobReport> find(UUID jobId) {
        return repository.findById(jobId).map(record -> mapper.convertValue(record.getReport(), JobReport.class));
    }

    @Transactional(readOnly = true)
    public List<JobSummary> recent(String userId) {
        return repository.findTop20ByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(r -> new JobSummary(r.getId(), r.getStatus(), r.getSubmitted(), r.getSucceeded(), r.getFailed(),
                        r.getFlagged(), r.getCreatedAt(), r.getFinishedAt()))
                .toList();
    }
}
