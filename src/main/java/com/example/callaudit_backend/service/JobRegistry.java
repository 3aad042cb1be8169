package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import com.example.callaudit_backend.model.AuditJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of live jobs. Finished jobs stay reachable here until they are archived and
 * older than the retention window; after that they are served from the archive. A finished job
 * whose archive write failed is kept for the longer unarchived retention and then dropped.
 */
@Component
public class JobRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<UUID, AuditJob> jobs = new ConcurrentHashMap<>();
    private final BatchEngineProperties properties;
    private final Clock clock;

    public JobRegistry(BatchEngineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void register(AuditJob job) {
        jobs.put(job.getId(), job);
    }

    public Optional<AuditJob> find(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Scheduled(fixedDelayString = "${batch.registry-sweep-ms:60000}")
    public void evictFinished() {
        Instant now = clock.instant();
        Instant archivedCutoff = now.minus(properties.getJobRetention());
        Instant unarchivedCutoff = now.minus(properties.getUnarchivedRetention());
        int evicted = 0;
        int dropped = 0;
        Iterator<AuditJob> it = jobs.values().iterator();
        while (it.hasNext()) {
            AuditJob job = it.next();
            if (!job.getStatus().isTerminal() || job.getFinishedAt() == null) {
                continue;
            }
            if (job.isArchived() && job.getFinishedAt().isBefore(archivedCutoff)) {
                it.remove();
                evicted++;
            } else if (!job.isArchived() && job.getFinishedAt().isBefore(unarchivedCutoff)) {
                LOGGER.warn("JobRegistry dropping unarchived report jobId={} user={} finishedAt={}",
                        job.getId(), job.getUserId(), job.getFinishedAt());
                it.remove();
                dropped++;
            }
        }
        if (evicted + dropped > 0) {
            LOGGER.info("JobRegistry evicted={} droppedUnarchived={} remaining={}", evicted, dropped, jobs.size());
        }
    }
}
