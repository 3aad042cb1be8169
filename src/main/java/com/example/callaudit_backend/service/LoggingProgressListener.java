package com.example.callaudit_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class LoggingProgressListener implements ProgressListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onProgress(UUID jobId, int succeeded, int failed, int total) {
        if (succeeded + failed == total) {
            LOGGER.info("JOB PROGRESS jobId={} succeeded={} failed={} total={}", jobId, succeeded, failed, total);
        } else {
            LOGGER.debug("JOB PROGRESS jobId={} succeeded={} failed={} total={}", jobId, succeeded, failed, total);
        }
    }
}
