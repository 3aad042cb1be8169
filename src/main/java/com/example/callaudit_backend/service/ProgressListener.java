package com.example.callaudit_backend.service;

import java.util.UUID;

/**
 * Called after each file of a job reaches a terminal state.
 */
public interface ProgressListener {
    void onProgress(UUID jobId, int succeeded, int failed, int total);
}
