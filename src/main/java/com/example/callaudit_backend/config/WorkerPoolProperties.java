package com.example.callaudit_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sizes the shared worker pool and the external transcription concurrency ceiling.
 */
@ConfigurationProperties(prefix = "worker-pool")
public class WorkerPoolProperties {

    private int totalCapacity = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 20));
    private int apiConcurrencyCeiling = 5;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private Duration apiAcquireTimeout = Duration.ofSeconds(60);
    private int perJobCeiling = 10;
    private int jobExecutorThreads = 4;
    private int executorQueueCapacity = 100;

    public int getTotalCapacity() {
        return totalCapacity;
    }

    public void setTotalCapacity(int totalCapacity) {
        this.totalCapacity = totalCapacity;
    }

    public int getApiConcurrencyCeiling() {
        return apiConcurrencyCeiling;
    }

    public void setApiConcurrencyCeiling(int apiConcurrencyCeiling) {
        this.apiConcurrencyCeiling = apiConcurrencyCeiling;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    public Duration getApiAcquireTimeout() {
        return apiAcquireTimeout;
    }

    public void setApiAcquireTimeout(Duration apiAcquireTimeout) {
        this.apiAcquireTimeout = apiAcquireTimeout;
    }

    public int getPerJobCeiling() {
        return perJobCeiling;
    }

    public void setPerJobCeiling(int perJobCeiling) {
        this.perJobCeiling = perJobCeiling;
    }

    public int getJobExecutorThreads() {
        return jobExecutorThreads;
    }

    public void setJobExecutorThreads(int jobExecutorThreads) {
        this.jobExecutorThreads = jobExecutorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }
}
