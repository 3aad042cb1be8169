package com.example.callaudit_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Retry, timeout and input rules for the batch engine.
 */
@ConfigurationProperties(prefix = "batch")
public class BatchEngineProperties {

    private int allocationAttempts = 5;
    private Duration allocationBackoff = Duration.ofSeconds(2);
    private int remoteMaxAttempts = 3;
    private Duration remoteBackoff = Duration.ofSeconds(1);
    private Duration remoteMaxBackoff = Duration.ofSeconds(30);
    private Duration remoteTimeout = Duration.ofMinutes(10);
    private Duration localTimeout = Duration.ofMinutes(2);
    private Duration jobRetention = Duration.ofHours(1);
    private Duration unarchivedRetention = Duration.ofHours(24);
    private List<String> audioExtensions = List.of("mp3", "wav", "m4a", "mp4");
    private long minAudioBytes = 1024;

    public int getAllocationAttempts() {
        return allocationAttempts;
    }

    public void setAllocationAttempts(int allocationAttempts) {
        this.allocationAttempts = allocationAttempts;
    }

    public Duration getAllocationBackoff() {
        return allocationBackoff;
    }

    public void setAllocationBackoff(Duration allocationBackoff) {
        this.allocationBackoff = allocationBackoff;
    }

    public int getRemoteMaxAttempts() {
        return remoteMaxAttempts;
    }

    public void setRemoteMaxAttempts(int remoteMaxAttempts) {
        this.remoteMaxAttempts = remoteMaxAttempts;
    }

    public Duration getRemoteBackoff() {
        return remoteBackoff;
    }

    public void setRemoteBackoff(Duration remoteBackoff) {
        this.remoteBackoff = remoteBackoff;
    }

    public Duration getRemoteMaxBackoff() {
        return remoteMaxBackoff;
    }

    public void setRemoteMaxBackoff(Duration remoteMaxBackoff) {
        this.remoteMaxBackoff = remoteMaxBackoff;
    }

    public Duration getRemoteTimeout() {
        return remoteTimeout;
    }

    public void setRemoteTimeout(Duration remoteTimeout) {
        this.remoteTimeout = remoteTimeout;
    }

    public Duration getLocalTimeout() {
        return localTimeout;
    }

    public void setLocalTimeout(Duration localTimeout) {
        this.localTimeout = localTimeout;
    }

    public Duration getJobRetention() {
        return jobRetention;
    }

    public void setJobRetention(Duration jobRetention) {
        this.jobRetention = jobRetention;
    }

    /**
     * How long a finished job whose archive write failed stays readable in memory.
     */
    public Duration getUnarchivedRetention() {
        return unarchivedRetention;
    }

    public void setUnarchivedRetention(Duration unarchivedRetention) {
        this.unarchivedRetention = unarchivedRetention;
    }

    public List<String> getAudioExtensions() {
        return audioExtensions;
    }

    public void setAudioExtensions(List<String> audioExtensions) {
        this.audioExtensions = audioExtensions;
    }

    public long getMinAudioBytes() {
        return minAudioBytes;
    }

    public void setMinAudioBytes(long minAudioBytes) {
        this.minAudioBytes = minAudioBytes;
    }
}
