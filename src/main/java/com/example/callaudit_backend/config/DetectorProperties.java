package com.example.callaudit_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the local signal detectors. The agent is recorded on {@code agentChannel}.
 */
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {

    private String ffmpegBinary = "ffmpeg";
    private int agentChannel = 0;
    private double noiseDb = -35.0;
    private double minSilenceSec = 0.5;
    private Duration lateHelloThreshold = Duration.ofSeconds(5);
    private Duration minCallDuration = Duration.ofSeconds(1);
    private Duration processTimeout = Duration.ofMinutes(2);

    public String getFfmpegBinary() {
        return ffmpegBinary;
    }

    public void setFfmpegBinary(String ffmpegBinary) {
        this.ffmpegBinary = ffmpegBinary;
    }

    public int getAgentChannel() {
        return agentChannel;
    }

    public void setAgentChannel(int agentChannel) {
        this.agentChannel = agentChannel;
    }

    public double getNoiseDb() {
        return noiseDb;
    }

    public void setNoiseDb(double noiseDb) {
        this.noiseDb = noiseDb;
    }

    public double getMinSilenceSec() {
        return minSilenceSec;
    }

    public void setMinSilenceSec(double minSilenceSec) {
        this.minSilenceSec = minSilenceSec;
    }

    public Duration getLateHelloThreshold() {
        return lateHelloThreshold;
    }

    public void setLateHelloThreshold(Duration lateHelloThreshold) {
        this.lateHelloThreshold = lateHelloThreshold;
    }

    public Duration getMinCallDuration() {
        return minCallDuration;
    }

    public void setMinCallDuration(Duration minCallDuration) {
        this.minCallDuration = minCallDuration;
    }

    public Duration getProcessTimeout() {
        return processTimeout;
    }

    public void setProcessTimeout(Duration processTimeout) {
        this.processTimeout = processTimeout;
    }
}
