package com.example.callaudit_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning for the per-user chunk size controller (additive increase, multiplicative decrease).
 */
@ConfigurationProperties(prefix = "batch.sizer")
public class BatchSizerProperties {

    private int initialChunkSize = 2;
    private int additiveIncrease = 1;
    private double decreaseFactor = 0.5;
    private double ewmaAlpha = 0.3;
    /** Relative EWMA growth between windows that still counts as flat. */
    private double riseTolerance = 0.05;
    private Duration latencyCeiling = Duration.ofMinutes(5);
    private Duration idleEviction = Duration.ofMinutes(30);

    public int getInitialChunkSize() {
        return initialChunkSize;
    }

    public void setInitialChunkSize(int initialChunkSize) {
        this.initialChunkSize = initialChunkSize;
    }

    public int getAdditiveIncrease() {
        return additiveIncrease;
    }

    public void setAdditiveIncrease(int additiveIncrease) {
        this.additiveIncrease = additiveIncrease;
    }

    public double getDecreaseFactor() {
        return decreaseFactor;
    }

    public void setDecreaseFactor(double decreaseFactor) {
        this.decreaseFactor = decreaseFactor;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    public double getRiseTolerance() {
        return riseTolerance;
    }

    public void setRiseTolerance(double riseTolerance) {
        this.riseTolerance = riseTolerance;
    }

    public Duration getLatencyCeiling() {
        return latencyCeiling;
    }

    public void setLatencyCeiling(Duration latencyCeiling) {
        this.latencyCeiling = latencyCeiling;
    }

    public Duration getIdleEviction() {
        return idleEviction;
    }

    public void setIdleEviction(Duration idleEviction) {
        this.idleEviction = idleEviction;
    }
}
