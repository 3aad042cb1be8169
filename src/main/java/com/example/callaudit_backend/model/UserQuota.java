package com.example.callaudit_backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Per-user override of the default daily file limit.
 */
@Entity
@Table(name = "user_quota")
public class UserQuota {
    @Id
    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "daily_limit", nullable = false)
    private int dailyLimit;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected UserQuota() {
    }

    public UserQuota(String userId, int dailyLimit) {
        this.userId = userId;
        this.dailyLimit = dailyLimit;
    }

    public String getUserId() {
        return userId;
    }

    public int getDailyLimit() {
        return dailyLimit;
    }

    public void setDailyLimit(int dailyLimit) {
        this.dailyLimit = dailyLimit;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
