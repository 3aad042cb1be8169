package com.example.callaudit_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Remote-detector files consumed by a user on one UTC day.
 */
@Entity
@Table(name = "daily_usage", uniqueConstraints = @UniqueConstraint(name = "ux_daily_usage_user_day", columnNames = {"user_id", "date_key"}))
public class DailyUsage {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "date_key", nullable = false)
    private LocalDate dateKey;

    @Column(name = "used", nullable = false)
    private int used;

    public DailyUsage() {
    }

    public DailyUsage(String userId, LocalDate dateKey) {
        this.userId = userId;
        this.dateKey = dateKey;
    }

    public UUID getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public LocalDate getDateKey() {
        return dateKey;
    }

    public int getUsed() {
        return used;
    }

    public void setUsed(int used) {
        this.used = used;
    }
}
