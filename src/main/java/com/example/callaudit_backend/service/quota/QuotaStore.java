package com.example.callaudit_backend.service.quota;

import java.time.LocalDate;

/**
 * Persisted per-user, per-day usage counters consulted by {@link QuotaEnforcer}.
 */
public interface QuotaStore {

    int getDailyUsage(String userId, LocalDate dateKey);

    /**
     * Adds {@code delta} unconditionally.
     *
     * @return the counter after the increment
     */
    int incrementDailyUsage(String userId, LocalDate dateKey, int delta);

    int getUserDailyLimit(String userId);

    /**
     * Atomically adds {@code delta} only if the counter stays within {@code limit}.
     *
     * @return {@code true} when the increment was applied
     */
    boolean tryIncrement(String userId, LocalDate dateKey, int delta, int limit);
}
