package com.example.callaudit_backend.exception;

import java.time.LocalDate;

/**
 * The user's daily allowance is consumed. File-level and never retried.
 */
public class QuotaExceededException extends CallAuditException {
    private final String userId;
    private final LocalDate dateKey;
    private final int limit;

    public QuotaExceededException(String userId, LocalDate dateKey, int limit) {
        super("daily quota of " + limit + " exhausted for user " + userId + " on " + dateKey);
        this.userId = userId;
        this.dateKey = dateKey;
        this.limit = limit;
    }

    public String getUserId() {
        return userId;
    }

    public LocalDate getDateKey() {
        return dateKey;
    }

    public int getLimit() {
        return limit;
    }
}
