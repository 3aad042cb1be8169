package com.example.callaudit_backend.exception;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Transient throttling signalled by the transcription provider (HTTP 429).
 */
public class RateLimitedException extends CallAuditException {
    @Nullable
    private final Duration retryAfter;

    public RateLimitedException(String message, @Nullable Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    @Nullable
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
