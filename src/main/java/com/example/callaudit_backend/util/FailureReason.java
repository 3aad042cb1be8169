package com.example.callaudit_backend.util;

/**
 * Why a file ended in {@link FileTaskStatus#FAILED}.
 */
public enum FailureReason {
    QUOTA_EXCEEDED,
    RATE_LIMITED,
    REMOTE_TIMEOUT,
    REMOTE_ERROR,
    NO_CAPACITY,
    ABORTED,
    INVALID_AUDIO,
    INTERNAL_ERROR
}
