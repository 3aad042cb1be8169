package com.example.callaudit_backend.model;

import com.example.callaudit_backend.util.FailureReason;

/**
 * @param reason machine-readable cause
 * @param message human-readable explanation for the job report
 */
public record FileFailure(FailureReason reason, String message) {
}
