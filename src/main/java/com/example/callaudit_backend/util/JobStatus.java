package com.example.callaudit_backend.util;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_FAILED || this == FAILED;
    }
}
