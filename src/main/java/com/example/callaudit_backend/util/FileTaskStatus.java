package com.example.callaudit_backend.util;

public enum FileTaskStatus {
    QUEUED,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
