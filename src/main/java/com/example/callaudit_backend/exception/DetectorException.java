package com.example.callaudit_backend.exception;

/**
 * Failure raised by a detector adapter. Transient failures (5xx, dropped connections, timeouts)
 * are eligible for retry on the remote path; everything else fails the file at once.
 */
public class DetectorException extends CallAuditException {
    private final boolean transientFailure;

    public DetectorException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public DetectorException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
