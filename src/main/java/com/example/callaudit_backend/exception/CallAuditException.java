package com.example.callaudit_backend.exception;

/**
 * Base type for the engine's domain errors.
 */
public class CallAuditException extends RuntimeException {

    public CallAuditException(String message) {
        super(message);
    }

    public CallAuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
