package com.example.callaudit_backend.exception;

import java.time.Duration;

/**
 * Raised when no worker or external-API slot frees up within the bounded wait.
 */
public class ResourceExhaustedException extends CallAuditException {
    private final String resource;
    private final Duration waited;

    public ResourceExhaustedException(String resource, Duration waited) {
        super(resource + " exhausted after " + waited.toMillis() + "ms wait");
        this.resource = resource;
        this.waited = waited;
    }

    public ResourceExhaustedException(String resource, Duration waited, Throwable cause) {
        super(resource + " wait interrupted after " + waited.toMillis() + "ms", cause);
        this.resource = resource;
        this.waited = waited;
    }

    public String getResource() {
        return resource;
    }

    public Duration getWaited() {
        return waited;
    }
}
