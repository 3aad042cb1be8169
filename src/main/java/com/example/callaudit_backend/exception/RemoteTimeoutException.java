package com.example.callaudit_backend.exception;

import java.time.Duration;

public class RemoteTimeoutException extends DetectorException {
    private final Duration timeout;

    public RemoteTimeoutException(Duration timeout) {
        super("remote detector did not answer within " + timeout.toMillis() + "ms", true);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
