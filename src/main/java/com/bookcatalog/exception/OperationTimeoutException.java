package com.bookcatalog.exception;

import java.time.Duration;

public class OperationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public OperationTimeoutException(Duration timeout) {
        super("This operation timed out");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
